package mathvm.ir;

import static com.google.common.base.Preconditions.checkState;

import java.util.Optional;
import mathvm.util.IrPrinter;

/**
 * Common base of every IR node. The kind is fixed at construction and must be the kind registered
 * for the node's class in {@link IrKind}.
 */
public abstract class IrNode {

  private final IrKind kind;

  IrNode(IrKind kind) {
    checkState(
        kind.nodeClass == getClass(),
        "%s is not registered as the node class of kind %s",
        getClass().getName(),
        kind);
    this.kind = kind;
  }

  public final IrKind kind() {
    return kind;
  }

  public final boolean is(IrKind kind) {
    return this.kind == kind;
  }

  /**
   * Downcasts this node to {@code nodeClass} if that is exactly the class registered for this
   * node's kind. Asking for any other class, including abstract bases such as {@link Atom}, yields
   * an empty result.
   */
  public final <T extends IrNode> Optional<T> as(Class<T> nodeClass) {
    if (kind.nodeClass != nodeClass) {
      return Optional.empty();
    }
    return Optional.of(nodeClass.cast(this));
  }

  public abstract <T> T acceptVisitor(IrVisitor<T> visitor);

  @Override
  public String toString() {
    return acceptVisitor(new IrPrinter()).toString();
  }
}
