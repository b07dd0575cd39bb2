package mathvm.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** A side effecting unit of a {@link Block}. Statements produce no value. */
public abstract class Statement extends IrNode {

  Statement(IrKind kind) {
    super(kind);
  }

  public static final class Assignment extends Statement {
    public final Atom.Variable variable;
    public final Expression value;

    public Assignment(Atom.Variable variable, Expression value) {
      super(IrKind.ASSIGNMENT);
      this.variable = checkNotNull(variable);
      this.value = checkNotNull(value);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitAssignment(this);
    }
  }

  public static final class Return extends Statement {
    public final Optional<Atom> atom;

    public Return(@Nullable Atom atom) {
      super(IrKind.RETURN);
      this.atom = Optional.ofNullable(atom);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  public static final class Print extends Statement {
    public final Atom atom;

    public Print(Atom atom) {
      super(IrKind.PRINT);
      this.atom = checkNotNull(atom);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitPrint(this);
    }
  }
}
