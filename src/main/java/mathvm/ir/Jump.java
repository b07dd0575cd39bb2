package mathvm.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;

/**
 * The single outgoing edge of a {@link Block}. Targets are not owned by the jump, the graph they
 * span may contain cycles. A jump only takes effect once {@link ControlFlowLinker} attached it.
 */
public abstract class Jump extends IrNode {

  Jump(IrKind kind) {
    super(kind);
  }

  /** The targets in order, the yes target before the no target. */
  public abstract List<Block> targets();

  public abstract <T> T match(
      Function<Always, T> matchAlways, Function<Conditional, T> matchConditional);

  public static final class Always extends Jump {
    public final Block target;

    public Always(Block target) {
      super(IrKind.JUMP_ALWAYS);
      this.target = checkNotNull(target);
    }

    @Override
    public List<Block> targets() {
      return ImmutableList.of(target);
    }

    @Override
    public <T> T match(
        Function<Always, T> matchAlways, Function<Conditional, T> matchConditional) {
      return matchAlways.apply(this);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitJumpAlways(this);
    }
  }

  public static final class Conditional extends Jump {
    public final Block yes;
    public final Block no;
    public final Atom condition;

    public Conditional(Block yes, Block no, Atom condition) {
      super(IrKind.JUMP_COND);
      this.yes = checkNotNull(yes);
      this.no = checkNotNull(no);
      this.condition = checkNotNull(condition);
    }

    @Override
    public List<Block> targets() {
      return ImmutableList.of(yes, no);
    }

    @Override
    public <T> T match(
        Function<Always, T> matchAlways, Function<Conditional, T> matchConditional) {
      return matchConditional.apply(this);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitJumpConditional(this);
    }
  }
}
