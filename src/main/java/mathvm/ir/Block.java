package mathvm.ir;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A basic block: statements executed in order, followed by at most one {@link Jump}. The
 * transition and the predecessors are maintained by {@link ControlFlowLinker} only.
 *
 * <p>Blocks compare by identity, names are for humans and need not be unique.
 */
public final class Block extends IrNode {
  public final String name;
  private final List<Statement> contents = new ArrayList<>();
  /** Back edges, one entry per incoming edge. Not owned. */
  private final List<Block> predecessors = new ArrayList<>();

  private Optional<Jump> transition = Optional.empty();

  public Block(String name) {
    super(IrKind.BLOCK);
    this.name = checkNotNull(name);
  }

  public Block append(Statement statement) {
    checkState(
        !transition.isPresent(), "Block %s is already linked, statements can't follow", name);
    contents.add(checkNotNull(statement));
    return this;
  }

  public List<Statement> contents() {
    return Collections.unmodifiableList(contents);
  }

  public Optional<Jump> transition() {
    return transition;
  }

  public List<Block> predecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  /** The targets of the transition, empty if the block isn't linked yet. */
  public List<Block> successors() {
    return transition.map(Jump::targets).orElse(Collections.emptyList());
  }

  /** True if the last statement is a {@link Statement.Return}. */
  public boolean endsInReturn() {
    return !contents.isEmpty() && contents.get(contents.size() - 1).is(IrKind.RETURN);
  }

  void setTransition(Jump jump) {
    transition = Optional.of(jump);
  }

  void addPredecessor(Block block) {
    predecessors.add(block);
  }

  /**
   * Moves the predecessors listed in {@code preferred} to the front, in that order. Entries of
   * {@code preferred} that aren't predecessors are skipped, predecessors missing from it keep their
   * relative order at the end.
   */
  void reorderPredecessors(List<Block> preferred) {
    List<Block> remaining = new ArrayList<>(predecessors);
    List<Block> reordered = new ArrayList<>(predecessors.size());
    for (Block block : preferred) {
      for (int i = 0; i < remaining.size(); i++) {
        if (remaining.get(i) == block) {
          reordered.add(remaining.remove(i));
          break;
        }
      }
    }
    reordered.addAll(remaining);
    predecessors.clear();
    predecessors.addAll(reordered);
  }

  @Override
  public <T> T acceptVisitor(IrVisitor<T> visitor) {
    return visitor.visitBlock(this);
  }
}
