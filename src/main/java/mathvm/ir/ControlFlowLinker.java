package mathvm.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires blocks into a control flow graph. Attaching a transition also records the source block
 * as a predecessor of every target, so predecessors never need to be recomputed.
 */
public final class ControlFlowLinker {
  private static final Logger LOGGER = LoggerFactory.getLogger("ControlFlowLinker");

  private ControlFlowLinker() {}

  public static Jump.Always linkUnconditional(Block source, Block target) {
    return link(null, source, new Jump.Always(target));
  }

  /** Like {@link #linkUnconditional(Block, Block)}, errors name {@code function}. */
  public static Jump.Always linkUnconditional(
      FunctionRecord function, Block source, Block target) {
    return link(checkNotNull(function), source, new Jump.Always(target));
  }

  /**
   * Links {@code source} to {@code yes} and {@code no}. If both are the same block, {@code source}
   * is recorded twice as its predecessor, once per edge.
   */
  public static Jump.Conditional linkConditional(
      Block source, Block yes, Block no, Atom condition) {
    return link(null, source, new Jump.Conditional(yes, no, condition));
  }

  /** Like {@link #linkConditional(Block, Block, Block, Atom)}, errors name {@code function}. */
  public static Jump.Conditional linkConditional(
      FunctionRecord function, Block source, Block yes, Block no, Atom condition) {
    return link(checkNotNull(function), source, new Jump.Conditional(yes, no, condition));
  }

  public static <J extends Jump> J link(Block source, J jump) {
    return link(null, source, jump);
  }

  /**
   * Attaches {@code jump} as the transition of {@code source}, which belongs to {@code function}
   * if that is given.
   *
   * @throws StructuralError with {@link StructuralError.Violation#DUPLICATE_TRANSITION} if
   *     {@code source} already has a transition. Nothing is changed in that case.
   */
  public static <J extends Jump> J link(@Nullable FunctionRecord function, Block source, J jump) {
    checkNotNull(source);
    checkNotNull(jump);
    if (source.transition().isPresent()) {
      throw new StructuralError(
          StructuralError.Violation.DUPLICATE_TRANSITION,
          IrKind.BLOCK,
          function == null ? null : function.id,
          String.format(
              "block '%s' already has a transition to %s",
              source.name, names(source.successors())));
    }
    source.setTransition(jump);
    for (Block target : jump.targets()) {
      target.addPredecessor(source);
    }
    LOGGER.debug("Linked " + source.name + " -> " + names(jump.targets()));
    return jump;
  }

  public static List<Block> predecessors(Block block) {
    return block.predecessors();
  }

  public static List<Block> successors(Block block) {
    return block.successors();
  }

  /**
   * All blocks reachable from {@code entry}, including {@code entry}, in depth first preorder.
   * Each block is listed once, no matter how many cycles lead back to it.
   */
  public static List<Block> reachableBlocks(Block entry) {
    List<Block> ret = new ArrayList<>();
    Set<Block> seen = Sets.newIdentityHashSet();
    Deque<Block> toVisit = new ArrayDeque<>();
    toVisit.add(entry);
    while (!toVisit.isEmpty()) {
      Block cur = toVisit.removeLast();
      if (!seen.add(cur)) {
        continue;
      }
      ret.add(cur);
      // reversed, so that the yes target is visited before the no target
      toVisit.addAll(Lists.reverse(cur.successors()));
    }
    return ret;
  }

  private static List<String> names(List<Block> blocks) {
    return Lists.transform(blocks, b -> b.name);
  }
}
