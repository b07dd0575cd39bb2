package mathvm.ir.utils;

import com.google.common.base.Equivalence;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import mathvm.ir.Atom;
import mathvm.ir.Block;
import mathvm.ir.Expression;
import mathvm.ir.FunctionRecord;
import mathvm.ir.IrNode;
import mathvm.ir.IrVisitor;
import mathvm.ir.Jump;
import mathvm.ir.Program;
import mathvm.ir.Statement;

/**
 * Observational equality of IR graphs: same kinds, operators, literal values, names, parameters
 * and literal pools, and a one-to-one correspondence of blocks under which contents, transitions
 * and predecessors agree. Predecessors are compared in order, since phi operands are matched with
 * them by position.
 *
 * <p>Node identity plays no role, so a graph is equivalent to a copy made by {@link
 * mathvm.ir.IrRewriter}.
 */
public final class StructuralEquivalence extends Equivalence<IrNode> {
  public static final StructuralEquivalence INSTANCE = new StructuralEquivalence();

  private StructuralEquivalence() {}

  @Override
  protected boolean doEquivalent(IrNode a, IrNode b) {
    Comparison comparison = new Comparison();
    return comparison.nodes(a, b) && comparison.pairedBlocksAgree();
  }

  @Override
  protected int doHash(IrNode node) {
    return node.kind().ordinal();
  }

  private static final class Comparison {
    private final Map<Block, Block> correspondence = Maps.newIdentityHashMap();
    private final Set<Block> images = Sets.newIdentityHashSet();
    /** Pairs whose contents haven't been compared yet. */
    private final Deque<Block> unchecked = new ArrayDeque<>();

    boolean nodes(IrNode a, IrNode b) {
      return a.acceptVisitor(new Matcher(this, b));
    }

    boolean nodes(Optional<? extends IrNode> a, Optional<? extends IrNode> b) {
      if (a.isPresent() != b.isPresent()) {
        return false;
      }
      return !a.isPresent() || nodes(a.get(), b.get());
    }

    boolean nodes(List<? extends IrNode> as, List<? extends IrNode> bs) {
      if (as.size() != bs.size()) {
        return false;
      }
      for (int i = 0; i < as.size(); i++) {
        if (!nodes(as.get(i), bs.get(i))) {
          return false;
        }
      }
      return true;
    }

    /** Pairs {@code a} with {@code b}, unless one of them is already paired with another block. */
    boolean pair(Block a, Block b) {
      Block image = correspondence.get(a);
      if (image != null) {
        return image == b;
      }
      if (images.contains(b)) {
        return false;
      }
      correspondence.put(a, b);
      images.add(b);
      unchecked.add(a);
      return true;
    }

    boolean pairedBlocksAgree() {
      while (!unchecked.isEmpty()) {
        Block a = unchecked.removeFirst();
        Block b = correspondence.get(a);
        if (!a.name.equals(b.name)
            || !nodes(a.contents(), b.contents())
            || !nodes(a.transition(), b.transition())) {
          return false;
        }
      }
      for (Map.Entry<Block, Block> pair : correspondence.entrySet()) {
        List<Block> expected = new ArrayList<>();
        for (Block predecessor : pair.getKey().predecessors()) {
          Block image = correspondence.get(predecessor);
          if (image == null) {
            return false;
          }
          expected.add(image);
        }
        // blocks compare by identity
        if (!expected.equals(pair.getValue().predecessors())) {
          return false;
        }
      }
      return true;
    }
  }

  /** Compares the visited node with {@link #other}. */
  private static final class Matcher implements IrVisitor<Boolean> {
    private final Comparison comparison;
    private final IrNode other;

    Matcher(Comparison comparison, IrNode other) {
      this.comparison = comparison;
      this.other = other;
    }

    @Override
    public Boolean visitBinaryOperator(Expression.BinaryOperator that) {
      return other
          .as(Expression.BinaryOperator.class)
          .map(
              o ->
                  that.op == o.op
                      && comparison.nodes(that.left, o.left)
                      && comparison.nodes(that.right, o.right))
          .orElse(false);
    }

    @Override
    public Boolean visitUnaryOperator(Expression.UnaryOperator that) {
      return other
          .as(Expression.UnaryOperator.class)
          .map(o -> that.op == o.op && comparison.nodes(that.operand, o.operand))
          .orElse(false);
    }

    @Override
    public Boolean visitVariable(Atom.Variable that) {
      return that.equals(other);
    }

    @Override
    public Boolean visitReturn(Statement.Return that) {
      return other
          .as(Statement.Return.class)
          .map(o -> comparison.nodes(that.atom, o.atom))
          .orElse(false);
    }

    @Override
    public Boolean visitPhi(Expression.Phi that) {
      return other
          .as(Expression.Phi.class)
          .map(o -> that.variables.equals(o.variables))
          .orElse(false);
    }

    @Override
    public Boolean visitIntLiteral(Atom.IntLiteral that) {
      return that.equals(other);
    }

    @Override
    public Boolean visitFloatLiteral(Atom.FloatLiteral that) {
      return that.equals(other);
    }

    @Override
    public Boolean visitPointerLiteral(Atom.PointerLiteral that) {
      return that.equals(other);
    }

    @Override
    public Boolean visitBlock(Block that) {
      return other.as(Block.class).map(o -> comparison.pair(that, o)).orElse(false);
    }

    @Override
    public Boolean visitAssignment(Statement.Assignment that) {
      return other
          .as(Statement.Assignment.class)
          .map(
              o -> that.variable.equals(o.variable) && comparison.nodes(that.value, o.value))
          .orElse(false);
    }

    @Override
    public Boolean visitCall(Expression.Call that) {
      return other
          .as(Expression.Call.class)
          .map(o -> that.functionId == o.functionId && that.arguments.equals(o.arguments))
          .orElse(false);
    }

    @Override
    public Boolean visitPrint(Statement.Print that) {
      return other
          .as(Statement.Print.class)
          .map(o -> that.atom.equals(o.atom))
          .orElse(false);
    }

    @Override
    public Boolean visitFunctionRecord(FunctionRecord that) {
      return other
          .as(FunctionRecord.class)
          .map(
              o ->
                  that.id == o.id
                      && that.returnType == o.returnType
                      && that.parameterIds().equals(o.parameterIds())
                      && that.pool().equals(o.pool())
                      && comparison.nodes(that.blocks(), o.blocks()))
          .orElse(false);
    }

    @Override
    public Boolean visitJumpAlways(Jump.Always that) {
      return other
          .as(Jump.Always.class)
          .map(o -> comparison.pair(that.target, o.target))
          .orElse(false);
    }

    @Override
    public Boolean visitJumpConditional(Jump.Conditional that) {
      return other
          .as(Jump.Conditional.class)
          .map(
              o ->
                  that.condition.equals(o.condition)
                      && comparison.pair(that.yes, o.yes)
                      && comparison.pair(that.no, o.no))
          .orElse(false);
    }

    @Override
    public Boolean visitProgram(Program that) {
      return other
          .as(Program.class)
          .map(o -> comparison.nodes(that.functions(), o.functions()))
          .orElse(false);
    }
  }
}
