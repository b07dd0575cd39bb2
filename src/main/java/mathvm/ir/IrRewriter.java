package mathvm.ir;

import static org.jooq.lambda.Seq.seq;

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import mathvm.IrError;
import org.jetbrains.annotations.Nullable;

/**
 * Rewrites a graph into a fresh one. As is, every handler re-creates its node from the rewritten
 * children, which copies the graph; subclasses override handlers to substitute nodes. The input is
 * never modified.
 *
 * <p>Blocks are copied through a correspondence that lives for the duration of {@link
 * #visitFunctionRecord}: all blocks of the function are created up front and the copies are linked
 * with {@link ControlFlowLinker}, which rebuilds their predecessors. Predecessors of the copies
 * are then put into the order of the originals, so phi operands keep lining up with them. Jump
 * targets always end up in the copy, a substituted jump naming an original block is redirected to
 * its copy. Blocks themselves can't be substituted: {@link #visitBlock} has to yield the copy
 * given by {@link #rewritten}.
 *
 * <p>Instances are stateful. Use a new instance per rewrite.
 */
public class IrRewriter implements IrVisitor<IrNode> {
  private final Map<Block, Block> rewrittenBlocks = Maps.newIdentityHashMap();
  private final Set<Block> copies = Sets.newIdentityHashSet();
  @Nullable private FunctionRecord function;

  protected Expression rewrite(Expression expression) {
    return expect(Expression.class, expression.acceptVisitor(this), expression);
  }

  protected Atom rewrite(Atom atom) {
    return expect(Atom.class, atom.acceptVisitor(this), atom);
  }

  protected Statement rewrite(Statement statement) {
    return expect(Statement.class, statement.acceptVisitor(this), statement);
  }

  protected Jump rewrite(Jump jump) {
    return expect(Jump.class, jump.acceptVisitor(this), jump);
  }

  /**
   * The copy of {@code original}. Blocks that aren't owned by the function being rewritten get a
   * copy that isn't owned by any function either.
   */
  protected Block rewritten(Block original) {
    return rewrittenBlocks.computeIfAbsent(
        original,
        b -> {
          Block copy = new Block(b.name);
          copies.add(copy);
          return copy;
        });
  }

  /** {@code target} if it already is a copy, otherwise the copy of it. */
  private Block inCopy(Block target) {
    return copies.contains(target) ? target : rewritten(target);
  }

  /** {@code jump}, or a jump of the same shape, if it names blocks outside of the copy. */
  private Jump redirectedToCopy(Jump jump) {
    boolean allInCopy = true;
    for (Block target : jump.targets()) {
      allInCopy &= copies.contains(target);
    }
    if (allInCopy) {
      return jump;
    }
    return jump.match(
        always -> new Jump.Always(inCopy(always.target)),
        cond -> new Jump.Conditional(inCopy(cond.yes), inCopy(cond.no), cond.condition));
  }

  private static <T extends IrNode> T expect(
      Class<T> category, IrNode replacement, IrNode original) {
    if (!category.isInstance(replacement)) {
      throw new IrError(
          String.format(
              "A %s was rewritten to %s, but a %s is needed here",
              original.kind(),
              replacement == null ? "null" : replacement.kind(),
              category.getSimpleName()));
    }
    return category.cast(replacement);
  }

  @Override
  public IrNode visitBinaryOperator(Expression.BinaryOperator that) {
    return new Expression.BinaryOperator(that.op, rewrite(that.left), rewrite(that.right));
  }

  @Override
  public IrNode visitUnaryOperator(Expression.UnaryOperator that) {
    return new Expression.UnaryOperator(that.op, rewrite(that.operand));
  }

  @Override
  public IrNode visitVariable(Atom.Variable that) {
    return new Atom.Variable(that.id);
  }

  @Override
  public IrNode visitReturn(Statement.Return that) {
    return new Statement.Return(that.atom.map(this::rewrite).orElse(null));
  }

  @Override
  public IrNode visitPhi(Expression.Phi that) {
    return new Expression.Phi(
        seq(that.variables).map(v -> expect(Atom.Variable.class, v.acceptVisitor(this), v)).toList());
  }

  @Override
  public IrNode visitIntLiteral(Atom.IntLiteral that) {
    return new Atom.IntLiteral(that.value);
  }

  @Override
  public IrNode visitFloatLiteral(Atom.FloatLiteral that) {
    return new Atom.FloatLiteral(that.value);
  }

  @Override
  public IrNode visitPointerLiteral(Atom.PointerLiteral that) {
    return new Atom.PointerLiteral(that.value, that.isPooledString);
  }

  @Override
  public IrNode visitBlock(Block that) {
    Block copy = rewritten(that);
    for (Statement statement : that.contents()) {
      copy.append(rewrite(statement));
    }
    if (that.transition().isPresent()) {
      Jump jump = redirectedToCopy(rewrite(that.transition().get()));
      ControlFlowLinker.link(function, copy, jump);
    }
    return copy;
  }

  @Override
  public IrNode visitAssignment(Statement.Assignment that) {
    Atom.Variable variable =
        expect(Atom.Variable.class, that.variable.acceptVisitor(this), that.variable);
    return new Statement.Assignment(variable, rewrite(that.value));
  }

  @Override
  public IrNode visitCall(Expression.Call that) {
    return new Expression.Call(that.functionId, seq(that.arguments).map(this::rewrite).toList());
  }

  @Override
  public IrNode visitPrint(Statement.Print that) {
    return new Statement.Print(rewrite(that.atom));
  }

  @Override
  public IrNode visitFunctionRecord(FunctionRecord that) {
    FunctionRecord copy = new FunctionRecord(that.id, that.returnType);
    that.parameterIds().forEach(copy::addParameter);
    that.pool().forEach(copy::addString);

    rewrittenBlocks.clear();
    copies.clear();
    function = copy;
    rewrittenBlocks.put(that.entry, copy.entry);
    copies.add(copy.entry);
    for (Block block : that.blocks()) {
      if (block != that.entry) {
        Block blockCopy = copy.newBlock(block.name);
        rewrittenBlocks.put(block, blockCopy);
        copies.add(blockCopy);
      }
    }
    for (Block block : that.blocks()) {
      IrNode result = block.acceptVisitor(this);
      if (result != rewrittenBlocks.get(block)) {
        throw new IrError(
            String.format(
                "Block %s of function %s was rewritten to %s instead of its copy",
                block.name, that.id, result == null ? "null" : result.kind()));
      }
    }
    for (Map.Entry<Block, Block> pair : rewrittenBlocks.entrySet()) {
      List<Block> originalOrder =
          seq(pair.getKey().predecessors())
              .map(rewrittenBlocks::get)
              .filter(b -> b != null)
              .toList();
      pair.getValue().reorderPredecessors(originalOrder);
    }
    rewrittenBlocks.clear();
    copies.clear();
    function = null;
    return copy;
  }

  @Override
  public IrNode visitJumpAlways(Jump.Always that) {
    return new Jump.Always(rewritten(that.target));
  }

  @Override
  public IrNode visitJumpConditional(Jump.Conditional that) {
    return new Jump.Conditional(rewritten(that.yes), rewritten(that.no), rewrite(that.condition));
  }

  @Override
  public IrNode visitProgram(Program that) {
    Program copy = new Program();
    for (FunctionRecord original : that.functions()) {
      copy.add(expect(FunctionRecord.class, original.acceptVisitor(this), original));
    }
    return copy;
  }
}
