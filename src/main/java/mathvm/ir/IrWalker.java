package mathvm.ir;

/**
 * A read-only traversal that returns every visited node unchanged.
 *
 * <p>It descends along ownership only: program, functions, blocks in the order their function owns
 * them, statements, owned sub-expressions and the condition of a jump. Call arguments and phi
 * variables are visited through {@link #walkShared}. Jump targets and predecessors are never
 * followed, so loops in the control flow graph don't lead to revisits.
 *
 * <p>Subclasses override the handlers they are interested in and call {@code super} to keep
 * descending.
 */
public abstract class IrWalker implements IrVisitor<IrNode> {

  /** Visits a child that is owned by the node currently visited. */
  protected void walkOwned(IrNode child) {
    child.acceptVisitor(this);
  }

  /** Visits a node that is referenced, but not owned, by the node currently visited. */
  protected void walkShared(IrNode referenced) {
    referenced.acceptVisitor(this);
  }

  @Override
  public IrNode visitBinaryOperator(Expression.BinaryOperator that) {
    walkOwned(that.left);
    walkOwned(that.right);
    return that;
  }

  @Override
  public IrNode visitUnaryOperator(Expression.UnaryOperator that) {
    walkOwned(that.operand);
    return that;
  }

  @Override
  public IrNode visitVariable(Atom.Variable that) {
    return that;
  }

  @Override
  public IrNode visitReturn(Statement.Return that) {
    that.atom.ifPresent(this::walkOwned);
    return that;
  }

  @Override
  public IrNode visitPhi(Expression.Phi that) {
    that.variables.forEach(this::walkShared);
    return that;
  }

  @Override
  public IrNode visitIntLiteral(Atom.IntLiteral that) {
    return that;
  }

  @Override
  public IrNode visitFloatLiteral(Atom.FloatLiteral that) {
    return that;
  }

  @Override
  public IrNode visitPointerLiteral(Atom.PointerLiteral that) {
    return that;
  }

  @Override
  public IrNode visitBlock(Block that) {
    that.contents().forEach(this::walkOwned);
    that.transition().ifPresent(this::walkOwned);
    return that;
  }

  @Override
  public IrNode visitAssignment(Statement.Assignment that) {
    walkOwned(that.variable);
    walkOwned(that.value);
    return that;
  }

  @Override
  public IrNode visitCall(Expression.Call that) {
    that.arguments.forEach(this::walkShared);
    return that;
  }

  @Override
  public IrNode visitPrint(Statement.Print that) {
    walkOwned(that.atom);
    return that;
  }

  @Override
  public IrNode visitFunctionRecord(FunctionRecord that) {
    that.blocks().forEach(this::walkOwned);
    return that;
  }

  @Override
  public IrNode visitJumpAlways(Jump.Always that) {
    return that;
  }

  @Override
  public IrNode visitJumpConditional(Jump.Conditional that) {
    walkOwned(that.condition);
    return that;
  }

  @Override
  public IrNode visitProgram(Program that) {
    that.functions().forEach(this::walkOwned);
    return that;
  }
}
