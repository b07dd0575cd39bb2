package mathvm.ir;

/**
 * One handler per {@link IrKind}. Nodes dispatch to their own handler in {@code acceptVisitor},
 * so a caller holding a plain {@link IrNode} still reaches the concrete case.
 *
 * <p>Read-only analyses usually return the visited node, rewrites return its replacement. See
 * {@link IrWalker} and {@link IrRewriter}.
 */
public interface IrVisitor<T> {

  T visitBinaryOperator(Expression.BinaryOperator that);

  T visitUnaryOperator(Expression.UnaryOperator that);

  T visitVariable(Atom.Variable that);

  T visitReturn(Statement.Return that);

  T visitPhi(Expression.Phi that);

  T visitIntLiteral(Atom.IntLiteral that);

  T visitFloatLiteral(Atom.FloatLiteral that);

  T visitPointerLiteral(Atom.PointerLiteral that);

  T visitBlock(Block that);

  T visitAssignment(Statement.Assignment that);

  T visitCall(Expression.Call that);

  T visitPrint(Statement.Print that);

  T visitFunctionRecord(FunctionRecord that);

  T visitJumpAlways(Jump.Always that);

  T visitJumpConditional(Jump.Conditional that);

  T visitProgram(Program that);
}
