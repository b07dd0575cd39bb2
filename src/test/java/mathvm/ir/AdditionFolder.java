package mathvm.ir;

import java.util.Optional;
import mathvm.ir.Expression.BinOp;

/** Replaces additions of two int literals by their sum. */
public class AdditionFolder extends IrRewriter {

  @Override
  public IrNode visitBinaryOperator(Expression.BinaryOperator that) {
    Expression left = rewrite(that.left);
    Expression right = rewrite(that.right);
    if (that.op == BinOp.ADD) {
      Optional<Atom.IntLiteral> l = left.as(Atom.IntLiteral.class);
      Optional<Atom.IntLiteral> r = right.as(Atom.IntLiteral.class);
      if (l.isPresent() && r.isPresent()) {
        return Atom.integer(l.get().value + r.get().value);
      }
    }
    return new Expression.BinaryOperator(that.op, left, right);
  }
}
