package mathvm.util;

import static org.jooq.lambda.Seq.seq;

import com.google.common.base.Strings;
import com.google.common.primitives.UnsignedLongs;
import java.util.stream.Collectors;
import mathvm.ir.Atom;
import mathvm.ir.Block;
import mathvm.ir.Expression;
import mathvm.ir.FunctionRecord;
import mathvm.ir.IrVisitor;
import mathvm.ir.Jump;
import mathvm.ir.Program;
import mathvm.ir.Statement;

/**
 * Renders IR as text, one statement per line. Used for diagnostics and by {@code toString} of all
 * nodes.
 *
 * <p>Instances of this class <em>are</em> stateful (the current indentation level). It is very
 * cheap to create new instances, so don't reuse them.
 */
public class IrPrinter implements IrVisitor<CharSequence> {

  private int indentLevel = 0;

  private CharSequence indent() {
    return Strings.repeat("  ", indentLevel);
  }

  @Override
  public CharSequence visitBinaryOperator(Expression.BinaryOperator that) {
    return new StringBuilder("(")
        .append(that.left.acceptVisitor(this))
        .append(" ")
        .append(that.op.string)
        .append(" ")
        .append(that.right.acceptVisitor(this))
        .append(")");
  }

  @Override
  public CharSequence visitUnaryOperator(Expression.UnaryOperator that) {
    return new StringBuilder(that.op.string).append(that.operand.acceptVisitor(this));
  }

  @Override
  public CharSequence visitVariable(Atom.Variable that) {
    return "v" + that.idString();
  }

  @Override
  public CharSequence visitReturn(Statement.Return that) {
    return that.atom.map(a -> "return " + a.acceptVisitor(this)).orElse("return");
  }

  @Override
  public CharSequence visitPhi(Expression.Phi that) {
    return "phi("
        + seq(that.variables).map(v -> v.acceptVisitor(this)).collect(Collectors.joining(", "))
        + ")";
  }

  @Override
  public CharSequence visitIntLiteral(Atom.IntLiteral that) {
    return Long.toString(that.value);
  }

  @Override
  public CharSequence visitFloatLiteral(Atom.FloatLiteral that) {
    return Double.toString(that.value);
  }

  @Override
  public CharSequence visitPointerLiteral(Atom.PointerLiteral that) {
    if (that.isPooledString) {
      return "pool[" + that.value + "]";
    }
    return "0x" + UnsignedLongs.toString(that.value, 16);
  }

  @Override
  public CharSequence visitBlock(Block that) {
    StringBuilder sb = new StringBuilder(that.name).append(":");
    if (!that.predecessors().isEmpty()) {
      sb.append(" ; preds ")
          .append(seq(that.predecessors()).map(b -> b.name).collect(Collectors.joining(", ")));
    }
    sb.append(System.lineSeparator());
    indentLevel++;
    for (Statement statement : that.contents()) {
      sb.append(indent()).append(statement.acceptVisitor(this)).append(System.lineSeparator());
    }
    if (that.transition().isPresent()) {
      sb.append(indent())
          .append(that.transition().get().acceptVisitor(this))
          .append(System.lineSeparator());
    } else if (!that.endsInReturn()) {
      sb.append(indent()).append("<no transition>").append(System.lineSeparator());
    }
    indentLevel--;
    return sb;
  }

  @Override
  public CharSequence visitAssignment(Statement.Assignment that) {
    return new StringBuilder()
        .append(that.variable.acceptVisitor(this))
        .append(" = ")
        .append(that.value.acceptVisitor(this));
  }

  @Override
  public CharSequence visitCall(Expression.Call that) {
    return "call f"
        + that.functionId
        + "("
        + seq(that.arguments).map(a -> a.acceptVisitor(this)).collect(Collectors.joining(", "))
        + ")";
  }

  @Override
  public CharSequence visitPrint(Statement.Print that) {
    return "print " + that.atom.acceptVisitor(this);
  }

  @Override
  public CharSequence visitFunctionRecord(FunctionRecord that) {
    StringBuilder sb =
        new StringBuilder("function f")
            .append(that.id)
            .append("(")
            .append(
                seq(that.parameterIds())
                    .map(id -> "v" + UnsignedLongs.toString(id))
                    .collect(Collectors.joining(", ")))
            .append(") -> ")
            .append(that.returnType.string)
            .append(System.lineSeparator());
    indentLevel++;
    for (int i = 0; i < that.pool().size(); i++) {
      sb.append(indent())
          .append("pool[")
          .append(i)
          .append("] = \"")
          .append(escape(that.string(i)))
          .append("\"")
          .append(System.lineSeparator());
    }
    for (Block block : that.blocks()) {
      sb.append(indent()).append(block.acceptVisitor(this));
    }
    indentLevel--;
    return sb;
  }

  @Override
  public CharSequence visitJumpAlways(Jump.Always that) {
    return "jump " + that.target.name;
  }

  @Override
  public CharSequence visitJumpConditional(Jump.Conditional that) {
    return "if "
        + that.condition.acceptVisitor(this)
        + " then "
        + that.yes.name
        + " else "
        + that.no.name;
  }

  @Override
  public CharSequence visitProgram(Program that) {
    return seq(that.functions())
        .map(f -> f.acceptVisitor(this))
        .collect(Collectors.joining(System.lineSeparator()));
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
  }
}
