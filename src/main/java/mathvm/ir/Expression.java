package mathvm.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A node producing a value. */
public abstract class Expression extends IrNode {

  Expression(IrKind kind) {
    super(kind);
  }

  public static final class BinaryOperator extends Expression {
    public final BinOp op;
    public final Expression left;
    public final Expression right;

    public BinaryOperator(BinOp op, Expression left, Expression right) {
      super(IrKind.BIN_OP);
      this.op = checkNotNull(op);
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitBinaryOperator(this);
    }
  }

  public static final class UnaryOperator extends Expression {
    public final UnOp op;
    public final Expression operand;

    public UnaryOperator(UnOp op, Expression operand) {
      super(IrKind.UN_OP);
      this.op = checkNotNull(op);
      this.operand = checkNotNull(operand);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitUnaryOperator(this);
    }
  }

  /**
   * Selects one of the incoming definitions at a control flow merge. The variables are not owned,
   * they only name definitions made elsewhere.
   */
  public static final class Phi extends Expression {
    public final ImmutableList<Atom.Variable> variables;

    public Phi(List<Atom.Variable> variables) {
      super(IrKind.PHI);
      this.variables = ImmutableList.copyOf(variables);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitPhi(this);
    }
  }

  /**
   * Calls the function with id {@link #functionId} of the enclosing {@link Program}. Arguments are
   * shared with the rest of the function and never rewritten in place.
   */
  public static final class Call extends Expression {
    public final int functionId;
    public final ImmutableList<Atom> arguments;

    public Call(int functionId, List<? extends Atom> arguments) {
      super(IrKind.CALL);
      this.functionId = FunctionRecord.checkFunctionId(functionId);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    @Override
    public <T> T acceptVisitor(IrVisitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  /**
   * {@code OR} and {@code AND} are bitwise and always evaluate both operands, {@code LOR} and
   * {@code LAND} are the short-circuiting logical connectives.
   */
  public enum BinOp {
    ADD("+", Category.ARITHMETIC),
    SUB("-", Category.ARITHMETIC),
    MUL("*", Category.ARITHMETIC),
    DIV("/", Category.ARITHMETIC),
    MOD("%", Category.ARITHMETIC),
    LT("<", Category.RELATIONAL),
    LE("<=", Category.RELATIONAL),
    EQ("==", Category.RELATIONAL),
    NEQ("!=", Category.RELATIONAL),
    OR("|", Category.BITWISE),
    AND("&", Category.BITWISE),
    LOR("||", Category.LOGICAL),
    LAND("&&", Category.LOGICAL),
    XOR("^", Category.BITWISE);

    public final String string;
    public final Category category;

    BinOp(String string, Category category) {
      this.string = string;
      this.category = category;
    }

    public boolean isShortCircuit() {
      return category == Category.LOGICAL;
    }

    public enum Category {
      ARITHMETIC,
      RELATIONAL,
      BITWISE,
      LOGICAL
    }
  }

  public enum UnOp {
    CAST_I2D("<i2d>"),
    CAST_D2I("<d2i>"),
    CAST_P2I("<p2i>"),
    CAST_I2P("<i2p>"),
    NEG("-"),
    NOT("!");

    public final String string;

    UnOp(String string) {
      this.string = string;
    }

    public boolean isCast() {
      return this != NEG && this != NOT;
    }
  }
}
