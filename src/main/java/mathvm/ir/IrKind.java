package mathvm.ir;

import com.google.common.collect.ImmutableMap;
import java.util.Optional;

/**
 * The closed set of IR node kinds. Each constant names the one concrete node class carrying that
 * kind and the display name used by dumps and error messages.
 *
 * <p>Consumers serialize kinds by ordinal, so new kinds may only be appended.
 */
public enum IrKind {
  BIN_OP("BinOp", Expression.BinaryOperator.class),
  UN_OP("UnOp", Expression.UnaryOperator.class),
  VARIABLE("Variable", Atom.Variable.class),
  RETURN("Return", Statement.Return.class),
  PHI("Phi", Expression.Phi.class),
  INT("Int", Atom.IntLiteral.class),
  DOUBLE("Double", Atom.FloatLiteral.class),
  PTR("Ptr", Atom.PointerLiteral.class),
  BLOCK("Block", Block.class),
  ASSIGNMENT("Assignment", Statement.Assignment.class),
  CALL("Call", Expression.Call.class),
  PRINT("Print", Statement.Print.class),
  FUNCTION_RECORD("FunctionRecord", FunctionRecord.class),
  JUMP_ALWAYS("JumpAlways", Jump.Always.class),
  JUMP_COND("JumpCond", Jump.Conditional.class),
  PROGRAM("Program", Program.class);

  private static final ImmutableMap<Class<? extends IrNode>, IrKind> BY_CLASS;

  static {
    ImmutableMap.Builder<Class<? extends IrNode>, IrKind> builder = ImmutableMap.builder();
    for (IrKind kind : values()) {
      builder.put(kind.nodeClass, kind);
    }
    BY_CLASS = builder.build();
  }

  public final String displayName;
  public final Class<? extends IrNode> nodeClass;

  IrKind(String displayName, Class<? extends IrNode> nodeClass) {
    this.displayName = displayName;
    this.nodeClass = nodeClass;
  }

  /** The kind whose node class is exactly {@code nodeClass}, if there is one. */
  public static Optional<IrKind> of(Class<?> nodeClass) {
    return Optional.ofNullable(BY_CLASS.get(nodeClass));
  }

  @Override
  public String toString() {
    return displayName;
  }
}
