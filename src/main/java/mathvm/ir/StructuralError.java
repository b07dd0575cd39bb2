package mathvm.ir;

import java.util.Optional;
import mathvm.IrError;
import org.jetbrains.annotations.Nullable;

/**
 * A violated structural invariant of the IR, raised by the linker, by {@link Program} and by
 * verification. It names the kind of the offending node and, if known, the id of the function it
 * belongs to.
 */
public class StructuralError extends IrError {
  public final Violation violation;
  public final IrKind nodeKind;
  public final Optional<Integer> functionId;

  public StructuralError(
      Violation violation, IrKind nodeKind, @Nullable Integer functionId, String detail) {
    super(
        String.format(
            "Structural error%s at %s: %s (%s)",
            functionId == null ? "" : " in function " + functionId,
            nodeKind,
            detail,
            violation));
    this.violation = violation;
    this.nodeKind = nodeKind;
    this.functionId = Optional.ofNullable(functionId);
  }

  public enum Violation {
    /** A block got a second transition. */
    DUPLICATE_TRANSITION,
    /** Two functions of a program share an id. */
    DUPLICATE_FUNCTION_ID,
    /** A jump targets a block that isn't part of the function. */
    UNRESOLVED_JUMP_TARGET,
    /** A call names a function that isn't part of the program. */
    UNRESOLVED_CALL_TARGET,
    /** A reachable block has neither a transition nor a trailing return. */
    INCOMPLETE_FUNCTION,
    /** A pooled pointer indexes past the end of the function's literal pool. */
    UNRESOLVED_POOL_ENTRY,
    /** A statement or compound expression is owned by more than one parent. */
    MULTIPLE_OWNERS,
    /** A return disagrees with the declared return type about whether there is a value. */
    RETURN_TYPE_MISMATCH
  }
}
