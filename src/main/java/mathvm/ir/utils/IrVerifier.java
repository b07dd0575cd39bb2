package mathvm.ir.utils;

import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import mathvm.ir.Atom;
import mathvm.ir.Block;
import mathvm.ir.ControlFlowLinker;
import mathvm.ir.Expression;
import mathvm.ir.FunctionRecord;
import mathvm.ir.IrKind;
import mathvm.ir.IrNode;
import mathvm.ir.IrWalker;
import mathvm.ir.Program;
import mathvm.ir.Statement;
import mathvm.ir.StructuralError;
import mathvm.ir.StructuralError.Violation;
import mathvm.ir.VarType;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that functions are well formed once construction is complete:
 *
 * <ul>
 *   <li>every jump targets a block owned by the same function,
 *   <li>every reachable block has a transition, unless it ends in a return,
 *   <li>every call targets a function of the program,
 *   <li>pooled pointers index into the function's literal pool,
 *   <li>statements and compound expressions have exactly one owner,
 *   <li>returns carry a value iff the function declares a return type.
 * </ul>
 *
 * <p>Checking a function stops at its first violation, which is thrown as a {@link
 * StructuralError}.
 */
public class IrVerifier extends IrWalker {
  private static final Logger LOGGER = LoggerFactory.getLogger("IrVerifier");

  @Nullable private final Program program;
  private final Set<IrNode> owned = Sets.newIdentityHashSet();
  @Nullable private FunctionRecord function;

  private IrVerifier(@Nullable Program program) {
    this.program = program;
  }

  /** @throws StructuralError for the first violation of the first malformed function */
  public static void verify(Program program) {
    program.acceptVisitor(new IrVerifier(program));
  }

  /**
   * Verifies a single function. Calls are only checked if {@code program} is given.
   *
   * @throws StructuralError for the first violation
   */
  public static void verify(FunctionRecord function, @Nullable Program program) {
    function.acceptVisitor(new IrVerifier(program));
  }

  /** The first violation of every malformed function of {@code program}, in program order. */
  public static List<StructuralError> findProblems(Program program) {
    IrVerifier verifier = new IrVerifier(program);
    List<StructuralError> problems = new ArrayList<>();
    for (FunctionRecord function : program.functions()) {
      try {
        function.acceptVisitor(verifier);
      } catch (StructuralError e) {
        LOGGER.warn(e.getMessage());
        problems.add(e);
      }
    }
    return problems;
  }

  private StructuralError error(Violation violation, IrKind kind, String format, Object... args) {
    return new StructuralError(
        violation, kind, function == null ? null : function.id, String.format(format, args));
  }

  @Override
  protected void walkOwned(IrNode child) {
    // atoms are values and may be shared freely
    if (!(child instanceof Atom) && !owned.add(child)) {
      throw error(
          Violation.MULTIPLE_OWNERS, child.kind(), "%s has more than one owner", child.kind());
    }
    super.walkOwned(child);
  }

  @Override
  public IrNode visitFunctionRecord(FunctionRecord that) {
    function = that;
    for (Block block : that.blocks()) {
      for (Block target : block.successors()) {
        if (!that.owns(target)) {
          throw error(
              Violation.UNRESOLVED_JUMP_TARGET,
              block.transition().get().kind(),
              "block '%s' jumps to '%s', which doesn't belong to the function",
              block.name,
              target.name);
        }
      }
    }
    for (Block block : ControlFlowLinker.reachableBlocks(that.entry)) {
      if (!block.transition().isPresent() && !block.endsInReturn()) {
        throw error(
            Violation.INCOMPLETE_FUNCTION,
            IrKind.BLOCK,
            "reachable block '%s' neither has a transition nor returns",
            block.name);
      }
    }
    super.visitFunctionRecord(that);
    LOGGER.debug("Verified function " + that.id);
    return that;
  }

  @Override
  public IrNode visitReturn(Statement.Return that) {
    if (function != null) {
      boolean returnsValue = function.returnType != VarType.BOT;
      if (that.atom.isPresent() != returnsValue) {
        throw error(
            Violation.RETURN_TYPE_MISMATCH,
            IrKind.RETURN,
            returnsValue ? "missing return value of type %s" : "value returned from a %s function",
            function.returnType.string);
      }
    }
    return super.visitReturn(that);
  }

  @Override
  public IrNode visitCall(Expression.Call that) {
    if (program != null && !program.function(that.functionId).isPresent()) {
      throw error(
          Violation.UNRESOLVED_CALL_TARGET,
          IrKind.CALL,
          "call to function %s, which isn't part of the program",
          that.functionId);
    }
    return super.visitCall(that);
  }

  @Override
  public IrNode visitPointerLiteral(Atom.PointerLiteral that) {
    if (function != null
        && that.isPooledString
        && (that.value < 0 || that.value >= function.pool().size())) {
      throw error(
          Violation.UNRESOLVED_POOL_ENTRY,
          IrKind.PTR,
          "literal pool index %s, but the pool has %s entries",
          that.value,
          function.pool().size());
    }
    return super.visitPointerLiteral(that);
  }
}
