package mathvm.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** The IR of a translation unit: its functions in the order they were added. */
public final class Program extends IrNode {
  private final Map<Integer, FunctionRecord> functions = new LinkedHashMap<>();

  public Program() {
    super(IrKind.PROGRAM);
  }

  /**
   * Adds {@code function} to this program.
   *
   * @throws StructuralError with {@link StructuralError.Violation#DUPLICATE_FUNCTION_ID} if there
   *     already is a function with the same id. The program is left unchanged.
   */
  public Program add(FunctionRecord function) {
    checkNotNull(function);
    if (functions.containsKey(function.id)) {
      throw new StructuralError(
          StructuralError.Violation.DUPLICATE_FUNCTION_ID,
          IrKind.FUNCTION_RECORD,
          function.id,
          "the program already contains a function with this id");
    }
    functions.put(function.id, function);
    return this;
  }

  public FunctionRecord newFunction(int id, VarType returnType) {
    FunctionRecord function = new FunctionRecord(id, returnType);
    add(function);
    return function;
  }

  public Optional<FunctionRecord> function(int id) {
    return Optional.ofNullable(functions.get(id));
  }

  public List<FunctionRecord> functions() {
    return ImmutableList.copyOf(functions.values());
  }

  @Override
  public <T> T acceptVisitor(IrVisitor<T> visitor) {
    return visitor.visitProgram(this);
  }
}
