package mathvm.ir.pass;

import java.util.function.Supplier;
import mathvm.IrError;
import mathvm.ir.IrNode;
import mathvm.ir.IrRewriter;
import mathvm.ir.Program;

/**
 * A transformation of a whole program. Passes never modify their input, they return a new program
 * (or the input itself, if there is nothing to do).
 */
public interface IrPass {

  String name();

  Program run(Program program);

  /** A pass applying a fresh rewriter from {@code rewriters} to the program on every run. */
  static IrPass rewriting(String name, Supplier<? extends IrRewriter> rewriters) {
    return new IrPass() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Program run(Program program) {
        IrNode result = program.acceptVisitor(rewriters.get());
        return result
            .as(Program.class)
            .orElseThrow(
                () -> new IrError("Pass " + name + " rewrote the program to a " + result.kind()));
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }
}
