package mathvm.ir.pass;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import mathvm.EnvVar;
import mathvm.ir.Program;
import mathvm.ir.utils.IrVerifier;
import mathvm.ir.utils.StructuralEquivalence;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed sequence of {@link IrPass}es. Every pass gets the program produced by its
 * predecessor, so no two passes ever share a graph.
 *
 * <p>Unless turned off, the input and the result of every pass are checked with {@link
 * IrVerifier}; a malformed program stops the pipeline with a {@link
 * mathvm.ir.StructuralError}.
 */
public class PassPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger("PassPipeline");
  private static final int DEFAULT_MAX_ROUNDS = 10;

  private final PVector<IrPass> passes;
  private final boolean verify;
  private final boolean dump;
  private final int maxRounds;

  private PassPipeline(PVector<IrPass> passes, boolean verify, boolean dump, int maxRounds) {
    this.passes = passes;
    this.verify = verify;
    this.dump = dump;
    this.maxRounds = maxRounds;
  }

  public List<IrPass> passes() {
    return passes;
  }

  /** Applies all passes once, in order. */
  public Program run(Program program) {
    if (verify) {
      IrVerifier.verify(program);
    }
    Program current = program;
    for (IrPass pass : passes) {
      current = apply(pass, current);
    }
    return current;
  }

  /**
   * Applies all passes repeatedly until a round doesn't change the program any more, at most
   * {@code maxRounds} times. Changes are detected with {@link StructuralEquivalence}.
   */
  public Program runUntilFixpoint(Program program) {
    Program current = program;
    for (int round = 1; round <= maxRounds; round++) {
      Program next = run(current);
      if (StructuralEquivalence.INSTANCE.equivalent(current, next)) {
        LOGGER.debug("Reached a fixpoint after " + round + " round(s)");
        return next;
      }
      current = next;
    }
    LOGGER.warn("No fixpoint after " + maxRounds + " rounds, giving up");
    return current;
  }

  private Program apply(IrPass pass, Program program) {
    LOGGER.debug(pass.name());
    Program result = pass.run(program);
    if (verify) {
      IrVerifier.verify(result);
    }
    if (dump) {
      LOGGER.info("after " + pass.name() + ":" + System.lineSeparator() + result);
    }
    return result;
  }

  public static class Builder {
    private final PVector<IrPass> passes;
    private final boolean verify;
    private final boolean dump;
    private final int maxRounds;

    private Builder(PVector<IrPass> passes, boolean verify, boolean dump, int maxRounds) {
      this.passes = passes;
      this.verify = verify;
      this.dump = dump;
      this.maxRounds = maxRounds;
    }

    /** Starts with the settings of {@link EnvVar#MATHVM_IR_VERIFY} and friends. */
    public Builder() {
      this(
          TreePVector.empty(),
          !EnvVar.MATHVM_IR_VERIFY.isSetToZero(),
          EnvVar.MATHVM_IR_DUMP.isSetToOne(),
          EnvVar.MATHVM_IR_MAX_ROUNDS.intValue(DEFAULT_MAX_ROUNDS));
    }

    public Builder add(IrPass pass) {
      return new Builder(passes.plus(pass), verify, dump, maxRounds);
    }

    public Builder verifyAfterEachPass(boolean verify) {
      return new Builder(passes, verify, dump, maxRounds);
    }

    public Builder dumpAfterEachPass(boolean dump) {
      return new Builder(passes, verify, dump, maxRounds);
    }

    public Builder maxRounds(int maxRounds) {
      checkArgument(maxRounds > 0, "maxRounds must be positive, was %s", maxRounds);
      return new Builder(passes, verify, dump, maxRounds);
    }

    public PassPipeline build() {
      checkArgument(maxRounds > 0, "maxRounds must be positive, was %s", maxRounds);
      return new PassPipeline(passes, verify, dump, maxRounds);
    }
  }
}
