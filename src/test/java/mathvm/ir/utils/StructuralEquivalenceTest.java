package mathvm.ir.utils;

import static mathvm.ir.Atom.integer;
import static mathvm.ir.Atom.variable;
import static mathvm.ir.ControlFlowLinker.linkConditional;
import static mathvm.ir.ControlFlowLinker.linkUnconditional;

import com.google.common.collect.ImmutableList;
import mathvm.ir.Block;
import mathvm.ir.ExampleFunctions;
import mathvm.ir.Expression;
import mathvm.ir.Expression.BinOp;
import mathvm.ir.FunctionRecord;
import mathvm.ir.Statement;
import mathvm.ir.VarType;
import org.junit.Assert;
import org.junit.Test;

public class StructuralEquivalenceTest {
  private static final StructuralEquivalence EQUIVALENCE = StructuralEquivalence.INSTANCE;

  @Test
  public void independentlyBuiltGraphs_areEquivalent() {
    Assert.assertTrue(EQUIVALENCE.equivalent(ExampleFunctions.program(), ExampleFunctions.program()));
    Assert.assertTrue(
        EQUIVALENCE.equivalent(
            ExampleFunctions.loopCountingToFive(1), ExampleFunctions.loopCountingToFive(1)));
  }

  @Test
  public void equivalentNodes_hashAlike() {
    Assert.assertEquals(
        EQUIVALENCE.hash(ExampleFunctions.max(0)), EQUIVALENCE.hash(ExampleFunctions.max(0)));
  }

  @Test
  public void differentIdOrLiteral_notEquivalent() {
    Assert.assertFalse(
        EQUIVALENCE.equivalent(ExampleFunctions.max(0), ExampleFunctions.max(1)));
    Assert.assertFalse(EQUIVALENCE.equivalent(integer(1), integer(2)));
    Assert.assertFalse(EQUIVALENCE.equivalent(integer(1), variable(1)));
  }

  @Test
  public void differentOperator_notEquivalent() {
    Assert.assertFalse(
        EQUIVALENCE.equivalent(
            new Expression.BinaryOperator(BinOp.OR, variable(0), variable(1)),
            new Expression.BinaryOperator(BinOp.LOR, variable(0), variable(1))));
  }

  @Test
  public void swappedBranches_notEquivalent() {
    FunctionRecord swapped = new FunctionRecord(0, VarType.INT);
    swapped.addParameter(0).addParameter(1);
    Block less = swapped.newBlock("less");
    Block greaterEqual = swapped.newBlock("greaterEqual");
    Block exit = swapped.newBlock("exit");
    swapped.entry.append(
        new Statement.Assignment(
            variable(2), new Expression.BinaryOperator(BinOp.LT, variable(0), variable(1))));
    linkConditional(swapped.entry, greaterEqual, less, variable(2));
    linkUnconditional(less, exit);
    linkUnconditional(greaterEqual, exit);
    exit.append(
            new Statement.Assignment(
                variable(3),
                new Expression.Phi(ImmutableList.of(variable(1), variable(0)))))
        .append(new Statement.Return(variable(3)));

    Assert.assertFalse(EQUIVALENCE.equivalent(ExampleFunctions.max(0), swapped));
  }

  @Test
  public void predecessorOrder_matters() {
    Assert.assertTrue(EQUIVALENCE.equivalent(diamond(false), diamond(false)));
    Assert.assertTrue(EQUIVALENCE.equivalent(diamond(true), diamond(true)));
    // phi operands pair up with predecessors by position
    Assert.assertFalse(EQUIVALENCE.equivalent(diamond(false), diamond(true)));
  }

  @Test
  public void mergedTargets_notEquivalentToDistinctOnes() {
    FunctionRecord distinct = new FunctionRecord(0, VarType.BOT);
    Block x = distinct.newBlock("x");
    Block y = distinct.newBlock("x");
    x.append(new Statement.Return(null));
    y.append(new Statement.Return(null));
    linkConditional(distinct.entry, x, y, variable(0));

    FunctionRecord merged = new FunctionRecord(0, VarType.BOT);
    Block z = merged.newBlock("x");
    Block unused = merged.newBlock("x");
    z.append(new Statement.Return(null));
    unused.append(new Statement.Return(null));
    linkConditional(merged.entry, z, z, variable(0));

    Assert.assertFalse(EQUIVALENCE.equivalent(distinct, merged));
    Assert.assertFalse(EQUIVALENCE.equivalent(merged, distinct));
  }

  /** entry branches to left and right, which both jump to exit. */
  private static FunctionRecord diamond(boolean rightFirst) {
    FunctionRecord function = new FunctionRecord(0, VarType.BOT);
    Block left = function.newBlock("left");
    Block right = function.newBlock("right");
    Block exit = function.newBlock("exit");
    exit.append(new Statement.Return(null));
    linkConditional(function.entry, left, right, variable(0));
    if (rightFirst) {
      linkUnconditional(right, exit);
      linkUnconditional(left, exit);
    } else {
      linkUnconditional(left, exit);
      linkUnconditional(right, exit);
    }
    return function;
  }
}
