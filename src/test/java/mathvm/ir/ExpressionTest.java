package mathvm.ir;

import static mathvm.ir.Atom.integer;
import static mathvm.ir.Atom.variable;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import mathvm.ir.Expression.BinOp;
import mathvm.ir.Expression.UnOp;
import org.junit.Assert;
import org.junit.Test;

public class ExpressionTest {

  @Test
  public void phi_keepsVariablesInOrder() {
    Expression.Phi phi = new Expression.Phi(ImmutableList.of(variable(3), variable(7)));

    assertThat(phi.variables, contains(variable(3), variable(7)));
    Assert.assertEquals(3, phi.variables.get(0).id);
    Assert.assertEquals(7, phi.variables.get(1).id);
  }

  @Test
  public void phi_copiesItsInput() {
    List<Atom.Variable> variables = new ArrayList<>();
    variables.add(variable(1));
    Expression.Phi phi = new Expression.Phi(variables);
    variables.add(variable(2));

    assertThat(phi.variables, contains(variable(1)));
  }

  @Test
  public void call_keepsArgumentsInOrder() {
    Atom shared = variable(4);
    Expression.Call call = new Expression.Call(9, ImmutableList.of(shared, integer(1), shared));

    Assert.assertEquals(9, call.functionId);
    assertThat(call.arguments, contains(shared, integer(1), shared));
  }

  @Test
  public void bitwiseAndLogicalOperatorsAreDistinct() {
    assertThat(BinOp.OR, is(not(BinOp.LOR)));
    assertThat(BinOp.AND, is(not(BinOp.LAND)));
    assertThat(BinOp.OR.isShortCircuit(), is(false));
    assertThat(BinOp.AND.isShortCircuit(), is(false));
    assertThat(BinOp.XOR.isShortCircuit(), is(false));
    assertThat(BinOp.LOR.isShortCircuit(), is(true));
    assertThat(BinOp.LAND.isShortCircuit(), is(true));
    Assert.assertEquals(BinOp.Category.BITWISE, BinOp.OR.category);
    Assert.assertEquals(BinOp.Category.LOGICAL, BinOp.LOR.category);
  }

  @Test
  public void operatorSymbols() {
    Assert.assertEquals("|", BinOp.OR.string);
    Assert.assertEquals("||", BinOp.LOR.string);
    Assert.assertEquals("&&", BinOp.LAND.string);
    Assert.assertEquals("<=", BinOp.LE.string);
    Assert.assertEquals("<i2d>", UnOp.CAST_I2D.string);
    Assert.assertEquals("<p2i>", UnOp.CAST_P2I.string);
    Assert.assertEquals("!", UnOp.NOT.string);
    assertThat(UnOp.CAST_D2I.isCast(), is(true));
    assertThat(UnOp.NEG.isCast(), is(false));
  }

  @Test
  public void atomsAreValues() {
    Assert.assertEquals(integer(5), integer(5));
    Assert.assertNotEquals(integer(5), integer(6));
    Assert.assertEquals(Atom.floating(Double.NaN), Atom.floating(Double.NaN));
    Assert.assertNotEquals(Atom.floating(0.0), Atom.floating(-0.0));
    Assert.assertNotEquals(Atom.pointer(3), Atom.pooledString(3));
    Assert.assertEquals(variable(-1).hashCode(), variable(-1).hashCode());
    Assert.assertEquals("18446744073709551615", variable(-1).idString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void pooledStringWithNegativeIndex_throws() {
    Atom.pooledString(-1);
  }

  @Test(expected = NullPointerException.class)
  public void binaryOperatorWithoutOperand_throws() {
    new Expression.BinaryOperator(BinOp.ADD, integer(1), null);
  }
}
