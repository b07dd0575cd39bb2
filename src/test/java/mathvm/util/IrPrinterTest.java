package mathvm.util;

import static mathvm.ir.Atom.integer;
import static mathvm.ir.Atom.variable;

import com.google.common.collect.ImmutableList;
import mathvm.ir.Atom;
import mathvm.ir.Block;
import mathvm.ir.ExampleFunctions;
import mathvm.ir.Expression;
import mathvm.ir.Expression.UnOp;
import mathvm.ir.FunctionRecord;
import mathvm.ir.Statement;
import mathvm.ir.VarType;
import org.junit.Assert;
import org.junit.Test;

public class IrPrinterTest {

  private static String lines(String... lines) {
    return String.join(System.lineSeparator(), lines) + System.lineSeparator();
  }

  @Test
  public void loop() {
    String expected =
        lines(
            "function f1() -> none",
            "  1:",
            "    v0 = 0",
            "    jump cond",
            "  cond: ; preds 1, body",
            "    v1 = phi(v0, v3)",
            "    v2 = (v1 < 5)",
            "    if v2 then body else exit",
            "  body: ; preds cond",
            "    print v1",
            "    v3 = (v1 + 1)",
            "    jump cond",
            "  exit: ; preds cond",
            "    return");
    Assert.assertEquals(expected, ExampleFunctions.loopCountingToFive(1).toString());
  }

  @Test
  public void poolParametersAndCalls() {
    FunctionRecord greeter = ExampleFunctions.greeter(2, 1);
    greeter.addParameter(5);
    greeter.addString("say \"hi\"\n");
    String expected =
        lines(
            "function f2(v5) -> none",
            "  pool[0] = \"Hello, world!\"",
            "  pool[1] = \"say \\\"hi\\\"\\n\"",
            "  2:",
            "    print pool[0]",
            "    v0 = call f1(3, 4)",
            "    print v0",
            "    return");
    Assert.assertEquals(expected, greeter.toString());
  }

  @Test
  public void unlinkedBlock_isMarked() {
    Block block = new Block("dangling");
    block.append(new Statement.Print(integer(1)));
    Assert.assertEquals(lines("dangling:", "  print 1", "  <no transition>"), block.toString());
  }

  @Test
  public void atomsAndExpressions() {
    Assert.assertEquals("-7", integer(-7).toString());
    Assert.assertEquals("1.5", Atom.floating(1.5).toString());
    Assert.assertEquals("0xff", Atom.pointer(255).toString());
    Assert.assertEquals("pool[3]", Atom.pooledString(3).toString());
    Assert.assertEquals("v18446744073709551615", variable(-1).toString());
    Assert.assertEquals(
        "<i2d>v1", new Expression.UnaryOperator(UnOp.CAST_I2D, variable(1)).toString());
    Assert.assertEquals("call f0()", new Expression.Call(0, ImmutableList.of()).toString());
    Assert.assertEquals("return 0", new Statement.Return(integer(0)).toString());
  }

  @Test
  public void returnType() {
    Assert.assertEquals(
        lines("function f0() -> float", "  0:", "    return 0.0"),
        functionReturning(VarType.DOUBLE, Atom.floating(0.0)).toString());
  }

  private static FunctionRecord functionReturning(VarType type, Atom value) {
    FunctionRecord function = new FunctionRecord(0, type);
    function.entry.append(new Statement.Return(value));
    return function;
  }
}
