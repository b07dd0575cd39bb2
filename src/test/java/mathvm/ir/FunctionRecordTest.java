package mathvm.ir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class FunctionRecordTest {

  private FunctionRecord function;

  @Before
  public void setUp() {
    function = new FunctionRecord(7, VarType.PTR);
  }

  @Test
  public void newFunction_hasEmptyUnlinkedEntryNamedAfterId() {
    Assert.assertEquals(7, function.id);
    Assert.assertEquals(VarType.PTR, function.returnType);
    Assert.assertEquals("7", function.entry.name);
    assertThat(function.entry.contents().isEmpty(), is(true));
    assertThat(function.entry.transition().isPresent(), is(false));
    assertThat(function.blocks(), contains(function.entry));
  }

  @Test
  public void literalPool_indicesAreStable() {
    int hello = function.addString("hello");
    int world = function.addString("world");
    int helloAgain = function.addString("hello");

    Assert.assertEquals(0, hello);
    Assert.assertEquals(1, world);
    Assert.assertEquals(2, helloAgain);
    for (int i = 0; i < 100; i++) {
      function.addString("filler" + i);
    }
    Assert.assertEquals("hello", function.string(hello));
    Assert.assertEquals("world", function.string(world));
    Assert.assertEquals("hello", function.string(helloAgain));
    Assert.assertEquals(103, function.pool().size());
  }

  @Test
  public void pooledString_pointsToTheAppendedEntry() {
    function.addString("first");
    Atom.PointerLiteral pointer = function.pooledString("second");

    assertThat(pointer.isPooledString, is(true));
    Assert.assertEquals("second", function.string((int) pointer.value));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void string_indexOutOfPool_throws() {
    function.addString("only");
    function.string(1);
  }

  @Test(expected = UnsupportedOperationException.class)
  public void pool_isReadOnly() {
    function.pool().add("sneaky");
  }

  @Test
  public void parameters_keepOrder() {
    function.addParameter(3).addParameter(1).addParameter(-1L);
    assertThat(function.parameterIds(), contains(3L, 1L, -1L));
  }

  @Test(expected = IllegalArgumentException.class)
  public void duplicateParameter_throws() {
    function.addParameter(3).addParameter(3);
  }

  @Test
  public void blocks_entryFirstThenInCreationOrder() {
    Block a = function.newBlock("a");
    Block b = function.addBlock(new Block("b"));

    assertThat(function.blocks(), contains(function.entry, a, b));
    assertThat(function.owns(b), is(true));
    assertThat(function.owns(new Block("b")), is(false));
  }

  @Test(expected = IllegalArgumentException.class)
  public void addBlockTwice_throws() {
    Block a = function.newBlock("a");
    function.addBlock(a);
  }

  @Test
  public void owns_byIdentityAmongManyBlocks() {
    for (int i = 0; i < 1000; i++) {
      function.newBlock("b");
    }
    Block adopted = function.addBlock(new Block("b"));

    assertThat(function.owns(adopted), is(true));
    assertThat(function.owns(function.blocks().get(500)), is(true));
    assertThat(function.owns(new Block("b")), is(false));
    Assert.assertEquals(1002, function.blocks().size());
  }
}
