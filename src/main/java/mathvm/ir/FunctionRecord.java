package mathvm.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The IR of a single function.
 *
 * <p>The function owns all of its blocks: the entry block and every block created by {@link
 * #newBlock} or adopted by {@link #addBlock}, in that order. Jump targets and predecessors only
 * refer to these blocks.
 *
 * <p>The entry block starts out empty and has to be filled and linked before the function is well
 * formed, see {@code mathvm.ir.utils.IrVerifier}.
 */
public final class FunctionRecord extends IrNode {
  public static final int MAX_ID = 0xFFFF;

  /** An unsigned 16 bit number, unique within the enclosing {@link Program}. */
  public final int id;

  public final VarType returnType;
  public final Block entry;
  private final List<Block> blocks = new ArrayList<>();
  private final Set<Block> ownedBlocks = Sets.newIdentityHashSet();
  private final List<Long> parameterIds = new ArrayList<>();
  private final List<String> pool = new ArrayList<>();

  public FunctionRecord(int id, VarType returnType) {
    super(IrKind.FUNCTION_RECORD);
    this.id = checkFunctionId(id);
    this.returnType = checkNotNull(returnType);
    this.entry = new Block(Integer.toString(id));
    blocks.add(entry);
    ownedBlocks.add(entry);
  }

  static int checkFunctionId(int id) {
    checkArgument(id >= 0 && id <= MAX_ID, "Function id %s is not an unsigned 16 bit number", id);
    return id;
  }

  /** Creates a new, unlinked block owned by this function. */
  public Block newBlock(String name) {
    Block block = new Block(name);
    blocks.add(block);
    ownedBlocks.add(block);
    return block;
  }

  /**
   * Makes this function the owner of {@code block}, which must not be owned by this function
   * already.
   */
  public Block addBlock(Block block) {
    checkArgument(
        ownedBlocks.add(checkNotNull(block)),
        "Block %s already belongs to function %s",
        block.name,
        id);
    blocks.add(block);
    return block;
  }

  public boolean owns(Block block) {
    return ownedBlocks.contains(block);
  }

  /** All owned blocks, the entry block first. */
  public List<Block> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public FunctionRecord addParameter(long variableId) {
    checkArgument(
        !parameterIds.contains(variableId),
        "Duplicate parameter %s in function %s",
        variableId,
        id);
    parameterIds.add(variableId);
    return this;
  }

  public List<Long> parameterIds() {
    return Collections.unmodifiableList(parameterIds);
  }

  /**
   * Appends {@code constant} to the literal pool. The returned index stays valid for the lifetime
   * of this function. Equal strings added twice get two indices.
   */
  public int addString(String constant) {
    pool.add(checkNotNull(constant));
    return pool.size() - 1;
  }

  /** Appends {@code constant} to the literal pool and returns a pointer to it. */
  public Atom.PointerLiteral pooledString(String constant) {
    return Atom.pooledString(addString(constant));
  }

  public String string(int index) {
    checkElementIndex(index, pool.size(), "literal pool index");
    return pool.get(index);
  }

  public List<String> pool() {
    return Collections.unmodifiableList(pool);
  }

  @Override
  public <T> T acceptVisitor(IrVisitor<T> visitor) {
    return visitor.visitFunctionRecord(this);
  }
}
