package til.cfg;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import til.ir.Binding;

/**
 * A control-flow graph with a distinguished entry (taking no arguments) and exit (taking the
 * result as its single argument).
 *
 * <p>While lowering, {@link #blocks()} lists blocks in the order they were opened. After
 * normalization the list is dense and topologically ordered: {@code blocks().get(b.blockId()) ==
 * b}.
 */
public class Scfg {

  public final CfgArena arena;
  public final BasicBlock entry;
  public final BasicBlock exit;
  private final List<Binding> parameters;
  private List<BasicBlock> blocks = new ArrayList<>();
  private int numInstructions;

  private Scfg(CfgArena arena, BasicBlock entry, BasicBlock exit, List<Binding> parameters) {
    this.arena = arena;
    this.entry = entry;
    this.exit = exit;
    this.parameters = ImmutableList.copyOf(parameters);
  }

  public static Scfg create(CfgArena arena) {
    return create(arena, ImmutableList.of());
  }

  public static Scfg create(CfgArena arena, List<Binding> parameters) {
    return new Scfg(arena, arena.newBlock(0), arena.newBlock(1), parameters);
  }

  public void addBlock(BasicBlock block) {
    checkArgument(block.arena() == arena, "Block %s belongs to a different arena", block);
    blocks.add(block);
  }

  public List<BasicBlock> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  public BasicBlock block(int blockId) {
    checkElementIndex(blockId, blocks.size(), "block ID");
    return blocks.get(blockId);
  }

  void setBlocks(List<BasicBlock> blocks) {
    this.blocks = blocks;
  }

  /** Parameters of the function this CFG was lowered from. */
  public List<Binding> parameters() {
    return parameters;
  }

  /** One past the largest instruction ID, so it can size ID-indexed tables. */
  public int numInstructions() {
    return numInstructions;
  }

  void setNumInstructions(int numInstructions) {
    this.numInstructions = numInstructions;
  }

  @Override
  public String toString() {
    return new CfgPrinter().print(this);
  }
}
