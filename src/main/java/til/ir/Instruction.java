package til.ir;

import org.jetbrains.annotations.Nullable;
import til.cfg.BasicBlock;

/**
 * An expression that occupies a slot in a basic block. Owning block and instruction ID are unset
 * (null and 0, respectively) until the instruction is placed; IDs are only dense after the CFG has
 * been normalized.
 */
public abstract class Instruction extends Expression {

  /** The ID of an instruction that was not numbered yet. */
  public static final int UNNUMBERED = 0;

  @Nullable private BasicBlock block;
  private int instrId = UNNUMBERED;
  /** For debugging purposes only, the let binding (or parameter) this instruction was bound to. */
  private String name = "";

  Instruction() {}

  @Nullable
  public BasicBlock block() {
    return block;
  }

  public boolean isPlaced() {
    return block != null;
  }

  public void setBlock(BasicBlock block) {
    this.block = block;
  }

  public int instrId() {
    return instrId;
  }

  public void setInstrId(int instrId) {
    this.instrId = instrId;
  }

  public String name() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }
}
