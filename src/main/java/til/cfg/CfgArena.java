package til.cfg;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import til.InternalConsistencyError;
import til.ir.Expression;

/**
 * Owns every block allocated while lowering one CFG. Blocks refer to each other only through the
 * integer handles handed out here. Nothing is ever freed individually; the arena goes away together
 * with the CFG.
 */
public class CfgArena {

  private final List<BasicBlock> blocks = new ArrayList<>();

  public BasicBlock newBlock(int arity) {
    checkArgument(arity >= 0, "Negative arity %s", arity);
    BasicBlock block = new BasicBlock(this, blocks.size(), arity);
    blocks.add(block);
    return block;
  }

  public BasicBlock block(int handle) {
    checkElementIndex(handle, blocks.size(), "block handle");
    return blocks.get(handle);
  }

  /** Number of blocks ever allocated, including those that never made it into a CFG. */
  public int size() {
    return blocks.size();
  }

  /**
   * Wires up a jump from {@code source} to {@code target}: {@code source} becomes a new predecessor
   * of {@code target} and the arguments are written into the phi slots of that edge. The caller
   * still has to finish {@code source} with the returned terminator.
   *
   * @throws InternalConsistencyError if the argument count differs from the target's arity
   */
  public Expression.Goto newGoto(
      BasicBlock source, BasicBlock target, List<? extends Expression> arguments) {
    if (arguments.size() != target.arity()) {
      throw InternalConsistencyError.format(
          "Jump from %s to %s passes %d arguments, but the target takes %d",
          source, target, arguments.size(), target.arity());
    }
    int slot = target.addPredecessor(source);
    for (int i = 0; i < arguments.size(); i++) {
      target.argument(i).setValue(slot, arguments.get(i));
    }
    return new Expression.Goto(this, target.handle, slot);
  }

  /** @throws InternalConsistencyError if one of the targets expects arguments */
  public Expression.Branch newBranch(
      BasicBlock source, Expression condition, BasicBlock thenBlock, BasicBlock elseBlock) {
    for (BasicBlock target : new BasicBlock[] {thenBlock, elseBlock}) {
      if (target.arity() != 0) {
        throw InternalConsistencyError.format(
            "Branch from %s targets %s, which takes %d arguments", source, target, target.arity());
      }
    }
    thenBlock.addPredecessor(source);
    elseBlock.addPredecessor(source);
    return new Expression.Branch(this, condition, thenBlock.handle, elseBlock.handle);
  }

  public Expression.Return newReturn(@Nullable Expression value) {
    return new Expression.Return(value);
  }
}
