package til.cfg;

import java.util.List;
import til.InternalConsistencyError;
import til.ir.Expression;
import til.ir.Instruction;

/** Checks that a CFG is in the normal form {@link CfgNormalizer} promises. */
public class CfgVerifier {

  private CfgVerifier() {}

  /** @throws InternalConsistencyError naming the first offending block */
  public static void verify(Scfg cfg) {
    List<BasicBlock> blocks = cfg.blocks();
    if (blocks.isEmpty() || blocks.get(0) != cfg.entry) {
      throw InternalConsistencyError.format("The entry block %s is not ordered first", cfg.entry);
    }
    int expectedId = 1;
    for (int i = 0; i < blocks.size(); i++) {
      BasicBlock block = blocks.get(i);
      if (block.blockId() != i) {
        throw InternalConsistencyError.format("Block %s is listed at index %d", block, i);
      }
      if (!block.isFinished()) {
        throw InternalConsistencyError.format("Block %s has no terminator", block);
      }
      int predecessors = block.predecessors().size();
      for (Expression.Phi phi : block.phis()) {
        if (phi.values().size() != predecessors) {
          throw InternalConsistencyError.format(
              "Phi %s of block %s has %d slots for %d predecessors",
              phi.instrId(), block, phi.values().size(), predecessors);
        }
        if (phi.values().contains(null)) {
          throw InternalConsistencyError.format(
              "Phi %s of block %s has an unwritten slot", phi.instrId(), block);
        }
        expectedId = checkId(phi, block, expectedId);
      }
      for (Instruction instruction : block.instructions()) {
        expectedId = checkId(instruction, block, expectedId);
      }
      expectedId = checkId(block.terminator().get(), block, expectedId);
      for (BasicBlock succ : block.successors()) {
        int id = succ.blockId();
        if (id < 0 || id >= blocks.size() || blocks.get(id) != succ) {
          throw InternalConsistencyError.format(
              "Block %s jumps to %s, which is not part of the CFG", block, succ);
        }
      }
    }
    if (cfg.numInstructions() != expectedId) {
      throw InternalConsistencyError.format(
          "CFG claims %d instructions, but %d were numbered", cfg.numInstructions(), expectedId);
    }
  }

  private static int checkId(Instruction instruction, BasicBlock block, int expectedId) {
    if (instruction.instrId() != expectedId) {
      throw InternalConsistencyError.format(
          "Instruction %s in block %s should have ID %d", instruction, block, expectedId);
    }
    if (instruction.block() != block) {
      throw InternalConsistencyError.format(
          "Instruction %s in block %s is placed in %s", instruction, block, instruction.block());
    }
    return expectedId + 1;
  }
}
