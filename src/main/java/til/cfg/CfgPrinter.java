package til.cfg;

import static til.ir.ExpressionPrinter.indent;
import static til.ir.ExpressionPrinter.reference;

import java.util.Optional;
import til.ir.Instruction;

/**
 * Renders a CFG block by block, annotated with immediate (post-)dominators. Normalized CFGs are
 * followed by both trees.
 */
public class CfgPrinter {

  public String print(Scfg cfg) {
    StringBuilder sb = new StringBuilder();
    for (BasicBlock block : cfg.blocks()) {
      sb.append(block)
          .append(": idom ")
          .append(name(block.immediateDominator()))
          .append(", ipdom ")
          .append(name(block.immediatePostDominator()))
          .append(", preds ")
          .append(block.predecessors())
          .append(System.lineSeparator());
      for (Instruction phi : block.phis()) {
        appendInstruction(sb, phi);
      }
      for (Instruction instruction : block.instructions()) {
        appendInstruction(sb, instruction);
      }
      if (block.terminator().isPresent()) {
        sb.append(indent(1)).append(block.terminator().get()).append(System.lineSeparator());
      } else {
        sb.append(indent(1)).append("<open>").append(System.lineSeparator());
      }
    }
    if (!cfg.blocks().isEmpty() && cfg.entry.blockId() == 0) {
      sb.append("dominators ")
          .append(DominanceTree.dominators(cfg))
          .append(System.lineSeparator())
          .append("post-dominators ")
          .append(DominanceTree.postDominators(cfg))
          .append(System.lineSeparator());
    }
    return sb.toString();
  }

  private static void appendInstruction(StringBuilder sb, Instruction instruction) {
    sb.append(indent(1))
        .append(reference(instruction))
        .append(" = ")
        .append(instruction)
        .append(System.lineSeparator());
  }

  private static String name(Optional<BasicBlock> block) {
    return block.map(BasicBlock::toString).orElse("-");
  }
}
