package til.cfg;

import java.util.List;

/** A raw CFG, its blocks in generation order and their successors by generation index. */
class GeneratedCfg {
  final Scfg cfg;
  final List<BasicBlock> blocks;
  final List<List<Integer>> successors;
  final boolean cyclic;

  GeneratedCfg(
      Scfg cfg, List<BasicBlock> blocks, List<List<Integer>> successors, boolean cyclic) {
    this.cfg = cfg;
    this.blocks = blocks;
    this.successors = successors;
    this.cyclic = cyclic;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(cyclic ? "cyclic" : "acyclic");
    for (int i = 0; i < successors.size(); i++) {
      sb.append(' ').append(i).append("->").append(successors.get(i));
    }
    return sb.toString();
  }
}
