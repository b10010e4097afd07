package til.cfg;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import org.jooq.lambda.Seq;

/**
 * The dominator or post-dominator tree of a normalized CFG, read off its blocks' pre-order node
 * IDs. Nothing is copied: parents and ancestry come straight from the blocks.
 */
public class DominanceTree {

  private final List<BasicBlock> preorder;
  private final Function<BasicBlock, Optional<BasicBlock>> parent;
  private final BiPredicate<BasicBlock, BasicBlock> isAncestor;

  private DominanceTree(
      Scfg cfg,
      ToIntFunction<BasicBlock> nodeId,
      Function<BasicBlock, Optional<BasicBlock>> parent,
      BiPredicate<BasicBlock, BasicBlock> isAncestor) {
    this.preorder = Seq.seq(cfg.blocks()).sorted(Comparator.comparingInt(nodeId)).toList();
    this.parent = parent;
    this.isAncestor = isAncestor;
  }

  public static DominanceTree dominators(Scfg cfg) {
    return new DominanceTree(
        cfg, BasicBlock::dominatorNodeId, BasicBlock::immediateDominator, BasicBlock::dominates);
  }

  public static DominanceTree postDominators(Scfg cfg) {
    return new DominanceTree(
        cfg,
        BasicBlock::postDominatorNodeId,
        BasicBlock::immediatePostDominator,
        BasicBlock::postDominates);
  }

  public BasicBlock root() {
    return preorder.get(0);
  }

  /** Blocks in node ID order, which is a pre-order walk of the tree. */
  public List<BasicBlock> preorder() {
    return preorder;
  }

  /** Children of {@code block}, in pre-order. */
  public List<BasicBlock> children(BasicBlock block) {
    Optional<BasicBlock> self = Optional.of(block);
    return Seq.seq(preorder).filter(b -> parent.apply(b).equals(self)).toList();
  }

  /** Block IDs as an S-expression, e.g. {@code (0 (3 (4)) (2) (1))}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    Deque<BasicBlock> open = new ArrayDeque<>();
    for (BasicBlock block : preorder) {
      while (!open.isEmpty() && !isAncestor.test(open.peek(), block)) {
        open.pop();
        sb.append(')');
      }
      if (!open.isEmpty()) {
        sb.append(' ');
      }
      sb.append('(').append(block.blockId());
      open.push(block);
    }
    while (!open.isEmpty()) {
      open.pop();
      sb.append(')');
    }
    return sb.toString();
  }
}
