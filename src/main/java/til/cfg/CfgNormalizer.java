package til.cfg;

import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.ObjIntConsumer;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import til.InternalConsistencyError;
import til.ir.Expression;
import til.ir.Instruction;

/**
 * Brings a raw CFG into normal form.
 *
 * <ol>
 *   <li>Sorts blocks post-topologically, starting at the exit and following predecessors.
 *   <li>Computes post-dominators in that order.
 *   <li>Sorts blocks topologically, starting at the entry and following the post-dominator and
 *       then the successors, so that unreachable blocks are dropped.
 *   <li>Renumbers blocks densely and instructions sequentially from 1.
 *   <li>Computes dominators, then subtree sizes and pre-order IDs of both trees.
 * </ol>
 *
 * Both trees are computed by sweeping over a depth-first order of the (reversed, for
 * post-dominators) graph: a block's parent is the nearest common ancestor of all neighbours that
 * already have one. Sweeps repeat until no parent changes.
 *
 * <p>All traversals use explicit stacks, so the CFG's size is not limited by the call stack.
 */
public class CfgNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger("CfgNormalizer");

  private static final Function<BasicBlock, TopologyNode> DOMINATOR = b -> b.dominatorNode;
  private static final Function<BasicBlock, TopologyNode> POST_DOMINATOR =
      b -> b.postDominatorNode;

  private final Scfg cfg;
  private final Set<BasicBlock> listed = Sets.newIdentityHashSet();

  private CfgNormalizer(Scfg cfg) {
    this.cfg = cfg;
    listed.addAll(cfg.blocks());
  }

  /**
   * @throws InternalConsistencyError if some block of the CFG cannot reach the exit or cannot be
   *     reached from the entry, or if a reachable block is missing from {@link Scfg#blocks()}
   */
  public static void computeNormalForm(Scfg cfg) {
    new CfgNormalizer(cfg).normalize();
  }

  private void normalize() {
    List<BasicBlock> blocks = cfg.blocks();
    int n = blocks.size();
    LOGGER.debug("Normalizing CFG with {} blocks", n);
    clearVisited(blocks);

    BasicBlock[] postOrder = new BasicBlock[n];
    int remaining =
        depthFirst(cfg.exit, BasicBlock::predecessors, postOrder, (b, id) -> b.postBlockId = id);
    checkAllVisited(remaining, blocks, "cannot reach the exit");
    clearVisited(blocks);
    computeTree(postOrder, POST_DOMINATOR, BasicBlock::successors);

    BasicBlock[] order = new BasicBlock[n];
    remaining =
        depthFirst(
            cfg.entry,
            CfgNormalizer::postDominatorThenSuccessors,
            order,
            (b, id) -> b.blockId = id);
    checkAllVisited(remaining, blocks, "are unreachable from the entry");
    clearVisited(blocks);

    renumber(order);

    // The topological order also follows post-dominator edges, which are no CFG edges. Dominators
    // need a depth-first order of the CFG itself.
    BasicBlock[] forwardOrder = new BasicBlock[n];
    depthFirst(cfg.entry, BasicBlock::successors, forwardOrder, (b, id) -> {});
    clearVisited(blocks);
    computeTree(forwardOrder, DOMINATOR, BasicBlock::predecessors);

    computeIntervals(forwardOrder, DOMINATOR);
    computeIntervals(postOrder, POST_DOMINATOR);
    LOGGER.debug("Normalized CFG has {} blocks and {} instructions", n, cfg.numInstructions());
  }

  private static void clearVisited(List<BasicBlock> blocks) {
    for (BasicBlock block : blocks) {
      block.visited = false;
    }
  }

  private void checkListed(BasicBlock block) {
    if (!listed.contains(block)) {
      throw InternalConsistencyError.format(
          "Block %s is reachable, but not part of the CFG's block list", block);
    }
  }

  private static void checkAllVisited(int remaining, List<BasicBlock> blocks, String what) {
    if (remaining != 0) {
      List<BasicBlock> orphans = Seq.seq(blocks).filter(b -> !b.visited).toList();
      throw InternalConsistencyError.format("%d blocks %s: %s", remaining, what, orphans);
    }
  }

  private static List<BasicBlock> postDominatorThenSuccessors(BasicBlock block) {
    List<BasicBlock> ret = new ArrayList<>();
    block.immediatePostDominator().ifPresent(ret::add);
    ret.addAll(block.successors());
    return ret;
  }

  private static final class Frame {
    final BasicBlock block;
    final Iterator<BasicBlock> next;

    Frame(BasicBlock block, Iterator<BasicBlock> next) {
      this.block = block;
      this.next = next;
    }
  }

  /**
   * Visits everything reachable from {@code root} via {@code next} depth-first and fills {@code
   * order} from the back as blocks are finished, so that {@code order} ends up in reverse
   * post-order. {@code number} learns each block's index.
   *
   * @return the number of slots of {@code order} left empty
   */
  private int depthFirst(
      BasicBlock root,
      Function<BasicBlock, List<BasicBlock>> next,
      BasicBlock[] order,
      ObjIntConsumer<BasicBlock> number) {
    int count = order.length;
    Deque<Frame> stack = new ArrayDeque<>();
    checkListed(root);
    root.visited = true;
    stack.push(new Frame(root, next.apply(root).iterator()));
    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      if (top.next.hasNext()) {
        BasicBlock child = top.next.next();
        if (!child.visited) {
          checkListed(child);
          child.visited = true;
          stack.push(new Frame(child, next.apply(child).iterator()));
        }
        continue;
      }
      stack.pop();
      order[--count] = top.block;
      number.accept(top.block, count);
    }
    return count;
  }

  private void renumber(BasicBlock[] order) {
    int instrId = 1;
    for (int i = 0; i < order.length; i++) {
      BasicBlock block = order[i];
      block.blockId = i;
      for (Expression.Phi phi : block.phis()) {
        phi.setInstrId(instrId++);
      }
      for (Instruction instruction : block.instructions()) {
        instruction.setInstrId(instrId++);
      }
      if (block.terminator().isPresent()) {
        block.terminator().get().setInstrId(instrId++);
      }
    }
    cfg.setBlocks(Arrays.asList(order));
    cfg.setNumInstructions(instrId);
  }

  /**
   * Computes the parents of {@code tree}, rooted at {@code order[0]}. {@code order} has to be a
   * reverse post-order along the inverse of {@code neighbours}, which guarantees that a block's
   * depth-first parent and every tree ancestor come before it.
   */
  private void computeTree(
      BasicBlock[] order,
      Function<BasicBlock, TopologyNode> tree,
      Function<BasicBlock, List<BasicBlock>> neighbours) {
    int[] rank = new int[cfg.arena.size()];
    for (int i = 0; i < order.length; i++) {
      rank[order[i].handle] = i;
      tree.apply(order[i]).reset();
    }
    BasicBlock root = order[0];
    boolean changed = true;
    int sweeps = 0;
    while (changed) {
      changed = false;
      sweeps++;
      for (int i = 1; i < order.length; i++) {
        BasicBlock block = order[i];
        BasicBlock candidate = null;
        for (BasicBlock neighbour : neighbours.apply(block)) {
          if (neighbour != root && !tree.apply(neighbour).hasParent()) {
            continue;
          }
          candidate =
              candidate == null ? neighbour : commonAncestor(candidate, neighbour, tree, rank);
        }
        if (candidate == null) {
          throw InternalConsistencyError.format(
              "Block %s has no neighbour ordered before it to take its dominator from", block);
        }
        TopologyNode node = tree.apply(block);
        if (node.parent != candidate.handle) {
          node.parent = candidate.handle;
          changed = true;
        }
      }
    }
    LOGGER.debug("Tree of {} blocks stable after {} sweeps", order.length, sweeps);
  }

  private BasicBlock commonAncestor(
      BasicBlock a, BasicBlock b, Function<BasicBlock, TopologyNode> tree, int[] rank) {
    while (a != b) {
      while (rank[a.handle] > rank[b.handle]) {
        a = cfg.arena.block(tree.apply(a).parent);
      }
      while (rank[b.handle] > rank[a.handle]) {
        b = cfg.arena.block(tree.apply(b).parent);
      }
    }
    return a;
  }

  /**
   * Gives every subtree of {@code tree} the interval {@code [nodeId, nodeId + sizeOfSubTree)}.
   * Parents precede their children in {@code order}.
   */
  private void computeIntervals(BasicBlock[] order, Function<BasicBlock, TopologyNode> tree) {
    for (int i = order.length - 1; i >= 0; i--) {
      TopologyNode node = tree.apply(order[i]);
      if (node.hasParent()) {
        TopologyNode parent = tree.apply(cfg.arena.block(node.parent));
        node.nodeId = parent.sizeOfSubTree;
        parent.sizeOfSubTree += node.sizeOfSubTree;
      }
    }
    for (BasicBlock block : order) {
      TopologyNode node = tree.apply(block);
      if (node.hasParent()) {
        node.nodeId += tree.apply(cfg.arena.block(node.parent)).nodeId;
      }
    }
  }
}
