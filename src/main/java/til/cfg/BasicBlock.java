package til.cfg;

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.Seq;
import til.InternalConsistencyError;
import til.ir.Expression;
import til.ir.Instruction;
import til.ir.Terminator;

/**
 * A basic block: phi arguments, straight-line instructions and exactly one terminator.
 *
 * <p>The number of phis (the arity) is fixed at creation. Every phi carries one slot per
 * predecessor, so {@link #addPredecessor(BasicBlock)} grows all of them at once. After {@link
 * #finish(List, Terminator)} the instruction list and terminator never change, but predecessors
 * may still be added when some later block jumps back here.
 *
 * <p>Block IDs and the dominator trees are only meaningful after {@link
 * CfgNormalizer#computeNormalForm(Scfg)}.
 */
public class BasicBlock {

  public static final int UNNUMBERED = -1;

  private final CfgArena arena;
  public final int handle;
  private final List<Expression.Phi> phis;
  private final List<Instruction> instructions = new ArrayList<>();
  @Nullable private Terminator terminator;
  private final List<Integer> predecessors = new ArrayList<>();

  final TopologyNode dominatorNode = new TopologyNode();
  final TopologyNode postDominatorNode = new TopologyNode();
  int blockId = UNNUMBERED;
  int postBlockId = UNNUMBERED;
  boolean visited;

  BasicBlock(CfgArena arena, int handle, int arity) {
    this.arena = arena;
    this.handle = handle;
    List<Expression.Phi> phis = new ArrayList<>(arity);
    for (int i = 0; i < arity; i++) {
      phis.add(new Expression.Phi(this));
    }
    this.phis = Collections.unmodifiableList(phis);
  }

  public CfgArena arena() {
    return arena;
  }

  public int arity() {
    return phis.size();
  }

  public List<Expression.Phi> phis() {
    return phis;
  }

  public Expression.Phi argument(int i) {
    checkElementIndex(i, phis.size(), "block argument");
    return phis.get(i);
  }

  public List<Instruction> instructions() {
    return Collections.unmodifiableList(instructions);
  }

  public Optional<Terminator> terminator() {
    return Optional.ofNullable(terminator);
  }

  public boolean isFinished() {
    return terminator != null;
  }

  /**
   * Registers {@code predecessor} as the next incoming edge and opens a fresh slot in every phi.
   *
   * @return the slot index of the new edge
   */
  public int addPredecessor(BasicBlock predecessor) {
    predecessors.add(predecessor.handle);
    for (Expression.Phi phi : phis) {
      phi.addSlot();
    }
    return predecessors.size() - 1;
  }

  public List<BasicBlock> predecessors() {
    return Seq.seq(predecessors).map(arena::block).toList();
  }

  public List<BasicBlock> successors() {
    if (terminator == null) {
      return ImmutableList.of();
    }
    return Seq.seq(terminator.successorHandles()).map(arena::block).toList();
  }

  /**
   * Freezes this block.
   *
   * @throws InternalConsistencyError if the block was finished before
   */
  public void finish(List<? extends Instruction> body, Terminator terminator) {
    if (isFinished()) {
      throw InternalConsistencyError.format("Block %s is already finished", this);
    }
    for (Instruction instruction : body) {
      instruction.setBlock(this);
      instructions.add(instruction);
    }
    terminator.setBlock(this);
    this.terminator = terminator;
  }

  /** Position in topological order, or {@link #UNNUMBERED}. */
  public int blockId() {
    return blockId;
  }

  /** Position in post-topological order (ordered from the exit), or {@link #UNNUMBERED}. */
  public int postBlockId() {
    return postBlockId;
  }

  /** Whether every path from the entry to {@code other} passes through this block. */
  public boolean dominates(BasicBlock other) {
    return dominatorNode.isAncestorOf(other.dominatorNode);
  }

  /** Whether every path from {@code other} to the exit passes through this block. */
  public boolean postDominates(BasicBlock other) {
    return postDominatorNode.isAncestorOf(other.postDominatorNode);
  }

  public Optional<BasicBlock> immediateDominator() {
    return parentOf(dominatorNode);
  }

  public Optional<BasicBlock> immediatePostDominator() {
    return parentOf(postDominatorNode);
  }

  private Optional<BasicBlock> parentOf(TopologyNode node) {
    if (!node.hasParent()) {
      return Optional.empty();
    }
    return Optional.of(arena.block(node.parent));
  }

  /** Pre-order index in the dominator tree. */
  public int dominatorNodeId() {
    return dominatorNode.nodeId;
  }

  public int postDominatorNodeId() {
    return postDominatorNode.nodeId;
  }

  @Override
  public String toString() {
    if (blockId != UNNUMBERED) {
      return "b" + blockId;
    }
    return "@" + handle;
  }
}
