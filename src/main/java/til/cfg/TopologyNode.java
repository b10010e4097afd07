package til.cfg;

/**
 * A block's node in the dominator or post-dominator tree. The parent is an arena handle; {@link
 * #nodeId} is the pre-order position in the tree once normalization is complete, so that the
 * blocks of a subtree occupy the interval {@code [nodeId, nodeId + sizeOfSubTree)}.
 */
final class TopologyNode {

  static final int NO_PARENT = -1;

  int parent = NO_PARENT;
  int nodeId;
  int sizeOfSubTree;

  boolean hasParent() {
    return parent != NO_PARENT;
  }

  /** Interval containment, i.e. whether {@code this} is an ancestor-or-self of {@code other}. */
  boolean isAncestorOf(TopologyNode other) {
    int d = other.nodeId - nodeId;
    return d >= 0 && d < sizeOfSubTree;
  }

  void reset() {
    parent = NO_PARENT;
    nodeId = 0;
    sizeOfSubTree = 1;
  }
}
