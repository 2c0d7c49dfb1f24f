package io.nodescope.api;

import it.unimi.dsi.fastutil.longs.LongList;

/**
 * A way of walking a pointer-linked structure from a root handle.
 *
 * <p>Every call starts with an empty visited set and expands each canonical address at most once,
 * so calls terminate on cyclic structures. Foreign reads that fail end the current branch; no
 * call throws because of the structure it walks.
 *
 * <p>Strategies are immutable and may be shared.
 */
public interface TraversalStrategy {

  /** Returns a short name for logging and display ("linear", "preorder", ...). */
  String name();

  /**
   * Walks the structure and summarizes each visited node's payload.
   *
   * @param root root handle, may be null or invalid
   * @param maxItems maximum number of value summaries (cycle markers excepted)
   * @return values and metadata; {@link TraversalResult#empty()} for a null root
   * @throws IllegalArgumentException if {@code maxItems} is negative
   */
  TraversalResult traverse(NodeHandle root, int maxItems);

  /**
   * Performs the same walk as {@link #traverse} but records canonical addresses instead of values,
   * with no item bound and no cycle marker. Used to annotate structural exports.
   *
   * @param root root handle, may be null or invalid
   * @return addresses in visiting order
   */
  LongList orderedAddresses(NodeHandle root);

  /**
   * Exports the structure as a node/edge graph.
   *
   * @param root root handle, may be null or invalid
   * @param annotate prefix each node label with its 1-based position in this strategy's order
   * @return the graph; empty for a null root
   */
  DotGraph toGraph(NodeHandle root, boolean annotate);
}
