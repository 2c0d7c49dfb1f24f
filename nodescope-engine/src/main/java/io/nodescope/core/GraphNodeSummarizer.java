package io.nodescope.core;

import io.nodescope.api.GraphNodeSummary;
import io.nodescope.api.NodeHandle;
import io.nodescope.api.TraversalResult;
import java.util.ArrayList;
import java.util.List;

/** Summarizes one adjacency-list node: its value and the values of its first neighbors. */
public final class GraphNodeSummarizer {

  private GraphNodeSummarizer() {}

  /**
   * @param node the node record or a pointer to it, may be null
   * @param maxNeighbors maximum neighbors to summarize
   * @return the summary; value {@link TraversalResult#INVALID} for an unreadable node
   */
  public static GraphNodeSummary summarize(NodeHandle node, int maxNeighbors) {
    if (maxNeighbors < 0) {
      throw new IllegalArgumentException("maxNeighbors must not be negative: " + maxNeighbors);
    }
    NodeHandle record = PointerNormalizer.dereference(node);
    if (record == null) {
      return new GraphNodeSummary(TraversalResult.INVALID, List.of(), false);
    }
    String value = ValueSummarizer.summarizeNode(record);

    NodeHandle neighbors = FieldResolver.resolve(record, FieldNames.NEIGHBORS);
    if (neighbors == null || !neighbors.isValid()) {
      return new GraphNodeSummary(value, List.of(), false);
    }
    int degree = neighbors.numChildren();
    List<String> values = new ArrayList<>();
    for (int i = 0; i < Math.min(degree, maxNeighbors); i++) {
      NodeHandle neighbor = PointerNormalizer.dereference(neighbors.childAt(i));
      if (neighbor != null) {
        values.add(ValueSummarizer.summarizeNode(neighbor));
      }
    }
    return new GraphNodeSummary(value, values, degree > maxNeighbors);
  }
}
