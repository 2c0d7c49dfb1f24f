package io.nodescope.api;

import java.util.List;
import java.util.Objects;

/**
 * Value of one adjacency-list graph node together with the values of its first neighbors.
 *
 * @param value the node's own value summary
 * @param neighbors neighbor value summaries, at most {@code maxGraphNeighbors}
 * @param truncated the node has more neighbors than were summarized
 */
public record GraphNodeSummary(String value, List<String> neighbors, boolean truncated) {

  public GraphNodeSummary {
    Objects.requireNonNull(value, "value must not be null");
    neighbors = List.copyOf(Objects.requireNonNull(neighbors, "neighbors must not be null"));
  }
}
