package io.nodescope.api;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structural export of a pointer-linked structure: node declarations and edges, each keyed by
 * canonical address and kept in emission order. A node is declared at most once.
 *
 * <p>The line shapes returned by {@link #nodeLines()} and {@link #edgeLines()} are a stable
 * contract for downstream renderers:
 *
 * <pre>
 * Node_&lt;address&gt; [label="&lt;escaped summary&gt;"];
 * Node_&lt;parent&gt; -&gt; Node_&lt;child&gt;;
 * </pre>
 */
public record DotGraph(List<GraphNode> nodes, List<GraphEdge> edges) {

  private static final DotGraph EMPTY = new DotGraph(List.of(), List.of());

  public DotGraph {
    nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
    edges = List.copyOf(Objects.requireNonNull(edges, "edges must not be null"));
  }

  public static DotGraph empty() {
    return EMPTY;
  }

  public List<String> nodeLines() {
    return nodes.stream().map(GraphNode::toDotLine).collect(Collectors.toList());
  }

  public List<String> edgeLines() {
    return edges.stream().map(GraphEdge::toDotLine).collect(Collectors.toList());
  }

  public boolean isEmpty() {
    return nodes.isEmpty() && edges.isEmpty();
  }
}
