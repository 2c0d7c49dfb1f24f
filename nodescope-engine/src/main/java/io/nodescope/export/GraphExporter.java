package io.nodescope.export;

import io.nodescope.api.DotGraph;
import io.nodescope.api.GraphEdge;
import io.nodescope.api.GraphNode;
import io.nodescope.api.NodeHandle;
import io.nodescope.core.FieldNames;
import io.nodescope.core.FieldResolver;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.core.ValueSummarizer;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports an adjacency-list graph: a record holding a container of nodes, each node holding a
 * collection of neighbor pointers.
 *
 * <p>Nodes are declared in container order, each address once. Every distinct node→neighbor edge
 * is emitted once, in the order first seen. Neighbors outside the node container get edges but no
 * declaration.
 */
public final class GraphExporter {

  private static final Logger LOG = LoggerFactory.getLogger(GraphExporter.class);

  private GraphExporter() {}

  /**
   * Exports a graph.
   *
   * @param graph the graph record or a pointer to it, may be null
   * @return the graph; empty if no node container can be resolved
   */
  public static DotGraph export(NodeHandle graph) {
    NodeHandle container = nodeContainer(graph);
    if (container == null) {
      LOG.debug("No node container found on graph");
      return DotGraph.empty();
    }

    List<GraphNode> nodes = new ArrayList<>();
    Set<GraphEdge> edges = new LinkedHashSet<>();
    LongOpenHashSet declared = new LongOpenHashSet();

    int count = container.numChildren();
    for (int i = 0; i < count; i++) {
      NodeHandle element = container.childAt(i);
      NodeHandle node = PointerNormalizer.dereference(element);
      long address = PointerNormalizer.address(element);
      if (node == null || address == 0L) {
        continue;
      }
      if (declared.add(address)) {
        nodes.add(new GraphNode(address, ValueSummarizer.summarizeNode(node)));
      }

      NodeHandle neighbors = FieldResolver.resolve(node, FieldNames.NEIGHBORS);
      if (neighbors == null || !neighbors.isValid()) {
        continue;
      }
      int degree = neighbors.numChildren();
      for (int j = 0; j < degree; j++) {
        long neighborAddress = PointerNormalizer.address(neighbors.childAt(j));
        if (neighborAddress != 0L) {
          edges.add(new GraphEdge(address, neighborAddress));
        }
      }
    }

    LOG.debug("Exported graph with {} nodes and {} edges", nodes.size(), edges.size());
    return new DotGraph(nodes, new ArrayList<>(edges));
  }

  /**
   * Resolves the node container of a graph record.
   *
   * @return the container, or null if the graph is unreadable or declares none
   */
  public static NodeHandle nodeContainer(NodeHandle graph) {
    NodeHandle record = PointerNormalizer.dereference(graph);
    NodeHandle container = FieldResolver.resolve(record, FieldNames.GRAPH_NODES);
    return container != null && container.isValid() ? container : null;
  }
}
