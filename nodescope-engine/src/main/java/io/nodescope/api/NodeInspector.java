package io.nodescope.api;

import io.nodescope.core.GraphNodeSummarizer;
import io.nodescope.export.GraphExporter;
import io.nodescope.traversal.InOrderTraversal;
import io.nodescope.traversal.LinearTraversal;
import io.nodescope.traversal.PostOrderTraversal;
import io.nodescope.traversal.PreOrderTraversal;
import io.nodescope.traversal.TreeTraversal;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for inspecting pointer-linked structures.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * InspectorOptions options = InspectorOptions.builder()
 *     .maxSummaryItems(20)
 *     .treeTraversalStrategy(TraversalOrder.INORDER)
 *     .build();
 *
 * TraversalResult list = NodeInspector.summarizeList(headPointer, options);
 * if (list.metadata().truncated()) {
 *   // more nodes than maxSummaryItems
 * }
 *
 * DotGraph tree = NodeInspector.exportTree(rootPointer, TraversalOrder.POSTORDER);
 * tree.nodeLines().forEach(System.out::println);
 * tree.edgeLines().forEach(System.out::println);
 * }</pre>
 *
 * <p>All calls are synchronous and run to completion on the calling thread. Each call reads the
 * options it is given once; nothing is retained between calls.
 */
public final class NodeInspector {

  private static final Logger LOG = LoggerFactory.getLogger(NodeInspector.class);

  private static final TreeTraversal PREORDER = new PreOrderTraversal();
  private static final TreeTraversal INORDER = new InOrderTraversal();
  private static final TreeTraversal POSTORDER = new PostOrderTraversal();

  private NodeInspector() {}

  /** Returns the tree strategy for the given order. */
  public static TreeTraversal tree(TraversalOrder order) {
    Objects.requireNonNull(order, "order must not be null");
    return switch (order) {
      case PREORDER -> PREORDER;
      case INORDER -> INORDER;
      case POSTORDER -> POSTORDER;
    };
  }

  /** Returns the linear strategy configured by {@code options}. */
  public static LinearTraversal linear(InspectorOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    return new LinearTraversal(options.exportMaxItems());
  }

  /**
   * Summarizes a linked chain, bounded by {@link InspectorOptions#maxSummaryItems()}.
   *
   * @param head pointer to (or record of) the first node, may be null
   * @param options settings for this call
   */
  public static TraversalResult summarizeList(NodeHandle head, InspectorOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    return linear(options).traverse(head, options.maxSummaryItems());
  }

  /**
   * Summarizes a tree in the order selected by {@link InspectorOptions#treeTraversalStrategy()},
   * bounded by {@link InspectorOptions#maxSummaryItems()}.
   *
   * @param root pointer to (or record of) the root node, may be null
   * @param options settings for this call
   */
  public static TraversalResult summarizeTree(NodeHandle root, InspectorOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    TreeTraversal strategy = tree(options.treeTraversalStrategy());
    LOG.debug("Summarizing tree using {} traversal", strategy.name());
    return strategy.traverse(root, options.maxSummaryItems());
  }

  /**
   * Exports the structure of a tree.
   *
   * @param root pointer to (or record of) the root node, may be null
   * @param annotateWith order whose positions prefix node labels, or null for plain labels
   */
  public static DotGraph exportTree(NodeHandle root, TraversalOrder annotateWith) {
    if (annotateWith == null) {
      return PREORDER.toGraph(root, false);
    }
    return tree(annotateWith).toGraph(root, true);
  }

  /**
   * Exports a linked chain as a sequence of nodes, bounded by {@link
   * InspectorOptions#exportMaxItems()}.
   */
  public static DotGraph exportList(NodeHandle head, InspectorOptions options) {
    return linear(options).toGraph(head, false);
  }

  /**
   * Exports an adjacency-list graph.
   *
   * @param graph the graph record or a pointer to it, may be null
   */
  public static DotGraph exportGraph(NodeHandle graph) {
    return GraphExporter.export(graph);
  }

  /**
   * Summarizes one graph node and up to {@link InspectorOptions#maxGraphNeighbors()} neighbors.
   */
  public static GraphNodeSummary summarizeGraphNode(NodeHandle node, InspectorOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    return GraphNodeSummarizer.summarize(node, options.maxGraphNeighbors());
  }
}
