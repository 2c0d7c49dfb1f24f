package io.nodescope.export;

import io.nodescope.api.DotGraph;
import io.nodescope.api.GraphEdge;
import io.nodescope.api.GraphNode;
import io.nodescope.api.NodeHandle;
import io.nodescope.core.ChildEnumerator;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.core.ValueSummarizer;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports the parent/child structure of a tree as nodes and edges.
 *
 * <p>The walk is depth-first and visited-guarded: every reachable node is declared once, labelled
 * with its value summary. For each child with a non-zero address an edge is emitted before the
 * child is expanded, so shared subtrees and back references show up as extra edges to an
 * already-declared node.
 */
public final class StructuralExporter {

  private static final Logger LOG = LoggerFactory.getLogger(StructuralExporter.class);

  private StructuralExporter() {}

  private static final class Frame {
    final long address;
    final List<NodeHandle> children;
    int cursor;

    Frame(long address, List<NodeHandle> children) {
      this.address = address;
      this.children = children;
    }
  }

  /**
   * Exports a tree.
   *
   * @param root root handle, may be null
   * @param order addresses in traversal order; when non-null, labels are prefixed with the node's
   *     1-based position ({@code "3: value"})
   * @return the graph, empty for a null root
   */
  public static DotGraph tree(NodeHandle root, LongList order) {
    if (root == null || !root.isValid()) {
      return DotGraph.empty();
    }

    Long2IntOpenHashMap positions = new Long2IntOpenHashMap();
    if (order != null) {
      for (int i = 0; i < order.size(); i++) {
        positions.putIfAbsent(order.getLong(i), i + 1);
      }
    }

    List<GraphNode> nodes = new ArrayList<>();
    Set<GraphEdge> edges = new LinkedHashSet<>();
    LongOpenHashSet visited = new LongOpenHashSet();
    Deque<Frame> stack = new ArrayDeque<>();

    Frame first = declare(root, positions, visited, nodes);
    if (first != null) {
      stack.push(first);
    }
    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      if (top.cursor >= top.children.size()) {
        stack.pop();
        continue;
      }
      NodeHandle child = top.children.get(top.cursor++);
      long childAddress = PointerNormalizer.address(child);
      if (childAddress == 0L) {
        continue;
      }
      edges.add(new GraphEdge(top.address, childAddress));
      Frame next = declare(child, positions, visited, nodes);
      if (next != null) {
        stack.push(next);
      }
    }

    LOG.debug("Exported tree with {} nodes and {} edges", nodes.size(), edges.size());
    return new DotGraph(nodes, new ArrayList<>(edges));
  }

  private static Frame declare(
      NodeHandle handle,
      Long2IntOpenHashMap positions,
      LongOpenHashSet visited,
      List<GraphNode> nodes) {
    long address = PointerNormalizer.address(handle);
    if (address == 0L || !visited.add(address)) {
      return null;
    }
    NodeHandle record = PointerNormalizer.dereference(handle);
    if (record == null) {
      return null;
    }
    String label = ValueSummarizer.summarizeNode(record);
    int position = positions.get(address);
    if (position > 0) {
      label = position + ": " + label;
    }
    nodes.add(new GraphNode(address, label));
    return new Frame(address, ChildEnumerator.children(record).handles());
  }
}
