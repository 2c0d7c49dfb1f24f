package io.nodescope.traversal;

import io.nodescope.api.DotGraph;
import io.nodescope.api.GraphEdge;
import io.nodescope.api.GraphNode;
import io.nodescope.api.InspectorOptions;
import io.nodescope.api.NodeHandle;
import io.nodescope.api.TraversalMetadata;
import io.nodescope.api.TraversalResult;
import io.nodescope.api.TraversalStrategy;
import io.nodescope.core.FieldNames;
import io.nodescope.core.FieldResolver;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.core.ValueSummarizer;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks singly and doubly linked chains by following the next pointer.
 *
 * <p>The next, value and previous members are resolved once on the head node and reused for every
 * node of the chain. The walk stops at a null next pointer, when {@code maxItems} values have been
 * produced (metadata {@code truncated}), or on reaching an address already visited (a single
 * {@link TraversalResult#CYCLE_DETECTED} marker, not counted against the bound).
 */
public final class LinearTraversal implements TraversalStrategy {

  private static final Logger LOG = LoggerFactory.getLogger(LinearTraversal.class);

  private final int exportMaxItems;

  /** Uses the default {@link InspectorOptions#exportMaxItems()} for exports. */
  public LinearTraversal() {
    this(InspectorOptions.DEFAULT.exportMaxItems());
  }

  /**
   * @param exportMaxItems bound on the nodes walked by {@link #toGraph}
   */
  public LinearTraversal(int exportMaxItems) {
    TreeTraversal.requireNonNegative(exportMaxItems);
    this.exportMaxItems = exportMaxItems;
  }

  /** Receives the links of a chain in order. */
  private interface LinkVisitor {
    void link(long address, String value);

    void cycle(long address);

    void unresolved();
  }

  @Override
  public String name() {
    return "linear";
  }

  @Override
  public TraversalResult traverse(NodeHandle root, int maxItems) {
    TreeTraversal.requireNonNegative(maxItems);
    List<String> values = new ArrayList<>();
    TraversalMetadata metadata =
        walk(
            root,
            maxItems,
            new LinkVisitor() {
              @Override
              public void link(long address, String value) {
                values.add(value);
              }

              @Override
              public void cycle(long address) {
                values.add(TraversalResult.CYCLE_DETECTED);
              }

              @Override
              public void unresolved() {
                values.add(TraversalResult.STRUCTURE_UNRESOLVED);
              }
            });
    return new TraversalResult(values, metadata);
  }

  @Override
  public LongList orderedAddresses(NodeHandle root) {
    LongArrayList addresses = new LongArrayList();
    walk(
        root,
        Integer.MAX_VALUE,
        new LinkVisitor() {
          @Override
          public void link(long address, String value) {
            addresses.add(address);
          }

          @Override
          public void cycle(long address) {}

          @Override
          public void unresolved() {}
        });
    return addresses;
  }

  /**
   * Exports the chain as consecutive nodes joined by edges. A cycle shows as an edge from the last
   * node back to the revisited one.
   */
  @Override
  public DotGraph toGraph(NodeHandle root, boolean annotate) {
    List<GraphNode> nodes = new ArrayList<>();
    List<GraphEdge> edges = new ArrayList<>();
    walk(
        root,
        exportMaxItems,
        new LinkVisitor() {
          private long previous;

          @Override
          public void link(long address, String value) {
            String label = annotate ? (nodes.size() + 1) + ": " + value : value;
            nodes.add(new GraphNode(address, label));
            if (previous != 0L) {
              edges.add(new GraphEdge(previous, address));
            }
            previous = address;
          }

          @Override
          public void cycle(long address) {
            if (previous != 0L) {
              edges.add(new GraphEdge(previous, address));
            }
          }

          @Override
          public void unresolved() {}
        });
    return new DotGraph(nodes, edges);
  }

  private TraversalMetadata walk(NodeHandle root, int maxItems, LinkVisitor visitor) {
    if (PointerNormalizer.address(root) == 0L) {
      return TraversalMetadata.EMPTY;
    }
    NodeHandle head = PointerNormalizer.dereference(root);
    if (head == null) {
      return TraversalMetadata.EMPTY;
    }

    Optional<String> nextName = FieldResolver.resolveName(head, FieldNames.NEXT);
    Optional<String> valueName = FieldResolver.resolveName(head, FieldNames.VALUE);
    boolean doublyLinked = FieldResolver.isPresent(head, FieldNames.PREV);
    if (nextName.isEmpty() || valueName.isEmpty()) {
      LOG.debug(
          "Cannot resolve chain structure: next={}, value={}",
          nextName.orElse(null),
          valueName.orElse(null));
      visitor.unresolved();
      return TraversalMetadata.EMPTY;
    }

    LongOpenHashSet visited = new LongOpenHashSet();
    NodeHandle current = root;
    int count = 0;
    boolean truncated = false;
    long address;
    while ((address = PointerNormalizer.address(current)) != 0L) {
      if (count >= maxItems) {
        truncated = true;
        break;
      }
      if (!visited.add(address)) {
        LOG.debug("Cycle detected at 0x{} after {} nodes", Long.toHexString(address), count);
        visitor.cycle(address);
        break;
      }
      NodeHandle node = PointerNormalizer.dereference(current);
      if (node == null) {
        break;
      }
      visitor.link(address, ValueSummarizer.summarize(FieldResolver.field(node, valueName.get())));
      count++;
      current = FieldResolver.field(node, nextName.get());
    }
    return new TraversalMetadata(truncated, doublyLinked);
  }
}
