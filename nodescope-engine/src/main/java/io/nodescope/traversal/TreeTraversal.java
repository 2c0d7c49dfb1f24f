package io.nodescope.traversal;

import io.nodescope.api.DotGraph;
import io.nodescope.api.NodeHandle;
import io.nodescope.api.TraversalMetadata;
import io.nodescope.api.TraversalOrder;
import io.nodescope.api.TraversalResult;
import io.nodescope.api.TraversalStrategy;
import io.nodescope.core.ChildEnumerator.Children;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.core.ValueSummarizer;
import io.nodescope.export.StructuralExporter;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for tree strategies. Subclasses only decide where a node's own value falls among its
 * children; summaries, address ordering and structural export share one walk.
 */
public abstract class TreeTraversal implements TraversalStrategy {

  private static final Logger LOG = LoggerFactory.getLogger(TreeTraversal.class);

  /** Returns the visiting order this strategy implements. */
  public abstract TraversalOrder order();

  /** Number of leading children whose subtrees are visited before the node itself. */
  protected abstract int emitPosition(Children children);

  @Override
  public String name() {
    return order().id();
  }

  @Override
  public TraversalResult traverse(NodeHandle root, int maxItems) {
    requireNonNegative(maxItems);
    if (PointerNormalizer.address(root) == 0L) {
      return TraversalResult.empty();
    }

    List<String> values = new ArrayList<>();
    TreeWalker.walk(
        root,
        this::emitPosition,
        new TreeWalker.Sink() {
          @Override
          public boolean isFull() {
            return values.size() >= maxItems;
          }

          @Override
          public void node(long address, NodeHandle record) {
            values.add(ValueSummarizer.summarizeNode(record));
          }

          @Override
          public void revisit(long address) {
            LOG.debug("{} traversal revisited 0x{}", name(), Long.toHexString(address));
            values.add(TraversalResult.CYCLE);
          }
        });

    boolean truncated = values.size() >= maxItems;
    LOG.debug("{} traversal produced {} values (truncated={})", name(), values.size(), truncated);
    return new TraversalResult(values, TraversalMetadata.truncated(truncated));
  }

  @Override
  public LongList orderedAddresses(NodeHandle root) {
    LongArrayList addresses = new LongArrayList();
    if (PointerNormalizer.address(root) == 0L) {
      return addresses;
    }
    TreeWalker.walk(
        root,
        this::emitPosition,
        new TreeWalker.Sink() {
          @Override
          public boolean isFull() {
            return false;
          }

          @Override
          public void node(long address, NodeHandle record) {
            addresses.add(address);
          }

          @Override
          public void revisit(long address) {}
        });
    return addresses;
  }

  @Override
  public DotGraph toGraph(NodeHandle root, boolean annotate) {
    return StructuralExporter.tree(root, annotate ? orderedAddresses(root) : null);
  }

  static void requireNonNegative(int maxItems) {
    if (maxItems < 0) {
      throw new IllegalArgumentException("maxItems must not be negative: " + maxItems);
    }
  }
}
