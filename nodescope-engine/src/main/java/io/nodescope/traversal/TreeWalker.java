package io.nodescope.traversal;

import io.nodescope.api.NodeHandle;
import io.nodescope.core.ChildEnumerator;
import io.nodescope.core.ChildEnumerator.Children;
import io.nodescope.core.PointerNormalizer;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Depth-first walk over a tree-shaped structure driven by an explicit stack, so stack usage does
 * not depend on the depth of the foreign structure.
 *
 * <p>Each frame holds the node's children and a cursor into them. The node itself is emitted when
 * the cursor reaches its emit position: 0 for pre-order, the in-order split, or the child count
 * for post-order. This reproduces the recursive visiting orders exactly.
 *
 * <p>A node is entered only if the sink is not full, its address is non-zero and it has not been
 * visited during this walk. Revisits are reported to the sink and never expanded.
 */
final class TreeWalker {

  private TreeWalker() {}

  /** Receives the nodes of a walk in visiting order. */
  interface Sink {

    /** Once true, nothing further is emitted and the walk ends. */
    boolean isFull();

    /** Emits a visited node. */
    void node(long address, NodeHandle record);

    /** Reports an address reached again during the walk. */
    void revisit(long address);
  }

  private static final class Frame {
    final long address;
    final NodeHandle record;
    final List<NodeHandle> children;
    final int emitAt;
    int cursor;
    boolean emitted;

    Frame(long address, NodeHandle record, List<NodeHandle> children, int emitAt) {
      this.address = address;
      this.record = record;
      this.children = children;
      this.emitAt = emitAt;
    }
  }

  /**
   * Walks the structure below {@code root}.
   *
   * @param root root handle, may be null
   * @param emitPosition index of the child before which a node is emitted
   * @param sink receives nodes and revisits
   */
  static void walk(NodeHandle root, ToIntFunction<Children> emitPosition, Sink sink) {
    LongOpenHashSet visited = new LongOpenHashSet();
    Deque<Frame> stack = new ArrayDeque<>();

    Frame first = enter(root, emitPosition, visited, sink);
    if (first != null) {
      stack.push(first);
    }

    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      if (!top.emitted && top.cursor == top.emitAt) {
        top.emitted = true;
        if (!sink.isFull()) {
          sink.node(top.address, top.record);
        }
      }
      if (sink.isFull()) {
        // the bound only grows, so no pending frame can emit anything
        return;
      }
      if (top.cursor < top.children.size()) {
        Frame child = enter(top.children.get(top.cursor++), emitPosition, visited, sink);
        if (child != null) {
          stack.push(child);
        }
      } else {
        stack.pop();
      }
    }
  }

  private static Frame enter(
      NodeHandle handle,
      ToIntFunction<Children> emitPosition,
      LongOpenHashSet visited,
      Sink sink) {
    if (sink.isFull()) {
      return null;
    }
    long address = PointerNormalizer.address(handle);
    if (address == 0L) {
      return null;
    }
    if (!visited.add(address)) {
      sink.revisit(address);
      return null;
    }
    NodeHandle record = PointerNormalizer.dereference(handle);
    if (record == null) {
      return null;
    }
    Children children = ChildEnumerator.children(record);
    return new Frame(address, record, children.handles(), emitPosition.applyAsInt(children));
  }
}
