package io.nodescope.shell.render;

import io.nodescope.api.NodeHandle;
import io.nodescope.api.TraversalResult;
import io.nodescope.core.ChildEnumerator;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.core.ValueSummarizer;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Draws a tree in pre-order with box-drawing connectors:
 *
 * <pre>
 * └── 8
 *     ├── 3
 *     │   ├── 1
 *     │   └── 6
 *     └── 10
 * </pre>
 *
 * A node reached a second time is drawn as {@code [CYCLE]} and not expanded.
 */
public final class TreeDrawer {

  static final String BRANCH = "├── ";
  static final String LAST_BRANCH = "└── ";
  static final String PIPE = "│   ";
  static final String SPACE = "    ";

  private TreeDrawer() {}

  private record Pending(NodeHandle handle, String prefix, boolean last) {}

  /**
   * Renders the tree below {@code root}.
   *
   * @param root pointer to (or record of) the root, may be null
   * @param palette colours for values and markers
   * @param maxLines bound on the number of node lines; a final {@code ...} line marks the cut
   * @return the drawing, one element per line; empty for a null root
   */
  public static List<String> draw(NodeHandle root, Palette palette, int maxLines) {
    List<String> lines = new ArrayList<>();
    LongOpenHashSet visited = new LongOpenHashSet();
    Deque<Pending> stack = new ArrayDeque<>();
    stack.push(new Pending(root, "", true));

    while (!stack.isEmpty()) {
      Pending next = stack.pop();
      long address = PointerNormalizer.address(next.handle());
      if (address == 0L) {
        continue;
      }
      if (lines.size() >= maxLines) {
        lines.add("...");
        break;
      }
      String connector = next.prefix() + (next.last() ? LAST_BRANCH : BRANCH);
      if (!visited.add(address)) {
        lines.add(connector + palette.marker(TraversalResult.CYCLE));
        continue;
      }
      NodeHandle record = PointerNormalizer.dereference(next.handle());
      if (record == null) {
        continue;
      }
      lines.add(connector + palette.value(ValueSummarizer.summarizeNode(record)));

      List<NodeHandle> children = ChildEnumerator.children(record).handles();
      String childPrefix = next.prefix() + (next.last() ? SPACE : PIPE);
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new Pending(children.get(i), childPrefix, i == children.size() - 1));
      }
    }
    return lines;
  }
}
