package io.nodescope.shell.format;

import io.nodescope.api.InspectorOptions;
import io.nodescope.api.NodeHandle;
import io.nodescope.api.NodeInspector;
import io.nodescope.api.TraversalResult;
import io.nodescope.core.FieldNames;
import io.nodescope.core.FieldResolver;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.shell.render.Palette;
import java.util.stream.Collectors;

/**
 * Summary for linked lists, stacks and queues: {@code size = 3, [1 -> 2 -> 3]}. Doubly linked
 * chains use {@code <->}; a truncated listing ends with {@code -> ...}. The size prefix is omitted
 * when the container declares no count member.
 */
public final class LinearContainerFormatter implements SummaryFormatter {

  static final String NO_HEAD = "Error: Could not find head pointer member.";
  static final String EMPTY = "size = 0, []";

  @Override
  public String summarize(NodeHandle value, InspectorOptions options, Palette palette) {
    NodeHandle container = PointerNormalizer.dereference(value);
    NodeHandle head = FieldResolver.resolve(container, FieldNames.HEAD);
    if (head == null) {
      return NO_HEAD;
    }
    if (!PointerNormalizer.isNonNull(head)) {
      return EMPTY;
    }

    TraversalResult result = NodeInspector.summarizeList(head, options);
    String arrow = result.metadata().doublyLinked() ? "<->" : "->";
    String separator = " " + palette.separator(arrow) + " ";

    String items =
        result.values().stream().map(palette::item).collect(Collectors.joining(separator));
    if (result.metadata().truncated()) {
      items += separator + "...";
    }
    String size = sizeOf(container);
    String prefix = size.isEmpty() ? "" : palette.size(size) + ", ";
    return prefix + "[" + items + "]";
  }

  static String sizeOf(NodeHandle container) {
    NodeHandle size = FieldResolver.resolve(container, FieldNames.SIZE);
    if (size == null || !size.isValid() || size.rawValue() == null) {
      return "";
    }
    return "size = " + size.rawValue();
  }
}
