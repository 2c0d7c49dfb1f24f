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

/** Summary for tree containers: {@code size = 3, [2 -> 1 -> 3] (preorder)}. */
public final class TreeFormatter implements SummaryFormatter {

  static final String EMPTY = "Tree is empty";

  @Override
  public String summarize(NodeHandle value, InspectorOptions options, Palette palette) {
    NodeHandle container = PointerNormalizer.dereference(value);
    NodeHandle root = FieldResolver.resolve(container, FieldNames.ROOT);
    if (!PointerNormalizer.isNonNull(root)) {
      return EMPTY;
    }

    TraversalResult result = NodeInspector.summarizeTree(root, options);
    String separator = " " + palette.separator("->") + " ";
    String items =
        result.values().stream().map(palette::item).collect(Collectors.joining(separator));
    if (result.metadata().truncated()) {
      items += " ...";
    }

    String size = LinearContainerFormatter.sizeOf(container);
    String prefix = size.isEmpty() ? "" : palette.size(size) + ", ";
    return prefix + "[" + items + "] (" + options.treeTraversalStrategy().id() + ")";
  }
}
