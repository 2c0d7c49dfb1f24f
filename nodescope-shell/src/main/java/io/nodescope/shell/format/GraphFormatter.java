package io.nodescope.shell.format;

import io.nodescope.api.InspectorOptions;
import io.nodescope.api.NodeHandle;
import io.nodescope.core.CandidateFieldSet;
import io.nodescope.core.FieldNames;
import io.nodescope.core.FieldResolver;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.shell.render.Palette;

/**
 * Summary for adjacency-list graphs: {@code Graph | V = 4 | E = 5}. Counts are shown only when the
 * graph declares them. Always plain, since graph summaries are shown in variable panels.
 */
public final class GraphFormatter implements SummaryFormatter {

  @Override
  public String summarize(NodeHandle value, InspectorOptions options, Palette palette) {
    NodeHandle graph = PointerNormalizer.dereference(value);
    StringBuilder sb = new StringBuilder("Graph");
    appendCount(sb, graph, FieldNames.NODE_COUNT, "V");
    appendCount(sb, graph, FieldNames.EDGE_COUNT, "E");
    return sb.toString();
  }

  private static void appendCount(
      StringBuilder sb, NodeHandle graph, CandidateFieldSet names, String label) {
    NodeHandle count = FieldResolver.resolve(graph, names);
    if (count != null && count.isValid() && count.rawValue() != null) {
      sb.append(" | ").append(label).append(" = ").append(count.rawValue());
    }
  }
}
