package io.nodescope.shell.format;

import io.nodescope.api.GraphNodeSummary;
import io.nodescope.api.InspectorOptions;
import io.nodescope.api.NodeHandle;
import io.nodescope.api.NodeInspector;
import io.nodescope.shell.render.Palette;

/** Summary for one graph node: {@code 1 -> [2, 3] ...}. */
public final class GraphNodeFormatter implements SummaryFormatter {

  @Override
  public String summarize(NodeHandle value, InspectorOptions options, Palette palette) {
    GraphNodeSummary summary = NodeInspector.summarizeGraphNode(value, options);
    StringBuilder sb = new StringBuilder(palette.item(summary.value()));
    if (!summary.neighbors().isEmpty()) {
      sb.append(" -> [").append(String.join(", ", summary.neighbors())).append(']');
    }
    if (summary.truncated()) {
      sb.append(" ...");
    }
    return sb.toString();
  }
}
