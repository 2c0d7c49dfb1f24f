package io.nodescope.shell.export;

import io.nodescope.api.DotGraph;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes structural exports as Graphviz {@code .dot} files. */
public final class DotFileWriter {

  private static final Logger LOG = LoggerFactory.getLogger(DotFileWriter.class);

  /** Graph name and layout attributes per kind of structure. */
  public enum Layout {
    TREE("Tree", List.of("node [shape=circle];")),
    LIST("List", List.of("rankdir=\"LR\";", "node [shape=box];")),
    GRAPH("G", List.of("rankdir=\"LR\";", "node [shape=circle];"));

    private final String graphName;
    private final List<String> attributes;

    Layout(String graphName, List<String> attributes) {
      this.graphName = graphName;
      this.attributes = attributes;
    }

    public String graphName() {
      return graphName;
    }

    /** Graph-level statements written before the nodes. */
    public List<String> attributes() {
      return attributes;
    }
  }

  private DotFileWriter() {}

  /** Renders the file content: a {@code digraph} block of node lines followed by edge lines. */
  public static String render(DotGraph graph, Layout layout) {
    Objects.requireNonNull(graph, "graph must not be null");
    List<String> lines = new ArrayList<>();
    lines.add("digraph " + layout.graphName() + " {");
    for (String attribute : layout.attributes()) {
      lines.add("  " + attribute);
    }
    for (String line : graph.nodeLines()) {
      lines.add("  " + line);
    }
    for (String line : graph.edgeLines()) {
      lines.add("  " + line);
    }
    lines.add("}");
    return String.join("\n", lines) + "\n";
  }

  /**
   * Writes the graph to {@code file}, replacing any existing content.
   *
   * @throws IOException if the file cannot be written
   */
  public static void write(Path file, DotGraph graph, Layout layout) throws IOException {
    Files.writeString(file, render(graph, layout), StandardCharsets.UTF_8);
    LOG.info(
        "Wrote {} nodes and {} edges to {}", graph.nodes().size(), graph.edges().size(), file);
  }
}
