package io.nodescope.shell.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.nodescope.api.DotGraph;
import io.nodescope.api.GraphEdge;
import io.nodescope.api.GraphNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes structural exports as JSON for browser-based renderers:
 *
 * <pre>{@code
 * {"nodes": [{"id": "0x7f0000001000", "label": "8"}, ...],
 *  "edges": [{"from": "0x7f0000001000", "to": "0x7f0000002000"}, ...]}
 * }</pre>
 *
 * Labels are written unescaped; JSON string escaping is left to Gson.
 */
public final class WebGraphWriter {

  private static final Logger LOG = LoggerFactory.getLogger(WebGraphWriter.class);

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  private WebGraphWriter() {}

  public static JsonObject toJson(DotGraph graph) {
    JsonArray nodes = new JsonArray();
    for (GraphNode node : graph.nodes()) {
      JsonObject n = new JsonObject();
      n.addProperty("id", id(node.address()));
      n.addProperty("label", node.label());
      nodes.add(n);
    }
    JsonArray edges = new JsonArray();
    for (GraphEdge edge : graph.edges()) {
      JsonObject e = new JsonObject();
      e.addProperty("from", id(edge.from()));
      e.addProperty("to", id(edge.to()));
      edges.add(e);
    }
    JsonObject root = new JsonObject();
    root.add("nodes", nodes);
    root.add("edges", edges);
    return root;
  }

  /**
   * Writes the graph to {@code file}, replacing any existing content.
   *
   * @throws IOException if the file cannot be written
   */
  public static void write(Path file, DotGraph graph) throws IOException {
    Files.writeString(file, GSON.toJson(toJson(graph)), StandardCharsets.UTF_8);
    LOG.info("Wrote web graph with {} nodes to {}", graph.nodes().size(), file);
  }

  static String id(long address) {
    return "0x" + Long.toHexString(address);
  }
}
