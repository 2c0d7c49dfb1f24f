package io.nodescope.shell.export;

import static org.junit.jupiter.api.Assertions.*;

import io.nodescope.api.DotGraph;
import io.nodescope.api.GraphEdge;
import io.nodescope.api.GraphNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DotFileWriterTest {

  @TempDir Path tempDir;

  private final DotGraph graph =
      new DotGraph(
          List.of(new GraphNode(16, "a"), new GraphNode(32, "say \"b\"")),
          List.of(new GraphEdge(16, 32)));

  @Test
  void testRenderTree() {
    assertEquals(
        "digraph Tree {\n"
            + "  node [shape=circle];\n"
            + "  Node_16 [label=\"a\"];\n"
            + "  Node_32 [label=\"say \\\"b\\\"\"];\n"
            + "  Node_16 -> Node_32;\n"
            + "}\n",
        DotFileWriter.render(graph, DotFileWriter.Layout.TREE));
  }

  @Test
  void testRenderListLayout() {
    String dot = DotFileWriter.render(DotGraph.empty(), DotFileWriter.Layout.LIST);

    assertEquals("digraph List {\n  rankdir=\"LR\";\n  node [shape=box];\n}\n", dot);
  }

  @Test
  void testWrite() throws IOException {
    Path file = tempDir.resolve("graph.dot");
    Files.writeString(file, "stale content that is longer than the new file ".repeat(20));

    DotFileWriter.write(file, graph, DotFileWriter.Layout.GRAPH);

    String content = Files.readString(file);
    assertTrue(content.startsWith("digraph G {\n  rankdir=\"LR\";\n  node [shape=circle];\n"));
    assertTrue(content.endsWith("}\n"));
    assertFalse(content.contains("stale"));
  }

  @Test
  void testWriteToMissingDirectoryFails() {
    Path file = tempDir.resolve("missing").resolve("graph.dot");

    assertThrows(
        IOException.class, () -> DotFileWriter.write(file, graph, DotFileWriter.Layout.TREE));
  }

  @Test
  void testLayouts() {
    assertEquals("G", DotFileWriter.Layout.GRAPH.graphName());
    assertEquals(List.of("node [shape=circle];"), DotFileWriter.Layout.TREE.attributes());
    assertEquals("List", DotFileWriter.Layout.LIST.graphName());
  }
}
