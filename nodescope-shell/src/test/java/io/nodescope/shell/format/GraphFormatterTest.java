package io.nodescope.shell.format;

import static org.junit.jupiter.api.Assertions.*;

import io.nodescope.api.InspectorOptions;
import io.nodescope.reflect.ReflectiveHeap;
import io.nodescope.shell.render.Palette;
import io.nodescope.shell.test.Containers.MyGraph;
import io.nodescope.shell.test.Containers.Network;
import io.nodescope.shell.test.Containers.Vertex;
import org.junit.jupiter.api.Test;

class GraphFormatterTest {

  private final ReflectiveHeap heap = new ReflectiveHeap();

  @Test
  void testGraphCounts() {
    Vertex a = new Vertex(1);
    Vertex b = new Vertex(2);
    Vertex c = new Vertex(3);
    a.to(b, c);
    b.to(c);

    String summary =
        new GraphFormatter()
            .summarize(heap.valueOf(new MyGraph(a, b, c)), InspectorOptions.DEFAULT, Palette.ANSI);

    assertEquals("Graph | V = 3 | E = 3", summary);
  }

  @Test
  void testGraphWithoutCounts() {
    assertEquals(
        "Graph",
        new GraphFormatter()
            .summarize(heap.valueOf(new Network()), InspectorOptions.DEFAULT, Palette.PLAIN));
  }

  @Test
  void testGraphNode_BoundedNeighbors() {
    Vertex a = new Vertex(1).to(new Vertex(2), new Vertex(3));
    InspectorOptions options = InspectorOptions.builder().maxGraphNeighbors(1).build();

    assertEquals(
        "1 -> [2] ...",
        new GraphNodeFormatter().summarize(heap.pointerTo(a), options, Palette.PLAIN));
    assertEquals(
        "1 -> [2, 3]",
        new GraphNodeFormatter()
            .summarize(heap.pointerTo(a), InspectorOptions.DEFAULT, Palette.PLAIN));
  }

  @Test
  void testGraphNode_NoNeighbors() {
    assertEquals(
        "5",
        new GraphNodeFormatter()
            .summarize(heap.valueOf(new Vertex(5)), InspectorOptions.DEFAULT, Palette.PLAIN));
  }
}
