package io.nodescope.core;

import static org.junit.jupiter.api.Assertions.*;

import io.nodescope.api.GraphNodeSummary;
import io.nodescope.api.TraversalResult;
import io.nodescope.reflect.ReflectiveHeap;
import io.nodescope.test.Fixtures.Opaque;
import io.nodescope.test.Fixtures.Vertex;
import java.util.List;
import org.junit.jupiter.api.Test;

class GraphNodeSummarizerTest {

  private final ReflectiveHeap heap = new ReflectiveHeap();

  @Test
  void testNeighborsWithinLimit() {
    Vertex a = new Vertex(1).to(new Vertex(2), new Vertex(3));

    GraphNodeSummary summary = GraphNodeSummarizer.summarize(heap.pointerTo(a), 10);

    assertEquals("1", summary.value());
    assertEquals(List.of("2", "3"), summary.neighbors());
    assertFalse(summary.truncated());
  }

  @Test
  void testNeighborsTruncated() {
    Vertex a = new Vertex(1).to(new Vertex(2), new Vertex(3), new Vertex(4));

    GraphNodeSummary summary = GraphNodeSummarizer.summarize(heap.valueOf(a), 2);

    assertEquals(List.of("2", "3"), summary.neighbors());
    assertTrue(summary.truncated());
  }

  @Test
  void testNullNeighborSkipped() {
    Vertex a = new Vertex(1);
    a.neighbors.add(null);
    a.neighbors.add(new Vertex(5));

    assertEquals(List.of("5"), GraphNodeSummarizer.summarize(heap.pointerTo(a), 10).neighbors());
  }

  @Test
  void testNodeWithoutNeighborMember() {
    Opaque node = new Opaque();
    node.value = 9;

    GraphNodeSummary summary = GraphNodeSummarizer.summarize(heap.pointerTo(node), 10);

    assertEquals("9", summary.value());
    assertTrue(summary.neighbors().isEmpty());
  }

  @Test
  void testNullNode() {
    GraphNodeSummary summary = GraphNodeSummarizer.summarize(heap.pointerTo(null), 10);

    assertEquals(TraversalResult.INVALID, summary.value());
    assertTrue(summary.neighbors().isEmpty());
  }

  @Test
  void testNegativeLimitRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> GraphNodeSummarizer.summarize(heap.pointerTo(new Vertex(1)), -1));
  }
}
