package io.nodescope.api;

import static io.nodescope.test.Fixtures.list;
import static io.nodescope.test.Fixtures.referenceTree;
import static io.nodescope.test.Fixtures.strings;
import static org.junit.jupiter.api.Assertions.*;

import io.nodescope.reflect.ReflectiveHeap;
import io.nodescope.test.Fixtures.Graph;
import io.nodescope.test.Fixtures.Vertex;
import io.nodescope.traversal.InOrderTraversal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NodeInspectorTest {

  private ReflectiveHeap heap;

  @BeforeEach
  void setUp() {
    heap = new ReflectiveHeap();
  }

  @Test
  void testSummarizeTree_UsesConfiguredOrderAndBound() {
    InspectorOptions options =
        InspectorOptions.builder()
            .maxSummaryItems(5)
            .treeTraversalStrategy(TraversalOrder.INORDER)
            .build();

    TraversalResult result = NodeInspector.summarizeTree(heap.pointerTo(referenceTree()), options);

    assertEquals(strings(0, 1, 2, 3, 4), result.values());
    assertTrue(result.metadata().truncated());
  }

  @Test
  void testSummarizeTree_DefaultsToPreOrder() {
    TraversalResult result =
        NodeInspector.summarizeTree(heap.pointerTo(referenceTree()), InspectorOptions.DEFAULT);

    assertEquals("8", result.values().get(0));
    assertEquals(19, result.size());
    assertFalse(result.metadata().truncated());
  }

  @Test
  void testSummarizeList_BoundedBySummaryItems() {
    InspectorOptions options = InspectorOptions.builder().maxSummaryItems(2).build();

    TraversalResult result = NodeInspector.summarizeList(heap.pointerTo(list(1, 2, 3)), options);

    assertEquals(strings(1, 2), result.values());
    assertTrue(result.metadata().truncated());
  }

  @Test
  void testExportList_BoundedByExportItems() {
    InspectorOptions options =
        InspectorOptions.builder().maxSummaryItems(1).exportMaxItems(3).build();

    DotGraph graph = NodeInspector.exportList(heap.pointerTo(list(1, 2, 3, 4, 5)), options);

    assertEquals(3, graph.nodes().size());
    assertEquals("1", graph.nodes().get(0).label());
  }

  @Test
  void testExportTree_Annotation() {
    NodeHandle root = heap.pointerTo(referenceTree());

    assertEquals("8", NodeInspector.exportTree(root, null).nodes().get(0).label());
    assertEquals(
        "19: 8", NodeInspector.exportTree(root, TraversalOrder.POSTORDER).nodes().get(0).label());
  }

  @Test
  void testExportGraphAndNodeSummary() {
    Vertex a = new Vertex(1);
    Vertex b = new Vertex(2);
    a.to(b);

    DotGraph graph = NodeInspector.exportGraph(heap.pointerTo(new Graph(a, b)));
    GraphNodeSummary summary =
        NodeInspector.summarizeGraphNode(
            heap.pointerTo(a), InspectorOptions.builder().maxGraphNeighbors(0).build());

    assertEquals(2, graph.nodes().size());
    assertEquals(1, graph.edges().size());
    assertEquals("1", summary.value());
    assertTrue(summary.neighbors().isEmpty());
    assertTrue(summary.truncated());
  }

  @Test
  void testTreeStrategies() {
    assertInstanceOf(InOrderTraversal.class, NodeInspector.tree(TraversalOrder.INORDER));
    assertSame(
        NodeInspector.tree(TraversalOrder.POSTORDER), NodeInspector.tree(TraversalOrder.POSTORDER));
    assertThrows(NullPointerException.class, () -> NodeInspector.tree(null));
    assertThrows(NullPointerException.class, () -> NodeInspector.summarizeList(null, null));
  }

  @Test
  void testNullRoots() {
    assertTrue(NodeInspector.summarizeList(null, InspectorOptions.DEFAULT).isEmpty());
    assertTrue(NodeInspector.summarizeTree(null, InspectorOptions.DEFAULT).isEmpty());
    assertTrue(NodeInspector.exportTree(null, TraversalOrder.INORDER).isEmpty());
    assertEquals(List.of(), NodeInspector.exportGraph(null).nodeLines());
  }
}
