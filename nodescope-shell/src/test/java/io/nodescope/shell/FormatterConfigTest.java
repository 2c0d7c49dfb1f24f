package io.nodescope.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.nodescope.api.InspectorOptions;
import io.nodescope.api.TraversalOrder;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FormatterConfigTest {

  private FormatterConfig config;

  @BeforeEach
  void setUp() {
    config = new FormatterConfig();
  }

  @Test
  void testDefaultsMatchEngineDefaults() {
    assertEquals(InspectorOptions.DEFAULT, config.snapshot());
    assertEquals("30", config.get(FormatterConfig.SUMMARY_MAX_ITEMS));
    assertEquals("10", config.get(FormatterConfig.GRAPH_MAX_NEIGHBORS));
    assertEquals("'preorder'", config.get(FormatterConfig.TREE_TRAVERSAL_STRATEGY));
  }

  @Test
  void testKeysInDisplayOrder() {
    assertEquals(
        List.of("summary_max_items", "graph_max_neighbors", "tree_traversal_strategy"),
        FormatterConfig.keys());
    assertEquals(
        "Traversal order for tree summaries. Options: preorder, inorder, postorder",
        FormatterConfig.description(FormatterConfig.TREE_TRAVERSAL_STRATEGY));
  }

  @Test
  void testSetInteger() {
    assertEquals("5", config.set("summary_max_items", " 5 "));

    assertEquals(5, config.summaryMaxItems());
    assertEquals(5, config.snapshot().maxSummaryItems());
  }

  @Test
  void testSetStrategy_CaseInsensitive() {
    assertEquals("'inorder'", config.set("tree_traversal_strategy", "InOrder"));

    assertEquals(TraversalOrder.INORDER, config.snapshot().treeTraversalStrategy());
  }

  @Test
  void testSetInvalidInteger_LeavesValueUnchanged() {
    ConfigException e =
        assertThrows(ConfigException.class, () -> config.set("graph_max_neighbors", "many"));

    assertEquals(
        "Invalid value. 'many' is not a valid integer for 'graph_max_neighbors'.",
        e.getMessage());
    assertEquals(10, config.graphMaxNeighbors());
  }

  @Test
  void testSetNegative_Rejected() {
    assertThrows(ConfigException.class, () -> config.set("summary_max_items", "-1"));
    assertEquals(30, config.summaryMaxItems());
  }

  @Test
  void testSetInvalidStrategy() {
    ConfigException e =
        assertThrows(
            ConfigException.class, () -> config.set("tree_traversal_strategy", "levelorder"));

    assertTrue(e.getMessage().contains("'levelorder'"));
    assertEquals(TraversalOrder.PREORDER, config.treeTraversalStrategy());
  }

  @Test
  void testUnknownKey() {
    ConfigException e = assertThrows(ConfigException.class, () -> config.set("colour", "red"));

    assertEquals(
        "Unknown setting 'colour'.\nAvailable settings are: "
            + "summary_max_items, graph_max_neighbors, tree_traversal_strategy",
        e.getMessage());
    assertThrows(ConfigException.class, () -> config.get("colour"));
  }

  @Test
  void testSnapshotIsDetached() {
    InspectorOptions before = config.snapshot();
    config.set("summary_max_items", "3");

    assertEquals(30, before.maxSummaryItems());
    assertEquals(3, config.snapshot().maxSummaryItems());
  }

  @Test
  void testInitialOptionsKeepExportBound() {
    FormatterConfig custom =
        new FormatterConfig(InspectorOptions.builder().exportMaxItems(50).build());
    custom.set("summary_max_items", "4");

    assertEquals(50, custom.snapshot().exportMaxItems());
  }
}
