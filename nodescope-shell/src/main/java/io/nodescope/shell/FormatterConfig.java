package io.nodescope.shell;

import io.nodescope.api.InspectorOptions;
import io.nodescope.api.TraversalOrder;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable formatter settings owned by the shell. Commands change them between calls; every engine
 * call receives an immutable {@link #snapshot()}.
 */
public final class FormatterConfig {

  private static final Logger LOG = LoggerFactory.getLogger(FormatterConfig.class);

  public static final String SUMMARY_MAX_ITEMS = "summary_max_items";
  public static final String GRAPH_MAX_NEIGHBORS = "graph_max_neighbors";
  public static final String TREE_TRAVERSAL_STRATEGY = "tree_traversal_strategy";

  private static final Map<String, String> DESCRIPTIONS = new LinkedHashMap<>();

  static {
    DESCRIPTIONS.put(SUMMARY_MAX_ITEMS, "Max items for list/tree summaries");
    DESCRIPTIONS.put(GRAPH_MAX_NEIGHBORS, "Max neighbors in graph node summaries");
    DESCRIPTIONS.put(
        TREE_TRAVERSAL_STRATEGY,
        "Traversal order for tree summaries. Options: " + String.join(", ", orderIds()));
  }

  private int summaryMaxItems;
  private int graphMaxNeighbors;
  private TraversalOrder treeTraversalStrategy;
  private final int exportMaxItems;

  public FormatterConfig() {
    this(InspectorOptions.DEFAULT);
  }

  public FormatterConfig(InspectorOptions initial) {
    this.summaryMaxItems = initial.maxSummaryItems();
    this.graphMaxNeighbors = initial.maxGraphNeighbors();
    this.treeTraversalStrategy = initial.treeTraversalStrategy();
    this.exportMaxItems = initial.exportMaxItems();
  }

  /** Returns the current settings as engine options. */
  public InspectorOptions snapshot() {
    return new InspectorOptions(
        summaryMaxItems, graphMaxNeighbors, treeTraversalStrategy, exportMaxItems);
  }

  /** Names of the settings that can be changed, in display order. */
  public static List<String> keys() {
    return List.copyOf(DESCRIPTIONS.keySet());
  }

  public static String description(String key) {
    return DESCRIPTIONS.get(key);
  }

  /**
   * Returns the display form of a setting's current value; strings are quoted.
   *
   * @throws ConfigException if the key is unknown
   */
  public String get(String key) {
    return switch (key) {
      case SUMMARY_MAX_ITEMS -> String.valueOf(summaryMaxItems);
      case GRAPH_MAX_NEIGHBORS -> String.valueOf(graphMaxNeighbors);
      case TREE_TRAVERSAL_STRATEGY -> "'" + treeTraversalStrategy.id() + "'";
      default -> throw unknown(key);
    };
  }

  /**
   * Parses and assigns a setting.
   *
   * @return the display form of the new value
   * @throws ConfigException if the key is unknown or the value invalid; the setting is unchanged
   */
  public String set(String key, String value) {
    switch (key) {
      case SUMMARY_MAX_ITEMS -> summaryMaxItems = parseCount(key, value);
      case GRAPH_MAX_NEIGHBORS -> graphMaxNeighbors = parseCount(key, value);
      case TREE_TRAVERSAL_STRATEGY ->
          treeTraversalStrategy =
              TraversalOrder.fromId(value)
                  .orElseThrow(
                      () ->
                          rejected(
                              "Invalid value '"
                                  + value
                                  + "'. Valid options for "
                                  + key
                                  + " are: "
                                  + String.join(", ", orderIds())));
      default -> throw unknown(key);
    }
    return get(key);
  }

  public int summaryMaxItems() {
    return summaryMaxItems;
  }

  public int graphMaxNeighbors() {
    return graphMaxNeighbors;
  }

  public TraversalOrder treeTraversalStrategy() {
    return treeTraversalStrategy;
  }

  public int exportMaxItems() {
    return exportMaxItems;
  }

  private static int parseCount(String key, String value) {
    int parsed;
    try {
      parsed = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw rejected("Invalid value. '" + value + "' is not a valid integer for '" + key + "'.");
    }
    if (parsed < 0) {
      throw rejected("Invalid value. '" + key + "' must not be negative, got " + parsed + ".");
    }
    return parsed;
  }

  private static ConfigException unknown(String key) {
    return rejected(
        "Unknown setting '" + key + "'.\nAvailable settings are: " + String.join(", ", keys()));
  }

  private static ConfigException rejected(String message) {
    LOG.warn("Rejected formatter setting: {}", message);
    return new ConfigException(message);
  }

  private static List<String> orderIds() {
    return Arrays.stream(TraversalOrder.values())
        .map(TraversalOrder::id)
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return keys().stream()
        .map(k -> k + "=" + get(k))
        .collect(Collectors.joining(", ", "FormatterConfig{", "}"));
  }
}
