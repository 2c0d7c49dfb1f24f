package io.nodescope.api;

import java.util.Objects;

/**
 * Settings read by engine calls. Instances are immutable and passed explicitly into every
 * traversal and export; the engine keeps no settings of its own.
 *
 * @param maxSummaryItems maximum values in list and tree summaries
 * @param maxGraphNeighbors maximum neighbors shown per graph node summary
 * @param treeTraversalStrategy visiting order for tree summaries
 * @param exportMaxItems maximum items walked by chain exports and full listings
 */
public record InspectorOptions(
    int maxSummaryItems,
    int maxGraphNeighbors,
    TraversalOrder treeTraversalStrategy,
    int exportMaxItems) {

  /** Defaults: 30 summary items, 10 neighbors, pre-order, 1000 export items. */
  public static final InspectorOptions DEFAULT =
      new InspectorOptions(30, 10, TraversalOrder.PREORDER, 1000);

  public InspectorOptions {
    requireNonNegative(maxSummaryItems, "maxSummaryItems");
    requireNonNegative(maxGraphNeighbors, "maxGraphNeighbors");
    requireNonNegative(exportMaxItems, "exportMaxItems");
    Objects.requireNonNull(treeTraversalStrategy, "treeTraversalStrategy must not be null");
  }

  private static void requireNonNegative(int value, String name) {
    if (value < 0) {
      throw new IllegalArgumentException(name + " must not be negative: " + value);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder pre-populated with this instance's values. */
  public Builder toBuilder() {
    return new Builder()
        .maxSummaryItems(maxSummaryItems)
        .maxGraphNeighbors(maxGraphNeighbors)
        .treeTraversalStrategy(treeTraversalStrategy)
        .exportMaxItems(exportMaxItems);
  }

  public static class Builder {
    private int maxSummaryItems = DEFAULT.maxSummaryItems;
    private int maxGraphNeighbors = DEFAULT.maxGraphNeighbors;
    private TraversalOrder treeTraversalStrategy = DEFAULT.treeTraversalStrategy;
    private int exportMaxItems = DEFAULT.exportMaxItems;

    public Builder maxSummaryItems(int value) {
      this.maxSummaryItems = value;
      return this;
    }

    public Builder maxGraphNeighbors(int value) {
      this.maxGraphNeighbors = value;
      return this;
    }

    public Builder treeTraversalStrategy(TraversalOrder order) {
      this.treeTraversalStrategy =
          Objects.requireNonNull(order, "treeTraversalStrategy must not be null");
      return this;
    }

    public Builder exportMaxItems(int value) {
      this.exportMaxItems = value;
      return this;
    }

    public InspectorOptions build() {
      return new InspectorOptions(
          maxSummaryItems, maxGraphNeighbors, treeTraversalStrategy, exportMaxItems);
    }
  }
}
