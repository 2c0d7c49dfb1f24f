package io.nodescope.api;

import java.util.List;
import java.util.Objects;

/**
 * Ordered value summaries produced by a traversal. Control markers ({@link #CYCLE},
 * {@link #CYCLE_DETECTED}, {@link #INVALID}, {@link #STRUCTURE_UNRESOLVED}) start with {@code
 * '['} so callers can style them apart from data.
 *
 * @param values value summaries in visiting order, at most {@code maxItems} plus one cycle marker
 * @param metadata how the traversal ended
 */
public record TraversalResult(List<String> values, TraversalMetadata metadata) {

  /** Emitted by tree traversals on revisiting a node. */
  public static final String CYCLE = "[CYCLE]";

  /** Emitted by linear traversals on revisiting a node; the walk stops there. */
  public static final String CYCLE_DETECTED = "[CYCLE DETECTED]";

  /** Emitted when a node's payload member cannot be resolved or read. */
  public static final String INVALID = "[invalid]";

  /** Sole element of the result when the head node's next/value members cannot be resolved. */
  public static final String STRUCTURE_UNRESOLVED =
      "[ERROR: could not determine node structure (value/next)]";

  private static final TraversalResult EMPTY =
      new TraversalResult(List.of(), TraversalMetadata.EMPTY);

  public TraversalResult {
    values = List.copyOf(Objects.requireNonNull(values, "values must not be null"));
    Objects.requireNonNull(metadata, "metadata must not be null");
  }

  /** Result for a null or invalid root. */
  public static TraversalResult empty() {
    return EMPTY;
  }

  /** Returns true if the given value is a control marker rather than data. */
  public static boolean isMarker(String value) {
    return value != null && value.startsWith("[");
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }
}
