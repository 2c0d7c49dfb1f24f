package io.nodescope.api;

/**
 * Facts about how a traversal ended.
 *
 * @param truncated the {@code maxItems} bound was reached
 * @param doublyLinked a previous-pointer member exists on the head node (linear traversals only)
 */
public record TraversalMetadata(boolean truncated, boolean doublyLinked) {

  /** Metadata for traversals that never started (null root, unresolvable structure). */
  public static final TraversalMetadata EMPTY = new TraversalMetadata(false, false);

  public static TraversalMetadata truncated(boolean truncated) {
    return new TraversalMetadata(truncated, false);
  }
}
