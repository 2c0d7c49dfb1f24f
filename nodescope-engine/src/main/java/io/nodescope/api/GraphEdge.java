package io.nodescope.api;

/**
 * A directed edge in a structural export.
 *
 * @param from canonical address of the parent
 * @param to canonical address of the child
 */
public record GraphEdge(long from, long to) {

  /** Renders {@code Node_<from> -> Node_<to>;}. */
  public String toDotLine() {
    return "Node_" + Long.toUnsignedString(from) + " -> Node_" + Long.toUnsignedString(to) + ";";
  }
}
