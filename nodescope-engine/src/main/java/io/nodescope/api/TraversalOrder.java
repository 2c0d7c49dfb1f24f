package io.nodescope.api;

import java.util.Locale;
import java.util.Optional;

/** Visiting orders supported for tree-shaped structures. */
public enum TraversalOrder {
  /** Root, then each child's subtree. */
  PREORDER("preorder"),

  /**
   * Binary: left subtree, root, right subtree. N-ary: first child's subtree, root, remaining
   * children's subtrees.
   */
  INORDER("inorder"),

  /** Every child's subtree, then the root. */
  POSTORDER("postorder");

  private final String id;

  TraversalOrder(String id) {
    this.id = id;
  }

  /** Returns the lower-case name used in configuration and commands. */
  public String id() {
    return id;
  }

  /** Looks up an order by its id, ignoring case. */
  public static Optional<TraversalOrder> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    String normalized = id.trim().toLowerCase(Locale.ROOT);
    for (TraversalOrder order : values()) {
      if (order.id.equals(normalized)) {
        return Optional.of(order);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return id;
  }
}
