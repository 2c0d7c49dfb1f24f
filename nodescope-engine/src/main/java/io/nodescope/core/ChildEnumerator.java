package io.nodescope.core;

import io.nodescope.api.NodeHandle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lists the children of a tree node, adapting to its shape.
 *
 * <ol>
 *   <li>A declared children collection makes the node n-ary: every element with a non-zero
 *       address, in collection order.
 *   <li>Otherwise a declared left or right member (even a null one) makes it binary: left, then
 *       right, skipping null pointers.
 *   <li>Otherwise the node is a leaf.
 * </ol>
 */
public final class ChildEnumerator {

  private ChildEnumerator() {}

  /** How a node's children were discovered. */
  public enum Shape {
    NARY,
    BINARY,
    LEAF
  }

  /**
   * Children of one node.
   *
   * @param shape how the children were discovered
   * @param handles child handles, all with non-zero addresses
   * @param hasLeft for binary nodes, whether {@code handles} starts with a left child
   */
  public record Children(Shape shape, List<NodeHandle> handles, boolean hasLeft) {

    static final Children LEAF = new Children(Shape.LEAF, List.of(), false);

    public Children {
      Objects.requireNonNull(shape, "shape must not be null");
      handles = List.copyOf(handles);
    }

    /**
     * Number of leading children visited before the node itself in in-order: the left child of
     * a binary node, the first child of an n-ary node.
     */
    public int inOrderSplit() {
      return switch (shape) {
        case BINARY -> hasLeft ? 1 : 0;
        case NARY -> Math.min(1, handles.size());
        case LEAF -> 0;
      };
    }

    public boolean isEmpty() {
      return handles.isEmpty();
    }
  }

  /**
   * Enumerates the children of a dereferenced node.
   *
   * @param record the node record, may be null
   * @return the children; a leaf for null or unreadable records
   */
  public static Children children(NodeHandle record) {
    if (record == null || !record.isValid()) {
      return Children.LEAF;
    }

    NodeHandle collection = FieldResolver.resolve(record, FieldNames.CHILDREN);
    if (collection != null && collection.isValid()) {
      List<NodeHandle> handles = new ArrayList<>();
      int count = collection.numChildren();
      for (int i = 0; i < count; i++) {
        NodeHandle child = collection.childAt(i);
        if (PointerNormalizer.isNonNull(child)) {
          handles.add(child);
        }
      }
      return new Children(Shape.NARY, handles, false);
    }

    boolean binary = false;
    List<NodeHandle> handles = new ArrayList<>(2);
    boolean hasLeft = false;
    if (FieldResolver.isPresent(record, FieldNames.LEFT)) {
      binary = true;
      NodeHandle left = FieldResolver.resolve(record, FieldNames.LEFT);
      if (PointerNormalizer.isNonNull(left)) {
        handles.add(left);
        hasLeft = true;
      }
    }
    if (FieldResolver.isPresent(record, FieldNames.RIGHT)) {
      binary = true;
      NodeHandle right = FieldResolver.resolve(record, FieldNames.RIGHT);
      if (PointerNormalizer.isNonNull(right)) {
        handles.add(right);
      }
    }
    return binary ? new Children(Shape.BINARY, handles, hasLeft) : Children.LEAF;
  }
}
