package io.nodescope.traversal;

import io.nodescope.api.TraversalOrder;
import io.nodescope.core.ChildEnumerator.Children;

/** Root, then each child's subtree in enumeration order. */
public final class PreOrderTraversal extends TreeTraversal {

  @Override
  public TraversalOrder order() {
    return TraversalOrder.PREORDER;
  }

  @Override
  protected int emitPosition(Children children) {
    return 0;
  }
}
