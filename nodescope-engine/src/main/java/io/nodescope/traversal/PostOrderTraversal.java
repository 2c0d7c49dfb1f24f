package io.nodescope.traversal;

import io.nodescope.api.TraversalOrder;
import io.nodescope.core.ChildEnumerator.Children;

/** Each child's subtree in enumeration order, then the root. */
public final class PostOrderTraversal extends TreeTraversal {

  @Override
  public TraversalOrder order() {
    return TraversalOrder.POSTORDER;
  }

  @Override
  protected int emitPosition(Children children) {
    return children.handles().size();
  }
}
