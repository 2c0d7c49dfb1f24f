package io.nodescope.traversal;

import io.nodescope.api.TraversalOrder;
import io.nodescope.core.ChildEnumerator.Children;

/**
 * Left subtree, root, right subtree for binary nodes. N-ary nodes visit the first child's
 * subtree, then the root, then the remaining children's subtrees; a node exposing a children
 * collection always takes the n-ary rule.
 */
public final class InOrderTraversal extends TreeTraversal {

  @Override
  public TraversalOrder order() {
    return TraversalOrder.INORDER;
  }

  @Override
  protected int emitPosition(Children children) {
    return children.inOrderSplit();
  }
}
