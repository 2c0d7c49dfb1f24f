package io.nodescope.test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Node shapes used across the engine tests, read through the reflective host. */
public final class Fixtures {

  private Fixtures() {}

  /** Singly linked node. */
  public static final class ListNode {
    public int value;
    public ListNode next;

    public ListNode(int value) {
      this.value = value;
    }
  }

  /** Doubly linked node with C++-style member names. */
  public static final class DoublyNode {
    public String m_data;
    public DoublyNode m_next;
    public DoublyNode m_prev;

    public DoublyNode(String data) {
      this.m_data = data;
    }
  }

  /** Binary tree node. */
  public static final class TreeNode {
    public int value;
    public TreeNode left;
    public TreeNode right;

    public TreeNode(int value) {
      this.value = value;
    }

    public TreeNode(int value, TreeNode left, TreeNode right) {
      this.value = value;
      this.left = left;
      this.right = right;
    }
  }

  /** N-ary tree node holding raw child pointers. */
  public static final class NaryNode {
    public String key;
    public List<NaryNode> children = new ArrayList<>();

    public NaryNode(String key, NaryNode... children) {
      this.key = key;
      this.children.addAll(List.of(children));
    }
  }

  /** N-ary tree node whose children are wrapped in smart pointers. */
  public static final class OwningNode {
    public int val;
    public List<Optional<OwningNode>> m_children = new ArrayList<>();

    public OwningNode(int val) {
      this.val = val;
    }

    public OwningNode add(OwningNode child) {
      m_children.add(Optional.ofNullable(child));
      return this;
    }
  }

  /** Node carrying both a children collection and a left member. */
  public static final class HybridNode {
    public int value;
    public HybridNode left;
    public List<HybridNode> children = new ArrayList<>();

    public HybridNode(int value) {
      this.value = value;
    }
  }

  /** Binary node owning its children through optional wrappers. */
  public static final class OwnedTreeNode {
    public int data;
    public Optional<OwnedTreeNode> left = Optional.empty();
    public Optional<OwnedTreeNode> right = Optional.empty();

    public OwnedTreeNode(int data) {
      this.data = data;
    }

    public OwnedTreeNode(int data, OwnedTreeNode left, OwnedTreeNode right) {
      this.data = data;
      this.left = Optional.ofNullable(left);
      this.right = Optional.ofNullable(right);
    }
  }

  /** Adjacency-list vertex. */
  public static final class Vertex {
    public int value;
    public List<Vertex> neighbors = new ArrayList<>();

    public Vertex(int value) {
      this.value = value;
    }

    public Vertex to(Vertex... targets) {
      neighbors.addAll(List.of(targets));
      return this;
    }
  }

  /** Adjacency-list graph. */
  public static final class Graph {
    public List<Vertex> nodes = new ArrayList<>();
    public int num_nodes;
    public int num_edges;

    public Graph(Vertex... vertices) {
      nodes.addAll(List.of(vertices));
      num_nodes = vertices.length;
      for (Vertex v : vertices) {
        num_edges += v.neighbors.size();
      }
    }
  }

  /** A node with no recognizable next member. */
  public static final class Opaque {
    public int value;
    public Opaque link;
  }

  /** Builds a singly linked list and returns its head. */
  public static ListNode list(int... values) {
    ListNode head = null;
    for (int i = values.length - 1; i >= 0; i--) {
      ListNode node = new ListNode(values[i]);
      node.next = head;
      head = node;
    }
    return head;
  }

  /**
   * The 19-node reference tree holding 0..18 so that in-order yields ascending values.
   *
   * <pre>
   *              8
   *         /         \
   *        3           10
   *      /   \        /   \
   *     1     6      9     14
   *    / \   / \          /  \
   *   0   2 4   7       13    15
   *          \          /       \
   *           5       12         16
   *                   /            \
   *                 11              17
   *                                   \
   *                                    18
   * </pre>
   */
  public static TreeNode referenceTree() {
    TreeNode n1 = new TreeNode(1, new TreeNode(0), new TreeNode(2));
    TreeNode n4 = new TreeNode(4, null, new TreeNode(5));
    TreeNode n6 = new TreeNode(6, n4, new TreeNode(7));
    TreeNode n3 = new TreeNode(3, n1, n6);

    TreeNode n12 = new TreeNode(12, new TreeNode(11), null);
    TreeNode n13 = new TreeNode(13, n12, null);
    TreeNode n17 = new TreeNode(17, null, new TreeNode(18));
    TreeNode n16 = new TreeNode(16, null, n17);
    TreeNode n15 = new TreeNode(15, null, n16);
    TreeNode n14 = new TreeNode(14, n13, n15);
    TreeNode n10 = new TreeNode(10, new TreeNode(9), n14);

    return new TreeNode(8, n3, n10);
  }

  /** Renders ints as the strings traversals produce. */
  public static List<String> strings(int... values) {
    List<String> out = new ArrayList<>(values.length);
    for (int v : values) {
      out.add(String.valueOf(v));
    }
    return out;
  }
}
