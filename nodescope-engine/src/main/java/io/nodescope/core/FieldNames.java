package io.nodescope.core;

/**
 * The member-name tables probed on records of unknown layout. Covers common C/C++ conventions
 * ({@code m_x}, {@code _x}, {@code pX}) and the internal pointer members of libstdc++ and libc++
 * smart pointers.
 */
public final class FieldNames {

  private FieldNames() {}

  public static final CandidateFieldSet NEXT =
      CandidateFieldSet.of("next", "next", "m_next", "_next", "pNext");

  public static final CandidateFieldSet PREV =
      CandidateFieldSet.of("prev", "prev", "m_prev", "_prev", "pPrev");

  public static final CandidateFieldSet VALUE =
      CandidateFieldSet.of("value", "value", "val", "data", "m_data", "key");

  public static final CandidateFieldSet LEFT =
      CandidateFieldSet.of("left", "left", "m_left", "_left");

  public static final CandidateFieldSet RIGHT =
      CandidateFieldSet.of("right", "right", "m_right", "_right");

  public static final CandidateFieldSet CHILDREN =
      CandidateFieldSet.of("children", "children", "m_children");

  public static final CandidateFieldSet NEIGHBORS =
      CandidateFieldSet.of("neighbors", "neighbors", "adj", "edges");

  /** Raw pointer held inside {@code unique_ptr}/{@code shared_ptr}-like wrappers. */
  public static final CandidateFieldSet SMART_POINTER =
      CandidateFieldSet.of("smart pointer", "_M_ptr", "__ptr_", "pointer");

  public static final CandidateFieldSet HEAD =
      CandidateFieldSet.of("head", "head", "m_head", "_head", "top");

  public static final CandidateFieldSet ROOT =
      CandidateFieldSet.of("root", "root", "m_root", "_root");

  public static final CandidateFieldSet SIZE =
      CandidateFieldSet.of("size", "count", "size", "m_size", "_size");

  public static final CandidateFieldSet GRAPH_NODES =
      CandidateFieldSet.of("graph nodes", "nodes", "m_nodes", "adj", "adjacency_list");

  public static final CandidateFieldSet NODE_COUNT =
      CandidateFieldSet.of("node count", "num_nodes", "V", "node_count");

  public static final CandidateFieldSet EDGE_COUNT =
      CandidateFieldSet.of("edge count", "num_edges", "E", "edge_count");
}
