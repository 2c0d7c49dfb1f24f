package io.nodescope.api;

/**
 * A borrowed reference into memory the engine does not own. A handle may denote a raw pointer, a
 * record (struct/object) reached through one, a collection-shaped member, or a scalar payload.
 *
 * <p>Every read through a handle is a potentially failing read of foreign memory. Implementations
 * report failures by returning {@code null}, an invalid handle, or a zero address; they never
 * throw for unreadable memory.
 *
 * <p>The engine performs no host-specific calls beyond this capability set.
 */
public interface NodeHandle {

  /** Returns true if the handle still refers to readable memory. */
  boolean isValid();

  /** Returns true if the handle's own type is a raw pointer. */
  boolean isPointer();

  /**
   * Returns the numeric pointer value for pointer handles (0 for null), or the address of the
   * handle's own storage otherwise.
   */
  long address();

  /**
   * Follows one level of indirection.
   *
   * @return the pointed-to record, or null if the pointer is null or the target is unreadable
   */
  NodeHandle dereference();

  /**
   * Returns true if the handle's type declares a member with the given name. Existence is
   * structural: a declared member holding null is still present.
   */
  boolean hasField(String name);

  /**
   * Returns the named member.
   *
   * @param name member name
   * @return the member, or null if the type declares no such member
   */
  NodeHandle getField(String name);

  /** Returns the element count for collection-shaped handles, 0 otherwise. */
  int numChildren();

  /**
   * Returns the collection element at {@code index}.
   *
   * @return the element, or null if out of range or unreadable
   */
  NodeHandle childAt(int index);

  /**
   * Returns a rich, pre-formatted rendering of the value (e.g. the text of a string), or null if
   * the host has none for this type.
   */
  String summary();

  /** Returns the raw scalar rendering of the value, or null if unavailable. */
  String rawValue();
}
