package io.nodescope.core;

import io.nodescope.api.NodeHandle;

/**
 * Normalizes raw pointers, smart-pointer wrappers and plain values to one identity and one
 * dereferenced record.
 *
 * <ul>
 *   <li>A pointer-typed handle's address is its numeric value.
 *   <li>A wrapper holding an internal raw pointer ({@link FieldNames#SMART_POINTER}) takes the
 *       address of that pointer.
 *   <li>Anything else falls back to the address of its own storage.
 * </ul>
 *
 * <p>Two handles reaching the same record normalize to the same address.
 */
public final class PointerNormalizer {

  private PointerNormalizer() {}

  /**
   * Computes the canonical address of a handle.
   *
   * @param handle the handle, may be null
   * @return the canonical address, 0 for null/invalid handles and null pointers
   */
  public static long address(NodeHandle handle) {
    if (handle == null || !handle.isValid()) {
      return 0L;
    }
    if (handle.isPointer()) {
      return handle.address();
    }
    NodeHandle inner = FieldResolver.resolve(handle, FieldNames.SMART_POINTER);
    if (inner != null && inner.isValid()) {
      return inner.address();
    }
    return handle.address();
  }

  /**
   * Unwraps one level of indirection. Smart-pointer unwrapping takes priority over plain pointer
   * dereference; a handle that is neither denotes the record itself.
   *
   * @param handle the handle, may be null
   * @return the record, or null if the address is 0 or the record cannot be read
   */
  public static NodeHandle dereference(NodeHandle handle) {
    if (handle == null || !handle.isValid()) {
      return null;
    }
    NodeHandle inner = FieldResolver.resolve(handle, FieldNames.SMART_POINTER);
    if (inner != null && inner.isValid()) {
      return readable(inner.address() == 0L ? null : inner.dereference());
    }
    if (handle.isPointer()) {
      return readable(handle.address() == 0L ? null : handle.dereference());
    }
    return handle;
  }

  /** Returns true if the handle normalizes to a non-zero address. */
  public static boolean isNonNull(NodeHandle handle) {
    return address(handle) != 0L;
  }

  private static NodeHandle readable(NodeHandle record) {
    return record != null && record.isValid() ? record : null;
  }
}
