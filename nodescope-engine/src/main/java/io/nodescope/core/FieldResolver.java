package io.nodescope.core;

import io.nodescope.api.NodeHandle;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the member that plays a logical role on a record whose layout is not known ahead of time.
 * Candidates are tried in order and the first one the record declares wins; existence is
 * structural, so a member holding a null pointer still matches.
 */
public final class FieldResolver {

  private FieldResolver() {}

  /**
   * Returns the name of the first candidate declared by {@code record}.
   *
   * @param record a dereferenced record, may be null
   * @param candidates names to try
   * @return the matching name, or empty if none is declared or the record is unreadable
   */
  public static Optional<String> resolveName(NodeHandle record, CandidateFieldSet candidates) {
    Objects.requireNonNull(candidates, "candidates must not be null");
    if (record == null || !record.isValid()) {
      return Optional.empty();
    }
    for (String name : candidates.names()) {
      if (record.hasField(name)) {
        return Optional.of(name);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the first candidate member declared by {@code record}.
   *
   * @param record a dereferenced record, may be null
   * @param candidates names to try
   * @return the member handle, or null if none is declared or it cannot be read
   */
  public static NodeHandle resolve(NodeHandle record, CandidateFieldSet candidates) {
    return resolveName(record, candidates).map(record::getField).orElse(null);
  }

  /**
   * Reads a member by a name resolved earlier on another record of the same shape.
   *
   * @return the member, or null if the record is unreadable or lacks it
   */
  public static NodeHandle field(NodeHandle record, String name) {
    if (record == null || !record.isValid() || name == null) {
      return null;
    }
    return record.getField(name);
  }

  /** Returns true if {@code record} declares any of the candidate names. */
  public static boolean isPresent(NodeHandle record, CandidateFieldSet candidates) {
    return resolveName(record, candidates).isPresent();
  }
}
