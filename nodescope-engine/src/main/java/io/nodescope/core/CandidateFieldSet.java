package io.nodescope.core;

import java.util.List;
import java.util.Objects;

/**
 * Ordered list of acceptable member names for one logical field. Order encodes priority: the first
 * name present on a record wins.
 *
 * @param role what the field means, for logging ("next", "value", ...)
 * @param names candidate names, highest priority first
 */
public record CandidateFieldSet(String role, List<String> names) {

  public CandidateFieldSet {
    Objects.requireNonNull(role, "role must not be null");
    names = List.copyOf(Objects.requireNonNull(names, "names must not be null"));
    if (names.isEmpty()) {
      throw new IllegalArgumentException("candidate set '" + role + "' must not be empty");
    }
  }

  public static CandidateFieldSet of(String role, String... names) {
    return new CandidateFieldSet(role, List.of(names));
  }
}
