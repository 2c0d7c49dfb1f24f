package io.nodescope.core;

import io.nodescope.api.NodeHandle;
import io.nodescope.api.TraversalResult;

/**
 * Renders a payload member as display text: the host's rich summary when it has one (surrounding
 * double quotes stripped), else the raw scalar value, else {@link TraversalResult#INVALID}.
 */
public final class ValueSummarizer {

  private ValueSummarizer() {}

  /**
   * Summarizes a payload member.
   *
   * @param value the payload member, may be null
   */
  public static String summarize(NodeHandle value) {
    if (value == null || !value.isValid()) {
      return TraversalResult.INVALID;
    }
    String summary = value.summary();
    if (summary != null && !summary.isEmpty()) {
      return stripQuotes(summary);
    }
    String raw = value.rawValue();
    return raw != null ? raw : TraversalResult.INVALID;
  }

  /** Summarizes the payload of a dereferenced node, found through {@link FieldNames#VALUE}. */
  public static String summarizeNode(NodeHandle record) {
    return summarize(FieldResolver.resolve(record, FieldNames.VALUE));
  }

  private static String stripQuotes(String s) {
    int start = 0;
    int end = s.length();
    while (start < end && s.charAt(start) == '"') {
      start++;
    }
    while (end > start && s.charAt(end - 1) == '"') {
      end--;
    }
    return s.substring(start, end);
  }
}
