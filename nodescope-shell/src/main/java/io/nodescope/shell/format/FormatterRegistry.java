package io.nodescope.shell.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registry of built-in summary formatters, keyed by type-name pattern.
 *
 * <p>Entries are tried in registration order and the first matching pattern wins. Every pattern
 * accepts an optional template argument list, so {@code MyList} and {@code MyList<int>} both
 * match.
 */
public final class FormatterRegistry {

  /** A type-name pattern and the formatter it selects. */
  public record Entry(Pattern pattern, SummaryFormatter formatter) {}

  private static final List<Entry> ENTRIES;

  static {
    List<Entry> entries = new ArrayList<>();

    SummaryFormatter linear = new LinearContainerFormatter();
    register(entries, "(Custom|My)?(Linked)?List", linear);
    register(entries, "(Custom|My)?Stack", linear);
    register(entries, "(Custom|My)?Queue", linear);
    register(entries, "(Custom|My)?(Binary)?Tree", new TreeFormatter());
    register(entries, "(Custom|My)?Graph", new GraphFormatter());
    register(entries, "(Custom|My)?(Graph)?Node", new GraphNodeFormatter());

    ENTRIES = Collections.unmodifiableList(entries);
  }

  private FormatterRegistry() {}

  private static void register(List<Entry> entries, String typeName, SummaryFormatter formatter) {
    entries.add(new Entry(Pattern.compile("^" + typeName + "(<.*>)?$"), formatter));
  }

  /**
   * Finds the formatter for a type.
   *
   * @param typeName display name of the type, e.g. {@code "MyList<int>"}
   * @return the first matching formatter, or empty if none matches
   */
  public static Optional<SummaryFormatter> find(String typeName) {
    if (typeName == null) {
      return Optional.empty();
    }
    String trimmed = typeName.trim();
    for (Entry entry : ENTRIES) {
      if (entry.pattern().matcher(trimmed).matches()) {
        return Optional.of(entry.formatter());
      }
    }
    return Optional.empty();
  }

  /** Returns all entries in lookup order. */
  public static List<Entry> entries() {
    return ENTRIES;
  }
}
