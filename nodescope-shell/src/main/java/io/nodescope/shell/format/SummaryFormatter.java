package io.nodescope.shell.format;

import io.nodescope.api.InspectorOptions;
import io.nodescope.api.NodeHandle;
import io.nodescope.shell.render.Palette;

/** Renders the one-line summary shown next to a variable of a recognized container type. */
@FunctionalInterface
public interface SummaryFormatter {

  /**
   * @param value the container (or a pointer to it)
   * @param options settings for this call
   * @param palette console colours; ignored by formatters whose output is always plain
   */
  String summarize(NodeHandle value, InspectorOptions options, Palette palette);
}
