package io.nodescope.shell.render;

import io.nodescope.api.TraversalResult;
import java.util.Map;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

/**
 * Console colouring for summaries. Colours are emitted as ANSI sequences only when the console is
 * known to render them; otherwise every method returns its input unchanged.
 */
public final class Palette {

  /** Environment variable and value identifying a console that renders ANSI colours. */
  static final String TERM_PROGRAM = "TERM_PROGRAM";

  static final String ANSI_TERM_PROGRAM = "vscode";

  public static final Palette PLAIN = new Palette(false);
  public static final Palette ANSI = new Palette(true);

  private static final AttributedStyle VALUE =
      AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW);
  private static final AttributedStyle MARKER =
      AttributedStyle.DEFAULT.foreground(AttributedStyle.RED);
  private static final AttributedStyle SEPARATOR =
      AttributedStyle.BOLD.foreground(AttributedStyle.CYAN);
  private static final AttributedStyle SIZE =
      AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN);

  private final boolean colored;

  private Palette(boolean colored) {
    this.colored = colored;
  }

  /** Picks the palette for the given process environment. */
  public static Palette forEnvironment(Map<String, String> env) {
    return ANSI_TERM_PROGRAM.equals(env.get(TERM_PROGRAM)) ? ANSI : PLAIN;
  }

  public boolean isColored() {
    return colored;
  }

  /** Styles a traversal value: markers in red, data in yellow. */
  public String item(String s) {
    return TraversalResult.isMarker(s) ? marker(s) : value(s);
  }

  public String value(String s) {
    return style(s, VALUE);
  }

  public String marker(String s) {
    return style(s, MARKER);
  }

  public String separator(String s) {
    return style(s, SEPARATOR);
  }

  public String size(String s) {
    return style(s, SIZE);
  }

  private String style(String s, AttributedStyle style) {
    if (!colored || s.isEmpty()) {
      return s;
    }
    return new AttributedString(s, style).toAnsi();
  }
}
