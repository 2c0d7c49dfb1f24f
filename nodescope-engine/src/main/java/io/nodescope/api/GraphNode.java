package io.nodescope.api;

/**
 * A node declaration in a structural export.
 *
 * @param address canonical address of the node
 * @param label display label (unescaped)
 */
public record GraphNode(long address, String label) {

  /** Renders {@code Node_<address> [label="<escaped label>"];}. */
  public String toDotLine() {
    return "Node_" + Long.toUnsignedString(address) + " [label=\"" + escapeLabel(label) + "\"];";
  }

  /** Escapes backslashes, double quotes and line breaks for use inside a quoted DOT label. */
  public static String escapeLabel(String label) {
    if (label == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(label.length() + 8);
    for (int i = 0; i < label.length(); i++) {
      char c = label.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        case '\r' -> {}
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }
}
