package io.nodescope.shell;

import java.io.PrintStream;

/**
 * Sink for command results. Results and errors travel on separate channels so a debugger host
 * can route errors to its own error console.
 */
public interface OutputWriter {

  /** Prints one line of command output. */
  void println(String s);

  /** Reports why a command could not complete. */
  void error(String s);

  /** Prints each line in order. */
  default void printLines(Iterable<String> lines) {
    for (String line : lines) {
      println(line);
    }
  }

  /** Creates a writer sending results to {@code out} and errors to {@code err}. */
  static OutputWriter of(PrintStream out, PrintStream err) {
    return new OutputWriter() {
      @Override
      public void println(String s) {
        out.println(s);
      }

      @Override
      public void error(String s) {
        err.println(s);
      }
    };
  }

  /** Creates a writer on the process's standard streams. */
  static OutputWriter console() {
    return of(System.out, System.err);
  }
}
