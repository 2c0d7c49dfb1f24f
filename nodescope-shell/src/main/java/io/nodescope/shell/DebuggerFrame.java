package io.nodescope.shell;

import java.util.Optional;

/** The execution context commands resolve variable names against. */
public interface DebuggerFrame {

  /** Returns true if the frame can currently be inspected. */
  default boolean isValid() {
    return true;
  }

  /**
   * Looks up a variable visible in this frame.
   *
   * @param name variable name as typed by the user
   * @return the variable, or empty if no such variable is visible
   */
  Optional<Variable> findVariable(String name);
}
