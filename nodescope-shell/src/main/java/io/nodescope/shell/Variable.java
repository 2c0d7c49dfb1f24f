package io.nodescope.shell;

import io.nodescope.api.NodeHandle;
import java.util.Objects;

/**
 * A named variable of the inspected program.
 *
 * @param name variable name
 * @param typeName display name of the variable's type, used for formatter lookup
 * @param value handle to the variable's storage
 */
public record Variable(String name, String typeName, NodeHandle value) {

  public Variable {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(typeName, "typeName must not be null");
    Objects.requireNonNull(value, "value must not be null");
  }
}
