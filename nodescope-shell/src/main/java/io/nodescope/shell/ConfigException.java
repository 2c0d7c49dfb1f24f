package io.nodescope.shell;

/** Thrown when a formatter setting is unknown or given a value it cannot take. */
public final class ConfigException extends RuntimeException {

  public ConfigException(String message) {
    super(message);
  }
}
