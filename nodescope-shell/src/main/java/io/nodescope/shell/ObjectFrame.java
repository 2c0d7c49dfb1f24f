package io.nodescope.shell;

import io.nodescope.reflect.ReflectiveHeap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A frame whose variables are live JVM objects, inspected through a {@link ReflectiveHeap}. All
 * variables share one heap, so the same object reached through two variables has one address.
 */
public final class ObjectFrame implements DebuggerFrame {

  private final ReflectiveHeap heap;
  private final Map<String, Variable> variables = new LinkedHashMap<>();

  public ObjectFrame() {
    this(new ReflectiveHeap());
  }

  public ObjectFrame(ReflectiveHeap heap) {
    this.heap = Objects.requireNonNull(heap, "heap must not be null");
  }

  /** Binds a variable typed by the simple name of its runtime class. */
  public ObjectFrame bind(String name, Object value) {
    return bind(name, value == null ? "void *" : value.getClass().getSimpleName(), value);
  }

  /** Binds a variable with an explicit display type name, e.g. {@code "MyList<int>"}. */
  public ObjectFrame bind(String name, String typeName, Object value) {
    variables.put(name, new Variable(name, typeName, heap.valueOf(value)));
    return this;
  }

  /**
   * Unbinds every variable and resets the heap, releasing the objects inspected so far. Call when
   * the debugged program resumes.
   */
  public void clear() {
    variables.clear();
    heap.reset();
  }

  @Override
  public Optional<Variable> findVariable(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  public Map<String, Variable> variables() {
    return Collections.unmodifiableMap(variables);
  }

  public ReflectiveHeap heap() {
    return heap;
  }
}
