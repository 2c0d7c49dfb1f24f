package io.nodescope.reflect;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instance fields of a class and its superclasses, by name. A field declared in a subclass hides a
 * superclass field of the same name. Fields that cannot be made accessible (module boundaries)
 * stay part of the layout but read as unavailable.
 */
final class FieldLayout {

  private static final Logger LOG = LoggerFactory.getLogger(FieldLayout.class);

  private final Map<String, Field> fields;
  private final Map<String, Integer> indexes;
  private final Set<String> readable;

  private FieldLayout(Map<String, Field> fields, Set<String> readable) {
    this.fields = Collections.unmodifiableMap(fields);
    this.readable = readable;
    Map<String, Integer> idx = new LinkedHashMap<>();
    for (String name : fields.keySet()) {
      idx.put(name, idx.size());
    }
    this.indexes = idx;
  }

  static FieldLayout of(Class<?> type) {
    Map<String, Field> fields = new LinkedHashMap<>();
    Set<String> readable = new HashSet<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Field f : c.getDeclaredFields()) {
        if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) {
          continue;
        }
        if (fields.putIfAbsent(f.getName(), f) != null) {
          continue;
        }
        try {
          f.setAccessible(true);
          readable.add(f.getName());
        } catch (RuntimeException e) {
          LOG.debug("Field {}.{} is not accessible: {}", c.getName(), f.getName(), e.getMessage());
        }
      }
    }
    return new FieldLayout(fields, readable);
  }

  boolean has(String name) {
    return fields.containsKey(name);
  }

  Field get(String name) {
    return fields.get(name);
  }

  boolean isReadable(String name) {
    return readable.contains(name);
  }

  /** Position of the field in the layout, used to derive a storage address. */
  int indexOf(String name) {
    Integer index = indexes.get(name);
    return index != null ? index : -1;
  }
}
