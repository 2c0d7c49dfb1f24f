package io.nodescope.reflect;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Bounded LRU (Least Recently Used) cache with automatic eviction.
 *
 * <p>Holds per-class field layouts so that probing the same node type repeatedly does not rescan
 * its class hierarchy. Not thread-safe; a cache belongs to one {@link ReflectiveHeap}.
 *
 * @param <K> key type
 * @param <V> value type
 */
final class LruCache<K, V> {

  private final int maxSize;
  private final Map<K, V> cache;

  /**
   * Creates an LRU cache with the specified maximum size.
   *
   * @param maxSize maximum number of entries to keep in cache
   */
  LruCache(int maxSize) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    this.maxSize = maxSize;
    // access order gives LRU eviction
    this.cache =
        new LinkedHashMap<K, V>(maxSize + 1, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return size() > LruCache.this.maxSize;
          }
        };
  }

  /**
   * Returns the cached value for the key, computing and caching it on a miss. Accessing a key
   * marks it as recently used.
   */
  V computeIfAbsent(K key, Function<? super K, ? extends V> loader) {
    V value = cache.get(key);
    if (value == null) {
      value = loader.apply(key);
      cache.put(key, value);
    }
    return value;
  }

  /** Returns the current number of entries in the cache. */
  int size() {
    return cache.size();
  }
}
