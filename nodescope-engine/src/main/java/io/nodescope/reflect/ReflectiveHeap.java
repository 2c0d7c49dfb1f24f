package io.nodescope.reflect;

import io.nodescope.api.NodeHandle;
import it.unimi.dsi.fastutil.objects.Reference2LongOpenHashMap;
import java.lang.ref.Reference;
import java.lang.reflect.Field;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Address space over live JVM objects, read through {@code java.lang.reflect}.
 *
 * <p>Objects are the records; reference-typed fields and collection elements are the pointers.
 * Each object reached through this heap gets a synthetic address on first sight, assigned by
 * identity and stable for the lifetime of the heap, so two handles to the same object always
 * normalize to the same address.
 *
 * <p>Members are classified by declared type and current value:
 *
 * <ul>
 *   <li>primitives, boxed numbers, characters, booleans, strings and enums are scalars
 *   <li>arrays and {@link Collection}s are collections
 *   <li>{@link Optional}, {@link AtomicReference} and {@link Reference} are smart pointers exposing
 *       their referent through a {@code pointer} member
 *   <li>every other reference is a raw pointer
 * </ul>
 *
 * <p>The address table holds a strong reference to every object it has numbered. A host that
 * inspects a program across many stops calls {@link #reset()} when the inspected objects change,
 * so objects from earlier stops can be collected.
 *
 * <p><strong>Thread safety:</strong> not thread-safe; confine a heap and its handles to one
 * thread.
 */
public final class ReflectiveHeap {

  private static final Logger LOG = LoggerFactory.getLogger(ReflectiveHeap.class);

  /** Addresses start here and advance by {@link #OBJECT_ALIGNMENT} per object. */
  static final long BASE_ADDRESS = 0x7f00_0000_0000L;

  /** Room left for member storage addresses between consecutive objects. */
  static final long OBJECT_ALIGNMENT = 0x1000L;

  /** Distance between consecutive member storage slots of one object. */
  static final long SLOT_SIZE = 8L;

  private static final int LAYOUT_CACHE_SIZE = 256;

  private final Reference2LongOpenHashMap<Object> addresses = new Reference2LongOpenHashMap<>();
  private final LruCache<Class<?>, FieldLayout> layouts = new LruCache<>(LAYOUT_CACHE_SIZE);
  private long nextAddress = BASE_ADDRESS;

  public ReflectiveHeap() {
    addresses.defaultReturnValue(0L);
  }

  /**
   * Returns a raw-pointer handle to {@code target}, as if read from a variable of pointer type.
   *
   * @param target the object pointed to, or null for a null pointer
   */
  public NodeHandle pointerTo(Object target) {
    return new ReflectiveHandles.PointerHandle(this, target);
  }

  /**
   * Returns a handle denoting {@code value} itself: a record for ordinary objects, a collection
   * for arrays and collections, a scalar for primitives and strings.
   *
   * @param value the object; null yields a null pointer
   */
  public NodeHandle valueOf(Object value) {
    if (value == null) {
      return pointerTo(null);
    }
    NodeHandle handle = classify(value, value.getClass(), addressOf(value));
    if (handle instanceof ReflectiveHandles.PointerHandle) {
      return new ReflectiveHandles.RecordHandle(this, value);
    }
    return handle;
  }

  /**
   * Returns the synthetic address of {@code object}, assigning one on first sight.
   *
   * @return the address, or 0 for null
   */
  public long addressOf(Object object) {
    if (object == null) {
      return 0L;
    }
    long address = addresses.getLong(object);
    if (address == 0L) {
      address = nextAddress;
      nextAddress += OBJECT_ALIGNMENT;
      addresses.put(object, address);
    }
    return address;
  }

  /**
   * Forgets every assigned address. Handles obtained before the reset stay usable but report
   * addresses numbered afresh, so they must not be compared with addresses read earlier.
   */
  public void reset() {
    LOG.debug("Releasing {} addressed objects", addresses.size());
    addresses.clear();
    nextAddress = BASE_ADDRESS;
  }

  /** Returns the number of objects that have been assigned an address. */
  public int objectCount() {
    return addresses.size();
  }

  FieldLayout layoutOf(Class<?> type) {
    return layouts.computeIfAbsent(type, FieldLayout::of);
  }

  /** Reads a field, returning an invalid handle if the read fails. */
  NodeHandle readField(Object owner, String name) {
    FieldLayout layout = layoutOf(owner.getClass());
    Field field = layout.get(name);
    if (field == null) {
      return null;
    }
    long storage = addressOf(owner) + SLOT_SIZE * (layout.indexOf(name) + 1);
    if (!layout.isReadable(name)) {
      return ReflectiveHandles.InvalidHandle.INSTANCE;
    }
    try {
      return classify(field.get(owner), field.getType(), storage);
    } catch (IllegalAccessException | RuntimeException e) {
      LOG.debug("Cannot read {}.{}: {}", owner.getClass().getName(), name, e.getMessage());
      return ReflectiveHandles.InvalidHandle.INSTANCE;
    }
  }

  /** Wraps a value read from storage of the given declared type. */
  NodeHandle classify(Object value, Class<?> declaredType, long storage) {
    if (declaredType.isPrimitive()
        || isScalar(value)
        || (value == null && isScalarType(declaredType))) {
      return new ReflectiveHandles.ScalarHandle(value, storage);
    }
    if (value instanceof Optional<?>
        || value instanceof AtomicReference<?>
        || value instanceof Reference<?>) {
      return new ReflectiveHandles.SmartPointerHandle(this, value, storage);
    }
    if (value instanceof Collection<?>
        || (value != null && value.getClass().isArray())
        || (value == null && isCollectionType(declaredType))) {
      return new ReflectiveHandles.CollectionHandle(this, value, storage);
    }
    return new ReflectiveHandles.PointerHandle(this, value);
  }

  private static boolean isScalar(Object value) {
    return value instanceof Number
        || value instanceof CharSequence
        || value instanceof Character
        || value instanceof Boolean
        || value instanceof Enum<?>;
  }

  private static boolean isCollectionType(Class<?> type) {
    return type.isArray() || Collection.class.isAssignableFrom(type);
  }

  private static boolean isScalarType(Class<?> type) {
    return Number.class.isAssignableFrom(type)
        || CharSequence.class.isAssignableFrom(type)
        || type == Character.class
        || type == Boolean.class
        || type.isEnum();
  }
}
