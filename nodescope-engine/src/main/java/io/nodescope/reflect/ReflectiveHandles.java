package io.nodescope.reflect;

import io.nodescope.api.NodeHandle;
import java.lang.ref.Reference;
import java.lang.reflect.Array;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** The handle kinds handed out by {@link ReflectiveHeap}. */
final class ReflectiveHandles {

  private ReflectiveHandles() {}

  /** Name of the member through which smart pointers expose their referent. */
  static final String SMART_POINTER_MEMBER = "pointer";

  abstract static class Base implements NodeHandle {

    @Override
    public boolean isValid() {
      return true;
    }

    @Override
    public boolean isPointer() {
      return false;
    }

    @Override
    public NodeHandle dereference() {
      return null;
    }

    @Override
    public boolean hasField(String name) {
      return false;
    }

    @Override
    public NodeHandle getField(String name) {
      return null;
    }

    @Override
    public int numChildren() {
      return 0;
    }

    @Override
    public NodeHandle childAt(int index) {
      return null;
    }

    @Override
    public String summary() {
      return null;
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + "[0x" + Long.toHexString(address()) + "]";
    }
  }

  static String describe(ReflectiveHeap heap, Object object) {
    return object.getClass().getSimpleName() + "@" + Long.toHexString(heap.addressOf(object));
  }

  /** A reference-typed field, variable or element. */
  static final class PointerHandle extends Base {
    private final ReflectiveHeap heap;
    private final Object target;

    PointerHandle(ReflectiveHeap heap, Object target) {
      this.heap = heap;
      this.target = target;
    }

    @Override
    public boolean isPointer() {
      return true;
    }

    @Override
    public long address() {
      return heap.addressOf(target);
    }

    @Override
    public NodeHandle dereference() {
      return target == null ? null : heap.valueOf(target);
    }

    @Override
    public String rawValue() {
      return target == null ? "0x0" : describe(heap, target);
    }
  }

  /** An object seen as a record of named members. */
  static final class RecordHandle extends Base {
    private final ReflectiveHeap heap;
    private final Object object;

    RecordHandle(ReflectiveHeap heap, Object object) {
      this.heap = heap;
      this.object = object;
    }

    @Override
    public long address() {
      return heap.addressOf(object);
    }

    @Override
    public NodeHandle dereference() {
      return this;
    }

    @Override
    public boolean hasField(String name) {
      return heap.layoutOf(object.getClass()).has(name);
    }

    @Override
    public NodeHandle getField(String name) {
      return heap.readField(object, name);
    }

    @Override
    public String rawValue() {
      return describe(heap, object);
    }
  }

  /** An array or {@link Collection}; elements are read in iteration order. */
  static final class CollectionHandle extends Base {
    private final ReflectiveHeap heap;
    private final Object collection;
    private final long storage;
    private Object[] snapshot;

    CollectionHandle(ReflectiveHeap heap, Object collection, long storage) {
      this.heap = heap;
      this.collection = collection;
      this.storage = storage;
    }

    @Override
    public long address() {
      return collection == null ? storage : heap.addressOf(collection);
    }

    @Override
    public int numChildren() {
      if (collection == null) {
        return 0;
      }
      if (collection.getClass().isArray()) {
        return Array.getLength(collection);
      }
      return ((Collection<?>) collection).size();
    }

    @Override
    public NodeHandle childAt(int index) {
      if (index < 0 || index >= numChildren()) {
        return null;
      }
      long slot = address() + ReflectiveHeap.SLOT_SIZE * (index + 1);
      if (collection.getClass().isArray()) {
        Class<?> component = collection.getClass().getComponentType();
        return heap.classify(Array.get(collection, index), component, slot);
      }
      return heap.classify(element(index), Object.class, slot);
    }

    private Object element(int index) {
      if (collection instanceof List<?> list) {
        return list.get(index);
      }
      if (snapshot == null) {
        snapshot = ((Collection<?>) collection).toArray();
      }
      return index < snapshot.length ? snapshot[index] : null;
    }

    @Override
    public String summary() {
      return "size=" + numChildren();
    }

    @Override
    public String rawValue() {
      return collection == null ? "0x0" : describe(heap, collection);
    }
  }

  /** A primitive, boxed number, character, boolean, string or enum. */
  static final class ScalarHandle extends Base {
    private final Object value;
    private final long storage;

    ScalarHandle(Object value, long storage) {
      this.value = value;
      this.storage = storage;
    }

    @Override
    public long address() {
      return storage;
    }

    @Override
    public String summary() {
      return value instanceof CharSequence text ? "\"" + text + "\"" : null;
    }

    @Override
    public String rawValue() {
      if (value instanceof Enum<?> constant) {
        return constant.name();
      }
      return String.valueOf(value);
    }
  }

  /**
   * A wrapper owning a single reference: {@link Optional}, {@link AtomicReference} or {@link
   * Reference}. The referent is exposed as a raw pointer member named {@value
   * #SMART_POINTER_MEMBER}.
   */
  static final class SmartPointerHandle extends Base {
    private final ReflectiveHeap heap;
    private final Object wrapper;
    private final long storage;

    SmartPointerHandle(ReflectiveHeap heap, Object wrapper, long storage) {
      this.heap = heap;
      this.wrapper = wrapper;
      this.storage = storage;
    }

    private Object referent() {
      if (wrapper instanceof Optional<?> optional) {
        return optional.orElse(null);
      }
      if (wrapper instanceof AtomicReference<?> ref) {
        return ref.get();
      }
      if (wrapper instanceof Reference<?> ref) {
        return ref.get();
      }
      return null;
    }

    @Override
    public long address() {
      return storage != 0L ? storage : heap.addressOf(wrapper);
    }

    @Override
    public NodeHandle dereference() {
      Object referent = referent();
      return referent == null ? null : heap.valueOf(referent);
    }

    @Override
    public boolean hasField(String name) {
      return SMART_POINTER_MEMBER.equals(name);
    }

    @Override
    public NodeHandle getField(String name) {
      return hasField(name) ? new PointerHandle(heap, referent()) : null;
    }

    @Override
    public String rawValue() {
      Object referent = referent();
      return wrapper.getClass().getSimpleName()
          + " -> "
          + (referent == null ? "0x0" : describe(heap, referent));
    }
  }

  /** Result of a failed foreign read. */
  static final class InvalidHandle extends Base {
    static final InvalidHandle INSTANCE = new InvalidHandle();

    @Override
    public boolean isValid() {
      return false;
    }

    @Override
    public long address() {
      return 0L;
    }

    @Override
    public String rawValue() {
      return null;
    }
  }
}
