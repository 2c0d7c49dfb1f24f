package io.nodescope.reflect;

import static org.junit.jupiter.api.Assertions.*;

import io.nodescope.api.NodeHandle;
import io.nodescope.core.PointerNormalizer;
import io.nodescope.test.Fixtures.DoublyNode;
import io.nodescope.test.Fixtures.ListNode;
import io.nodescope.test.Fixtures.NaryNode;
import java.lang.ref.WeakReference;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReflectiveHeapTest {

  private ReflectiveHeap heap;

  @BeforeEach
  void setUp() {
    heap = new ReflectiveHeap();
  }

  @Test
  void testAddressesStableAndDistinct() {
    ListNode a = new ListNode(1);
    ListNode b = new ListNode(1);

    long first = heap.addressOf(a);
    assertEquals(first, heap.addressOf(a));
    assertNotEquals(first, heap.addressOf(b));
    assertEquals(0L, heap.addressOf(null));
    assertEquals(2, heap.objectCount());
  }

  @Test
  void testPointerHandles() {
    ListNode node = new ListNode(3);
    NodeHandle pointer = heap.pointerTo(node);
    NodeHandle nullPointer = heap.pointerTo(null);

    assertTrue(pointer.isPointer());
    assertEquals(heap.addressOf(node), pointer.address());
    assertEquals("3", pointer.dereference().getField("value").rawValue());

    assertTrue(nullPointer.isValid());
    assertEquals(0L, nullPointer.address());
    assertNull(nullPointer.dereference());
    assertEquals("0x0", nullPointer.rawValue());
  }

  @Test
  void testRecordMembers() {
    ListNode node = new ListNode(5);
    NodeHandle record = heap.valueOf(node);

    assertFalse(record.isPointer());
    assertSame(record, record.dereference());
    assertTrue(record.hasField("next"));
    assertFalse(record.hasField("prev"));
    assertNull(record.getField("prev"));

    NodeHandle next = record.getField("next");
    assertTrue(next.isPointer());
    assertEquals(0L, next.address());
  }

  @Test
  void testMemberStorageAddressesDifferFromObject() {
    ListNode node = new ListNode(5);
    NodeHandle value = heap.valueOf(node).getField("value");

    assertNotEquals(0L, value.address());
    assertNotEquals(heap.addressOf(node), value.address());
  }

  @Test
  void testStringSummaryIsQuoted() {
    NodeHandle data = heap.valueOf(new DoublyNode("text")).getField("m_data");

    assertEquals("\"text\"", data.summary());
    assertEquals("text", data.rawValue());
  }

  @Test
  void testNullStringMemberIsScalar() {
    NodeHandle data = heap.valueOf(new DoublyNode(null)).getField("m_data");

    assertFalse(data.isPointer());
    assertEquals("null", data.rawValue());
  }

  @Test
  void testCollections() {
    NaryNode child = new NaryNode("c");
    NodeHandle children = heap.valueOf(new NaryNode("p", child)).getField("children");

    assertEquals(1, children.numChildren());
    assertEquals("size=1", children.summary());
    assertEquals(heap.addressOf(child), children.childAt(0).address());
    assertNull(children.childAt(1));
    assertNull(children.childAt(-1));
  }

  @Test
  void testArraysAndUnorderedCollections() {
    NodeHandle array = heap.valueOf(new int[] {4, 5});
    NodeHandle set = heap.valueOf(Set.of("only"));

    assertEquals(2, array.numChildren());
    assertEquals("5", array.childAt(1).rawValue());
    assertEquals(1, set.numChildren());
    assertEquals("\"only\"", set.childAt(0).summary());
  }

  @Test
  void testScalarsAndEnums() {
    assertEquals("42", heap.valueOf(42).rawValue());
    assertEquals("SECONDS", heap.valueOf(TimeUnit.SECONDS).rawValue());
  }

  @Test
  void testSmartPointers() {
    ListNode node = new ListNode(8);
    for (Object wrapper :
        List.of(Optional.of(node), new AtomicReference<>(node), new WeakReference<>(node))) {
      NodeHandle handle = heap.valueOf(wrapper);

      assertFalse(handle.isPointer());
      assertTrue(handle.hasField("pointer"));
      assertEquals(heap.addressOf(node), PointerNormalizer.address(handle));
      assertEquals(
          "8", PointerNormalizer.dereference(handle).getField("value").rawValue(), "" + wrapper);
    }
  }

  @Test
  void testEmptySmartPointer() {
    NodeHandle handle = heap.valueOf(Optional.empty());

    assertEquals(0L, PointerNormalizer.address(handle));
    assertNull(PointerNormalizer.dereference(handle));
  }

  @Test
  void testLayoutCache() {
    LruCache<String, Integer> cache = new LruCache<>(2);
    cache.computeIfAbsent("a", String::length);
    cache.computeIfAbsent("bb", String::length);
    cache.computeIfAbsent("ccc", String::length);

    assertEquals(2, cache.size());
    assertEquals(3, cache.computeIfAbsent("ccc", k -> -1));
    assertEquals(-1, cache.computeIfAbsent("a", k -> -1));
    assertThrows(IllegalArgumentException.class, () -> new LruCache<String, String>(0));
  }

  @Test
  void testReset_ReleasesAddressedObjects() {
    for (int i = 0; i < 100; i++) {
      heap.addressOf(new ListNode(i));
    }
    assertEquals(100, heap.objectCount());

    heap.reset();

    assertEquals(0, heap.objectCount());
    assertEquals(ReflectiveHeap.BASE_ADDRESS, heap.addressOf(new ListNode(7)));
    assertEquals(1, heap.objectCount());
  }
}
