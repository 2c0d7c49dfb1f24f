package io.nodescope.shell;

import static org.junit.jupiter.api.Assertions.*;

import io.nodescope.shell.test.Containers.MyList;
import org.junit.jupiter.api.Test;

class ObjectFrameTest {

  @Test
  void testBind_TypeNameFromRuntimeClass() {
    ObjectFrame frame = new ObjectFrame().bind("lst", MyList.of(1, 2));

    Variable v = frame.findVariable("lst").orElseThrow();
    assertEquals("MyList", v.typeName());
    assertFalse(v.value().isPointer());
  }

  @Test
  void testBind_ExplicitTypeName() {
    ObjectFrame frame = new ObjectFrame().bind("lst", "MyList<int>", MyList.of(1));

    assertEquals("MyList<int>", frame.findVariable("lst").orElseThrow().typeName());
  }

  @Test
  void testBind_NullIsNullPointer() {
    ObjectFrame frame = new ObjectFrame().bind("p", null);

    Variable v = frame.findVariable("p").orElseThrow();
    assertEquals("void *", v.typeName());
    assertEquals(0L, v.value().address());
  }

  @Test
  void testSharedHeapGivesOneAddressPerObject() {
    MyList list = MyList.of(1);
    ObjectFrame frame = new ObjectFrame().bind("a", list).bind("b", list);

    assertEquals(
        frame.findVariable("a").orElseThrow().value().address(),
        frame.findVariable("b").orElseThrow().value().address());
    assertEquals(frame.heap().addressOf(list), frame.findVariable("a").get().value().address());
  }

  @Test
  void testUnknownVariable() {
    ObjectFrame frame = new ObjectFrame();

    assertTrue(frame.findVariable("missing").isEmpty());
    assertTrue(frame.variables().isEmpty());
    assertTrue(frame.isValid());
  }

  @Test
  void testClear_ReleasesVariablesAndAddresses() {
    ObjectFrame frame = new ObjectFrame().bind("a", MyList.of(1, 2, 3));
    assertTrue(frame.heap().objectCount() > 0);

    frame.clear();

    assertTrue(frame.findVariable("a").isEmpty());
    assertEquals(0, frame.heap().objectCount());
  }
}
