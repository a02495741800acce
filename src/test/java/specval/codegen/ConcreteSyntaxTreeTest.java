package specval.codegen;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConcreteSyntaxTreeTest {

  @Test
  public void testNestedBlocksIndent() {
    var root = new ConcreteSyntaxTree();
    var cls = root.newBlock("class A");
    var m = cls.newBlock("void run()");
    m.writeLine("return;");
    cls.writeLine("int x;");

    assertEquals("class A {\n  void run() {\n    return;\n  }\n  int x;\n}\n", root.toString());
  }

  @Test
  public void testForkFilledLater() {
    var root = new ConcreteSyntaxTree();
    root.writeLine("first");
    var slot = root.fork();
    root.writeLine("last");
    slot.writeLine("middle");

    assertEquals("first\nmiddle\nlast\n", root.toString());
  }

  @Test
  public void testEmptyHeaderOpensBareBlock() {
    var root = new ConcreteSyntaxTree();
    root.newBlock("").write("x").write(" = 1;").writeLine("");

    assertEquals("{\n  x = 1;\n}\n", root.toString());
  }

  @Test
  public void testIsEmpty() {
    var root = new ConcreteSyntaxTree();
    var slot = root.fork();
    assertTrue(root.isEmpty());
    slot.write("x");
    assertFalse(root.isEmpty());
  }
}
