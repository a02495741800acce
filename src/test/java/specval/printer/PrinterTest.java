package specval.printer;

import org.junit.jupiter.api.Test;

import java.util.List;

import specval.core.BinaryOp;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.Member;
import specval.core.MethodKind;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.Variable;
import specval.validator.IdSource;
import specval.validator.ModuleWiring;
import specval.validator.ValidatorOptions;

import static org.junit.jupiter.api.Assertions.*;
import static specval.AstFixtures.*;

public class PrinterTest {

  private static String printValidated(Decl... decls) {
    var wired = ModuleWiring.wire(program(decls), ValidatorOptions.DEFAULT, IdSource.sequential());
    return Printer.print(wired.program(), PrintMode.VALIDATION);
  }

  @Test
  public void testValidatorModuleAppended() {
    String text = printValidated(counterClass());

    assertTrue(text.startsWith("class {:autocontracts} Counter {\n  var count: int\n"), text);
    assertTrue(text.contains("\nmodule Valid {\n  import opened Gen = Gen\n"), text);
    assertTrue(text.contains("  class Counter_valid {\n"), text);
    assertTrue(text.endsWith("}\n"), text);
  }

  @Test
  public void testShimPrintedWithInjectedClauses() {
    String text = printValidated(counterClass());

    assertTrue(text.contains("method Add_valid(x: int, arg_valid: Counter) returns (y: int)"), text);
    assertTrue(text.contains("requires {:injected} arg_valid.Valid()"), text);
    assertTrue(text.contains("modifies arg_valid.Repr"), text);
    assertTrue(text.contains("ensures {:injected} arg_valid.Valid()"), text);
    assertTrue(text.contains("ensures y == arg_valid.count"), text);
    assertTrue(text.contains("y := arg_valid.Add(x);"), text);
    assertTrue(text.contains("predicate Valid_valid(arg_valid: Counter)"), text);
  }

  @Test
  public void testInjectedMarkerOnlyInValidationMode() {
    var wired = ModuleWiring.wire(program(counterClass()), ValidatorOptions.DEFAULT, IdSource.sequential());

    String text = Printer.print(wired.program(), PrintMode.DAFNY);

    assertFalse(text.contains("{:injected}"), text);
    assertTrue(text.contains("requires arg_valid.Valid()"), text);
  }

  @Test
  public void testModuleLevelShimCallsWithoutReceiver() {
    var x = Variable.Formal.in("x", INT);
    var y = Variable.Formal.out("y", INT);
    var top = method("Top", List.of(x), List.of(y), block(assign(ref(y), ref(x))));

    String text = printValidated(new Decl.DefaultClass(List.of(top)));

    assertTrue(text.startsWith("method Top(x: int) returns (y: int)\n{\n  y := x;\n}\n"), text);
    assertTrue(text.contains("method Top_valid(x: int) returns (y: int)"), text);
    assertTrue(text.contains("y := Top(x);"), text);
  }

  @Test
  public void testNoGhostSkipsGhostMembersAndStatements() {
    var x = Variable.Formal.in("x", INT);
    var check = new Stmt.Assert(StmtMeta.NONE, bin(BinaryOp.GT, ref(x), lit(0)), null, null);
    var run = method("Run", List.of(x), List.of(), block(check, new Stmt.Print(StmtMeta.NONE, List.of(ref(x)))));
    var cls = classDecl("C", List.of(), List.of(
        predicate("Inv", lit(true)),
        methodWithKind(MethodKind.LEMMA, "L", block()),
        run), false);
    var prog = program(cls);

    String full = Printer.print(prog, PrintMode.DAFNY);
    String compiled = Printer.print(prog, PrintMode.NO_GHOST);

    assertTrue(full.contains("assert x > 0;"), full);
    assertTrue(full.contains("predicate Inv()"), full);
    assertTrue(full.contains("lemma L()"), full);
    assertFalse(compiled.contains("assert"), compiled);
    assertFalse(compiled.contains("Inv"), compiled);
    assertFalse(compiled.contains("lemma"), compiled);
    assertTrue(compiled.contains("print x;"), compiled);
  }

  @Test
  public void testBinaryPrecedence() {
    var a = Variable.Formal.in("a", INT);
    var b = Variable.Formal.in("b", INT);
    var c = Variable.Formal.in("c", INT);
    var printer = new Printer(PrintMode.DAFNY);

    assertEquals("(a + b) * c", printer.expr(bin(BinaryOp.MUL, bin(BinaryOp.ADD, ref(a), ref(b)), ref(c))));
    assertEquals("a + b * c", printer.expr(bin(BinaryOp.ADD, ref(a), bin(BinaryOp.MUL, ref(b), ref(c)))));
    assertEquals("a - b - c", printer.expr(bin(BinaryOp.SUB, bin(BinaryOp.SUB, ref(a), ref(b)), ref(c))));
    assertEquals("a - (b - c)", printer.expr(bin(BinaryOp.SUB, ref(a), bin(BinaryOp.SUB, ref(b), ref(c)))));
    var p = bin(BinaryOp.GT, ref(a), lit(0));
    var q = bin(BinaryOp.GT, ref(b), lit(0));
    var r = bin(BinaryOp.GT, ref(c), lit(0));
    assertEquals("a > 0 ==> b > 0 ==> c > 0", printer.expr(bin(BinaryOp.IMP, p, bin(BinaryOp.IMP, q, r))));
    assertEquals("(a > 0 ==> b > 0) ==> c > 0", printer.expr(bin(BinaryOp.IMP, bin(BinaryOp.IMP, p, q), r)));
  }

  @Test
  public void testFieldAccessThroughThis() {
    var printer = new Printer(PrintMode.DAFNY);
    assertEquals("this.count", printer.expr(field("count")));
    assertEquals("count", printer.expr(Expr.DotName.of(new Expr.This(null, true), "count")));
  }

  @Test
  public void testGenericWitnessTypePrinted() {
    var t = TypeParameter.of("T");
    var put = method("Put", List.of(Variable.Formal.in("item", new Type.TypeParamRef(t))), List.of(),
        block());
    String text = printValidated(classDecl("Box", List.of(t), List.<Member>of(put), false));

    assertTrue(text.contains("class Box_valid<T> {"), text);
    assertTrue(text.contains("method Put_valid(item: T, arg_valid: Box<T>)"), text);
    assertTrue(text.contains("arg_valid.Put(item);"), text);
  }
}
