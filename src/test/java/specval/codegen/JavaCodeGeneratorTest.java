package specval.codegen;

import org.junit.jupiter.api.Test;

import java.util.List;

import specval.core.AttributedExpr;
import specval.core.BinaryOp;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.Member;
import specval.core.Rhs;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Variable;
import specval.validator.IdSource;
import specval.validator.ModuleWiring;
import specval.validator.ValidatorOptions;

import static org.junit.jupiter.api.Assertions.*;
import static specval.AstFixtures.*;

public class JavaCodeGeneratorTest {

  private final JavaCodeGenerator generator = new JavaCodeGenerator();

  @Test
  public void testGhostAssertBecomesRuntimeCheck() {
    var x = Variable.Formal.in("x", INT);
    var assertion = new Stmt.Assert(StmtMeta.GHOST, bin(BinaryOp.GT, ref(x), lit(0)), null, null);

    String code = generator.compileStatement(assertion);

    assertEquals("specval.runtime.Checks.check((x.compareTo(java.math.BigInteger.valueOf(0L)) > 0), "
        + "\"assert x > 0\");\n", code);
  }

  @Test
  public void testOtherGhostStatementsErased() {
    var x = Variable.Formal.in("x", INT);
    var cond = bin(BinaryOp.GT, ref(x), lit(0));

    assertEquals("", generator.compileStatement(new Stmt.Assume(StmtMeta.GHOST, cond)));
    assertEquals("", generator.compileStatement(new Stmt.Print(StmtMeta.GHOST, List.of(ref(x)))));
    assertEquals("System.out.print(x);\n", generator.compileStatement(new Stmt.Print(StmtMeta.NONE, List.of(ref(x)))));
  }

  @Test
  public void testInjectedContractsCheckedAtEntryAndExit() {
    var wired = ModuleWiring.wire(program(counterClass()), ValidatorOptions.DEFAULT, IdSource.sequential());
    var cls = (Decl.ClassDecl) wired.validatorTwin().decls().get(1);
    var shim = (Member.Method) cls.members().get(1);

    String code = generator.compileMethod(shim, new SinglePassCodeGenerator.Host(cls.name(), false));

    assertTrue(code.startsWith("public java.math.BigInteger Add_valid(java.math.BigInteger x, Counter arg_valid) {\n"),
        code);
    int entry = code.indexOf("specval.runtime.Checks.check(arg_valid.Valid(), \"requires arg_valid.Valid()\");");
    int call = code.indexOf("y = arg_valid.Add(x);");
    int exit = code.indexOf("specval.runtime.Checks.check(arg_valid.Valid(), \"ensures arg_valid.Valid()\");");
    int ret = code.indexOf("return y;");
    assertTrue(entry > 0 && entry < call && call < exit && exit < ret, code);
    // 用户写的 requires x > 0 留给验证器，不在运行时检查
    assertFalse(code.contains("compareTo"), code);
  }

  @Test
  public void testExitChecksBeforeEveryReturn() {
    var x = Variable.Formal.in("x", INT);
    var y = Variable.Formal.out("y", INT);
    var early = new Stmt.If(StmtMeta.NONE, bin(BinaryOp.GT, ref(x), lit(0)),
        block(new Stmt.Return(StmtMeta.NONE, List.of(Rhs.ExprRhs.of(ref(x))))), null);
    var ok = AttributedExpr.injected(lit(true));
    var m = method("M", List.of(x), List.of(y), List.of(), List.of(ok), block(early, assign(ref(y), lit(1))));

    String code = generator.compileMethod(m, SinglePassCodeGenerator.Host.MODULE);

    assertTrue(code.startsWith("public static java.math.BigInteger M(java.math.BigInteger x) {\n"), code);
    assertEquals(2, code.split("Checks\\.check\\(true, \"ensures true\"\\);", -1).length - 1, code);
    assertTrue(code.contains("y = x;\n"), code);
  }

  @Test
  public void testGhostMembersErasedFromModule() {
    String code = generator.compileModule(module("M", counterClass()));

    assertTrue(code.startsWith("public final class M {\n  public static class Counter {\n"), code);
    assertTrue(code.contains("    public java.math.BigInteger count = java.math.BigInteger.ZERO;\n"), code);
    assertTrue(code.contains("    public Counter() {\n"), code);
    assertTrue(code.contains("this.count = this.count.add(x);"), code);
    assertTrue(code.contains("public java.math.BigInteger Get() {"), code);
    assertFalse(code.contains("CountNonNegative"), code);
    assertFalse(code.contains("Valid"), code);
  }

  @Test
  public void testTypeOnlyDeclarationsSkipped() {
    var v = new Variable.BoundVar("n", INT, false);
    var subset = new Decl.SubsetType("Pos", List.of(), null, v, bin(BinaryOp.GT, ref(v), lit(0)), null, null,
        List.of());

    assertEquals("public final class M {\n}\n", generator.compileModule(module("M", subset)));
  }

  @Test
  public void testQuantifierInCompiledCodeRejected() {
    var i = new Variable.BoundVar("i", INT, false);
    var forall = new Expr.Quantifier(true, List.of(i), null, bin(BinaryOp.GE, ref(i), lit(0)), List.of());
    var print = new Stmt.Print(StmtMeta.NONE, List.of(forall));

    var ex = assertThrows(UnsupportedFeatureException.class, () -> generator.compileStatement(print));
    assertEquals("forall expression", ex.feature());
    assertTrue(ex.getMessage().contains("unsupported in compiled code: forall expression"));
  }

  @Test
  public void testQuantifierInsideGhostAssertStillRejected() {
    var i = new Variable.BoundVar("i", INT, false);
    var forall = new Expr.Quantifier(false, List.of(i), null, bin(BinaryOp.EQ, ref(i), lit(0)), List.of());

    assertThrows(UnsupportedFeatureException.class,
        () -> generator.compileStatement(new Stmt.Assert(StmtMeta.GHOST, forall, null, null)));
  }
}
