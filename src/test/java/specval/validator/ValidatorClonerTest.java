package specval.validator;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import specval.clone.Cloner;
import specval.core.Attribute;
import specval.core.BinaryOp;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.FrameExpr;
import specval.core.Member;
import specval.core.MethodKind;
import specval.core.ModuleDefinition;
import specval.core.Rhs;
import specval.core.Stmt;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.Variable;

import static org.junit.jupiter.api.Assertions.*;
import static specval.AstFixtures.*;

/**
 * 校验器变换测试：外壳形状、注入契约、声明过滤与三个开关。
 */
public class ValidatorClonerTest {

  private static ModuleDefinition transform(ValidatorOptions options, Decl... decls) {
    return new ValidatorCloner(options, IdSource.sequential()).transform(module("M", decls), "Valid");
  }

  private static ModuleDefinition transform(Decl... decls) {
    return transform(ValidatorOptions.DEFAULT, decls);
  }

  private static Decl.ClassDecl onlyClass(ModuleDefinition m) {
    assertEquals(1, m.decls().size());
    return (Decl.ClassDecl) m.decls().get(0);
  }

  private static Member member(Decl d, String name) {
    for (Member m : d.members()) {
      if (m.name().equals(name)) return m;
    }
    throw new AssertionError("no member " + name + " in " + d.name());
  }

  private static List<String> memberNames(Decl d) {
    List<String> names = new ArrayList<>();
    for (Member m : d.members()) names.add(m.name());
    return names;
  }

  @Test
  public void testRootModuleRenamedWithoutSuffix() {
    var result = transform(counterClass());
    assertEquals("Valid", result.name());
    assertEquals("Counter_valid", onlyClass(result).name());
  }

  @Test
  public void testShimSignatureAndDelegation() {
    var shim = (Member.Method) member(onlyClass(transform(counterClass())), "Add_valid");

    assertEquals(List.of("x", "arg_valid"), List.of(shim.ins().get(0).name(), shim.ins().get(1).name()));
    assertEquals(2, shim.ins().size());
    assertEquals(1, shim.outs().size());
    assertEquals("y", shim.outs().get(0).name());
    var witness = shim.ins().get(1);
    assertEquals(Type.UserDefinedType.of("Counter"), witness.type());

    var body = (Stmt.Block) shim.body();
    assertEquals(1, body.body().size());
    var update = (Stmt.Update) body.body().get(0);
    assertSame(shim.outs().get(0), ((Expr.Ident) update.lhss().get(0)).var());
    var call = (Expr.FunctionCall) ((Rhs.ExprRhs) update.rhss().get(0)).expr();
    assertEquals("Add", call.name());
    assertSame(witness, ((Expr.Ident) call.receiver()).var());
    assertEquals(1, call.args().size());
    assertSame(shim.ins().get(0), ((Expr.Ident) call.args().get(0)).var());
  }

  @Test
  public void testAutoContractsClausesInjectedFirst() {
    var shim = (Member.Method) member(onlyClass(transform(counterClass())), "Add_valid");
    var witness = shim.ins().get(1);

    assertEquals(2, shim.req().size());
    assertTrue(shim.req().get(0).injected());
    var validCall = (Expr.FunctionCall) shim.req().get(0).expr();
    assertEquals("Valid", validCall.name());
    assertTrue(validCall.args().isEmpty());
    assertSame(witness, ((Expr.Ident) validCall.receiver()).var());
    assertFalse(shim.req().get(1).injected());

    assertEquals(2, shim.ens().size());
    assertTrue(shim.ens().get(0).injected());
    assertEquals(validCall, shim.ens().get(0).expr());

    FrameExpr repr = shim.mod().expressions().get(0);
    var dot = (Expr.DotName) repr.expr();
    assertEquals("Repr", dot.suffix());
    assertSame(witness, ((Expr.Ident) dot.obj()).var());
  }

  @Test
  public void testNoContractsWithoutAutoContracts() {
    var x = Variable.Formal.in("x", INT);
    var m = method("M", List.of(x), List.of(), block());
    var c = classDecl("Plain", List.of(), List.of(m), false);

    var shim = (Member.Method) member(onlyClass(transform(c)), "M_valid");

    assertTrue(shim.req().isEmpty());
    assertTrue(shim.ens().isEmpty());
    assertTrue(shim.mod().isEmpty());
    assertEquals("arg_valid", shim.ins().get(1).name());
  }

  @Test
  public void testSelfReferencesRewrittenToWitness() {
    var result = onlyClass(transform(counterClass()));
    var counter = new ThisCounter();
    counter.cloneDeclaration(result, null);
    assertEquals(0, counter.count);

    // 原方法的 ensures 引用了 this.count，改写后指向见证形参
    var shim = (Member.Method) member(result, "Add_valid");
    var eq = (Expr.Binary) shim.ens().get(1).expr();
    var dot = (Expr.DotName) eq.right();
    assertSame(shim.ins().get(1), ((Expr.Ident) dot.obj()).var());

    var get = (Member.Function) member(result, "Get_valid");
    assertEquals("arg_valid", get.ins().get(0).name());
    assertSame(get.ins().get(0), ((Expr.Ident) ((Expr.DotName) get.body()).obj()).var());
  }

  @Test
  public void testClassMembersFiltered() {
    var result = onlyClass(transform(counterClass()));
    // 字段、构造器、引理被丢弃，autocontracts 标记不再出现
    assertEquals(List.of("Valid_valid", "Add_valid", "Get_valid"), memberNames(result));
    assertFalse(Attribute.contains(result.attributes(), "autocontracts"));
    assertTrue(result.parentTraits().isEmpty());
  }

  @Test
  public void testShapeDeclarationsDropped() {
    var v = new Variable.BoundVar("n", INT, false);
    var result = transform(
        new Decl.AbstractType("Opaque", List.of(), null, List.of(), List.of(), List.of()),
        new Decl.SubsetType("Pos", List.of(), null, v, bin(BinaryOp.GT, ref(v), lit(0)), null, null, List.of()),
        new Decl.TypeSynonym("Ints", List.of(), null, new Type.SeqType(INT), List.of()),
        new Decl.Newtype("Byte", INT, null, null, null, null, List.of(), List.of(), List.of()),
        new Decl.Datatype("Color", false, List.of(), List.of(), List.of(), List.of(), List.of()),
        new Decl.Datatype("Stream", true, List.of(), List.of(), List.of(), List.of(), List.of()),
        new Decl.ModuleExport("Public", List.of(), List.of(), List.of(), true, false, false),
        counterClass());

    assertEquals(1, result.decls().size());
    assertEquals("Counter_valid", result.decls().get(0).name());
  }

  @Test
  public void testFilteringIsIdempotentOnClassOnlyModules() {
    var trait = new Decl.Trait("Shape", List.of(), List.of(), List.of(), List.of());
    var first = transform(counterClass(), trait);
    var second = new ValidatorCloner(ValidatorOptions.DEFAULT, IdSource.sequential()).transform(first, "Again");

    assertEquals(2, first.decls().size());
    assertEquals(2, second.decls().size());
    assertEquals("Counter_valid_valid", second.decls().get(0).name());
    assertEquals("Shape_valid_valid", second.decls().get(1).name());
  }

  @Test
  public void testDeterministicForStableIdSource() {
    var nested = new Decl.LiteralModule(module("Inner", counterClass()), null);
    var first = transform(nested, counterClass());
    var second = transform(nested, counterClass());
    assertEquals(first, second);
  }

  @Test
  public void testModuleLevelMembersUseStaticReceiver() {
    var x = Variable.Formal.in("x", INT);
    var y = Variable.Formal.out("y", INT);
    var top = method("Top", List.of(x), List.of(y), block(assign(ref(y), ref(x))));
    var n = Variable.Formal.in("n", INT);
    var f = function("Double", List.of(n), INT, bin(BinaryOp.MUL, ref(n), lit(2)));

    var result = transform(new Decl.DefaultClass(List.of(top, f)));

    var dc = (Decl.DefaultClass) result.decls().get(0);
    assertEquals(List.of("Top_valid", "Double_valid"), memberNames(dc));
    var shim = (Member.Method) dc.members().get(0);
    assertEquals(1, shim.ins().size());
    var update = (Stmt.Update) ((Stmt.Block) shim.body()).body().get(0);
    var call = (Expr.FunctionCall) ((Rhs.ExprRhs) update.rhss().get(0)).expr();
    assertInstanceOf(Expr.StaticReceiver.class, call.receiver());
    assertEquals(1, ((Member.Function) dc.members().get(1)).ins().size());
  }

  @Test
  public void testBodylessMethodKeepsNoBody() {
    var m = method("Abstract", List.of(), List.of(), null);
    var trait = new Decl.Trait("Shape", List.of(), List.of(), List.of(m), List.of());

    var shim = (Member.Method) member(transform(trait).decls().get(0), "Abstract_valid");

    assertNull(shim.body());
    assertEquals("arg_valid", shim.ins().get(0).name());
  }

  @Test
  public void testValidatePureFalseDropsClassFunctionsOnly() {
    var x = Variable.Formal.in("x", INT);
    var topLevel = new Decl.DefaultClass(List.of(function("Inc", List.of(x), INT, ref(x))));

    var result = transform(new ValidatorOptions(false, false, false), counterClass(), topLevel);

    assertEquals(List.of("Add_valid"), memberNames(result.decls().get(0)));
    assertEquals(List.of("Inc_valid"), memberNames(result.decls().get(1)));
  }

  @Test
  public void testValidateLemmasShimsLemmas() {
    var result = onlyClass(transform(ValidatorOptions.DEFAULT.withValidateLemmas(true), counterClass()));

    var lemma = (Member.Method) member(result, "CountNonNegative_valid");
    assertEquals(MethodKind.LEMMA, lemma.kind());
    assertFalse(memberNames(result).contains("_ctor_valid"));
  }

  @Test
  public void testAddPureCopiesKeepsOriginalName() {
    var result = onlyClass(transform(ValidatorOptions.DEFAULT.withAddPureCopies(true), counterClass()));

    assertEquals(List.of("Valid_valid", "Valid", "Add_valid", "Get_valid", "Get"), memberNames(result));
    var renamed = (Member.Function) member(result, "Get_valid");
    var copy = (Member.Function) member(result, "Get");
    assertNotSame(renamed.ins().get(0), copy.ins().get(0));
    assertEquals(renamed.body(), copy.body());
  }

  @Test
  public void testCollisionAfterSuffixing() {
    var a = function("F", List.of(), INT, lit(1));
    var b = function("F_valid", List.of(), INT, lit(2));
    var c = classDecl("C", List.of(), List.of(a, b), false);

    var ex = assertThrows(NameCollisionException.class,
        () -> transform(ValidatorOptions.DEFAULT.withAddPureCopies(true), c));
    assertEquals("F_valid", ex.name());
    assertEquals("C_valid", ex.scope());
  }

  @Test
  public void testGenericWitnessUsesClonedTypeParameters() {
    var t = TypeParameter.of("T");
    var item = Variable.Formal.in("item", new Type.TypeParamRef(t));
    var put = method("Put", List.of(item), List.of(), block());
    var box = classDecl("Box", List.of(t), List.of(put), false);

    var result = onlyClass(transform(box));

    var clonedT = result.typeArgs().get(0);
    assertNotSame(t, clonedT);
    var shim = (Member.Method) member(result, "Put_valid");
    var witnessType = (Type.UserDefinedType) shim.ins().get(1).type();
    assertEquals("Box", witnessType.name());
    assertSame(clonedT, ((Type.TypeParamRef) witnessType.typeArgs().get(0)).param());
    assertSame(clonedT, ((Type.TypeParamRef) shim.ins().get(0).type()).param());
  }

  @Test
  public void testImportsRedirectedUnderReferenceRoot() {
    var alias = new Decl.AliasModule("L", List.of("Lib", "Core"), true, List.of(), null, null);
    var abs = new Decl.AbstractModule("S", List.of("Spec"), false, List.of(), null, null);

    var result = transform(alias, abs);

    assertEquals(List.of("Gen", "Lib", "Core"), ((Decl.AliasModule) result.decls().get(0)).targetPath());
    assertEquals(List.of("Gen", "Spec"), ((Decl.AbstractModule) result.decls().get(1)).path());
  }

  @Test
  public void testNestedModuleImportsItsReferenceTwin() {
    var inner = new Decl.LiteralModule(module("Inner"), null);
    var outer = new Decl.LiteralModule(module("Outer", inner, counterClass()), null);

    var result = transform(outer);

    var outerValid = (Decl.LiteralModule) result.decls().get(0);
    assertEquals("Outer_valid", outerValid.name());
    var selfImport = (Decl.AliasModule) outerValid.def().decls().get(0);
    assertEquals("Outer", selfImport.name());
    assertTrue(selfImport.opened());
    assertEquals(List.of("Gen", "Outer"), selfImport.targetPath());
    assertEquals(new UUID(0L, 2L), selfImport.cloneId());

    var innerValid = (Decl.LiteralModule) outerValid.def().decls().get(1);
    assertEquals("Inner_valid", innerValid.name());
    var innerImport = (Decl.AliasModule) innerValid.def().decls().get(0);
    assertEquals(List.of("Gen", "Outer", "Inner"), innerImport.targetPath());
    assertEquals("Counter_valid", outerValid.def().decls().get(2).name());
  }

  @Test
  public void testWitnessRenamedWhenMethodParameterTakesItsName() {
    var taken = Variable.Formal.in("arg_valid", INT);
    var m = method("M", List.of(taken), List.of(), block());
    var c = classDecl("C", List.of(), List.of(m), false);

    var shim = (Member.Method) member(onlyClass(transform(c)), "M_valid");

    assertEquals(List.of("arg_valid", "arg_valid0"), List.of(shim.ins().get(0).name(), shim.ins().get(1).name()));
    var witness = shim.ins().get(1);
    assertEquals(Type.UserDefinedType.of("C"), witness.type());
    var update = (Stmt.Update) ((Stmt.Block) shim.body()).body().get(0);
    var call = (Expr.FunctionCall) ((Rhs.ExprRhs) update.rhss().get(0)).expr();
    assertSame(witness, ((Expr.Ident) call.receiver()).var());
    assertSame(shim.ins().get(0), ((Expr.Ident) call.args().get(0)).var());
  }

  @Test
  public void testWitnessRenamedWhenFunctionParameterTakesItsName() {
    var a = Variable.Formal.in("arg_valid", INT);
    var b = Variable.Formal.in("arg_valid0", INT);
    var f = function("F", List.of(a, b), INT, bin(BinaryOp.ADD, ref(a), field("k")));
    var c = classDecl("C", List.of(), List.of(intField("k"), f), false);

    var clone = (Member.Function) member(onlyClass(transform(c)), "F_valid");

    assertEquals(3, clone.ins().size());
    var witness = clone.ins().get(2);
    assertEquals("arg_valid1", witness.name());
    var sum = (Expr.Binary) clone.body();
    assertSame(clone.ins().get(0), ((Expr.Ident) sum.left()).var());
    assertSame(witness, ((Expr.Ident) ((Expr.DotName) sum.right()).obj()).var());
  }

  @Test
  public void testTransformIsOneShot() {
    var cloner = new ValidatorCloner(ValidatorOptions.DEFAULT, IdSource.sequential());
    cloner.transform(module("M", counterClass()), "Valid");
    assertThrows(IllegalStateException.class, () -> cloner.transform(module("N", counterClass()), "Valid"));
  }

  /** 统计树中剩余的 {@code this} 表达式。 */
  private static final class ThisCounter extends Cloner<Void> {
    int count;

    @Override
    public Expr visitThisExpr(Expr.This e, Void ctx) {
      count++;
      return super.visitThisExpr(e, ctx);
    }
  }
}
