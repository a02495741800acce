package specval.clone;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import specval.core.Attribute;
import specval.core.AttributedExpr;
import specval.core.BinaryOp;
import specval.core.DatatypeCtor;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.FrameExpr;
import specval.core.Member;
import specval.core.ModuleDefinition;
import specval.core.ModuleSignature;
import specval.core.Pattern;
import specval.core.Rhs;
import specval.core.Specification;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.UnaryOp;
import specval.core.Variable;
import specval.core.WitnessKind;
import specval.runtime.UnreachableException;

import static org.junit.jupiter.api.Assertions.*;
import static specval.AstFixtures.*;

/**
 * 克隆框架测试：身份记忆、解析结果的取舍、每种变体的结构保持。
 */
public class ClonerTest {

  @Test
  public void testSharedFormalMapsToOneClone() {
    var x = Variable.Formal.in("x", INT);
    var y = Variable.Formal.out("y", INT);
    var m = method("Twice", List.of(x), List.of(y),
        block(assign(ref(y), bin(BinaryOp.ADD, ref(x), ref(x)))));

    var clone = (Member.Method) new Cloner<Void>().cloneMember(m, null);

    var clonedX = clone.ins().get(0);
    assertNotSame(x, clonedX);
    var update = (Stmt.Update) ((Stmt.Block) clone.body()).body().get(0);
    var sum = (Expr.Binary) ((Rhs.ExprRhs) update.rhss().get(0)).expr();
    assertSame(clonedX, ((Expr.Ident) sum.left()).var());
    assertSame(clonedX, ((Expr.Ident) sum.right()).var());
    assertSame(clone.outs().get(0), ((Expr.Ident) update.lhss().get(0)).var());
  }

  @Test
  public void testRepeatedStatementClonedOnce() {
    Stmt shared = new Stmt.Print(StmtMeta.NONE, List.of(lit(1)));
    var b = block(shared, shared);

    var clone = new Cloner<Void>().cloneBlockStmt(b, null);

    assertNotSame(shared, clone.body().get(0));
    assertSame(clone.body().get(0), clone.body().get(1));
  }

  @Test
  public void testMemberClonedOnce() {
    var f = intField("count");
    var cloner = new Cloner<Void>();
    assertSame(cloner.cloneMember(f, null), cloner.cloneMember(f, null));
  }

  @Test
  public void testRegisteredStatementCloneIsReturned() {
    Stmt original = new Stmt.Print(StmtMeta.NONE, List.of(lit(1)));
    Stmt replacement = new Stmt.Print(StmtMeta.NONE, List.of(lit(2)));
    var cloner = new Cloner<Void>();

    cloner.registerStatementClone(original, replacement);

    assertSame(replacement, cloner.cloneStmt(original, null));
    assertThrows(IllegalStateException.class, () -> cloner.registerStatementClone(original, replacement));
  }

  @Test
  public void testNullInNullOut() {
    var cloner = new Cloner<Void>();
    assertNull(cloner.cloneModuleDefinition(null, null));
    assertNull(cloner.cloneModuleDefinition(null, "X", null));
    assertNull(cloner.cloneDeclaration(null, null));
    assertNull(cloner.cloneCtor(null, null));
    assertNull(cloner.cloneTypeParam(null));
    assertNull(cloner.cloneCharacteristics(null));
    assertNull(cloner.cloneType(null, null));
    assertNull(cloner.cloneVariable(null, null));
    assertNull(cloner.cloneFormal(null, null));
    assertNull(cloner.cloneAttributes(null, null));
    assertNull(cloner.cloneAttributedExpr(null, null));
    assertNull(cloner.cloneSpecExpr(null, null));
    assertNull(cloner.cloneSpecFrameExpr(null, null));
    assertNull(cloner.cloneFrameExpr(null, null));
    assertNull(cloner.cloneMember(null, null));
    assertNull(cloner.cloneFunction(null, "f", null));
    assertNull(cloner.cloneMethod(null, "m", null));
    assertNull(cloner.cloneStmt(null, null));
    assertNull(cloner.cloneBlockStmt(null, null));
    assertNull(cloner.cloneRhs(null, null));
    assertNull(cloner.clonePattern(null, null));
    assertNull(cloner.cloneExpr(null, null));
  }

  @Test
  public void testReservedAttributesKeptOnlyForResolvedClones() {
    var attrs = List.of(Attribute.of("_inferred"), Attribute.of("verify", lit(false)));
    var c = new Decl.ClassDecl("C", List.of(), List.of(), List.of(), attrs);

    var plain = new Cloner<Void>().cloneDeclaration(c, null);
    var resolved = new Cloner<Void>(false, true).cloneDeclaration(c, null);

    assertEquals(List.of(Attribute.of("verify", lit(false))), plain.attributes());
    assertEquals(attrs, resolved.attributes());
  }

  @Test
  public void testTupleTypeIsUnreachable() {
    var ex = assertThrows(UnreachableException.class,
        () -> new Cloner<Void>().cloneDeclaration(new Decl.TupleType(2), null));
    assertTrue(ex.getMessage().contains("clone: no rule for TupleType"));
  }

  @Test
  public void testInferredEqualityResetOnClone() {
    var inferred = new TypeParameter("T", TypeParameter.Variance.COVARIANT_STRICT,
        new TypeParameter.Characteristics(TypeParameter.EqualitySupport.INFERRED_REQUIRED,
            TypeParameter.AutoInit.NONEMPTY, true));
    var declared = new TypeParameter("U", null,
        new TypeParameter.Characteristics(TypeParameter.EqualitySupport.REQUIRED, null, false));
    var cloner = new Cloner<Void>();

    var t = cloner.cloneTypeParam(inferred);
    var u = cloner.cloneTypeParam(declared);

    assertEquals(TypeParameter.EqualitySupport.UNSPECIFIED, t.characteristics().equalitySupport());
    assertEquals(TypeParameter.AutoInit.NONEMPTY, t.characteristics().autoInit());
    assertTrue(t.characteristics().containsNoReferenceTypes());
    assertEquals(TypeParameter.Variance.COVARIANT_STRICT, t.variance());
    assertEquals(TypeParameter.EqualitySupport.REQUIRED, u.characteristics().equalitySupport());
    assertSame(t, cloner.cloneTypeParam(inferred));
  }

  @Test
  public void testTypeParameterReferencesFollowTheClone() {
    var tp = TypeParameter.of("T");
    var field = new Member.Field("item", false, false, true, true, new Type.TypeParamRef(tp), List.of());
    var c = new Decl.ClassDecl("Box", List.of(tp), List.of(), List.of(field), List.of());

    var clone = (Decl.ClassDecl) new Cloner<Void>().cloneDeclaration(c, null);

    var clonedTp = clone.typeArgs().get(0);
    assertNotSame(tp, clonedTp);
    var fieldType = (Type.TypeParamRef) ((Member.Field) clone.members().get(0)).type();
    assertSame(clonedTp, fieldType.param());
  }

  @Test
  public void testTypesUnwrapRefinementAndShareBasicTypes() {
    var cloner = new Cloner<Void>();
    assertSame(INT, cloner.cloneType(INT, null));
    assertEquals(new Type.SeqType(INT), cloner.cloneType(new Type.RefinementWrapper(new Type.SeqType(INT)), null));

    var inferred = new Type.InferredType(INT);
    assertNull(((Type.InferredType) cloner.cloneType(inferred, null)).resolved());
    assertSame(INT, ((Type.InferredType) new Cloner<Void>(false, true).cloneType(inferred, null)).resolved());
  }

  @Test
  public void testUnnamedLabelsAndBreakTargetsDropped() {
    var meta = new StmtMeta("loop", List.of(new StmtMeta.Label(null), new StmtMeta.Label("outer")), List.of(), false);
    var brk = new Stmt.Break(StmtMeta.NONE, null, 1, false, "loop");
    var loop = new Stmt.While(meta, lit(true), List.of(), null, null, block(brk));

    var plain = (Stmt.While) new Cloner<Void>().cloneStmt(loop, null);
    var resolved = (Stmt.While) new Cloner<Void>(false, true).cloneStmt(loop, null);

    assertEquals(List.of(new StmtMeta.Label("outer")), plain.meta().labels());
    assertEquals("loop", plain.meta().id());
    assertNull(((Stmt.Break) plain.body().body().get(0)).targetId());
    assertEquals("loop", ((Stmt.Break) resolved.body().body().get(0)).targetId());
  }

  @Test
  public void testLiteralModuleSharedUnlessDeep() {
    var inner = ModuleDefinition.of("Inner", List.of(classDecl("C")));
    var lm = new Decl.LiteralModule(inner, UUID.randomUUID());

    var shallow = (Decl.LiteralModule) new Cloner<Void>().cloneDeclaration(lm, null);
    var deep = (Decl.LiteralModule) new DeepModuleSignatureCloner<Void>().cloneDeclaration(lm, null);

    assertSame(inner, shallow.def());
    assertNotSame(inner, deep.def());
    assertEquals("Inner", deep.def().name());
    assertEquals(lm.cloneId(), deep.cloneId());
  }

  @Test
  public void testModuleSignatureKeptByDeepCloner() {
    var sig = new ModuleSignature("Lib", List.of("f"));
    var alias = new Decl.AliasModule("L", List.of("Lib"), true, List.of(), sig, null);
    var abs = new Decl.AbstractModule("A", List.of("Spec"), false, List.of(), sig, null);

    assertNull(((Decl.AliasModule) new Cloner<Void>().cloneDeclaration(alias, null)).signature());
    assertNull(((Decl.AbstractModule) new Cloner<Void>().cloneDeclaration(abs, null)).signature());
    assertSame(sig, ((Decl.AliasModule) new DeepModuleSignatureCloner<Void>().cloneDeclaration(alias, null)).signature());
    assertSame(sig, ((Decl.AbstractModule) new DeepModuleSignatureCloner<Void>().cloneDeclaration(abs, null)).signature());
  }

  @Test
  public void testDropMethodBodies() {
    var x = Variable.Formal.in("x", INT);
    var m = method("M", List.of(x), List.of(), block(new Stmt.Print(StmtMeta.NONE, List.of(ref(x)))));
    var f = function("F", List.of(), INT, lit(1));
    var c = new Decl.ClassDecl("C", List.of(), List.of(), List.of(m, f), List.of());

    var clone = (Decl.ClassDecl) new ClonerButDropMethodBodies<Void>().cloneDeclaration(c, null);

    var cm = (Member.Method) clone.members().get(0);
    assertNull(cm.body());
    assertEquals("x", cm.ins().get(0).name());
    assertEquals(lit(1), ((Member.Function) clone.members().get(1)).body());
  }

  @Test
  public void testRenamingMethodAndFunction() {
    var cloner = new Cloner<Void>();
    assertEquals("M2", cloner.cloneMethod(method("M", List.of(), List.of(), block()), "M2", null).name());
    assertEquals("F", cloner.cloneFunction(function("F", List.of(), INT, lit(1)), null, null).name());
  }

  @Test
  public void testEveryStatementVariantPreserved() {
    List<Stmt> all = allStatements();
    Set<Class<?>> seen = new HashSet<>();
    var cloner = new Cloner<Void>(false, true);
    for (Stmt s : all) {
      seen.add(s.getClass());
      Stmt clone = cloner.cloneStmt(s, null);
      assertEquals(s, clone, () -> "statement " + s.getClass().getSimpleName());
      assertNotSame(s, clone);
    }
    assertEquals(Set.of(Stmt.class.getPermittedSubclasses()), seen);
  }

  @Test
  public void testEveryExpressionVariantPreserved() {
    List<Expr> all = allExpressions();
    Set<Class<?>> seen = new HashSet<>();
    var cloner = new Cloner<Void>(false, true);
    for (Expr e : all) {
      seen.add(e.getClass());
      assertEquals(e, cloner.cloneExpr(e, null), () -> "expression " + e.getClass().getSimpleName());
    }
    assertEquals(new HashSet<>(Arrays.asList(Expr.class.getPermittedSubclasses())), seen);
  }

  @Test
  public void testEveryDeclarationVariantHandled() {
    var cloner = new DeepModuleSignatureCloner<Void>(true);
    Set<Class<?>> seen = new HashSet<>();
    seen.add(Decl.TupleType.class);
    for (Decl d : allDeclarations()) {
      seen.add(d.getClass());
      assertEquals(d, cloner.cloneDeclaration(d, null), () -> "declaration " + d.getClass().getSimpleName());
    }
    assertEquals(Set.of(Decl.class.getPermittedSubclasses()), seen);
  }

  @Test
  public void testEveryMemberVariantPreserved() {
    var x = Variable.Formal.in("x", INT);
    List<Member> all = List.of(
        new Member.Field("count", false, false, true, true, INT, List.of(Attribute.of("ghostly"))),
        new Member.ConstantField("Limit", lit(10), true, false, false, INT, List.of()),
        new Member.SpecialField("Repr", "Repr", true, true, true, new Type.SetType(true, Type.UserDefinedType.of("object")),
            List.of()),
        function("Twice", List.of(x), INT, bin(BinaryOp.ADD, ref(x), ref(x))),
        method("Run", List.of(), List.of(), block(new Stmt.Print(StmtMeta.NONE, List.of(lit(1))))));
    Set<Class<?>> seen = new HashSet<>();
    var cloner = new Cloner<Void>(false, true);
    for (Member m : all) {
      seen.add(m.getClass());
      Member clone = cloner.cloneMember(m, null);
      assertEquals(m, clone, () -> "member " + m.getClass().getSimpleName());
      assertNotSame(m, clone);
    }
    assertEquals(Set.of(Member.class.getPermittedSubclasses()), seen);
  }

  @Test
  public void testEveryTypeVariantHandled() {
    var tp = TypeParameter.of("T");
    List<Type> all = List.of(
        INT,
        new Type.SetType(false, INT),
        new Type.SeqType(INT),
        new Type.MultiSetType(INT),
        new Type.MapType(true, INT, new Type.SeqType(INT)),
        new Type.ArrowType(List.of(INT), INT),
        new Type.UserDefinedType("Box", List.of(INT)),
        new Type.InferredType(INT),
        new Type.TypeParamRef(tp));
    Set<Class<?>> seen = new HashSet<>();
    var cloner = new Cloner<Void>(false, true);
    for (Type t : all) {
      seen.add(t.getClass());
      assertEquals(t, cloner.cloneType(t, null), () -> "type " + t.getClass().getSimpleName());
    }
    var wrapped = new Type.RefinementWrapper(new Type.SeqType(INT));
    seen.add(wrapped.getClass());
    assertEquals(new Type.SeqType(INT), cloner.cloneType(wrapped, null));
    assertEquals(Set.of(Type.class.getPermittedSubclasses()), seen);
  }

  @Test
  public void testEveryRhsVariantPreserved() {
    List<Rhs> all = List.of(
        new Rhs.ExprRhs(lit(1), List.of(Attribute.of("tag"))),
        new Rhs.HavocRhs(),
        new Rhs.TypeRhs(Type.UserDefinedType.of("Counter"), List.of(), "Init", List.of(lit(0))));
    Set<Class<?>> seen = new HashSet<>();
    var cloner = new Cloner<Void>(false, true);
    for (Rhs r : all) {
      seen.add(r.getClass());
      assertEquals(r, cloner.cloneRhs(r, null), () -> "rhs " + r.getClass().getSimpleName());
    }
    assertEquals(Set.of(Rhs.class.getPermittedSubclasses()), seen);
  }

  @Test
  public void testEveryPatternVariantPreserved() {
    var bv = new Variable.BoundVar("v", INT, false);
    List<Pattern> all = List.of(
        new Pattern.Lit(lit(0)),
        new Pattern.Id("Some", null, List.of(Pattern.Id.binder(bv)), false),
        new Pattern.Disjunctive(List.of(new Pattern.Lit(lit(1)), new Pattern.Lit(lit(2))), false));
    Set<Class<?>> seen = new HashSet<>();
    var cloner = new Cloner<Void>(false, true);
    for (Pattern p : all) {
      seen.add(p.getClass());
      assertEquals(p, cloner.clonePattern(p, null), () -> "pattern " + p.getClass().getSimpleName());
    }
    assertEquals(Set.of(Pattern.class.getPermittedSubclasses()), seen);
  }

  // ---------------------------------------------------------------------------------------------

  private static List<Stmt> allStatements() {
    var i = new Variable.LocalVariable("i", INT, false, true, INT);
    var bv = new Variable.BoundVar("k", INT, false);
    var n = StmtMeta.NONE;
    var ghost = StmtMeta.GHOST;
    return List.of(
        block(new Stmt.Print(n, List.of(lit(1)))),
        new Stmt.DividedBlock(n, List.of(assign(field("count"), lit(0))), List.of(new Stmt.Print(n, List.of()))),
        new Stmt.Assert(ghost, lit(true), "L", block()),
        new Stmt.Assume(ghost, lit(true)),
        new Stmt.Expect(n, lit(true), Expr.Literal.of("boom")),
        new Stmt.Print(n, List.of(Expr.Literal.of("hi"))),
        new Stmt.Return(n, List.of(Rhs.ExprRhs.of(lit(3)))),
        new Stmt.Break(n, "outer", 1, true, "outer"),
        new Stmt.VarDecl(n, List.of(i), new Stmt.Update(n, List.of(ref(i)), List.of(Rhs.ExprRhs.of(lit(0))))),
        new Stmt.Update(n, List.of(ref(i)), List.of(new Rhs.HavocRhs())),
        new Stmt.Assign(n, ref(i), new Rhs.TypeRhs(INT, List.of(lit(4)), null, null)),
        new Stmt.Call(n, List.of(), self(), "M", List.of(lit(1))),
        new Stmt.If(n, bin(BinaryOp.LT, ref(i), lit(2)), block(), block()),
        new Stmt.While(n, lit(true), List.of(AttributedExpr.of(lit(true))), new Specification<>(List.of(ref(i)), null),
            new Specification<>(List.of(FrameExpr.of(self())), null), block()),
        new Stmt.Match(n, ref(i), List.of(
            new Stmt.MatchCase(new Pattern.Lit(lit(0)), List.of(), null),
            new Stmt.MatchCase(new Pattern.Disjunctive(List.of(Pattern.Id.binder(bv)), false), List.of(), null))),
        new Stmt.Forall(ghost, List.of(bv), bin(BinaryOp.GE, ref(bv), lit(0)), List.of(), null),
        new Stmt.Reveal(ghost, List.of(Expr.FunctionCall.of(null, "F", List.of()))),
        new Stmt.Modify(ghost, new Specification<>(List.of(new FrameExpr(self(), "count")), null), null));
  }

  private static List<Expr> allExpressions() {
    var bv = new Variable.BoundVar("k", INT, false);
    var s = new Variable.BoundVar("s", new Type.SeqType(INT), false);
    return List.of(
        Expr.Literal.of(new BigDecimal("1.5")),
        ref(bv),
        self(),
        new Expr.StaticReceiver(Type.UserDefinedType.of("C")),
        field("count"),
        new Expr.FunctionCall(self(), "F", List.of(lit(1)), "pre"),
        new Expr.Unary(UnaryOp.CARDINALITY, ref(s)),
        bin(BinaryOp.IMP, lit(true), lit(false)),
        new Expr.Ite(lit(true), lit(1), lit(2)),
        new Expr.Old(field("count"), null),
        new Expr.SeqDisplay(List.of(lit(1), lit(2))),
        new Expr.SetDisplay(false, List.of(lit(1))),
        new Expr.MapDisplay(true, List.of(new Expr.MapEntry(lit(1), lit(2)))),
        new Expr.SeqSelect(false, ref(s), null, lit(1)),
        new Expr.Quantifier(true, List.of(bv), null, bin(BinaryOp.GE, ref(bv), lit(0)), null),
        new Expr.Lambda(List.of(bv), null, null, ref(bv)),
        new Expr.Let(List.of(bv), List.of(lit(1)), ref(bv)),
        new Expr.Match(lit(1), List.of(new Expr.MatchCase(new Pattern.Lit(lit(1)), lit(true), null))),
        new Expr.Parens(lit(1)),
        new Expr.DatatypeValue("Option", "Some", List.of(lit(1))));
  }

  private static List<Decl> allDeclarations() {
    var tp = TypeParameter.of("T");
    var v = new Variable.BoundVar("n", INT, false);
    var sig = new ModuleSignature("Lib", List.of());
    return List.of(
        new Decl.AbstractType("Opaque", List.of(tp), null, List.of(), List.of(), List.of()),
        new Decl.SubsetType("Pos", List.of(), null, v, bin(BinaryOp.GT, ref(v), lit(0)),
            WitnessKind.COMPILED, lit(1), List.of()),
        new Decl.TypeSynonym("Ints", List.of(), null, new Type.SeqType(INT), List.of()),
        new Decl.Newtype("Byte", INT, null, null, null, null, List.of(), List.of(), List.of()),
        new Decl.Datatype("Option", false, List.of(tp),
            List.of(new DatatypeCtor("None", false, List.of(), null),
                new DatatypeCtor("Some", false,
                    List.of(Variable.Formal.in("value", new Type.TypeParamRef(tp))), null)),
            List.of(), List.of(), List.of()),
        new Decl.Iterator("Gen", List.of(), List.of(), List.of(Variable.Formal.out("v", INT)), null, null, null,
            List.of(), List.of(), List.of(), List.of(), block(), List.of()),
        new Decl.Trait("Shape", List.of(), List.of(), List.of(function("Area", List.of(), INT, null)), List.of()),
        classDecl("Counter"),
        new Decl.DefaultClass(List.of(method("Main", List.of(), List.of(), block()))),
        new Decl.LiteralModule(ModuleDefinition.of("Inner", List.of()), null),
        new Decl.AliasModule("L", List.of("Lib"), false, List.of("Public"), sig, null),
        new Decl.AbstractModule("A", List.of("Spec"), false, List.of(), sig, null),
        new Decl.ModuleExport("Public", List.of("f"), List.of(), List.of(), false, true, false));
  }
}
