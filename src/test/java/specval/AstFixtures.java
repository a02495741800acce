package specval;

import java.math.BigInteger;
import java.util.List;

import specval.core.Attribute;
import specval.core.AttributedExpr;
import specval.core.BinaryOp;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.FrameExpr;
import specval.core.FunctionKind;
import specval.core.Member;
import specval.core.MethodKind;
import specval.core.ModuleDefinition;
import specval.core.Program;
import specval.core.Rhs;
import specval.core.Specification;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.Variable;

/**
 * 测试共用的程序树构造辅助。
 */
public final class AstFixtures {
  private AstFixtures() {}

  public static final Type INT = Type.BasicType.INT;
  public static final Type BOOL = Type.BasicType.BOOL;

  public static Expr.Literal lit(long n) {
    return Expr.Literal.of(BigInteger.valueOf(n));
  }

  public static Expr.Literal lit(boolean b) {
    return Expr.Literal.of(b);
  }

  public static Expr.Ident ref(Variable v) {
    return Expr.Ident.of(v);
  }

  public static Expr bin(BinaryOp op, Expr left, Expr right) {
    return new Expr.Binary(op, left, right);
  }

  public static Expr.This self() {
    return new Expr.This(null, false);
  }

  /** {@code this.name} */
  public static Expr field(String name) {
    return Expr.DotName.of(self(), name);
  }

  public static Stmt assign(Expr lhs, Expr rhs) {
    return new Stmt.Update(StmtMeta.NONE, List.of(lhs), List.of(Rhs.ExprRhs.of(rhs)));
  }

  public static Stmt.Block block(Stmt... body) {
    return Stmt.Block.of(List.of(body));
  }

  public static Member.Field intField(String name) {
    return new Member.Field(name, false, false, true, true, INT, List.of());
  }

  public static Member.Method method(String name, List<Variable.Formal> ins, List<Variable.Formal> outs,
                                     List<AttributedExpr> req, List<AttributedExpr> ens, Stmt body) {
    return new Member.Method(MethodKind.METHOD, name, false, false, List.of(), ins, outs, req, null, null, ens,
        null, body, List.of());
  }

  public static Member.Method method(String name, List<Variable.Formal> ins, List<Variable.Formal> outs, Stmt body) {
    return method(name, ins, outs, List.of(), List.of(), body);
  }

  public static Member.Method methodWithKind(MethodKind kind, String name, Stmt body) {
    return new Member.Method(kind, name, false, kind.isLemma(), List.of(), List.of(), List.of(), List.of(), null,
        null, List.of(), null, body, List.of());
  }

  public static Member.Function function(String name, List<Variable.Formal> ins, Type resultType, Expr body) {
    return new Member.Function(FunctionKind.FUNCTION, name, false, false, false, List.of(), ins, null, resultType,
        List.of(), null, List.of(), null, body, null, List.of());
  }

  public static Member.Function predicate(String name, Expr body) {
    return new Member.Function(FunctionKind.PREDICATE, name, false, true, false, List.of(), List.of(), null, BOOL,
        List.of(), Specification.<FrameExpr>empty(), List.of(), null, body, null, List.of());
  }

  public static Decl.ClassDecl classDecl(String name, List<TypeParameter> typeArgs, List<Member> members,
                                         boolean autoContracts) {
    List<Attribute> attrs = autoContracts ? List.of(Attribute.of("autocontracts")) : List.of();
    return new Decl.ClassDecl(name, typeArgs, List.of(), members, attrs);
  }

  public static Decl.ClassDecl classDecl(String name, Member... members) {
    return classDecl(name, List.of(), List.of(members), true);
  }

  public static ModuleDefinition module(String name, Decl... decls) {
    return ModuleDefinition.of(name, List.of(decls));
  }

  public static Program program(Decl... decls) {
    return new Program("sample", module(ModuleDefinition.DEFAULT_MODULE_NAME, decls), "sample.dfy");
  }

  /**
   * 带 autocontracts 的计数器类：
   *
   * <pre>
   * class {:autocontracts} Counter {
   *   var count: int
   *   predicate Valid() { this.count >= 0 }
   *   constructor() { this.count := 0; }
   *   method Add(x: int) returns (y: int)
   *     requires x > 0
   *     ensures y == this.count
   *   { this.count := this.count + x; y := this.count; }
   *   function Get(): int { this.count }
   *   lemma CountNonNegative() { }
   * }
   * </pre>
   */
  public static Decl.ClassDecl counterClass() {
    var x = Variable.Formal.in("x", INT);
    var y = Variable.Formal.out("y", INT);
    var add = method("Add", List.of(x), List.of(y),
        List.of(AttributedExpr.of(bin(BinaryOp.GT, ref(x), lit(0)))),
        List.of(AttributedExpr.of(bin(BinaryOp.EQ, ref(y), field("count")))),
        block(
            assign(field("count"), bin(BinaryOp.ADD, field("count"), ref(x))),
            assign(ref(y), field("count"))));
    var ctor = new Member.Method(MethodKind.CONSTRUCTOR, "_ctor", false, false, List.of(), List.of(), List.of(),
        List.of(), null, null, List.of(), null, block(assign(field("count"), lit(0))), List.of());
    return classDecl("Counter", List.of(), List.of(
        intField("count"),
        predicate("Valid", bin(BinaryOp.GE, field("count"), lit(0))),
        ctor,
        add,
        function("Get", List.of(), INT, field("count")),
        methodWithKind(MethodKind.LEMMA, "CountNonNegative", block())), true);
  }
}
