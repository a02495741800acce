package specval.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import specval.core.AttributedExpr;
import specval.core.BinaryOp;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.Member;
import specval.core.ModuleDefinition;
import specval.core.Pattern;
import specval.core.PrefixNameModule;
import specval.core.Rhs;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.Variable;
import specval.printer.PrintMode;
import specval.printer.Printer;
import specval.runtime.UnreachableException;

/**
 * 单遍代码生成管线：遍历语句树，把每种语句交给后端的 emit 原语输出。
 *
 * <p>ghost 语句通常整句擦除；ghost 断言例外，它被降级为一次运行时检查，校验器注入的
 * {@code arg_valid.Valid()} 契约因此能在编译后的代码里真正执行。</p>
 */
public abstract class SinglePassCodeGenerator implements Stmt.Visitor<Void, ConcreteSyntaxTree> {
  private static final Logger logger = Logger.getLogger(SinglePassCodeGenerator.class.getName());

  /** 成员所在的宿主：模块级（{@code className == null}）、类或 trait。 */
  public record Host(String className, boolean isTrait) {
    public static final Host MODULE = new Host(null, false);
  }

  private final Printer describer = new Printer(PrintMode.DAFNY);

  // 当前方法的出参与出口检查，Return 语句需要它们
  private List<Variable.Formal> currentOuts = List.of();
  private List<AttributedExpr> exitChecks = List.of();
  private int tempCounter;

  // ---------------------------------------------------------------------------------------------
  // 入口

  public String compileModule(ModuleDefinition module) {
    var wr = new ConcreteSyntaxTree();
    trModule(module, createModule(module.name(), false, wr));
    return wr.toString();
  }

  public String compileMethod(Member.Method method, Host host) {
    var wr = new ConcreteSyntaxTree();
    trMethod(method, host, wr);
    return wr.toString();
  }

  public String compileStatement(Stmt stmt) {
    var wr = new ConcreteSyntaxTree();
    trStmt(stmt, wr);
    return wr.toString();
  }

  // ---------------------------------------------------------------------------------------------
  // 模块与声明

  protected void trModule(ModuleDefinition module, ConcreteSyntaxTree wr) {
    for (Decl d : module.decls()) {
      trDecl(d, wr);
    }
    for (PrefixNameModule p : module.prefixNamedModules()) {
      trModule(p.module().def(), createModule(String.join("_", p.prefixIds()), true, wr));
    }
  }

  protected void trDecl(Decl d, ConcreteSyntaxTree wr) {
    if (d instanceof Decl.DefaultClass dc) {
      trMembers(dc.members(), Host.MODULE, wr);
    } else if (d instanceof Decl.ClassDecl c) {
      trMembers(c.members(), new Host(c.name(), false), createClass(c.name(), c.typeArgs(), false, wr));
    } else if (d instanceof Decl.Trait t) {
      trMembers(t.members(), new Host(t.name(), true), createClass(t.name(), t.typeArgs(), true, wr));
    } else if (d instanceof Decl.LiteralModule lm) {
      trModule(lm.def(), createModule(lm.name(), true, wr));
    } else if (d instanceof Decl.TupleType) {
      throw UnreachableException.of("codegen", d);
    } else if (d instanceof Decl.AliasModule || d instanceof Decl.AbstractModule || d instanceof Decl.ModuleExport) {
      logger.fine(() -> "codegen: import/export " + d.name() + " has no runtime form");
    } else {
      logger.fine(() -> "codegen: skipping type declaration " + d.name());
    }
  }

  protected void trMembers(List<Member> members, Host host, ConcreteSyntaxTree wr) {
    for (Member m : members) {
      if (m.ghost() || m instanceof Member.Method method && method.kind().isLemma()) {
        logger.fine(() -> "codegen: erasing ghost member " + m.name());
        continue;
      }
      if (m instanceof Member.Field f) {
        emitField(f, host, wr);
      } else if (m instanceof Member.ConstantField cf) {
        emitConstant(cf, host, wr);
      } else if (m instanceof Member.Function f) {
        trFunction(f, host, wr);
      } else if (m instanceof Member.Method method) {
        trMethod(method, host, wr);
      }
      // SpecialField 由目标语言的内建成员承担
    }
  }

  protected void trFunction(Member.Function f, Host host, ConcreteSyntaxTree wr) {
    ConcreteSyntaxTree body = emitFunctionHeader(f, host, wr);
    if (body == null) return;
    emitReturnExpr(f.body(), body);
  }

  /**
   * 方法降级：出参先以默认值声明，入口处检查注入的 requires，每个出口处检查注入的 ensures。
   */
  protected void trMethod(Member.Method m, Host host, ConcreteSyntaxTree wr) {
    if (m.outs().size() > 1) {
      throw new UnsupportedFeatureException("method with several out-parameters: " + m.name());
    }
    ConcreteSyntaxTree body = emitMethodHeader(m, host, wr);
    if (body == null) return;

    var savedOuts = currentOuts;
    var savedChecks = exitChecks;
    currentOuts = m.outs();
    exitChecks = injected(m.ens());
    try {
      for (Variable.Formal out : m.outs()) {
        emitOutDeclaration(out, body);
      }
      for (AttributedExpr req : injected(m.req())) {
        emitRuntimeCheck(req.expr(), "requires " + describe(req.expr()), body);
      }
      List<Stmt> stmts = bodyStatements(m.body());
      trStmts(stmts, body);
      if (stmts.isEmpty() || !endsWithReturn(stmts.get(stmts.size() - 1))) {
        emitMethodExit(body);
      }
    } finally {
      currentOuts = savedOuts;
      exitChecks = savedChecks;
    }
  }

  private void emitMethodExit(ConcreteSyntaxTree wr) {
    for (AttributedExpr ens : exitChecks) {
      emitRuntimeCheck(ens.expr(), "ensures " + describe(ens.expr()), wr);
    }
    emitReturn(currentOuts, wr);
  }

  private static List<AttributedExpr> injected(List<AttributedExpr> clauses) {
    List<AttributedExpr> result = new ArrayList<>();
    for (AttributedExpr c : clauses) {
      if (c.injected()) result.add(c);
    }
    return result;
  }

  private static List<Stmt> bodyStatements(Stmt body) {
    if (body instanceof Stmt.Block b) return b.body();
    if (body instanceof Stmt.DividedBlock db) {
      List<Stmt> all = new ArrayList<>(db.init());
      all.addAll(db.proper());
      return all;
    }
    return body == null ? List.of() : List.of(body);
  }

  private static boolean endsWithReturn(Stmt s) {
    if (s instanceof Stmt.Return) return true;
    if (s instanceof Stmt.Block b) {
      return !b.body().isEmpty() && endsWithReturn(b.body().get(b.body().size() - 1));
    }
    if (s instanceof Stmt.If i) {
      return i.els() != null && endsWithReturn(i.thn()) && endsWithReturn(i.els());
    }
    return false;
  }

  protected String describe(Expr e) {
    return describer.expr(e);
  }

  // ---------------------------------------------------------------------------------------------
  // 语句

  public void trStmt(Stmt s, ConcreteSyntaxTree wr) {
    if (s.ghost()) {
      if (s instanceof Stmt.Assert a) {
        emitRuntimeCheck(a.expr(), "assert " + describe(a.expr()), wr);
      }
      return;
    }
    for (StmtMeta.Label label : s.meta().labels()) {
      if (label.name() != null) emitLabel(label.name(), wr);
    }
    s.accept(this, wr);
  }

  protected void trStmts(List<Stmt> stmts, ConcreteSyntaxTree wr) {
    for (Stmt s : stmts) {
      trStmt(s, wr);
    }
  }

  @Override
  public Void visitBlockStmt(Stmt.Block s, ConcreteSyntaxTree wr) {
    trStmts(s.body(), emitBlock(wr));
    return null;
  }

  @Override
  public Void visitDividedBlockStmt(Stmt.DividedBlock s, ConcreteSyntaxTree wr) {
    var block = emitBlock(wr);
    trStmts(s.init(), block);
    trStmts(s.proper(), block);
    return null;
  }

  @Override
  public Void visitAssertStmt(Stmt.Assert s, ConcreteSyntaxTree wr) {
    // 断言在解析后总是 ghost
    throw UnreachableException.of("codegen", s);
  }

  @Override
  public Void visitAssumeStmt(Stmt.Assume s, ConcreteSyntaxTree wr) {
    throw UnreachableException.of("codegen", s);
  }

  @Override
  public Void visitExpectStmt(Stmt.Expect s, ConcreteSyntaxTree wr) {
    emitExpect(s.expr(), s.message(), "expect " + describe(s.expr()), wr);
    return null;
  }

  @Override
  public Void visitPrintStmt(Stmt.Print s, ConcreteSyntaxTree wr) {
    emitPrint(s.args(), wr);
    return null;
  }

  @Override
  public Void visitReturnStmt(Stmt.Return s, ConcreteSyntaxTree wr) {
    if (!s.rhss().isEmpty()) {
      if (s.rhss().size() != currentOuts.size()) {
        throw new UnsupportedFeatureException("return with " + s.rhss().size() + " values");
      }
      for (int i = 0; i < s.rhss().size(); i++) {
        emitAssignment(Expr.Ident.of(currentOuts.get(i)), s.rhss().get(i), wr);
      }
    }
    emitMethodExit(wr);
    return null;
  }

  @Override
  public Void visitBreakStmt(Stmt.Break s, ConcreteSyntaxTree wr) {
    emitBreak(s.targetLabel(), s.breakCount(), s.isContinue(), wr);
    return null;
  }

  @Override
  public Void visitVarDeclStmt(Stmt.VarDecl s, ConcreteSyntaxTree wr) {
    List<Rhs> rhss = s.update() == null ? List.of() : s.update().rhss();
    if (!rhss.isEmpty() && rhss.size() != s.locals().size()) {
      throw new UnsupportedFeatureException("declaration of several variables from one call");
    }
    for (int i = 0; i < s.locals().size(); i++) {
      Variable.LocalVariable local = s.locals().get(i);
      if (local.ghost()) continue;
      emitDeclaration(local, rhss.isEmpty() ? null : rhss.get(i), wr);
    }
    return null;
  }

  @Override
  public Void visitUpdateStmt(Stmt.Update s, ConcreteSyntaxTree wr) {
    if (s.lhss().isEmpty()) {
      for (Rhs rhs : s.rhss()) {
        if (rhs instanceof Rhs.ExprRhs er) emitExprStatement(er.expr(), wr);
      }
      return null;
    }
    if (s.lhss().size() != s.rhss().size()) {
      throw new UnsupportedFeatureException("assignment of several variables from one call");
    }
    if (s.lhss().size() == 1) {
      emitAssignment(s.lhss().get(0), s.rhss().get(0), wr);
      return null;
    }
    // 并行赋值：先求出所有右侧，再逐个写回
    List<Expr> temps = new ArrayList<>(s.rhss().size());
    for (Rhs rhs : s.rhss()) {
      var temp = tempLocal("_rhs");
      emitDeclaration(temp, rhs, wr);
      temps.add(Expr.Ident.of(temp));
    }
    for (int i = 0; i < s.lhss().size(); i++) {
      emitAssignment(s.lhss().get(i), Rhs.ExprRhs.of(temps.get(i)), wr);
    }
    return null;
  }

  @Override
  public Void visitAssignStmt(Stmt.Assign s, ConcreteSyntaxTree wr) {
    emitAssignment(s.lhs(), s.rhs(), wr);
    return null;
  }

  @Override
  public Void visitCallStmt(Stmt.Call s, ConcreteSyntaxTree wr) {
    if (s.lhss().size() > 1) {
      throw new UnsupportedFeatureException("call " + s.methodName() + " with several out-parameters");
    }
    emitCall(s.lhss().isEmpty() ? null : s.lhss().get(0), s.receiver(), s.methodName(), s.args(), wr);
    return null;
  }

  @Override
  public Void visitIfStmt(Stmt.If s, ConcreteSyntaxTree wr) {
    if (s.guard() == null) {
      throw new UnsupportedFeatureException("if *");
    }
    trStmts(s.thn().body(), emitIf(s.guard(), wr));
    if (s.els() instanceof Stmt.Block b) {
      trStmts(b.body(), emitElse(wr));
    } else if (s.els() != null) {
      trStmt(s.els(), emitElse(wr));
    }
    return null;
  }

  @Override
  public Void visitWhileStmt(Stmt.While s, ConcreteSyntaxTree wr) {
    if (s.guard() == null) {
      throw new UnsupportedFeatureException("while *");
    }
    if (s.body() == null) {
      throw new UnsupportedFeatureException("loop without a body");
    }
    trStmts(s.body().body(), emitWhile(s.guard(), wr));
    return null;
  }

  /**
   * match 语句降级为 if-else 链：源表达式先存入临时变量，字面量模式比较相等，
   * 变量模式总是匹配并绑定。
   */
  @Override
  public Void visitMatchStmt(Stmt.Match s, ConcreteSyntaxTree wr) {
    var source = tempLocal("_source");
    emitDeclaration(source, Rhs.ExprRhs.of(s.source()), wr);
    var sourceRef = Expr.Ident.of(source);
    ConcreteSyntaxTree current = wr;
    for (Stmt.MatchCase mc : s.cases()) {
      Expr condition = patternCondition(mc.pattern(), sourceRef);
      if (condition == null) {
        ConcreteSyntaxTree body = current == wr ? emitBlock(wr) : current;
        bindPattern(mc.pattern(), sourceRef, body);
        trStmts(mc.body(), body);
        return null;
      }
      ConcreteSyntaxTree body = emitIf(condition, current);
      bindPattern(mc.pattern(), sourceRef, body);
      trStmts(mc.body(), body);
      current = emitElse(current);
    }
    return null;
  }

  /** 模式的匹配条件；总是匹配时返回 null。 */
  private Expr patternCondition(Pattern p, Expr source) {
    if (p instanceof Pattern.Lit lit) {
      return new Expr.Binary(BinaryOp.EQ, source, lit.lit());
    }
    if (p instanceof Pattern.Id id) {
      if (id.arguments() != null) {
        throw new UnsupportedFeatureException("constructor pattern " + id.id());
      }
      return null;
    }
    var d = (Pattern.Disjunctive) p;
    Expr result = null;
    for (Pattern alt : d.alternatives()) {
      Expr c = patternCondition(alt, source);
      if (c == null) return null;
      result = result == null ? c : new Expr.Binary(BinaryOp.OR, result, c);
    }
    return result;
  }

  private void bindPattern(Pattern p, Expr source, ConcreteSyntaxTree wr) {
    if (p instanceof Pattern.Id id && id.arguments() == null && !id.ghost() && !id.id().startsWith("_")) {
      Type type = id.var() == null ? null : id.var().type();
      var local = new Variable.LocalVariable(id.id(), type, false, type != null, null);
      emitDeclaration(local, Rhs.ExprRhs.of(source), wr);
    }
  }

  @Override
  public Void visitForallStmt(Stmt.Forall s, ConcreteSyntaxTree wr) {
    throw new UnsupportedFeatureException("forall statement");
  }

  @Override
  public Void visitRevealStmt(Stmt.Reveal s, ConcreteSyntaxTree wr) {
    return null;
  }

  @Override
  public Void visitModifyStmt(Stmt.Modify s, ConcreteSyntaxTree wr) {
    if (s.body() != null) {
      trStmts(s.body().body(), emitBlock(wr));
    }
    return null;
  }

  private Variable.LocalVariable tempLocal(String prefix) {
    return new Variable.LocalVariable(prefix + tempCounter++, null, false, false, null);
  }

  // ---------------------------------------------------------------------------------------------
  // 后端原语

  protected abstract ConcreteSyntaxTree createModule(String name, boolean nested, ConcreteSyntaxTree wr);

  protected abstract ConcreteSyntaxTree createClass(String name, List<TypeParameter> typeArgs, boolean isTrait,
                                                    ConcreteSyntaxTree wr);

  protected abstract void emitField(Member.Field f, Host host, ConcreteSyntaxTree wr);

  protected abstract void emitConstant(Member.ConstantField f, Host host, ConcreteSyntaxTree wr);

  /** @return 函数体的写入位置；无体声明返回 null */
  protected abstract ConcreteSyntaxTree emitFunctionHeader(Member.Function f, Host host, ConcreteSyntaxTree wr);

  /** @return 方法体的写入位置；无体声明返回 null */
  protected abstract ConcreteSyntaxTree emitMethodHeader(Member.Method m, Host host, ConcreteSyntaxTree wr);

  protected abstract void emitOutDeclaration(Variable.Formal out, ConcreteSyntaxTree wr);

  protected abstract void emitReturn(List<Variable.Formal> outs, ConcreteSyntaxTree wr);

  protected abstract void emitReturnExpr(Expr e, ConcreteSyntaxTree wr);

  protected abstract void emitLabel(String label, ConcreteSyntaxTree wr);

  protected abstract ConcreteSyntaxTree emitBlock(ConcreteSyntaxTree wr);

  protected abstract void emitPrint(List<Expr> args, ConcreteSyntaxTree wr);

  protected abstract void emitBreak(String label, int breakCount, boolean isContinue, ConcreteSyntaxTree wr);

  protected abstract void emitDeclaration(Variable.LocalVariable local, Rhs init, ConcreteSyntaxTree wr);

  protected abstract void emitAssignment(Expr lhs, Rhs rhs, ConcreteSyntaxTree wr);

  protected abstract void emitExprStatement(Expr e, ConcreteSyntaxTree wr);

  protected abstract void emitCall(Expr lhs, Expr receiver, String methodName, List<Expr> args,
                                   ConcreteSyntaxTree wr);

  protected abstract ConcreteSyntaxTree emitIf(Expr guard, ConcreteSyntaxTree wr);

  protected abstract ConcreteSyntaxTree emitElse(ConcreteSyntaxTree wr);

  protected abstract ConcreteSyntaxTree emitWhile(Expr guard, ConcreteSyntaxTree wr);

  protected abstract void emitRuntimeCheck(Expr condition, String description, ConcreteSyntaxTree wr);

  protected abstract void emitExpect(Expr condition, Expr message, String description, ConcreteSyntaxTree wr);

  public abstract String emitExpr(Expr e);
}
