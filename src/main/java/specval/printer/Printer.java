package specval.printer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import specval.core.Attribute;
import specval.core.AttributedExpr;
import specval.core.BinaryOp;
import specval.core.DatatypeCtor;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.FrameExpr;
import specval.core.Member;
import specval.core.MethodKind;
import specval.core.ModuleDefinition;
import specval.core.Pattern;
import specval.core.PrefixNameModule;
import specval.core.Program;
import specval.core.Rhs;
import specval.core.Specification;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.Variable;
import specval.core.WitnessKind;
import specval.runtime.UnreachableException;

/**
 * 把程序树打印回源码文本。
 *
 * <p>声明、成员、语句从调用方缩进好的位置开始输出，不带结尾换行；表达式与类型以字符串返回，
 * 表达式访问者的上下文是外层要求的最低绑定强度，不足时加括号。</p>
 */
public final class Printer implements Decl.Visitor<Void, Integer>, Member.Visitor<Void, Integer>,
    Stmt.Visitor<Void, Integer>, Expr.Visitor<String, Integer>, Type.Visitor<String, Void>,
    Pattern.Visitor<String, Void>, Rhs.Visitor<String, Void> {

  static final int INDENT = 2;
  static final String INJECTED = "injected";
  /** 匿名构造器在树中的名字，打印时省略。 */
  static final String ANONYMOUS_CONSTRUCTOR = "_ctor";

  private static final int PREC_TOP = 0;
  private static final int PREC_UNARY = 8;
  private static final int PREC_PRIMARY = 9;

  private final PrintMode mode;
  private final StringBuilder wr = new StringBuilder();

  public Printer(PrintMode mode) {
    this.mode = mode;
  }

  public static String print(Program program, PrintMode mode) {
    var printer = new Printer(mode);
    printer.printProgram(program);
    return printer.toString();
  }

  @Override
  public String toString() {
    return wr.toString();
  }

  // ---------------------------------------------------------------------------------------------
  // 程序与模块

  public void printProgram(Program program) {
    ModuleDefinition m = program.defaultModule();
    printTopLevelDecls(m.decls(), 0);
    for (PrefixNameModule p : m.prefixNamedModules()) {
      if (wr.length() > 0) wr.append('\n');
      wr.append("module ").append(attributes(p.module().def().attributes())).append(String.join(".", p.prefixIds()));
      printModuleBody(p.module().def(), 0);
      wr.append('\n');
    }
  }

  private void printTopLevelDecls(List<Decl> decls, int indent) {
    boolean first = true;
    for (Decl d : decls) {
      if (d instanceof Decl.DefaultClass dc && dc.members().isEmpty()) continue;
      if (!first && !(d instanceof Decl.AliasModule || d instanceof Decl.AbstractModule)) {
        wr.append('\n');
      }
      first = false;
      if (d instanceof Decl.DefaultClass dc) {
        printMembers(dc.members(), indent);
        continue;
      }
      indent(indent);
      d.accept(this, indent);
      wr.append('\n');
    }
  }

  private void printModuleBody(ModuleDefinition m, int indent) {
    wr.append(" {\n");
    printTopLevelDecls(m.decls(), indent + INDENT);
    for (PrefixNameModule p : m.prefixNamedModules()) {
      wr.append('\n');
      indent(indent + INDENT);
      wr.append("module ").append(String.join(".", p.prefixIds()));
      printModuleBody(p.module().def(), indent + INDENT);
      wr.append('\n');
    }
    indent(indent);
    wr.append('}');
  }

  // ---------------------------------------------------------------------------------------------
  // 声明

  @Override
  public Void visitAbstractType(Decl.AbstractType d, Integer indent) {
    wr.append("type ").append(attributes(d.attributes())).append(d.name())
        .append(characteristics(d.characteristics())).append(typeParams(d.typeArgs()))
        .append(parentTraits(d.parentTraits()));
    printMemberBlock(d.members(), indent);
    return null;
  }

  @Override
  public Void visitSubsetType(Decl.SubsetType d, Integer indent) {
    wr.append("type ").append(attributes(d.attributes())).append(d.name())
        .append(characteristics(d.characteristics())).append(typeParams(d.typeArgs()))
        .append(" = ").append(d.var().name()).append(": ").append(type(d.var().type()))
        .append(" | ").append(expr(d.constraint()));
    wr.append(witness(d.witnessKind(), d.witness()));
    return null;
  }

  @Override
  public Void visitTypeSynonym(Decl.TypeSynonym d, Integer indent) {
    wr.append("type ").append(attributes(d.attributes())).append(d.name())
        .append(characteristics(d.characteristics())).append(typeParams(d.typeArgs()))
        .append(" = ").append(type(d.rhs()));
    return null;
  }

  @Override
  public Void visitNewtype(Decl.Newtype d, Integer indent) {
    wr.append("newtype ").append(attributes(d.attributes())).append(d.name()).append(" = ");
    if (d.var() == null) {
      wr.append(type(d.baseType()));
    } else {
      wr.append(d.var().name()).append(": ").append(type(d.baseType())).append(" | ").append(expr(d.constraint()));
      wr.append(witness(d.witnessKind(), d.witness()));
    }
    wr.append(parentTraits(d.parentTraits()));
    printMemberBlock(d.members(), indent);
    return null;
  }

  @Override
  public Void visitDatatype(Decl.Datatype d, Integer indent) {
    wr.append(d.coinductive() ? "codatatype " : "datatype ").append(attributes(d.attributes())).append(d.name())
        .append(typeParams(d.typeArgs())).append(parentTraits(d.parentTraits())).append(" = ");
    List<String> ctors = new ArrayList<>(d.ctors().size());
    for (DatatypeCtor ct : d.ctors()) {
      var sb = new StringBuilder();
      if (ct.ghost()) sb.append("ghost ");
      sb.append(attributes(ct.attributes())).append(ct.name());
      if (!ct.formals().isEmpty()) sb.append('(').append(formals(ct.formals())).append(')');
      ctors.add(sb.toString());
    }
    wr.append(String.join(" | ", ctors));
    printMemberBlock(d.members(), indent);
    return null;
  }

  @Override
  public Void visitTupleType(Decl.TupleType d, Integer indent) {
    throw UnreachableException.of("print", d);
  }

  @Override
  public Void visitIterator(Decl.Iterator d, Integer indent) {
    wr.append("iterator ").append(attributes(d.attributes())).append(d.name()).append(typeParams(d.typeArgs()))
        .append('(').append(formals(d.ins())).append(')');
    if (!d.outs().isEmpty()) {
      wr.append(" yields (").append(formals(d.outs())).append(')');
    }
    int specIndent = indent + INDENT;
    printFrameSpec("reads", d.reads(), specIndent);
    printFrameSpec("modifies", d.mod(), specIndent);
    printSpec("requires", d.req(), specIndent);
    printSpec("ensures", d.ens(), specIndent);
    printSpec("yield requires", d.yieldReq(), specIndent);
    printSpec("yield ensures", d.yieldEns(), specIndent);
    printDecreases(d.decreases(), specIndent);
    if (d.body() != null) {
      wr.append('\n');
      indent(indent);
      d.body().accept(this, indent);
    }
    return null;
  }

  @Override
  public Void visitTrait(Decl.Trait d, Integer indent) {
    wr.append("trait ").append(attributes(d.attributes())).append(d.name()).append(typeParams(d.typeArgs()))
        .append(parentTraits(d.parentTraits()));
    printClassBody(d.members(), indent);
    return null;
  }

  @Override
  public Void visitClassDecl(Decl.ClassDecl d, Integer indent) {
    wr.append("class ").append(attributes(d.attributes())).append(d.name()).append(typeParams(d.typeArgs()))
        .append(parentTraits(d.parentTraits()));
    printClassBody(d.members(), indent);
    return null;
  }

  @Override
  public Void visitDefaultClass(Decl.DefaultClass d, Integer indent) {
    printMembers(d.members(), indent);
    return null;
  }

  @Override
  public Void visitLiteralModule(Decl.LiteralModule d, Integer indent) {
    ModuleDefinition m = d.def();
    if (m.isAbstract()) wr.append("abstract ");
    wr.append("module ").append(attributes(m.attributes())).append(m.name());
    if (m.refinementBase() != null) {
      wr.append(" refines ").append(String.join(".", m.refinementBase()));
    }
    printModuleBody(m, indent);
    return null;
  }

  @Override
  public Void visitAliasModule(Decl.AliasModule d, Integer indent) {
    wr.append(d.opened() ? "import opened " : "import ").append(d.name()).append(" = ")
        .append(String.join(".", d.targetPath())).append(exports(d.exports()));
    return null;
  }

  @Override
  public Void visitAbstractModule(Decl.AbstractModule d, Integer indent) {
    wr.append(d.opened() ? "import opened " : "import ").append(d.name()).append(" : ")
        .append(String.join(".", d.path())).append(exports(d.exports()));
    return null;
  }

  @Override
  public Void visitModuleExport(Decl.ModuleExport d, Integer indent) {
    wr.append("export");
    if (!d.isDefault() || !d.name().isEmpty()) wr.append(' ').append(d.name());
    if (!d.extendsNames().isEmpty()) wr.append(" extends ").append(String.join(", ", d.extendsNames()));
    if (d.provideAll()) {
      wr.append(" provides *");
    } else if (!d.provides().isEmpty()) {
      wr.append(" provides ").append(String.join(", ", d.provides()));
    }
    if (d.revealAll()) {
      wr.append(" reveals *");
    } else if (!d.reveals().isEmpty()) {
      wr.append(" reveals ").append(String.join(", ", d.reveals()));
    }
    return null;
  }

  private void printClassBody(List<Member> members, int indent) {
    wr.append(" {\n");
    printMembers(members, indent + INDENT);
    indent(indent);
    wr.append('}');
  }

  private void printMemberBlock(List<Member> members, int indent) {
    if (members.isEmpty()) return;
    printClassBody(members, indent);
  }

  private void printMembers(List<Member> members, int indent) {
    boolean previousWasField = false;
    boolean first = true;
    for (Member m : members) {
      if (m instanceof Member.SpecialField) continue;
      if (mode == PrintMode.NO_GHOST && isGhost(m)) continue;
      boolean isField = m instanceof Member.Field || m instanceof Member.ConstantField;
      if (!first && !(isField && previousWasField)) wr.append('\n');
      first = false;
      previousWasField = isField;
      indent(indent);
      m.accept(this, indent);
      wr.append('\n');
    }
  }

  private static boolean isGhost(Member m) {
    if (m instanceof Member.Method method && method.kind().isLemma()) return true;
    return m.ghost();
  }

  // ---------------------------------------------------------------------------------------------
  // 成员

  @Override
  public Void visitField(Member.Field f, Integer indent) {
    wr.append(modifiers(f.ghost(), f.isStatic())).append("var ").append(attributes(f.attributes()))
        .append(f.name()).append(": ").append(type(f.type()));
    return null;
  }

  @Override
  public Void visitConstantField(Member.ConstantField f, Integer indent) {
    wr.append(modifiers(f.ghost(), f.isStatic()));
    if (f.opaque()) wr.append("opaque ");
    wr.append("const ").append(attributes(f.attributes())).append(f.name());
    if (!(f.type() instanceof Type.InferredType)) wr.append(": ").append(type(f.type()));
    if (f.rhs() != null) wr.append(" := ").append(expr(f.rhs()));
    return null;
  }

  @Override
  public Void visitSpecialField(Member.SpecialField f, Integer indent) {
    return null;
  }

  @Override
  public Void visitFunction(Member.Function f, Integer indent) {
    wr.append(modifiers(f.ghost(), f.isStatic()));
    if (f.opaque()) wr.append("opaque ");
    wr.append(f.kind().keyword()).append(' ').append(attributes(f.attributes())).append(f.name())
        .append(typeParams(f.typeArgs())).append('(').append(formals(f.ins())).append(')');
    if (f.result() != null) {
      wr.append(": (").append(formal(f.result())).append(')');
    } else if (!isPredicateResult(f)) {
      wr.append(": ").append(type(f.resultType()));
    }
    int specIndent = indent + INDENT;
    printSpec("requires", f.req(), specIndent);
    printFrameSpec("reads", f.reads(), specIndent);
    printSpec("ensures", f.ens(), specIndent);
    printDecreases(f.decreases(), specIndent);
    if (f.body() != null) {
      wr.append('\n');
      indent(indent);
      wr.append("{\n");
      indent(indent + INDENT);
      wr.append(expr(f.body())).append('\n');
      indent(indent);
      wr.append('}');
      if (f.byMethodBody() != null) {
        wr.append(" by method ");
        f.byMethodBody().accept(this, indent);
      }
    }
    return null;
  }

  private static boolean isPredicateResult(Member.Function f) {
    return switch (f.kind()) {
      case PREDICATE, LEAST_PREDICATE, GREATEST_PREDICATE, TWO_STATE_PREDICATE -> true;
      case FUNCTION, TWO_STATE_FUNCTION -> false;
    };
  }

  @Override
  public Void visitMethod(Member.Method m, Integer indent) {
    boolean printGhost = m.ghost() && !m.kind().isLemma();
    wr.append(modifiers(printGhost, m.isStatic())).append(m.kind().keyword()).append(' ')
        .append(attributes(m.attributes()));
    if (m.kind() != MethodKind.CONSTRUCTOR || !m.name().equals(ANONYMOUS_CONSTRUCTOR)) {
      wr.append(m.name());
    }
    wr.append(typeParams(m.typeArgs())).append('(').append(formals(m.ins())).append(')');
    if (!m.outs().isEmpty()) {
      wr.append(" returns (").append(formals(m.outs())).append(')');
    }
    int specIndent = indent + INDENT;
    printSpec("requires", m.req(), specIndent);
    printFrameSpec("reads", m.reads(), specIndent);
    printFrameSpec("modifies", m.mod(), specIndent);
    printSpec("ensures", m.ens(), specIndent);
    printDecreases(m.decreases(), specIndent);
    if (m.body() != null) {
      wr.append('\n');
      indent(indent);
      m.body().accept(this, indent);
    }
    return null;
  }

  // ---------------------------------------------------------------------------------------------
  // 规格子句

  private void printSpec(String keyword, List<AttributedExpr> clauses, int indent) {
    for (AttributedExpr clause : clauses) {
      wr.append('\n');
      indent(indent);
      wr.append(keyword).append(' ');
      if (clause.injected() && mode == PrintMode.VALIDATION) {
        wr.append("{:").append(INJECTED).append("} ");
      }
      wr.append(attributes(clause.attributes()));
      if (clause.label() != null) wr.append(clause.label()).append(": ");
      wr.append(expr(clause.expr()));
    }
  }

  private void printFrameSpec(String keyword, Specification<FrameExpr> spec, int indent) {
    if (spec.isEmpty()) return;
    wr.append('\n');
    indent(indent);
    wr.append(keyword).append(' ').append(attributes(spec.attributes())).append(frames(spec.expressions()));
  }

  private void printDecreases(Specification<Expr> spec, int indent) {
    if (spec.isEmpty()) return;
    wr.append('\n');
    indent(indent);
    wr.append("decreases ").append(attributes(spec.attributes())).append(exprs(spec.expressions()));
  }

  private String frames(List<FrameExpr> frames) {
    List<String> parts = new ArrayList<>(frames.size());
    for (FrameExpr fe : frames) {
      parts.add(fe.fieldName() == null ? expr(fe.expr()) : expr(fe.expr()) + "`" + fe.fieldName());
    }
    return String.join(", ", parts);
  }

  // ---------------------------------------------------------------------------------------------
  // 语句

  public void printStatement(Stmt s, int indent) {
    printLabels(s.meta(), indent);
    s.accept(this, indent);
  }

  private boolean shouldPrint(Stmt s) {
    if (mode != PrintMode.NO_GHOST) return true;
    if (s.ghost()) return false;
    if (s instanceof Stmt.Assert || s instanceof Stmt.Assume || s instanceof Stmt.Expect) return false;
    if (s instanceof Stmt.VarDecl vd) {
      for (Variable.LocalVariable lv : vd.locals()) {
        if (lv.ghost()) return false;
      }
    }
    return true;
  }

  private void printLabels(StmtMeta meta, int indent) {
    for (StmtMeta.Label label : meta.labels()) {
      if (label.name() == null) continue;
      wr.append("label ").append(label.name()).append(":\n");
      indent(indent);
    }
  }

  private void printStatements(List<Stmt> body, int indent) {
    for (Stmt s : body) {
      if (!shouldPrint(s)) continue;
      indent(indent);
      printStatement(s, indent);
      wr.append('\n');
    }
  }

  @Override
  public Void visitBlockStmt(Stmt.Block s, Integer indent) {
    wr.append("{\n");
    printStatements(s.body(), indent + INDENT);
    indent(indent);
    wr.append('}');
    return null;
  }

  @Override
  public Void visitDividedBlockStmt(Stmt.DividedBlock s, Integer indent) {
    wr.append("{\n");
    printStatements(s.init(), indent + INDENT);
    if (!s.proper().isEmpty()) {
      indent(indent + INDENT);
      wr.append("new;\n");
      printStatements(s.proper(), indent + INDENT);
    }
    indent(indent);
    wr.append('}');
    return null;
  }

  @Override
  public Void visitAssertStmt(Stmt.Assert s, Integer indent) {
    wr.append("assert").append(leadingAttributes(s.meta().attributes())).append(' ');
    if (s.label() != null) wr.append(s.label()).append(": ");
    wr.append(expr(s.expr()));
    if (s.proof() != null) {
      wr.append(" by ");
      s.proof().accept(this, indent);
    } else {
      wr.append(';');
    }
    return null;
  }

  @Override
  public Void visitAssumeStmt(Stmt.Assume s, Integer indent) {
    wr.append("assume").append(leadingAttributes(s.meta().attributes())).append(' ').append(expr(s.expr()))
        .append(';');
    return null;
  }

  @Override
  public Void visitExpectStmt(Stmt.Expect s, Integer indent) {
    wr.append("expect").append(leadingAttributes(s.meta().attributes())).append(' ').append(expr(s.expr()));
    if (s.message() != null) wr.append(", ").append(expr(s.message()));
    wr.append(';');
    return null;
  }

  @Override
  public Void visitPrintStmt(Stmt.Print s, Integer indent) {
    wr.append("print ").append(exprs(s.args())).append(';');
    return null;
  }

  @Override
  public Void visitReturnStmt(Stmt.Return s, Integer indent) {
    wr.append("return");
    if (!s.rhss().isEmpty()) wr.append(' ').append(rhss(s.rhss()));
    wr.append(';');
    return null;
  }

  @Override
  public Void visitBreakStmt(Stmt.Break s, Integer indent) {
    String kind = s.isContinue() ? "continue" : "break";
    if (s.targetLabel() != null) {
      wr.append(kind).append(' ').append(s.targetLabel()).append(';');
    } else {
      for (int i = 0; i < s.breakCount() - 1; i++) wr.append("break ");
      wr.append(kind).append(';');
    }
    return null;
  }

  @Override
  public Void visitVarDeclStmt(Stmt.VarDecl s, Integer indent) {
    boolean allGhost = !s.locals().isEmpty();
    for (Variable.LocalVariable lv : s.locals()) allGhost &= lv.ghost();
    if (allGhost) wr.append("ghost ");
    wr.append("var");
    String sep = "";
    for (Variable.LocalVariable lv : s.locals()) {
      wr.append(sep).append(' ').append(lv.name());
      if (!(lv.syntacticType() instanceof Type.InferredType)) wr.append(": ").append(type(lv.syntacticType()));
      sep = ",";
    }
    if (s.update() != null) {
      wr.append(" := ").append(rhss(s.update().rhss()));
    }
    wr.append(';');
    return null;
  }

  @Override
  public Void visitUpdateStmt(Stmt.Update s, Integer indent) {
    if (!s.lhss().isEmpty()) wr.append(exprs(s.lhss())).append(" := ");
    wr.append(rhss(s.rhss())).append(';');
    return null;
  }

  @Override
  public Void visitAssignStmt(Stmt.Assign s, Integer indent) {
    wr.append(expr(s.lhs())).append(" := ").append(s.rhs().accept(this, null)).append(';');
    return null;
  }

  @Override
  public Void visitCallStmt(Stmt.Call s, Integer indent) {
    if (!s.lhss().isEmpty()) wr.append(exprs(s.lhss())).append(" := ");
    wr.append(receiverPrefix(s.receiver())).append(s.methodName()).append('(').append(exprs(s.args())).append(");");
    return null;
  }

  @Override
  public Void visitIfStmt(Stmt.If s, Integer indent) {
    wr.append("if").append(leadingAttributes(s.meta().attributes())).append(' ')
        .append(s.guard() == null ? "*" : expr(s.guard())).append(' ');
    s.thn().accept(this, indent);
    if (s.els() != null) {
      wr.append(" else ");
      s.els().accept(this, indent);
    }
    return null;
  }

  @Override
  public Void visitWhileStmt(Stmt.While s, Integer indent) {
    wr.append("while").append(leadingAttributes(s.meta().attributes())).append(' ')
        .append(s.guard() == null ? "*" : expr(s.guard()));
    printSpec("invariant", s.invariants(), indent + INDENT);
    printDecreases(s.decreases(), indent + INDENT);
    printFrameSpec("modifies", s.mod(), indent + INDENT);
    if (s.body() != null) {
      boolean hasSpecs = !s.invariants().isEmpty() || !s.decreases().isEmpty() || !s.mod().isEmpty();
      if (hasSpecs) {
        wr.append('\n');
        indent(indent);
      } else {
        wr.append(' ');
      }
      s.body().accept(this, indent);
    }
    return null;
  }

  @Override
  public Void visitMatchStmt(Stmt.Match s, Integer indent) {
    wr.append("match").append(leadingAttributes(s.meta().attributes())).append(' ').append(expr(s.source()))
        .append(" {");
    int caseIndent = indent + INDENT;
    for (Stmt.MatchCase mc : s.cases()) {
      wr.append('\n');
      indent(caseIndent);
      wr.append("case").append(leadingAttributes(mc.attributes())).append(' ').append(mc.pattern().accept(this, null))
          .append(" =>");
      for (Stmt body : mc.body()) {
        if (!shouldPrint(body)) continue;
        wr.append('\n');
        indent(caseIndent + INDENT);
        printStatement(body, caseIndent + INDENT);
      }
    }
    wr.append('\n');
    indent(indent);
    wr.append('}');
    return null;
  }

  @Override
  public Void visitForallStmt(Stmt.Forall s, Integer indent) {
    wr.append("forall");
    if (!s.vars().isEmpty()) {
      wr.append(' ').append(quantifierDomain(s.vars(), s.meta().attributes(), s.range()));
    }
    printSpec("ensures", s.ens(), indent + INDENT);
    if (s.body() != null) {
      if (s.ens().isEmpty()) {
        wr.append(' ');
      } else {
        wr.append('\n');
        indent(indent);
      }
      s.body().accept(this, indent);
    }
    return null;
  }

  @Override
  public Void visitRevealStmt(Stmt.Reveal s, Integer indent) {
    wr.append("reveal ").append(exprs(s.exprs())).append(';');
    return null;
  }

  @Override
  public Void visitModifyStmt(Stmt.Modify s, Integer indent) {
    wr.append("modify").append(leadingAttributes(s.mod().attributes())).append(' ')
        .append(frames(s.mod().expressions()));
    if (s.body() != null) {
      wr.append(' ');
      s.body().accept(this, indent);
    } else {
      wr.append(';');
    }
    return null;
  }

  // ---------------------------------------------------------------------------------------------
  // 赋值右侧与模式

  private String rhss(List<Rhs> rhss) {
    List<String> parts = new ArrayList<>(rhss.size());
    for (Rhs r : rhss) parts.add(r.accept(this, null));
    return String.join(", ", parts);
  }

  @Override
  public String visitExprRhs(Rhs.ExprRhs r, Void unused) {
    return expr(r.expr()) + trailingAttributes(r.attributes());
  }

  @Override
  public String visitHavocRhs(Rhs.HavocRhs r, Void unused) {
    return "*";
  }

  @Override
  public String visitTypeRhs(Rhs.TypeRhs r, Void unused) {
    var sb = new StringBuilder("new ").append(type(r.type()));
    if (!r.arrayDims().isEmpty()) {
      sb.append('[').append(exprs(r.arrayDims())).append(']');
    } else if (r.args() != null) {
      if (r.ctorName() != null) sb.append('.').append(r.ctorName());
      sb.append('(').append(exprs(r.args())).append(')');
    }
    return sb.toString();
  }

  @Override
  public String visitLitPattern(Pattern.Lit p, Void unused) {
    return expr(p.lit());
  }

  @Override
  public String visitIdPattern(Pattern.Id p, Void unused) {
    if (p.arguments() == null) {
      return (p.ghost() ? "ghost " : "") + p.id();
    }
    List<String> args = new ArrayList<>(p.arguments().size());
    for (Pattern a : p.arguments()) args.add(a.accept(this, null));
    return p.id() + "(" + String.join(", ", args) + ")";
  }

  @Override
  public String visitDisjunctivePattern(Pattern.Disjunctive p, Void unused) {
    var sb = new StringBuilder();
    for (Pattern a : p.alternatives()) sb.append("| ").append(a.accept(this, null)).append(' ');
    return sb.toString().trim();
  }

  // ---------------------------------------------------------------------------------------------
  // 表达式

  public String expr(Expr e) {
    return e.accept(this, PREC_TOP);
  }

  private String exprs(List<Expr> exprs) {
    List<String> parts = new ArrayList<>(exprs.size());
    for (Expr e : exprs) parts.add(expr(e));
    return String.join(", ", parts);
  }

  private static String parenIf(boolean paren, String s) {
    return paren ? "(" + s + ")" : s;
  }

  /** 接收者前缀：隐式 this 与隐式静态接收者不输出。 */
  private String receiverPrefix(Expr receiver) {
    if (receiver == null) return "";
    if (receiver instanceof Expr.This t && t.implicit()) return "";
    if (receiver instanceof Expr.StaticReceiver sr && sr.type() == null) return "";
    return receiver.accept(this, PREC_PRIMARY) + ".";
  }

  @Override
  public String visitLiteralExpr(Expr.Literal e, Integer prec) {
    Object v = e.value();
    if (v == null) return "null";
    if (v instanceof String s) return "\"" + escape(s) + "\"";
    if (v instanceof Character c) return "'" + escape(String.valueOf(c)) + "'";
    if (v instanceof BigDecimal d) {
      String plain = d.toPlainString();
      return plain.contains(".") ? plain : plain + ".0";
    }
    return String.valueOf(v);
  }

  private static String escape(String s) {
    var sb = new StringBuilder(s.length());
    for (char c : s.toCharArray()) {
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\'' -> sb.append("\\'");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        case '\r' -> sb.append("\\r");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public String visitIdentExpr(Expr.Ident e, Integer prec) {
    return e.name();
  }

  @Override
  public String visitThisExpr(Expr.This e, Integer prec) {
    return "this";
  }

  @Override
  public String visitStaticReceiverExpr(Expr.StaticReceiver e, Integer prec) {
    return e.type() == null ? "" : type(e.type());
  }

  @Override
  public String visitDotNameExpr(Expr.DotName e, Integer prec) {
    String targs = e.typeArgs().isEmpty() ? "" : "<" + types(e.typeArgs()) + ">";
    return receiverPrefix(e.obj()) + e.suffix() + targs;
  }

  @Override
  public String visitFunctionCallExpr(Expr.FunctionCall e, Integer prec) {
    String at = e.atLabel() == null ? "" : "@" + e.atLabel();
    return receiverPrefix(e.receiver()) + e.name() + at + "(" + exprs(e.args()) + ")";
  }

  @Override
  public String visitUnaryExpr(Expr.Unary e, Integer prec) {
    return switch (e.op()) {
      case NOT, MINUS -> parenIf(prec > PREC_UNARY, e.op().symbol() + e.operand().accept(this, PREC_UNARY));
      case CARDINALITY -> "|" + expr(e.operand()) + "|";
      case FRESH, ALLOCATED -> e.op().symbol() + "(" + expr(e.operand()) + ")";
    };
  }

  @Override
  public String visitBinaryExpr(Expr.Binary e, Integer prec) {
    BinaryOp op = e.op();
    int p = op.precedence();
    boolean rightAssoc = op == BinaryOp.IMP;
    String left = e.left().accept(this, rightAssoc ? p + 1 : p);
    String right = e.right().accept(this, rightAssoc ? p : p + 1);
    return parenIf(prec > p, left + " " + op.symbol() + " " + right);
  }

  @Override
  public String visitIteExpr(Expr.Ite e, Integer prec) {
    return parenIf(prec > PREC_TOP,
        "if " + expr(e.test()) + " then " + expr(e.thn()) + " else " + expr(e.els()));
  }

  @Override
  public String visitOldExpr(Expr.Old e, Integer prec) {
    return "old" + (e.at() == null ? "" : "@" + e.at()) + "(" + expr(e.expr()) + ")";
  }

  @Override
  public String visitSeqDisplayExpr(Expr.SeqDisplay e, Integer prec) {
    return "[" + exprs(e.elements()) + "]";
  }

  @Override
  public String visitSetDisplayExpr(Expr.SetDisplay e, Integer prec) {
    return (e.finite() ? "" : "iset") + "{" + exprs(e.elements()) + "}";
  }

  @Override
  public String visitMapDisplayExpr(Expr.MapDisplay e, Integer prec) {
    List<String> parts = new ArrayList<>(e.entries().size());
    for (Expr.MapEntry me : e.entries()) parts.add(expr(me.key()) + " := " + expr(me.value()));
    return (e.finite() ? "map" : "imap") + "[" + String.join(", ", parts) + "]";
  }

  @Override
  public String visitSeqSelectExpr(Expr.SeqSelect e, Integer prec) {
    String seq = e.seq().accept(this, PREC_PRIMARY);
    if (e.selectOne()) {
      return seq + "[" + expr(e.lo()) + "]";
    }
    String lo = e.lo() == null ? "" : expr(e.lo());
    String hi = e.hi() == null ? "" : expr(e.hi());
    return seq + "[" + lo + ".." + hi + "]";
  }

  @Override
  public String visitQuantifierExpr(Expr.Quantifier e, Integer prec) {
    String q = (e.universal() ? "forall " : "exists ") + quantifierDomain(e.vars(), e.attributes(), e.range())
        + " :: " + expr(e.term());
    return parenIf(prec > PREC_TOP, q);
  }

  private String quantifierDomain(List<Variable.BoundVar> vars, List<Attribute> attrs, Expr range) {
    List<String> parts = new ArrayList<>(vars.size());
    for (Variable.BoundVar bv : vars) parts.add(boundVar(bv));
    String domain = String.join(", ", parts) + trailingAttributes(attrs);
    return range == null ? domain : domain + " | " + expr(range);
  }

  private String boundVar(Variable.BoundVar bv) {
    if (bv.type() instanceof Type.InferredType it && it.resolved() == null) return bv.name();
    return bv.name() + ": " + type(bv.type());
  }

  @Override
  public String visitLambdaExpr(Expr.Lambda e, Integer prec) {
    List<String> parts = new ArrayList<>(e.vars().size());
    for (Variable.BoundVar bv : e.vars()) parts.add(boundVar(bv));
    var sb = new StringBuilder("(").append(String.join(", ", parts)).append(')');
    if (!e.reads().isEmpty()) sb.append(" reads ").append(frames(e.reads().expressions()));
    if (e.range() != null) sb.append(" requires ").append(expr(e.range()));
    sb.append(" => ").append(expr(e.body()));
    return parenIf(prec > PREC_TOP, sb.toString());
  }

  @Override
  public String visitLetExpr(Expr.Let e, Integer prec) {
    List<String> names = new ArrayList<>(e.vars().size());
    for (Variable.BoundVar bv : e.vars()) names.add(boundVar(bv));
    return parenIf(prec > PREC_TOP,
        "var " + String.join(", ", names) + " := " + exprs(e.rhss()) + "; " + expr(e.body()));
  }

  @Override
  public String visitMatchExpr(Expr.Match e, Integer prec) {
    var sb = new StringBuilder("match ").append(expr(e.source())).append(" {");
    for (Expr.MatchCase mc : e.cases()) {
      sb.append(" case").append(leadingAttributes(mc.attributes())).append(' ')
          .append(mc.pattern().accept(this, null)).append(" => ").append(expr(mc.body()));
    }
    return sb.append(" }").toString();
  }

  @Override
  public String visitParensExpr(Expr.Parens e, Integer prec) {
    return "(" + expr(e.inner()) + ")";
  }

  @Override
  public String visitDatatypeValueExpr(Expr.DatatypeValue e, Integer prec) {
    String name = e.datatypeName() == null ? e.ctorName() : e.datatypeName() + "." + e.ctorName();
    return e.args().isEmpty() ? name : name + "(" + exprs(e.args()) + ")";
  }

  // ---------------------------------------------------------------------------------------------
  // 类型

  public String type(Type t) {
    return t.accept(this, null);
  }

  private String types(List<Type> types) {
    List<String> parts = new ArrayList<>(types.size());
    for (Type t : types) parts.add(type(t));
    return String.join(", ", parts);
  }

  @Override
  public String visitBasicType(Type.BasicType t, Void unused) {
    return t.name();
  }

  @Override
  public String visitSetType(Type.SetType t, Void unused) {
    return (t.finite() ? "set" : "iset") + typeArg(t.arg());
  }

  @Override
  public String visitSeqType(Type.SeqType t, Void unused) {
    return "seq" + typeArg(t.arg());
  }

  @Override
  public String visitMultiSetType(Type.MultiSetType t, Void unused) {
    return "multiset" + typeArg(t.arg());
  }

  @Override
  public String visitMapType(Type.MapType t, Void unused) {
    return (t.finite() ? "map" : "imap") + "<" + type(t.domain()) + ", " + type(t.range()) + ">";
  }

  private String typeArg(Type arg) {
    return arg == null ? "" : "<" + type(arg) + ">";
  }

  @Override
  public String visitArrowType(Type.ArrowType t, Void unused) {
    String args = t.args().size() == 1 && !(t.args().get(0) instanceof Type.ArrowType)
        ? type(t.args().get(0))
        : "(" + types(t.args()) + ")";
    return args + " -> " + type(t.result());
  }

  @Override
  public String visitUserDefinedType(Type.UserDefinedType t, Void unused) {
    return t.typeArgs().isEmpty() ? t.name() : t.name() + "<" + types(t.typeArgs()) + ">";
  }

  @Override
  public String visitInferredType(Type.InferredType t, Void unused) {
    return t.resolved() == null ? "?" : type(t.resolved());
  }

  @Override
  public String visitTypeParamRef(Type.TypeParamRef t, Void unused) {
    return t.param().name();
  }

  @Override
  public String visitRefinementWrapper(Type.RefinementWrapper t, Void unused) {
    return type(t.inner());
  }

  // ---------------------------------------------------------------------------------------------
  // 片段

  private void indent(int n) {
    wr.append(" ".repeat(n));
  }

  private static String modifiers(boolean ghost, boolean isStatic) {
    return (ghost ? "ghost " : "") + (isStatic ? "static " : "");
  }

  /** 声明关键字之后、名字之前的属性，每个属性后跟一个空格。 */
  private String attributes(List<Attribute> attrs) {
    var sb = new StringBuilder();
    for (Attribute a : attrs) sb.append(attribute(a)).append(' ');
    return sb.toString();
  }

  /** 语句关键字之后的属性，每个属性前带一个空格。 */
  private String leadingAttributes(List<Attribute> attrs) {
    var sb = new StringBuilder();
    for (Attribute a : attrs) sb.append(' ').append(attribute(a));
    return sb.toString();
  }

  private String trailingAttributes(List<Attribute> attrs) {
    return leadingAttributes(attrs);
  }

  private String attribute(Attribute a) {
    return a.args().isEmpty() ? "{:" + a.name() + "}" : "{:" + a.name() + " " + exprs(a.args()) + "}";
  }

  private String formals(List<Variable.Formal> formals) {
    List<String> parts = new ArrayList<>(formals.size());
    for (Variable.Formal f : formals) parts.add(formal(f));
    return String.join(", ", parts);
  }

  private String formal(Variable.Formal f) {
    var sb = new StringBuilder(attributes(f.attributes()));
    if (f.ghost()) sb.append("ghost ");
    if (f.nameOnly()) sb.append("nameonly ");
    if (f.older()) sb.append("older ");
    sb.append(f.name()).append(": ").append(type(f.type()));
    if (f.defaultValue() != null) sb.append(" := ").append(expr(f.defaultValue()));
    return sb.toString();
  }

  private static String typeParams(List<TypeParameter> tps) {
    if (tps.isEmpty()) return "";
    List<String> parts = new ArrayList<>(tps.size());
    for (TypeParameter tp : tps) {
      parts.add(tp.variance().symbol() + tp.name() + characteristics(tp.characteristics()));
    }
    return "<" + String.join(", ", parts) + ">";
  }

  private static String characteristics(TypeParameter.Characteristics ch) {
    List<String> parts = new ArrayList<>(3);
    if (ch.equalitySupport() == TypeParameter.EqualitySupport.REQUIRED) parts.add("==");
    switch (ch.autoInit()) {
      case NONEMPTY -> parts.add("00");
      case COMPILABLE -> parts.add("0");
      case MAYBE_EMPTY -> { }
    }
    if (ch.containsNoReferenceTypes()) parts.add("!new");
    return parts.isEmpty() ? "" : "(" + String.join(",", parts) + ")";
  }

  private String parentTraits(List<Type> traits) {
    return traits.isEmpty() ? "" : " extends " + types(traits);
  }

  private String witness(WitnessKind kind, Expr witness) {
    return switch (kind) {
      case NONE -> "";
      case OPT_OUT -> " witness *";
      case GHOST -> " ghost witness " + expr(witness);
      case COMPILED -> " witness " + expr(witness);
    };
  }

  private static String exports(List<String> exports) {
    if (exports.isEmpty()) return "";
    return exports.size() == 1 ? "`" + exports.get(0) : "`{" + String.join(", ", exports) + "}";
  }
}
