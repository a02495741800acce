package specval.codegen;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import specval.core.Expr;
import specval.core.Member;
import specval.core.MethodKind;
import specval.core.Rhs;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.Variable;

/**
 * 输出 Java 源码的后端。
 *
 * <p>整数映射到 {@link BigInteger}，序列、集合、映射映射到 {@code java.util} 的不可变集合。
 * 运行时检查输出为对 {@link specval.runtime.Checks} 的调用。</p>
 */
public class JavaCodeGenerator extends SinglePassCodeGenerator
    implements Expr.Visitor<String, Void>, Type.Visitor<String, Boolean> {

  static final String CHECKS = "specval.runtime.Checks";
  private static final String BIG_INTEGER = "java.math.BigInteger";
  private static final String BIG_DECIMAL = "java.math.BigDecimal";

  // ---------------------------------------------------------------------------------------------
  // 声明

  @Override
  protected ConcreteSyntaxTree createModule(String name, boolean nested, ConcreteSyntaxTree wr) {
    return wr.newBlock((nested ? "public static final class " : "public final class ") + idName(name));
  }

  @Override
  protected ConcreteSyntaxTree createClass(String name, List<TypeParameter> typeArgs, boolean isTrait,
                                           ConcreteSyntaxTree wr) {
    String kind = isTrait ? "public interface " : "public static class ";
    return wr.newBlock(kind + idName(name) + typeParams(typeArgs));
  }

  @Override
  protected void emitField(Member.Field f, Host host, ConcreteSyntaxTree wr) {
    if (host.isTrait()) {
      throw new UnsupportedFeatureException("mutable field " + f.name() + " in trait " + host.className());
    }
    String mods = f.isStatic() || host.className() == null ? "public static " : "public ";
    wr.writeLine(mods + javaType(f.type()) + " " + idName(f.name()) + " = " + defaultValue(f.type()) + ";");
  }

  @Override
  protected void emitConstant(Member.ConstantField f, Host host, ConcreteSyntaxTree wr) {
    boolean isStatic = f.isStatic() || host.className() == null || host.isTrait();
    String mods = host.isTrait() ? "" : isStatic ? "public static final " : "public final ";
    String init = f.rhs() == null ? defaultValue(f.type()) : emitExpr(f.rhs());
    wr.writeLine(mods + javaType(f.type()) + " " + idName(f.name()) + " = " + init + ";");
  }

  @Override
  protected ConcreteSyntaxTree emitFunctionHeader(Member.Function f, Host host, ConcreteSyntaxTree wr) {
    if (f.byMethodBody() == null && f.body() == null && !host.isTrait()) {
      throw new UnsupportedFeatureException("function without a body: " + f.name());
    }
    String signature = modifiers(f.isStatic(), f.body() != null, host) + typeParamsPrefix(f.typeArgs())
        + javaType(f.resultType()) + " " + idName(f.name()) + "(" + formals(f.ins()) + ")";
    if (f.body() == null) {
      wr.writeLine(signature + ";");
      return null;
    }
    return wr.newBlock(signature);
  }

  @Override
  protected ConcreteSyntaxTree emitMethodHeader(Member.Method m, Host host, ConcreteSyntaxTree wr) {
    if (m.kind() == MethodKind.CONSTRUCTOR) {
      if (host.className() == null || host.isTrait()) {
        throw new UnsupportedFeatureException("constructor outside a class");
      }
      return wr.newBlock("public " + idName(host.className()) + "(" + formals(m.ins()) + ")");
    }
    if (m.body() == null && !host.isTrait()) {
      throw new UnsupportedFeatureException("method without a body: " + m.name());
    }
    String result = m.outs().isEmpty() ? "void" : javaType(m.outs().get(0).type());
    String signature = modifiers(m.isStatic(), m.body() != null, host) + typeParamsPrefix(m.typeArgs())
        + result + " " + idName(m.name()) + "(" + formals(m.ins()) + ")";
    if (m.body() == null) {
      wr.writeLine(signature + ";");
      return null;
    }
    return wr.newBlock(signature);
  }

  private static String modifiers(boolean isStatic, boolean hasBody, Host host) {
    if (host.isTrait()) {
      if (isStatic) return "static ";
      return hasBody ? "default " : "";
    }
    return isStatic || host.className() == null ? "public static " : "public ";
  }

  private String formals(List<Variable.Formal> formals) {
    List<String> parts = new ArrayList<>(formals.size());
    for (Variable.Formal f : formals) {
      parts.add(javaType(f.type()) + " " + idName(compiledName(f)));
    }
    return String.join(", ", parts);
  }

  private static String compiledName(Variable.Formal f) {
    return f.nameForCompilation() != null ? f.nameForCompilation() : f.name();
  }

  private String typeParamsPrefix(List<TypeParameter> tps) {
    return tps.isEmpty() ? "" : typeParams(tps) + " ";
  }

  private static String typeParams(List<TypeParameter> tps) {
    if (tps.isEmpty()) return "";
    List<String> names = new ArrayList<>(tps.size());
    for (TypeParameter tp : tps) names.add(idName(tp.name()));
    return "<" + String.join(", ", names) + ">";
  }

  // ---------------------------------------------------------------------------------------------
  // 语句原语

  @Override
  protected void emitOutDeclaration(Variable.Formal out, ConcreteSyntaxTree wr) {
    wr.writeLine(javaType(out.type()) + " " + idName(compiledName(out)) + " = " + defaultValue(out.type()) + ";");
  }

  @Override
  protected void emitReturn(List<Variable.Formal> outs, ConcreteSyntaxTree wr) {
    wr.writeLine(outs.isEmpty() ? "return;" : "return " + idName(compiledName(outs.get(0))) + ";");
  }

  @Override
  protected void emitReturnExpr(Expr e, ConcreteSyntaxTree wr) {
    wr.writeLine("return " + emitExpr(e) + ";");
  }

  @Override
  protected void emitLabel(String label, ConcreteSyntaxTree wr) {
    wr.writeLine(idName(label) + ":");
  }

  @Override
  protected ConcreteSyntaxTree emitBlock(ConcreteSyntaxTree wr) {
    return wr.newBlock("");
  }

  @Override
  protected void emitPrint(List<Expr> args, ConcreteSyntaxTree wr) {
    for (Expr arg : args) {
      wr.writeLine("System.out.print(" + emitExpr(arg) + ");");
    }
  }

  @Override
  protected void emitBreak(String label, int breakCount, boolean isContinue, ConcreteSyntaxTree wr) {
    String keyword = isContinue ? "continue" : "break";
    if (label != null) {
      wr.writeLine(keyword + " " + idName(label) + ";");
    } else if (breakCount <= 1) {
      wr.writeLine(keyword + ";");
    } else {
      throw new UnsupportedFeatureException("unlabelled break out of " + breakCount + " loops");
    }
  }

  @Override
  protected void emitDeclaration(Variable.LocalVariable local, Rhs init, ConcreteSyntaxTree wr) {
    Type type = local.type();
    boolean known = !(type instanceof Type.InferredType it && it.resolved() == null);
    String name = idName(local.name());
    if (init == null || init instanceof Rhs.HavocRhs) {
      if (!known) {
        throw new UnsupportedFeatureException("untyped variable " + local.name() + " without an initializer");
      }
      wr.writeLine(javaType(type) + " " + name + " = " + defaultValue(type) + ";");
      return;
    }
    wr.writeLine((known ? javaType(type) : "var") + " " + name + " = " + rhs(init) + ";");
  }

  @Override
  protected void emitAssignment(Expr lhs, Rhs rhs, ConcreteSyntaxTree wr) {
    if (rhs instanceof Rhs.HavocRhs) {
      // 编译代码中 havoc 保留原值
      return;
    }
    wr.writeLine(lvalue(lhs) + " = " + rhs(rhs) + ";");
  }

  private String lvalue(Expr lhs) {
    if (lhs instanceof Expr.SeqSelect sel && sel.selectOne()) {
      throw new UnsupportedFeatureException("element assignment " + describe(lhs));
    }
    return emitExpr(lhs);
  }

  @Override
  protected void emitExprStatement(Expr e, ConcreteSyntaxTree wr) {
    wr.writeLine(emitExpr(e) + ";");
  }

  @Override
  protected void emitCall(Expr lhs, Expr receiver, String methodName, List<Expr> args, ConcreteSyntaxTree wr) {
    String call = receiverPrefix(receiver) + idName(methodName) + "(" + exprs(args) + ")";
    wr.writeLine(lhs == null ? call + ";" : lvalue(lhs) + " = " + call + ";");
  }

  @Override
  protected ConcreteSyntaxTree emitIf(Expr guard, ConcreteSyntaxTree wr) {
    return wr.newBlock("if (" + emitExpr(guard) + ")");
  }

  @Override
  protected ConcreteSyntaxTree emitElse(ConcreteSyntaxTree wr) {
    return wr.newBlock("else");
  }

  @Override
  protected ConcreteSyntaxTree emitWhile(Expr guard, ConcreteSyntaxTree wr) {
    return wr.newBlock("while (" + emitExpr(guard) + ")");
  }

  @Override
  protected void emitRuntimeCheck(Expr condition, String description, ConcreteSyntaxTree wr) {
    wr.writeLine(CHECKS + ".check(" + emitExpr(condition) + ", " + quote(description) + ");");
  }

  @Override
  protected void emitExpect(Expr condition, Expr message, String description, ConcreteSyntaxTree wr) {
    String msg = message == null ? quote(description) : emitExpr(message);
    wr.writeLine(CHECKS + ".expect(" + emitExpr(condition) + ", " + msg + ");");
  }

  private String rhs(Rhs rhs) {
    if (rhs instanceof Rhs.ExprRhs er) return emitExpr(er.expr());
    if (rhs instanceof Rhs.TypeRhs tr) {
      if (!tr.arrayDims().isEmpty()) {
        if (tr.arrayDims().size() > 1) {
          throw new UnsupportedFeatureException("multi-dimensional array");
        }
        return "new " + javaType(tr.type()) + "[" + emitExpr(tr.arrayDims().get(0)) + ".intValueExact()]";
      }
      return "new " + javaType(tr.type()) + "(" + (tr.args() == null ? "" : exprs(tr.args())) + ")";
    }
    throw new UnsupportedFeatureException("havoc value");
  }

  // ---------------------------------------------------------------------------------------------
  // 表达式

  @Override
  public String emitExpr(Expr e) {
    return e.accept(this, null);
  }

  private String exprs(List<Expr> exprs) {
    List<String> parts = new ArrayList<>(exprs.size());
    for (Expr e : exprs) parts.add(emitExpr(e));
    return String.join(", ", parts);
  }

  private String receiverPrefix(Expr receiver) {
    if (receiver == null) return "";
    if (receiver instanceof Expr.This t && t.implicit()) return "";
    if (receiver instanceof Expr.StaticReceiver sr && sr.type() == null) return "";
    return emitExpr(receiver) + ".";
  }

  @Override
  public String visitLiteralExpr(Expr.Literal e, Void unused) {
    Object v = e.value();
    if (v == null) return "null";
    if (v instanceof Boolean) return v.toString();
    if (v instanceof BigInteger i) {
      return i.bitLength() < 64 ? BIG_INTEGER + ".valueOf(" + i + "L)" : "new " + BIG_INTEGER + "(\"" + i + "\")";
    }
    if (v instanceof BigDecimal d) return "new " + BIG_DECIMAL + "(\"" + d.toPlainString() + "\")";
    if (v instanceof Character c) return "'" + escape(String.valueOf(c)) + "'";
    if (v instanceof String s) return quote(s);
    throw new UnsupportedFeatureException("literal of type " + v.getClass().getSimpleName());
  }

  @Override
  public String visitIdentExpr(Expr.Ident e, Void unused) {
    if (e.var() instanceof Variable.Formal f) return idName(compiledName(f));
    return idName(e.name());
  }

  @Override
  public String visitThisExpr(Expr.This e, Void unused) {
    return "this";
  }

  @Override
  public String visitStaticReceiverExpr(Expr.StaticReceiver e, Void unused) {
    return e.type() == null ? "" : javaType(e.type());
  }

  @Override
  public String visitDotNameExpr(Expr.DotName e, Void unused) {
    return receiverPrefix(e.obj()) + idName(e.suffix());
  }

  @Override
  public String visitFunctionCallExpr(Expr.FunctionCall e, Void unused) {
    if (e.atLabel() != null) {
      throw new UnsupportedFeatureException("two-state call " + e.name() + "@" + e.atLabel());
    }
    return receiverPrefix(e.receiver()) + idName(e.name()) + "(" + exprs(e.args()) + ")";
  }

  @Override
  public String visitUnaryExpr(Expr.Unary e, Void unused) {
    String operand = emitExpr(e.operand());
    return switch (e.op()) {
      case NOT -> "!(" + operand + ")";
      case MINUS -> operand + ".negate()";
      case CARDINALITY -> BIG_INTEGER + ".valueOf(" + operand + ".size())";
      case FRESH, ALLOCATED -> throw new UnsupportedFeatureException(e.op().symbol() + "(...)");
    };
  }

  @Override
  public String visitBinaryExpr(Expr.Binary e, Void unused) {
    String l = emitExpr(e.left());
    String r = emitExpr(e.right());
    return switch (e.op()) {
      case IFF -> "(" + l + " == " + r + ")";
      case IMP -> "(!(" + l + ") || " + r + ")";
      case EXP -> "(" + l + " || !(" + r + "))";
      case AND -> "(" + l + " && " + r + ")";
      case OR -> "(" + l + " || " + r + ")";
      case EQ -> "java.util.Objects.equals(" + l + ", " + r + ")";
      case NEQ -> "!java.util.Objects.equals(" + l + ", " + r + ")";
      case LT -> "(" + l + ".compareTo(" + r + ") < 0)";
      case LE -> "(" + l + ".compareTo(" + r + ") <= 0)";
      case GT -> "(" + l + ".compareTo(" + r + ") > 0)";
      case GE -> "(" + l + ".compareTo(" + r + ") >= 0)";
      case IN -> r + ".contains(" + l + ")";
      case NOT_IN -> "!" + r + ".contains(" + l + ")";
      case DISJOINT -> "java.util.Collections.disjoint(" + l + ", " + r + ")";
      case ADD -> isString(e.left()) ? "(" + l + " + " + r + ")" : l + ".add(" + r + ")";
      case SUB -> l + ".subtract(" + r + ")";
      case MUL -> l + ".multiply(" + r + ")";
      case DIV -> l + ".divide(" + r + ")";
      case MOD -> l + ".mod(" + r + ")";
    };
  }

  private static boolean isString(Expr e) {
    if (e instanceof Expr.Literal lit) return lit.value() instanceof String;
    if (e instanceof Expr.Ident id) {
      Type t = id.type();
      while (t instanceof Type.InferredType it && it.resolved() != null) t = it.resolved();
      return t instanceof Type.BasicType b && b.name().equals("string");
    }
    return false;
  }

  @Override
  public String visitIteExpr(Expr.Ite e, Void unused) {
    return "(" + emitExpr(e.test()) + " ? " + emitExpr(e.thn()) + " : " + emitExpr(e.els()) + ")";
  }

  @Override
  public String visitOldExpr(Expr.Old e, Void unused) {
    throw new UnsupportedFeatureException("old(...)");
  }

  @Override
  public String visitSeqDisplayExpr(Expr.SeqDisplay e, Void unused) {
    return "java.util.List.of(" + exprs(e.elements()) + ")";
  }

  @Override
  public String visitSetDisplayExpr(Expr.SetDisplay e, Void unused) {
    if (!e.finite()) throw new UnsupportedFeatureException("iset display");
    return "java.util.Set.copyOf(java.util.List.of(" + exprs(e.elements()) + "))";
  }

  @Override
  public String visitMapDisplayExpr(Expr.MapDisplay e, Void unused) {
    if (!e.finite()) throw new UnsupportedFeatureException("imap display");
    List<String> entries = new ArrayList<>(e.entries().size());
    for (Expr.MapEntry me : e.entries()) {
      entries.add("java.util.Map.entry(" + emitExpr(me.key()) + ", " + emitExpr(me.value()) + ")");
    }
    return "java.util.Map.ofEntries(" + String.join(", ", entries) + ")";
  }

  @Override
  public String visitSeqSelectExpr(Expr.SeqSelect e, Void unused) {
    String seq = emitExpr(e.seq());
    if (e.selectOne()) {
      return seq + ".get(" + emitExpr(e.lo()) + ".intValueExact())";
    }
    String lo = e.lo() == null ? "0" : emitExpr(e.lo()) + ".intValueExact()";
    String hi = e.hi() == null ? seq + ".size()" : emitExpr(e.hi()) + ".intValueExact()";
    return seq + ".subList(" + lo + ", " + hi + ")";
  }

  @Override
  public String visitQuantifierExpr(Expr.Quantifier e, Void unused) {
    throw new UnsupportedFeatureException(e.universal() ? "forall expression" : "exists expression");
  }

  @Override
  public String visitLambdaExpr(Expr.Lambda e, Void unused) {
    throw new UnsupportedFeatureException("lambda expression");
  }

  @Override
  public String visitLetExpr(Expr.Let e, Void unused) {
    throw new UnsupportedFeatureException("let expression");
  }

  @Override
  public String visitMatchExpr(Expr.Match e, Void unused) {
    throw new UnsupportedFeatureException("match expression");
  }

  @Override
  public String visitParensExpr(Expr.Parens e, Void unused) {
    return "(" + emitExpr(e.inner()) + ")";
  }

  @Override
  public String visitDatatypeValueExpr(Expr.DatatypeValue e, Void unused) {
    String owner = e.datatypeName() == null ? "" : idName(e.datatypeName()) + ".";
    return owner + "create_" + idName(e.ctorName()) + "(" + exprs(e.args()) + ")";
  }

  // ---------------------------------------------------------------------------------------------
  // 类型

  public String javaType(Type t) {
    return t.accept(this, false);
  }

  private String boxed(Type t) {
    return t.accept(this, true);
  }

  @Override
  public String visitBasicType(Type.BasicType t, Boolean box) {
    return switch (t.name()) {
      case "int", "nat", "ORDINAL" -> BIG_INTEGER;
      case "real" -> BIG_DECIMAL;
      case "bool" -> box ? "Boolean" : "boolean";
      case "char" -> box ? "Character" : "char";
      case "string" -> "String";
      case "object" -> "Object";
      default -> idName(t.name());
    };
  }

  @Override
  public String visitSetType(Type.SetType t, Boolean box) {
    return "java.util.Set<" + boxed(t.arg()) + ">";
  }

  @Override
  public String visitSeqType(Type.SeqType t, Boolean box) {
    return "java.util.List<" + boxed(t.arg()) + ">";
  }

  @Override
  public String visitMultiSetType(Type.MultiSetType t, Boolean box) {
    return "java.util.Map<" + boxed(t.arg()) + ", " + BIG_INTEGER + ">";
  }

  @Override
  public String visitMapType(Type.MapType t, Boolean box) {
    return "java.util.Map<" + boxed(t.domain()) + ", " + boxed(t.range()) + ">";
  }

  @Override
  public String visitArrowType(Type.ArrowType t, Boolean box) {
    return switch (t.args().size()) {
      case 0 -> "java.util.function.Supplier<" + boxed(t.result()) + ">";
      case 1 -> "java.util.function.Function<" + boxed(t.args().get(0)) + ", " + boxed(t.result()) + ">";
      default -> throw new UnsupportedFeatureException("function type with " + t.args().size() + " arguments");
    };
  }

  @Override
  public String visitUserDefinedType(Type.UserDefinedType t, Boolean box) {
    if (t.typeArgs().isEmpty()) return idName(t.name());
    List<String> args = new ArrayList<>(t.typeArgs().size());
    for (Type a : t.typeArgs()) args.add(boxed(a));
    return idName(t.name()) + "<" + String.join(", ", args) + ">";
  }

  @Override
  public String visitInferredType(Type.InferredType t, Boolean box) {
    return t.resolved() == null ? "Object" : t.resolved().accept(this, box);
  }

  @Override
  public String visitTypeParamRef(Type.TypeParamRef t, Boolean box) {
    return idName(t.param().name());
  }

  @Override
  public String visitRefinementWrapper(Type.RefinementWrapper t, Boolean box) {
    return t.inner().accept(this, box);
  }

  String defaultValue(Type t) {
    if (t instanceof Type.InferredType it && it.resolved() != null) return defaultValue(it.resolved());
    if (t instanceof Type.RefinementWrapper rw) return defaultValue(rw.inner());
    if (t instanceof Type.BasicType b) {
      return switch (b.name()) {
        case "int", "nat", "ORDINAL" -> BIG_INTEGER + ".ZERO";
        case "real" -> BIG_DECIMAL + ".ZERO";
        case "bool" -> "false";
        case "char" -> "'D'";
        case "string" -> "\"\"";
        default -> "null";
      };
    }
    if (t instanceof Type.SeqType) return "java.util.List.of()";
    if (t instanceof Type.SetType) return "java.util.Set.of()";
    if (t instanceof Type.MapType || t instanceof Type.MultiSetType) return "java.util.Map.of()";
    return "null";
  }

  // ---------------------------------------------------------------------------------------------
  // 名字与字面量

  /** Java 标识符不允许 {@code '} 与 {@code ?}，点分名字保持原样。 */
  static String idName(String name) {
    return name.replace("'", "_k").replace("?", "_q").replace("#", "_");
  }

  static String quote(String s) {
    return "\"" + escape(s) + "\"";
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
}
