package specval.core;

import java.util.List;
import java.util.Objects;

/**
 * 表达式语法树。
 *
 * <p>标识符表达式通过 {@link Ident#var()} 直接指向它解析到的变量对象，克隆时按身份映射。</p>
 */
public sealed interface Expr {

  <R, C> R accept(Visitor<R, C> visitor, C ctx);

  interface Visitor<R, C> {
    R visitLiteralExpr(Literal e, C ctx);
    R visitIdentExpr(Ident e, C ctx);
    R visitThisExpr(This e, C ctx);
    R visitStaticReceiverExpr(StaticReceiver e, C ctx);
    R visitDotNameExpr(DotName e, C ctx);
    R visitFunctionCallExpr(FunctionCall e, C ctx);
    R visitUnaryExpr(Unary e, C ctx);
    R visitBinaryExpr(Binary e, C ctx);
    R visitIteExpr(Ite e, C ctx);
    R visitOldExpr(Old e, C ctx);
    R visitSeqDisplayExpr(SeqDisplay e, C ctx);
    R visitSetDisplayExpr(SetDisplay e, C ctx);
    R visitMapDisplayExpr(MapDisplay e, C ctx);
    R visitSeqSelectExpr(SeqSelect e, C ctx);
    R visitQuantifierExpr(Quantifier e, C ctx);
    R visitLambdaExpr(Lambda e, C ctx);
    R visitLetExpr(Let e, C ctx);
    R visitMatchExpr(Match e, C ctx);
    R visitParensExpr(Parens e, C ctx);
    R visitDatatypeValueExpr(DatatypeValue e, C ctx);
  }

  /**
   * 字面量：null、Boolean、BigInteger、BigDecimal、String、Character。
   * {@code type} 仅在已解析的树中存在。
   */
  record Literal(Object value, Type type) implements Expr {
    public static Literal of(Object value) {
      return new Literal(value, null);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitLiteralExpr(this, ctx); }
  }

  record Ident(String name, Variable var, Type type) implements Expr {
    public Ident { Objects.requireNonNull(name, "name"); }

    /** 指向已解析变量的引用，类型取自变量本身。 */
    public static Ident of(Variable var) {
      return new Ident(var.name(), var, var.type());
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitIdentExpr(this, ctx); }
  }

  /** {@code this}；{@code implicit} 表示源码中省略的接收者。 */
  record This(Type type, boolean implicit) implements Expr {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitThisExpr(this, ctx); }
  }

  /** 静态调用的接收者；{@code type} 为 null 时为隐式（同一作用域内的调用）。 */
  record StaticReceiver(Type type) implements Expr {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitStaticReceiverExpr(this, ctx); }
  }

  /** {@code obj.suffix}：字段访问或成员选择。 */
  record DotName(Expr obj, String suffix, List<Type> typeArgs) implements Expr {
    public DotName {
      Objects.requireNonNull(obj, "obj");
      Objects.requireNonNull(suffix, "suffix");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
    }

    public static DotName of(Expr obj, String suffix) {
      return new DotName(obj, suffix, List.of());
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitDotNameExpr(this, ctx); }
  }

  /** 函数调用；{@code receiver} 为 null 时调用同一作用域的函数。 */
  record FunctionCall(Expr receiver, String name, List<Expr> args, String atLabel) implements Expr {
    public FunctionCall {
      Objects.requireNonNull(name, "name");
      args = List.copyOf(args);
    }

    public static FunctionCall of(Expr receiver, String name, List<Expr> args) {
      return new FunctionCall(receiver, name, args, null);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitFunctionCallExpr(this, ctx); }
  }

  record Unary(UnaryOp op, Expr operand) implements Expr {
    public Unary {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(operand, "operand");
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitUnaryExpr(this, ctx); }
  }

  record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
    public Binary {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitBinaryExpr(this, ctx); }
  }

  record Ite(Expr test, Expr thn, Expr els) implements Expr {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitIteExpr(this, ctx); }
  }

  record Old(Expr expr, String at) implements Expr {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitOldExpr(this, ctx); }
  }

  record SeqDisplay(List<Expr> elements) implements Expr {
    public SeqDisplay { elements = List.copyOf(elements); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitSeqDisplayExpr(this, ctx); }
  }

  record SetDisplay(boolean finite, List<Expr> elements) implements Expr {
    public SetDisplay { elements = List.copyOf(elements); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitSetDisplayExpr(this, ctx); }
  }

  record MapEntry(Expr key, Expr value) {}

  record MapDisplay(boolean finite, List<MapEntry> entries) implements Expr {
    public MapDisplay { entries = List.copyOf(entries); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitMapDisplayExpr(this, ctx); }
  }

  /** {@code s[i]}（selectOne）或切片 {@code s[lo..hi]}，两端均可省略。 */
  record SeqSelect(boolean selectOne, Expr seq, Expr lo, Expr hi) implements Expr {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitSeqSelectExpr(this, ctx); }
  }

  /** forall（universal）或 exists；{@code range} 可为 null。 */
  record Quantifier(boolean universal, List<Variable.BoundVar> vars, Expr range, Expr term,
                    List<Attribute> attributes) implements Expr {
    public Quantifier {
      vars = List.copyOf(vars);
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitQuantifierExpr(this, ctx); }
  }

  record Lambda(List<Variable.BoundVar> vars, Expr range, Specification<FrameExpr> reads, Expr body) implements Expr {
    public Lambda {
      vars = List.copyOf(vars);
      reads = reads == null ? Specification.empty() : reads;
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitLambdaExpr(this, ctx); }
  }

  record Let(List<Variable.BoundVar> vars, List<Expr> rhss, Expr body) implements Expr {
    public Let {
      vars = List.copyOf(vars);
      rhss = List.copyOf(rhss);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitLetExpr(this, ctx); }
  }

  record MatchCase(Pattern pattern, Expr body, List<Attribute> attributes) {
    public MatchCase {
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
  }

  record Match(Expr source, List<MatchCase> cases) implements Expr {
    public Match { cases = List.copyOf(cases); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitMatchExpr(this, ctx); }
  }

  record Parens(Expr inner) implements Expr {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitParensExpr(this, ctx); }
  }

  record DatatypeValue(String datatypeName, String ctorName, List<Expr> args) implements Expr {
    public DatatypeValue { args = List.copyOf(args); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitDatatypeValueExpr(this, ctx); }
  }
}
