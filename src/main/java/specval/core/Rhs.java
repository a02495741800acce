package specval.core;

import java.util.List;
import java.util.Objects;

/** 赋值右侧。 */
public sealed interface Rhs {

  <R, C> R accept(Visitor<R, C> visitor, C ctx);

  interface Visitor<R, C> {
    R visitExprRhs(ExprRhs r, C ctx);
    R visitHavocRhs(HavocRhs r, C ctx);
    R visitTypeRhs(TypeRhs r, C ctx);
  }

  record ExprRhs(Expr expr, List<Attribute> attributes) implements Rhs {
    public ExprRhs {
      Objects.requireNonNull(expr, "expr");
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static ExprRhs of(Expr expr) {
      return new ExprRhs(expr, List.of());
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitExprRhs(this, ctx); }
  }

  /** {@code *}：任意值。 */
  record HavocRhs() implements Rhs {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitHavocRhs(this, ctx); }
  }

  /**
   * {@code new T[dims]} 或 {@code new T.ctor(args)}。{@code arrayDims} 非空时为数组分配，
   * {@code args} 为 null 表示不调用构造器。
   */
  record TypeRhs(Type type, List<Expr> arrayDims, String ctorName, List<Expr> args) implements Rhs {
    public TypeRhs {
      Objects.requireNonNull(type, "type");
      arrayDims = arrayDims == null ? List.of() : List.copyOf(arrayDims);
      args = args == null ? null : List.copyOf(args);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitTypeRhs(this, ctx); }
  }
}
