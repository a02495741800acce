package specval.core;

import java.util.List;
import java.util.Objects;

/** match 语句/表达式中的扩展模式。 */
public sealed interface Pattern {

  <R, C> R accept(Visitor<R, C> visitor, C ctx);

  interface Visitor<R, C> {
    R visitLitPattern(Lit p, C ctx);
    R visitIdPattern(Id p, C ctx);
    R visitDisjunctivePattern(Disjunctive p, C ctx);
  }

  record Lit(Expr.Literal lit) implements Pattern {
    public Lit { Objects.requireNonNull(lit, "lit"); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitLitPattern(this, ctx); }
  }

  /**
   * 构造器模式 {@code Ctor(p1, p2)} 或变量绑定。{@code arguments} 为 null 表示没有括号；
   * 此时若 {@code var} 非空，它是引入的绑定变量。
   */
  record Id(String id, Variable.BoundVar var, List<Pattern> arguments, boolean ghost) implements Pattern {
    public Id {
      Objects.requireNonNull(id, "id");
      arguments = arguments == null ? null : List.copyOf(arguments);
    }

    public static Id binder(Variable.BoundVar var) {
      return new Id(var.name(), var, null, var.ghost());
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitIdPattern(this, ctx); }
  }

  record Disjunctive(List<Pattern> alternatives, boolean ghost) implements Pattern {
    public Disjunctive { alternatives = List.copyOf(alternatives); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitDisjunctivePattern(this, ctx); }
  }
}
