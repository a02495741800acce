package specval.core;

import java.util.List;
import java.util.Objects;

/**
 * requires / ensures / invariant 子句。
 *
 * <p>{@code injected} 标记由校验器合成的子句，打印器的 VALIDATION 模式据此区分用户原有子句。</p>
 */
public record AttributedExpr(Expr expr, String label, List<Attribute> attributes, boolean injected) {
  public AttributedExpr {
    Objects.requireNonNull(expr, "expr");
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public static AttributedExpr of(Expr expr) {
    return new AttributedExpr(expr, null, List.of(), false);
  }

  public static AttributedExpr injected(Expr expr) {
    return new AttributedExpr(expr, null, List.of(), true);
  }
}
