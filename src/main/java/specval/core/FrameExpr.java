package specval.core;

import java.util.Objects;

/** reads / modifies 帧表达式，可带 {@code `field} 后缀。 */
public record FrameExpr(Expr expr, String fieldName) {
  public FrameExpr {
    Objects.requireNonNull(expr, "expr");
  }

  public static FrameExpr of(Expr expr) {
    return new FrameExpr(expr, null);
  }
}
