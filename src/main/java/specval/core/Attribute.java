package specval.core;

import java.util.List;
import java.util.Objects;

/**
 * 声明/语句上的属性，如 {@code {:autocontracts}}。
 *
 * <p>属性链按"最外层优先"保存为有序列表。名称以 {@link #RESERVED_PREFIX} 开头的属性由解析阶段生成，
 * 非 resolved 克隆时会被丢弃。</p>
 */
public record Attribute(String name, List<Expr> args) {
  public static final String RESERVED_PREFIX = "_";

  public Attribute {
    Objects.requireNonNull(name, "name");
    args = args == null ? List.of() : List.copyOf(args);
  }

  public static Attribute of(String name, Expr... args) {
    return new Attribute(name, List.of(args));
  }

  public boolean isReserved() {
    return name.startsWith(RESERVED_PREFIX);
  }

  /**
   * 查找布尔标记属性：无参数视为 true，单个布尔字面量参数取其值。
   *
   * @return 属性存在且取值为 true
   */
  public static boolean isTrue(List<Attribute> attributes, String name) {
    if (attributes == null) return false;
    for (Attribute a : attributes) {
      if (!a.name.equals(name)) continue;
      if (a.args.isEmpty()) return true;
      if (a.args.size() == 1 && a.args.get(0) instanceof Expr.Literal lit && lit.value() instanceof Boolean b) {
        return b;
      }
    }
    return false;
  }

  public static boolean contains(List<Attribute> attributes, String name) {
    if (attributes == null) return false;
    for (Attribute a : attributes) if (a.name.equals(name)) return true;
    return false;
  }
}
