package specval.core;

import java.util.List;
import java.util.Objects;

/** 以点分前缀命名、挂在默认模块上的子模块。 */
public record PrefixNameModule(List<String> prefixIds, Decl.LiteralModule module) {
  public PrefixNameModule {
    prefixIds = List.copyOf(prefixIds);
    Objects.requireNonNull(module, "module");
  }
}
