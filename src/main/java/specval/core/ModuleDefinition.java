package specval.core;

import java.util.List;
import java.util.Objects;

/**
 * 模块定义。默认模块（文件顶层）的 {@code prefixNamedModules} 保存以点分名字声明的子模块，
 * 例如 {@code module Valid { ... }}。
 */
public record ModuleDefinition(String name, boolean isAbstract, List<String> refinementBase, List<Decl> decls,
                               List<PrefixNameModule> prefixNamedModules, List<Attribute> attributes) {
  public static final String DEFAULT_MODULE_NAME = "_module";

  public ModuleDefinition {
    Objects.requireNonNull(name, "name");
    refinementBase = refinementBase == null ? null : List.copyOf(refinementBase);
    decls = List.copyOf(decls);
    prefixNamedModules = prefixNamedModules == null ? List.of() : List.copyOf(prefixNamedModules);
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public static ModuleDefinition of(String name, List<Decl> decls) {
    return new ModuleDefinition(name, false, null, decls, List.of(), List.of());
  }

  public boolean isDefaultModule() {
    return DEFAULT_MODULE_NAME.equals(name);
  }

  public ModuleDefinition withName(String newName) {
    return new ModuleDefinition(newName, isAbstract, refinementBase, decls, prefixNamedModules, attributes);
  }

  public ModuleDefinition withDecls(List<Decl> newDecls) {
    return new ModuleDefinition(name, isAbstract, refinementBase, newDecls, prefixNamedModules, attributes);
  }

  public ModuleDefinition withPrefixNamedModules(List<PrefixNameModule> modules) {
    return new ModuleDefinition(name, isAbstract, refinementBase, decls, modules, attributes);
  }
}
