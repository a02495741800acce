package specval.validator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import specval.clone.DeepModuleSignatureCloner;
import specval.core.Decl;
import specval.core.ModuleDefinition;
import specval.core.PrefixNameModule;
import specval.core.Program;

/**
 * 把校验器副本接到程序上。
 *
 * <p>程序的默认模块被克隆两次：引用副本 {@code Gen} 保留原行为与模块签名；校验器副本 {@code Valid}
 * 由 {@link ValidatorCloner} 生成，并以 {@code import opened Gen = Gen} 看到引用副本。默认模块原有的前缀命名子模块
 * 全部被替换为唯一的 {@code Valid} 子模块，其余顶层声明保持不变。</p>
 *
 * <p>用户的前缀命名子模块（如 {@code module A.B}）经过变换后保留在 {@code Valid} 内部；
 * 上一次运行留下的 {@code Valid...} 子模块在变换前丢弃。</p>
 */
public final class ModuleWiring {
  private static final Logger logger = Logger.getLogger(ModuleWiring.class.getName());

  private ModuleWiring() {}

  public static WiringResult wire(Program program, ValidatorOptions options, IdSource ids) {
    ModuleDefinition root = program.defaultModule();

    ModuleDefinition reference = new DeepModuleSignatureCloner<Void>()
        .cloneModuleDefinition(root, ValidatorNames.REFERENCE_ROOT, null);

    List<PrefixNameModule> userModules = new ArrayList<>(root.prefixNamedModules().size());
    for (PrefixNameModule p : root.prefixNamedModules()) {
      if (!p.prefixIds().isEmpty() && ValidatorNames.VALIDATOR_MODULE.equals(p.prefixIds().get(0))) {
        logger.fine(String.format("Dropping stale module %s of %s", String.join(".", p.prefixIds()), program.name()));
        continue;
      }
      userModules.add(p);
    }
    ModuleDefinition transformed = new ValidatorCloner(options, ids)
        .transform(root.withPrefixNamedModules(userModules), ValidatorNames.VALIDATOR_MODULE);
    var genImport = new Decl.AliasModule(ValidatorNames.REFERENCE_ROOT, List.of(ValidatorNames.REFERENCE_ROOT),
        true, List.of(), null, ids.next());
    List<Decl> decls = new ArrayList<>(transformed.decls().size() + 1);
    decls.add(genImport);
    for (Decl d : transformed.decls()) {
      if (ValidatorNames.REFERENCE_ROOT.equals(d.name())) {
        throw new NameCollisionException(ValidatorNames.VALIDATOR_MODULE, d.name());
      }
      decls.add(d);
    }
    ModuleDefinition validator = transformed.withDecls(decls);

    if (!root.prefixNamedModules().isEmpty()) {
      logger.fine(String.format("Replacing %d prefix-named module(s) of %s",
          root.prefixNamedModules().size(), program.name()));
    }
    var submodule = new PrefixNameModule(List.of(ValidatorNames.VALIDATOR_MODULE),
        new Decl.LiteralModule(validator, ids.next()));
    Program rewired = program.withDefaultModule(root.withPrefixNamedModules(List.of(submodule)));
    return new WiringResult(rewired, reference, validator);
  }
}
