package specval.clone;

import specval.core.Decl;

/**
 * 深拷贝模块树，并把模块导入声明上的签名原样带到副本上，使副本无需重新链接即可解析跨模块引用。
 */
public class DeepModuleSignatureCloner<C> extends Cloner<C> {

  public DeepModuleSignatureCloner() {
    this(false);
  }

  public DeepModuleSignatureCloner(boolean cloneResolvedFields) {
    super(true, cloneResolvedFields);
  }

  @Override
  public Decl visitAliasModule(Decl.AliasModule d, C ctx) {
    return new Decl.AliasModule(d.name(), d.targetPath(), d.opened(), d.exports(), d.signature(), d.cloneId());
  }

  @Override
  public Decl visitAbstractModule(Decl.AbstractModule d, C ctx) {
    return new Decl.AbstractModule(d.name(), d.path(), d.opened(), d.exports(), d.signature(), d.cloneId());
  }
}
