package specval.clone;

import specval.core.Member;
import specval.core.Stmt;

/**
 * 只保留签名的克隆：方法体、函数的 by-method 体、迭代器体都被丢弃，模块签名照常保留。
 */
public class ClonerButDropMethodBodies<C> extends DeepModuleSignatureCloner<C> {

  public ClonerButDropMethodBodies() {
    super(false);
  }

  public ClonerButDropMethodBodies(boolean cloneResolvedFields) {
    super(cloneResolvedFields);
  }

  @Override
  public Stmt.Block cloneBlockStmt(Stmt.Block b, C ctx) {
    return null;
  }

  @Override
  public Stmt cloneMethodBody(Member.Method m, C ctx) {
    return null;
  }
}
