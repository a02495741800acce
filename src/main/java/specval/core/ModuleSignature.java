package specval.core;

import java.util.List;

/**
 * 解析器为模块声明计算出的签名（跨模块链接）。变换只负责保留或丢弃，不解释其内容。
 */
public record ModuleSignature(String moduleName, List<String> exportedNames) {
  public ModuleSignature {
    exportedNames = exportedNames == null ? List.of() : List.copyOf(exportedNames);
  }
}
