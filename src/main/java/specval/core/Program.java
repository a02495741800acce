package specval.core;

import java.util.Objects;

/**
 * 已解析的程序：一个默认模块加上源文件路径（打印结果写回的位置，可为 null）。
 */
public record Program(String name, ModuleDefinition defaultModule, String sourcePath) {
  public Program {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(defaultModule, "defaultModule");
  }

  public Program withDefaultModule(ModuleDefinition module) {
    return new Program(name, module, sourcePath);
  }
}
