package specval.printer;

/**
 * 打印模式。
 */
public enum PrintMode {
  /** 原样输出所有声明与语句。 */
  DAFNY,
  /** 跳过 ghost 成员、ghost 语句以及断言类语句。 */
  NO_GHOST,
  /** 与 DAFNY 相同，但校验器注入的规格子句带 {@code {:injected}} 标记。 */
  VALIDATION
}
