package specval.runtime;

/**
 * 生成代码调用的运行时检查入口。ghost 断言经代码生成后变成对 {@link #check} 的调用。
 */
public final class Checks {
  private Checks() {}

  public static void check(boolean condition, String description) {
    if (!condition) {
      throw new ContractViolationException(description);
    }
  }

  /** expect 语句：失败时带用户给出的消息。 */
  public static void expect(boolean condition, Object message) {
    if (!condition) {
      throw new ContractViolationException(String.valueOf(message));
    }
  }
}
