package specval.runtime;

/**
 * specval 运行配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次。
 */
public final class ValidatorConfig {
  private ValidatorConfig() {}

  /**
   * 调试模式开关
   * 环境变量：SPECVAL_DEBUG
   * 启用时命令行把每个输入文件的路径与变换选项打印到 stderr
   */
  public static final boolean DEBUG = System.getenv("SPECVAL_DEBUG") != null;

  /**
   * 输出文件扩展名
   * 环境变量：SPECVAL_OUTPUT_EXTENSION
   * 程序树没有记录源文件路径时，输出写到 {@code <程序名><扩展名>}，默认 ".dfy"
   */
  public static final String OUTPUT_EXTENSION = getEnvOrDefault("SPECVAL_OUTPUT_EXTENSION", ".dfy");

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null && !value.isEmpty() ? value : defaultValue;
  }
}
