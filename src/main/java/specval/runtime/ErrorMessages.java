package specval.runtime;

/**
 * 错误消息统一生成工具。
 *
 * <p>所有错误消息均提供中英文双语描述并附带恢复提示。英文部分保留固定关键字，测试按关键字断言。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   *
   * @param message 主体消息
   * @param hintZh 中文提示
   * @param hintEn 英文提示
   * @return 包含提示信息的完整消息文本
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  /**
   * 构造"变体没有处理规则"的内部错误消息。
   *
   * @param phase 所在阶段，如 clone、validate、codegen
   * @param variant 变体名称
   * @return 带有恢复建议的内部错误描述
   */
  public static String unreachableVariant(String phase, String variant) {
    String english = phase + ": no rule for " + variant;
    String message = bilingual("内部错误：" + phase + " 阶段没有处理 " + variant + " 的规则", english);
    return withHint(message, "该变体不应出现在此处，请报告此问题", "This variant must not reach this phase; please report it");
  }

  /**
   * 构造程序树格式错误消息。
   *
   * @param pointer 出错节点的 JSON Pointer
   * @param detail 具体原因
   * @return 带有恢复建议的格式错误描述
   */
  public static String malformedProgram(String pointer, String detail) {
    String english = "malformed program tree at " + pointer + ": " + detail;
    String message = bilingual("程序树格式错误，位置 " + pointer + "：" + detail, english);
    return withHint(message, "重新运行解析器导出程序树，确认版本一致", "Re-export the tree from the resolver and check its version");
  }

  /**
   * 构造变量 / 语句引用悬空的错误消息。
   *
   * @param pointer 引用所在位置
   * @param id 未定义的标识
   * @return 带有恢复建议的引用错误描述
   */
  public static String danglingReference(String pointer, String id) {
    String english = "dangling reference '" + id + "' at " + pointer;
    String message = bilingual("引用未定义的节点 '" + id + "'，位置 " + pointer, english);
    return withHint(message, "确认被引用的变量在引用之前已声明", "Ensure the referenced node is declared before it is used");
  }

  /**
   * 构造同级成员重名的错误消息。
   *
   * @param scope 所在声明
   * @param name 冲突的名字
   * @return 带有恢复建议的命名冲突描述
   */
  public static String nameCollision(String scope, String name) {
    String english = "name collision in " + scope + ": " + name;
    String message = bilingual("命名冲突：" + scope + " 中已存在 " + name, english);
    return withHint(message, "重命名原有成员，避免以 _valid 结尾", "Rename the existing member so it does not end in _valid");
  }

  /**
   * 构造代码生成不支持的构造的错误消息。
   *
   * @param feature 不支持的构造
   * @return 带有恢复建议的错误描述
   */
  public static String unsupportedFeature(String feature) {
    String english = "unsupported in compiled code: " + feature;
    String message = bilingual("编译代码中不支持：" + feature, english);
    return withHint(message, "将该构造移入 ghost 上下文", "Move the construct into a ghost context");
  }

  /**
   * 构造运行时契约违反的错误消息。
   *
   * @param description 被检查的条件
   * @return 带有恢复建议的契约错误描述
   */
  public static String contractViolation(String description) {
    String english = "contract violation: " + description;
    String message = bilingual("契约被违反：" + description, english);
    return withHint(message, "检查被校验的实现或输入值", "Inspect the implementation or the value under validation");
  }

  /**
   * 构造命令行用法错误消息。
   *
   * @param detail 具体原因
   * @return 带有用法提示的错误描述
   */
  public static String usage(String detail) {
    String english = "usage error: " + detail;
    String message = bilingual("参数错误：" + detail, english);
    return withHint(message,
        "用法 validate <文件|目录>... [--addPureCopies] [--validatePure] [--validateLemmas] [--out <目录>]",
        "usage: validate <file|folder>... [--addPureCopies] [--validatePure] [--validateLemmas] [--out <dir>]");
  }
}
