package specval.validator;

/**
 * 校验器变换使用的固定名字。
 */
public final class ValidatorNames {
  private ValidatorNames() {}

  /** 变换后声明与成员的名字后缀。 */
  public static final String SUFFIX = "_valid";

  /** 合成的有效性见证形参。 */
  public static final String WITNESS = "arg_valid";

  /** 引用副本的模块名，也是重定向导入路径的首段。 */
  public static final String REFERENCE_ROOT = "Gen";

  /** 校验器副本挂到程序上时使用的子模块名。 */
  public static final String VALIDATOR_MODULE = "Valid";

  /** autocontracts 约定下的有效性谓词。 */
  public static final String VALIDITY_PREDICATE = "Valid";

  /** autocontracts 约定下的所有权帧字段。 */
  public static final String REPR_FIELD = "Repr";

  public static final String AUTOCONTRACTS = "autocontracts";

  public static String validName(String name) {
    return name + SUFFIX;
  }
}
