package specval.validator;

/**
 * 校验器变换的三个开关，对应命令行的同名选项。
 *
 * @param addPureCopies 每个保留的函数/谓词同时以原名输出一份副本
 * @param validatePure 为 false 时类中的函数/谓词被丢弃
 * @param validateLemmas 为 true 时引理像普通方法一样生成校验外壳
 */
public record ValidatorOptions(boolean addPureCopies, boolean validatePure, boolean validateLemmas) {
  public static final ValidatorOptions DEFAULT = new ValidatorOptions(false, true, false);

  public ValidatorOptions withAddPureCopies(boolean value) {
    return new ValidatorOptions(value, validatePure, validateLemmas);
  }

  public ValidatorOptions withValidatePure(boolean value) {
    return new ValidatorOptions(addPureCopies, value, validateLemmas);
  }

  public ValidatorOptions withValidateLemmas(boolean value) {
    return new ValidatorOptions(addPureCopies, validatePure, value);
  }
}
