package specval.runtime;

/**
 * 生成代码中的运行时检查失败。
 */
public final class ContractViolationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String description;

  public ContractViolationException(String description) {
    super(ErrorMessages.contractViolation(description));
    this.description = description;
  }

  public String description() {
    return description;
  }
}
