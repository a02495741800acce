package specval.runtime;

/**
 * 内部错误：遇到没有处理规则的语法树变体。总是致命的，不做恢复。
 */
public final class UnreachableException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public UnreachableException(String message) { super(message); }

  public static UnreachableException of(String phase, Object node) {
    String variant = node == null ? "null" : node.getClass().getSimpleName();
    return new UnreachableException(ErrorMessages.unreachableVariant(phase, variant));
  }
}
