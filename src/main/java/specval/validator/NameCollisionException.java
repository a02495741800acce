package specval.validator;

import specval.runtime.ErrorMessages;

/**
 * 加后缀之后同级声明或成员重名。
 */
public final class NameCollisionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String scope;
  private final String name;

  public NameCollisionException(String scope, String name) {
    super(ErrorMessages.nameCollision(scope, name));
    this.scope = scope;
    this.name = name;
  }

  public String scope() {
    return scope;
  }

  public String name() {
    return name;
  }
}
