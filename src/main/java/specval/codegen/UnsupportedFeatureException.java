package specval.codegen;

import specval.runtime.ErrorMessages;

/**
 * 只在 ghost 上下文中有意义的构造（量词、old、非确定选择等）到达了编译代码。
 */
public final class UnsupportedFeatureException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String feature;

  public UnsupportedFeatureException(String feature) {
    super(ErrorMessages.unsupportedFeature(feature));
    this.feature = feature;
  }

  public String feature() {
    return feature;
  }
}
