package specval.core;

import java.util.Objects;

/**
 * 类型参数。克隆时按对象身份记忆，同一遍克隆中同一个源类型参数只产生一个副本。
 */
public record TypeParameter(String name, Variance variance, Characteristics characteristics) {
  public TypeParameter {
    Objects.requireNonNull(name, "name");
    variance = variance == null ? Variance.NON_VARIANT_PERMISSIVE : variance;
    characteristics = characteristics == null ? Characteristics.DEFAULT : characteristics;
  }

  public static TypeParameter of(String name) {
    return new TypeParameter(name, Variance.NON_VARIANT_PERMISSIVE, Characteristics.DEFAULT);
  }

  public enum Variance {
    NON_VARIANT_STRICT("!"),
    NON_VARIANT_PERMISSIVE(""),
    COVARIANT_STRICT("+"),
    COVARIANT_PERMISSIVE("*"),
    CONTRAVARIANT("-");

    private final String symbol;

    Variance(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }
  }

  public enum EqualitySupport { UNSPECIFIED, REQUIRED, INFERRED_REQUIRED }

  public enum AutoInit { MAYBE_EMPTY, NONEMPTY, COMPILABLE }

  /** 类型参数特征：(==)、(0)/(00)、(!new)。 */
  public record Characteristics(EqualitySupport equalitySupport, AutoInit autoInit, boolean containsNoReferenceTypes) {
    public static final Characteristics DEFAULT =
        new Characteristics(EqualitySupport.UNSPECIFIED, AutoInit.MAYBE_EMPTY, false);

    public Characteristics {
      equalitySupport = equalitySupport == null ? EqualitySupport.UNSPECIFIED : equalitySupport;
      autoInit = autoInit == null ? AutoInit.MAYBE_EMPTY : autoInit;
    }
  }
}
