package specval.core;

public enum MethodKind {
  METHOD("method"),
  CONSTRUCTOR("constructor"),
  LEMMA("lemma"),
  LEAST_LEMMA("least lemma"),
  GREATEST_LEMMA("greatest lemma"),
  TWO_STATE_LEMMA("twostate lemma");

  private final String keyword;

  MethodKind(String keyword) { this.keyword = keyword; }

  public String keyword() { return keyword; }

  /** 引理家族：只承载证明义务，没有运行时行为。 */
  public boolean isLemma() {
    return switch (this) {
      case LEMMA, LEAST_LEMMA, GREATEST_LEMMA, TWO_STATE_LEMMA -> true;
      case METHOD, CONSTRUCTOR -> false;
    };
  }
}
