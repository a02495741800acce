package specval.core;

public enum FunctionKind {
  FUNCTION("function"),
  PREDICATE("predicate"),
  LEAST_PREDICATE("least predicate"),
  GREATEST_PREDICATE("greatest predicate"),
  TWO_STATE_PREDICATE("twostate predicate"),
  TWO_STATE_FUNCTION("twostate function");

  private final String keyword;

  FunctionKind(String keyword) { this.keyword = keyword; }

  public String keyword() { return keyword; }
}
