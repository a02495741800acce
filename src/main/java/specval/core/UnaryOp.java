package specval.core;

public enum UnaryOp {
  NOT("!"),
  MINUS("-"),
  CARDINALITY("|"),
  FRESH("fresh"),
  ALLOCATED("allocated");

  private final String symbol;

  UnaryOp(String symbol) { this.symbol = symbol; }

  public String symbol() { return symbol; }
}
