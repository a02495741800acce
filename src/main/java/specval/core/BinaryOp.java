package specval.core;

/**
 * 二元运算符，按绑定强度分级：数值越大绑定越紧。
 */
public enum BinaryOp {
  IFF("<==>", 1),
  IMP("==>", 2),
  EXP("<==", 2),
  AND("&&", 3),
  OR("||", 3),
  EQ("==", 4),
  NEQ("!=", 4),
  LT("<", 4),
  LE("<=", 4),
  GT(">", 4),
  GE(">=", 4),
  IN("in", 4),
  NOT_IN("!in", 4),
  DISJOINT("!!", 4),
  ADD("+", 6),
  SUB("-", 6),
  MUL("*", 7),
  DIV("/", 7),
  MOD("%", 7);

  private final String symbol;
  private final int precedence;

  BinaryOp(String symbol, int precedence) {
    this.symbol = symbol;
    this.precedence = precedence;
  }

  public String symbol() { return symbol; }

  public int precedence() { return precedence; }

  public static BinaryOp fromSymbol(String symbol) {
    for (BinaryOp op : values()) {
      if (op.symbol.equals(symbol)) return op;
    }
    throw new IllegalArgumentException("Unknown binary operator: " + symbol);
  }
}
