package hdlelab.value;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Operator node: a kind and an ordered operand list. The operand count is checked against the kind on construction.
 */
public final class Operator extends Value {
  public enum Category { ARITHMETIC, BITWISE, COMPARISON, LOGICAL, SHIFT, SELECT, CAST }

  public enum Kind {
    ADD("+", 2, Category.ARITHMETIC),
    SUB("-", 2, Category.ARITHMETIC),
    MUL("*", 2, Category.ARITHMETIC),
    NEG("-", 1, Category.ARITHMETIC),
    AND("&", 2, Category.BITWISE),
    OR("|", 2, Category.BITWISE),
    XOR("^", 2, Category.BITWISE),
    INVERT("~", 1, Category.BITWISE),
    EQ("==", 2, Category.COMPARISON),
    NE("!=", 2, Category.COMPARISON),
    LT("<", 2, Category.COMPARISON),
    GT(">", 2, Category.COMPARISON),
    LE("<=", 2, Category.COMPARISON),
    GE(">=", 2, Category.COMPARISON),
    BOOL("|", 1, Category.LOGICAL),
    ALL("&", 1, Category.LOGICAL),
    XOR_REDUCE("^", 1, Category.LOGICAL),
    LOGICAL_NOT("!", 1, Category.LOGICAL),
    LOGICAL_AND("&&", 2, Category.LOGICAL),
    LOGICAL_OR("||", 2, Category.LOGICAL),
    SHL("<<", 2, Category.SHIFT),
    SHR(">>", 2, Category.SHIFT),
    MUX("?:", 3, Category.SELECT),
    AS_SIGNED("$signed", 1, Category.CAST),
    AS_UNSIGNED("$unsigned", 1, Category.CAST);

    public final String symbol;
    public final int arity;
    public final Category category;

    private Kind(String symbol, int arity, Category category) {
      this.symbol = symbol;
      this.arity = arity;
      this.category = category;
    }
  }

  private final Kind kind;
  private final List<Value> operands;

  public Operator(Kind kind, List<Value> operands) {
    this.kind = Objects.requireNonNull(kind, "kind");
    operands.forEach(operand -> Objects.requireNonNull(operand, "operand"));
    if (operands.size() != kind.arity)
      throw new IllegalArgumentException(String.format("Operator %s takes %d operand(s), got %d", kind, kind.arity, operands.size()));
    this.operands = List.copyOf(operands);
  }
  public Operator(Kind kind, Value... operands) { this(kind, Arrays.asList(operands)); }

  /**
   * Two-way selection: <code>sel ? ifTrue : ifFalse</code>; sel is reduced to one bit.
   */
  public static Operator mux(Object sel, Object ifTrue, Object ifFalse) {
    return new Operator(Kind.MUX, Value.cast(sel), Value.cast(ifTrue), Value.cast(ifFalse));
  }

  public Kind getKind() { return kind; }
  public List<Value> getOperands() { return operands; }
  public Value getOperand(int i) { return operands.get(i); }

  @Override
  public List<Value> children() {
    return operands;
  }
}
