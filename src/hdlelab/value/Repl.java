package hdlelab.value;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Replication of an operand, equivalent to a {@link Cat} of <code>count</code> copies. Used e.g. to replicate a sign bit.
 */
public final class Repl extends Value {
  private final Value operand;
  private final int count;

  public Repl(Value operand, int count) {
    this.operand = Objects.requireNonNull(operand, "operand");
    if (count < 0)
      throw new IllegalArgumentException("Replication count must not be negative, got " + count);
    this.count = count;
  }

  public static Repl of(Object operand, int count) { return new Repl(Value.cast(operand), count); }

  public Value getOperand() { return operand; }
  public int getCount() { return count; }

  /** The equivalent concatenation. */
  public Cat toCat() { return new Cat(Collections.nCopies(count, operand)); }

  @Override
  public List<Value> children() {
    return List.of(operand);
  }
}
