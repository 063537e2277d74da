package hdlelab.stmt;

import hdlelab.util.ExprPrinter;
import hdlelab.value.ArrayRef;
import hdlelab.value.Cat;
import hdlelab.value.Signal;
import hdlelab.value.Slice;
import hdlelab.value.Value;
import java.util.List;
import java.util.Objects;

/**
 * Assignment of a source value to a target in a domain. The source is truncated or extended to the target width.
 */
public final class Assign extends Statement {
  private final Domain domain;
  private final Value target;
  private final Value source;

  public Assign(Domain domain, Value target, Value source) {
    this.domain = Objects.requireNonNull(domain, "domain");
    this.target = Objects.requireNonNull(target, "target");
    this.source = Objects.requireNonNull(source, "source");
    if (!isAssignable(target))
      throw new IllegalArgumentException("Value " + ExprPrinter.render(target) + " cannot be assigned to");
  }

  /**
   * Returns true iff the value can be the target of an assignment: a signal, or a slice, concatenation or array element built only
   * from assignable values.
   */
  public static boolean isAssignable(Value value) {
    if (value instanceof Signal)
      return true;
    if (value instanceof Slice)
      return isAssignable(((Slice)value).getOperand());
    if (value instanceof Cat)
      return ((Cat)value).getParts().stream().allMatch(Assign::isAssignable);
    if (value instanceof ArrayRef)
      return ((ArrayRef)value).getElements().stream().allMatch(Assign::isAssignable);
    return false;
  }

  public Domain getDomain() { return domain; }
  public Value getTarget() { return target; }
  public Value getSource() { return source; }

  @Override
  public List<Value> values() {
    return List.of(target, source);
  }
  @Override
  public List<List<Statement>> bodies() {
    return List.of();
  }
  @Override
  public String toString() {
    return String.format("%s: %s = %s", domain, ExprPrinter.render(target), ExprPrinter.render(source));
  }
}
