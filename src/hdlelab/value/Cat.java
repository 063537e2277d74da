package hdlelab.value;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Concatenation; the first operand occupies the least significant bits. The result is unsigned.
 */
public final class Cat extends Value {
  private final List<Value> parts;

  public Cat(List<Value> parts) {
    parts.forEach(part -> Objects.requireNonNull(part, "part"));
    this.parts = List.copyOf(parts);
  }

  /** Concatenates values and constants, first argument least significant. */
  public static Cat of(Object... parts) { return new Cat(Arrays.stream(parts).map(Value::cast).collect(Collectors.toList())); }

  public List<Value> getParts() { return parts; }

  @Override
  public List<Value> children() {
    return parts;
  }
}
