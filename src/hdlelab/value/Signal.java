package hdlelab.value;

import hdlelab.shape.EnumShape;
import hdlelab.shape.Shape;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Mutable hardware signal. The shape is fixed at creation; the value changes only through drivers produced by elaboration.
 * Signals have identity semantics: two signals with the same name are distinct.
 */
public final class Signal extends Value {
  private final String name;
  private final Shape declaredShape;
  private final BigInteger reset;
  private final boolean resetLess;

  /**
   * @param name name used in diagnostics
   * @param shape the declared shape
   * @param reset value in the comb domain when not assigned, and initial value in synchronous domains; truncated to the shape
   * @param resetLess true iff a synchronous domain reset should not affect this signal
   */
  public Signal(String name, Shape shape, BigInteger reset, boolean resetLess) {
    this.name = Objects.requireNonNull(name, "name");
    this.declaredShape = Objects.requireNonNull(shape, "shape");
    this.reset = shape.wrap(Objects.requireNonNull(reset, "reset"));
    this.resetLess = resetLess;
  }
  public Signal(String name, Shape shape, long reset) { this(name, shape, BigInteger.valueOf(reset), false); }
  public Signal(String name, Shape shape) { this(name, shape, BigInteger.ZERO, false); }
  /** A 1-bit unsigned signal. */
  public Signal(String name) { this(name, Shape.unsigned(1)); }

  public static Signal unsigned(String name, int width) { return new Signal(name, Shape.unsigned(width)); }
  public static Signal signed(String name, int width) { return new Signal(name, Shape.signed(width)); }
  public static Signal ofRange(String name, long lo, long hi) { return new Signal(name, Shape.fromRange(lo, hi)); }
  public static Signal ofEnum(String name, EnumShape enumShape) {
    return new Signal(name, enumShape.getShape(), enumShape.getMin(), false);
  }

  /** Returns a new signal with the same name and shape but a different reset value. */
  public Signal withReset(long reset) { return new Signal(name, declaredShape, BigInteger.valueOf(reset), resetLess); }

  public String getName() { return name; }
  public Shape getDeclaredShape() { return declaredShape; }
  public BigInteger getReset() { return reset; }
  public boolean isResetLess() { return resetLess; }

  @Override
  public List<Value> children() {
    return List.of();
  }
}
