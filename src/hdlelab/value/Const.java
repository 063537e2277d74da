package hdlelab.value;

import hdlelab.shape.EncodedEnum;
import hdlelab.shape.EnumShape;
import hdlelab.shape.Shape;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Constant with a fixed bit pattern. The value is stored normalized into its shape.
 */
public final class Const extends Value {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final BigInteger value;
  private final Shape constShape;

  private Const(BigInteger value, Shape shape) {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(shape, "shape");
    this.constShape = shape;
    this.value = shape.wrap(value);
    if (!this.value.equals(value))
      logger.warn("Constant {} does not fit {}, truncated to {}", value, shape, this.value);
  }

  /** Constant with the minimal shape for its value. */
  public static Const of(BigInteger value) { return new Const(value, Shape.ofConstant(value)); }
  public static Const of(long value) { return of(BigInteger.valueOf(value)); }
  /** Constant with an explicit shape; values that do not fit are truncated. */
  public static Const of(BigInteger value, Shape shape) { return new Const(value, shape); }
  public static Const of(long value, Shape shape) { return of(BigInteger.valueOf(value), shape); }
  /** Constant whose shape holds every integer of [lo, hi). */
  public static Const ofRange(long value, long lo, long hi) { return of(BigInteger.valueOf(value), Shape.fromRange(lo, hi)); }
  /** Constant with the shape of an enum. */
  public static Const of(long value, EnumShape enumShape) { return of(BigInteger.valueOf(value), enumShape.getShape()); }

  /**
   * Constant for an enum member; its shape is derived from the enum class.
   * @throws hdlelab.elab.ElaborationException of kind UnrepresentableEnum if the enum has no integer encoding
   */
  @SuppressWarnings("unchecked")
  public static Const ofEnum(Enum<?> member) {
    EnumShape enumShape = EnumShape.of((Class<? extends Enum<?>>)member.getDeclaringClass());
    return of(BigInteger.valueOf(((EncodedEnum)member).encoding()), enumShape.getShape());
  }

  public BigInteger getValue() { return value; }
  public Shape getConstShape() { return constShape; }

  @Override
  public List<Value> children() {
    return List.of();
  }
}
