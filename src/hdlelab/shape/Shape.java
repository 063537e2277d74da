package hdlelab.shape;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Bit representation of a value: a positive width and a signedness.
 * Signed shapes use two's complement, i.e. represent exactly [-2^(width-1), 2^(width-1)-1].
 */
public final class Shape {
  private final int width;
  private final boolean signed;

  public Shape(int width, boolean signed) {
    if (width < 1)
      throw new IllegalArgumentException("Shape width must be at least 1, got " + width);
    this.width = width;
    this.signed = signed;
  }

  public static Shape unsigned(int width) { return new Shape(width, false); }
  public static Shape signed(int width) { return new Shape(width, true); }

  /**
   * Minimal shape holding a constant in two's complement; signed iff the constant is negative.
   * @param value the constant
   * @return the shape
   */
  public static Shape ofConstant(BigInteger value) {
    if (value.signum() < 0)
      return signed(value.bitLength() + 1);
    return unsigned(Math.max(1, value.bitLength()));
  }
  public static Shape ofConstant(long value) { return ofConstant(BigInteger.valueOf(value)); }

  /**
   * Minimal shape holding every integer of the half-open range [lo, hi); signed iff lo is negative.
   * @param lo lowest value, inclusive
   * @param hi highest value, exclusive
   * @return the shape
   */
  public static Shape fromRange(BigInteger lo, BigInteger hi) {
    BigInteger max = hi.subtract(BigInteger.ONE);
    if (max.compareTo(lo) < 0)
      throw new IllegalArgumentException(String.format("Cannot derive a shape from the empty range [%s, %s)", lo, hi));
    boolean signed = lo.signum() < 0;
    return new Shape(Math.max(bitsFor(lo, signed), bitsFor(max, signed)), signed);
  }
  public static Shape fromRange(long lo, long hi) { return fromRange(BigInteger.valueOf(lo), BigInteger.valueOf(hi)); }

  private static int bitsFor(BigInteger value, boolean signed) {
    // BigInteger.bitLength excludes the sign bit
    return Math.max(1, value.bitLength() + (signed ? 1 : 0));
  }

  public int getWidth() { return width; }
  public boolean isSigned() { return signed; }

  public BigInteger minValue() { return signed ? BigInteger.ONE.shiftLeft(width - 1).negate() : BigInteger.ZERO; }
  public BigInteger maxValue() {
    return signed ? BigInteger.ONE.shiftLeft(width - 1).subtract(BigInteger.ONE) : BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
  }

  /** Returns true iff the value is representable without truncation. */
  public boolean contains(BigInteger value) { return value.compareTo(minValue()) >= 0 && value.compareTo(maxValue()) <= 0; }

  /** Bit mask with the lowest <code>width</code> bits set. */
  public BigInteger mask() { return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE); }

  /**
   * Truncates an arbitrary integer to this shape using two's complement.
   * @param value any integer
   * @return the representable value with the same low <code>width</code> bits
   */
  public BigInteger wrap(BigInteger value) {
    BigInteger bits = value.and(mask());
    if (signed && bits.testBit(width - 1))
      return bits.subtract(BigInteger.ONE.shiftLeft(width));
    return bits;
  }

  /** Returns the raw bit pattern (non-negative, below 2^width) of a value of this shape. */
  public BigInteger toBits(BigInteger value) { return value.and(mask()); }

  public Shape withSigned(boolean signed) { return signed == this.signed ? this : new Shape(width, signed); }

  @Override
  public int hashCode() {
    return Objects.hash(width, signed);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Shape other = (Shape)obj;
    return width == other.width && signed == other.signed;
  }
  @Override
  public String toString() {
    return String.format("%s(%d)", signed ? "signed" : "unsigned", width);
  }
}
