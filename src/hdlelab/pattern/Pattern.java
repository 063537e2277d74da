package hdlelab.pattern;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * A case pattern: either a don't-care bit string over {0,1,-} (most significant bit first) or an integer value.
 * Patterns are not validated on construction; {@link PatternMatcher#validate} resolves them against the subject shape.
 */
public final class Pattern {
  private final String bits;
  private final BigInteger value;

  private Pattern(String bits, BigInteger value) {
    this.bits = bits;
    this.value = value;
  }

  /**
   * Bit string pattern; whitespace is ignored.
   * @param text e.g. "11--" or "1010 ----"
   */
  public static Pattern bits(String text) {
    Objects.requireNonNull(text, "text");
    return new Pattern(text.replaceAll("\\s", ""), null);
  }
  /** Integer pattern matching exactly one value of the subject shape. */
  public static Pattern value(BigInteger value) { return new Pattern(null, Objects.requireNonNull(value, "value")); }
  public static Pattern value(long value) { return value(BigInteger.valueOf(value)); }

  /** The bit string as written, if this is a bit string pattern. */
  public Optional<String> getBits() { return Optional.ofNullable(bits); }
  /** The integer, if this is a value pattern. */
  public Optional<BigInteger> getValue() { return Optional.ofNullable(value); }

  @Override
  public int hashCode() {
    return Objects.hash(bits, value);
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Pattern other = (Pattern)obj;
    return Objects.equals(bits, other.bits) && Objects.equals(value, other.value);
  }
  @Override
  public String toString() {
    return bits != null ? "\"" + bits + "\"" : value.toString();
  }
}
