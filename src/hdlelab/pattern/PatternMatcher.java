package hdlelab.pattern;

import hdlelab.elab.ElaborationException;
import hdlelab.elab.ErrorKind;
import hdlelab.shape.Shape;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Validation and evaluation of don't-care patterns used by switch cases and <code>matches</code>.
 */
public final class PatternMatcher {
  private PatternMatcher() {}

  /**
   * Resolves a pattern to a bit string of the subject width, most significant bit first.
   * @param pattern the pattern
   * @param subject the shape of the matched expression
   * @param culprit node or statement reported on failure
   * @return the bit string over {0,1,-}
   * @throws ElaborationException of kind InvalidPattern if the length differs from the subject width, the pattern contains other
   *     characters, or an integer pattern is not representable in the subject shape
   */
  public static String validate(Pattern pattern, Shape subject, Object culprit) {
    if (pattern.getValue().isPresent()) {
      BigInteger value = pattern.getValue().get();
      if (!subject.contains(value))
        throw new ElaborationException(ErrorKind.INVALID_PATTERN,
                                       String.format("case value %s is not representable in %s", value, subject), culprit);
      String bits = subject.toBits(value).toString(2);
      return "0".repeat(subject.getWidth() - bits.length()) + bits;
    }
    String bits = pattern.getBits().orElseThrow();
    for (int i = 0; i < bits.length(); ++i) {
      char c = bits.charAt(i);
      if (c != '0' && c != '1' && c != '-')
        throw new ElaborationException(
            ErrorKind.INVALID_PATTERN,
            String.format("pattern \"%s\" contains '%c'; only '0', '1' and '-' are allowed", bits, c), culprit);
    }
    if (bits.length() != subject.getWidth())
      throw new ElaborationException(
          ErrorKind.INVALID_PATTERN,
          String.format("pattern \"%s\" has length %d, but the matched value is %d bits wide", bits, bits.length(), subject.getWidth()),
          culprit);
    return bits;
  }

  /** Validates all patterns, keeping their order. */
  public static List<String> validateAll(List<Pattern> patterns, Shape subject, Object culprit) {
    return patterns.stream().map(pattern -> validate(pattern, subject, culprit)).collect(Collectors.toList());
  }

  /**
   * Tests a raw bit pattern against a validated pattern: every position must be '-' or equal the value bit.
   * @param bits validated pattern, most significant bit first
   * @param rawValue non-negative bit representation of the value
   */
  public static boolean matches(String bits, BigInteger rawValue) {
    int width = bits.length();
    for (int i = 0; i < width; ++i) {
      char c = bits.charAt(i);
      if (c == '-')
        continue;
      if (rawValue.testBit(width - 1 - i) != (c == '1'))
        return false;
    }
    return true;
  }

  /** OR-combination of {@link #matches(String, BigInteger)}; false for an empty list. */
  public static boolean matchesAny(List<String> bitPatterns, BigInteger rawValue) {
    return bitPatterns.stream().anyMatch(bits -> matches(bits, rawValue));
  }

  /** Returns true iff the pattern has no don't-care position. */
  public static boolean isExact(String bits) { return bits.indexOf('-') < 0; }
}
