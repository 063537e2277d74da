package hdlelab.value;

import hdlelab.elab.ElaborationException;
import hdlelab.elab.ErrorKind;
import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Normalization of host-style (start, stop, stride) slice bounds against an operand width into a list of bit positions.
 * Bit 0 is the least significant bit; negative bounds count from the most significant end.
 */
public final class SliceIndices {
  private SliceIndices() {}

  /**
   * Maps possibly-negative, possibly-defaulted bounds to the selected bit positions, in selection order.
   * Explicit bounds must lie in [-width, width].
   * @param width operand width
   * @param start first index, or null for the default (0 for positive strides, width-1 for negative strides)
   * @param stop exclusive end index, or null for the default (past the last bit in stride direction)
   * @param stride non-zero step
   * @param culprit node reported on failure
   * @return the bit positions
   * @throws ElaborationException of kind IndexOutOfRange for a bound outside the valid domain
   */
  public static int[] normalize(int width, Integer start, Integer stop, int stride, Object culprit) {
    if (stride == 0)
      throw new IllegalArgumentException("Slice stride must not be zero");
    int from, to;
    if (stride > 0) {
      from = (start == null) ? 0 : checkBound(width, start, culprit);
      to = (stop == null) ? width : checkBound(width, stop, culprit);
    } else {
      from = (start == null) ? width - 1 : Math.min(width - 1, checkBound(width, start, culprit));
      to = (stop == null) ? -1 : checkBound(width, stop, culprit);
    }
    if (stride > 0) {
      if (to <= from)
        return new int[0];
      return IntStream.iterate(from, i -> i < to, i -> i + stride).toArray();
    }
    if (from <= to)
      return new int[0];
    return IntStream.iterate(from, i -> i > to, i -> i + stride).toArray();
  }

  /**
   * Normalizes a single bit index.
   * @param width operand width
   * @param index index in [-width, width)
   * @param culprit node reported on failure
   * @return the index in [0, width)
   */
  public static int normalizeIndex(int width, int index, Object culprit) {
    if (index < -width || index >= width)
      throw new ElaborationException(ErrorKind.INDEX_OUT_OF_RANGE,
                                     String.format("bit index %d is out of range for a %d-bit value", index, width), culprit);
    return index < 0 ? index + width : index;
  }

  private static int checkBound(int width, int bound, Object culprit) {
    if (bound < -width || bound > width)
      throw new ElaborationException(ErrorKind.INDEX_OUT_OF_RANGE,
                                     String.format("slice bound %d is out of range for a %d-bit value", bound, width), culprit);
    return bound < 0 ? bound + width : bound;
  }

  /** Returns true iff the positions form the ascending run [first, first+length). */
  public static boolean isContiguous(int[] positions) {
    for (int i = 1; i < positions.length; ++i)
      if (positions[i] != positions[i - 1] + 1)
        return false;
    return true;
  }

  public static String toString(int[] positions) { return Arrays.toString(positions); }
}
