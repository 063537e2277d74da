package hdlelab.value;

import java.util.List;
import java.util.Objects;

/**
 * Selection of bit positions of an operand; the result is always unsigned.
 * Bounds are kept as written and normalized against the operand width by {@link SliceIndices}.
 */
public final class Slice extends Value {
  private final Value operand;
  private final Integer start;
  private final Integer stop;
  private final int stride;
  private final boolean singleBit;
  private volatile int[] positions = null;

  public Slice(Value operand, Integer start, Integer stop, int stride) { this(operand, start, stop, stride, false); }

  private Slice(Value operand, Integer start, Integer stop, int stride, boolean singleBit) {
    this.operand = Objects.requireNonNull(operand, "operand");
    if (stride == 0)
      throw new IllegalArgumentException("Slice stride must not be zero");
    this.start = start;
    this.stop = stop;
    this.stride = stride;
    this.singleBit = singleBit;
  }

  /** Single-bit selection; negative indices count from the most significant end. */
  public static Slice bit(Value operand, int index) { return new Slice(operand, index, null, 1, true); }

  /** Same selection applied to another operand. */
  public Slice withOperand(Value newOperand) { return new Slice(newOperand, start, stop, stride, singleBit); }

  public Value getOperand() { return operand; }
  public Integer getStart() { return start; }
  public Integer getStop() { return stop; }
  public int getStride() { return stride; }
  public boolean isSingleBit() { return singleBit; }

  /**
   * Selected operand bit positions, least significant result bit first.
   * @throws hdlelab.elab.ElaborationException of kind IndexOutOfRange for constant bounds outside the operand
   */
  public int[] positions() {
    int[] result = positions;
    if (result == null) {
      int width = operand.width();
      if (singleBit)
        result = new int[] {SliceIndices.normalizeIndex(width, start, this)};
      else
        result = SliceIndices.normalize(width, start, stop, stride, this);
      positions = result;
    }
    return result.clone();
  }

  @Override
  public List<Value> children() {
    return List.of(operand);
  }
}
