package hdlelab.elab;

/**
 * Categories of fatal elaboration errors.
 */
public enum ErrorKind {
  /** Operand widths/signedness incompatible per an operator's rule, or array elements of differing width. */
  SHAPE_MISMATCH("ShapeMismatch"),
  /** Case pattern length differs from the subject width, or contains characters outside {0,1,-}. */
  INVALID_PATTERN("InvalidPattern"),
  /** Constant array index or constant slice bound outside the valid domain. */
  INDEX_OUT_OF_RANGE("IndexOutOfRange"),
  /** The same target bit is driven by more than one module or from more than one domain. */
  DUPLICATE_DRIVER("DuplicateDriver"),
  /** An enum used for shape derivation has a member without an integer value. */
  UNREPRESENTABLE_ENUM("UnrepresentableEnum");

  public final String serialName;

  private ErrorKind(String serialName) { this.serialName = serialName; }

  @Override
  public String toString() {
    return serialName;
  }
}
