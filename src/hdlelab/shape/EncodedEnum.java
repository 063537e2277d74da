package hdlelab.shape;

/**
 * Capability of an enum whose members carry an integer encoding, making the enum usable as a shape.
 * Enums that do not implement this interface are treated as having non-integer members.
 */
public interface EncodedEnum {
  /** The integer value of this member. */
  long encoding();
}
