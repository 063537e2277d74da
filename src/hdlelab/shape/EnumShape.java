package hdlelab.shape;

import hdlelab.elab.ElaborationException;
import hdlelab.elab.ErrorKind;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shape derived from an ordered set of integer values, treated as <code>range(min, max+1)</code>.
 * The (min, max) pair is computed once on construction; shapes of Java enum classes are cached per class.
 */
public final class EnumShape {
  private static final ConcurrentHashMap<Class<?>, EnumShape> existingEnumShapes = new ConcurrentHashMap<>();

  private final String name;
  private final Map<String, BigInteger> members;
  private final BigInteger min;
  private final BigInteger max;
  private final Shape shape;

  private EnumShape(String name, Map<String, BigInteger> members) {
    this.name = name;
    this.members = Collections.unmodifiableMap(members);
    this.min = members.values().stream().min(BigInteger::compareTo).orElseThrow();
    this.max = members.values().stream().max(BigInteger::compareTo).orElseThrow();
    this.shape = Shape.fromRange(min, max.add(BigInteger.ONE));
  }

  /**
   * Returns the shape of a Java enum. The enum must implement {@link EncodedEnum}.
   * @param enumClass the enum class
   * @return the (cached) EnumShape
   * @throws ElaborationException of kind UnrepresentableEnum if the members carry no integer encoding or the enum is empty
   */
  public static EnumShape of(Class<? extends Enum<?>> enumClass) {
    EnumShape existing = existingEnumShapes.get(enumClass);
    if (existing != null)
      return existing;
    if (!EncodedEnum.class.isAssignableFrom(enumClass))
      throw new ElaborationException(ErrorKind.UNREPRESENTABLE_ENUM,
                                     String.format("enum %s has members without an integer value", enumClass.getSimpleName()), enumClass);
    LinkedHashMap<String, BigInteger> members = new LinkedHashMap<>();
    for (Enum<?> member : enumClass.getEnumConstants())
      members.put(member.name(), BigInteger.valueOf(((EncodedEnum)member).encoding()));
    if (members.isEmpty())
      throw new ElaborationException(ErrorKind.UNREPRESENTABLE_ENUM, String.format("enum %s has no members", enumClass.getSimpleName()),
                                     enumClass);
    EnumShape created = new EnumShape(enumClass.getSimpleName(), members);
    existing = existingEnumShapes.putIfAbsent(enumClass, created);
    return existing != null ? existing : created;
  }

  /**
   * Builds an EnumShape from loosely typed member values, e.g. from a configuration file.
   * @param name the enum name for diagnostics
   * @param memberValues member name to member value; every value must be an integral number
   * @return the EnumShape
   * @throws ElaborationException of kind UnrepresentableEnum for a non-integer member or an empty member set
   */
  public static EnumShape fromMembers(String name, Map<String, ?> memberValues) {
    LinkedHashMap<String, BigInteger> members = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : memberValues.entrySet()) {
      Object val = entry.getValue();
      if (val instanceof BigInteger)
        members.put(entry.getKey(), (BigInteger)val);
      else if (val instanceof Long || val instanceof Integer || val instanceof Short || val instanceof Byte)
        members.put(entry.getKey(), BigInteger.valueOf(((Number)val).longValue()));
      else
        throw new ElaborationException(ErrorKind.UNREPRESENTABLE_ENUM,
                                       String.format("member %s.%s has non-integer value '%s'", name, entry.getKey(), val), name);
    }
    if (members.isEmpty())
      throw new ElaborationException(ErrorKind.UNREPRESENTABLE_ENUM, String.format("enum %s has no members", name), name);
    return new EnumShape(name, members);
  }

  public String getName() { return name; }
  public Shape getShape() { return shape; }
  public BigInteger getMin() { return min; }
  public BigInteger getMax() { return max; }
  public Map<String, BigInteger> getMembers() { return members; }
  public Optional<BigInteger> encodingOf(String member) { return Optional.ofNullable(members.get(member)); }

  @Override
  public String toString() {
    return String.format("%s%s", name, shape);
  }
}
