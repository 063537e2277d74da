package hdlelab.value;

import hdlelab.pattern.Pattern;
import hdlelab.shape.EncodedEnum;
import hdlelab.shape.Shape;
import hdlelab.shape.ShapeInferencer;
import hdlelab.util.ExprPrinter;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Node of the immutable expression DAG. Every node has a shape that is computed from its children by {@link ShapeInferencer}.
 * Nodes compare by identity; shared sub-expressions are the same object.
 *
 * The builder methods create new nodes and never validate shapes; shape errors surface when {@link #shape()} is evaluated during
 * elaboration.
 */
public abstract class Value {
  private volatile Shape inferredShape = null;

  /**
   * Returns the shape of this node, inferring it (and the shapes of all children) on first use.
   * @throws hdlelab.elab.ElaborationException if the node violates an operator rule
   */
  public final Shape shape() {
    Shape shape = inferredShape;
    if (shape == null) {
      shape = ShapeInferencer.shapeOf(this);
      inferredShape = shape;
    }
    return shape;
  }

  /** Returns true iff the shape has been inferred already. */
  public final boolean isShapeInferred() { return inferredShape != null; }

  /** The direct operands of this node, in order. */
  public abstract List<Value> children();

  /** Width of {@link #shape()}. */
  public final int width() { return shape().getWidth(); }

  /**
   * Converts a host object into a Value: Values are returned as is, integral numbers and {@link EncodedEnum} members become constants.
   * @param obj the object
   * @return the Value
   */
  public static Value cast(Object obj) {
    if (obj instanceof Value)
      return (Value)obj;
    if (obj instanceof BigInteger)
      return Const.of((BigInteger)obj);
    if (obj instanceof Long || obj instanceof Integer || obj instanceof Short || obj instanceof Byte)
      return Const.of(((Number)obj).longValue());
    if (obj instanceof EncodedEnum && obj instanceof Enum<?>)
      return Const.ofEnum((Enum<?>)obj);
    throw new IllegalArgumentException("Cannot use " + obj + " as a value");
  }

  // arithmetic
  public Value add(Object other) { return new Operator(Operator.Kind.ADD, this, cast(other)); }
  public Value sub(Object other) { return new Operator(Operator.Kind.SUB, this, cast(other)); }
  public Value mul(Object other) { return new Operator(Operator.Kind.MUL, this, cast(other)); }
  public Value neg() { return new Operator(Operator.Kind.NEG, this); }

  // bitwise
  public Value and(Object other) { return new Operator(Operator.Kind.AND, this, cast(other)); }
  public Value or(Object other) { return new Operator(Operator.Kind.OR, this, cast(other)); }
  public Value xor(Object other) { return new Operator(Operator.Kind.XOR, this, cast(other)); }
  public Value invert() { return new Operator(Operator.Kind.INVERT, this); }

  // comparison
  public Value eq(Object other) { return new Operator(Operator.Kind.EQ, this, cast(other)); }
  public Value ne(Object other) { return new Operator(Operator.Kind.NE, this, cast(other)); }
  public Value lt(Object other) { return new Operator(Operator.Kind.LT, this, cast(other)); }
  public Value gt(Object other) { return new Operator(Operator.Kind.GT, this, cast(other)); }
  public Value le(Object other) { return new Operator(Operator.Kind.LE, this, cast(other)); }
  public Value ge(Object other) { return new Operator(Operator.Kind.GE, this, cast(other)); }

  // reductions and logical operators
  /** True iff at least one bit is set. */
  public Value bool() { return new Operator(Operator.Kind.BOOL, this); }
  public Value any() { return bool(); }
  /** True iff all bits are set. */
  public Value all() { return new Operator(Operator.Kind.ALL, this); }
  /** Parity of all bits. */
  public Value xorReduce() { return new Operator(Operator.Kind.XOR_REDUCE, this); }
  public Value logicalNot() { return new Operator(Operator.Kind.LOGICAL_NOT, this); }
  public Value logicalAnd(Object other) { return new Operator(Operator.Kind.LOGICAL_AND, this, cast(other)); }
  public Value logicalOr(Object other) { return new Operator(Operator.Kind.LOGICAL_OR, this, cast(other)); }

  // shifts
  /** Shift left by a variable, unsigned amount. */
  public Value shl(Object amount) { return new Operator(Operator.Kind.SHL, this, cast(amount)); }
  /** Shift right by a variable, unsigned amount; arithmetic for signed operands. */
  public Value shr(Object amount) { return new Operator(Operator.Kind.SHR, this, cast(amount)); }
  /**
   * Shift left by a constant amount, widening the value.
   * @param amount number of zero bits to insert at the bottom; negative amounts shift right
   */
  public Value shiftLeft(int amount) {
    if (amount < 0)
      return shiftRight(-amount);
    if (amount == 0)
      return this;
    return Cat.of(Const.of(BigInteger.ZERO, Shape.unsigned(amount)), this);
  }
  /**
   * Shift right by a constant amount, dropping the low bits. The result keeps the signedness of this value; a signed value shifted by
   * its full width or more keeps its sign bit only.
   * @param amount number of low bits to drop; negative amounts shift left
   */
  public Value shiftRight(int amount) {
    if (amount < 0)
      return shiftLeft(-amount);
    if (amount == 0)
      return this;
    int width = width();
    boolean signed = shape().isSigned();
    if (amount >= width)
      return signed ? bit(-1).asSigned() : Const.of(BigInteger.ZERO, Shape.unsigned(1));
    Value rest = slice(amount, width);
    return signed ? rest.asSigned() : rest;
  }

  // reinterpretation
  public Value asSigned() { return new Operator(Operator.Kind.AS_SIGNED, this); }
  public Value asUnsigned() { return new Operator(Operator.Kind.AS_UNSIGNED, this); }

  // bit selection
  /**
   * Selects one bit; negative indices count from the most significant end.
   * @param index in [-width, width)
   */
  public Slice bit(int index) { return Slice.bit(this, index); }
  /** Selects bits [start, stop); negative bounds count from the most significant end. */
  public Slice slice(int start, int stop) { return new Slice(this, start, stop, 1); }
  /**
   * Strided selection with host slice semantics.
   * @param start first index or null for the default
   * @param stop end index (exclusive) or null for the default
   * @param stride non-zero step
   */
  public Slice slice(Integer start, Integer stop, int stride) { return new Slice(this, start, stop, stride); }

  /** Replicates this value <code>count</code> times, see {@link Repl}. */
  public Repl replicate(int count) { return new Repl(this, count); }

  /**
   * Builds a 1-bit value that is true iff this value matches at least one of the patterns.
   * @param patterns bit strings over {0,1,-}
   */
  public Matches matches(String... patterns) {
    return new Matches(this, Arrays.stream(patterns).map(Pattern::bits).collect(Collectors.toList()));
  }
  public Matches matches(Pattern... patterns) { return new Matches(this, Arrays.asList(patterns)); }

  @Override
  public String toString() {
    return ExprPrinter.render(this);
  }
}
