package hdlelab.shape;

import hdlelab.elab.ElaborationException;
import hdlelab.elab.ErrorKind;
import hdlelab.pattern.PatternMatcher;
import hdlelab.value.ArrayRef;
import hdlelab.value.Cat;
import hdlelab.value.Const;
import hdlelab.value.Matches;
import hdlelab.value.Operator;
import hdlelab.value.Repl;
import hdlelab.value.Signal;
import hdlelab.value.Slice;
import hdlelab.value.Value;
import java.util.List;

/**
 * Computes the shape of a node from the shapes of its children, following two's complement promotion rules.
 * Children are queried through {@link Value#shape()}, which memoizes per node.
 */
public final class ShapeInferencer {
  private ShapeInferencer() {}

  /**
   * Infers the shape of a single node.
   * @param value the node
   * @return its shape
   * @throws ElaborationException if the node violates the rule of its kind
   */
  public static Shape shapeOf(Value value) {
    if (value instanceof Const)
      return ((Const)value).getConstShape();
    if (value instanceof Signal)
      return ((Signal)value).getDeclaredShape();
    if (value instanceof Operator)
      return operatorShape((Operator)value);
    if (value instanceof Slice) {
      int width = ((Slice)value).positions().length;
      return nonEmpty(width, "slice selects no bits", value);
    }
    if (value instanceof Cat) {
      long width = 0;
      for (Value part : ((Cat)value).getParts())
        width += part.width();
      return nonEmpty(width, "concatenation of no bits", value);
    }
    if (value instanceof Repl) {
      Repl repl = (Repl)value;
      long width = (long)repl.getOperand().width() * repl.getCount();
      return nonEmpty(width, "replication produces no bits", value);
    }
    if (value instanceof ArrayRef)
      return arrayShape((ArrayRef)value);
    if (value instanceof Matches) {
      Matches matches = (Matches)value;
      PatternMatcher.validateAll(matches.getPatterns(), matches.getSubject().shape(), value);
      return Shape.unsigned(1);
    }
    throw new IllegalArgumentException("Unknown node type " + value.getClass().getName());
  }

  /** Shape of <code>a + b</code> and <code>a - b</code>: common shape plus one carry/borrow bit. */
  public static Shape arithmetic(Shape a, Shape b) {
    Shape common = common(a, b);
    return new Shape(common.getWidth() + 1, common.isSigned());
  }

  /**
   * Common shape both operands can be converted to without loss. An unsigned operand mixed with a signed one needs one extra bit.
   */
  public static Shape common(Shape a, Shape b) {
    int wa = a.getWidth() + ((!a.isSigned() && b.isSigned()) ? 1 : 0);
    int wb = b.getWidth() + ((!b.isSigned() && a.isSigned()) ? 1 : 0);
    return new Shape(Math.max(wa, wb), a.isSigned() || b.isSigned());
  }

  /** Shape of a comparison; the operands are compared in {@link #common(Shape, Shape)}. */
  public static Shape comparison(Shape a, Shape b) { return Shape.unsigned(1); }

  /** Shape of <code>&amp; | ^</code>: widest operand, signed only if both operands are. */
  public static Shape bitwise(Shape a, Shape b) {
    return new Shape(Math.max(a.getWidth(), b.getWidth()), a.isSigned() && b.isSigned());
  }

  /** Shape of <code>a * b</code>. */
  public static Shape multiply(Shape a, Shape b) {
    int wa = a.getWidth() + ((!a.isSigned() && b.isSigned()) ? 1 : 0);
    int wb = b.getWidth() + ((!b.isSigned() && a.isSigned()) ? 1 : 0);
    return new Shape(wa + wb, a.isSigned() || b.isSigned());
  }

  private static Shape operatorShape(Operator op) {
    List<Value> operands = op.getOperands();
    Shape a = operands.get(0).shape();
    Shape b = operands.size() > 1 ? operands.get(1).shape() : null;
    switch (op.getKind()) {
    case ADD:
    case SUB:
      return arithmetic(a, b);
    case MUL:
      return multiply(a, b);
    case NEG:
      return Shape.signed(a.getWidth() + 1);
    case AND:
    case OR:
    case XOR:
      return bitwise(a, b);
    case INVERT:
      return a;
    case EQ:
    case NE:
    case LT:
    case GT:
    case LE:
    case GE:
      return comparison(a, b);
    case BOOL:
    case ALL:
    case XOR_REDUCE:
    case LOGICAL_NOT:
    case LOGICAL_AND:
    case LOGICAL_OR:
      return Shape.unsigned(1);
    case SHL:
      checkShiftAmount(b, op);
      if (b.getWidth() > 24)
        throw new ElaborationException(ErrorKind.SHAPE_MISMATCH,
                                       String.format("shift amount of %d bits would produce an unrepresentable width", b.getWidth()), op);
      return new Shape(a.getWidth() + (1 << b.getWidth()) - 1, a.isSigned());
    case SHR:
      checkShiftAmount(b, op);
      return a;
    case MUX:
      // Operand 0 is the selector; the selected values are operands 1 and 2
      return bitwise(b, operands.get(2).shape());
    case AS_SIGNED:
      return a.withSigned(true);
    case AS_UNSIGNED:
      return a.withSigned(false);
    }
    throw new IllegalArgumentException("Unknown operator kind " + op.getKind());
  }

  private static void checkShiftAmount(Shape amount, Operator op) {
    if (amount.isSigned())
      throw new ElaborationException(ErrorKind.SHAPE_MISMATCH, "shift amount must be unsigned, got " + amount, op);
  }

  private static Shape arrayShape(ArrayRef ref) {
    ref.getIndex().shape();
    List<Value> elements = ref.getElements();
    Shape first = elements.get(0).shape();
    for (Value element : elements) {
      Shape shape = element.shape();
      if (shape.getWidth() != first.getWidth())
        throw new ElaborationException(ErrorKind.SHAPE_MISMATCH,
                                       String.format("array elements have differing widths %d and %d", first.getWidth(), shape.getWidth()),
                                       ref);
      if (shape.isSigned() != first.isSigned())
        throw new ElaborationException(ErrorKind.SHAPE_MISMATCH, "array elements mix signed and unsigned shapes", ref);
    }
    return first;
  }

  private static Shape nonEmpty(long width, String what, Value culprit) {
    if (width < 1)
      throw new ElaborationException(ErrorKind.SHAPE_MISMATCH, what, culprit);
    if (width > Integer.MAX_VALUE)
      throw new ElaborationException(ErrorKind.SHAPE_MISMATCH, "width " + width + " is too large", culprit);
    return Shape.unsigned((int)width);
  }
}
