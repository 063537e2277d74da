package hdlelab.value;

import hdlelab.pattern.PatternMatcher;
import hdlelab.shape.Shape;
import java.math.BigInteger;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates values to integers under a fixed assignment of signal values. Results are interpreted in the node's shape: negative
 * for signed nodes with the sign bit set, non-negative otherwise.
 *
 * Not a simulator: there is no notion of time or clock domains. Signals missing from the environment evaluate to their reset value.
 */
public class ValueEvaluator {
  private final Map<Signal, BigInteger> env;
  private final IdentityHashMap<Value, BigInteger> memo = new IdentityHashMap<>();

  public ValueEvaluator(Map<Signal, BigInteger> env) { this.env = env; }
  /** An evaluator where every signal has its reset value. */
  public ValueEvaluator() { this(Map.of()); }

  /** Evaluates a value without signals. */
  public static BigInteger evaluateConstant(Value value) { return new ValueEvaluator().evaluate(value); }

  public BigInteger evaluate(Value value) {
    BigInteger result = memo.get(value);
    if (result == null) {
      // Children are memoized before their parents
      for (Value node : Values.postOrder(List.of(value)))
        if (!memo.containsKey(node))
          memo.put(node, compute(node));
      result = memo.get(value);
    }
    return result;
  }

  /** Raw two's complement bit pattern of the evaluated value. */
  public BigInteger evaluateBits(Value value) { return value.shape().toBits(evaluate(value)); }

  private BigInteger compute(Value value) {
    Shape shape = value.shape();
    if (value instanceof Const)
      return ((Const)value).getValue();
    if (value instanceof Signal)
      return shape.wrap(env.getOrDefault((Signal)value, ((Signal)value).getReset()));
    if (value instanceof Operator)
      return shape.wrap(computeOperator((Operator)value));
    if (value instanceof Slice) {
      Slice slice = (Slice)value;
      BigInteger raw = evaluateBits(slice.getOperand());
      int[] positions = slice.positions();
      BigInteger result = BigInteger.ZERO;
      for (int i = 0; i < positions.length; ++i)
        if (raw.testBit(positions[i]))
          result = result.setBit(i);
      return result;
    }
    if (value instanceof Cat)
      return concat(((Cat)value).getParts());
    if (value instanceof Repl)
      return concat(((Repl)value).toCat().getParts());
    if (value instanceof ArrayRef) {
      ArrayRef ref = (ArrayRef)value;
      BigInteger index = evaluate(ref.getIndex());
      List<Value> elements = ref.getElements();
      // Out-of-range selection is unspecified; this evaluator picks the last element, matching ArrayLowering.
      int i = (index.signum() >= 0 && index.compareTo(BigInteger.valueOf(elements.size())) < 0) ? index.intValue() : elements.size() - 1;
      return shape.wrap(evaluate(elements.get(i)));
    }
    if (value instanceof Matches) {
      Matches matches = (Matches)value;
      List<String> bits = PatternMatcher.validateAll(matches.getPatterns(), matches.getSubject().shape(), matches);
      return PatternMatcher.matchesAny(bits, evaluateBits(matches.getSubject())) ? BigInteger.ONE : BigInteger.ZERO;
    }
    throw new IllegalArgumentException("Unknown node type " + value.getClass().getName());
  }

  private BigInteger concat(List<Value> parts) {
    BigInteger result = BigInteger.ZERO;
    int offset = 0;
    for (Value part : parts) {
      result = result.or(evaluateBits(part).shiftLeft(offset));
      offset += part.width();
    }
    return result;
  }

  private static BigInteger bool(boolean b) { return b ? BigInteger.ONE : BigInteger.ZERO; }

  private BigInteger computeOperator(Operator op) {
    List<Value> operands = op.getOperands();
    BigInteger a = evaluate(operands.get(0));
    BigInteger b = operands.size() > 1 ? evaluate(operands.get(1)) : null;
    switch (op.getKind()) {
    case ADD:
      return a.add(b);
    case SUB:
      return a.subtract(b);
    case MUL:
      return a.multiply(b);
    case NEG:
      return a.negate();
    // BigInteger bitwise operators act on an infinite two's complement representation, which is the sign/zero extension of each
    // operand to the common width.
    case AND:
      return a.and(b);
    case OR:
      return a.or(b);
    case XOR:
      return a.xor(b);
    case INVERT:
      return a.not();
    case EQ:
      return bool(a.equals(b));
    case NE:
      return bool(!a.equals(b));
    case LT:
      return bool(a.compareTo(b) < 0);
    case GT:
      return bool(a.compareTo(b) > 0);
    case LE:
      return bool(a.compareTo(b) <= 0);
    case GE:
      return bool(a.compareTo(b) >= 0);
    case BOOL:
      return bool(a.signum() != 0);
    case ALL: {
      Shape shape = operands.get(0).shape();
      return bool(shape.toBits(a).equals(shape.mask()));
    }
    case XOR_REDUCE:
      return bool(operands.get(0).shape().toBits(a).bitCount() % 2 == 1);
    case LOGICAL_NOT:
      return bool(a.signum() == 0);
    case LOGICAL_AND:
      return bool(a.signum() != 0 && b.signum() != 0);
    case LOGICAL_OR:
      return bool(a.signum() != 0 || b.signum() != 0);
    case SHL:
      return a.shiftLeft(b.intValueExact());
    case SHR:
      // Shifting by the full width or more leaves only sign bits
      return a.shiftRight(Math.min(b.min(BigInteger.valueOf(Integer.MAX_VALUE)).intValue(), operands.get(0).width()));
    case MUX:
      return a.signum() != 0 ? b : evaluate(operands.get(2));
    case AS_SIGNED:
    case AS_UNSIGNED:
      return a;
    }
    throw new IllegalArgumentException("Unknown operator kind " + op.getKind());
  }
}
