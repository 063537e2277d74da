package hdlelab.resolve;

import hdlelab.elab.ElaborationException;
import hdlelab.elab.ErrorKind;
import hdlelab.value.ArrayRef;
import hdlelab.value.Cat;
import hdlelab.value.Const;
import hdlelab.value.Matches;
import hdlelab.value.Operator;
import hdlelab.value.Repl;
import hdlelab.value.Slice;
import hdlelab.value.Value;
import hdlelab.value.ValueEvaluator;
import hdlelab.value.Values;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites ArrayRef nodes into priority mux trees that select element i when the index equals i.
 * Constant indices are bounds-checked and replaced by the selected element.
 *
 * For a variable index whose value space exceeds the element count, the element selected by an out-of-range index is unspecified.
 * The generated tree happens to fall through to the last element; callers must not rely on that.
 */
public class ArrayLowering {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final boolean warnUnconstrained;
  private final IdentityHashMap<Value, Value> lowered = new IdentityHashMap<>();

  /**
   * @param warnUnconstrained log a warning for each variable index that can exceed its array
   */
  public ArrayLowering(boolean warnUnconstrained) { this.warnUnconstrained = warnUnconstrained; }

  /**
   * Returns the element selected by a constant index.
   * @param ref an ArrayRef whose index contains no signal
   * @return the element
   * @throws ElaborationException of kind IndexOutOfRange if the index lies outside [0, element count)
   */
  public static Value selectConstant(ArrayRef ref) {
    BigInteger index = ValueEvaluator.evaluateConstant(ref.getIndex());
    checkConstantIndex(ref, index);
    return ref.getElements().get(index.intValue());
  }

  /**
   * Bounds-checks an array selection if its index is constant; variable indices are accepted.
   * @throws ElaborationException of kind IndexOutOfRange for a constant index outside the array
   */
  public static void checkConstantIndex(ArrayRef ref) {
    if (Values.isConstant(ref.getIndex()))
      checkConstantIndex(ref, ValueEvaluator.evaluateConstant(ref.getIndex()));
  }

  private static void checkConstantIndex(ArrayRef ref, BigInteger index) {
    int size = ref.getElements().size();
    if (index.signum() < 0 || index.compareTo(BigInteger.valueOf(size)) >= 0)
      throw new ElaborationException(ErrorKind.INDEX_OUT_OF_RANGE,
                                     String.format("constant index %s is out of range for an array of %d elements", index, size), ref);
  }

  /** Returns true iff the index can take values outside [0, element count). */
  public static boolean isUnconstrained(ArrayRef ref) {
    var indexShape = ref.getIndex().shape();
    if (indexShape.isSigned())
      return true;
    return indexShape.maxValue().compareTo(BigInteger.valueOf(ref.getElements().size() - 1)) > 0;
  }

  /**
   * Lowers every ArrayRef reachable from a value. Shared sub-expressions are rewritten once.
   * @param value the root
   * @return an equivalent value without ArrayRef nodes; value itself if it contains none
   */
  public Value lower(Value value) {
    for (Value node : Values.postOrder(List.of(value)))
      if (!lowered.containsKey(node))
        lowered.put(node, rewrite(node));
    return lowered.get(value);
  }

  /** Lowers the source of a driver. */
  public Driver lower(Driver driver) {
    Value source = lower(driver.getSource());
    return source == driver.getSource() ? driver : driver.withSource(source);
  }

  private Value rewrite(Value node) {
    if (node instanceof ArrayRef)
      return lowerArray((ArrayRef)node);
    List<Value> children = node.children();
    List<Value> newChildren = new ArrayList<>(children.size());
    boolean changed = false;
    for (Value child : children) {
      Value newChild = lowered.get(child);
      changed |= newChild != child;
      newChildren.add(newChild);
    }
    if (!changed)
      return node;
    if (node instanceof Operator)
      return new Operator(((Operator)node).getKind(), newChildren);
    if (node instanceof Slice)
      return ((Slice)node).withOperand(newChildren.get(0));
    if (node instanceof Cat)
      return new Cat(newChildren);
    if (node instanceof Repl)
      return new Repl(newChildren.get(0), ((Repl)node).getCount());
    if (node instanceof Matches)
      return new Matches(newChildren.get(0), ((Matches)node).getPatterns());
    throw new IllegalArgumentException("Unknown node type " + node.getClass().getName());
  }

  private Value lowerArray(ArrayRef ref) {
    Value index = lowered.get(ref.getIndex());
    List<Value> elements = new ArrayList<>();
    for (Value element : ref.getElements())
      elements.add(lowered.get(element));
    if (Values.isConstant(index)) {
      BigInteger constIndex = ValueEvaluator.evaluateConstant(index);
      checkConstantIndex(ref, constIndex);
      return elements.get(constIndex.intValue());
    }
    if (warnUnconstrained && isUnconstrained(ref))
      logger.warn("Index {} ({}) can exceed the {} elements of the array; out-of-range selection is unspecified", index,
                  index.shape(), elements.size());
    Value result = elements.get(elements.size() - 1);
    for (int i = elements.size() - 2; i >= 0; --i)
      result = Operator.mux(index.eq(Const.of(i)), elements.get(i), result);
    return result;
  }
}
