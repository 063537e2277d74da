package hdlelab.value;

import hdlelab.shape.Shape;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Utility methods over the value graph.
 */
public final class Values {
  private Values() {}

  /**
   * Truncates or extends a value to a width. Extension replicates the sign bit of signed values and inserts zeros otherwise.
   * @param value the value
   * @param width the target width
   * @return value itself if the width already matches, else an unsigned value of the target width
   */
  public static Value resize(Value value, int width) {
    int current = value.width();
    if (current == width)
      return value;
    if (width < current)
      return value.slice(0, width);
    int extra = width - current;
    if (value.shape().isSigned())
      return Cat.of(value, Repl.of(value.bit(-1), extra));
    return Cat.of(value, Const.of(BigInteger.ZERO, Shape.unsigned(extra)));
  }

  /**
   * Reduces a value used as a condition to one bit: true iff at least one bit is set.
   * @return value itself if it is already unsigned(1), else its OR-reduction
   */
  public static Value asCondition(Value value) {
    if (value.shape().equals(Shape.unsigned(1)))
      return value;
    return value.bool();
  }

  /** Returns true iff no signal is reachable from the value. */
  public static boolean isConstant(Value value) {
    return postOrder(List.of(value)).stream().noneMatch(node -> node instanceof Signal);
  }

  /**
   * Lists all nodes reachable from the roots exactly once, children before parents. Iterative, so deep graphs do not exhaust the stack.
   * @param roots the start nodes
   * @return the nodes in post-order
   */
  public static List<Value> postOrder(Collection<? extends Value> roots) {
    Set<Value> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    List<Value> result = new ArrayList<>();
    Deque<Object[]> stack = new ArrayDeque<>();
    for (Value root : roots) {
      if (!visited.add(root))
        continue;
      stack.push(new Object[] {root, 0});
      while (!stack.isEmpty()) {
        Object[] frame = stack.peek();
        Value node = (Value)frame[0];
        int next = (Integer)frame[1];
        List<Value> children = node.children();
        if (next < children.size()) {
          frame[1] = next + 1;
          Value child = children.get(next);
          if (visited.add(child))
            stack.push(new Object[] {child, 0});
        } else {
          stack.pop();
          result.add(node);
        }
      }
    }
    return result;
  }
}
