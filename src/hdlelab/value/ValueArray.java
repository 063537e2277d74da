package hdlelab.value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Host-side container for one- or multi-dimensional arrays of values. Not itself a value; indexing it builds {@link ArrayRef} nodes.
 * All rows of a multi-dimensional array must have the same nesting depth.
 */
public final class ValueArray {
  private final List<Object> elements;
  private final int depth;

  /**
   * @param elements Values (or objects accepted by {@link Value#cast(Object)}), or nested ValueArrays
   */
  public ValueArray(List<?> elements) {
    if (elements.isEmpty())
      throw new IllegalArgumentException("ValueArray must not be empty");
    this.elements = new ArrayList<>(elements.size());
    int depth = -1;
    for (Object element : elements) {
      Objects.requireNonNull(element, "element");
      int elementDepth;
      if (element instanceof ValueArray) {
        elementDepth = ((ValueArray)element).depth + 1;
        this.elements.add(element);
      } else {
        elementDepth = 1;
        this.elements.add(Value.cast(element));
      }
      if (depth != -1 && depth != elementDepth)
        throw new IllegalArgumentException("All elements of a ValueArray must have the same nesting depth");
      depth = elementDepth;
    }
    this.depth = depth;
  }
  public static ValueArray of(Object... elements) { return new ValueArray(Arrays.asList(elements)); }

  /** Number of dimensions. */
  public int getDepth() { return depth; }
  public int size() { return elements.size(); }

  /**
   * Selects an element, one index per dimension, outermost dimension first.
   * @param indices Values or integers
   * @return the ArrayRef for a full selection
   */
  public ArrayRef get(Object... indices) {
    if (indices.length != depth)
      throw new IllegalArgumentException(String.format("Array has %d dimension(s), got %d index(es)", depth, indices.length));
    return select(Arrays.stream(indices).map(Value::cast).toArray(Value[]::new), 0);
  }

  private ArrayRef select(Value[] indices, int dim) {
    List<Value> selected = new ArrayList<>(elements.size());
    for (Object element : elements) {
      if (element instanceof ValueArray)
        selected.add(((ValueArray)element).select(indices, dim + 1));
      else
        selected.add((Value)element);
    }
    return new ArrayRef(selected, indices[dim]);
  }
}
