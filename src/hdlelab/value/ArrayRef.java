package hdlelab.value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Element selection from an ordered sequence of values by a (possibly variable) index.
 * Nested arrays are represented by ArrayRefs whose elements are ArrayRefs, see {@link ValueArray}.
 *
 * A variable index whose value space exceeds the element count selects an unspecified element when out of range.
 */
public final class ArrayRef extends Value {
  private final List<Value> elements;
  private final Value index;

  public ArrayRef(List<Value> elements, Value index) {
    elements.forEach(element -> Objects.requireNonNull(element, "element"));
    if (elements.isEmpty())
      throw new IllegalArgumentException("Cannot index an empty array");
    this.elements = List.copyOf(elements);
    this.index = Objects.requireNonNull(index, "index");
  }

  public List<Value> getElements() { return elements; }
  public Value getIndex() { return index; }

  @Override
  public List<Value> children() {
    List<Value> result = new ArrayList<>(elements.size() + 1);
    result.addAll(elements);
    result.add(index);
    return result;
  }
}
