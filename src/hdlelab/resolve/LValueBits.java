package hdlelab.resolve;

import hdlelab.value.ArrayRef;
import hdlelab.value.Cat;
import hdlelab.value.Signal;
import hdlelab.value.Slice;
import hdlelab.value.Value;
import hdlelab.value.Values;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens an assignment target into the signal bits it writes, least significant target bit first.
 * Slices select bits of their operand's target bits; concatenations list their parts low to high.
 */
public final class LValueBits {
  private LValueBits() {}

  /** One bit of a signal. */
  public record TargetBit(Signal signal, int bit) {}

  /**
   * @param target an assignable value whose array elements all have constant indices
   * @return the written bits, in target bit order
   * @throws hdlelab.elab.ElaborationException of kind IndexOutOfRange for a constant index outside the array or slice
   */
  public static List<TargetBit> flatten(Value target) {
    List<TargetBit> result = new ArrayList<>();
    collect(target, result);
    return result;
  }

  private static void collect(Value target, List<TargetBit> out) {
    if (target instanceof Signal) {
      Signal signal = (Signal)target;
      for (int i = 0; i < signal.width(); ++i)
        out.add(new TargetBit(signal, i));
    } else if (target instanceof Slice) {
      Slice slice = (Slice)target;
      List<TargetBit> operandBits = new ArrayList<>();
      collect(slice.getOperand(), operandBits);
      for (int position : slice.positions())
        out.add(operandBits.get(position));
    } else if (target instanceof Cat) {
      for (Value part : ((Cat)target).getParts())
        collect(part, out);
    } else if (target instanceof ArrayRef) {
      ArrayRef ref = (ArrayRef)target;
      if (!Values.isConstant(ref.getIndex()))
        throw new IllegalStateException("Array targets with a variable index must be lowered before flattening");
      collect(ArrayLowering.selectConstant(ref), out);
    } else {
      throw new IllegalArgumentException("Not an assignable value: " + target);
    }
  }

  /**
   * Finds the first array element selection with a variable index in a target, searching parts in order.
   * @return the ArrayRef, or null if all indices are constant
   */
  public static ArrayRef findVariableIndex(Value target) {
    if (target instanceof Slice)
      return findVariableIndex(((Slice)target).getOperand());
    if (target instanceof Cat) {
      for (Value part : ((Cat)target).getParts()) {
        ArrayRef found = findVariableIndex(part);
        if (found != null)
          return found;
      }
      return null;
    }
    if (target instanceof ArrayRef) {
      ArrayRef ref = (ArrayRef)target;
      if (!Values.isConstant(ref.getIndex()))
        return ref;
      return findVariableIndex(ArrayLowering.selectConstant(ref));
    }
    return null;
  }

  /**
   * Rebuilds a target with one array selection replaced by a concrete element.
   * @param target the target
   * @param ref the ArrayRef node to replace (compared by identity)
   * @param element the replacement
   * @return the rebuilt target
   */
  public static Value substitute(Value target, ArrayRef ref, Value element) {
    if (target == ref)
      return element;
    if (target instanceof Slice) {
      Slice slice = (Slice)target;
      Value operand = substitute(slice.getOperand(), ref, element);
      return operand == slice.getOperand() ? slice : slice.withOperand(operand);
    }
    if (target instanceof Cat) {
      List<Value> parts = ((Cat)target).getParts();
      List<Value> newParts = new ArrayList<>(parts.size());
      boolean changed = false;
      for (Value part : parts) {
        Value newPart = substitute(part, ref, element);
        changed |= newPart != part;
        newParts.add(newPart);
      }
      return changed ? new Cat(newParts) : target;
    }
    if (target instanceof ArrayRef) {
      ArrayRef other = (ArrayRef)target;
      List<Value> newElements = new ArrayList<>(other.getElements().size());
      boolean changed = false;
      for (Value e : other.getElements()) {
        Value newElement = substitute(e, ref, element);
        changed |= newElement != e;
        newElements.add(newElement);
      }
      return changed ? new ArrayRef(newElements, other.getIndex()) : target;
    }
    return target;
  }
}
