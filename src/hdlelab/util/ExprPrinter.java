package hdlelab.util;

import hdlelab.pattern.Pattern;
import hdlelab.shape.Shape;
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
import java.util.stream.Collectors;

/**
 * Renders values as Verilog-like expression text for diagnostics and logs.
 * Only Const and Signal shapes are read; rendering never triggers shape inference.
 * Subexpressions nested deeper than {@link #MAX_DEPTH} levels, and anything past {@link #MAX_LENGTH} characters, are printed as
 * <code>...</code>.
 */
public final class ExprPrinter {
  public static final int MAX_DEPTH = 64;
  public static final int MAX_LENGTH = 4096;

  private static final String ELLIPSIS = "...";

  private ExprPrinter() {}

  public static String render(Value value) {
    StringBuilder sb = new StringBuilder();
    append(sb, value, 0);
    if (sb.length() > MAX_LENGTH) {
      sb.setLength(MAX_LENGTH);
      sb.append(ELLIPSIS);
    }
    return sb.toString();
  }

  /** Sized Verilog literal, e.g. <code>4'd10</code>, <code>-5'sd10</code>. */
  public static String literal(Const c) {
    Shape shape = c.getConstShape();
    String sign = c.getValue().signum() < 0 ? "-" : "";
    return String.format("%s%d'%sd%s", sign, shape.getWidth(), shape.isSigned() ? "s" : "", c.getValue().abs());
  }

  private static void append(StringBuilder sb, Value value, int depth) {
    if (sb.length() > MAX_LENGTH)
      return;
    if (depth >= MAX_DEPTH) {
      sb.append(ELLIPSIS);
      return;
    }
    if (value instanceof Const) {
      sb.append(literal((Const)value));
    } else if (value instanceof Signal) {
      sb.append(((Signal)value).getName());
    } else if (value instanceof Operator) {
      appendOperator(sb, (Operator)value, depth);
    } else if (value instanceof Slice) {
      Slice slice = (Slice)value;
      append(sb, slice.getOperand(), depth + 1);
      sb.append(sliceSuffix(slice));
    } else if (value instanceof Cat) {
      List<Value> parts = ((Cat)value).getParts();
      sb.append('{');
      // most significant part first
      for (int i = parts.size() - 1; i >= 0; --i) {
        append(sb, parts.get(i), depth + 1);
        if (i > 0)
          sb.append(", ");
      }
      sb.append('}');
    } else if (value instanceof Repl) {
      Repl repl = (Repl)value;
      sb.append('{').append(repl.getCount()).append('{');
      append(sb, repl.getOperand(), depth + 1);
      sb.append("}}");
    } else if (value instanceof ArrayRef) {
      ArrayRef ref = (ArrayRef)value;
      sb.append('[');
      for (int i = 0; i < ref.getElements().size(); ++i) {
        if (i > 0)
          sb.append(", ");
        append(sb, ref.getElements().get(i), depth + 1);
      }
      sb.append("][");
      append(sb, ref.getIndex(), depth + 1);
      sb.append(']');
    } else if (value instanceof Matches) {
      Matches matches = (Matches)value;
      sb.append('(');
      append(sb, matches.getSubject(), depth + 1);
      sb.append(" matches ");
      sb.append(matches.getPatterns().stream().map(Pattern::toString).collect(Collectors.joining(", ")));
      sb.append(')');
    } else {
      sb.append(value.getClass().getSimpleName());
    }
  }

  private static String sliceSuffix(Slice slice) {
    Integer start = slice.getStart();
    Integer stop = slice.getStop();
    if (slice.isSingleBit())
      return "[" + start + "]";
    if (slice.getStride() == 1 && start != null && stop != null && start >= 0 && stop > start) {
      if (stop - start == 1)
        return "[" + start + "]";
      return "[" + (stop - 1) + ":" + start + "]";
    }
    // Bounds as written
    return "[" + (start == null ? "" : start) + ":" + (stop == null ? "" : stop) + ":" + slice.getStride() + "]";
  }

  private static void appendOperator(StringBuilder sb, Operator op, int depth) {
    Operator.Kind kind = op.getKind();
    List<Value> operands = op.getOperands();
    switch (kind) {
    case MUX:
      sb.append('(');
      append(sb, operands.get(0), depth + 1);
      sb.append(" ? ");
      append(sb, operands.get(1), depth + 1);
      sb.append(" : ");
      append(sb, operands.get(2), depth + 1);
      sb.append(')');
      return;
    case AS_SIGNED:
    case AS_UNSIGNED:
      sb.append(kind.symbol).append('(');
      append(sb, operands.get(0), depth + 1);
      sb.append(')');
      return;
    default:
      break;
    }
    if (kind.arity == 1) {
      sb.append(kind.symbol);
      append(sb, operands.get(0), depth + 1);
      return;
    }
    sb.append('(');
    append(sb, operands.get(0), depth + 1);
    sb.append(' ').append(kind.symbol).append(' ');
    append(sb, operands.get(1), depth + 1);
    sb.append(')');
  }
}
