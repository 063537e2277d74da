package hdlelab.resolve;

import hdlelab.stmt.Domain;
import hdlelab.util.ExprPrinter;
import hdlelab.value.Signal;
import hdlelab.value.Value;
import java.util.Objects;

/**
 * Finalized binding of the bit range [start, stop) of a target signal to a fully shaped source expression in one domain.
 * Created only by elaboration.
 */
public final class Driver {
  private final Domain domain;
  private final Signal target;
  private final int start;
  private final int stop;
  private final Value source;
  private final String module;

  Driver(Domain domain, Signal target, int start, int stop, Value source, String module) {
    this.domain = Objects.requireNonNull(domain, "domain");
    this.target = Objects.requireNonNull(target, "target");
    this.source = Objects.requireNonNull(source, "source");
    if (start < 0 || stop > target.width() || start >= stop)
      throw new IllegalArgumentException(String.format("Invalid bit range [%d, %d) for %s", start, stop, target.getName()));
    this.start = start;
    this.stop = stop;
    this.module = module;
  }

  public Domain getDomain() { return domain; }
  public Signal getTarget() { return target; }
  /** Lowest driven bit. */
  public int getStart() { return start; }
  /** One past the highest driven bit. */
  public int getStop() { return stop; }
  public int getRangeWidth() { return stop - start; }
  public boolean coversWholeTarget() { return start == 0 && stop == target.width(); }
  public Value getSource() { return source; }
  /** Hierarchical name of the module whose statements produced this driver. */
  public String getModule() { return module; }

  Driver withSource(Value newSource) { return new Driver(domain, target, start, stop, newSource, module); }

  @Override
  public String toString() {
    String range = coversWholeTarget() ? "" : (getRangeWidth() == 1 ? String.format("[%d]", start) : String.format("[%d:%d]", stop - 1, start));
    return String.format("%s: %s%s <= %s", domain, target.getName(), range, ExprPrinter.render(source));
  }
}
