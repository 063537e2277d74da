package hdlelab.stmt;

import hdlelab.value.Value;
import java.util.List;

/**
 * Immutable statement of a module body.
 */
public abstract class Statement {
  /** Values referenced directly by this statement (not by nested bodies). */
  public abstract List<Value> values();

  /** Nested statement bodies, in source order. */
  public abstract List<List<Statement>> bodies();
}
