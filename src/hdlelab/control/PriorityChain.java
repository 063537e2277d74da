package hdlelab.control;

import hdlelab.stmt.Statement;
import hdlelab.value.Value;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of (guard, body) arms plus a default body. The first arm whose 1-bit guard is true selects its body; if none is, the
 * default body applies. Both If chains and Switch statements compile to this form.
 */
public final class PriorityChain {
  /** One arm of the chain. The guard is always unsigned(1). */
  public record Arm(Value guard, List<Statement> body) {
    public Arm {
      Objects.requireNonNull(guard, "guard");
      body = List.copyOf(body);
    }
  }

  private final Statement origin;
  private final List<Arm> arms;
  private final List<Statement> defaultBody;

  public PriorityChain(Statement origin, List<Arm> arms, List<Statement> defaultBody) {
    this.origin = origin;
    this.arms = List.copyOf(arms);
    this.defaultBody = List.copyOf(defaultBody);
  }

  /** The statement this chain was compiled from. */
  public Statement getOrigin() { return origin; }
  public List<Arm> getArms() { return arms; }
  public List<Statement> getDefaultBody() { return defaultBody; }

  @Override
  public String toString() {
    return String.format("PriorityChain(%d arms%s) of %s", arms.size(), defaultBody.isEmpty() ? "" : " + default", origin);
  }
}
