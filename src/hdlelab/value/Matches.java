package hdlelab.value;

import hdlelab.pattern.Pattern;
import java.util.List;
import java.util.Objects;

/**
 * 1-bit unsigned value that is true iff the subject matches at least one of the patterns (OR-combined).
 * Pattern lengths are validated against the subject width during shape inference.
 */
public final class Matches extends Value {
  private final Value subject;
  private final List<Pattern> patterns;

  public Matches(Value subject, List<Pattern> patterns) {
    this.subject = Objects.requireNonNull(subject, "subject");
    patterns.forEach(pattern -> Objects.requireNonNull(pattern, "pattern"));
    this.patterns = List.copyOf(patterns);
  }

  public Value getSubject() { return subject; }
  public List<Pattern> getPatterns() { return patterns; }

  @Override
  public List<Value> children() {
    return List.of(subject);
  }
}
