package hdlelab.stmt;

import hdlelab.pattern.Pattern;
import hdlelab.util.ExprPrinter;
import hdlelab.value.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Switch/Case/Default over a subject. Cases are tried in declaration order; overlapping patterns are won by the earlier case.
 */
public final class SwitchStatement extends Statement {
  /** One case; its patterns are OR-combined. */
  public record Case(List<Pattern> patterns, List<Statement> body) {
    public Case {
      patterns = List.copyOf(patterns);
      body = List.copyOf(body);
    }
  }

  private final Value subject;
  private final List<Case> cases;
  private final List<Statement> defaultBody;

  /**
   * @param subject the matched value
   * @param cases the cases in declaration order
   * @param defaultBody the Default body, empty if there is none
   */
  public SwitchStatement(Value subject, List<Case> cases, List<Statement> defaultBody) {
    this.subject = Objects.requireNonNull(subject, "subject");
    this.cases = List.copyOf(cases);
    this.defaultBody = List.copyOf(defaultBody);
  }

  public Value getSubject() { return subject; }
  public List<Case> getCases() { return cases; }
  public List<Statement> getDefaultBody() { return defaultBody; }

  @Override
  public List<Value> values() {
    return List.of(subject);
  }
  @Override
  public List<List<Statement>> bodies() {
    List<List<Statement>> result = new ArrayList<>();
    cases.forEach(c -> result.add(c.body()));
    result.add(defaultBody);
    return result;
  }
  @Override
  public String toString() {
    return "switch (" + ExprPrinter.render(subject) + ") " +
        cases.stream().map(c -> c.patterns().toString()).collect(Collectors.joining(" ")) + (defaultBody.isEmpty() ? "" : " default");
  }
}
