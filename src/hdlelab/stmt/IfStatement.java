package hdlelab.stmt;

import hdlelab.util.ExprPrinter;
import hdlelab.value.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * If/Elif/Else chain. Conditions are reduced to one bit; the first true condition selects its body.
 */
public final class IfStatement extends Statement {
  /** One If or Elif arm. */
  public record Branch(Value condition, List<Statement> body) {
    public Branch {
      Objects.requireNonNull(condition, "condition");
      body = List.copyOf(body);
    }
  }

  private final List<Branch> branches;
  private final List<Statement> elseBody;

  /**
   * @param branches the If arm followed by the Elif arms, at least one
   * @param elseBody the Else body, empty if there is none
   */
  public IfStatement(List<Branch> branches, List<Statement> elseBody) {
    if (branches.isEmpty())
      throw new IllegalArgumentException("An If statement needs at least one branch");
    this.branches = List.copyOf(branches);
    this.elseBody = List.copyOf(elseBody);
  }

  public List<Branch> getBranches() { return branches; }
  public List<Statement> getElseBody() { return elseBody; }

  @Override
  public List<Value> values() {
    return branches.stream().map(Branch::condition).collect(Collectors.toList());
  }
  @Override
  public List<List<Statement>> bodies() {
    List<List<Statement>> result = new ArrayList<>();
    branches.forEach(branch -> result.add(branch.body()));
    result.add(elseBody);
    return result;
  }
  @Override
  public String toString() {
    return "if " + branches.stream().map(branch -> "(" + ExprPrinter.render(branch.condition()) + ")").collect(Collectors.joining(" elif "))
        + (elseBody.isEmpty() ? "" : " else");
  }
}
