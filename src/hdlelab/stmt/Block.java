package hdlelab.stmt;

import hdlelab.pattern.Pattern;
import hdlelab.value.Value;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Explicit construction context for a statement body. Nested bodies of If and Switch are built through their own Block passed to a
 * callback, so there is no implicit "current" module or scope.
 *
 * Statements are appended in source order; {@link #build()} returns the immutable statement list.
 */
public class Block {
  private final List<Statement> statements = new ArrayList<>();

  /** Appends a prebuilt statement. */
  public Block add(Statement statement) {
    statements.add(Objects.requireNonNull(statement, "statement"));
    return this;
  }

  /**
   * Appends an assignment.
   * @param domain the driver domain
   * @param target a signal, or a slice, concatenation or array element of signals
   * @param source a Value or a constant accepted by {@link Value#cast(Object)}
   */
  public Block assign(Domain domain, Value target, Object source) { return add(new Assign(domain, target, Value.cast(source))); }
  /** Combinational assignment. */
  public Block comb(Value target, Object source) { return assign(Domain.COMB, target, source); }
  /** Assignment in the default synchronous domain. */
  public Block sync(Value target, Object source) { return assign(Domain.SYNC, target, source); }

  /**
   * Starts an If chain.
   * @param condition a Value (reduced to one bit) or a constant
   * @param body fills the body of the If arm
   * @return a builder for Elif/Else arms
   */
  public IfBuilder ifThen(Object condition, Consumer<Block> body) {
    IfStatement.Branch first = new IfStatement.Branch(Value.cast(condition), buildBody(body));
    return new IfBuilder(first);
  }

  /**
   * Starts a Switch over a subject.
   * @param subject a Value or a constant
   * @return a builder for Case/Default arms
   */
  public SwitchBuilder switchOn(Object subject) {
    return new SwitchBuilder(Value.cast(subject));
  }

  /** Returns the statements appended so far. */
  public List<Statement> build() { return List.copyOf(statements); }

  private static List<Statement> buildBody(Consumer<Block> body) {
    Block block = new Block();
    body.accept(block);
    return block.build();
  }

  /** Adds Elif and Else arms to an If statement that is already part of the enclosing block. */
  public class IfBuilder {
    private final int slot;
    private final List<IfStatement.Branch> branches = new ArrayList<>();
    private List<Statement> elseBody = null;

    private IfBuilder(IfStatement.Branch first) {
      branches.add(first);
      slot = statements.size();
      statements.add(newStatement());
    }

    private IfStatement newStatement() { return new IfStatement(branches, elseBody == null ? List.of() : elseBody); }
    private void publish() { statements.set(slot, newStatement()); }

    public IfBuilder elif(Object condition, Consumer<Block> body) {
      if (elseBody != null)
        throw new IllegalStateException("Elif after Else");
      branches.add(new IfStatement.Branch(Value.cast(condition), buildBody(body)));
      publish();
      return this;
    }
    public Block otherwise(Consumer<Block> body) {
      if (elseBody != null)
        throw new IllegalStateException("Duplicate Else");
      elseBody = buildBody(body);
      publish();
      return Block.this;
    }
  }

  /** Adds Case and Default arms to a Switch statement that is already part of the enclosing block. */
  public class SwitchBuilder {
    private final int slot;
    private final Value subject;
    private final List<SwitchStatement.Case> cases = new ArrayList<>();
    private List<Statement> defaultBody = null;

    private SwitchBuilder(Value subject) {
      this.subject = subject;
      slot = statements.size();
      statements.add(newStatement());
    }

    private SwitchStatement newStatement() { return new SwitchStatement(subject, cases, defaultBody == null ? List.of() : defaultBody); }
    private void publish() { statements.set(slot, newStatement()); }

    /**
     * Adds a case matching any of the patterns.
     * @param body fills the case body
     * @param patterns at least one pattern
     */
    public SwitchBuilder caseOf(Consumer<Block> body, Pattern... patterns) {
      if (defaultBody != null)
        throw new IllegalStateException("Case after Default");
      if (patterns.length == 0)
        throw new IllegalArgumentException("A case needs at least one pattern; use defaultCase instead");
      cases.add(new SwitchStatement.Case(Arrays.asList(patterns), buildBody(body)));
      publish();
      return this;
    }
    /** Adds a case matching any of the bit string patterns. */
    public SwitchBuilder caseOf(Consumer<Block> body, String... patterns) {
      return caseOf(body, Arrays.stream(patterns).map(Pattern::bits).collect(Collectors.toList()).toArray(new Pattern[0]));
    }
    /** Adds a case matching exactly one integer value. */
    public SwitchBuilder caseValue(long value, Consumer<Block> body) { return caseOf(body, Pattern.value(value)); }

    public Block defaultCase(Consumer<Block> body) {
      if (defaultBody != null)
        throw new IllegalStateException("Duplicate Default");
      defaultBody = buildBody(body);
      publish();
      return Block.this;
    }
  }
}
