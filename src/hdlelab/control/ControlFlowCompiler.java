package hdlelab.control;

import hdlelab.pattern.PatternMatcher;
import hdlelab.shape.Shape;
import hdlelab.stmt.IfStatement;
import hdlelab.stmt.Statement;
import hdlelab.stmt.SwitchStatement;
import hdlelab.value.Matches;
import hdlelab.value.Value;
import hdlelab.value.Values;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers If/Elif/Else and Switch/Case/Default statements into {@link PriorityChain}s.
 */
public class ControlFlowCompiler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /**
   * Compiles a conditional statement.
   * @param statement an IfStatement or SwitchStatement
   * @return the priority chain
   * @throws hdlelab.elab.ElaborationException of kind InvalidPattern for a case pattern that does not fit the subject
   */
  public PriorityChain compile(Statement statement) {
    if (statement instanceof IfStatement)
      return compileIf((IfStatement)statement);
    if (statement instanceof SwitchStatement)
      return compileSwitch((SwitchStatement)statement);
    throw new IllegalArgumentException("Not a conditional statement: " + statement);
  }

  public PriorityChain compileIf(IfStatement statement) {
    List<PriorityChain.Arm> arms = new ArrayList<>();
    for (IfStatement.Branch branch : statement.getBranches())
      arms.add(new PriorityChain.Arm(Values.asCondition(branch.condition()), branch.body()));
    return new PriorityChain(statement, arms, statement.getElseBody());
  }

  public PriorityChain compileSwitch(SwitchStatement statement) {
    Value subject = statement.getSubject();
    Shape subjectShape = subject.shape();
    List<PriorityChain.Arm> arms = new ArrayList<>();
    List<String> seenExact = new ArrayList<>();
    for (SwitchStatement.Case c : statement.getCases()) {
      List<String> bits = PatternMatcher.validateAll(c.patterns(), subjectShape, statement);
      for (String pattern : bits) {
        if (PatternMatcher.isExact(pattern) && seenExact.contains(pattern))
          logger.debug("Case pattern {} of {} is shadowed by an earlier case", pattern, statement);
        else if (PatternMatcher.isExact(pattern))
          seenExact.add(pattern);
      }
      Matches guard = new Matches(subject, c.patterns());
      guard.shape();
      arms.add(new PriorityChain.Arm(guard, c.body()));
    }
    return new PriorityChain(statement, arms, statement.getDefaultBody());
  }
}
