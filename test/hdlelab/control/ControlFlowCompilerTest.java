package hdlelab.control;

import hdlelab.elab.ElaborationException;
import hdlelab.elab.ErrorKind;
import hdlelab.shape.Shape;
import hdlelab.stmt.Block;
import hdlelab.stmt.Statement;
import hdlelab.value.Operator;
import hdlelab.value.Signal;
import hdlelab.value.ValueEvaluator;
import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ControlFlowCompilerTest {

  private final ControlFlowCompiler compiler = new ControlFlowCompiler();

  /** Index of the arm selected for a subject value, or -1 for the default body. */
  private static int selectedArm(PriorityChain chain, Signal subject, long value) {
    ValueEvaluator eval = new ValueEvaluator(Map.of(subject, BigInteger.valueOf(value)));
    for (int i = 0; i < chain.getArms().size(); ++i)
      if (eval.evaluate(chain.getArms().get(i).guard()).signum() != 0)
        return i;
    return -1;
  }

  @Test
  void testIfGuards() {
    Signal wide = Signal.unsigned("wide", 4);
    Signal flag = new Signal("flag");
    Block block = new Block();
    block.ifThen(wide, body -> {}).elif(flag, body -> body.comb(flag, 0)).otherwise(body -> body.comb(flag, 1));
    PriorityChain chain = compiler.compile(block.build().get(0));

    Assertions.assertEquals(2, chain.getArms().size());
    Assertions.assertEquals(Operator.Kind.BOOL, ((Operator)chain.getArms().get(0).guard()).getKind());
    Assertions.assertSame(flag, chain.getArms().get(1).guard());
    chain.getArms().forEach(arm -> Assertions.assertEquals(Shape.unsigned(1), arm.guard().shape()));
    Assertions.assertEquals(1, chain.getArms().get(1).body().size());
    Assertions.assertEquals(1, chain.getDefaultBody().size());
  }

  @ParameterizedTest
  @ValueSource(longs = {0b1111, 0b1000, 0b1010})
  void testEarlierCaseWins(long value) {
    Signal sel = Signal.unsigned("sel", 4);
    Block block = new Block();
    block.switchOn(sel).caseOf(body -> {}, "1---").caseOf(body -> {}, "1111").defaultCase(body -> {});
    PriorityChain chain = compiler.compile(block.build().get(0));
    Assertions.assertEquals(0, selectedArm(chain, sel, value));
  }

  @Test
  void testSwitchSelection() {
    Signal sel = Signal.unsigned("sel", 3);
    Block block = new Block();
    block.switchOn(sel).caseValue(2, body -> {}).caseOf(body -> {}, "0-1", "111").defaultCase(body -> {});
    PriorityChain chain = compiler.compile(block.build().get(0));
    Assertions.assertEquals(0, selectedArm(chain, sel, 2));
    Assertions.assertEquals(1, selectedArm(chain, sel, 1));
    Assertions.assertEquals(1, selectedArm(chain, sel, 3));
    Assertions.assertEquals(1, selectedArm(chain, sel, 7));
    Assertions.assertEquals(-1, selectedArm(chain, sel, 4));
  }

  @Test
  void testInvalidCasePattern() {
    Signal sel = Signal.unsigned("sel", 4);
    Block block = new Block();
    block.switchOn(sel).caseOf(body -> {}, "1--");
    Statement sw = block.build().get(0);
    var e = Assertions.assertThrows(ElaborationException.class, () -> compiler.compile(sw));
    Assertions.assertEquals(ErrorKind.INVALID_PATTERN, e.getKind());
    Assertions.assertSame(sw, e.getCulprit().orElseThrow());
  }

  @Test
  void testNotConditional() {
    Signal a = new Signal("a");
    Block block = new Block();
    block.comb(a, 1);
    Assertions.assertThrows(IllegalArgumentException.class, () -> compiler.compile(block.build().get(0)));
  }
}
