package hdlelab.value;

import hdlelab.shape.Shape;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ValueEvaluatorTest {

  private static BigInteger big(long v) { return BigInteger.valueOf(v); }

  private static ValueEvaluator with(Signal s, long v) { return new ValueEvaluator(Map.of(s, big(v))); }

  @ParameterizedTest
  @ValueSource(longs = {0, 1, 0x5A, 0xFF, 0x80})
  void testFullSliceIsIdentity(long raw) {
    Signal a = Signal.unsigned("a", 8);
    ValueEvaluator eval = with(a, raw);
    Assertions.assertEquals(eval.evaluate(a), eval.evaluate(a.slice(0, 8)));
    Assertions.assertEquals(BigInteger.ONE, eval.evaluate(a.slice(0, 8).eq(a)));
  }

  @ParameterizedTest
  @ValueSource(longs = {0, 0x1F3, 0x0AB, 0x3FF})
  void testCatSlicesRoundTrip(long raw) {
    Signal a = Signal.unsigned("a", 4);
    Signal b = Signal.unsigned("b", 6);
    Map<Signal, BigInteger> env = new HashMap<>();
    env.put(a, big(raw & 0xF));
    env.put(b, big(raw >> 4));
    ValueEvaluator eval = new ValueEvaluator(env);
    Cat cat = Cat.of(a, b);
    Assertions.assertEquals(eval.evaluate(a), eval.evaluate(cat.slice(0, 4)));
    Assertions.assertEquals(eval.evaluate(b), eval.evaluate(cat.slice(4, 10)));
    // first operand is least significant
    Assertions.assertEquals(big((raw >> 4) << 4 | (raw & 0xF)), eval.evaluate(cat));
  }

  @ParameterizedTest
  @ValueSource(longs = {0, 1, 2, 5, 7})
  void testReplicationEqualsCat(long raw) {
    Signal x = Signal.unsigned("x", 3);
    ValueEvaluator eval = with(x, raw);
    Assertions.assertEquals(eval.evaluate(Cat.of(x, x, x)), eval.evaluate(Repl.of(x, 3)));
    Assertions.assertEquals(9, Repl.of(x, 3).width());
  }

  @Test
  void testMixedSignAddition() {
    Signal addr = new Signal("addr", Shape.unsigned(16), 0);
    Signal offset = new Signal("offset", Shape.signed(5), -1);
    ValueEvaluator eval = new ValueEvaluator();
    Value sum = addr.add(offset);
    Assertions.assertEquals(Shape.signed(18), sum.shape());
    Assertions.assertEquals(big(-1), eval.evaluate(sum));
    Assertions.assertEquals(big(0xFFFF), eval.evaluate(sum.slice(0, 16)));
    Assertions.assertEquals(BigInteger.ONE, eval.evaluate(sum.slice(0, 16).eq(0xFFFF)));
    Assertions.assertEquals(BigInteger.ZERO, eval.evaluate(sum.eq(0xFFFF)));
  }

  @Test
  void testMatches() {
    Signal x = Signal.unsigned("x", 5);
    Assertions.assertEquals(BigInteger.ONE, with(x, 0b11010).evaluate(x.matches("11---")));
    Assertions.assertEquals(BigInteger.ZERO, with(x, 0b10010).evaluate(x.matches("11---")));
    Assertions.assertEquals(BigInteger.ONE, with(x, 0b10010).evaluate(x.matches("11---", "10-1-")));
  }

  @Test
  void testSignedOperations() {
    Signal s = Signal.signed("s", 8);
    ValueEvaluator eval = with(s, -16);
    Assertions.assertEquals(big(-4), eval.evaluate(s.shiftRight(2)));
    Assertions.assertEquals(big(-1), eval.evaluate(s.shiftRight(8)));
    Assertions.assertEquals(big(-4), eval.evaluate(s.shr(Const.of(2))));
    Assertions.assertEquals(big(-64), eval.evaluate(s.shiftLeft(2).asSigned()));
    Assertions.assertEquals(big(16), eval.evaluate(s.neg()));
    Assertions.assertEquals(big(0xF0), eval.evaluate(s.asUnsigned()));
    Assertions.assertEquals(BigInteger.ONE, eval.evaluate(s.lt(0)));
    Assertions.assertEquals(BigInteger.ONE, eval.evaluate(s.bit(-1)));
  }

  @Test
  void testResize() {
    Signal s = Signal.signed("s", 4);
    Signal u = Signal.unsigned("u", 4);
    Map<Signal, BigInteger> env = new HashMap<>();
    env.put(s, big(-3));
    env.put(u, big(13));
    ValueEvaluator eval = new ValueEvaluator(env);
    Assertions.assertEquals(big(0xFD), eval.evaluate(Values.resize(s, 8)));
    Assertions.assertEquals(big(13), eval.evaluate(Values.resize(u, 8)));
    Assertions.assertEquals(big(1), eval.evaluate(Values.resize(u, 2)));
    Assertions.assertSame(u, Values.resize(u, 4));
  }

  @Test
  void testReductionsAndMux() {
    Signal x = Signal.unsigned("x", 4);
    ValueEvaluator eval = with(x, 0b1011);
    Assertions.assertEquals(BigInteger.ONE, eval.evaluate(x.bool()));
    Assertions.assertEquals(BigInteger.ZERO, eval.evaluate(x.all()));
    Assertions.assertEquals(BigInteger.ONE, eval.evaluate(x.xorReduce()));
    Assertions.assertEquals(big(0b0100), eval.evaluate(x.invert()));
    Assertions.assertEquals(big(7), eval.evaluate(Operator.mux(x.bit(0), 7, 3)));
    Assertions.assertEquals(big(3), eval.evaluate(Operator.mux(x.bit(2), 7, 3)));
  }

  @Test
  void testArraySelection() {
    Signal idx = Signal.unsigned("idx", 2);
    ArrayRef ref = new ArrayRef(List.of(Const.of(10, Shape.unsigned(4)), Const.of(11, Shape.unsigned(4)), Const.of(12, Shape.unsigned(4))), idx);
    Assertions.assertEquals(big(11), with(idx, 1).evaluate(ref));
    Assertions.assertEquals(big(12), with(idx, 2).evaluate(ref));
  }

  @Test
  void testStridedSlice() {
    Signal x = Signal.unsigned("x", 8);
    ValueEvaluator eval = with(x, 0b10110001);
    // reversed bit order
    Assertions.assertEquals(big(0b10001101), eval.evaluate(x.slice(null, null, -1)));
    Assertions.assertEquals(big(0b0101), eval.evaluate(x.slice(null, null, 2)));
  }
}
