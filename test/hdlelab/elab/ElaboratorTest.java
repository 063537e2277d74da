package hdlelab.elab;

import hdlelab.resolve.Driver;
import hdlelab.resolve.DriverTable;
import hdlelab.shape.Shape;
import hdlelab.stmt.Domain;
import hdlelab.stmt.Module;
import hdlelab.ui.ElabConfig;
import hdlelab.value.ArrayRef;
import hdlelab.value.Const;
import hdlelab.value.Signal;
import hdlelab.value.Value;
import hdlelab.value.ValueEvaluator;
import hdlelab.value.Values;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ElaboratorTest {

  private static ElaborationException assertFails(ErrorKind kind, Module top) {
    Elaborator elaborator = new Elaborator();
    var e = Assertions.assertThrows(ElaborationException.class, () -> elaborator.elaborate(top));
    Assertions.assertEquals(kind, e.getKind());
    Assertions.assertEquals(ElaborationState.FAILED, elaborator.getState());
    Assertions.assertSame(e, elaborator.getError().orElseThrow());
    return e;
  }

  @Test
  void testCounter() {
    Signal en = new Signal("en");
    Signal count = Signal.unsigned("count", 8);
    Signal wrap = new Signal("wrap");
    Module top = new Module("counter");
    top.body().ifThen(en, body -> body.sync(count, count.add(1)));
    top.body().comb(wrap, count.eq(0xFF).logicalAnd(en));

    Elaborator elaborator = new Elaborator();
    Assertions.assertEquals(ElaborationState.BUILDING, elaborator.getState());
    DriverTable table = elaborator.elaborate(top);
    Assertions.assertEquals(ElaborationState.VALIDATED, elaborator.getState());
    Assertions.assertTrue(elaborator.getState().isTerminal());
    Assertions.assertTrue(elaborator.getError().isEmpty());

    Assertions.assertEquals(List.of(Domain.SYNC, Domain.COMB), List.copyOf(table.domains()));
    Assertions.assertEquals(2, table.size());
    Driver next = table.drivers(Domain.SYNC).get(0);
    Assertions.assertSame(count, next.getTarget());
    Assertions.assertTrue(next.coversWholeTarget());
    Assertions.assertEquals(8, next.getSource().width());

    ValueEvaluator eval = new ValueEvaluator(Map.of(en, BigInteger.ONE, count, BigInteger.valueOf(0xFF)));
    // count + 1 wraps to 8 bits
    Assertions.assertEquals(BigInteger.ZERO, eval.evaluate(next.getSource()));
    Assertions.assertEquals(BigInteger.ONE, eval.evaluate(table.driversOf(wrap).get(0).getSource()));

    for (Driver driver : table.all())
      Values.postOrder(List.of(driver.getSource())).forEach(node -> Assertions.assertTrue(node.isShapeInferred()));

    Assertions.assertThrows(IllegalStateException.class, () -> elaborator.elaborate(top));
  }

  @Test
  void testShapeMismatchFails() {
    Module top = new Module("top");
    Signal out = Signal.unsigned("out", 4);
    top.body().comb(out, new ArrayRef(List.of(Signal.unsigned("a", 4), Signal.unsigned("b", 5)), Signal.unsigned("i", 1)));
    ElaborationException e = assertFails(ErrorKind.SHAPE_MISMATCH, top);
    Assertions.assertTrue(e.getMessage().startsWith("ShapeMismatch: "));
  }

  @Test
  void testConstantIndexOutOfRange() {
    Module top = new Module("top");
    Signal out = Signal.unsigned("out", 4);
    Shape u4 = Shape.unsigned(4);
    top.body().comb(out, new ArrayRef(List.of(Const.of(1, u4), Const.of(2, u4), Const.of(3, u4)), Const.of(5)));
    assertFails(ErrorKind.INDEX_OUT_OF_RANGE, top);
  }

  @Test
  void testVariableIndexBeyondLengthIsAccepted() {
    Module top = new Module("top");
    Signal out = Signal.unsigned("out", 4);
    Signal idx = Signal.unsigned("idx", 3);
    Shape u4 = Shape.unsigned(4);
    top.body().comb(out, new ArrayRef(List.of(Const.of(1, u4), Const.of(2, u4), Const.of(3, u4)), idx));
    DriverTable table = new Elaborator().elaborate(top);
    Value source = table.driversOf(out).get(0).getSource();
    Assertions.assertTrue(Values.postOrder(List.of(source)).stream().noneMatch(node -> node instanceof ArrayRef));
    Assertions.assertEquals(BigInteger.valueOf(2), new ValueEvaluator(Map.of(idx, BigInteger.ONE)).evaluate(source));
  }

  @Test
  void testArraysKeptWhenLoweringDisabled() {
    ElabConfig config = new ElabConfig();
    config.lower_arrays = false;
    Module top = new Module("top");
    Signal out = Signal.unsigned("out", 4);
    top.body().comb(out, new ArrayRef(List.of(Signal.unsigned("a", 4), Signal.unsigned("b", 4)), new Signal("sel")));
    DriverTable table = new Elaborator(config).elaborate(top);
    Assertions.assertTrue(table.driversOf(out).get(0).getSource() instanceof ArrayRef);
  }

  @Test
  void testInvalidCasePattern() {
    Module top = new Module("top");
    Signal sel = Signal.unsigned("sel", 4);
    Signal out = new Signal("out");
    top.body().switchOn(sel).caseOf(body -> body.comb(out, 1), "1-").defaultCase(body -> body.comb(out, 0));
    assertFails(ErrorKind.INVALID_PATTERN, top);
  }

  @Test
  void testDuplicateDriverAcrossModules() {
    Signal out = Signal.unsigned("out", 4);
    Module top = new Module("top");
    Module child = new Module("child");
    top.addSubmodule(child);
    top.body().comb(out.slice(0, 2), 1);
    child.body().comb(out.bit(1), 0);
    ElaborationException e = assertFails(ErrorKind.DUPLICATE_DRIVER, top);
    Assertions.assertTrue(e.getMessage().contains("top.child"), e.getMessage());
  }

  @Test
  void testDisjointBitsAcrossModules() {
    Signal out = Signal.unsigned("out", 4);
    Module top = new Module("top");
    Module child = new Module("child");
    top.addSubmodule(child);
    top.body().comb(out.slice(0, 2), 1);
    child.body().comb(out.slice(2, 4), 2);
    DriverTable table = new Elaborator().elaborate(top);
    List<Driver> drivers = table.driversOf(out);
    Assertions.assertEquals(2, drivers.size());
    Assertions.assertEquals("top", drivers.get(0).getModule());
    Assertions.assertEquals("top.child", drivers.get(1).getModule());
  }

  @Test
  void testDuplicateDriverAcrossDomains() {
    Signal out = Signal.unsigned("out", 4);
    Module top = new Module("top");
    top.body().comb(out.slice(0, 2), 1);
    top.body().sync(out.slice(2, 4), 1);
    assertFails(ErrorKind.DUPLICATE_DRIVER, top);
  }

  @Test
  void testHierarchyCycle() {
    Module a = new Module("a");
    Module b = new Module("b");
    a.addSubmodule(b);
    b.addSubmodule(a);
    Elaborator elaborator = new Elaborator();
    Assertions.assertThrows(IllegalArgumentException.class, () -> elaborator.elaborate(a));
    Assertions.assertEquals(ElaborationState.FAILED, elaborator.getState());
    Assertions.assertTrue(elaborator.getState().isTerminal());
    Assertions.assertTrue(elaborator.getError().isEmpty());
    Assertions.assertThrows(IllegalStateException.class, () -> elaborator.elaborate(a));
  }

  @Test
  void testDeepGraphWithBadShift() {
    Signal a = Signal.unsigned("a", 4);
    Value deep = a;
    for (int i = 0; i < 20000; ++i)
      deep = deep.xor(a);
    Module top = new Module("top");
    top.body().comb(Signal.unsigned("out", 4), deep.shl(Signal.signed("n", 2)));
    ElaborationException e = assertFails(ErrorKind.SHAPE_MISMATCH, top);
    Assertions.assertTrue(e.getMessage().contains("..."));
  }

  @Test
  void testUnusedValuesAreChecked() {
    Module top = new Module("top");
    Signal x = Signal.unsigned("x", 4);
    top.body().ifThen(x.slice(0, 6).bool(), body -> {});
    assertFails(ErrorKind.INDEX_OUT_OF_RANGE, top);
  }

  @Test
  void testEmptyModule() {
    DriverTable table = new Elaborator().elaborate(new Module("empty"));
    Assertions.assertTrue(table.isEmpty());
    Assertions.assertTrue(table.domains().isEmpty());
  }
}
