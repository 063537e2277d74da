package hdlelab.shape;

import hdlelab.value.Const;
import java.math.BigInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ShapeTest {

  @Test
  void testConstantShapes() {
    Assertions.assertEquals(Shape.unsigned(4), Const.of(10).shape());
    Assertions.assertEquals(Shape.signed(5), Const.of(-10).shape());
    Assertions.assertEquals(Shape.unsigned(1), Const.of(0).shape());
    Assertions.assertEquals(Shape.signed(1), Const.of(-1).shape());
    Assertions.assertEquals(Shape.unsigned(8), Const.of(255).shape());
    Assertions.assertEquals(Shape.unsigned(9), Const.of(256).shape());
  }

  @Test
  void testRangeShapes() {
    Assertions.assertEquals(Shape.unsigned(3), Const.ofRange(2, 0, 5).shape());
    Assertions.assertEquals(Shape.signed(5), Const.ofRange(3, -5, 11).shape());
    Assertions.assertEquals(Shape.unsigned(1), Shape.fromRange(0, 1));
    Assertions.assertEquals(Shape.unsigned(8), Shape.fromRange(0, 256));
    Assertions.assertEquals(Shape.signed(8), Shape.fromRange(-128, 128));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Shape.fromRange(3, 3));
  }

  @ParameterizedTest
  @ValueSource(longs = {0, 1, 7, 8, -1, -8, -9, 1000, -1000, Long.MAX_VALUE, Long.MIN_VALUE})
  void testConstantFitsOwnShape(long value) {
    Shape shape = Shape.ofConstant(value);
    Assertions.assertTrue(shape.contains(BigInteger.valueOf(value)));
    Assertions.assertEquals(value < 0, shape.isSigned());
    if (shape.getWidth() > 1) {
      // minimal: one bit less cannot hold the value
      Shape smaller = new Shape(shape.getWidth() - 1, shape.isSigned());
      Assertions.assertFalse(smaller.contains(BigInteger.valueOf(value)), "shape of " + value + " is not minimal");
    }
  }

  @Test
  void testSignedRange() {
    Shape s = Shape.signed(5);
    Assertions.assertEquals(BigInteger.valueOf(-16), s.minValue());
    Assertions.assertEquals(BigInteger.valueOf(15), s.maxValue());
    Assertions.assertEquals(BigInteger.ZERO, Shape.unsigned(5).minValue());
    Assertions.assertEquals(BigInteger.valueOf(31), Shape.unsigned(5).maxValue());
  }

  @Test
  void testWrap() {
    Assertions.assertEquals(BigInteger.valueOf(-1), Shape.signed(4).wrap(BigInteger.valueOf(15)));
    Assertions.assertEquals(BigInteger.valueOf(15), Shape.unsigned(4).wrap(BigInteger.valueOf(-1)));
    Assertions.assertEquals(BigInteger.valueOf(3), Shape.unsigned(4).wrap(BigInteger.valueOf(19)));
    Assertions.assertEquals(BigInteger.valueOf(0xF), Shape.signed(4).toBits(BigInteger.valueOf(-1)));
  }

  @Test
  void testInvalidWidth() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> Shape.unsigned(0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> Shape.signed(-3));
  }

  @Test
  void testEqualsAndToString() {
    Assertions.assertEquals(Shape.unsigned(4), new Shape(4, false));
    Assertions.assertNotEquals(Shape.unsigned(4), Shape.signed(4));
    Assertions.assertEquals("unsigned(4)", Shape.unsigned(4).toString());
    Assertions.assertEquals("signed(5)", Shape.signed(5).toString());
  }
}
