package hdlelab.value;

import hdlelab.elab.ElaborationException;
import hdlelab.elab.ErrorKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SliceIndicesTest {

  @Test
  void testDefaults() {
    Assertions.assertArrayEquals(new int[] {0, 1, 2, 3, 4, 5, 6, 7}, SliceIndices.normalize(8, null, null, 1, null));
    Assertions.assertArrayEquals(new int[] {7, 6, 5, 4, 3, 2, 1, 0}, SliceIndices.normalize(8, null, null, -1, null));
    Assertions.assertArrayEquals(new int[] {0, 2, 4, 6}, SliceIndices.normalize(8, null, null, 2, null));
  }

  @Test
  void testNegativeBounds() {
    Assertions.assertArrayEquals(new int[] {5, 6, 7}, SliceIndices.normalize(8, -3, null, 1, null));
    Assertions.assertArrayEquals(new int[] {0, 1, 2, 3, 4, 5, 6}, SliceIndices.normalize(8, 0, -1, 1, null));
    Assertions.assertArrayEquals(new int[] {6, 4}, SliceIndices.normalize(8, 6, 2, -2, null));
    Assertions.assertArrayEquals(new int[] {7, 6}, SliceIndices.normalize(8, -1, -3, -1, null));
  }

  @Test
  void testEmpty() {
    Assertions.assertEquals(0, SliceIndices.normalize(8, 4, 4, 1, null).length);
    Assertions.assertEquals(0, SliceIndices.normalize(8, 5, 2, 1, null).length);
    Assertions.assertEquals(0, SliceIndices.normalize(8, 2, 5, -1, null).length);
  }

  @Test
  void testOutOfRange() {
    var e = Assertions.assertThrows(ElaborationException.class, () -> SliceIndices.normalize(8, 0, 9, 1, null));
    Assertions.assertEquals(ErrorKind.INDEX_OUT_OF_RANGE, e.getKind());
    e = Assertions.assertThrows(ElaborationException.class, () -> SliceIndices.normalize(8, -9, null, 1, null));
    Assertions.assertEquals(ErrorKind.INDEX_OUT_OF_RANGE, e.getKind());
    Assertions.assertThrows(IllegalArgumentException.class, () -> SliceIndices.normalize(8, 0, 4, 0, null));
  }

  @Test
  void testSingleIndex() {
    Assertions.assertEquals(7, SliceIndices.normalizeIndex(8, -1, null));
    Assertions.assertEquals(0, SliceIndices.normalizeIndex(8, -8, null));
    Assertions.assertEquals(3, SliceIndices.normalizeIndex(8, 3, null));
    Assertions.assertThrows(ElaborationException.class, () -> SliceIndices.normalizeIndex(8, 8, null));
    Assertions.assertThrows(ElaborationException.class, () -> SliceIndices.normalizeIndex(8, -9, null));
  }

  @Test
  void testContiguous() {
    Assertions.assertTrue(SliceIndices.isContiguous(new int[] {2, 3, 4}));
    Assertions.assertFalse(SliceIndices.isContiguous(new int[] {4, 3}));
    Assertions.assertFalse(SliceIndices.isContiguous(new int[] {0, 2}));
  }
}
