package net.larse.tsa.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ArrayHelperTest {
  @Test
  public void testDifference() {
    double[] y = {1, 4, 9, 16, 25};
    assertArrayEquals(new double[] {3, 5, 7, 9}, ArrayHelper.difference(y, 1), 0);
    assertArrayEquals(new double[] {8, 12, 16}, ArrayHelper.difference(y, 2), 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDifferenceTooShort() {
    ArrayHelper.difference(new double[] {1, 2}, 2);
  }

  @Test
  public void testIntegrate() {
    double[] history = {1, 4, 9, 16, 25};
    // continues the squares: differences 11, 13 after 25
    assertArrayEquals(new double[] {36, 49}, ArrayHelper.integrate(history, new double[] {11, 13}, 1), 0);
    // at lag 2 the forecasts chain on themselves after the first two
    assertArrayEquals(new double[] {18, 27, 20},
        ArrayHelper.integrate(history, new double[] {2, 2, 2}, 2), 0);
  }

  @Test
  public void testLogistic() {
    assertEquals(0.5, ArrayHelper.logistic(0), 0);
    assertEquals(0.2, ArrayHelper.logistic(ArrayHelper.logit(0.2)), 1e-12);
  }

  @Test
  public void testAllFinite() {
    assertTrue(ArrayHelper.allFinite(new double[] {1, -2}));
    assertFalse(ArrayHelper.allFinite(new double[] {1, Double.NaN}));
    assertFalse(ArrayHelper.allFinite(new double[] {Double.NEGATIVE_INFINITY}));
  }
}
