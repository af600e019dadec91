package net.larse.tsa.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class LinearLeastSquaresTest {
  @Test
  public void testExactLine() {
    LinearLeastSquares lls = new LinearLeastSquares(2);
    for (int i = 0; i < 5; i++) {
      lls.addInput(new double[] {1, i}, 0, 1 + 2 * i);
    }
    assertArrayEquals(new double[] {1, 2}, lls.getSolution(), 1e-9);
  }

  @Test
  public void testOffsetIntoInput() {
    LinearLeastSquares lls = new LinearLeastSquares(1);
    lls.addInput(new double[] {99, 1}, 1, 3);
    lls.addInput(new double[] {99, 2}, 1, 6);
    assertArrayEquals(new double[] {3}, lls.getSolution(), 1e-12);
  }

  @Test
  public void testTooFewInputs() {
    LinearLeastSquares lls = new LinearLeastSquares(2);
    lls.addInput(new double[] {1, 0}, 0, 1);
    assertNull(lls.getSolution());
  }
}
