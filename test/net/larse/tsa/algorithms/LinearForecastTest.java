package net.larse.tsa.algorithms;

import static org.junit.Assert.assertArrayEquals;

import org.junit.Test;

public class LinearForecastTest {

  @Test
  public void testExtendsLine() {
    double[] forecast = new LinearForecast().forecast(
        new double[] {1, 2, 3, 4, 5}, new double[] {3, 5, 7, 9, 11}, 0, new double[] {6, 7});
    assertArrayEquals(new double[] {13, 15}, forecast, 1e-9);
  }

  @Test
  public void testQuadraticOrder() {
    LinearForecast.Args args = new LinearForecast.Args();
    args.order = 2;
    double[] forecast = new LinearForecast(args).forecast(
        new double[] {0, 1, 2, 3}, new double[] {0, 1, 4, 9}, 0, new double[] {4});
    assertArrayEquals(new double[] {16}, forecast, 1e-8);
  }

  @Test
  public void testSinglePointGivesFlatForecast() {
    double[] forecast = new LinearForecast().forecast(
        new double[] {1}, new double[] {7}, 0, new double[] {2, 3});
    assertArrayEquals(new double[] {7, 7}, forecast, 1e-12);
  }

  @Test(expected = ArithmeticException.class)
  public void testEmptyHistory() {
    new LinearForecast().forecast(new double[0], new double[0], 0, new double[] {1});
  }
}
