package net.larse.tsa.timeseries;

import static org.junit.Assert.assertArrayEquals;

import org.junit.Test;

public class TimeSeriesUtilsTest {
  private static final double DELTA = 1e-12;

  @Test
  public void testMovingAverageOddPeriod() {
    double[] trend = TimeSeriesUtils.movingAverage(new double[] {1, 2, 3, 4, 5}, 3);
    assertArrayEquals(new double[] {2, 2, 3, 4, 4}, trend, DELTA);
  }

  @Test
  public void testMovingAverageEvenPeriod() {
    // the 2 x 4 average reproduces a straight line where it has a full window
    double[] trend = TimeSeriesUtils.movingAverage(new double[] {0, 1, 2, 3, 4, 5, 6, 7}, 4);
    assertArrayEquals(new double[] {2, 2, 2, 3, 4, 5, 5, 5}, trend, DELTA);
  }

  @Test
  public void testMovingAverageWithoutFullWindow() {
    double[] trend = TimeSeriesUtils.movingAverage(new double[] {1, 2, 6}, 4);
    assertArrayEquals(new double[] {3, 3, 3}, trend, DELTA);
  }

  @Test
  public void testPhaseMeans() {
    double[] byPhase = TimeSeriesUtils.phaseMeans(new double[] {1, 2, 3, 4, 5, 6}, 3, 0, 5);
    assertArrayEquals(new double[] {-1, 0, 1}, byPhase, DELTA);
  }

  @Test
  public void testPhaseMeansOverRange() {
    double[] values = {100, 1, 2, 3, 4, 100};
    // the ends are left out, phase 1 averages 1 and 4
    assertArrayEquals(new double[] {0.5, 0, -0.5},
        TimeSeriesUtils.phaseMeans(values, 3, 1, 4), DELTA);
  }

  @Test
  public void testPhaseMeansOutsideRange() {
    double[] values = {10, 1, 2, 3, 20, 30};
    // phases 0 and 1 have no position in [2, 3] and use the whole series
    assertArrayEquals(new double[] {6.125, 6.625, -6.875, -5.875},
        TimeSeriesUtils.phaseMeans(values, 4, 2, 3), DELTA);
    assertArrayEquals(new double[] {-2, -1, 0, 3},
        TimeSeriesUtils.phaseMeans(new double[] {1, 2, 3, 6}, 4, 2, 1), DELTA);
  }

  @Test
  public void testCycleDeviations() {
    double[] values = {0, 1, 10, 20, 30, 40};
    // positions 1 and 2 hold phases 1 and 0
    assertArrayEquals(new double[] {4.5, -4.5}, TimeSeriesUtils.cycleDeviations(values, 2, 1), DELTA);
    // no full cycle from position 5, so the first cycle is used
    assertArrayEquals(new double[] {-0.5, 0.5}, TimeSeriesUtils.cycleDeviations(values, 2, 5), DELTA);
  }

  @Test
  public void testBroadcast() {
    assertArrayEquals(new double[] {-1, 1, -1, 1, -1},
        TimeSeriesUtils.broadcast(new double[] {-1, 1}, 5), DELTA);
  }
}
