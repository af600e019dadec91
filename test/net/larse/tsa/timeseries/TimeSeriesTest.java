package net.larse.tsa.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import net.larse.tsa.algorithms.ForecastMethod;
import org.junit.Before;
import org.junit.Test;

public class TimeSeriesTest {
  private static final double DELTA = 1e-9;

  private List<DataPoint> alternating;

  @Before
  public void setUp() throws Exception {
    alternating = ImmutableList.of(
        DataPoint.of(1, 100), DataPoint.of(2, 200), DataPoint.of(3, 100),
        DataPoint.of(4, 200), DataPoint.of(5, 100));
  }

  @Test
  public void testFrequency() {
    TimeSeries series = TimeSeries.of(ImmutableList.<DataPoint>of(), 3);
    assertEquals(3, series.getFrequency().getAsInt());
    assertFalse(TimeSeries.of(alternating).getFrequency().isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveFrequency() {
    TimeSeries.of(alternating, 0);
  }

  @Test
  public void testPointListInit() {
    TimeSeries series = TimeSeries.of(ImmutableList.of(
        DataPoint.of(5, 6), DataPoint.of(1, 2), DataPoint.of(3, 4)));
    assertArrayEquals(new long[] {1, 3, 5}, series.getX().toLongArray());
    assertArrayEquals(new double[] {2, 4, 6}, series.getY().toDoubleArray(), DELTA);
    assertEquals(3, series.size());
  }

  @Test
  public void testMapInit() {
    TimeSeries series = TimeSeries.of(ImmutableMap.of(5L, 6, 1L, 2, 3L, 4));
    assertArrayEquals(new long[] {1, 3, 5}, series.getX().toLongArray());
    assertArrayEquals(new double[] {2, 4, 6}, series.getY().toDoubleArray(), DELTA);
    assertEquals(3, series.size());
  }

  @Test
  public void testArrayInit() {
    TimeSeries series = TimeSeries.of(new long[] {30, 10, 20}, new double[] {3, 1, 2}, 2);
    assertArrayEquals(new long[] {10, 20, 30}, series.getX().toLongArray());
    assertArrayEquals(new double[] {1, 2, 3}, series.getY().toDoubleArray(), DELTA);
    assertEquals(2, series.getFrequency().getAsInt());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateTimestamps() {
    TimeSeries.of(ImmutableList.of(DataPoint.of(1, 2), DataPoint.of(1, 3)));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testAccessorsAreReadOnly() {
    TimeSeries.of(alternating).getX().set(0, 42L);
  }

  @Test
  public void testAccessors() {
    TimeSeries series = TimeSeries.of(ImmutableList.of(
        DataPoint.of(1234000, 54), DataPoint.of(5678000, 100)));
    ZoneId zone = ZoneId.systemDefault();
    assertEquals(ImmutableList.of(
        LocalDateTime.ofInstant(Instant.ofEpochSecond(1234), zone),
        LocalDateTime.ofInstant(Instant.ofEpochSecond(5678), zone)), series.getDates());
    assertEquals(LocalDateTime.of(1970, 1, 1, 0, 20, 34), series.getDates(ZoneOffset.UTC).get(0));
    assertArrayEquals(new long[] {1234000, 5678000}, series.getTimestamps().toLongArray());
    assertArrayEquals(new double[] {54, 100}, series.getValues().toDoubleArray(), DELTA);
  }

  @Test
  public void testDatesTruncateToWholeSeconds() {
    TimeSeries series = TimeSeries.of(ImmutableList.of(DataPoint.of(-1500, 1), DataPoint.of(1999, 2)));
    List<LocalDateTime> dates = series.getDates(ZoneOffset.UTC);
    assertEquals(LocalDateTime.of(1969, 12, 31, 23, 59, 58), dates.get(0));
    assertEquals(LocalDateTime.of(1970, 1, 1, 0, 0, 1), dates.get(1));
  }

  @Test
  public void testInterval() {
    assertFalse(TimeSeries.of(ImmutableList.<DataPoint>of()).getInterval().isPresent());
    assertFalse(TimeSeries.of(ImmutableList.of(DataPoint.of(1, 2))).getInterval().isPresent());
    assertEquals(2, TimeSeries.of(ImmutableList.of(DataPoint.of(1, 2), DataPoint.of(3, 4)))
        .getInterval().getAsLong());
  }

  @Test
  public void testIteration() {
    List<DataPoint> points = ImmutableList.of(DataPoint.of(1, 2), DataPoint.of(3, 4), DataPoint.of(5, 6));
    assertEquals(points, Lists.newArrayList(TimeSeries.of(points)));
  }

  @Test
  public void testLinearTrend() {
    TimeSeries series = TimeSeries.of(ImmutableList.of(
        DataPoint.of(1, 32), DataPoint.of(2, 55), DataPoint.of(3, 40)), 3);
    TimeSeries trend = series.trend(TimeSeries.LINEAR);
    assertArrayEquals(new long[] {1, 2, 3}, trend.getX().toLongArray());
    assertArrayEquals(new double[] {38 + 1 / 3.0, 42 + 1 / 3.0, 46 + 1 / 3.0},
        trend.getY().toDoubleArray(), DELTA);
    assertEquals(3, trend.getFrequency().getAsInt());
    // the source is untouched
    assertArrayEquals(new double[] {32, 55, 40}, series.getY().toDoubleArray(), DELTA);
  }

  @Test
  public void testQuadraticTrend() {
    TimeSeries series = TimeSeries.of(new long[] {0, 1, 2, 3, 4}, new double[] {1, 0, 3, 10, 21});
    TimeSeries trend = series.trend(TimeSeries.QUADRATIC);
    assertArrayEquals(new double[] {1, 0, 3, 10, 21}, trend.getY().toDoubleArray(), 1e-8);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTrendNeedsEnoughPoints() {
    TimeSeries.of(ImmutableList.of(DataPoint.of(1, 3), DataPoint.of(2, 5))).trend(TimeSeries.QUADRATIC);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidForecastMethod() {
    TimeSeries.of(alternating).forecast(7, "huh");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidForecastMethodOnEmptySeries() {
    TimeSeries.of(ImmutableList.<DataPoint>of()).forecast(7, "huh");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveSteps() {
    TimeSeries.of(alternating).forecast(0, ForecastMethod.ARIMA);
  }

  @Test(expected = ArithmeticException.class)
  public void testForecastOnEmptySeries() {
    TimeSeries.of(ImmutableList.<DataPoint>of()).forecast(7);
  }

  @Test(expected = ArithmeticException.class)
  public void testForecastNoStepsOnEmptySeries() {
    TimeSeries.of(ImmutableList.<DataPoint>of()).forecast(0, ForecastMethod.ETS);
  }

  @Test(expected = ArithmeticException.class)
  public void testForecastOnSinglePoint() {
    TimeSeries.of(ImmutableList.of(DataPoint.of(1, 5))).forecast(2, ForecastMethod.ETS);
  }

  @Test
  public void testLinearForecast() {
    TimeSeries series = TimeSeries.of(new long[] {10, 20, 30, 40}, new double[] {3, 5, 7, 9});
    TimeSeries forecast = series.forecast(2);
    assertArrayEquals(new long[] {50, 60}, forecast.getTimestamps().toLongArray());
    assertArrayEquals(new double[] {11, 13}, forecast.getValues().toDoubleArray(), 1e-8);
  }

  @Test
  public void testArimaForecastWithoutFrequency() {
    assertForecastShape(TimeSeries.of(alternating).forecast(3, ForecastMethod.ARIMA));
  }

  @Test
  public void testArimaForecastWithFrequency() {
    assertForecastShape(TimeSeries.of(alternating, 4).forecast(3, ForecastMethod.ARIMA));
  }

  @Test
  public void testEtsForecastWithoutFrequency() {
    assertForecastShape(TimeSeries.of(alternating).forecast(3, ForecastMethod.ETS));
  }

  @Test
  public void testEtsForecastWithFrequency() {
    assertForecastShape(TimeSeries.of(alternating, 4).forecast(3, "ets"));
  }

  private static void assertForecastShape(TimeSeries forecast) {
    assertArrayEquals(new long[] {6, 7, 8}, forecast.getTimestamps().toLongArray());
    for (double value : forecast.getValues().toDoubleArray()) {
      assertFalse(Double.isNaN(value) || Double.isInfinite(value));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDecompositionWithNoFrequency() {
    TimeSeries.of(ImmutableList.of(DataPoint.of(1, 2), DataPoint.of(3, 4))).decompose();
  }

  @Test
  public void testDecomposition() {
    assertRegularDecomposition(TimeSeries.of(alternating, 2).decompose());
  }

  @Test
  public void testPeriodicDecomposition() {
    assertRegularDecomposition(TimeSeries.of(alternating, 2).decompose(true));
  }

  private static void assertRegularDecomposition(TimeSeriesGroup decomposed) {
    assertEquals(3, decomposed.size());
    assertEquals(ImmutableList.of(TimeSeries.TREND, TimeSeries.SEASONAL, TimeSeries.RESIDUAL),
        decomposed.names());
    for (Map.Entry<String, TimeSeries> entry : decomposed) {
      assertArrayEquals(new long[] {1, 2, 3, 4, 5}, entry.getValue().getTimestamps().toLongArray());
    }
    assertArrayEquals(new double[] {150, 150, 150, 150, 150},
        decomposed.get(TimeSeries.TREND).getValues().toDoubleArray(), DELTA);
    assertArrayEquals(new double[] {-50, 50, -50, 50, -50},
        decomposed.get(TimeSeries.SEASONAL).getValues().toDoubleArray(), DELTA);
    assertArrayEquals(new double[] {0, 0, 0, 0, 0},
        decomposed.get(TimeSeries.RESIDUAL).getValues().toDoubleArray(), DELTA);
  }

  @Test
  public void testDecompositionIsAdditive() {
    Random random = new Random(17);
    long[] x = new long[36];
    double[] y = new double[36];
    for (int i = 0; i < x.length; i++) {
      x[i] = 1000L * i;
      y[i] = 20 + 0.3 * i + 5 * Math.sin(2 * Math.PI * i / 12) + random.nextGaussian();
    }
    TimeSeries series = TimeSeries.of(x, y, 12);
    for (boolean periodic : new boolean[] {false, true}) {
      TimeSeriesGroup decomposed = series.decompose(periodic);
      double[] trend = decomposed.get(TimeSeries.TREND).getValues().toDoubleArray();
      double[] seasonal = decomposed.get(TimeSeries.SEASONAL).getValues().toDoubleArray();
      double[] residual = decomposed.get(TimeSeries.RESIDUAL).getValues().toDoubleArray();
      for (int i = 0; i < y.length; i++) {
        assertEquals(y[i], trend[i] + seasonal[i] + residual[i], DELTA);
      }
      double cycleSum = 0;
      for (int i = 0; i < 12; i++) {
        cycleSum += seasonal[i];
      }
      assertEquals(0, cycleSum, DELTA);
    }
  }

  @Test
  public void testResultsAreSnapshots() {
    TimeSeries series = TimeSeries.of(alternating, 2);
    TimeSeries trend = series.decompose().get(TimeSeries.TREND);
    assertNotSame(series, trend);
    assertArrayEquals(new double[] {100, 200, 100, 200, 100}, series.getValues().toDoubleArray(), DELTA);
    try {
      trend.getValues().set(0, 1.0);
      fail("component values are writable");
    } catch (UnsupportedOperationException expected) {
      // read-only view
    }
  }
}
