/*
 * Copyright (c) 2015 TSA Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsa.timeseries;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;

import net.larse.tsa.algorithms.ForecastMethod;
import net.larse.tsa.algorithms.Forecaster;
import net.larse.tsa.algorithms.PolynomialTrend;
import net.larse.tsa.helper.ArrayHelper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * An immutable series of observations ordered by timestamp, with an optional
 * seasonal frequency (observations per cycle).
 *
 * <p>Series are built from a list of points or a timestamp to value map; either
 * way the points are sorted by timestamp and timestamps must be distinct.
 * Timestamps are milliseconds since the epoch wherever they are read as
 * calendar dates.
 *
 * <p>Trend, decomposition and forecast results are new series that share no
 * state with this one.
 */
public final class TimeSeries implements Iterable<DataPoint> {
  private static final Logger LOG = LoggerFactory.getLogger(TimeSeries.class);

  public static final int LINEAR = PolynomialTrend.LINEAR;
  public static final int QUADRATIC = PolynomialTrend.QUADRATIC;
  public static final int CUBIC = PolynomialTrend.CUBIC;

  /** Keys of the decomposition result. */
  public static final String TREND = "trend";
  public static final String SEASONAL = "seasonal";
  public static final String RESIDUAL = "residual";

  private static final int NO_FREQUENCY = 0;

  private final long[] x;
  private final double[] y;
  private final int frequency;

  private TimeSeries(long[] x, double[] y, int frequency) {
    this.x = x;
    this.y = y;
    this.frequency = frequency;
  }

  public static TimeSeries of(List<DataPoint> points) {
    return create(points, NO_FREQUENCY);
  }

  public static TimeSeries of(List<DataPoint> points, int frequency) {
    return create(points, checkFrequency(frequency));
  }

  public static TimeSeries of(Map<Long, ? extends Number> points) {
    return create(toPoints(points), NO_FREQUENCY);
  }

  public static TimeSeries of(Map<Long, ? extends Number> points, int frequency) {
    return create(toPoints(points), checkFrequency(frequency));
  }

  public static TimeSeries of(long[] x, double[] y) {
    return create(toPoints(x, y), NO_FREQUENCY);
  }

  public static TimeSeries of(long[] x, double[] y, int frequency) {
    return create(toPoints(x, y), checkFrequency(frequency));
  }

  private static int checkFrequency(int frequency) {
    Preconditions.checkArgument(frequency > 0, "frequency must be positive, got %s", frequency);
    return frequency;
  }

  private static List<DataPoint> toPoints(Map<Long, ? extends Number> points) {
    Preconditions.checkNotNull(points, "points");
    List<DataPoint> list = new ArrayList<>(points.size());
    for (Map.Entry<Long, ? extends Number> entry : points.entrySet()) {
      Preconditions.checkNotNull(entry.getKey(), "null timestamp");
      Preconditions.checkNotNull(entry.getValue(), "null value at %s", entry.getKey());
      list.add(new DataPoint(entry.getKey(), entry.getValue().doubleValue()));
    }
    return list;
  }

  private static List<DataPoint> toPoints(long[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length,
        "x and y differ in length: %s != %s", x.length, y.length);
    List<DataPoint> list = new ArrayList<>(x.length);
    for (int i = 0; i < x.length; i++) {
      list.add(new DataPoint(x[i], y[i]));
    }
    return list;
  }

  private static TimeSeries create(List<DataPoint> points, int frequency) {
    Preconditions.checkNotNull(points, "points");
    List<DataPoint> sorted = new ArrayList<>(points);
    for (DataPoint point : sorted) {
      Preconditions.checkNotNull(point, "null point");
    }
    sorted.sort(Comparator.comparingLong(DataPoint::getTimestamp));
    long[] x = new long[sorted.size()];
    double[] y = new double[sorted.size()];
    for (int i = 0; i < x.length; i++) {
      x[i] = sorted.get(i).getTimestamp();
      y[i] = sorted.get(i).getValue();
      if (i > 0 && x[i] == x[i - 1]) {
        throw new IllegalArgumentException("Duplicate timestamp " + x[i]);
      }
    }
    return new TimeSeries(x, y, frequency);
  }

  /** Number of observations. */
  public int size() {
    return x.length;
  }

  public boolean isEmpty() {
    return x.length == 0;
  }

  /** The timestamps in ascending order. */
  public LongList getX() {
    return LongLists.unmodifiable(LongArrayList.wrap(x));
  }

  /** The values, aligned with {@link #getX()}. */
  public DoubleList getY() {
    return DoubleLists.unmodifiable(DoubleArrayList.wrap(y));
  }

  public LongList getTimestamps() {
    return getX();
  }

  public DoubleList getValues() {
    return getY();
  }

  /** The timestamps as local date-times in the system time zone. */
  public List<LocalDateTime> getDates() {
    return getDates(ZoneId.systemDefault());
  }

  /**
   * The timestamps as local date-times in the given zone. Timestamps are read
   * as milliseconds and truncated to whole seconds.
   */
  public List<LocalDateTime> getDates(ZoneId zone) {
    Preconditions.checkNotNull(zone, "zone");
    List<LocalDateTime> dates = new ArrayList<>(x.length);
    for (long timestamp : x) {
      dates.add(LocalDateTime.ofInstant(Instant.ofEpochSecond(Math.floorDiv(timestamp, 1000L)), zone));
    }
    return dates;
  }

  /**
   * The spacing of the first two timestamps, taken to hold for the whole
   * series. Empty with fewer than two observations.
   */
  public OptionalLong getInterval() {
    return x.length < 2 ? OptionalLong.empty() : OptionalLong.of(x[1] - x[0]);
  }

  public OptionalInt getFrequency() {
    return frequency == NO_FREQUENCY ? OptionalInt.empty() : OptionalInt.of(frequency);
  }

  @Override
  public Iterator<DataPoint> iterator() {
    return new AbstractIterator<DataPoint>() {
      private int next;

      @Override
      protected DataPoint computeNext() {
        return next < x.length ? new DataPoint(x[next], y[next++]) : endOfData();
      }
    };
  }

  /** The least squares line at the observation timestamps. */
  public TimeSeries trend() {
    return trend(LINEAR);
  }

  /**
   * The least squares polynomial of the given order evaluated at the
   * observation timestamps. Needs at least {@code order + 1} observations.
   */
  public TimeSeries trend(int order) {
    double[] times = timesAsDoubles(x);
    double[] fitted = new PolynomialTrend(order).fit(times, y).values(times);
    return new TimeSeries(x.clone(), fitted, frequency);
  }

  public TimeSeriesGroup decompose() {
    return decompose(false);
  }

  /**
   * Additive decomposition into the {@link #TREND}, {@link #SEASONAL} and
   * {@link #RESIDUAL} series, all at this series' timestamps.
   *
   * @param periodic estimate the seasonal pattern from a single cycle, for
   *     series whose pattern repeats exactly
   * @throws IllegalArgumentException if the series has no frequency
   */
  public TimeSeriesGroup decompose(boolean periodic) {
    Preconditions.checkArgument(frequency != NO_FREQUENCY,
        "decomposition requires a series with a frequency");
    SeasonalDecomposition decomposition = new SeasonalDecomposition(y, frequency, periodic);
    Map<String, TimeSeries> components = new LinkedHashMap<>();
    components.put(TREND, new TimeSeries(x.clone(), decomposition.getTrend(), frequency));
    components.put(SEASONAL, new TimeSeries(x.clone(), decomposition.getSeasonal(), frequency));
    components.put(RESIDUAL, new TimeSeries(x.clone(), decomposition.getResidual(), frequency));
    return new TimeSeriesGroup(components);
  }

  /** Extends the least squares line by the given number of steps. */
  public TimeSeries forecast(int steps) {
    return forecast(steps, ForecastMethod.LINEAR);
  }

  /**
   * Forecasts with the method of the given name.
   *
   * @throws IllegalArgumentException if no method has that name
   */
  public TimeSeries forecast(int steps, String method) {
    return forecast(steps, ForecastMethod.fromName(method));
  }

  public TimeSeries forecast(int steps, ForecastMethod method) {
    Preconditions.checkNotNull(method, "method");
    return forecast(steps, method.newForecaster());
  }

  /**
   * Forecasts {@code steps} values after the last observation. The forecast
   * timestamps continue from the last timestamp by the series interval.
   *
   * @throws ArithmeticException if the series is empty, whatever the steps, or
   *     has a single observation and so no interval to step by
   * @throws IllegalArgumentException if steps is not positive
   */
  public TimeSeries forecast(int steps, Forecaster forecaster) {
    Preconditions.checkNotNull(forecaster, "forecaster");
    if (x.length == 0) {
      throw new ArithmeticException("Cannot forecast an empty series");
    }
    Preconditions.checkArgument(steps > 0, "steps must be positive, got %s", steps);
    OptionalLong interval = getInterval();
    if (!interval.isPresent()) {
      throw new ArithmeticException("Cannot forecast a single observation, the interval is unknown");
    }

    long[] futureX = new long[steps];
    long last = x[x.length - 1];
    for (int h = 0; h < steps; h++) {
      last += interval.getAsLong();
      futureX[h] = last;
    }

    double[] values = forecaster.forecast(timesAsDoubles(x), y.clone(), frequency,
        timesAsDoubles(futureX));
    if (values.length != steps || !ArrayHelper.allFinite(values)) {
      throw new ArithmeticException(forecaster.getClass().getSimpleName()
          + " did not produce " + steps + " finite values");
    }
    LOG.debug("Forecast {} steps from {} points with {}", steps, x.length,
        forecaster.getClass().getSimpleName());
    return new TimeSeries(futureX, values, frequency);
  }

  private static double[] timesAsDoubles(long[] times) {
    double[] result = new double[times.length];
    for (int i = 0; i < times.length; i++) {
      result[i] = times[i];
    }
    return result;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("size", x.length)
        .add("first", x.length > 0 ? x[0] : null)
        .add("last", x.length > 0 ? x[x.length - 1] : null)
        .add("frequency", frequency == NO_FREQUENCY ? null : frequency)
        .toString();
  }
}
