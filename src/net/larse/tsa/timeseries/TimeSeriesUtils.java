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

import com.google.common.base.Preconditions;

import org.apache.commons.math.stat.StatUtils;

import java.util.Arrays;

/**
 * Smoothing and cycle helpers for additive seasonal decomposition.
 */
public final class TimeSeriesUtils {
  private TimeSeriesUtils() {}

  /**
   * Centered moving average sized to the seasonal period.
   *
   * <p>An odd period averages {@code period} values centered on each position.
   * An even period uses the 2 x period average: {@code period + 1} values with
   * half weight on the two ends, so the window stays centered.
   *
   * <p>The first and last {@code period / 2} positions have no full window and
   * take the nearest centered estimate. When no position has a full window the
   * mean of the series is used everywhere.
   */
  public static double[] movingAverage(double[] y, int period) {
    Preconditions.checkArgument(period >= 1, "period must be positive, got %s", period);
    int n = y.length;
    double[] trend = new double[n];
    if (n == 0) {
      return trend;
    }
    int half = period / 2;
    int first = half;
    int last = n - 1 - half;
    if (first > last) {
      Arrays.fill(trend, StatUtils.mean(y));
      return trend;
    }
    boolean even = period % 2 == 0;
    for (int i = first; i <= last; i++) {
      double sum = 0;
      if (even) {
        sum += 0.5 * y[i - half] + 0.5 * y[i + half];
        for (int j = i - half + 1; j < i + half; j++) {
          sum += y[j];
        }
      } else {
        for (int j = i - half; j <= i + half; j++) {
          sum += y[j];
        }
      }
      trend[i] = sum / period;
    }
    for (int i = 0; i < first; i++) {
      trend[i] = trend[first];
    }
    for (int i = last + 1; i < n; i++) {
      trend[i] = trend[last];
    }
    return trend;
  }

  /**
   * Mean of the values at each phase ({@code index mod period}) over the
   * positions start to end (inclusive), shifted so the phase means sum to zero.
   * A phase with no position in that range is averaged over the whole series
   * instead; a phase without any observation gets zero before the shift.
   */
  public static double[] phaseMeans(double[] values, int period, int start, int end) {
    Preconditions.checkArgument(period >= 1, "period must be positive, got %s", period);
    double[] sums = new double[period];
    int[] counts = new int[period];
    for (int i = Math.max(0, start); i <= Math.min(end, values.length - 1); i++) {
      sums[i % period] += values[i];
      counts[i % period]++;
    }
    for (int phase = 0; phase < period; phase++) {
      if (counts[phase] == 0) {
        for (int i = phase; i < values.length; i += period) {
          sums[phase] += values[i];
          counts[phase]++;
        }
      }
      sums[phase] = counts[phase] == 0 ? 0 : sums[phase] / counts[phase];
    }
    return center(sums);
  }

  /**
   * The {@code period} consecutive values starting at {@code start}, arranged by
   * phase and shifted to zero mean. The start moves back to 0 if the series
   * ends before a full cycle; phases still missing get zero.
   */
  public static double[] cycleDeviations(double[] values, int period, int start) {
    Preconditions.checkArgument(period >= 1, "period must be positive, got %s", period);
    if (start + period > values.length) {
      start = 0;
    }
    double[] cycle = new double[period];
    int end = Math.min(values.length, start + period);
    for (int i = start; i < end; i++) {
      cycle[i % period] = values[i];
    }
    return center(cycle);
  }

  /** Repeats the per-phase values over n positions. */
  public static double[] broadcast(double[] byPhase, int n) {
    double[] result = new double[n];
    for (int i = 0; i < n; i++) {
      result[i] = byPhase[i % byPhase.length];
    }
    return result;
  }

  private static double[] center(double[] values) {
    double mean = StatUtils.mean(values);
    for (int i = 0; i < values.length; i++) {
      values[i] -= mean;
    }
    return values;
  }
}
