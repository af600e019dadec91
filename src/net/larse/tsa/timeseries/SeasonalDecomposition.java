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

/**
 * Classical additive decomposition of a periodic series into trend, seasonal
 * and residual components, {@code y = trend + seasonal + residual}.
 *
 * <p>The trend is a centered moving average over one period (see
 * {@link TimeSeriesUtils#movingAverage}). The seasonal component is estimated
 * from the detrended series where the moving average has a full window,
 * either as the mean of each phase over those positions or, for a strictly
 * periodic pattern, from a single cycle: the first one that starts at the
 * first full window. Both are centered to sum to zero over a cycle, and they
 * agree on a series of exactly repeating cycles. The residual is whatever
 * remains.
 *
 * <p>Results are only meaningful for series of at least two periods.
 */
public class SeasonalDecomposition {
  private final double[] y;
  private final int period;
  private final boolean periodic;

  private double[] trend;
  private double[] seasonal;
  private double[] residual;

  public SeasonalDecomposition(double[] y, int period) {
    this(y, period, false);
  }

  public SeasonalDecomposition(double[] y, int period, boolean periodic) {
    Preconditions.checkArgument(period >= 1, "period must be positive, got %s", period);
    this.y = y.clone();
    this.period = period;
    this.periodic = periodic;
  }

  public double[] getTrend() {
    decompose();
    return trend.clone();
  }

  public double[] getSeasonal() {
    decompose();
    return seasonal.clone();
  }

  public double[] getResidual() {
    decompose();
    return residual.clone();
  }

  private void decompose() {
    if (trend != null) {
      return;
    }
    int n = y.length;
    double[] smoothed = TimeSeriesUtils.movingAverage(y, period);

    double[] detrended = new double[n];
    for (int i = 0; i < n; i++) {
      detrended[i] = y[i] - smoothed[i];
    }

    // the boundary trend is extrapolated, so only full windows inform the season
    int first = period / 2;
    double[] byPhase = periodic
        ? TimeSeriesUtils.cycleDeviations(detrended, period, first)
        : TimeSeriesUtils.phaseMeans(detrended, period, first, n - 1 - first);
    double[] season = TimeSeriesUtils.broadcast(byPhase, n);

    double[] remainder = new double[n];
    for (int i = 0; i < n; i++) {
      remainder[i] = y[i] - smoothed[i] - season[i];
    }

    seasonal = season;
    residual = remainder;
    trend = smoothed;
  }
}
