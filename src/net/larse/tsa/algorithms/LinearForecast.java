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
package net.larse.tsa.algorithms;

import com.google.common.base.Preconditions;

import net.larse.tsa.helper.AlgorithmBase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forecasts by extending the least squares trend of the history to the future
 * times. With fewer points than the configured order needs, the order is
 * lowered until the fit is determined.
 */
public final class LinearForecast implements Forecaster {
  private static final Logger LOG = LoggerFactory.getLogger(LinearForecast.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Order of the trend polynomial that is extrapolated.")
    @Optional
    public int order = PolynomialTrend.LINEAR;
  }

  private final Args args;

  public LinearForecast() {
    this(new Args());
  }

  public LinearForecast(Args args) {
    Preconditions.checkArgument(args.order >= 0, "order must not be negative, got %s", args.order);
    this.args = args;
  }

  @Override
  public double[] forecast(double[] x, double[] y, int frequency, double[] futureX) {
    Preconditions.checkArgument(x.length == y.length, "x and y differ in length");
    if (y.length == 0) {
      throw new ArithmeticException("Cannot forecast from an empty history");
    }
    int order = Math.min(args.order, y.length - 1);
    if (order < args.order) {
      LOG.debug("Lowered trend order from {} to {} for {} points", args.order, order, y.length);
    }
    return new PolynomialTrend(order).fit(x, y).values(futureX);
  }
}
