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

import net.larse.tsa.helper.FitGenerator;

import org.apache.commons.math.stat.regression.SimpleRegression;

/**
 * Least squares polynomial trend {@code f(x) = c0 + c1 t + ... + ck t^k}.
 *
 * <p>The abscissae are mapped to {@code t = (x - center) / scale} so that the
 * fitted range lies in [-1, 1]; millisecond timestamps raised to a power would
 * otherwise swamp the normal equations.
 *
 * <p>A polynomial of order k needs at least k + 1 points. Order 1 is solved in
 * closed form from the sums of x, y, xy and x^2; higher orders go through a
 * Vandermonde design matrix.
 */
public final class PolynomialTrend {
  public static final int CONSTANT = 0;
  public static final int LINEAR = 1;
  public static final int QUADRATIC = 2;
  public static final int CUBIC = 3;

  private final int order;

  private double center;
  private double scale = 1.0;
  private double[] coefficients;

  public PolynomialTrend(int order) {
    Preconditions.checkArgument(order >= 0, "order must not be negative, got %s", order);
    this.order = order;
  }

  public int getOrder() {
    return order;
  }

  /** The fewest points a fit of this order accepts. */
  public int minimumPoints() {
    return order + 1;
  }

  /**
   * Fits the polynomial to (x, y).
   *
   * @throws IllegalArgumentException if there are fewer than {@link #minimumPoints()} points
   * @throws ArithmeticException if the x values cannot determine the coefficients
   */
  public PolynomialTrend fit(double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length,
        "x and y differ in length: %s != %s", x.length, y.length);
    Preconditions.checkArgument(x.length >= minimumPoints(),
        "a trend of order %s needs at least %s points, got %s",
        order, minimumPoints(), x.length);

    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double xi : x) {
      min = Math.min(min, xi);
      max = Math.max(max, xi);
    }
    center = (min + max) / 2;
    scale = max > min ? (max - min) / 2 : 1.0;

    if (order == LINEAR) {
      coefficients = fitLine(x, y);
    } else {
      coefficients = fitPolynomial(x, y);
    }
    return this;
  }

  private double[] fitLine(double[] x, double[] y) {
    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < x.length; i++) {
      regression.addData(normalize(x[i]), y[i]);
    }
    double slope = regression.getSlope();
    if (Double.isNaN(slope)) {
      throw new ArithmeticException("Cannot fit a line through a single distinct x value");
    }
    return new double[] {regression.getIntercept(), slope};
  }

  private double[] fitPolynomial(double[] x, double[] y) {
    FitGenerator generator = new FitGenerator();
    generator.init(order + 1, x.length);
    for (int i = 0; i < x.length; i++) {
      double t = normalize(x[i]);
      double power = 1.0;
      for (int k = 0; k <= order; k++) {
        generator.setObservation(i, k, power);
        power *= t;
      }
      generator.setTarget(i, y[i]);
    }
    return generator.linearFit();
  }

  private double normalize(double x) {
    return (x - center) / scale;
  }

  /** Evaluates the fitted polynomial at x. */
  public double value(double x) {
    Preconditions.checkState(coefficients != null, "fit() has not been called");
    double t = normalize(x);
    // Horner
    double result = 0;
    for (int k = coefficients.length - 1; k >= 0; k--) {
      result = result * t + coefficients[k];
    }
    return result;
  }

  public double[] values(double[] x) {
    double[] result = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      result[i] = value(x[i]);
    }
    return result;
  }
}
