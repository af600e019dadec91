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

/**
 * A model that is fitted to the full history of a series and projects it forward.
 */
public interface Forecaster {
  /**
   * Fits the model to the observations and returns one value per future time.
   *
   * @param x observation times, ascending
   * @param y observed values, aligned with x
   * @param frequency observations per seasonal cycle, or a value below 1 when
   *     the series has no known periodicity
   * @param futureX the times to forecast, ascending and after the last of x
   * @return futureX.length finite values
   */
  double[] forecast(double[] x, double[] y, int frequency, double[] futureX);
}
