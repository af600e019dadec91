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

import java.util.Locale;

/** The forecasting model families a series can be projected with. */
public enum ForecastMethod {
  /** Extrapolation of the least squares trend line. */
  LINEAR("linear"),
  /** Autoregressive integrated moving average, see {@link Arima}. */
  ARIMA("arima"),
  /** Exponential smoothing, see {@link Ets}. */
  ETS("ets");

  private final String label;

  ForecastMethod(String label) {
    this.label = label;
  }

  public String getName() {
    return label;
  }

  /** Returns a forecaster of this family with default arguments. */
  public Forecaster newForecaster() {
    switch (this) {
      case ARIMA:
        return new Arima();
      case ETS:
        return new Ets();
      case LINEAR:
      default:
        return new LinearForecast();
    }
  }

  /**
   * Looks a method up by name, ignoring case.
   *
   * @throws IllegalArgumentException if no method has that name
   */
  public static ForecastMethod fromName(String name) {
    Preconditions.checkNotNull(name, "method name");
    String key = name.trim().toLowerCase(Locale.ROOT);
    for (ForecastMethod method : values()) {
      if (method.label.equals(key)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unknown forecast method: " + name);
  }
}
