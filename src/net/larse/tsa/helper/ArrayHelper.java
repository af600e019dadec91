package net.larse.tsa.helper;

import com.google.common.base.Preconditions;

/** Static array manipulation functions. */
public class ArrayHelper {
  private ArrayHelper() {}

  /**
   * Lagged differences, {@code y[i + lag] - y[i]}. The result is {@code lag}
   * entries shorter than the input.
   */
  public static double[] difference(double[] y, int lag) {
    Preconditions.checkArgument(lag >= 1, "lag must be positive, got %s", lag);
    Preconditions.checkArgument(y.length > lag,
        "cannot difference %s values at lag %s", y.length, lag);
    double[] diff = new double[y.length - lag];
    for (int i = 0; i < diff.length; i++) {
      diff[i] = y[i + lag] - y[i];
    }
    return diff;
  }

  /**
   * Inverse of {@link #difference} for values following the end of history:
   * given forecasts of the lagged differences, rebuilds forecasts of the
   * undifferenced series from the last {@code lag} values of history.
   */
  public static double[] integrate(double[] history, double[] diffForecast, int lag) {
    Preconditions.checkArgument(history.length >= lag,
        "need %s values of history, got %s", lag, history.length);
    double[] result = new double[diffForecast.length];
    for (int h = 0; h < diffForecast.length; h++) {
      double base = h < lag ? history[history.length - lag + h] : result[h - lag];
      result[h] = base + diffForecast[h];
    }
    return result;
  }

  /** Maps the real line onto (0, 1). */
  public static double logistic(double u) {
    return 1.0 / (1.0 + Math.exp(-u));
  }

  /** Inverse of {@link #logistic}; p must lie in (0, 1). */
  public static double logit(double p) {
    return Math.log(p / (1.0 - p));
  }

  /** Returns true if every entry is a finite number. */
  public static boolean allFinite(double[] array) {
    for (double v : array) {
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        return false;
      }
    }
    return true;
  }
}
