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
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.SimplexMinimizer;

import org.apache.commons.math.analysis.MultivariateRealFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Exponential smoothing with additive errors.
 *
 * <p>The candidate models are simple smoothing (A,N,N) and Holt's linear trend
 * (A,A,N), plus their additive seasonal forms (A,N,A) and (A,A,A) when the
 * frequency is at least 2 and two full cycles are observed. Without a usable
 * frequency the seasonal forms are not considered. The smoothing parameters
 * of each candidate minimize the sum of squared one step errors and the model
 * with the lowest AIC is kept.
 *
 * <p>States are initialized from the data: the level from the first
 * observation (the mean of the first cycle for seasonal models), the slope
 * from the first difference (the difference of the first two cycle means),
 * and the seasonal indices from the first cycle less its mean.
 */
public final class Ets implements Forecaster {
  private static final Logger LOG = LoggerFactory.getLogger(Ets.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Whether models with a slope term are considered.")
    @Optional
    public boolean allowTrend = true;

    @Doc(help = "Maximum objective evaluations per candidate model.")
    @Optional
    public int maxEvaluations = 5000;

    @Doc(help = "Convergence tolerance of the smoothing parameter search.")
    @Optional
    public double tolerance = 1e-10;
  }

  /** The smoothing model forms. */
  public enum Kind {
    SIMPLE(false, false),
    HOLT(true, false),
    SEASONAL(false, true),
    HOLT_WINTERS(true, true);

    final boolean trend;
    final boolean seasonal;

    Kind(boolean trend, boolean seasonal) {
      this.trend = trend;
      this.seasonal = seasonal;
    }

    int numSmoothingParams() {
      return 1 + (trend ? 1 : 0) + (seasonal ? 1 : 0);
    }
  }

  private final Args args;
  private final SimplexMinimizer minimizer;

  public Ets() {
    this(new Args());
  }

  public Ets(Args args) {
    this.args = args;
    this.minimizer = new SimplexMinimizer(args.maxEvaluations, args.tolerance, 0.5);
  }

  @Override
  public double[] forecast(double[] x, double[] y, int frequency, double[] futureX) {
    Preconditions.checkArgument(x.length == y.length, "x and y differ in length");
    return fit(y, frequency).forecast(futureX.length);
  }

  /**
   * Selects and fits a smoothing model.
   *
   * @param frequency observations per cycle, below 2 for none
   * @throws ArithmeticException if y is empty
   */
  public Fit fit(double[] y, int frequency) {
    if (y.length == 0) {
      throw new ArithmeticException("Cannot fit a smoothing model to an empty series");
    }
    LOG.debug("Fitting ETS to {} points, frequency {}, {}", y.length, frequency, args);
    if (y.length == 1) {
      Fit flat = new Fit(Kind.SIMPLE, 1, new double[] {1.0}, y);
      flat.aic = Double.NEGATIVE_INFINITY;
      return flat;
    }

    boolean seasonal = frequency >= 2 && y.length >= 2 * frequency;
    if (frequency >= 2 && !seasonal) {
      LOG.debug("{} points do not cover two cycles of {}, using non-seasonal models",
          y.length, frequency);
    }

    Fit best = null;
    ArithmeticException failure = null;
    for (Kind kind : Kind.values()) {
      if ((kind.seasonal && !seasonal) || (kind.trend && !args.allowTrend)) {
        continue;
      }
      int period = kind.seasonal ? frequency : 1;
      // one step errors are scored from the first observation after the initial states
      int start = kind.seasonal ? period : 1;
      int numErrors = y.length - start;
      int numParams = kind.numSmoothingParams() + 1 + (kind.trend ? 1 : 0)
          + (kind.seasonal ? period - 1 : 0);
      if (numErrors < 1 || (kind != Kind.SIMPLE && numErrors <= numParams)) {
        continue;
      }
      Fit candidate;
      try {
        candidate = fitKind(kind, period, y);
      } catch (ArithmeticException e) {
        LOG.debug("Dropped {}: {}", kind, e.getMessage());
        failure = e;
        continue;
      }
      candidate.aic = numErrors * Math.log(Math.max(candidate.sse / numErrors, Double.MIN_NORMAL))
          + 2.0 * (numParams + 1);
      if (best == null || candidate.aic < best.aic - 1e-9) {
        best = candidate;
      }
    }
    if (best == null) {
      throw failure != null ? failure : new ArithmeticException("No smoothing model could be fitted");
    }
    LOG.debug("Selected {}", best);
    return best;
  }

  private Fit fitKind(Kind kind, int period, double[] y) {
    MultivariateRealFunction objective = new MultivariateRealFunction() {
      @Override
      public double value(double[] u) {
        double sse = new Fit(kind, period, toSmoothing(kind, u), y).sse;
        return Double.isNaN(sse) || Double.isInfinite(sse) ? SimplexMinimizer.PENALTY : sse;
      }
    };
    double[] start = new double[kind.numSmoothingParams()];
    // alpha 0.5, beta 0.1 of alpha, gamma 0.1 of what alpha leaves
    start[0] = 0.0;
    int next = 1;
    if (kind.trend) {
      start[next++] = ArrayHelper.logit(0.1);
    }
    if (kind.seasonal) {
      start[next] = ArrayHelper.logit(0.1);
    }
    double[] optimum = minimizer.minimize(objective, start);
    Fit fit = new Fit(kind, period, toSmoothing(kind, Arrays.copyOf(optimum, start.length)), y);
    LOG.debug("{} smoothing {} sse {}", kind, Arrays.toString(fit.smoothing), fit.sse);
    return fit;
  }

  /**
   * Maps unconstrained search coordinates to smoothing parameters with
   * 0 < beta < alpha < 1 and 0 < gamma < 1 - alpha.
   */
  static double[] toSmoothing(Kind kind, double[] u) {
    double[] smoothing = new double[u.length];
    double alpha = ArrayHelper.logistic(u[0]);
    smoothing[0] = alpha;
    int next = 1;
    if (kind.trend) {
      smoothing[next] = alpha * ArrayHelper.logistic(u[next]);
      next++;
    }
    if (kind.seasonal) {
      smoothing[next] = (1 - alpha) * ArrayHelper.logistic(u[next]);
    }
    return smoothing;
  }

  /** A smoothing model run over the history, holding its final states. */
  public static final class Fit {
    private final Kind kind;
    private final int period;
    private final double[] smoothing;
    private final int n;
    private double level;
    private double slope;
    // indexed by observation index modulo period
    private final double[] season;
    private double sse;
    private double aic;

    Fit(Kind kind, int period, double[] smoothing, double[] y) {
      this.kind = kind;
      this.period = period;
      this.smoothing = smoothing;
      this.n = y.length;
      this.season = new double[period];
      run(y);
    }

    private void run(double[] y) {
      double alpha = smoothing[0];
      double beta = kind.trend ? smoothing[1] : 0;
      double gamma = kind.seasonal ? smoothing[kind.trend ? 2 : 1] : 0;

      int start;
      if (kind.seasonal) {
        double first = 0;
        for (int i = 0; i < period; i++) {
          first += y[i];
        }
        first /= period;
        for (int i = 0; i < period; i++) {
          season[i] = y[i] - first;
        }
        if (kind.trend) {
          double second = 0;
          for (int i = period; i < 2 * period; i++) {
            second += y[i];
          }
          second /= period;
          slope = (second - first) / period;
        }
        // level at the end of the first cycle
        level = first + slope * (period - 1) / 2.0;
        start = period;
      } else {
        level = y[0];
        slope = kind.trend && y.length > 1 ? y[1] - y[0] : 0;
        start = 1;
      }

      sse = 0;
      for (int t = start; t < y.length; t++) {
        double s = season[t % period];
        double error = y[t] - (level + slope + s);
        sse += error * error;
        double previous = level;
        level = alpha * (y[t] - s) + (1 - alpha) * (level + slope);
        if (kind.trend) {
          slope = beta * (level - previous) + (1 - beta) * slope;
        }
        if (kind.seasonal) {
          season[t % period] = gamma * (y[t] - level) + (1 - gamma) * s;
        }
      }
    }

    public Kind getKind() {
      return kind;
    }

    /** alpha, then beta and gamma where the model has them. */
    public double[] getSmoothing() {
      return smoothing.clone();
    }

    public double getSse() {
      return sse;
    }

    public double getAic() {
      return aic;
    }

    public double[] forecast(int steps) {
      Preconditions.checkArgument(steps > 0, "steps must be positive, got %s", steps);
      double[] result = new double[steps];
      for (int h = 1; h <= steps; h++) {
        result[h - 1] = level + h * slope + season[(n - 1 + h) % period];
      }
      return result;
    }

    @Override
    public String toString() {
      return String.format("ETS %s period %d smoothing %s aic %.4f",
          kind, period, Arrays.toString(smoothing), aic);
    }
  }
}
