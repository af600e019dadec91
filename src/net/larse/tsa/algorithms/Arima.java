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
import com.google.common.primitives.Ints;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import net.larse.tsa.helper.AlgorithmBase;
import net.larse.tsa.helper.ArrayHelper;
import net.larse.tsa.helper.LinearLeastSquares;
import net.larse.tsa.helper.SimplexMinimizer;

import org.apache.commons.math.analysis.MultivariateRealFunction;
import org.apache.commons.math.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Autoregressive integrated moving average forecasting with automatic order
 * selection.
 *
 * <p>The series is differenced while differencing lowers its variance: once at
 * the seasonal lag when a frequency is known and at least two cycles are
 * present, then up to {@code maxD} times at lag one. An ARMA(p, q) model is
 * fitted to every order in the search grid by conditional sum of squares and
 * the order with the lowest AIC is kept. Forecasts of the differenced series
 * are integrated back to the original scale.
 *
 * <p>Fitting works on the standardized differenced series so that the
 * intercept and the coefficients share one scale in the simplex search.
 */
public final class Arima implements Forecaster {
  private static final Logger LOG = LoggerFactory.getLogger(Arima.class);

  // shortest series left after differencing
  private static final int MIN_LENGTH = 3;

  // the stationarity test below only covers polynomials up to order two
  private static final int MAX_ORDER = 2;

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Largest autoregressive order searched, at most 2.")
    @Optional
    public int maxP = 2;

    @Doc(help = "Largest moving average order searched, at most 2.")
    @Optional
    public int maxQ = 2;

    @Doc(help = "Largest number of ordinary (lag one) differences.")
    @Optional
    public int maxD = 1;

    @Doc(help = "Whether a seasonal difference is considered when the frequency is known.")
    @Optional
    public boolean seasonalDifferencing = true;

    @Doc(help = "Maximum objective evaluations per fitted order.")
    @Optional
    public int maxEvaluations = 5000;

    @Doc(help = "Convergence tolerance of the parameter search.")
    @Optional
    public double tolerance = 1e-10;
  }

  private final Args args;
  private final SimplexMinimizer minimizer;

  public Arima() {
    this(new Args());
  }

  public Arima(Args args) {
    Preconditions.checkArgument(args.maxP >= 0 && args.maxP <= MAX_ORDER,
        "maxP must be in [0, %s], got %s", MAX_ORDER, args.maxP);
    Preconditions.checkArgument(args.maxQ >= 0 && args.maxQ <= MAX_ORDER,
        "maxQ must be in [0, %s], got %s", MAX_ORDER, args.maxQ);
    Preconditions.checkArgument(args.maxD >= 0, "maxD must not be negative, got %s", args.maxD);
    this.args = args;
    this.minimizer = new SimplexMinimizer(args.maxEvaluations, args.tolerance, 0.1);
  }

  @Override
  public double[] forecast(double[] x, double[] y, int frequency, double[] futureX) {
    Preconditions.checkArgument(x.length == y.length, "x and y differ in length");
    return fit(y, frequency).forecast(futureX.length);
  }

  /**
   * Selects and fits a model for the observations.
   *
   * @param frequency observations per cycle, below 2 for none
   * @throws ArithmeticException if y is empty
   */
  public Fit fit(double[] y, int frequency) {
    if (y.length == 0) {
      throw new ArithmeticException("Cannot fit an ARIMA model to an empty series");
    }
    LOG.debug("Fitting ARIMA to {} points, frequency {}, {}", y.length, frequency, args);

    List<double[]> levels = new ArrayList<>();
    IntArrayList lags = new IntArrayList();
    double[] w = y;

    if (args.seasonalDifferencing && frequency >= 2) {
      if (w.length >= 2 * frequency && w.length - frequency >= MIN_LENGTH) {
        double[] diff = ArrayHelper.difference(w, frequency);
        if (StatUtils.variance(diff) < StatUtils.variance(w)) {
          levels.add(w);
          lags.add(frequency);
          w = diff;
        }
      } else {
        LOG.debug("{} points do not cover two cycles of {}, no seasonal difference",
            w.length, frequency);
      }
    }
    for (int d = 0; d < args.maxD && w.length - 1 >= MIN_LENGTH; d++) {
      double[] diff = ArrayHelper.difference(w, 1);
      if (StatUtils.variance(diff) >= StatUtils.variance(w)) {
        break;
      }
      levels.add(w);
      lags.add(1);
      w = diff;
    }

    Model model = selectModel(w, lags.size() <= 1);
    Fit fit = new Fit(model, w, levels, lags.toIntArray());
    LOG.debug("Selected {}", fit);
    return fit;
  }

  private Model selectModel(double[] w, boolean includeMean) {
    double mean = StatUtils.mean(w);
    double sd = Math.sqrt(StatUtils.variance(w));
    if (w.length < 2 || !(sd > 0)) {
      // nothing left to explain, the series is constant
      Model flat = new Model(0, 0, false, new double[0], mean, 1.0);
      flat.aic = Double.NEGATIVE_INFINITY;
      return flat;
    }
    double[] z = new double[w.length];
    for (int i = 0; i < w.length; i++) {
      z[i] = (w[i] - mean) / sd;
    }

    Model best = null;
    for (int p = 0; p <= args.maxP; p++) {
      for (int q = 0; q <= args.maxQ; q++) {
        int k = p + q + (includeMean ? 1 : 0);
        int nEff = z.length - p;
        if (nEff < k + 1) {
          continue;
        }
        Model candidate;
        try {
          candidate = fitOrder(z, p, q, includeMean, mean, sd);
        } catch (ArithmeticException e) {
          LOG.debug("Dropped ARMA({}, {}): {}", p, q, e.getMessage());
          continue;
        }
        if (best == null || candidate.aic < best.aic - 1e-9) {
          best = candidate;
        }
      }
    }
    // ARMA(0, 0) is solved in closed form, so the grid never comes back empty
    assert best != null;
    return best;
  }

  private Model fitOrder(double[] z, int p, int q, boolean includeMean, double mean, double sd) {
    Model model = new Model(p, q, includeMean, null, mean, sd);
    int numParams = p + q + (includeMean ? 1 : 0);
    if (p == 0 && q == 0) {
      // the intercept of a standardized series is its mean, zero
      model.params = new double[numParams];
    } else {
      final Model trial = model;
      MultivariateRealFunction objective = new MultivariateRealFunction() {
        @Override
        public double value(double[] params) {
          if (!trial.isAdmissible(params)) {
            return SimplexMinimizer.PENALTY;
          }
          double sse = trial.conditionalSumOfSquares(z, params, null);
          return Double.isNaN(sse) || Double.isInfinite(sse) ? SimplexMinimizer.PENALTY : sse;
        }
      };
      double[] optimum = minimizer.minimize(objective, startingValues(z, model));
      model.params = Arrays.copyOf(optimum, numParams);
      if (!model.isAdmissible(model.params)) {
        throw new ArithmeticException("no admissible parameters found");
      }
    }
    double sse = model.conditionalSumOfSquares(z, model.params, null) * sd * sd;
    int nEff = z.length - p;
    model.aic = nEff * Math.log(Math.max(sse / nEff, Double.MIN_NORMAL)) + 2.0 * (numParams + 1);
    return model;
  }

  /**
   * Starting point for the search: autoregressive coefficients from a least
   * squares regression on the lagged values, moving average terms at zero.
   */
  private static double[] startingValues(double[] z, Model model) {
    int offset = model.includeMean ? 1 : 0;
    double[] start = new double[offset + model.p + model.q];
    if (model.p == 0) {
      return start;
    }
    LinearLeastSquares lls = new LinearLeastSquares(offset + model.p);
    double[] row = new double[offset + model.p];
    for (int t = model.p; t < z.length; t++) {
      if (model.includeMean) {
        row[0] = 1.0;
      }
      for (int i = 1; i <= model.p; i++) {
        row[offset + i - 1] = z[t - i];
      }
      lls.addInput(row, 0, z[t]);
    }
    double[] solution = lls.getSolution();
    if (solution != null && ArrayHelper.allFinite(solution)) {
      System.arraycopy(solution, 0, start, 0, solution.length);
    }
    if (!model.isAdmissible(start)) {
      Arrays.fill(start, 0);
    }
    return start;
  }

  /** ARMA(p, q) on the standardized differenced series. */
  static final class Model {
    final int p;
    final int q;
    final boolean includeMean;
    final double mean;
    final double sd;
    // intercept (if any), then p autoregressive, then q moving average coefficients
    double[] params;
    double aic;

    Model(int p, int q, boolean includeMean, double[] params, double mean, double sd) {
      this.p = p;
      this.q = q;
      this.includeMean = includeMean;
      this.params = params;
      this.mean = mean;
      this.sd = sd;
    }

    private int offset() {
      return includeMean ? 1 : 0;
    }

    /** Stationary autoregressive part and invertible moving average part. */
    boolean isAdmissible(double[] params) {
      int offset = offset();
      double a1 = p > 0 ? params[offset] : 0;
      double a2 = p > 1 ? params[offset + 1] : 0;
      double m1 = q > 0 ? -params[offset + p] : 0;
      double m2 = q > 1 ? -params[offset + p + 1] : 0;
      return insideUnitTriangle(a1, a2) && insideUnitTriangle(m1, m2);
    }

    // roots of 1 - a1 z - a2 z^2 lie outside the unit circle
    private static boolean insideUnitTriangle(double a1, double a2) {
      return Math.abs(a2) < 1 && a1 + a2 < 1 && a2 - a1 < 1;
    }

    /**
     * Sum of squared one step errors from t = p on, with errors before p taken
     * as zero. Stores the errors in residuals when it is not null.
     */
    double conditionalSumOfSquares(double[] z, double[] params, double[] residuals) {
      int offset = offset();
      double c = includeMean ? params[0] : 0;
      double[] e = residuals != null ? residuals : new double[z.length];
      double sse = 0;
      for (int t = p; t < z.length; t++) {
        double pred = c;
        for (int i = 1; i <= p; i++) {
          pred += params[offset + i - 1] * z[t - i];
        }
        for (int j = 1; j <= q && t - j >= 0; j++) {
          pred += params[offset + p + j - 1] * e[t - j];
        }
        e[t] = z[t] - pred;
        sse += e[t] * e[t];
      }
      return sse;
    }

    /** Forecasts of the differenced series, in its own units. */
    double[] forecast(double[] w, int steps) {
      int n = w.length;
      double[] z = new double[n + steps];
      for (int i = 0; i < n; i++) {
        z[i] = (w[i] - mean) / sd;
      }
      double[] e = new double[n + steps];
      conditionalSumOfSquares(Arrays.copyOf(z, n), params, e);
      int offset = offset();
      double c = includeMean ? params[0] : 0;
      double[] result = new double[steps];
      for (int h = 0; h < steps; h++) {
        int t = n + h;
        double pred = c;
        for (int i = 1; i <= p; i++) {
          pred += params[offset + i - 1] * z[t - i];
        }
        for (int j = 1; j <= q; j++) {
          pred += params[offset + p + j - 1] * e[t - j];
        }
        z[t] = pred;
        result[h] = mean + sd * pred;
      }
      return result;
    }
  }

  /** A fitted model together with the differencing that produced its input. */
  public static final class Fit {
    private final Model model;
    private final double[] differenced;
    private final List<double[]> levels;
    private final int[] lags;

    private Fit(Model model, double[] differenced, List<double[]> levels, int[] lags) {
      this.model = model;
      this.differenced = differenced;
      this.levels = levels;
      this.lags = lags;
    }

    public int getP() {
      return model.p;
    }

    public int getQ() {
      return model.q;
    }

    /** Number of lag one differences. */
    public int getD() {
      int d = 0;
      for (int lag : lags) {
        if (lag == 1) {
          d++;
        }
      }
      return d;
    }

    /** Number of seasonal differences, zero or one. */
    public int getSeasonalD() {
      return lags.length - getD();
    }

    public double getAic() {
      return model.aic;
    }

    public double[] forecast(int steps) {
      Preconditions.checkArgument(steps > 0, "steps must be positive, got %s", steps);
      double[] values = model.forecast(differenced, steps);
      for (int i = lags.length - 1; i >= 0; i--) {
        values = ArrayHelper.integrate(levels.get(i), values, lags[i]);
      }
      return values;
    }

    @Override
    public String toString() {
      return String.format("ARIMA(%d, %d, %d) seasonal differences %d, lags %s, aic %.4f",
          getP(), getD(), getQ(), getSeasonalD(), Ints.join(",", lags), getAic());
    }
  }
}
