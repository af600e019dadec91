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

package net.larse.tsa.helper;

import com.google.common.base.Preconditions;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.MultivariateRealFunction;
import org.apache.commons.math.optimization.GoalType;
import org.apache.commons.math.optimization.RealPointValuePair;
import org.apache.commons.math.optimization.SimpleScalarValueChecker;
import org.apache.commons.math.optimization.direct.NelderMead;

import java.util.Arrays;

/**
 * Minimizes an objective over unconstrained parameters with the Nelder-Mead
 * simplex. Constraints are left to the objective, either by reparameterizing
 * or by returning {@link #PENALTY} outside the feasible region.
 */
public class SimplexMinimizer {
  /** Objective value for infeasible parameters. */
  public static final double PENALTY = 1e100;

  private final int maxEvaluations;
  private final double tolerance;
  private final double initialStep;

  public SimplexMinimizer(int maxEvaluations, double tolerance, double initialStep) {
    Preconditions.checkArgument(maxEvaluations > 0, "maxEvaluations must be positive");
    Preconditions.checkArgument(tolerance > 0, "tolerance must be positive");
    Preconditions.checkArgument(initialStep > 0, "initialStep must be positive");
    this.maxEvaluations = maxEvaluations;
    this.tolerance = tolerance;
    this.initialStep = initialStep;
  }

  /**
   * Returns the minimizing point, with the objective value at that point appended
   * as the last element.
   *
   * @throws ArithmeticException if the simplex does not converge
   */
  public double[] minimize(MultivariateRealFunction objective, double[] start) {
    Preconditions.checkArgument(start.length >= 1, "nothing to minimize");
    NelderMead optimizer = new NelderMead();
    double[] steps = new double[start.length];
    Arrays.fill(steps, initialStep);
    optimizer.setStartConfiguration(steps);
    optimizer.setMaxEvaluations(maxEvaluations);
    optimizer.setConvergenceChecker(new SimpleScalarValueChecker(tolerance, tolerance));

    RealPointValuePair optimum;
    try {
      optimum = optimizer.optimize(objective, GoalType.MINIMIZE, start);
    } catch (MathException e) {
      ArithmeticException failure =
          new ArithmeticException("Simplex minimization failed: " + e.getMessage());
      failure.initCause(e);
      throw failure;
    }

    double[] point = optimum.getPoint();
    double[] result = Arrays.copyOf(point, point.length + 1);
    result[point.length] = optimum.getValue();
    return result;
  }
}
