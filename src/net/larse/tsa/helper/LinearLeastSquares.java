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

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

/**
 * Computes a linear regression of one dependent variable via the normal
 * equations, accumulated one observation at a time.
 */
public class LinearLeastSquares {
  public final int numX;

  private int numInputs;
  // the lower-left triangle of transpose(X) * X, row by row
  private final double[] xSums;
  // transpose(X) * y
  private final double[] ySums;

  private DenseMatrix64F xMat;
  private DenseMatrix64F yMat;
  private LinearSolver<DenseMatrix64F> solver;

  /**
   * Creates a solver for a regression with numX independent variables. An
   * intercept, when wanted, is passed as a constant 1 in the observations.
   */
  public LinearLeastSquares(int numX) {
    Preconditions.checkArgument(numX >= 1, "numX must be positive, got %s", numX);
    this.numX = numX;
    this.xSums = new double[numX * (numX + 1) / 2];
    this.ySums = new double[numX];
  }

  // With X holding one observation per row,
  //    xMat = transpose(X) * X,  xMat[i, j] = sum(x_i * x_j)
  //    yMat = transpose(X) * y,  yMat[i]    = sum(x_i * y)
  // and the coefficients R solve xMat * R = yMat. xMat is symmetric so only
  // one triangle is accumulated.

  /** Adds one observation, using numX values from x starting at xStart. */
  public void addInput(double[] x, int xStart, double y) {
    ++numInputs;
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      double xi = x[xStart + i];
      for (int i2 = 0; i2 <= i; ++i2) {
        xSums[pos++] += xi * x[xStart + i2];
      }
      ySums[i] += xi * y;
    }
    assert pos == xSums.length;
  }

  /**
   * Solves for the coefficients. Returns null if there are fewer inputs than
   * coefficients or the normal equations are not positive definite.
   */
  public double[] getSolution() {
    if (numInputs < numX) {
      return null;
    }
    if (xMat == null) {
      xMat = new DenseMatrix64F(numX, numX);
      solver = LinearSolverFactory.symmPosDef(numX);
    }
    int pos = 0;
    for (int i = 0; i < numX; ++i) {
      for (int i2 = 0; i2 <= i; ++i2) {
        double sum = xSums[pos++];
        xMat.unsafe_set(i, i2, sum);
        if (i != i2) {
          xMat.unsafe_set(i2, i, sum);
        }
      }
    }
    yMat = DenseMatrix64F.wrap(numX, 1, ySums.clone());
    if (!solver.setA(xMat) || solver.quality() <= 0) {
      return null;
    }
    DenseMatrix64F results = new DenseMatrix64F(numX, 1);
    solver.solve(yMat, results);
    return results.getData();
  }
}
