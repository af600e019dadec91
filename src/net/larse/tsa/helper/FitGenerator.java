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
 * A wrapper for OLS fitting of a design matrix with one target column.
 *
 * <p>Call {@link #init}, fill every row with {@link #setObservation} and
 * {@link #setTarget}, then {@link #linearFit}.
 */
public class FitGenerator {
  private int numCols;
  private int numRows;

  private DenseMatrix64F matrixA;
  private DenseMatrix64F matrixB;

  public void init(int numCols, int numRows) {
    Preconditions.checkArgument(numCols >= 1, "need at least one column, got %s", numCols);
    Preconditions.checkArgument(numRows >= numCols,
        "need at least %s observations for %s coefficients, got %s", numCols, numCols, numRows);
    this.numCols = numCols;
    this.numRows = numRows;
    matrixA = new DenseMatrix64F(numRows, numCols);
    matrixB = new DenseMatrix64F(numRows, 1);
  }

  public void setObservation(int idx, int feature, double value) {
    matrixA.set(idx, feature, value);
  }

  public void setTarget(int idx, double target) {
    matrixB.set(idx, 0, target);
  }

  /**
   * Solves the least squares problem and returns the coefficients, one per column.
   *
   * @throws ArithmeticException if the design matrix is rank deficient
   */
  public double[] linearFit() {
    Preconditions.checkState(matrixA != null, "init() has not been called");
    DenseMatrix64F matrixX = new DenseMatrix64F(numCols, 1);
    LinearSolver<DenseMatrix64F> solver =
        LinearSolverFactory.leastSquares(matrixA.getNumRows(), matrixA.getNumCols());
    // the solver may modify its input
    if (!solver.setA(matrixA.copy()) || solver.quality() <= 1e-12) {
      throw new ArithmeticException("Design matrix is singular, cannot fit "
          + numCols + " coefficients to " + numRows + " observations");
    }
    solver.solve(matrixB, matrixX);
    return matrixX.getData();
  }
}
