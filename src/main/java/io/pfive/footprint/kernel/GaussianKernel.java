// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.kernel;

import static com.google.common.base.Preconditions.checkArgument;

/// A square-celled, odd-dimensioned matrix of weights summing to one, centered on the middle cell.
/// Weights are stored flat in row-major order: row r (offset r - halfHeight cells in latitude)
/// starts at index r * nCols.
public final class GaussianKernel {

    private final double sigma;
    private final int nCols;
    private final int nRows;
    private final double[] weights;

    GaussianKernel (double sigma, int nCols, int nRows, double[] weights) {
        checkArgument(nCols % 2 == 1 && nRows % 2 == 1, "Kernel dimensions must be odd.");
        checkArgument(weights.length == nCols * nRows, "Kernel weights do not match dimensions.");
        this.sigma = sigma;
        this.nCols = nCols;
        this.nRows = nRows;
        this.weights = weights;
    }

    public double sigma () {
        return sigma;
    }

    public int nCols () {
        return nCols;
    }

    public int nRows () {
        return nRows;
    }

    public int halfWidth () {
        return (nCols - 1) / 2;
    }

    public int halfHeight () {
        return (nRows - 1) / 2;
    }

    public double weight (int row, int col) {
        return weights[row * nCols + col];
    }

    /// Direct access to the backing array for the scatter loop. Callers must not modify it.
    public double[] weights () {
        return weights;
    }

    public double sum () {
        double sum = 0;
        for (double w : weights) sum += w;
        return sum;
    }

    @Override
    public String toString () {
        return String.format("GaussianKernel(sigma=%.5f, %dx%d)", sigma, nCols, nRows);
    }
}
