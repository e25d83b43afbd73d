// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.kernel;

import io.pfive.footprint.grid.GridSpec;
import io.pfive.footprint.grid.Wgs84Bounds;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// Turns the particle spread at each time step into a Gaussian smoothing kernel on the footprint
/// grid. The standard deviation in degrees is the particle spread divided by an empirical
/// calibration constant, widened in longitude by 1/cos(latitude), plus a floor of a fraction of a
/// cell so that even perfectly clustered particles are smoothed a little. Kernels are truncated at
/// a fixed number of standard deviations and renormalized so no influence is lost.
public class KernelGenerator {

    public static final double DEFAULT_CALIBRATION = 40;
    public static final double DEFAULT_FLOOR_DIVISOR = 8;
    public static final double DEFAULT_TRUNCATION_SIGMAS = 3;

    private final double xRes;
    private final double yRes;
    private final double maxRes;
    private final double calibration;
    private final double floorDivisor;
    private final double truncationSigmas;

    public KernelGenerator (GridSpec grid, double calibration, double floorDivisor, double truncationSigmas) {
        checkArgument(calibration > 0, "Bandwidth calibration must be positive.");
        checkArgument(floorDivisor > 0, "Bandwidth floor divisor must be positive.");
        checkArgument(truncationSigmas > 0, "Kernel truncation must be positive.");
        this.xRes = grid.xRes();
        this.yRes = grid.yRes();
        this.maxRes = grid.maxRes();
        this.calibration = calibration;
        this.floorDivisor = floorDivisor;
        this.truncationSigmas = truncationSigmas;
    }

    public double bandwidth (double distance, double lat) {
        return distance * Wgs84Bounds.xScale(lat) / calibration + maxRes / floorDivisor;
    }

    public GaussianKernel kernelFor (Spread spread) {
        return kernel(bandwidth(spread.distance(), spread.meanLat()));
    }

    /// Evaluates the isotropic Gaussian density at the center of every cell within the truncation
    /// radius, with the center cell at offset zero.
    public GaussianKernel kernel (double sigma) {
        checkArgument(sigma > 0 && Double.isFinite(sigma), "Kernel bandwidth must be positive and finite.");
        double reach = truncationSigmas * sigma;
        int halfWidth = (int) Math.floor(reach / xRes);
        int halfHeight = (int) Math.floor(reach / yRes);
        int nCols = 1 + 2 * halfWidth;
        int nRows = 1 + 2 * halfHeight;
        double[] weights = new double[nCols * nRows];
        double twoSigmaSquared = 2 * sigma * sigma;
        double norm = 1 / (Math.PI * twoSigmaSquared);
        double sum = 0;
        for (int r = 0; r < nRows; r++) {
            double dy = (r - halfHeight) * yRes;
            for (int c = 0; c < nCols; c++) {
                double dx = (c - halfWidth) * xRes;
                double w = norm * Math.exp(-(dx * dx + dy * dy) / twoSigmaSquared);
                weights[r * nCols + c] = w;
                sum += w;
            }
        }
        for (int i = 0; i < weights.length; i++) weights[i] /= sum;
        return new GaussianKernel(sigma, nCols, nRows, weights);
    }

    /// The kernel for the largest spread at the lowest mean latitude seen in this computation.
    /// Its half-widths set the halo around the grid.
    public GaussianKernel haloKernel (List<Spread> spreads) {
        checkArgument(!spreads.isEmpty(), "At least one time step is needed to size the halo.");
        double maxDistance = 0;
        double minLat = Double.POSITIVE_INFINITY;
        for (Spread spread : spreads) {
            maxDistance = Math.max(maxDistance, spread.distance());
            minLat = Math.min(minLat, spread.meanLat());
        }
        return kernel(bandwidth(maxDistance, minLat));
    }

}
