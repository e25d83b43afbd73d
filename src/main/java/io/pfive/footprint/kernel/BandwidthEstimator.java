// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.kernel;

import io.pfive.footprint.trajectory.TimeStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.SplittableRandom;

import static com.google.common.base.Preconditions.checkArgument;

/// Estimates how widely particles are dispersed at each time step. Computing all pairwise distances
/// is quadratic in the number of particles, so instead we average the mean pairwise distance over a
/// few small subsamples drawn with replacement. Duplicate draws contribute zero-length pairs, exactly
/// as they would in a bootstrap of the full distance matrix.
///
/// Instances hold no mutable state and may be shared between threads. Each call must receive its
/// own random source.
public class BandwidthEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final int DEFAULT_ITERATIONS = 4;
    public static final int DEFAULT_SAMPLE_SIZE = 50;

    private final int iterations;
    private final int sampleSize;

    public BandwidthEstimator (int iterations, int sampleSize) {
        checkArgument(iterations > 0, "Bootstrap iterations must be positive.");
        checkArgument(sampleSize >= 2, "Bootstrap sample size must be at least two.");
        this.iterations = iterations;
        this.sampleSize = sampleSize;
    }

    /// A time step with fewer than two particles has no pairwise distance. It is reported as zero
    /// distance, which leaves only the resolution-based floor in the kernel bandwidth.
    public Spread estimate (TimeStep step, SplittableRandom random) {
        double meanLat = mean(step.lat());
        int n = step.size();
        if (n < 2) {
            LOG.debug("Time step {} has {} particles, using zero spread.", step.minutes(), n);
            return new Spread(step.tenths(), 0, meanLat);
        }
        int size = Math.min(sampleSize, n);
        int[] draw = new int[size];
        double total = 0;
        for (int i = 0; i < iterations; i++) {
            for (int k = 0; k < size; k++) draw[k] = random.nextInt(n);
            total += meanPairwiseDistance(step.lon(), step.lat(), draw);
        }
        return new Spread(step.tenths(), total / iterations, meanLat);
    }

    /// Mean Euclidean distance in degrees over all unordered pairs of the drawn points.
    static double meanPairwiseDistance (double[] x, double[] y, int[] draw) {
        double sum = 0;
        long nPairs = 0;
        for (int a = 0; a < draw.length; a++) {
            double xa = x[draw[a]];
            double ya = y[draw[a]];
            for (int b = a + 1; b < draw.length; b++) {
                double dx = xa - x[draw[b]];
                double dy = ya - y[draw[b]];
                sum += Math.sqrt(dx * dx + dy * dy);
                nPairs += 1;
            }
        }
        return sum / nPairs;
    }

    private static double mean (double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

}
