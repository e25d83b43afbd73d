// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// Disjoint bands of time before release, within which resampled weights are rescaled to match the
/// recorded weights. Resampling onto the canonical time grid changes how densely each stretch of a
/// trajectory is represented, which would otherwise bias the total influence.
///
/// Each epoch is closed on the side nearer to release: with boundaries (10, 20, 100) the epochs
/// are |t| <= 10, 10 < |t| <= 20 and 20 < |t| <= 100. Samples older than the last boundary belong to
/// no epoch and are never rescaled.
public final class MassEpochs {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final double[] DEFAULT_BOUNDARIES_MINUTES = {10, 20, 100};

    private final double[] boundariesMinutes;

    public MassEpochs (double[] boundariesMinutes) {
        checkArgument(boundariesMinutes.length > 0, "At least one epoch boundary is required.");
        for (int i = 0; i < boundariesMinutes.length; i++) {
            checkArgument(boundariesMinutes[i] > 0, "Epoch boundaries must be positive.");
            checkArgument(i == 0 || boundariesMinutes[i] > boundariesMinutes[i - 1],
                  "Epoch boundaries must be strictly increasing.");
        }
        this.boundariesMinutes = boundariesMinutes.clone();
    }

    /// Epochs ending 10, 20 and 100 minutes before release.
    public static MassEpochs standard () {
        return new MassEpochs(DEFAULT_BOUNDARIES_MINUTES);
    }

    public double[] boundariesMinutes () {
        return boundariesMinutes.clone();
    }

    /// @return the epoch containing the given (non-positive) time, or -1 if it is older than the
    /// last boundary.
    public int epochOf (double time) {
        double minutesBefore = -time;
        for (int e = 0; e < boundariesMinutes.length; e++) {
            if (minutesBefore <= boundariesMinutes[e]) return e;
        }
        return -1;
    }

    public double[] sums (List<ParticleSample> samples) {
        double[] sums = new double[boundariesMinutes.length];
        for (ParticleSample s : samples) {
            int e = epochOf(s.time());
            if (e >= 0) sums[e] += s.weight();
        }
        return sums;
    }

    /// Factor by which to multiply resampled weights in each epoch so their sum equals the recorded
    /// sum. An epoch with no recorded or no resampled weight gets a factor of zero rather than NaN.
    public double[] scales (double[] rawSums, double[] resampledSums) {
        double[] scales = new double[boundariesMinutes.length];
        for (int e = 0; e < scales.length; e++) {
            if (rawSums[e] > 0 && resampledSums[e] > 0) {
                scales[e] = rawSums[e] / resampledSums[e];
            } else {
                if (rawSums[e] != resampledSums[e]) {
                    LOG.debug("Epoch {} has recorded weight {} and resampled weight {}, scaling to zero.",
                          e, rawSums[e], resampledSums[e]);
                }
                scales[e] = 0;
            }
        }
        return scales;
    }

    @Override
    public String toString () {
        return "MassEpochs" + Arrays.toString(boundariesMinutes);
    }
}
