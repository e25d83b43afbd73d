// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.kernel;

import io.pfive.footprint.trajectory.TimeStep;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BandwidthEstimatorTest {

    private final BandwidthEstimator estimator =
          new BandwidthEstimator(BandwidthEstimator.DEFAULT_ITERATIONS, BandwidthEstimator.DEFAULT_SAMPLE_SIZE);

    private static TimeStep randomStep (int n, long seed) {
        Random random = new Random(seed);
        double[] lon = new double[n];
        double[] lat = new double[n];
        double[] weight = new double[n];
        for (int i = 0; i < n; i++) {
            lon[i] = -112 + random.nextGaussian();
            lat[i] = 40 + random.nextGaussian();
            weight[i] = 1;
        }
        return new TimeStep(-15, lon, lat, weight);
    }

    @Test
    void meanOverAllPairsIncludingRepeatedDraws () {
        double[] x = {0, 3, 0};
        double[] y = {0, 4, 0};
        assertThat(BandwidthEstimator.meanPairwiseDistance(x, y, new int[] {0, 1, 2}))
              .isCloseTo(10.0 / 3, within(1e-12));
        assertThat(BandwidthEstimator.meanPairwiseDistance(x, y, new int[] {1, 1})).isZero();
    }

    @Test
    void singleParticleHasZeroSpread () {
        TimeStep step = new TimeStep(-3, new double[] {5}, new double[] {45}, new double[] {1});
        Spread spread = estimator.estimate(step, new SplittableRandom(1));
        assertThat(spread.distance()).isZero();
        assertThat(spread.meanLat()).isEqualTo(45.0);
        assertThat(spread.tenths()).isEqualTo(-3);
    }

    @Test
    void coincidentParticlesHaveZeroSpread () {
        TimeStep step = new TimeStep(0, new double[] {1, 1, 1}, new double[] {2, 2, 2}, new double[] {1, 1, 1});
        assertThat(estimator.estimate(step, new SplittableRandom(1)).distance()).isZero();
    }

    @Test
    void sameSeedGivesSameEstimate () {
        TimeStep step = randomStep(500, 3);
        Spread a = estimator.estimate(step, new SplittableRandom(99));
        Spread b = estimator.estimate(step, new SplittableRandom(99));
        assertThat(a).isEqualTo(b);
    }

    @Test
    void estimateApproachesTheFullPairwiseMean () {
        TimeStep step = randomStep(200, 5);
        int[] all = new int[step.size()];
        for (int i = 0; i < all.length; i++) all[i] = i;
        double exact = BandwidthEstimator.meanPairwiseDistance(step.lon(), step.lat(), all);
        // Large bootstrap so the estimate is tight. Unit normal scatter gives a mean distance near sqrt(pi).
        BandwidthEstimator thorough = new BandwidthEstimator(200, 50);
        double estimate = thorough.estimate(step, new SplittableRandom(7)).distance();
        assertThat(estimate).isCloseTo(exact, within(0.05 * exact));
        assertThat(exact).isBetween(1.4, 2.2);
    }

    @Test
    void meanLatitudeIsUnweighted () {
        TimeStep step = new TimeStep(0, new double[] {0, 0}, new double[] {10, 20}, new double[] {1, 100});
        assertThat(estimator.estimate(step, new SplittableRandom(1)).meanLat()).isEqualTo(15.0);
    }

    @Test
    void rejectsDegenerateBootstrapSettings () {
        assertThatThrownBy(() -> new BandwidthEstimator(0, 50)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BandwidthEstimator(4, 1)).isInstanceOf(IllegalArgumentException.class);
    }

}
