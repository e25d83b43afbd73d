// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MassEpochsTest {

    private final MassEpochs epochs = MassEpochs.standard();

    @Test
    void epochsAreClosedTowardRelease () {
        assertThat(epochs.epochOf(0)).isEqualTo(0);
        assertThat(epochs.epochOf(-10)).isEqualTo(0);
        assertThat(epochs.epochOf(-10.1)).isEqualTo(1);
        assertThat(epochs.epochOf(-20)).isEqualTo(1);
        assertThat(epochs.epochOf(-20.5)).isEqualTo(2);
        assertThat(epochs.epochOf(-100)).isEqualTo(2);
        assertThat(epochs.epochOf(-100.5)).isEqualTo(-1);
    }

    @Test
    void sumsIgnoreSamplesOlderThanLastEpoch () {
        List<ParticleSample> samples = List.of(
              new ParticleSample(1, 0, 0, 0, 1),
              new ParticleSample(1, -15, 0, 0, 2),
              new ParticleSample(1, -50, 0, 0, 4),
              new ParticleSample(1, -150, 0, 0, 8)
        );
        assertThat(epochs.sums(samples)).containsExactly(1, 2, 4);
    }

    @Test
    void emptyEpochsScaleToZero () {
        double[] scales = epochs.scales(new double[] {2, 0, 3}, new double[] {4, 5, 0});
        assertThat(scales).containsExactly(0.5, 0, 0);
    }

    @Test
    void boundariesMustIncrease () {
        assertThatThrownBy(() -> new MassEpochs(new double[] {10, 10}))
              .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MassEpochs(new double[0]))
              .isInstanceOf(IllegalArgumentException.class);
    }

}
