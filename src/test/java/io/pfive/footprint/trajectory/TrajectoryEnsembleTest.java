// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

import io.pfive.footprint.exception.InputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrajectoryEnsembleTest {

    @Test
    void countsDistinctTrajectories () {
        TrajectoryEnsemble ensemble = new TrajectoryEnsemble.Builder()
              .add(7, 0, 1, 2, 1)
              .add(7, -1, 1.5, 2.5, 1)
              .add(3, 0, -1, 0, 0)
              .build();
        assertThat(ensemble.nSamples()).isEqualTo(3);
        assertThat(ensemble.nTrajectories()).isEqualTo(2);
        assertThat(TrajectoryEnsemble.sortedIds(ensemble.byTrajectory())).containsExactly(3, 7);
        assertThat(ensemble.byTrajectory().get(7)).hasSize(2);
    }

    @Test
    void rejectsTimesTooOldToHoldInTenthsOfAMinute () {
        assertThatThrownBy(() -> new TrajectoryEnsemble.Builder().add(1, -3e8, 0, 0, 1).build())
              .isInstanceOf(InputException.class)
              .hasMessageContaining("too old");
        TrajectoryEnsemble oldest = new TrajectoryEnsemble.Builder().add(1, -2e8, 0, 0, 1).build();
        assertThat(oldest.samples().get(0).timeTenths()).isEqualTo(-2_000_000_000);
    }

    @Test
    void rejectsEmptyEnsembles () {
        assertThatThrownBy(() -> TrajectoryEnsemble.of(List.of()))
              .isInstanceOf(InputException.class)
              .hasMessageContaining("no particle samples");
    }

    @Test
    void rejectsSamplesThatCannotComeFromBackwardTrajectories () {
        assertThatThrownBy(() -> new TrajectoryEnsemble.Builder().add(1, 0.5, 0, 0, 1).build())
              .isInstanceOf(InputException.class);
        assertThatThrownBy(() -> new TrajectoryEnsemble.Builder().add(1, 0, 0, 0, -1).build())
              .isInstanceOf(InputException.class);
        assertThatThrownBy(() -> new TrajectoryEnsemble.Builder().add(1, 0, Double.NaN, 0, 1).build())
              .isInstanceOf(InputException.class);
    }

    @Test
    void samplesAreUnmodifiable () {
        TrajectoryEnsemble ensemble = new TrajectoryEnsemble.Builder().add(1, 0, 0, 0, 1).build();
        assertThatThrownBy(() -> ensemble.samples().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

}
