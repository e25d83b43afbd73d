// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.scatter;

import io.pfive.footprint.grid.GridSpec;
import io.pfive.footprint.grid.HaloGrid;
import io.pfive.footprint.trajectory.TimeStep;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OccupiedCellsTest {

    private static final HaloGrid GRID = new HaloGrid(new GridSpec(0, 4, 1, 0, 4, 1), 2, 1);

    @Test
    void particlesInTheSameCellAreSummed () {
        TimeStep step = new TimeStep(-7,
              new double[] {0.2, 0.8, 3.5, 0.5},
              new double[] {0.2, 0.9, 3.5, 0.1},
              new double[] {1, 2, 4, 8});
        OccupiedCells cells = OccupiedCells.of(step, GRID);
        assertThat(cells.tenths()).isEqualTo(-7);
        assertThat(cells.size()).isEqualTo(2);
        int first = GRID.flatIndex(2, 1);
        int last = GRID.flatIndex(5, 4);
        assertThat(cells.flatIndexes()).containsExactly(first, last);
        assertThat(cells.weights()).containsExactly(11, 4);
    }

    @Test
    void pointsOnTheMaximumEdgeStayInTheLastCell () {
        TimeStep step = new TimeStep(0, new double[] {4}, new double[] {4}, new double[] {1});
        OccupiedCells cells = OccupiedCells.of(step, GRID);
        assertThat(cells.flatIndexes()).containsExactly(GRID.flatIndex(5, 4));
    }

    @Test
    void pointsBeyondThePaddedGridAreSkipped () {
        TimeStep step = new TimeStep(0, new double[] {-10}, new double[] {2}, new double[] {1});
        assertThat(OccupiedCells.of(step, GRID).isEmpty()).isTrue();
    }

}
