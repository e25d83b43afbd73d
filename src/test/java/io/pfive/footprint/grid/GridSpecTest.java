// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.grid;

import io.pfive.footprint.exception.InputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GridSpecTest {

    @Test
    void rejectsNonPositiveResolution () {
        assertThatThrownBy(() -> new GridSpec(0, 1, 0, 0, 1, 0.1))
              .isInstanceOf(InputException.class)
              .hasMessageContaining("x resolution");
        assertThatThrownBy(() -> new GridSpec(0, 1, 0.1, 0, 1, -0.1))
              .isInstanceOf(InputException.class)
              .hasMessageContaining("y resolution");
    }

    @Test
    void rejectsInvertedOrEmptyBounds () {
        assertThatThrownBy(() -> new GridSpec(1, 0, 0.1, 0, 1, 0.1)).isInstanceOf(InputException.class);
        assertThatThrownBy(() -> new GridSpec(0, 1, 0.1, 2, 2, 0.1)).isInstanceOf(InputException.class);
        assertThatThrownBy(() -> new GridSpec(Double.NaN, 1, 0.1, 0, 1, 0.1)).isInstanceOf(InputException.class);
    }

    @Test
    void cellCountsTolerateRoundingInTheExtent () {
        GridSpec world = new GridSpec(-180, 180, 0.1, -90, 90, 0.1);
        assertThat(world.nCellsWide()).isEqualTo(3600);
        assertThat(world.nCellsHigh()).isEqualTo(1800);
        GridSpec partial = new GridSpec(0, 1.05, 0.1, 0, 1, 0.25);
        assertThat(partial.nCellsWide()).isEqualTo(11);
        assertThat(partial.nCellsHigh()).isEqualTo(4);
    }

    @Test
    void cellCentersAreOffsetByHalfACell () {
        GridSpec grid = new GridSpec(-10, 10, 0.5, 0, 5, 0.25);
        assertThat(grid.centerLonForX(0)).isCloseTo(-9.75, within(1e-12));
        assertThat(grid.centerLatForY(19)).isCloseTo(4.875, within(1e-12));
        assertThat(grid.nElements()).isEqualTo(40 * 20);
    }

    @Test
    void boundsAreInclusive () {
        GridSpec grid = new GridSpec(-1, 1, 0.1, 40, 42, 0.1);
        assertThat(grid.contains(-1, 40)).isTrue();
        assertThat(grid.contains(1, 42)).isTrue();
        assertThat(grid.contains(1.0000001, 41)).isFalse();
        assertThat(grid.contains(0, 39.9999999)).isFalse();
    }

    @Test
    void subdivideDoublesCellsPerAxis () {
        GridSpec grid = new GridSpec(-2, 2, 0.2, -1, 1, 0.2);
        GridSpec fine = grid.subdivide(2);
        assertThat(fine.nCellsWide()).isEqualTo(2 * grid.nCellsWide());
        assertThat(fine.nCellsHigh()).isEqualTo(2 * grid.nCellsHigh());
        assertThat(fine.cellEnvelope().getMaxX()).isCloseTo(grid.cellEnvelope().getMaxX(), within(1e-12));
        assertThat(fine.cellEnvelope().getMaxY()).isCloseTo(grid.cellEnvelope().getMaxY(), within(1e-12));
    }

    @Test
    void cellEnvelopeCoversWholeCells () {
        GridSpec ragged = new GridSpec(10, 12.5, 1, -5, -4, 0.25);
        assertThat(ragged.cellEnvelope().getMinX()).isEqualTo(10.0);
        assertThat(ragged.cellEnvelope().getMaxX()).isEqualTo(13.0);
        assertThat(ragged.cellEnvelope().getMinY()).isEqualTo(-5.0);
        assertThat(ragged.cellEnvelope().getMaxY()).isEqualTo(-4.0);
    }

}
