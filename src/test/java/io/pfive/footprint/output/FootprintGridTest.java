// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.output;

import io.pfive.footprint.grid.GridSpec;
import io.pfive.footprint.grid.HaloGrid;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FootprintGridTest {

    private static final GridSpec GRID = new GridSpec(10, 13, 1, 40, 42, 1);

    @Test
    void valuesAreIndexedFromTheSouthWestCorner () {
        FootprintGrid footprint = new FootprintGrid(GRID, 5, new double[] {1, 2, 3, 4, 5, 6});
        assertThat(footprint.nCellsWide()).isEqualTo(3);
        assertThat(footprint.nCellsHigh()).isEqualTo(2);
        assertThat(footprint.value(0, 0)).isEqualTo(1.0);
        assertThat(footprint.value(2, 1)).isEqualTo(6.0);
        assertThat(footprint.centerLonForX(2)).isEqualTo(12.5);
        assertThat(footprint.centerLatForY(1)).isEqualTo(41.5);
        assertThat(footprint.total()).isEqualTo(21.0);
        assertThat(footprint.max()).isEqualTo(6.0);
        assertThat(footprint.argMax()).isEqualTo(5);
        assertThat(footprint.toRowsNorthUp()[0]).containsExactly(4, 5, 6);
        assertThat(footprint.toRowsNorthUp()[1]).containsExactly(1, 2, 3);
        assertThatThrownBy(() -> footprint.value(3, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void isImmutable () {
        double[] values = {1, 2, 3, 4, 5, 6};
        FootprintGrid footprint = new FootprintGrid(GRID, 1, values);
        values[0] = 100;
        footprint.valuesCopy()[1] = 100;
        footprint.toRowsNorthUp()[1][0] = 100;
        assertThat(footprint.valuesCopy()).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void zeroGridHasNoMaximum () {
        FootprintGrid footprint = FootprintGrid.zero(GRID, 3);
        assertThat(footprint.total()).isZero();
        assertThat(footprint.argMax()).isEqualTo(-1);
        assertThat(footprint.nTrajectories()).isEqualTo(3);
    }

    @Test
    void boundsCoverWholeCells () {
        GridSpec ragged = new GridSpec(0, 2.5, 1, 0, 1, 0.5);
        FootprintGrid footprint = FootprintGrid.zero(ragged, 1);
        assertThat(footprint.wgsBounds().maxLon()).isCloseTo(3, within(1e-12));
        assertThat(footprint.wgsBounds().maxLat()).isCloseTo(1, within(1e-12));
    }

    @Test
    void compositorCropsTheHalo () {
        HaloGrid halo = new HaloGrid(GRID, 1, 2);
        double[] padded = new double[halo.nElements()];
        for (int i = 0; i < padded.length; i++) padded[i] = -1;
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 3; x++) padded[halo.flatIndex(x + 1, y + 2)] = 10 * y + x;
        }
        FootprintGrid footprint = FootprintCompositor.compose(padded, halo, 7);
        assertThat(footprint.valuesCopy()).containsExactly(0, 1, 2, 10, 11, 12);
        assertThat(footprint.nTrajectories()).isEqualTo(7);
        assertThat(footprint.grid()).isEqualTo(GRID);
    }

    @Test
    void rejectsMismatchedValues () {
        assertThatThrownBy(() -> new FootprintGrid(GRID, 1, new double[5])).isInstanceOf(IllegalArgumentException.class);
    }

}
