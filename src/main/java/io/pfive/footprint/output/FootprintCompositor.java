// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.output;

import io.pfive.footprint.grid.GridSpec;
import io.pfive.footprint.grid.HaloGrid;

import static com.google.common.base.Preconditions.checkArgument;

/// Crops the padded, normalized accumulator back to the requested grid. Whatever influence was
/// spread into the halo lies outside the requested extent and is discarded.
public abstract class FootprintCompositor {

    public static FootprintGrid compose (double[] padded, HaloGrid haloGrid, int nTrajectories) {
        checkArgument(padded.length == haloGrid.nElements(), "Accumulator does not match padded grid.");
        GridSpec grid = haloGrid.nominal();
        int width = grid.nCellsWide();
        int height = grid.nCellsHigh();
        double[] cropped = new double[width * height];
        for (int y = 0; y < height; y++) {
            int sourceStart = haloGrid.flatIndex(haloGrid.haloX(), y + haloGrid.haloY());
            System.arraycopy(padded, sourceStart, cropped, y * width, width);
        }
        return new FootprintGrid(grid, nTrajectories, cropped);
    }

}
