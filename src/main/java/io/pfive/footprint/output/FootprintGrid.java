// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.output;

import io.pfive.footprint.grid.GridSpec;
import io.pfive.footprint.grid.Wgs84Bounds;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/// The time-integrated influence of each cell of the requested grid on the receptor, averaged over
/// all released particles. Values are held flat with x varying fastest and row 0 at the southern
/// edge (y increases with latitude, unlike most image formats). Instances are immutable; accessors
/// returning arrays return copies.
public final class FootprintGrid {

    /// Plain longitude/latitude on the WGS84 ellipsoid, as a PROJ string.
    public static final String CRS = "+proj=longlat +ellps=WGS84";

    private final GridSpec grid;
    private final int nTrajectories;
    private final double[] values;

    public FootprintGrid (GridSpec grid, int nTrajectories, double[] values) {
        checkArgument(values.length == grid.nElements(), "Footprint values do not match grid dimensions.");
        this.grid = grid;
        this.nTrajectories = nTrajectories;
        this.values = values.clone();
    }

    public static FootprintGrid zero (GridSpec grid, int nTrajectories) {
        return new FootprintGrid(grid, nTrajectories, new double[grid.nElements()]);
    }

    public GridSpec grid () {
        return grid;
    }

    public int nTrajectories () {
        return nTrajectories;
    }

    public int nCellsWide () {
        return grid.nCellsWide();
    }

    public int nCellsHigh () {
        return grid.nCellsHigh();
    }

    /// Bounds of the cells, which can extend past the requested maximum when the extent is not a
    /// whole number of cells.
    public Wgs84Bounds wgsBounds () {
        return Wgs84Bounds.fromWgsEnvelope(grid.cellEnvelope());
    }

    public double centerLonForX (int x) {
        return grid.centerLonForX(x);
    }

    public double centerLatForY (int y) {
        return grid.centerLatForY(y);
    }

    public double value (int x, int y) {
        checkElementIndex(x, nCellsWide(), "x");
        checkElementIndex(y, nCellsHigh(), "y");
        return values[y * nCellsWide() + x];
    }

    public double total () {
        double total = 0;
        for (double v : values) total += v;
        return total;
    }

    public double max () {
        double max = 0;
        for (double v : values) max = Math.max(max, v);
        return max;
    }

    /// @return flat index of the cell holding the maximum value, or -1 if all values are zero.
    public int argMax () {
        int best = -1;
        double max = 0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] > max) {
                max = values[i];
                best = i;
            }
        }
        return best;
    }

    public double[] valuesCopy () {
        return values.clone();
    }

    /// Values in (y, x) axis order with row 0 at the northern edge, as image formats expect.
    public double[][] toRowsNorthUp () {
        int width = nCellsWide();
        int height = nCellsHigh();
        double[][] rows = new double[height][width];
        for (int y = 0; y < height; y++) {
            System.arraycopy(values, y * width, rows[height - y - 1], 0, width);
        }
        return rows;
    }

    @Override
    public String toString () {
        return String.format("FootprintGrid(%dx%d cells, %d trajectories, total %.6g)",
              nCellsWide(), nCellsHigh(), nTrajectories, total());
    }
}
