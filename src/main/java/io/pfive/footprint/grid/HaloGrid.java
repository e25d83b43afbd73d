// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.grid;

import static com.google.common.base.Preconditions.checkArgument;

/// The requested grid padded with extra columns and rows on every side, so that a kernel centered
/// on any cell of the requested grid fits entirely inside the padded one. Accumulator buffers are
/// flat arrays over this grid with x varying fastest and y increasing with latitude.
public record HaloGrid (GridSpec nominal, int haloX, int haloY) {

    public HaloGrid {
        checkArgument(haloX >= 0 && haloY >= 0, "Halo sizes must be non-negative.");
    }

    public int nCellsWide () {
        return nominal.nCellsWide() + 2 * haloX;
    }

    public int nCellsHigh () {
        return nominal.nCellsHigh() + 2 * haloY;
    }

    public int nElements () {
        return nCellsWide() * nCellsHigh();
    }

    public double minLon () {
        return nominal.xMin() - haloX * nominal.xRes();
    }

    public double minLat () {
        return nominal.yMin() - haloY * nominal.yRes();
    }

    /// Does not perform range checks, for use in constrained iteration over provably safe ranges.
    public int flatIndex (int x, int y) {
        return y * nCellsWide() + x;
    }

    public int xForFlatIndex (int flatIndex) {
        return flatIndex % nCellsWide();
    }

    public int yForFlatIndex (int flatIndex) {
        return flatIndex / nCellsWide();
    }

    /// Interval search against the cell edges of the padded grid. Points lying exactly on the
    /// maximum edge of the requested grid are binned into its last column or row rather than the
    /// first halo cell beyond it, so boundary points stay inside the cropped output.
    /// Returns -1 for points that fall outside the padded grid.
    public int flatIndexForLonLat (double lon, double lat) {
        int x = haloX + nominalCell(lon, nominal.xMin(), nominal.xMax(), nominal.xRes(), nominal.nCellsWide());
        if (x < 0 || x >= nCellsWide()) return -1;
        int y = haloY + nominalCell(lat, nominal.yMin(), nominal.yMax(), nominal.yRes(), nominal.nCellsHigh());
        if (y < 0 || y >= nCellsHigh()) return -1;
        return flatIndex(x, y);
    }

    private static int nominalCell (double v, double min, double max, double res, int nCells) {
        int i = (int) Math.floor((v - min) / res);
        if (i >= nCells && v <= max) i = nCells - 1;
        return i;
    }

    /// Size in bytes of one double-precision accumulator over this grid.
    public long accumulatorBytes () {
        return (long) nElements() * Double.BYTES;
    }

}
