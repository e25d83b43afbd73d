// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.grid;

import io.pfive.footprint.exception.InputException;
import org.locationtech.jts.geom.Envelope;

/// The requested footprint extent and resolution in degrees of longitude and latitude. All cells
/// are the same size in degrees, so at large scales cells vary in area depending on latitude.
/// Cell x spans [xMin + x * xRes, xMin + (x + 1) * xRes) and its center is at xMin + (x + 0.5) * xRes.
/// When the extent is not an exact multiple of the resolution, the last column or row extends past
/// the maximum.
public record GridSpec (double xMin, double xMax, double xRes, double yMin, double yMax, double yRes) {

    /// Relative slack when deciding whether an extent is an exact multiple of the resolution.
    private static final double CELL_COUNT_TOLERANCE = 1e-9;

    public GridSpec {
        checkAxis("x", xMin, xMax, xRes);
        checkAxis("y", yMin, yMax, yRes);
    }

    private static void checkAxis (String axis, double min, double max, double res) {
        if (!Double.isFinite(min) || !Double.isFinite(max) || !Double.isFinite(res)) {
            throw new InputException(String.format("Grid %s axis has non-finite bounds or resolution.", axis));
        }
        if (res <= 0) {
            throw new InputException(String.format("Grid %s resolution must be positive, was %s.", axis, res));
        }
        if (max <= min) {
            throw new InputException(String.format("Grid %s bounds are inverted or empty: [%s, %s].", axis, min, max));
        }
    }

    public int nCellsWide () {
        return cellCount(xMax - xMin, xRes);
    }

    public int nCellsHigh () {
        return cellCount(yMax - yMin, yRes);
    }

    private static int cellCount (double span, double res) {
        double n = span / res;
        return Math.max(1, (int) Math.ceil(n - n * CELL_COUNT_TOLERANCE));
    }

    public int nElements () {
        return nCellsWide() * nCellsHigh();
    }

    public double maxRes () {
        return Math.max(xRes, yRes);
    }

    public double centerLonForX (int x) {
        return xMin + ((x + 0.5) * xRes);
    }

    public double centerLatForY (int y) {
        return yMin + ((y + 0.5) * yRes);
    }

    /// Bounds are inclusive on all four edges.
    public boolean contains (double lon, double lat) {
        return lon >= xMin && lon <= xMax && lat >= yMin && lat <= yMax;
    }

    /// The area covered by whole cells, which extends past the requested maximum on an axis whose
    /// extent is not a whole number of cells.
    public Envelope cellEnvelope () {
        return new Envelope(xMin, xMin + nCellsWide() * xRes, yMin, yMin + nCellsHigh() * yRes);
    }

    /// Returns a new grid over the same extent, with the resolution divided by the given factor.
    public GridSpec subdivide (int factor) {
        return new GridSpec(xMin, xMax, xRes / factor, yMin, yMax, yRes / factor);
    }

}
