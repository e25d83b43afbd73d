// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.scatter;

import gnu.trove.map.TIntDoubleMap;
import gnu.trove.map.hash.TIntDoubleHashMap;
import io.pfive.footprint.grid.HaloGrid;
import io.pfive.footprint.trajectory.TimeStep;

import java.util.Arrays;

/// The distinct grid cells occupied by particles at one time step, with the summed weight of the
/// particles in each. Every particle in the same cell at the same time receives the same kernel at
/// the same position, so applying the kernel once with the summed weight is equivalent and makes
/// the scatter cost depend on occupied cells rather than on the number of particles.
/// Flat indexes are into the padded grid and are sorted ascending for a deterministic summation order.
public record OccupiedCells (int tenths, int[] flatIndexes, double[] weights) {

    public static OccupiedCells of (TimeStep step, HaloGrid grid) {
        TIntDoubleMap weightForCell = new TIntDoubleHashMap();
        for (int i = 0; i < step.size(); i++) {
            int flatIndex = grid.flatIndexForLonLat(step.lon()[i], step.lat()[i]);
            // Preprocessed samples are all within the grid bounds. This is only reachable when
            // callers pass time steps built against a different grid.
            if (flatIndex < 0) continue;
            weightForCell.adjustOrPutValue(flatIndex, step.weight()[i], step.weight()[i]);
        }
        int[] flatIndexes = weightForCell.keys();
        Arrays.sort(flatIndexes);
        double[] weights = new double[flatIndexes.length];
        for (int i = 0; i < flatIndexes.length; i++) weights[i] = weightForCell.get(flatIndexes[i]);
        return new OccupiedCells(step.tenths(), flatIndexes, weights);
    }

    public int size () {
        return flatIndexes.length;
    }

    public boolean isEmpty () {
        return flatIndexes.length == 0;
    }

}
