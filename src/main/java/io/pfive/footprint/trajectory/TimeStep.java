// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

import static com.google.common.base.Preconditions.checkArgument;

/// All active particles at one rounded time, as parallel arrays of positions and weights.
/// Bandwidth estimation and kernel application both work one time step at a time.
public record TimeStep (int tenths, double[] lon, double[] lat, double[] weight) {

    public TimeStep {
        checkArgument(lon.length == lat.length && lat.length == weight.length,
              "Time step arrays must have equal lengths.");
    }

    public double minutes () {
        return tenths / 10.0;
    }

    public int size () {
        return lon.length;
    }

    public double totalWeight () {
        double total = 0;
        for (double w : weight) total += w;
        return total;
    }

}
