// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

import gnu.trove.list.array.TIntArrayList;

/// The fixed, strictly decreasing sequence of times onto which every trajectory is resampled
/// before kernels are applied. Resolution is finest near release, where particles are tightly
/// clustered and influence is strongest: every 0.1 minute out to 10 minutes, every 0.2 minute out
/// to 20 minutes, and every 0.5 minute out to 100 minutes.
///
/// Times are held as integer tenths of a minute. Converting tenths to minutes by division yields
/// the same double as parsing the decimal text of that time, so exact matches against recorded
/// times are reliable.
public final class CanonicalTimeGrid {

    private static final CanonicalTimeGrid STANDARD = new CanonicalTimeGrid(new int[][] {
        // {first tenths, last tenths, step tenths}
        {0, -100, 1},
        {-102, -200, 2},
        {-205, -1000, 5}
    });

    private final int[] tenths;

    private CanonicalTimeGrid (int[][] segments) {
        TIntArrayList times = new TIntArrayList();
        for (int[] segment : segments) {
            for (int t = segment[0]; t >= segment[1]; t -= segment[2]) times.add(t);
        }
        this.tenths = times.toArray();
    }

    public static CanonicalTimeGrid standard () {
        return STANDARD;
    }

    public int size () {
        return tenths.length;
    }

    public double minutesAt (int i) {
        return tenths[i] / 10.0;
    }

    public int[] tenths () {
        return tenths.clone();
    }

}
