// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

/// One recorded position of one simulated particle. Time is in minutes relative to release at the
/// receptor and is never positive, since trajectories are integrated backward in time. Weight is
/// the particle's surface influence at that position.
public record ParticleSample (int trajectoryId, double time, double lon, double lat, double weight) {

    /// Time rounded to one decimal place and held as integer tenths of a minute, so that samples
    /// from different trajectories fall into exactly the same time bucket.
    public int timeTenths () {
        return Math.toIntExact(Math.round(time * 10));
    }

    public ParticleSample withWeight (double newWeight) {
        return new ParticleSample(trajectoryId, time, lon, lat, newWeight);
    }

}
