// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import io.pfive.footprint.exception.InputException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// All particle samples released from a single receptor. The number of distinct trajectory IDs is
/// the number of particles released, which is what the footprint is normalized by. Trajectories
/// that never enter the footprint grid still count toward that number.
public final class TrajectoryEnsemble {

    /// Times are bucketed as integer tenths of a minute.
    static final double OLDEST_TIME_MINUTES = Integer.MIN_VALUE / 10.0;

    private final List<ParticleSample> samples;
    private final int nTrajectories;

    private TrajectoryEnsemble (List<ParticleSample> samples, int nTrajectories) {
        this.samples = samples;
        this.nTrajectories = nTrajectories;
    }

    /// Validates every sample, failing on the first one that could not have come from a backward
    /// trajectory run. An empty list is also rejected.
    public static TrajectoryEnsemble of (List<ParticleSample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new InputException("Trajectory ensemble contains no particle samples.");
        }
        TIntSet ids = new TIntHashSet();
        for (int i = 0; i < samples.size(); i++) {
            ParticleSample s = samples.get(i);
            if (s == null) throw new InputException("Null particle sample at index " + i);
            if (!Double.isFinite(s.time()) || !Double.isFinite(s.lon()) || !Double.isFinite(s.lat())) {
                throw new InputException("Non-finite time or position in sample " + i + ": " + s);
            }
            if (s.time() > 0) {
                throw new InputException("Sample times must be zero or negative, sample " + i + ": " + s);
            }
            if (s.time() < OLDEST_TIME_MINUTES) {
                throw new InputException("Sample time is too old to represent in tenths of a minute, sample " + i + ": " + s);
            }
            if (!(s.weight() >= 0) || Double.isInfinite(s.weight())) {
                throw new InputException("Sample weights must be finite and non-negative, sample " + i + ": " + s);
            }
            ids.add(s.trajectoryId());
        }
        return new TrajectoryEnsemble(Collections.unmodifiableList(new ArrayList<>(samples)), ids.size());
    }

    public List<ParticleSample> samples () {
        return samples;
    }

    public int nSamples () {
        return samples.size();
    }

    public int nTrajectories () {
        return nTrajectories;
    }

    /// Group samples by trajectory, preserving the order in which they were recorded.
    public TIntObjectMap<List<ParticleSample>> byTrajectory () {
        TIntObjectMap<List<ParticleSample>> trajectories = new TIntObjectHashMap<>();
        for (ParticleSample s : samples) {
            List<ParticleSample> trajectory = trajectories.get(s.trajectoryId());
            if (trajectory == null) {
                trajectory = new ArrayList<>();
                trajectories.put(s.trajectoryId(), trajectory);
            }
            trajectory.add(s);
        }
        return trajectories;
    }

    /// Trajectory IDs in ascending order, for deterministic iteration over byTrajectory().
    public static int[] sortedIds (TIntObjectMap<?> trajectories) {
        int[] ids = trajectories.keys();
        Arrays.sort(ids);
        return ids;
    }

    public static class Builder {
        private final List<ParticleSample> samples = new ArrayList<>();

        public Builder add (int trajectoryId, double time, double lon, double lat, double weight) {
            samples.add(new ParticleSample(trajectoryId, time, lon, lat, weight));
            return this;
        }

        public TrajectoryEnsemble build () {
            return TrajectoryEnsemble.of(samples);
        }
    }
}
