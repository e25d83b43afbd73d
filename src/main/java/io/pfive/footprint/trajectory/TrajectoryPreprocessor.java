// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.trajectory;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import io.pfive.footprint.grid.GridSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/// Resamples every trajectory onto the canonical time grid so that particles from different
/// trajectories line up in the same time buckets, then rescales weights epoch by epoch so that
/// resampling does not change the total influence.
///
/// Only samples inside the grid bounds are resampled. A trajectory that leaves the grid and comes
/// back is therefore interpolated straight across the gap, and canonical times outside the span of
/// a trajectory's in-bounds samples are dropped rather than extrapolated. Each epoch is rescaled to
/// the recorded weight of the whole ensemble, including samples outside the grid, so the in-bounds
/// samples of a trajectory that leaves the grid carry the weight of the part outside it.
public class TrajectoryPreprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final Comparator<ParticleSample> NEWEST_FIRST =
          Comparator.comparingDouble(ParticleSample::time).reversed();

    private final CanonicalTimeGrid canonicalTimes;
    private final MassEpochs epochs;

    public TrajectoryPreprocessor (CanonicalTimeGrid canonicalTimes, MassEpochs epochs) {
        this.canonicalTimes = canonicalTimes;
        this.epochs = epochs;
    }

    /// @return resampled samples with times rounded to tenths of a minute and strictly positive
    /// weights, all within the grid bounds.
    public List<ParticleSample> preprocess (TrajectoryEnsemble ensemble, GridSpec grid) {
        List<ParticleSample> inBounds = new ArrayList<>();
        for (ParticleSample s : ensemble.samples()) {
            if (grid.contains(s.lon(), s.lat())) inBounds.add(s);
        }
        if (inBounds.isEmpty()) {
            LOG.debug("None of {} samples fall inside the grid.", ensemble.nSamples());
            return List.of();
        }
        TrajectoryEnsemble domain = TrajectoryEnsemble.of(inBounds);
        TIntObjectMap<List<ParticleSample>> trajectories = domain.byTrajectory();
        List<ParticleSample> resampled = new ArrayList<>();
        for (int id : TrajectoryEnsemble.sortedIds(trajectories)) {
            resampleOne(trajectories.get(id), resampled);
        }
        double[] rawSums = epochs.sums(ensemble.samples());
        double[] resampledSums = epochs.sums(resampled);
        double[] scales = epochs.scales(rawSums, resampledSums);
        LOG.debug("Epoch weights recorded {} resampled {}.", Arrays.toString(rawSums), Arrays.toString(resampledSums));

        List<ParticleSample> out = new ArrayList<>(resampled.size());
        for (ParticleSample s : resampled) {
            int e = epochs.epochOf(s.time());
            double weight = (e < 0) ? s.weight() : s.weight() * scales[e];
            if (weight > 0) out.add(s.withWeight(weight));
        }
        return out;
    }

    /// Sorted merge of one trajectory's recorded samples with the canonical times, both ordered
    /// from release backward. Recorded samples are all kept. Each canonical time that is not
    /// recorded exactly, but lies between two recorded times, gets a linearly interpolated sample.
    /// Output times are rounded to tenths of a minute.
    void resampleOne (List<ParticleSample> trajectory, List<ParticleSample> out) {
        List<ParticleSample> recorded = new ArrayList<>(trajectory);
        recorded.sort(NEWEST_FIRST);
        // The first record of a duplicated time wins. Sort is stable so that is the first one read.
        List<ParticleSample> distinct = new ArrayList<>(recorded.size());
        for (ParticleSample s : recorded) {
            if (distinct.isEmpty() || distinct.get(distinct.size() - 1).time() != s.time()) distinct.add(s);
        }
        for (ParticleSample s : distinct) {
            out.add(new ParticleSample(s.trajectoryId(), s.timeTenths() / 10.0, s.lon(), s.lat(), s.weight()));
        }
        int n = distinct.size();
        int j = 0;
        for (int c = 0; c < canonicalTimes.size(); c++) {
            double t = canonicalTimes.minutesAt(c);
            while (j < n && distinct.get(j).time() > t) j++;
            if (j < n && distinct.get(j).time() == t) continue;
            // Outside the recorded span, either newer than the first or older than the last record.
            if (j == 0 || j == n) continue;
            ParticleSample newer = distinct.get(j - 1);
            ParticleSample older = distinct.get(j);
            double f = (newer.time() - t) / (newer.time() - older.time());
            out.add(new ParticleSample(
                  newer.trajectoryId(),
                  t,
                  lerp(newer.lon(), older.lon(), f),
                  lerp(newer.lat(), older.lat(), f),
                  lerp(newer.weight(), older.weight(), f)
            ));
        }
    }

    private static double lerp (double a, double b, double f) {
        return a + f * (b - a);
    }

    /// Group resampled samples into one TimeStep per distinct rounded time, ordered from release
    /// backward. Within a time step, samples keep their input order.
    public static List<TimeStep> groupByTime (List<ParticleSample> samples) {
        TIntObjectMap<TDoubleArrayList[]> columns = new TIntObjectHashMap<>();
        for (ParticleSample s : samples) {
            int tenths = s.timeTenths();
            TDoubleArrayList[] cols = columns.get(tenths);
            if (cols == null) {
                cols = new TDoubleArrayList[] {new TDoubleArrayList(), new TDoubleArrayList(), new TDoubleArrayList()};
                columns.put(tenths, cols);
            }
            cols[0].add(s.lon());
            cols[1].add(s.lat());
            cols[2].add(s.weight());
        }
        int[] times = columns.keys();
        Arrays.sort(times);
        List<TimeStep> steps = new ArrayList<>(times.length);
        for (int i = times.length - 1; i >= 0; i--) {
            TDoubleArrayList[] cols = columns.get(times[i]);
            steps.add(new TimeStep(times[i], cols[0].toArray(), cols[1].toArray(), cols[2].toArray()));
        }
        return steps;
    }

}
