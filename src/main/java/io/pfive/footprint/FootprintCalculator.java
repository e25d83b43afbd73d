// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint;

import io.pfive.footprint.background.ProgressListener;
import io.pfive.footprint.background.ProgressSink;
import io.pfive.footprint.exception.ConfigurationException;
import io.pfive.footprint.grid.GridSpec;
import io.pfive.footprint.grid.HaloGrid;
import io.pfive.footprint.kernel.BandwidthEstimator;
import io.pfive.footprint.kernel.GaussianKernel;
import io.pfive.footprint.kernel.KernelGenerator;
import io.pfive.footprint.kernel.Spread;
import io.pfive.footprint.output.FootprintCompositor;
import io.pfive.footprint.output.FootprintGrid;
import io.pfive.footprint.output.FootprintWriters;
import io.pfive.footprint.scatter.ScatterAggregator;
import io.pfive.footprint.trajectory.CanonicalTimeGrid;
import io.pfive.footprint.trajectory.MassEpochs;
import io.pfive.footprint.trajectory.ParticleSample;
import io.pfive.footprint.trajectory.TimeStep;
import io.pfive.footprint.trajectory.TrajectoryEnsemble;
import io.pfive.footprint.trajectory.TrajectoryPreprocessor;
import io.pfive.footprint.util.StageTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;

/// Aggregates an ensemble of backward particle trajectories into a time-integrated footprint,
/// spreading each particle's influence with a 2D Gaussian kernel whose bandwidth follows the
/// spread of all particles at that time step.
///
/// Each call to compute() is independent: it creates its own worker pool and buffers and releases
/// them before returning. One calculator may be used for many receptors, one after another or from
/// several threads, and always gives the same result for the same ensemble, grid and seed.
public class FootprintCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final FootprintConfig config;
    private final long seed;
    private final TrajectoryPreprocessor preprocessor;
    private final BandwidthEstimator bandwidthEstimator;
    /// When null, each computation logs its progress through a ProgressSink of its own.
    private ProgressListener progress = null;

    public FootprintCalculator (FootprintConfig config, long seed) {
        this.config = checkNotNull(config);
        this.seed = seed;
        this.preprocessor = new TrajectoryPreprocessor(
              CanonicalTimeGrid.standard(),
              new MassEpochs(config.epochBoundariesMinutes())
        );
        this.bandwidthEstimator = new BandwidthEstimator(config.bootstrapIterations, config.bootstrapSampleSize);
    }

    /// Uses the seed from the configuration, which must then be present.
    public FootprintCalculator (FootprintConfig config) {
        this(config, config.randomSeed.orElseThrow(() -> new ConfigurationException(
              "No random seed configured. Set random-seed or supply a seed explicitly.")));
    }

    /// The listener receives the progress of every later computation. When computations run
    /// concurrently it must be able to tell them apart, or should be left unset.
    public void setProgressListener (ProgressListener progress) {
        this.progress = checkNotNull(progress);
    }

    public long seed () {
        return seed;
    }

    /// Compute the footprint and persist it to the given path, choosing the format from the file
    /// extension. The grid is returned as well.
    public FootprintGrid compute (TrajectoryEnsemble ensemble, GridSpec grid, Path output) {
        FootprintGrid footprint = compute(ensemble, grid);
        if (output != null) FootprintWriters.write(footprint, output);
        return footprint;
    }

    public FootprintGrid compute (TrajectoryEnsemble ensemble, GridSpec grid) {
        checkNotNull(ensemble, "Ensemble is required.");
        checkNotNull(grid, "Grid specification is required.");
        StageTimer timer = new StageTimer("Footprint");
        timer.start("Preprocessing");
        List<ParticleSample> resampled = preprocessor.preprocess(ensemble, grid);
        List<TimeStep> steps = TrajectoryPreprocessor.groupByTime(resampled);
        if (steps.isEmpty()) {
            LOG.info("No particles with influence inside the grid, footprint is empty.");
            timer.done();
            return FootprintGrid.zero(grid, ensemble.nTrajectories());
        }
        int nWorkers = config.workerThreads();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
              nWorkers, nWorkers, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>()
        );
        try {
            timer.start("Bandwidth estimation");
            KernelGenerator kernelGenerator = new KernelGenerator(grid, config.bandwidthCalibration,
                  config.bandwidthFloorDivisor, config.kernelTruncationSigmas);
            // Split one generator per time step in a fixed order, so the draws for each time step
            // do not depend on which worker runs it or when.
            SplittableRandom random = new SplittableRandom(seed);
            List<Callable<Spread>> spreadTasks = new ArrayList<>(steps.size());
            for (TimeStep step : steps) {
                SplittableRandom stepRandom = random.split();
                spreadTasks.add(() -> bandwidthEstimator.estimate(step, stepRandom));
            }
            List<Spread> spreads = ScatterAggregator.invokeAll(executor, spreadTasks);

            timer.start("Kernel generation");
            List<Callable<GaussianKernel>> kernelTasks = new ArrayList<>(spreads.size());
            for (Spread spread : spreads) kernelTasks.add(() -> kernelGenerator.kernelFor(spread));
            List<GaussianKernel> kernels = ScatterAggregator.invokeAll(executor, kernelTasks);
            GaussianKernel haloKernel = kernelGenerator.haloKernel(spreads);
            HaloGrid haloGrid = ScatterAggregator.haloFor(grid, haloKernel, kernels);

            timer.start("Scatter");
            ProgressListener listener = (progress != null) ? progress : new ProgressSink("footprint");
            ScatterAggregator aggregator = new ScatterAggregator(executor, nWorkers, listener);
            double[] padded = aggregator.aggregate(steps, kernels, haloGrid, ensemble.nTrajectories());

            timer.start("Compositing");
            FootprintGrid footprint = FootprintCompositor.compose(padded, haloGrid, ensemble.nTrajectories());
            timer.done();
            LOG.info("Footprint of {} trajectories over {} time steps on {}x{} cells (halo {}x{}) in {}, total {}.",
                  ensemble.nTrajectories(), steps.size(), footprint.nCellsWide(), footprint.nCellsHigh(),
                  haloGrid.haloX(), haloGrid.haloY(), timer.getElapsedString(), footprint.total());
            return footprint;
        } finally {
            executor.shutdownNow();
        }
    }

}
