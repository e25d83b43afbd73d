// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.footprint.scatter;

import io.pfive.footprint.background.ProgressListener;
import io.pfive.footprint.grid.GridSpec;
import io.pfive.footprint.grid.HaloGrid;
import io.pfive.footprint.kernel.GaussianKernel;
import io.pfive.footprint.trajectory.TimeStep;
import io.pfive.footprint.util.MemoryUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkArgument;

/// Spreads the weight of every occupied cell over its neighbors using the kernel for its time step,
/// and sums the result over all time steps.
///
/// Time steps are divided into contiguous chunks, one per worker. Each worker owns a single
/// accumulator and adds its time steps into it in order, so workers share no mutable state. The
/// only synchronization is the final reduction, which adds the worker accumulators in chunk order.
/// For a given worker count the result is therefore bit-for-bit reproducible. Changing the worker
/// count changes the order of floating point additions and may change the last bits.
public class ScatterAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final ExecutorService executor;
    private final int nWorkers;
    private final ProgressListener progress;

    public ScatterAggregator (ExecutorService executor, int nWorkers, ProgressListener progress) {
        checkArgument(nWorkers > 0, "At least one worker is required.");
        this.executor = executor;
        this.nWorkers = nWorkers;
        this.progress = progress;
    }

    /// Pad the grid so that the largest kernel of the computation fits around any cell. The halo
    /// kernel is normally the largest, but time steps at higher latitude than the minimum can have
    /// wider kernels, so every kernel is checked.
    public static HaloGrid haloFor (GridSpec grid, GaussianKernel haloKernel, List<GaussianKernel> kernels) {
        int haloX = haloKernel.halfWidth();
        int haloY = haloKernel.halfHeight();
        for (GaussianKernel kernel : kernels) {
            haloX = Math.max(haloX, kernel.halfWidth());
            haloY = Math.max(haloY, kernel.halfHeight());
        }
        return new HaloGrid(grid, haloX, haloY);
    }

    /// Adds w * kernel into the accumulator around every occupied cell. Kernel cells falling outside
    /// the accumulator are skipped, which cannot happen when the halo is sized by haloFor().
    public static void scatter (OccupiedCells cells, GaussianKernel kernel, HaloGrid grid, double[] accumulator) {
        checkArgument(accumulator.length == grid.nElements(), "Accumulator does not match grid.");
        final int width = grid.nCellsWide();
        final int height = grid.nCellsHigh();
        final int nCols = kernel.nCols();
        final int nRows = kernel.nRows();
        final int hx = kernel.halfWidth();
        final int hy = kernel.halfHeight();
        final double[] k = kernel.weights();
        for (int i = 0; i < cells.size(); i++) {
            int flatIndex = cells.flatIndexes()[i];
            double w = cells.weights()[i];
            int cx = flatIndex % width;
            int cy = flatIndex / width;
            for (int r = 0; r < nRows; r++) {
                int y = cy + r - hy;
                if (y < 0 || y >= height) continue;
                int rowStart = y * width;
                int kRowStart = r * nCols;
                for (int c = 0; c < nCols; c++) {
                    int x = cx + c - hx;
                    if (x < 0 || x >= width) continue;
                    accumulator[rowStart + x] += w * k[kRowStart + c];
                }
            }
        }
    }

    /// @param steps time steps in order from release backward
    /// @param kernels one kernel per time step, in the same order
    /// @return the padded footprint summed over all time steps and divided by nTrajectories
    public double[] aggregate (List<TimeStep> steps, List<GaussianKernel> kernels, HaloGrid grid, int nTrajectories) {
        checkArgument(steps.size() == kernels.size(), "Each time step needs exactly one kernel.");
        checkArgument(nTrajectories > 0, "Trajectory count must be positive.");
        int nChunks = Math.max(1, Math.min(nWorkers, steps.size()));
        LOG.debug("Allocating {} accumulators of {}x{} cells, {} total, {} heap available.",
              nChunks, grid.nCellsWide(), grid.nCellsHigh(),
              MemoryUtil.memString((double) nChunks * grid.accumulatorBytes()),
              MemoryUtil.memString(MemoryUtil.availableHeapBytes()));
        progress.beginTask("Applying kernels", steps.size());
        List<Callable<double[]>> tasks = new ArrayList<>(nChunks);
        for (int chunk = 0; chunk < nChunks; chunk++) {
            final int from = chunk * steps.size() / nChunks;
            final int to = (chunk + 1) * steps.size() / nChunks;
            tasks.add(() -> scatterRange(steps, kernels, grid, from, to));
        }
        List<double[]> partials = invokeAll(executor, tasks);
        // Reduce into the first chunk's buffer, which no worker touches any more.
        double[] total = partials.get(0);
        for (int p = 1; p < partials.size(); p++) {
            double[] partial = partials.get(p);
            for (int i = 0; i < total.length; i++) total[i] += partial[i];
        }
        for (int i = 0; i < total.length; i++) total[i] /= nTrajectories;
        return total;
    }

    private double[] scatterRange (List<TimeStep> steps, List<GaussianKernel> kernels, HaloGrid grid, int from, int to) {
        double[] accumulator = new double[grid.nElements()];
        for (int s = from; s < to; s++) {
            OccupiedCells cells = OccupiedCells.of(steps.get(s), grid);
            if (!cells.isEmpty()) scatter(cells, kernels.get(s), grid, accumulator);
            progress.increment();
        }
        return accumulator;
    }

    /// Run all tasks and return their results in submission order, rethrowing the first failure.
    public static <T> List<T> invokeAll (ExecutorService executor, List<Callable<T>> tasks) {
        try {
            List<Future<T>> futures = executor.invokeAll(tasks);
            List<T> results = new ArrayList<>(futures.size());
            for (Future<T> future : futures) results.add(future.get());
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while computing footprint.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) throw runtimeException;
            if (cause instanceof Error error) throw error;
            throw new IllegalStateException("Footprint worker failed.", cause);
        }
    }

}
