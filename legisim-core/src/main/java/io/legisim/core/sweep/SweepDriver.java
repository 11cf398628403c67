package io.legisim.core.sweep;

import io.legisim.core.LegisimConfig;
import io.legisim.core.session.ChamberConfig;
import io.legisim.core.session.LegislatureSimulator;
import io.legisim.core.session.OutcomeRecord;
import io.legisim.core.session.VoteDivergenceException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Runs a batch of repetitions for every value of a sweep on a fixed worker pool.
///
/// ### This driver
///
/// - Derives and validates one {@link ChamberConfig} per grid value before any work starts
/// - Submits one task per value; each task runs `reps` repetitions sequentially and
///   checks for cancellation before every repetition
/// - Joins the tasks in grid order and concatenates their rows into one
///   {@link OutcomeTable} numbered 1..N
///
/// Workers share nothing: a task receives its configuration and returns its rows.
///
/// ### Failure Handling
/// The first task that fails cancels every task not yet joined and surfaces as a
/// {@link SweepException} carrying the worker's cause. Queued tasks never start; a
/// running task finishes its current repetition and then stops.
///
/// @implNote The pool is owned by the driver and released by {@link #close()}.
/// A driver created with an external `ExecutorService` still shuts it down on close.
///
/// @see SweepType for the predefined grids
/// @see LegislatureSimulator#runRepetition
public final class SweepDriver implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(SweepDriver.class.getName());

    private final ExecutorService executorService;
    private final LegislatureSimulator simulator;

    /// Creates a driver with a fixed pool sized by `config`.
    ///
    /// @param config environment configuration, not null
    /// @throws IllegalArgumentException if the configured pool size is not positive
    public SweepDriver(LegisimConfig config) {
        this(Executors.newFixedThreadPool(config.getThreadPoolSize()), new LegislatureSimulator());
    }

    /// Creates a driver over an existing pool and simulator.
    ///
    /// @param executorService pool the tasks run on, not null
    /// @param simulator simulator each task calls, not null
    public SweepDriver(ExecutorService executorService, LegislatureSimulator simulator) {
        this.executorService = executorService;
        this.simulator = simulator;
    }

    /// Runs a predefined sweep over its grid.
    ///
    /// @param type the sweep to run, not null
    /// @param base configuration supplying every unswept parameter, not null
    /// @param reps repetitions per grid value, must be non-negative
    /// @return the concatenated table, never null
    /// @throws SweepException if any grid value fails
    /// @throws InterruptedException if interrupted while waiting for workers
    /// @throws io.legisim.core.exception.InvalidChamberConfigException if a grid value is
    ///     invalid for the base configuration; raised before any task is submitted
    public OutcomeTable run(SweepType type, ChamberConfig base, int reps)
            throws SweepException, InterruptedException {
        List<ChamberConfig> configs = new ArrayList<>();
        for (double value : type.grid().values()) {
            configs.add(type.apply(base, value));
        }
        logger.info(
                "Starting "
                        + type
                        + " sweep: "
                        + configs.size()
                        + " values x "
                        + reps
                        + " repetitions");
        return run(configs, reps);
    }

    /// Runs `reps` repetitions of each configuration.
    ///
    /// @param configs one configuration per sweep value, in output order, not null
    /// @param reps repetitions per configuration, must be non-negative
    /// @return the concatenated table, never null
    /// @throws SweepException if any configuration fails
    /// @throws InterruptedException if interrupted while waiting for workers
    public OutcomeTable run(List<ChamberConfig> configs, int reps)
            throws SweepException, InterruptedException {
        if (reps < 0) {
            throw new IllegalArgumentException("reps must be >= 0");
        }

        List<Future<List<OutcomeRecord>>> futures =
                configs.stream()
                        .map(config -> executorService.submit(() -> runBatch(config, reps)))
                        .toList();

        List<List<OutcomeRecord>> batches = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                batches.add(futures.get(i).get());
            } catch (ExecutionException e) {
                cancelFrom(futures, i + 1);
                Throwable cause = e.getCause();
                logger.warning("Sweep value " + i + " failed: " + cause.getMessage());
                throw new SweepException(
                        "Sweep value " + i + " failed: " + cause.getMessage(), cause);
            } catch (InterruptedException e) {
                cancelFrom(futures, i);
                Thread.currentThread().interrupt();
                throw e;
            }
        }

        OutcomeTable table = OutcomeTable.concat(batches);
        logger.info("Sweep completed: " + table.size() + " rows");
        return table;
    }

    private List<OutcomeRecord> runBatch(ChamberConfig config, int reps)
            throws VoteDivergenceException, InterruptedException {
        List<OutcomeRecord> records = new ArrayList<>(reps);
        for (int i = 0; i < reps; i++) {
            if (Thread.interrupted()) {
                logger.fine("Sweep task cancelled after " + i + " of " + reps + " repetitions");
                throw new InterruptedException(
                        "Cancelled after " + i + " of " + reps + " repetitions");
            }
            records.add(simulator.runRepetition(config, i));
        }
        return records;
    }

    private void cancelFrom(List<Future<List<OutcomeRecord>>> futures, int from) {
        for (int j = from; j < futures.size(); j++) {
            futures.get(j).cancel(true);
        }
    }

    /// Shuts down the worker pool.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block. Tasks already
    /// running continue to completion unless a failed sweep has cancelled them.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
