package io.legisim.core.session;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Entry point for running repetitions of a chamber configuration.
///
/// Each repetition is an independent {@link LegislatureSession} seeded with
/// `config.baseSeed() + repetition`, so a batch is reproducible and any single row of
/// it can be re-run in isolation.
///
/// ### Usage
/// {@snippet :
/// LegislatureSimulator simulator = new LegislatureSimulator();
/// OutcomeRecord first = simulator.runRepetition(ChamberConfig.defaults(), 0);
/// List<OutcomeRecord> batch = simulator.runBatch(ChamberConfig.defaults(), 10_000);
/// }
///
/// @implNote **Thread-safe** as long as the listener is. The simulator holds no mutable
/// state; every call builds fresh sessions.
public class LegislatureSimulator {

    private static final Logger logger = Logger.getLogger(LegislatureSimulator.class.getName());

    private final SessionListener listener;

    public LegislatureSimulator() {
        this(SessionListener.NOOP);
    }

    /// Creates a simulator that forwards every session's events to `listener`.
    ///
    /// @param listener receiver of session callbacks, not null
    public LegislatureSimulator(SessionListener listener) {
        this.listener = listener;
    }

    /// Runs a single repetition to convergence.
    ///
    /// @param config chamber parameters, not null
    /// @param repetition zero-based repetition index; the record's row number is
    ///     `repetition + 1`
    /// @return the outcome record, never null
    /// @throws VoteDivergenceException if the session hits the round cap
    public OutcomeRecord runRepetition(ChamberConfig config, int repetition)
            throws VoteDivergenceException {
        return new LegislatureSession(config, repetition, listener).run();
    }

    /// Runs repetitions `0 .. reps - 1` sequentially.
    ///
    /// @param config chamber parameters, not null
    /// @param reps number of repetitions, must be non-negative
    /// @return outcome records in repetition order, never null
    /// @throws VoteDivergenceException on the first repetition that hits the round cap
    /// @throws IllegalArgumentException if `reps` is negative
    public List<OutcomeRecord> runBatch(ChamberConfig config, int reps)
            throws VoteDivergenceException {
        if (reps < 0) {
            throw new IllegalArgumentException("reps must be >= 0");
        }
        logger.info(
                "Running "
                        + reps
                        + " repetitions: majority size "
                        + config.majorityPartySize()
                        + ", distance "
                        + config.distanceBetweenMedians()
                        + ", sigma "
                        + config.majority().sigma()
                        + "/"
                        + config.minority().sigma());

        List<OutcomeRecord> records = new ArrayList<>(reps);
        for (int i = 0; i < reps; i++) {
            records.add(runRepetition(config, i));
        }
        return records;
    }
}
