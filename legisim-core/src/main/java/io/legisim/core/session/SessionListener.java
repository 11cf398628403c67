package io.legisim.core.session;

import io.legisim.core.legislator.Legislator;

/// Listener for session lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to override
/// only the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onSessionStart(repetition, medianIdeal) - roster built and sorted
/// onProposerSelected(proposer, round)     - before round 1, and on rotation
/// onRoundComplete(result)                 - once per vote
/// onPassed(outcome)                       - after the passing vote, fatigue reset
/// ```
///
/// @implNote A listener passed to the sweep driver receives callbacks from several
/// worker threads and must be thread-safe.
///
/// @see LegislatureSession
public interface SessionListener {

    /// Called once the roster is built, sorted and the median is known.
    ///
    /// @param repetition zero-based repetition index
    /// @param medianIdeal ideal point of the median seat
    default void onSessionStart(int repetition, double medianIdeal) {}

    /// Called when a proposer takes the floor.
    ///
    /// @param proposer the legislator who will propose, not null
    /// @param round the round the proposer first proposes in
    default void onProposerSelected(Legislator proposer, int round) {}

    /// Called after every vote.
    ///
    /// @param result the round's proposal and tally, not null
    default void onRoundComplete(RoundResult result) {}

    /// Called when a proposal has passed.
    ///
    /// @param outcome the repetition's outcome record, not null
    default void onPassed(OutcomeRecord outcome) {}

    /// No-op listener instance that ignores all events.
    SessionListener NOOP = new SessionListener() {};
}
