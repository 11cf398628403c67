package io.legisim.core.session;

/// Outcome of one vote within a session.
///
/// @param round one-based round number
/// @param proposerId party-local identifier of the proposer
/// @param proposal the policy point voted on
/// @param yeas number of yea ballots, proposer included
/// @param passed whether the proposal carried the chamber
public record RoundResult(int round, int proposerId, double proposal, int yeas, boolean passed) {}
