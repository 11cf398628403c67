package io.legisim.core.session;

import java.io.Serial;

/// Thrown when a session reaches its round cap without a passing vote.
///
/// Indicates a configuration under which no proposal can gather a strict majority in
/// reasonable time. Common causes:
/// - Fatigue increments too small relative to the spread of ideal points
/// - A median outside every reachable acceptance window
/// - `maxRounds` set too low for the chamber
///
/// @see ChamberConfig#maxRounds()
public class VoteDivergenceException extends Exception {

    @Serial private static final long serialVersionUID = -2716359022881304745L;

    private final int repetition;
    private final int rounds;
    private final double lastProposal;

    /// Creates exception describing the diverging session.
    ///
    /// @param repetition zero-based repetition index
    /// @param rounds number of failed votes taken
    /// @param lastProposal proposal of the final failed vote
    public VoteDivergenceException(int repetition, int rounds, double lastProposal) {
        super(
                "Repetition "
                        + repetition
                        + " did not reach a majority after "
                        + rounds
                        + " rounds (last proposal "
                        + lastProposal
                        + ")");
        this.repetition = repetition;
        this.rounds = rounds;
        this.lastProposal = lastProposal;
    }

    public int getRepetition() {
        return repetition;
    }

    public int getRounds() {
        return rounds;
    }

    public double getLastProposal() {
        return lastProposal;
    }
}
