package io.legisim.core.session;

/// Result of one repetition: where the first proposal started, where the passing
/// proposal landed, how long it took, and the parameters that produced it.
///
/// @param repetition one-based row number
/// @param initialValue the first proposer's opening best response
/// @param finalValue the proposal that passed
/// @param numberOfVotes rounds taken, at least 1
/// @param yeas yea count of the passing round
/// @param majorityPartySize seats requested by the majority party
/// @param distanceBetweenMedians distance between the party means
/// @param majoritySigma majority ideal-point standard deviation
/// @param majorityAdjustment majority per-vote fatigue increment
/// @param minoritySigma minority ideal-point standard deviation
/// @param minorityAdjustment minority per-vote fatigue increment
public record OutcomeRecord(
        int repetition,
        double initialValue,
        double finalValue,
        int numberOfVotes,
        int yeas,
        int majorityPartySize,
        double distanceBetweenMedians,
        double majoritySigma,
        double majorityAdjustment,
        double minoritySigma,
        double minorityAdjustment) {

    /// Builds a record, copying the configuration columns from `config`.
    static OutcomeRecord of(
            int repetition,
            double initialValue,
            double finalValue,
            int numberOfVotes,
            int yeas,
            ChamberConfig config) {
        return new OutcomeRecord(
                repetition,
                initialValue,
                finalValue,
                numberOfVotes,
                yeas,
                config.majorityPartySize(),
                config.distanceBetweenMedians(),
                config.majority().sigma(),
                config.majority().adjustment(),
                config.minority().sigma(),
                config.minority().adjustment());
    }

    /// Returns a copy carrying a different row number.
    ///
    /// @param row new one-based row number
    /// @return renumbered record, never null
    public OutcomeRecord withRepetition(int row) {
        return new OutcomeRecord(
                row,
                initialValue,
                finalValue,
                numberOfVotes,
                yeas,
                majorityPartySize,
                distanceBetweenMedians,
                majoritySigma,
                majorityAdjustment,
                minoritySigma,
                minorityAdjustment);
    }
}
