package io.legisim.core.legislator;

/// A chamber member with a fixed ideal point and a widening acceptance radius.
///
/// The legislator accepts any proposal within `error` of its ideal point. Every
/// ballot it casts, yea or nay, adds `adjustment` to `error`, modelling the fatigue
/// that makes members more willing to compromise the longer a session runs.
///
/// ### Contracts
/// - **Invariant**: `ideal` and `adjustment` never change after construction
/// - **Invariant**: `error` is non-decreasing between calls to {@link #resetFatigue()}
///
/// @implNote **Not thread-safe**. A legislator belongs to exactly one session, and a
/// session runs on a single thread.
///
/// @see io.legisim.core.party.Party for how members are created
/// @see io.legisim.core.session.LegislatureSession for the voting loop
public class Legislator {

    private final String party;
    private final int id;
    private final double ideal;
    private final double initialError;
    private final double adjustment;
    private double error;

    /// Creates a legislator with its fatigue state at the configured starting radius.
    ///
    /// @param party name of the owning party, not null
    /// @param id identifier, unique within the owning party
    /// @param ideal preferred policy point
    /// @param initialError starting acceptance radius, must be non-negative
    /// @param adjustment radius increment applied after every vote, must be non-negative
    /// @throws IllegalArgumentException if `initialError` or `adjustment` is negative
    public Legislator(
            String party, int id, double ideal, double initialError, double adjustment) {
        if (initialError < 0) {
            throw new IllegalArgumentException("initialError must be >= 0");
        }
        if (adjustment < 0) {
            throw new IllegalArgumentException("adjustment must be >= 0");
        }
        this.party = party;
        this.id = id;
        this.ideal = ideal;
        this.initialError = initialError;
        this.adjustment = adjustment;
        this.error = initialError;
    }

    /// Casts a ballot on a proposal.
    ///
    /// The acceptance test uses the radius held before this call. The radius then
    /// grows by the adjustment regardless of the outcome.
    ///
    /// @apiNote **Side effects**: increments the acceptance radius by `adjustment`.
    ///
    /// @param proposed the policy point put to the vote
    /// @return `true` for yea, `false` for nay
    public boolean vote(double proposed) {
        boolean yea = window().contains(proposed);
        error += adjustment;
        return yea;
    }

    /// Returns the point this legislator would propose given the chamber median.
    ///
    /// The median itself when it lies within the current window, otherwise the window
    /// edge nearest to it. The result is always acceptable to this legislator.
    ///
    /// @param medianIdeal ideal point of the chamber's median seat
    /// @return the best-response proposal
    public double findProposal(double medianIdeal) {
        return window().clamp(medianIdeal);
    }

    /// Restores the acceptance radius to its configured starting value.
    public void resetFatigue() {
        error = initialError;
    }

    /// Returns the current acceptance window `[ideal - error, ideal + error]`.
    public AcceptanceWindow window() {
        return AcceptanceWindow.around(ideal, error);
    }

    public String getParty() {
        return party;
    }

    public int getId() {
        return id;
    }

    public double getIdeal() {
        return ideal;
    }

    public double getError() {
        return error;
    }

    public double getInitialError() {
        return initialError;
    }

    public double getAdjustment() {
        return adjustment;
    }

    @Override
    public String toString() {
        return "Legislator{party="
                + party
                + ", id="
                + id
                + ", ideal="
                + ideal
                + ", error="
                + error
                + "}";
    }
}
