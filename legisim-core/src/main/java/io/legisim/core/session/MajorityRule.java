package io.legisim.core.session;

import io.legisim.core.legislator.Legislator;
import java.util.List;

/// Simple-majority tally with an automatic yea from the proposer.
///
/// Every member of the roster, the proposer included, casts a ballot, so every member
/// accrues fatigue. The proposer's ballot is then counted as yea whatever the
/// acceptance test returned.
///
/// ### Threshold
/// A proposal passes iff `yeas > seats / 2`. For an odd chamber this is
/// `yeas >= (seats + 1) / 2`; for an even chamber a tie fails.
public final class MajorityRule {

    private final int seats;

    /// Creates a rule for a chamber of the given size.
    ///
    /// @param seats chamber size the threshold is computed against, must be positive
    /// @throws IllegalArgumentException if `seats` is not positive
    public MajorityRule(int seats) {
        if (seats <= 0) {
            throw new IllegalArgumentException("seats must be > 0");
        }
        this.seats = seats;
    }

    /// Collects ballots on a proposal from the whole roster.
    ///
    /// @apiNote **Side effects**: every legislator in `voters` accrues one round of fatigue.
    ///
    /// @param voters every seated legislator, not null
    /// @param proposer member who put the proposal forward, not null
    /// @param proposal the policy point under vote
    /// @return number of yea ballots, proposer included
    public int tally(List<Legislator> voters, Legislator proposer, double proposal) {
        int yeas = 0;
        for (Legislator voter : voters) {
            boolean accepted = voter.vote(proposal);
            if (accepted || voter == proposer) {
                yeas++;
            }
        }
        return yeas;
    }

    /// Returns whether a yea count carries the chamber.
    ///
    /// @param yeas number of yea ballots
    /// @return `true` iff `yeas` is a strict majority of the seats
    public boolean passes(int yeas) {
        return yeas > seats / 2.0;
    }

    /// Returns the smallest yea count that carries the chamber.
    public int threshold() {
        return seats / 2 + 1;
    }

    public int getSeats() {
        return seats;
    }
}
