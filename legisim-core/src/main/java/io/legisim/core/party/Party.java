package io.legisim.core.party;

import io.legisim.core.legislator.Legislator;
import io.legisim.core.legislator.Roster;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/// A group of legislators whose ideal points share one normal distribution.
///
/// Members are drawn at construction time against the chamber's shared seat count.
/// Each accepted draw is clipped into the policy space, wrapped in a {@link Legislator}
/// carrying the party's fatigue parameters, and seated both here and in the
/// {@link Roster}.
///
/// ### Seat Exhaustion
/// When the roster runs out of seats before `requestedSize` members are drawn, the
/// party stops early and logs a warning. The party is then smaller than requested;
/// this is not an error.
///
/// @implNote **Not thread-safe**. Draws consume the caller's random generator, so the
/// order in which parties are populated is part of a session's reproducibility.
///
/// @see PartyProfile
/// @see ClippingRule
public final class Party {

    private static final Logger logger = Logger.getLogger(Party.class.getName());

    private final String name;
    private final int requestedSize;
    private final double mu;
    private final PartyProfile profile;
    private final List<Legislator> members;

    private Party(
            String name,
            int requestedSize,
            double mu,
            PartyProfile profile,
            List<Legislator> members) {
        this.name = name;
        this.requestedSize = requestedSize;
        this.mu = mu;
        this.profile = profile;
        this.members = Collections.unmodifiableList(members);
    }

    /// Draws a party's members and seats them in the roster.
    ///
    /// @apiNote **Side effects**:
    /// - Consumes one normal sample from `random` per seated member
    /// - Seats every created member in `roster`
    ///
    /// @param name label used in log output, not null
    /// @param requestedSize number of members to create, must be non-negative
    /// @param mu mean ideal point
    /// @param profile spread and fatigue parameters, not null
    /// @param clippingRule how out-of-range draws are mapped back, not null
    /// @param random seeded generator shared by the session, not null
    /// @param roster chamber roster holding the remaining seats, not null
    /// @return the populated party, never null
    /// @throws IllegalArgumentException if `requestedSize` is negative
    public static Party populate(
            String name,
            int requestedSize,
            double mu,
            PartyProfile profile,
            ClippingRule clippingRule,
            RandomGenerator random,
            Roster roster) {
        if (requestedSize < 0) {
            throw new IllegalArgumentException("requestedSize must be >= 0");
        }

        NormalDistribution distribution = new NormalDistribution(random, mu, profile.sigma());
        List<Legislator> members = new ArrayList<>(requestedSize);

        for (int i = 0; i < requestedSize; i++) {
            if (roster.isFull()) {
                logger.warning(
                        "All seats are filled; party "
                                + name
                                + " seated "
                                + members.size()
                                + " of "
                                + requestedSize
                                + " requested members");
                break;
            }
            double ideal = clippingRule.apply(distribution.sample());
            Legislator member =
                    new Legislator(name, i, ideal, profile.error(), profile.adjustment());
            members.add(member);
            roster.seat(member);
        }

        return new Party(name, requestedSize, mu, profile, members);
    }

    /// Restores every member's acceptance radius to the party's configured value.
    public void resetFatigue() {
        for (Legislator member : members) {
            member.resetFatigue();
        }
    }

    public String getName() {
        return name;
    }

    public int getRequestedSize() {
        return requestedSize;
    }

    /// Returns the number of members actually seated, at most the requested size.
    public int size() {
        return members.size();
    }

    public double getMu() {
        return mu;
    }

    public PartyProfile getProfile() {
        return profile;
    }

    /// Returns the party's members in creation order.
    ///
    /// @return unmodifiable member list, never null
    public List<Legislator> getMembers() {
        return members;
    }
}
