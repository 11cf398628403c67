package io.legisim.core.session;

import io.legisim.core.exception.InvalidChamberConfigException;
import io.legisim.core.party.ClippingRule;
import io.legisim.core.party.PartyProfile;

/// Parameters of one simulated chamber, shared by every repetition of a batch.
///
/// The majority party is centred at `+distanceBetweenMedians / 2` and the minority at
/// `-distanceBetweenMedians / 2`. The minority receives every seat the majority does
/// not: `seats - majorityPartySize`.
///
/// ### Contracts
/// - **Precondition**: `seats > 0`, `0 <= majorityPartySize <= seats`, finite distance,
///   `maxRounds > 0`, non-null profiles and rules
/// - **Postcondition**: All fields immutable after construction
///
/// @param seats total number of chamber seats
/// @param majorityPartySize seats requested by the majority party
/// @param distanceBetweenMedians distance between the two party means
/// @param majority majority party spread and fatigue, not null
/// @param minority minority party spread and fatigue, not null
/// @param baseSeed seed of repetition 0; repetition `i` is seeded with `baseSeed + i`
/// @param maxRounds number of failed votes after which a session is declared divergent
/// @param clippingRule mapping of out-of-range ideal points, not null
/// @param proposerPolicy proposer selection after a failed vote, not null
/// @see LegislatureSession for how the parameters drive a session
public record ChamberConfig(
        int seats,
        int majorityPartySize,
        double distanceBetweenMedians,
        PartyProfile majority,
        PartyProfile minority,
        long baseSeed,
        int maxRounds,
        ClippingRule clippingRule,
        ProposerPolicy proposerPolicy) {

    public static final int DEFAULT_SEATS = 101;
    public static final int DEFAULT_MAJORITY_SIZE = 51;
    public static final double DEFAULT_DISTANCE = 1.0;
    public static final int DEFAULT_MAX_ROUNDS = 10_000;

    /// Compact constructor with validation.
    public ChamberConfig {
        if (seats <= 0) {
            throw new InvalidChamberConfigException("seats", "must be > 0, got " + seats);
        }
        if (majorityPartySize < 0 || majorityPartySize > seats) {
            throw new InvalidChamberConfigException(
                    "majorityPartySize",
                    "must be between 0 and " + seats + ", got " + majorityPartySize);
        }
        if (!Double.isFinite(distanceBetweenMedians)) {
            throw new InvalidChamberConfigException("distanceBetweenMedians", "must be finite");
        }
        if (majority == null) {
            throw new InvalidChamberConfigException("majority", "must not be null");
        }
        if (minority == null) {
            throw new InvalidChamberConfigException("minority", "must not be null");
        }
        if (maxRounds <= 0) {
            throw new InvalidChamberConfigException(
                    "maxRounds", "must be > 0, got " + maxRounds);
        }
        if (clippingRule == null) {
            clippingRule = ClippingRule.LEGACY;
        }
        if (proposerPolicy == null) {
            proposerPolicy = ProposerPolicy.PERSISTENT;
        }
    }

    /// Returns the configuration of the historical default run.
    ///
    /// Defaults:
    /// - seats: 101, majority size: 51, distance: 1.0
    /// - both parties: {@link PartyProfile#defaults()}
    /// - baseSeed: 0, maxRounds: 10 000
    /// - legacy clipping, persistent proposer
    ///
    /// @return default configuration, never null
    public static ChamberConfig defaults() {
        return new ChamberConfig(
                DEFAULT_SEATS,
                DEFAULT_MAJORITY_SIZE,
                DEFAULT_DISTANCE,
                PartyProfile.defaults(),
                PartyProfile.defaults(),
                0L,
                DEFAULT_MAX_ROUNDS,
                ClippingRule.LEGACY,
                ProposerPolicy.PERSISTENT);
    }

    /// Returns the number of seats requested by the minority party.
    public int minorityPartySize() {
        return seats - majorityPartySize;
    }

    /// Returns the mean ideal point of the majority party.
    public double majorityMean() {
        return distanceBetweenMedians / 2;
    }

    /// Returns the mean ideal point of the minority party.
    public double minorityMean() {
        return -distanceBetweenMedians / 2;
    }

    /// Returns the seed of a given zero-based repetition.
    public long seedFor(int repetition) {
        return baseSeed + repetition;
    }

    /// Returns a copy with updated majority party size.
    public ChamberConfig withMajorityPartySize(int size) {
        return new ChamberConfig(
                seats, size, distanceBetweenMedians, majority, minority, baseSeed, maxRounds,
                clippingRule, proposerPolicy);
    }

    /// Returns a copy with updated distance between party means.
    public ChamberConfig withDistanceBetweenMedians(double distance) {
        return new ChamberConfig(
                seats, majorityPartySize, distance, majority, minority, baseSeed, maxRounds,
                clippingRule, proposerPolicy);
    }

    /// Returns a copy with both party profiles replaced.
    public ChamberConfig withProfiles(PartyProfile majorityProfile, PartyProfile minorityProfile) {
        return new ChamberConfig(
                seats, majorityPartySize, distanceBetweenMedians, majorityProfile,
                minorityProfile, baseSeed, maxRounds, clippingRule, proposerPolicy);
    }

    /// Returns a copy with updated base seed.
    public ChamberConfig withBaseSeed(long seed) {
        return new ChamberConfig(
                seats, majorityPartySize, distanceBetweenMedians, majority, minority, seed,
                maxRounds, clippingRule, proposerPolicy);
    }

    /// Returns a copy with updated round cap.
    public ChamberConfig withMaxRounds(int rounds) {
        return new ChamberConfig(
                seats, majorityPartySize, distanceBetweenMedians, majority, minority, baseSeed,
                rounds, clippingRule, proposerPolicy);
    }

    /// Returns a copy with updated proposer policy.
    public ChamberConfig withProposerPolicy(ProposerPolicy policy) {
        return new ChamberConfig(
                seats, majorityPartySize, distanceBetweenMedians, majority, minority, baseSeed,
                maxRounds, clippingRule, policy);
    }

    /// Returns a copy with updated clipping rule.
    public ChamberConfig withClippingRule(ClippingRule rule) {
        return new ChamberConfig(
                seats, majorityPartySize, distanceBetweenMedians, majority, minority, baseSeed,
                maxRounds, rule, proposerPolicy);
    }
}
