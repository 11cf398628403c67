package io.legisim.core.party;

import io.legisim.core.exception.InvalidChamberConfigException;

/// Distribution and fatigue parameters shared by every member of one party.
///
/// The party mean is not part of the profile; it is derived from the chamber's
/// distance between medians.
///
/// ### Contracts
/// - **Precondition**: `sigma > 0`, `error >= 0`, `adjustment >= 0`
///
/// @param sigma standard deviation of member ideal points
/// @param error starting acceptance radius of every member
/// @param adjustment per-vote fatigue increment of every member
public record PartyProfile(double sigma, double error, double adjustment) {

    /// Compact constructor with validation.
    public PartyProfile {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new InvalidChamberConfigException("sigma", "must be a finite value > 0");
        }
        if (!(error >= 0) || Double.isInfinite(error)) {
            throw new InvalidChamberConfigException("error", "must be a finite value >= 0");
        }
        if (!(adjustment >= 0) || Double.isInfinite(adjustment)) {
            throw new InvalidChamberConfigException("adjustment", "must be a finite value >= 0");
        }
    }

    /// Returns the profile used by the historical runs.
    ///
    /// Defaults:
    /// - sigma: 0.1
    /// - error: 0.02
    /// - adjustment: 0.01
    ///
    /// @return default profile, never null
    public static PartyProfile defaults() {
        return new PartyProfile(0.1, 0.02, 0.01);
    }

    /// Returns a copy with updated sigma.
    ///
    /// @param newSigma standard deviation, must be positive
    /// @return new profile, never null
    public PartyProfile withSigma(double newSigma) {
        return new PartyProfile(newSigma, error, adjustment);
    }
}
