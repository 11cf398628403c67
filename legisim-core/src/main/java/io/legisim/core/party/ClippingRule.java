package io.legisim.core.party;

/// How a drawn ideal point outside the policy space `[-1, 1]` is brought back inside.
public enum ClippingRule {

    /// Draws above `1.0` become `1.0`; draws below `-1.0` become `0.0`.
    ///
    /// Preserves the historical asymmetric clipping rule.
    LEGACY {
        @Override
        public double apply(double ideal) {
            if (ideal > UPPER_BOUND) {
                return UPPER_BOUND;
            } else if (ideal < LOWER_BOUND) {
                return 0.0;
            }
            return ideal;
        }
    },

    /// Draws are clamped to the nearest bound.
    SYMMETRIC {
        @Override
        public double apply(double ideal) {
            return Math.max(LOWER_BOUND, Math.min(UPPER_BOUND, ideal));
        }
    };

    public static final double LOWER_BOUND = -1.0;
    public static final double UPPER_BOUND = 1.0;

    /// Maps a raw draw into the policy space.
    ///
    /// @param ideal raw sample from the party distribution
    /// @return the clipped ideal point
    public abstract double apply(double ideal);
}
