package io.legisim.core.legislator;

/// Closed interval of policy points a legislator is currently willing to accept.
///
/// @param lower inclusive lower bound, `ideal - error`
/// @param upper inclusive upper bound, `ideal + error`
public record AcceptanceWindow(double lower, double upper) {

    public AcceptanceWindow {
        if (lower > upper) {
            throw new IllegalArgumentException("Lower bound must be less than or equal to upper");
        }
    }

    /// Builds the window centred on an ideal point.
    ///
    /// @param ideal centre of the window
    /// @param radius non-negative half-width
    /// @return the window `[ideal - radius, ideal + radius]`, never null
    public static AcceptanceWindow around(double ideal, double radius) {
        return new AcceptanceWindow(ideal - radius, ideal + radius);
    }

    public boolean contains(double point) {
        return (lower <= point) && (point <= upper);
    }

    /// Returns the point of this window closest to `target`.
    ///
    /// `target` itself when inside, otherwise the nearer bound.
    public double clamp(double target) {
        if (target < lower) {
            return lower;
        }
        if (target > upper) {
            return upper;
        }
        return target;
    }
}
