package io.legisim.core.analysis;

import java.util.Optional;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/// Ordinary least-squares line `votes = intercept + slope * x`.
///
/// @param observations number of rows fitted
/// @param intercept fitted intercept
/// @param slope fitted slope
/// @param slopeStdErr standard error of the slope, `NaN` with fewer than three rows
/// @param rSquare coefficient of determination, `NaN` when `x` is constant
public record LinearFit(
        long observations, double intercept, double slope, double slopeStdErr, double rSquare) {

    /// Extracts the fit from an accumulated regression.
    ///
    /// @param regression the regression holding the observations, not null
    /// @return the fit, or empty with fewer than two observations
    static Optional<LinearFit> from(SimpleRegression regression) {
        if (regression.getN() < 2) {
            return Optional.empty();
        }
        return Optional.of(
                new LinearFit(
                        regression.getN(),
                        regression.getIntercept(),
                        regression.getSlope(),
                        regression.getSlopeStdErr(),
                        regression.getRSquare()));
    }
}
