package io.legisim.core.sweep;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Evenly spaced sweep values `start, start + step, ..., start + (count - 1) * step`.
///
/// Values are computed in decimal arithmetic, so a grid such as `0.0, 0.05, ..., 2.0`
/// yields `0.15` rather than `0.15000000000000002`.
///
/// @param start first value
/// @param step spacing between consecutive values, must be positive
/// @param count number of values, must be positive
public record ParameterGrid(double start, double step, int count) {

    public ParameterGrid {
        if (!(step > 0)) {
            throw new IllegalArgumentException("step must be > 0");
        }
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
    }

    /// Returns a grid containing the single value `value`.
    public static ParameterGrid single(double value) {
        return new ParameterGrid(value, 1.0, 1);
    }

    /// Returns the grid values in ascending order.
    ///
    /// @return unmodifiable list of `count` values, never null
    public List<Double> values() {
        BigDecimal first = BigDecimal.valueOf(start);
        BigDecimal increment = BigDecimal.valueOf(step);
        List<Double> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(first.add(increment.multiply(BigDecimal.valueOf(i))).doubleValue());
        }
        return Collections.unmodifiableList(values);
    }

    /// Returns the last grid value.
    public double end() {
        return BigDecimal.valueOf(start)
                .add(BigDecimal.valueOf(step).multiply(BigDecimal.valueOf(count - 1L)))
                .doubleValue();
    }
}
