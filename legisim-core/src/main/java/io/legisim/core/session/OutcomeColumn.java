package io.legisim.core.session;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/// Columns of the outcome table, in output order, with their published headers.
///
/// The row index is not a column; writers emit it separately as the leading
/// unnamed column.
public enum OutcomeColumn {
    INITIAL_VALUE("Initial Value", false, OutcomeRecord::initialValue),
    FINAL_VALUE("Final Value", false, OutcomeRecord::finalValue),
    NUMBER_OF_VOTES("Number of Votes", true, OutcomeRecord::numberOfVotes),
    YEAS("Yeas", true, OutcomeRecord::yeas),
    MAJORITY_PARTY_SIZE("Majority Party Size", true, OutcomeRecord::majorityPartySize),
    DISTANCE_BETWEEN_MEDIANS(
            "Distance between Medians", false, OutcomeRecord::distanceBetweenMedians),
    MAJORITY_SIGMA("Majority St. Dev.", false, OutcomeRecord::majoritySigma),
    MAJORITY_ADJUSTMENT("Majority Round Adjustment", false, OutcomeRecord::majorityAdjustment),
    MINORITY_SIGMA("Minority St. Dev.", false, OutcomeRecord::minoritySigma),
    MINORITY_ADJUSTMENT("Minority Round Adjustment", false, OutcomeRecord::minorityAdjustment);

    private final String header;
    private final boolean integral;
    private final ToDoubleFunction<OutcomeRecord> accessor;

    OutcomeColumn(String header, boolean integral, ToDoubleFunction<OutcomeRecord> accessor) {
        this.header = header;
        this.integral = integral;
        this.accessor = accessor;
    }

    /// Returns the column header as written to the table.
    public String header() {
        return header;
    }

    /// Returns whether the column holds whole numbers.
    public boolean isIntegral() {
        return integral;
    }

    /// Reads this column's value from a record.
    ///
    /// @param record the record to read, not null
    /// @return the column value, widened to double for integral columns
    public double valueOf(OutcomeRecord record) {
        return accessor.applyAsDouble(record);
    }

    /// Looks up a column by its published header.
    ///
    /// @param header exact header text, may be null
    /// @return the matching column, or empty if none matches
    public static Optional<OutcomeColumn> fromHeader(String header) {
        return Arrays.stream(values()).filter(c -> c.header.equals(header)).findFirst();
    }
}
