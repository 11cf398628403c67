package io.legisim.core.analysis;

import io.legisim.core.session.OutcomeColumn;
import io.legisim.core.session.OutcomeRecord;
import io.legisim.core.sweep.OutcomeTable;
import java.util.logging.Logger;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/// Fits the number of votes against a swept parameter.
///
/// Rows are split by where the first proposer opened: at or left of the centre
/// (`Initial Value <= 0`) or right of it (`Initial Value > 0`), and each group gets
/// its own line.
///
/// @implNote Stateless and thread-safe.
public class OutcomeRegression {

    private static final Logger logger = Logger.getLogger(OutcomeRegression.class.getName());

    /// Summarizes a table against the given predictor column.
    ///
    /// @param table rows to fit, not null
    /// @param predictor the column used as `x`, not null
    /// @return the summary, never null
    /// @throws IllegalArgumentException if `table` is empty
    public OutcomeSummary summarize(OutcomeTable table, OutcomeColumn predictor) {
        if (table.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarize an empty table");
        }

        DescriptiveStatistics votes = new DescriptiveStatistics();
        SimpleRegression overall = new SimpleRegression();
        SimpleRegression nonPositive = new SimpleRegression();
        SimpleRegression positive = new SimpleRegression();

        for (OutcomeRecord row : table.rows()) {
            double x = predictor.valueOf(row);
            double y = row.numberOfVotes();
            votes.addValue(y);
            overall.addData(x, y);
            if (row.initialValue() <= 0) {
                nonPositive.addData(x, y);
            } else {
                positive.addData(x, y);
            }
        }

        logger.fine(
                "Fitted "
                        + table.size()
                        + " rows against "
                        + predictor.header()
                        + " ("
                        + nonPositive.getN()
                        + " non-positive, "
                        + positive.getN()
                        + " positive)");

        return new OutcomeSummary(
                predictor,
                VoteStatistics.from(votes),
                LinearFit.from(overall),
                LinearFit.from(nonPositive),
                LinearFit.from(positive));
    }
}
