package io.legisim.cli.commands;

import io.legisim.cli.ui.AnsiStyles;
import io.legisim.core.analysis.LinearFit;
import io.legisim.core.analysis.OutcomeRegression;
import io.legisim.core.analysis.OutcomeSummary;
import io.legisim.core.analysis.VoteStatistics;
import io.legisim.core.session.OutcomeColumn;
import io.legisim.core.sweep.OutcomeTable;
import io.legisim.serialization.OutcomeTableReader;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for regressing the number of votes on one column of a written table.
///
/// Prints the vote-count distribution and three least-squares lines: over all rows,
/// over rows whose first proposal opened at or left of the centre, and over rows that
/// opened right of it.
///
/// ### Usage
/// ```bash
/// legisim summarize output_party_distance.csv --column "Distance between Medians"
/// ```
///
/// The column may be given by its header or by its constant name
/// (`DISTANCE_BETWEEN_MEDIANS`).
///
/// @see io.legisim.core.analysis.OutcomeRegression
@Command(name = "summarize", description = "Regress votes on a column of an outcome table")
class SummarizeCommand extends LegisimCommand {

    private static final Logger logger = Logger.getLogger(SummarizeCommand.class.getName());

    @Parameters(index = "0", description = "Outcome table written by run or sweep")
    private Path csvFile;

    @Option(
            names = {"-c", "--column"},
            required = true,
            description = "Predictor column header")
    private String column;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    private OutcomeTableReader reader = new OutcomeTableReader();

    @Override
    protected void execute() {
        AnsiStyles styles = AnsiStyles.of(color);

        try {
            OutcomeColumn predictor = resolveColumn(column);
            OutcomeTable table = reader.read(csvFile);
            OutcomeSummary summary = new OutcomeRegression().summarize(table, predictor);

            System.out.printf(
                    "%s %s%n",
                    styles.checkmark(),
                    styles.bold("Votes ~ " + predictor.header() + " (" + table.size() + " rows)"));

            VoteStatistics votes = summary.votes();
            System.out.printf(
                    Locale.ROOT,
                    "  Votes: mean %.2f %s sd %.2f %s min %.0f %s median %.0f %s max %.0f%n%n",
                    votes.mean(),
                    styles.bullet(),
                    votes.standardDeviation(),
                    styles.bullet(),
                    votes.min(),
                    styles.bullet(),
                    votes.median(),
                    styles.bullet(),
                    votes.max());

            printFit(styles, "All rows", summary.overall());
            printFit(styles, "Initial Value <= 0", summary.nonPositiveStart());
            printFit(styles, "Initial Value > 0", summary.positiveStart());
        } catch (Exception e) {
            logger.log(Level.FINE, "Summary failed", e);
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Summary failed:"), e.getMessage());
        }
    }

    private void printFit(AnsiStyles styles, String label, Optional<LinearFit> fit) {
        if (fit.isEmpty()) {
            System.out.printf(
                    "  %s %s%n", styles.bold(label), styles.gray("(fewer than two rows)"));
            return;
        }
        LinearFit f = fit.get();
        System.out.printf(
                Locale.ROOT,
                "  %s %s n=%d, slope %.4f (se %.4f), intercept %.4f, R² %.4f%n",
                styles.bold(label),
                styles.arrow(),
                f.observations(),
                f.slope(),
                f.slopeStdErr(),
                f.intercept(),
                f.rSquare());
    }

    /// Resolves a column from its header or constant name.
    static OutcomeColumn resolveColumn(String name) {
        Optional<OutcomeColumn> byHeader = OutcomeColumn.fromHeader(name);
        if (byHeader.isPresent()) {
            return byHeader.get();
        }
        return Arrays.stream(OutcomeColumn.values())
                .filter(c -> c.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(
                        () ->
                                new IllegalArgumentException(
                                        "Unknown column '"
                                                + name
                                                + "'. Expected one of: "
                                                + Arrays.stream(OutcomeColumn.values())
                                                        .map(OutcomeColumn::header)
                                                        .collect(Collectors.joining(", "))));
    }
}
