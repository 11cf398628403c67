package io.legisim.cli.commands;

import io.legisim.cli.execution.VerboseSessionListener;
import io.legisim.cli.ui.AnsiStyles;
import io.legisim.core.analysis.OutcomeRegression;
import io.legisim.core.analysis.VoteStatistics;
import io.legisim.core.session.ChamberConfig;
import io.legisim.core.session.LegislatureSimulator;
import io.legisim.core.session.OutcomeColumn;
import io.legisim.core.session.SessionListener;
import io.legisim.core.sweep.OutcomeTable;
import io.legisim.core.sweep.SweepType;
import io.legisim.serialization.OutcomeTableWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/// CLI command for running repetitions of a single chamber configuration.
///
/// ### Usage
/// ```bash
/// legisim run [-r <reps>] [-o <dir>] [-v] [--no-color] [chamber options]
/// ```
///
/// ### Options
/// - `-r, --reps` - Number of repetitions (default 10000)
/// - `-o, --output-dir` - Directory receiving `output.csv`
/// - `-v, --verbose` - Print every round of every repetition
/// - `--no-color` - Disable ANSI color output
///
/// @see io.legisim.core.session.LegislatureSimulator
@Command(name = "run", description = "Run repetitions of one chamber configuration")
class SimulateCommand extends LegisimCommand {

    private static final Logger logger = Logger.getLogger(SimulateCommand.class.getName());

    @Mixin private ChamberOptions chamber = new ChamberOptions();

    @Option(
            names = {"-r", "--reps"},
            description = "Number of repetitions (default: ${DEFAULT-VALUE})")
    private int reps = 10_000;

    @Option(
            names = {"-o", "--output-dir"},
            description = "Directory receiving " + SweepType.DEFAULT_OUTPUT_FILE)
    private Path outputDir = Path.of(".");

    @Option(
            names = {"-v", "--verbose"},
            description = "Print every round of every repetition")
    private boolean verbose = false;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    private boolean color = true;

    private OutcomeTableWriter writer = new OutcomeTableWriter();

    @Override
    protected void execute() {
        AnsiStyles styles = AnsiStyles.of(color);

        try {
            ChamberConfig config = chamber.toConfig();
            System.out.printf(
                    "%s %s%n",
                    styles.accent("*"),
                    styles.bold("Running " + reps + " repetitions"));
            System.out.printf(
                    "%s%n%n",
                    styles.gray(
                            "  Seats: "
                                    + config.seats()
                                    + " "
                                    + styles.bullet()
                                    + " Majority: "
                                    + config.majorityPartySize()
                                    + " "
                                    + styles.bullet()
                                    + " Distance: "
                                    + config.distanceBetweenMedians()
                                    + " "
                                    + styles.bullet()
                                    + " Seed: "
                                    + config.baseSeed()));

            SessionListener listener =
                    verbose
                            ? new VerboseSessionListener(System.out, color, config.seats())
                            : SessionListener.NOOP;
            OutcomeTable table =
                    OutcomeTable.of(new LegislatureSimulator(listener).runBatch(config, reps));

            Path file = outputDir.resolve(SweepType.DEFAULT_OUTPUT_FILE);
            writer.write(table, file);

            System.out.printf(
                    "%s %s%n",
                    styles.checkmark(), styles.bold("Wrote " + table.size() + " rows to " + file));
            if (!table.isEmpty()) {
                VoteStatistics votes =
                        new OutcomeRegression()
                                .summarize(table, OutcomeColumn.INITIAL_VALUE)
                                .votes();
                System.out.printf(
                        Locale.ROOT,
                        "  Votes to pass: mean %.2f %s median %.0f %s max %.0f%n",
                        votes.mean(),
                        styles.bullet(),
                        votes.median(),
                        styles.bullet(),
                        votes.max());
            }
        } catch (Exception e) {
            logger.log(Level.FINE, "Simulation failed", e);
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(), styles.bold("Simulation failed:"), e.getMessage());
        }
    }
}
