package io.legisim.cli.commands;

import io.legisim.cli.ui.AnsiStyles;
import io.legisim.core.LegisimConfig;
import io.legisim.core.analysis.LinearFit;
import io.legisim.core.analysis.OutcomeRegression;
import io.legisim.core.session.ChamberConfig;
import io.legisim.core.sweep.OutcomeTable;
import io.legisim.core.sweep.ParameterGrid;
import io.legisim.core.sweep.SweepDriver;
import io.legisim.core.sweep.SweepType;
import io.legisim.serialization.OutcomeTableWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for running one of the comparative parameter sweeps.
///
/// Every grid value runs `reps` repetitions on a worker pool; the rows of all values
/// are written, in grid order, to the sweep's own file.
///
/// ### Usage
/// ```bash
/// legisim sweep <PARTY_SIZE|DISTANCE|INTRAPARTY> [-r <reps>] [-o <dir>] [-t <threads>]
///     [chamber options]
/// ```
///
/// Chamber options set the base configuration; the swept parameter overrides its own
/// option.
///
/// @see io.legisim.core.sweep.SweepDriver
@Command(name = "sweep", description = "Run a parameter sweep")
class SweepCommand extends LegisimCommand {

    private static final Logger logger = Logger.getLogger(SweepCommand.class.getName());

    @Parameters(
            index = "0",
            description = "Sweep to run: ${COMPLETION-CANDIDATES}")
    private SweepType type;

    @Mixin private ChamberOptions chamber = new ChamberOptions();

    @Option(
            names = {"-r", "--reps"},
            description = "Repetitions per grid value (default: ${DEFAULT-VALUE})")
    private int reps = 10_000;

    @Option(
            names = {"-o", "--output-dir"},
            description = "Directory receiving the sweep's CSV file")
    private Path outputDir = Path.of(".");

    @Option(
            names = {"-t", "--threads"},
            description = "Worker threads (default: available processors)")
    private int threads = new LegisimConfig().getThreadPoolSize();

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
            if (threads <= 0) {
                throw new IllegalArgumentException("--threads must be > 0, got " + threads);
            }
            ChamberConfig base = chamber.toConfig();
            ParameterGrid grid = type.grid();
            System.out.printf(
                    "%s %s%n",
                    styles.accent("*"), styles.bold("Sweeping " + type.column().header()));
            System.out.printf(
                    "%s%n%n",
                    styles.gray(
                            "  "
                                    + grid.start()
                                    + " "
                                    + styles.arrow()
                                    + " "
                                    + grid.end()
                                    + " in "
                                    + grid.count()
                                    + " steps "
                                    + styles.bullet()
                                    + " "
                                    + reps
                                    + " repetitions each "
                                    + styles.bullet()
                                    + " "
                                    + threads
                                    + " threads"));

            OutcomeTable table;
            LegisimConfig config = LegisimConfig.builder().threadPoolSize(threads).build();
            try (SweepDriver driver = new SweepDriver(config)) {
                table = driver.run(type, base, reps);
            }

            Path file = outputDir.resolve(type.outputFileName());
            writer.write(table, file);

            System.out.printf(
                    "%s %s%n",
                    styles.checkmark(), styles.bold("Wrote " + table.size() + " rows to " + file));
            if (!table.isEmpty()) {
                Optional<LinearFit> fit =
                        new OutcomeRegression().summarize(table, type.column()).overall();
                fit.ifPresent(
                        f ->
                                System.out.printf(
                                        Locale.ROOT,
                                        "  Votes ~ %s: slope %.4f %s intercept %.4f %s R² %.4f%n",
                                        type.column().header(),
                                        f.slope(),
                                        styles.bullet(),
                                        f.intercept(),
                                        styles.bullet(),
                                        f.rSquare()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.printf("%s %s%n", styles.crossmark(), styles.bold("Sweep interrupted"));
        } catch (Exception e) {
            logger.log(Level.FINE, "Sweep failed", e);
            System.err.printf(
                    "%s %s %s%n", styles.crossmark(), styles.bold("Sweep failed:"), e.getMessage());
        }
    }
}
