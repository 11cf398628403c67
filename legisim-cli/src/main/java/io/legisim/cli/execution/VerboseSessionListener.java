package io.legisim.cli.execution;

import io.legisim.cli.ui.AnsiStyles;
import io.legisim.core.legislator.Legislator;
import io.legisim.core.session.OutcomeRecord;
import io.legisim.core.session.RoundResult;
import io.legisim.core.session.SessionListener;
import java.io.PrintStream;
import java.util.Locale;

/// Session listener that prints every round of every repetition to the terminal.
///
/// ### Output Format
/// ```
/// ──────────────────────────────────────────────────────────────
///   Repetition 1 • median ideal 0.0213
///   Proposer minority #17 (ideal -0.4410) → round 1
///   Round 1: proposal -0.3910 failed. Yeas- 44 Nays- 57
///   Round 2: proposal -0.3810 passed. Yeas- 52 Nays- 49
///   ✓ Passed after 2 votes
/// ```
///
/// @implNote **Not thread-safe**. Output interleaves if sessions run in parallel.
/// @see io.legisim.core.session.SessionListener
public class VerboseSessionListener implements SessionListener {

    private final PrintStream out;
    private final AnsiStyles styles;
    private final int seats;

    /// Creates a verbose listener.
    ///
    /// @param out      output stream for printing (typically System.out), not null
    /// @param useColor whether to apply ANSI color codes
    /// @param seats    chamber size, used to derive the nay count
    public VerboseSessionListener(PrintStream out, boolean useColor, int seats) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
        this.seats = seats;
    }

    @Override
    public void onSessionStart(int repetition, double medianIdeal) {
        out.println(styles.separator());
        out.printf(
                "  %s %s median ideal %s%n",
                styles.bold("Repetition " + (repetition + 1)),
                styles.bullet(),
                format(medianIdeal));
    }

    @Override
    public void onProposerSelected(Legislator proposer, int round) {
        out.printf(
                "  %s%n",
                styles.gray(
                        "Proposer "
                                + proposer.getParty()
                                + " #"
                                + proposer.getId()
                                + " (ideal "
                                + format(proposer.getIdeal())
                                + ") "
                                + styles.arrow()
                                + " round "
                                + round));
    }

    @Override
    public void onRoundComplete(RoundResult result) {
        out.printf(
                "  Round %d: proposal %s %s. Yeas- %d Nays- %d%n",
                result.round(),
                format(result.proposal()),
                styles.ballot(result.passed() ? "passed" : "failed", result.passed()),
                result.yeas(),
                seats - result.yeas());
    }

    @Override
    public void onPassed(OutcomeRecord outcome) {
        out.printf(
                "  %s Passed after %d votes%n%n", styles.checkmark(), outcome.numberOfVotes());
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
