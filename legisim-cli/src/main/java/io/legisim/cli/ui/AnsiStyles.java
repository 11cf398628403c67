package io.legisim.cli.ui;

/// Terminal styling for command and session output.
///
/// With color disabled every method returns its text unchanged, so callers format the
/// same way whether or not the terminal supports ANSI codes.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(color);
/// out.println(styles.checkmark() + " " + styles.bold("Wrote 10000 rows"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String RULE = "\033[38;5;241m";
    private static final String PASSED = "\033[0;32m";
    private static final String FAILED = "\033[38;5;214m";
    private static final String ERROR = "\033[38;5;167m";
    private static final String ACCENT = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private static final int RULE_WIDTH = 62;

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// @param useColor `true` to emit ANSI codes, `false` for plain text
    /// @return styles for the chosen mode, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public String bold(String text) {
        return wrap(text, BOLD);
    }

    /// Secondary detail lines: parameters, proposer selection.
    public String gray(String text) {
        return wrap(text, GRAY);
    }

    public String accent(String text) {
        return wrap(text, ACCENT);
    }

    /// Green for a passed ballot, amber for a failed one.
    public String ballot(String text, boolean passed) {
        return wrap(text, passed ? PASSED : FAILED);
    }

    public String arrow() {
        return wrap("→", ACCENT);
    }

    public String bullet() {
        return wrap("•", GRAY);
    }

    public String checkmark() {
        return wrap("✓", PASSED);
    }

    public String crossmark() {
        return wrap("✗", ERROR);
    }

    /// Horizontal rule printed between repetitions.
    public String separator() {
        return wrap("─".repeat(RULE_WIDTH), RULE);
    }

    private String wrap(String text, String code) {
        return useColor ? code + text + RESET : text;
    }
}
