package io.legisim.cli.commands;

/// Minimal abstract base for all Legisim CLI commands.
///
/// Owns the banner display and the {@link #run()} / {@link #execute()} contract.
/// Subclasses provide command-specific option sets and implement {@link #execute()}.
///
/// @see SimulateCommand
/// @see SweepCommand
/// @see SummarizeCommand
public abstract class LegisimCommand implements Runnable {

    private static final String[] BANNER = {
        "",
        "  _            _     _",
        " | | ___  __ _(_)___(_)_ __ ___",
        " | |/ _ \\/ _` | / __| | '_ ` _ \\",
        " | |  __/ (_| | \\__ \\ | | | | | |",
        " |_|\\___|\\__, |_|___/_|_| |_| |_|",
        "         |___/",
        "",
        " Spatial Voting Legislature Simulator",
        ""
    };

    @Override
    public final void run() {
        for (String line : BANNER) {
            System.out.println(line);
        }
        execute();
    }

    protected abstract void execute();
}
