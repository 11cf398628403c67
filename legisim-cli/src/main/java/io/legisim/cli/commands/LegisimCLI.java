package io.legisim.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ScopeType;

/// Main entry point for the Legisim CLI application.
///
/// Registers all available subcommands:
/// - `run` - Run repetitions of one chamber configuration and write `output.csv`
/// - `sweep` - Run a party-size, distance or intraparty sweep
/// - `summarize` - Regress the number of votes on one column of a written table
///
/// @see SimulateCommand
/// @see SweepCommand
/// @see SummarizeCommand
@Command(
        name = "legisim",
        description = "Spatial voting legislature simulator",
        mixinStandardHelpOptions = true,
        scope = ScopeType.INHERIT,
        version = "legisim 0.1.0",
        subcommands = {SimulateCommand.class, SweepCommand.class, SummarizeCommand.class})
public class LegisimCLI {

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine().execute(args));
    }

    /// Creates the command line with case-insensitive enum values.
    ///
    /// @return configured command line, never null
    public static CommandLine commandLine() {
        return new CommandLine(new LegisimCLI()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    private static void configureLogging() {
        try (InputStream in = LegisimCLI.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging configuration: " + e.getMessage());
        }
    }
}
