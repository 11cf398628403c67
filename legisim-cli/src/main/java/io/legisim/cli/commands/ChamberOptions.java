package io.legisim.cli.commands;

import io.legisim.core.party.ClippingRule;
import io.legisim.core.party.PartyProfile;
import io.legisim.core.session.ChamberConfig;
import io.legisim.core.session.ProposerPolicy;
import io.legisim.serialization.ChamberConfigSerializer;
import java.io.IOException;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/// Chamber parameters shared by every command that runs sessions.
///
/// Every option defaults to the value of {@link ChamberConfig#defaults()}. When
/// `--config` names a JSON file, the file is the whole configuration and the other
/// options are ignored.
///
/// @see ChamberConfigSerializer for the file format
class ChamberOptions {

    @Option(
            names = "--seats",
            description = "Number of chamber seats (default: ${DEFAULT-VALUE})")
    int seats = ChamberConfig.DEFAULT_SEATS;

    @Option(
            names = "--majority-size",
            description = "Seats held by the majority party (default: ${DEFAULT-VALUE})")
    int majoritySize = ChamberConfig.DEFAULT_MAJORITY_SIZE;

    @Option(
            names = "--distance",
            description = "Distance between the party medians (default: ${DEFAULT-VALUE})")
    double distance = ChamberConfig.DEFAULT_DISTANCE;

    @Option(
            names = "--majority-sigma",
            description = "Majority ideal-point standard deviation (default: ${DEFAULT-VALUE})")
    double majoritySigma = PartyProfile.defaults().sigma();

    @Option(
            names = "--majority-error",
            description = "Majority initial acceptance radius (default: ${DEFAULT-VALUE})")
    double majorityError = PartyProfile.defaults().error();

    @Option(
            names = "--majority-adj",
            description = "Majority per-vote fatigue increment (default: ${DEFAULT-VALUE})")
    double majorityAdjustment = PartyProfile.defaults().adjustment();

    @Option(
            names = "--minority-sigma",
            description = "Minority ideal-point standard deviation (default: ${DEFAULT-VALUE})")
    double minoritySigma = PartyProfile.defaults().sigma();

    @Option(
            names = "--minority-error",
            description = "Minority initial acceptance radius (default: ${DEFAULT-VALUE})")
    double minorityError = PartyProfile.defaults().error();

    @Option(
            names = "--minority-adj",
            description = "Minority per-vote fatigue increment (default: ${DEFAULT-VALUE})")
    double minorityAdjustment = PartyProfile.defaults().adjustment();

    @Option(
            names = "--seed",
            description = "Seed of the first repetition (default: ${DEFAULT-VALUE})")
    long seed = 0L;

    @Option(
            names = "--max-rounds",
            description =
                    "Failed votes before a repetition is abandoned (default: ${DEFAULT-VALUE})")
    int maxRounds = ChamberConfig.DEFAULT_MAX_ROUNDS;

    @Option(
            names = "--clipping",
            description =
                    "Out-of-range ideal points: ${COMPLETION-CANDIDATES}"
                            + " (default: ${DEFAULT-VALUE})")
    ClippingRule clipping = ClippingRule.LEGACY;

    @Option(
            names = "--proposer-policy",
            description =
                    "Proposer after a failed vote: ${COMPLETION-CANDIDATES}"
                            + " (default: ${DEFAULT-VALUE})")
    ProposerPolicy proposerPolicy = ProposerPolicy.PERSISTENT;

    @Option(
            names = "--config",
            description = "JSON chamber configuration; replaces every other chamber option")
    Path configFile;

    /// Builds the chamber configuration from the file or the individual options.
    ///
    /// @return validated configuration, never null
    /// @throws IOException if the configuration file cannot be read
    /// @throws IllegalArgumentException if a value is invalid
    ChamberConfig toConfig() throws IOException {
        if (configFile != null) {
            return ChamberConfigSerializer.fromFile(configFile);
        }
        return new ChamberConfig(
                seats,
                majoritySize,
                distance,
                new PartyProfile(majoritySigma, majorityError, majorityAdjustment),
                new PartyProfile(minoritySigma, minorityError, minorityAdjustment),
                seed,
                maxRounds,
                clipping,
                proposerPolicy);
    }
}
