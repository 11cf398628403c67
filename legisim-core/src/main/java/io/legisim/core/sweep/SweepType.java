package io.legisim.core.sweep;

import io.legisim.core.session.ChamberConfig;
import io.legisim.core.session.OutcomeColumn;

/// The comparative sweeps the simulation is run across.
///
/// Each sweep varies one parameter over a fixed grid while every other parameter keeps
/// the value of the base configuration, and writes one table to its own file.
///
/// | Sweep | Grid | Output file |
/// |-------|------|-------------|
/// | `PARTY_SIZE` | majority size 51, 53, ..., 99 | `output_party_size.csv` |
/// | `DISTANCE` | distance 0.00, 0.05, ..., 2.00 | `output_party_distance.csv` |
/// | `INTRAPARTY` | both sigmas 0.01, 0.03, ..., 0.99 | `output_intraparty.csv` |
public enum SweepType {
    PARTY_SIZE(
            new ParameterGrid(51, 2, 25),
            "output_party_size.csv",
            OutcomeColumn.MAJORITY_PARTY_SIZE) {
        @Override
        public ChamberConfig apply(ChamberConfig base, double value) {
            return base.withMajorityPartySize((int) Math.round(value));
        }
    },

    DISTANCE(
            new ParameterGrid(0.0, 0.05, 41),
            "output_party_distance.csv",
            OutcomeColumn.DISTANCE_BETWEEN_MEDIANS) {
        @Override
        public ChamberConfig apply(ChamberConfig base, double value) {
            return base.withDistanceBetweenMedians(value);
        }
    },

    INTRAPARTY(
            new ParameterGrid(0.01, 0.02, 50),
            "output_intraparty.csv",
            OutcomeColumn.MAJORITY_SIGMA) {
        @Override
        public ChamberConfig apply(ChamberConfig base, double value) {
            return base.withProfiles(
                    base.majority().withSigma(value), base.minority().withSigma(value));
        }
    };

    /// File name of the single, unswept default run.
    public static final String DEFAULT_OUTPUT_FILE = "output.csv";

    private final ParameterGrid grid;
    private final String outputFileName;
    private final OutcomeColumn column;

    SweepType(ParameterGrid grid, String outputFileName, OutcomeColumn column) {
        this.grid = grid;
        this.outputFileName = outputFileName;
        this.column = column;
    }

    /// Derives the configuration for one grid value.
    ///
    /// @param base configuration supplying every unswept parameter, not null
    /// @param value the grid value
    /// @return the configuration to run, never null
    /// @throws io.legisim.core.exception.InvalidChamberConfigException if the value is
    ///     not valid for the base configuration
    public abstract ChamberConfig apply(ChamberConfig base, double value);

    public ParameterGrid grid() {
        return grid;
    }

    public String outputFileName() {
        return outputFileName;
    }

    /// Returns the table column that carries the swept parameter.
    public OutcomeColumn column() {
        return column;
    }
}
