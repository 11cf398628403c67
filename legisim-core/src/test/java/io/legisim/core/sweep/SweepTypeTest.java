package io.legisim.core.sweep;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.legisim.core.exception.InvalidChamberConfigException;
import io.legisim.core.session.ChamberConfig;
import io.legisim.core.session.OutcomeColumn;
import io.legisim.core.session.OutcomeRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SweepTypeTest {

    private final ChamberConfig base = ChamberConfig.defaults();

    @Test
    void partySizeShouldCoverOddMajorities() {
        ParameterGrid grid = SweepType.PARTY_SIZE.grid();

        assertThat(grid.values()).hasSize(25).startsWith(51.0).endsWith(99.0);
        assertThat(SweepType.PARTY_SIZE.apply(base, 75).majorityPartySize()).isEqualTo(75);
        assertThat(SweepType.PARTY_SIZE.apply(base, 75).minorityPartySize()).isEqualTo(26);
    }

    @Test
    void distanceShouldChangeOnlyDistance() {
        ChamberConfig swept = SweepType.DISTANCE.apply(base, 1.35);

        assertThat(swept.distanceBetweenMedians()).isEqualTo(1.35);
        assertThat(swept.majorityPartySize()).isEqualTo(base.majorityPartySize());
        assertThat(swept.majority()).isEqualTo(base.majority());
    }

    @Test
    void intrapartyShouldSetBothSigmas() {
        ChamberConfig swept = SweepType.INTRAPARTY.apply(base, 0.45);

        assertThat(swept.majority().sigma()).isEqualTo(0.45);
        assertThat(swept.minority().sigma()).isEqualTo(0.45);
        assertThat(swept.majority().adjustment()).isEqualTo(base.majority().adjustment());
        assertThat(SweepType.INTRAPARTY.grid().values()).hasSize(50).startsWith(0.01);
    }

    @Test
    void shouldNameOutputFiles() {
        assertThat(SweepType.PARTY_SIZE.outputFileName()).isEqualTo("output_party_size.csv");
        assertThat(SweepType.DISTANCE.outputFileName()).isEqualTo("output_party_distance.csv");
        assertThat(SweepType.INTRAPARTY.outputFileName()).isEqualTo("output_intraparty.csv");
        assertThat(SweepType.DEFAULT_OUTPUT_FILE).isEqualTo("output.csv");
    }

    @ParameterizedTest
    @EnumSource(SweepType.class)
    void shouldReportSweptValueInItsColumn(SweepType type) {
        double value = type.grid().values().get(1);

        ChamberConfig swept = type.apply(base, value);
        double reported =
                type.column()
                        .valueOf(
                                new OutcomeRecord(
                                        1,
                                        0,
                                        0,
                                        1,
                                        51,
                                        swept.majorityPartySize(),
                                        swept.distanceBetweenMedians(),
                                        swept.majority().sigma(),
                                        swept.majority().adjustment(),
                                        swept.minority().sigma(),
                                        swept.minority().adjustment()));

        assertThat(reported).isEqualTo(value);
    }

    @Test
    void shouldRejectMajorityLargerThanSmallChamber() {
        ChamberConfig small =
                new ChamberConfig(
                        11, 6, 1.0, base.majority(), base.minority(), 0L, 100, null, null);

        assertThatThrownBy(() -> SweepType.PARTY_SIZE.apply(small, 51))
                .isInstanceOf(InvalidChamberConfigException.class);
        assertThat(SweepType.PARTY_SIZE.column()).isEqualTo(OutcomeColumn.MAJORITY_PARTY_SIZE);
    }
}
