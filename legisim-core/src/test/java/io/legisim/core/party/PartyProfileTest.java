package io.legisim.core.party;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.legisim.core.exception.InvalidChamberConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PartyProfileTest {

    @Test
    void shouldProvideHistoricalDefaults() {
        PartyProfile profile = PartyProfile.defaults();

        assertThat(profile.sigma()).isEqualTo(0.1);
        assertThat(profile.error()).isEqualTo(0.02);
        assertThat(profile.adjustment()).isEqualTo(0.01);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.1, Double.NaN, Double.POSITIVE_INFINITY})
    void shouldRejectInvalidSigma(double sigma) {
        assertThatThrownBy(() -> new PartyProfile(sigma, 0.02, 0.01))
                .isInstanceOf(InvalidChamberConfigException.class)
                .extracting("field")
                .isEqualTo("sigma");
    }

    @Test
    void shouldRejectNegativeError() {
        assertThatThrownBy(() -> new PartyProfile(0.1, -0.02, 0.01))
                .isInstanceOf(InvalidChamberConfigException.class)
                .hasMessageContaining("error");
    }

    @Test
    void shouldRejectNegativeAdjustment() {
        assertThatThrownBy(() -> new PartyProfile(0.1, 0.02, -0.01))
                .isInstanceOf(InvalidChamberConfigException.class)
                .hasMessageContaining("adjustment");
    }

    @Test
    void shouldAllowZeroFatigue() {
        PartyProfile profile = new PartyProfile(0.1, 0.0, 0.0);

        assertThat(profile.adjustment()).isZero();
    }

    @Test
    void shouldCopyWithNewSigma() {
        PartyProfile profile = PartyProfile.defaults().withSigma(0.35);

        assertThat(profile).isEqualTo(new PartyProfile(0.35, 0.02, 0.01));
    }
}
