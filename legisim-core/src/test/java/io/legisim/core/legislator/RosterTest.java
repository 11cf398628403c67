package io.legisim.core.legislator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RosterTest {

    @Test
    void shouldSeatUntilCapacity() {
        // Given
        Roster roster = new Roster(2);

        // When
        boolean first = roster.seat(new Legislator("majority", 0, 0.1, 0.0, 0.0));
        boolean second = roster.seat(new Legislator("majority", 1, 0.2, 0.0, 0.0));
        boolean third = roster.seat(new Legislator("majority", 2, 0.3, 0.0, 0.0));

        // Then
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(third).isFalse();
        assertThat(roster.size()).isEqualTo(2);
        assertThat(roster.isFull()).isTrue();
        assertThat(roster.remainingSeats()).isZero();
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new Roster(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
    }

    @Test
    void shouldSortAscendingByIdeal() {
        // Given
        Roster roster = new Roster(4);
        roster.seat(new Legislator("majority", 0, 0.7, 0.0, 0.0));
        roster.seat(new Legislator("majority", 1, -0.4, 0.0, 0.0));
        roster.seat(new Legislator("majority", 2, 0.1, 0.0, 0.0));
        roster.seat(new Legislator("majority", 3, -0.9, 0.0, 0.0));

        // When
        roster.sortByIdeal();

        // Then
        assertThat(roster.members())
                .extracting(Legislator::getIdeal)
                .containsExactly(-0.9, -0.4, 0.1, 0.7);
    }

    @Test
    void shouldTakeMedianAtHalfSizeIndex() {
        // Given
        Roster roster = new Roster(5);
        double[] ideals = {0.5, -0.5, 0.2, 0.9, -0.1};
        for (int i = 0; i < ideals.length; i++) {
            roster.seat(new Legislator("majority", i, ideals[i], 0.0, 0.0));
        }
        roster.sortByIdeal();

        // When
        double median = roster.medianIdeal();

        // Then
        assertThat(median).isEqualTo(0.2);
    }

    @Test
    void shouldUseUpperMiddleSeatForEvenRoster() {
        // Given
        Roster roster = new Roster(4);
        roster.seat(new Legislator("majority", 0, -0.3, 0.0, 0.0));
        roster.seat(new Legislator("majority", 1, -0.1, 0.0, 0.0));
        roster.seat(new Legislator("majority", 2, 0.1, 0.0, 0.0));
        roster.seat(new Legislator("majority", 3, 0.3, 0.0, 0.0));

        // Then
        assertThat(roster.medianIdeal()).isEqualTo(0.1);
    }

    @Test
    void shouldFailMedianOfEmptyRoster() {
        assertThatThrownBy(() -> new Roster(3).medianIdeal())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldExposeReadOnlyMembers() {
        Roster roster = new Roster(1);
        roster.seat(new Legislator("majority", 0, 0.0, 0.0, 0.0));

        assertThatThrownBy(() -> roster.members().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
