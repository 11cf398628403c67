package io.legisim.core.sweep;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.legisim.core.session.OutcomeRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutcomeTableTest {

    @Test
    void shouldRenumberRowsInGivenOrder() {
        OutcomeTable table = OutcomeTable.of(List.of(record(7, 0.1), record(3, 0.2)));

        assertThat(table.rows()).extracting(OutcomeRecord::repetition).containsExactly(1, 2);
        assertThat(table.rows()).extracting(OutcomeRecord::finalValue).containsExactly(0.1, 0.2);
    }

    @Test
    void shouldConcatenateBatchesContinuingRowNumbers() {
        List<OutcomeRecord> first = List.of(record(1, 0.1), record(2, 0.2));
        List<OutcomeRecord> second = List.of(record(1, 0.3), record(2, 0.4), record(3, 0.5));

        OutcomeTable table = OutcomeTable.concat(List.of(first, second));

        assertThat(table.size()).isEqualTo(5);
        assertThat(table.rows())
                .extracting(OutcomeRecord::repetition)
                .containsExactly(1, 2, 3, 4, 5);
        assertThat(table.rows().get(2).finalValue()).isEqualTo(0.3);
    }

    @Test
    void shouldExposeReadOnlyRows() {
        OutcomeTable table = OutcomeTable.of(List.of(record(1, 0.0)));

        assertThatThrownBy(() -> table.rows().add(record(2, 0.0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldReportEmptiness() {
        assertThat(OutcomeTable.of(List.of()).isEmpty()).isTrue();
        assertThat(OutcomeTable.concat(List.of(List.of(), List.of())).size()).isZero();
    }

    private static OutcomeRecord record(int repetition, double finalValue) {
        return new OutcomeRecord(repetition, 0.0, finalValue, 3, 51, 51, 1.0, 0.1, 0.01, 0.1, 0.01);
    }
}
