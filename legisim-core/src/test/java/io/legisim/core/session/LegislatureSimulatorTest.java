package io.legisim.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import org.junit.jupiter.api.Test;

class LegislatureSimulatorTest {

    private final LegislatureSimulator simulator = new LegislatureSimulator();

    @Test
    void shouldNumberBatchRowsFromOne() throws Exception {
        List<OutcomeRecord> records = simulator.runBatch(ChamberConfig.defaults(), 5);

        assertThat(records).extracting(OutcomeRecord::repetition).containsExactly(1, 2, 3, 4, 5);
        assertThat(records).allSatisfy(r -> assertThat(r.yeas()).isGreaterThan(50));
    }

    @Test
    void shouldMatchStandaloneSessionForEachRepetition() throws Exception {
        ChamberConfig config = ChamberConfig.defaults().withBaseSeed(9L);

        List<OutcomeRecord> batch = simulator.runBatch(config, 3);

        assertThat(batch.get(2)).isEqualTo(new LegislatureSession(config, 2).run());
        assertThat(simulator.runRepetition(config, 1)).isEqualTo(batch.get(1));
    }

    @Test
    void shouldReturnEmptyBatchForZeroRepetitions() throws Exception {
        assertThat(simulator.runBatch(ChamberConfig.defaults(), 0)).isEmpty();
    }

    @Test
    void shouldRejectNegativeRepetitions() {
        assertThatThrownBy(() -> simulator.runBatch(ChamberConfig.defaults(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldForwardEverySessionToListener() throws Exception {
        SessionListener listener = mock(SessionListener.class);

        new LegislatureSimulator(listener).runBatch(ChamberConfig.defaults(), 4);

        verify(listener, times(4)).onPassed(any(OutcomeRecord.class));
    }
}
