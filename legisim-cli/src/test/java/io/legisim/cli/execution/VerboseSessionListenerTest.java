package io.legisim.cli.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.legisim.core.legislator.Legislator;
import io.legisim.core.session.ChamberConfig;
import io.legisim.core.session.LegislatureSession;
import io.legisim.core.session.OutcomeRecord;
import io.legisim.core.session.RoundResult;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VerboseSessionListenerTest {

    private ByteArrayOutputStream outContent;
    private VerboseSessionListener listener;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        listener = new VerboseSessionListener(stream(), false, 101);
    }

    private PrintStream stream() {
        return new PrintStream(outContent, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintOneBasedRepetitionAndMedian() {
        listener.onSessionStart(0, 0.123456);

        assertThat(output()).contains("Repetition 1").contains("median ideal 0.1235");
    }

    @Test
    void shouldPrintProposerWithParty() {
        listener.onProposerSelected(new Legislator("minority", 17, -0.441, 0.02, 0.01), 3);

        assertThat(output()).contains("Proposer minority #17 (ideal -0.4410) → round 3");
    }

    @Test
    void shouldDistinguishEqualIdsAcrossParties() {
        listener.onProposerSelected(new Legislator("majority", 3, 0.52, 0.02, 0.01), 1);
        listener.onProposerSelected(new Legislator("minority", 3, -0.48, 0.02, 0.01), 2);

        assertThat(output()).contains("Proposer majority #3").contains("Proposer minority #3");
    }

    @Test
    void shouldPrintTallyWithNays() {
        listener.onRoundComplete(new RoundResult(2, 5, -0.381, 52, true));

        assertThat(output())
                .contains("Round 2: proposal -0.3810 passed. Yeas- 52 Nays- 49");
    }

    @Test
    void shouldPrintFailedRound() {
        listener.onRoundComplete(new RoundResult(1, 5, 0.25, 44, false));

        assertThat(output()).contains("failed. Yeas- 44 Nays- 57");
    }

    @Test
    void shouldPrintVoteCountOnPass() {
        listener.onPassed(new OutcomeRecord(1, 0.1, 0.0, 7, 55, 51, 1.0, 0.1, 0.01, 0.1, 0.01));

        assertThat(output()).contains("✓ Passed after 7 votes");
    }

    @Test
    void shouldNarrateWholeSession() throws Exception {
        OutcomeRecord outcome =
                new LegislatureSession(ChamberConfig.defaults(), 0, listener).run();

        String output = output();
        assertThat(output).contains("Round " + outcome.numberOfVotes() + ": proposal");
        assertThat(output).contains("Passed after " + outcome.numberOfVotes() + " votes");
    }

    @Test
    void shouldApplyColorWhenEnabled() {
        VerboseSessionListener colored = new VerboseSessionListener(stream(), true, 101);

        colored.onRoundComplete(new RoundResult(1, 0, 0.0, 60, true));

        assertThat(output()).contains("\033[");
    }
}
