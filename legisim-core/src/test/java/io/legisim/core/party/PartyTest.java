package io.legisim.core.party;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.legisim.core.legislator.Legislator;
import io.legisim.core.legislator.Roster;
import java.util.List;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.Test;

class PartyTest {

    @Test
    void shouldSeatRequestedMembersWithPartyFatigue() {
        // Given
        Roster roster = new Roster(101);
        PartyProfile profile = new PartyProfile(0.1, 0.03, 0.02);

        // When
        Party party =
                Party.populate(
                        "majority",
                        51,
                        0.5,
                        profile,
                        ClippingRule.LEGACY,
                        new MersenneTwister(0L),
                        roster);

        // Then
        assertThat(party.size()).isEqualTo(51);
        assertThat(party.getRequestedSize()).isEqualTo(51);
        assertThat(party.getMu()).isEqualTo(0.5);
        assertThat(roster.size()).isEqualTo(51);
        assertThat(roster.members()).containsExactlyElementsOf(party.getMembers());
        assertThat(party.getMembers())
                .allSatisfy(
                        member -> {
                            assertThat(member.getError()).isEqualTo(0.03);
                            assertThat(member.getAdjustment()).isEqualTo(0.02);
                            assertThat(member.getIdeal()).isBetween(-1.0, 1.0);
                        });
    }

    @Test
    void shouldNumberMembersFromZeroAndLabelThemWithPartyName() {
        Party party =
                Party.populate(
                        "minority",
                        4,
                        -0.5,
                        PartyProfile.defaults(),
                        ClippingRule.LEGACY,
                        new MersenneTwister(1L),
                        new Roster(10));

        assertThat(party.getMembers()).extracting(Legislator::getId).containsExactly(0, 1, 2, 3);
        assertThat(party.getMembers()).extracting(Legislator::getParty).containsOnly("minority");
    }

    @Test
    void shouldStopWhenSeatsRunOut() {
        // Given
        Roster roster = new Roster(10);
        MersenneTwister random = new MersenneTwister(7L);

        // When
        Party first =
                Party.populate(
                        "majority", 7, 0.5, PartyProfile.defaults(), ClippingRule.LEGACY, random,
                        roster);
        Party second =
                Party.populate(
                        "minority", 5, -0.5, PartyProfile.defaults(), ClippingRule.LEGACY, random,
                        roster);

        // Then
        assertThat(first.size()).isEqualTo(7);
        assertThat(second.size()).isEqualTo(3);
        assertThat(second.getRequestedSize()).isEqualTo(5);
        assertThat(roster.size()).isEqualTo(first.size() + second.size());
        assertThat(roster.size()).isLessThanOrEqualTo(roster.capacity());
    }

    @Test
    void shouldCreateEmptyPartyWhenRosterIsFull() {
        Roster roster = new Roster(1);
        roster.seat(new Legislator("majority", 0, 0.0, 0.0, 0.0));

        Party party =
                Party.populate(
                        "minority", 3, 0.0, PartyProfile.defaults(), ClippingRule.LEGACY,
                        new MersenneTwister(0L), roster);

        assertThat(party.size()).isZero();
        assertThat(roster.size()).isEqualTo(1);
    }

    @Test
    void shouldDrawIdenticalMembersForIdenticalSeed() {
        // When
        List<Double> first = idealsFor(42L);
        List<Double> second = idealsFor(42L);
        List<Double> other = idealsFor(43L);

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).isNotEqualTo(other);
    }

    @Test
    void shouldClipWideDrawsIntoPolicySpace() {
        // Given: sigma wide enough that most draws leave [-1, 1]
        Party party =
                Party.populate(
                        "wide",
                        200,
                        0.0,
                        new PartyProfile(10.0, 0.0, 0.0),
                        ClippingRule.LEGACY,
                        new MersenneTwister(3L),
                        new Roster(200));

        // Then
        List<Double> ideals = party.getMembers().stream().map(Legislator::getIdeal).toList();
        assertThat(ideals).allSatisfy(ideal -> assertThat(ideal).isBetween(-1.0, 1.0));
        assertThat(ideals).contains(1.0, 0.0);
        assertThat(ideals).doesNotContain(-1.0);
    }

    @Test
    void shouldClipSymmetricallyWhenConfigured() {
        Party party =
                Party.populate(
                        "wide",
                        200,
                        0.0,
                        new PartyProfile(10.0, 0.0, 0.0),
                        ClippingRule.SYMMETRIC,
                        new MersenneTwister(3L),
                        new Roster(200));

        List<Double> ideals = party.getMembers().stream().map(Legislator::getIdeal).toList();
        assertThat(ideals).contains(1.0, -1.0);
    }

    @Test
    void shouldResetEveryMembersFatigue() {
        // Given
        Party party =
                Party.populate(
                        "majority", 5, 0.5, PartyProfile.defaults(), ClippingRule.LEGACY,
                        new MersenneTwister(0L), new Roster(5));
        party.getMembers().forEach(member -> member.vote(0.0));

        // When
        party.resetFatigue();

        // Then
        assertThat(party.getMembers()).allSatisfy(m -> assertThat(m.getError()).isEqualTo(0.02));
    }

    @Test
    void shouldRejectNegativeSize() {
        assertThatThrownBy(
                        () ->
                                Party.populate(
                                        "broken", -1, 0.0, PartyProfile.defaults(),
                                        ClippingRule.LEGACY, new MersenneTwister(0L),
                                        new Roster(5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requestedSize");
    }

    private static List<Double> idealsFor(long seed) {
        Party party =
                Party.populate(
                        "majority", 20, 0.5, PartyProfile.defaults(), ClippingRule.LEGACY,
                        new MersenneTwister(seed), new Roster(20));
        return party.getMembers().stream().map(Legislator::getIdeal).toList();
    }
}
