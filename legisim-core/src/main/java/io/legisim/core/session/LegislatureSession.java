package io.legisim.core.session;

import io.legisim.core.legislator.Legislator;
import io.legisim.core.legislator.Roster;
import io.legisim.core.party.Party;
import java.util.logging.Logger;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/// Runs one repetition of the proposal-vote cycle to a passing vote.
///
/// ### Phases
/// 1. **INITIALIZING**: seat the majority party, then the minority party, against a
///    shared {@link Roster}; sort the roster by ideal point; take the median seat's
///    ideal point; draw a proposer uniformly at random and record its opening best
///    response as the initial value
/// 2. **VOTING**: the proposer puts forward its best response to the median, the whole
///    roster votes under the {@link MajorityRule}, and every member's acceptance radius
///    widens. On failure the next round starts with the same proposer, or with a newly
///    drawn one under {@link ProposerPolicy#ROTATE_ON_FAILURE}
/// 3. **PASSED**: every member's fatigue is reset and an {@link OutcomeRecord} is emitted
///
/// ### Reproducibility
/// All randomness comes from one {@link MersenneTwister} seeded with
/// `config.baseSeed() + repetition`. Party composition, proposer choice and every round
/// are fully determined by the configuration and the repetition index.
///
/// ### Round Cap
/// A session that has taken `config.maxRounds()` failed votes stops with a
/// {@link VoteDivergenceException} instead of looping forever.
///
/// @implNote **Not thread-safe**. A session is single-use: {@link #run()} may be called
/// once. Independent sessions share no state and may run on different threads.
///
/// @see LegislatureSimulator for batch execution
public final class LegislatureSession {

    private static final Logger logger = Logger.getLogger(LegislatureSession.class.getName());

    private final ChamberConfig config;
    private final int repetition;
    private final SessionListener listener;
    private final RandomGenerator random;
    private final Roster roster;
    private final MajorityRule majorityRule;

    private SessionPhase phase = SessionPhase.INITIALIZING;
    private Party majority;
    private Party minority;
    private double medianIdeal;
    private Legislator proposer;
    private double initialValue;
    private int votes;

    /// Creates a session without a listener.
    ///
    /// @param config chamber parameters, not null
    /// @param repetition zero-based repetition index, must be non-negative
    public LegislatureSession(ChamberConfig config, int repetition) {
        this(config, repetition, SessionListener.NOOP);
    }

    /// Creates a session reporting to the given listener.
    ///
    /// @param config chamber parameters, not null
    /// @param repetition zero-based repetition index, must be non-negative
    /// @param listener receiver of lifecycle callbacks, not null
    /// @throws IllegalArgumentException if `repetition` is negative
    public LegislatureSession(ChamberConfig config, int repetition, SessionListener listener) {
        if (repetition < 0) {
            throw new IllegalArgumentException("repetition must be >= 0");
        }
        this.config = config;
        this.repetition = repetition;
        this.listener = listener;
        this.random = new MersenneTwister(config.seedFor(repetition));
        this.roster = new Roster(config.seats());
        this.majorityRule = new MajorityRule(config.seats());
    }

    /// Runs the session until a proposal passes.
    ///
    /// @return the repetition's outcome record, never null
    /// @throws VoteDivergenceException if no proposal passes within `config.maxRounds()`
    /// @throws IllegalStateException if the session has already been run
    public OutcomeRecord run() throws VoteDivergenceException {
        if (phase != SessionPhase.INITIALIZING || majority != null) {
            throw new IllegalStateException(
                    "Session for repetition " + repetition + " already ran");
        }
        initialize();
        return vote();
    }

    private void initialize() {
        majority =
                Party.populate(
                        "majority",
                        config.majorityPartySize(),
                        config.majorityMean(),
                        config.majority(),
                        config.clippingRule(),
                        random,
                        roster);
        minority =
                Party.populate(
                        "minority",
                        config.minorityPartySize(),
                        config.minorityMean(),
                        config.minority(),
                        config.clippingRule(),
                        random,
                        roster);

        roster.sortByIdeal();
        medianIdeal = roster.medianIdeal();
        listener.onSessionStart(repetition, medianIdeal);

        selectProposer();
        initialValue = proposer.findProposal(medianIdeal);

        logger.fine(
                "Repetition "
                        + repetition
                        + ": median ideal "
                        + medianIdeal
                        + ", proposer ideal "
                        + proposer.getIdeal()
                        + ", initial value "
                        + initialValue);
    }

    private OutcomeRecord vote() throws VoteDivergenceException {
        phase = SessionPhase.VOTING;

        while (true) {
            double proposal = proposer.findProposal(medianIdeal);
            int yeas = majorityRule.tally(roster.members(), proposer, proposal);
            votes++;

            boolean passed = majorityRule.passes(yeas);
            RoundResult result = new RoundResult(votes, proposer.getId(), proposal, yeas, passed);
            logger.fine(
                    "Round "
                            + votes
                            + ": proposal "
                            + proposal
                            + " "
                            + (passed ? "passed" : "failed")
                            + ". Yeas- "
                            + yeas
                            + " Nays- "
                            + (roster.size() - yeas));
            listener.onRoundComplete(result);

            if (passed) {
                return pass(proposal, yeas);
            }
            if (votes >= config.maxRounds()) {
                logger.warning(
                        "Repetition " + repetition + " diverged after " + votes + " rounds");
                throw new VoteDivergenceException(repetition, votes, proposal);
            }
            if (config.proposerPolicy() == ProposerPolicy.ROTATE_ON_FAILURE) {
                selectProposer();
            }
        }
    }

    private OutcomeRecord pass(double proposal, int yeas) {
        majority.resetFatigue();
        minority.resetFatigue();
        phase = SessionPhase.PASSED;

        OutcomeRecord outcome =
                OutcomeRecord.of(repetition + 1, initialValue, proposal, votes, yeas, config);
        listener.onPassed(outcome);
        return outcome;
    }

    private void selectProposer() {
        proposer = roster.get(random.nextInt(roster.size()));
        listener.onProposerSelected(proposer, votes + 1);
    }

    public SessionPhase getPhase() {
        return phase;
    }

    public int getRepetition() {
        return repetition;
    }

    /// Returns the chamber roster, sorted by ideal point once initialized.
    public Roster getRoster() {
        return roster;
    }

    /// Returns the majority party, or null before {@link #run()}.
    public Party getMajority() {
        return majority;
    }

    /// Returns the minority party, or null before {@link #run()}.
    public Party getMinority() {
        return minority;
    }

    public double getMedianIdeal() {
        return medianIdeal;
    }

    /// Returns the current proposer, or null before {@link #run()}.
    public Legislator getProposer() {
        return proposer;
    }

    public double getInitialValue() {
        return initialValue;
    }

    /// Returns the number of votes taken so far.
    public int getVotes() {
        return votes;
    }
}
