package io.legisim.core.session;

/// Who proposes in the round after a failed vote.
public enum ProposerPolicy {

    /// The proposer drawn at session start keeps proposing until a vote passes.
    PERSISTENT,

    /// A new proposer is drawn uniformly from the roster after every failed vote.
    ROTATE_ON_FAILURE
}
