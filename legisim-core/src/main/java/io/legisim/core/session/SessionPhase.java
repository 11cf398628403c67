package io.legisim.core.session;

/// Lifecycle of a {@link LegislatureSession}.
///
/// ```
/// INITIALIZING ──> VOTING ──(majority)──> PASSED
///                    ^  │
///                    └──┘ (failed vote)
/// ```
public enum SessionPhase {
    INITIALIZING,
    VOTING,
    PASSED
}
