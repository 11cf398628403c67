package io.legisim.core.sweep;

import java.io.Serial;

/// Thrown when a sweep cannot complete because one of its workers failed.
///
/// The cause is the worker's own failure, typically a
/// {@link io.legisim.core.session.VoteDivergenceException}.
///
/// @see SweepDriver#run
public class SweepException extends Exception {

    @Serial private static final long serialVersionUID = 8031646392127750213L;

    /// Creates exception with message and cause.
    ///
    /// @param message description of the failed sweep value
    /// @param cause the underlying exception
    public SweepException(String message, Throwable cause) {
        super(message, cause);
    }
}
