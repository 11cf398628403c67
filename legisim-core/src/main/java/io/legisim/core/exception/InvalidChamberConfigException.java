package io.legisim.core.exception;

import java.io.Serial;

/// Thrown when a chamber or party configuration is rejected before any repetition runs.
///
/// Common causes:
/// - Non-positive seat count or a majority larger than the chamber
/// - Standard deviation that is zero or negative
/// - Negative acceptance radius or fatigue increment
///
/// @see io.legisim.core.session.ChamberConfig
public class InvalidChamberConfigException extends IllegalArgumentException {

    @Serial private static final long serialVersionUID = 4127391650248133057L;

    private final String field;

    /// Creates exception naming the rejected field.
    ///
    /// @param field configuration field that failed validation, not null
    /// @param message description of the violated constraint
    public InvalidChamberConfigException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    /// Returns the name of the rejected field.
    ///
    /// @return field name, never null
    public String getField() {
        return field;
    }
}
