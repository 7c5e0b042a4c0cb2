package com.unhuman.iconforge.model;

/**
 * Outcome of checking one icon file against the packaging rules.
 * A negative result is data, not an error: validators never throw for a bad file.
 */
public class ValidationResult {
    public static final String VALID_MESSAGE = "Icon is valid";

    private final boolean valid;
    private final String reason;

    private ValidationResult(boolean valid, String reason) {
        this.valid = valid;
        this.reason = reason;
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, VALID_MESSAGE);
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }

    public boolean isValid() { return valid; }

    /** Human readable explanation; {@link #VALID_MESSAGE} for a passing file. */
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return (valid ? "valid" : "invalid") + ": " + reason;
    }
}
