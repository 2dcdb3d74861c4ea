package io.cryojob4j.core;

import java.util.Objects;

/**
 * Outcome of {@code validate()}.
 *
 * valid : true when the job can be built
 * error : human-readable reason, null when valid
 */
public record ValidationResult(
        boolean valid,
        String error
) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public ValidationResult {
        if (!valid) {
            Objects.requireNonNull(error, "error must not be null for a failed validation");
        }
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(String error) {
        return new ValidationResult(false, error);
    }

    public boolean failed() {
        return !valid;
    }
}
