package com.yieldsolver.application.service;

import java.util.Collections;
import java.util.List;

/**
 * Result of validation operation
 */
public record ValidationResult(boolean isValid, List<String> errors) {

    /**
     * Fails with {@link RequestValidationException} carrying all collected errors
     */
    public void throwIfInvalid() {
        if (!isValid) {
            throw new RequestValidationException(errors);
        }
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, Collections.emptyList());
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, Collections.unmodifiableList(errors));
    }

    static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? valid() : invalid(errors);
    }
}
