package com.yieldsolver.application.service;

import java.util.List;

/**
 * Request rejected by {@link CashflowRequestValidator}; maps to HTTP 400
 */
public class RequestValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public RequestValidationException(List<String> errors) {
        super("Validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
