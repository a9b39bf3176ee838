package com.yieldsolver.domain.exception;

/**
 * Malformed calculation input - empty series, mismatched amount/date lengths,
 * out-of-range periods. Raised before any iteration begins.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
