package com.yieldsolver.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * DTO for failed requests
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String status,
        String message,
        List<String> errors
) {
    public static ErrorResponse error(String message, List<String> errors) {
        return new ErrorResponse("error", message, errors);
    }

    public static ErrorResponse error(String message) {
        return new ErrorResponse("error", message, null);
    }
}
