package com.yieldsolver.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * DTO for single-value calculations (npv, xnpv, mirr, tvm functions).
 * A non-finite result is returned as a null value with an explanatory message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueResponse(
        String status,
        Double value,
        String message
) {
    public static ValueResponse of(double value) {
        if (!Double.isFinite(value)) {
            return new ValueResponse("success", null, "result is undefined for the given inputs");
        }
        return new ValueResponse("success", value, null);
    }
}
