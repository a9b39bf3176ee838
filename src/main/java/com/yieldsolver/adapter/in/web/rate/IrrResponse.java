package com.yieldsolver.adapter.in.web.rate;

import com.yieldsolver.domain.model.SolverResult;

/**
 * DTO for an IRR result; irr is null when the solver did not converge
 */
public record IrrResponse(
        String status,
        Double irr,
        int iterations,
        boolean converged
) {
    public static IrrResponse from(SolverResult result) {
        return new IrrResponse("success", result.rate(), result.iterationsRun(), result.converged());
    }
}
