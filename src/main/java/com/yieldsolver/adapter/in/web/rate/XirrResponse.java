package com.yieldsolver.adapter.in.web.rate;

import com.yieldsolver.domain.model.SolverResult;

/**
 * DTO for an XIRR result; xirr is null when the solver did not converge
 */
public record XirrResponse(
        String status,
        Double xirr,
        int iterations,
        boolean converged
) {
    public static XirrResponse from(SolverResult result) {
        return new XirrResponse("success", result.rate(), result.iterationsRun(), result.converged());
    }
}
