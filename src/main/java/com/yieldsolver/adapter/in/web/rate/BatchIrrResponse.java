package com.yieldsolver.adapter.in.web.rate;

import com.yieldsolver.domain.model.SolverResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * DTO for a batch IRR result, one entry per requested series in request order
 */
public record BatchIrrResponse(
        String status,
        List<IrrResponse> results
) {
    public static BatchIrrResponse from(List<SolverResult> results) {
        return new BatchIrrResponse("success", results.stream()
                .map(IrrResponse::from)
                .collect(Collectors.toList()));
    }
}
