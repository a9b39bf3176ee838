package com.yieldsolver.adapter.in.web.loan;

import com.yieldsolver.domain.model.AmortizationRow;

import java.util.List;

/**
 * DTO for an amortization schedule
 */
public record AmortizationResponse(
        String status,
        int periods,
        List<AmortizationRow> rows
) {
    public static AmortizationResponse from(List<AmortizationRow> rows) {
        return new AmortizationResponse("success", rows.size(), rows);
    }
}
