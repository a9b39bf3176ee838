package com.yieldsolver.adapter.in.web.rate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for an XIRR request - dates are ISO strings (YYYY-MM-DD), one per cash flow
 */
public record XirrRequest(
        List<Double> cashflows,
        List<String> dates,
        Double guess,
        Double tolerance
) {
    @JsonCreator
    public XirrRequest(
            @JsonProperty("cashflows") List<Double> cashflows,
            @JsonProperty("dates") List<String> dates,
            @JsonProperty("guess") Double guess,
            @JsonProperty("tolerance") Double tolerance
    ) {
        this.cashflows = cashflows;
        this.dates = dates;
        this.guess = guess;
        this.tolerance = tolerance;
    }
}
