package com.yieldsolver.adapter.in.web.rate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for an IRR request over evenly spaced cash flows
 */
public record IrrRequest(
        List<Double> cashflows,
        Double guess,
        Double tolerance
) {
    @JsonCreator
    public IrrRequest(
            @JsonProperty("cashflows") List<Double> cashflows,
            @JsonProperty("guess") Double guess,
            @JsonProperty("tolerance") Double tolerance
    ) {
        this.cashflows = cashflows;
        this.guess = guess;
        this.tolerance = tolerance;
    }
}
