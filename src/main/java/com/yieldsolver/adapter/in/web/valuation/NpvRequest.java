package com.yieldsolver.adapter.in.web.valuation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for NPV over evenly spaced cash flows
 */
public record NpvRequest(Double rate, List<Double> cashflows) {
    @JsonCreator
    public NpvRequest(
            @JsonProperty("rate") Double rate,
            @JsonProperty("cashflows") List<Double> cashflows
    ) {
        this.rate = rate;
        this.cashflows = cashflows;
    }
}
