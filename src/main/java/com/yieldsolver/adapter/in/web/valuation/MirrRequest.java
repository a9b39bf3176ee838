package com.yieldsolver.adapter.in.web.valuation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for modified IRR
 */
public record MirrRequest(List<Double> cashflows, Double financeRate, Double reinvestRate) {
    @JsonCreator
    public MirrRequest(
            @JsonProperty("cashflows") List<Double> cashflows,
            @JsonProperty("financeRate") Double financeRate,
            @JsonProperty("reinvestRate") Double reinvestRate
    ) {
        this.cashflows = cashflows;
        this.financeRate = financeRate;
        this.reinvestRate = reinvestRate;
    }
}
