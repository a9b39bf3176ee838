package com.yieldsolver.adapter.in.web.valuation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for XNPV over date-stamped cash flows
 */
public record XnpvRequest(Double rate, List<Double> cashflows, List<String> dates) {
    @JsonCreator
    public XnpvRequest(
            @JsonProperty("rate") Double rate,
            @JsonProperty("cashflows") List<Double> cashflows,
            @JsonProperty("dates") List<String> dates
    ) {
        this.rate = rate;
        this.cashflows = cashflows;
        this.dates = dates;
    }
}
