package com.yieldsolver.adapter.in.web.loan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for an amortization schedule request
 */
public record AmortizationRequest(
        Double rate,
        Integer nper,
        Double pv,
        Double fv,
        String when
) {
    @JsonCreator
    public AmortizationRequest(
            @JsonProperty("rate") Double rate,
            @JsonProperty("nper") Integer nper,
            @JsonProperty("pv") Double pv,
            @JsonProperty("fv") Double fv,
            @JsonProperty("when") String when
    ) {
        this.rate = rate;
        this.nper = nper;
        this.pv = pv;
        this.fv = fv;
        this.when = when;
    }
}
