package com.yieldsolver.adapter.in.web.loan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a TVM function call - only the arguments the function needs are required
 */
public record TimeValueRequest(
        Double rate,
        Double nper,
        Double pmt,
        Double pv,
        Double fv,
        Integer per,
        String when
) {
    @JsonCreator
    public TimeValueRequest(
            @JsonProperty("rate") Double rate,
            @JsonProperty("nper") Double nper,
            @JsonProperty("pmt") Double pmt,
            @JsonProperty("pv") Double pv,
            @JsonProperty("fv") Double fv,
            @JsonProperty("per") Integer per,
            @JsonProperty("when") String when
    ) {
        this.rate = rate;
        this.nper = nper;
        this.pmt = pmt;
        this.pv = pv;
        this.fv = fv;
        this.per = per;
        this.when = when;
    }
}
