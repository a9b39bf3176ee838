package com.yieldsolver.adapter.in.web.rate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for a batch of independent IRR series sharing one guess / tolerance
 */
public record BatchIrrRequest(
        List<List<Double>> series,
        Double guess,
        Double tolerance
) {
    @JsonCreator
    public BatchIrrRequest(
            @JsonProperty("series") List<List<Double>> series,
            @JsonProperty("guess") Double guess,
            @JsonProperty("tolerance") Double tolerance
    ) {
        this.series = series;
        this.guess = guess;
        this.tolerance = tolerance;
    }
}
