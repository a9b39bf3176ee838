package com.yieldsolver.domain.model;

/**
 * Terminal outcome of a rate solve.
 *
 * @param rate          solved rate rounded to 10 decimals, {@code null} when not converged
 * @param iterationsRun Newton updates performed (or the fixed bound, see {@link IterationMode})
 * @param converged     whether the final residual is within tolerance
 */
public record SolverResult(Double rate, int iterationsRun, boolean converged) {

    public static SolverResult converged(double rate, int iterationsRun) {
        return new SolverResult(rate, iterationsRun, true);
    }

    public static SolverResult notConverged(int iterationsRun) {
        return new SolverResult(null, iterationsRun, false);
    }
}
