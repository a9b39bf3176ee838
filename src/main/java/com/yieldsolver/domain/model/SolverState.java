package com.yieldsolver.domain.model;

/**
 * Newton-Raphson iterate: trial rate with the residual and derivative evaluated at it.
 * Any component may be NaN once a step became undefined.
 */
public record SolverState(double rate, double residual, double derivative) {

    /**
     * Newton update from this state. A zero derivative yields NaN rather than a fault.
     */
    public double nextRate() {
        if (derivative == 0.0) {
            return Double.NaN;
        }
        return rate - residual / derivative;
    }

    public boolean isUndefined() {
        return Double.isNaN(rate) || Double.isNaN(residual);
    }
}
