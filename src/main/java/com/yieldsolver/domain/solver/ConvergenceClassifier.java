package com.yieldsolver.domain.solver;

import com.yieldsolver.domain.model.SolverResult;
import com.yieldsolver.domain.model.SolverState;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns the last solver state into a {@link SolverResult}.
 * The check uses the residual already carried by the state; nothing is re-evaluated.
 */
public class ConvergenceClassifier {

    public static final int RATE_SCALE = 10;

    public SolverResult classify(SolverState finalState, double tolerance, int iterationsRun) {
        double residual = finalState.residual();
        if (Double.isNaN(residual) || !(Math.abs(residual) < tolerance)) {
            return SolverResult.notConverged(iterationsRun);
        }

        // One more Newton projection from the accepted iterate, no extra evaluation
        double rate = finalState.nextRate();
        if (!Double.isFinite(rate)) {
            rate = finalState.rate();
        }
        if (!Double.isFinite(rate)) {
            return SolverResult.notConverged(iterationsRun);
        }
        return SolverResult.converged(round(rate), iterationsRun);
    }

    static double round(double rate) {
        return BigDecimal.valueOf(rate).setScale(RATE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
