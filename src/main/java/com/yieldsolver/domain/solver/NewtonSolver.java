package com.yieldsolver.domain.solver;

import com.yieldsolver.domain.exception.InvalidInputException;
import com.yieldsolver.domain.model.CashflowSeries;
import com.yieldsolver.domain.model.IterationMode;
import com.yieldsolver.domain.model.SolverResult;
import com.yieldsolver.domain.model.SolverState;

/**
 * Bounded Newton-Raphson rate finder shared by IRR and XIRR.
 *
 * <p>Each step folds the previous {@link SolverState} into a new one with exactly one
 * evaluator call, so total work is {@code O(MAX_ITERATIONS * series.size())}. A zero
 * derivative or a rate at or below -1 turns the state undefined (NaN); the chain still
 * completes and the result is reported as not converged.
 *
 * <p>Stateless and thread-safe.
 */
public class NewtonSolver {

    /** Hard cap on Newton updates per solve */
    public static final int MAX_ITERATIONS = 16;

    public static final double DEFAULT_GUESS = 0.1;
    public static final double DEFAULT_TOLERANCE = 1e-7;

    private final ResidualEvaluator evaluator;
    private final ConvergenceClassifier classifier;

    public NewtonSolver() {
        this(new ResidualEvaluator(), new ConvergenceClassifier());
    }

    public NewtonSolver(ResidualEvaluator evaluator, ConvergenceClassifier classifier) {
        this.evaluator = evaluator;
        this.classifier = classifier;
    }

    public SolverResult solve(CashflowSeries series, double guess, double tolerance) {
        return solve(series, guess, tolerance, IterationMode.EARLY_EXIT);
    }

    public SolverResult solve(CashflowSeries series, double guess, double tolerance, IterationMode mode) {
        if (series == null) {
            throw new InvalidInputException("cashflow series is required");
        }
        if (!(tolerance > 0.0)) {
            throw new InvalidInputException("tolerance must be positive: " + tolerance);
        }

        SolverState state = evaluator.evaluate(guess, series);
        int steps = 0;

        if (mode == IterationMode.FIXED) {
            while (steps < MAX_ITERATIONS) {
                state = step(state, series);
                steps++;
            }
            return classifier.classify(state, tolerance, MAX_ITERATIONS);
        }

        while (steps < MAX_ITERATIONS && !isSettled(state, tolerance)) {
            state = step(state, series);
            steps++;
        }
        return classifier.classify(state, tolerance, steps);
    }

    private SolverState step(SolverState state, CashflowSeries series) {
        return evaluator.evaluate(state.nextRate(), series);
    }

    private static boolean isSettled(SolverState state, double tolerance) {
        return state.isUndefined() || Math.abs(state.residual()) < tolerance;
    }
}
