package com.yieldsolver.domain.solver;

import com.yieldsolver.domain.model.SolverResult;
import com.yieldsolver.domain.model.SolverState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConvergenceClassifier
 */
class ConvergenceClassifierTest {

    private ConvergenceClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ConvergenceClassifier();
    }

    @Test
    void testResidualWithinToleranceConverges() {
        SolverResult result = classifier.classify(new SolverState(0.25, 1e-9, -100.0), 1e-7, 5);

        assertTrue(result.converged());
        assertEquals(5, result.iterationsRun());
        // projected one Newton step: 0.25 - 1e-9 / -100
        assertEquals(0.25, result.rate(), 1e-10);
    }

    @Test
    void testRateRoundedToTenDecimals() {
        SolverResult result = classifier.classify(new SolverState(0.123456789012345, 0.0, -1.0), 1e-7, 3);

        assertEquals(0.123456789, result.rate());
    }

    @Test
    void testResidualAtToleranceDoesNotConverge() {
        SolverResult result = classifier.classify(new SolverState(0.1, 1e-7, -10.0), 1e-7, 16);

        assertFalse(result.converged());
        assertNull(result.rate());
        assertEquals(16, result.iterationsRun());
    }

    @Test
    void testUndefinedResidualDoesNotConverge() {
        SolverResult result = classifier.classify(new SolverState(Double.NaN, Double.NaN, Double.NaN), 1e-7, 16);

        assertFalse(result.converged());
        assertNull(result.rate());
    }

    @Test
    void testZeroDerivativeFallsBackToCurrentRate() {
        SolverResult result = classifier.classify(new SolverState(0.05, 0.0, 0.0), 1e-7, 2);

        assertTrue(result.converged());
        assertEquals(0.05, result.rate());
    }

    @Test
    void testInfiniteRateDoesNotConverge() {
        SolverResult result = classifier.classify(
                new SolverState(Double.POSITIVE_INFINITY, 0.0, 0.0), 1e-7, 16);

        assertFalse(result.converged());
        assertNull(result.rate());
    }
}
