package com.yieldsolver.application.port.out;

import com.yieldsolver.domain.model.IterationMode;

/**
 * Output port for solver defaults and service limits
 */
public interface SolverConfigurationRepository {

    /**
     * Starting rate used when a request does not supply a guess
     */
    double getDefaultGuess();

    /**
     * Residual tolerance used when a request does not supply one
     */
    double getDefaultTolerance();

    IterationMode getIterationMode();

    /**
     * Maximum number of series accepted by one batch request
     */
    int getMaxBatchSize();
}
