package com.yieldsolver.application.port.in;

import com.yieldsolver.domain.model.SolverResult;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for rate-of-return solving
 * Numeric non-convergence is a successful result with converged = false;
 * only malformed input fails the future
 */
public interface RateOfReturnUseCase {

    /**
     * Solve IRR for evenly spaced cash flows (index 0 = now)
     * @param command cash flows plus optional guess / tolerance overrides
     * @return Future with the solver result
     */
    Future<SolverResult> irr(IrrCommand command);

    /**
     * Solve XIRR for date-stamped cash flows on an Actual/365 basis
     */
    Future<SolverResult> xirr(XirrCommand command);

    /**
     * Solve IRR for many independent series concurrently
     * @return Future with one result per input series, in input order
     */
    Future<List<SolverResult>> batchIrr(BatchIrrCommand command);

    record IrrCommand(
            List<Double> cashflows,
            Double guess,
            Double tolerance
    ) {}

    record XirrCommand(
            List<Double> cashflows,
            List<String> dates,
            Double guess,
            Double tolerance
    ) {}

    record BatchIrrCommand(
            List<List<Double>> series,
            Double guess,
            Double tolerance
    ) {}
}
