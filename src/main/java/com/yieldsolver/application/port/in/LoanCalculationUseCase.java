package com.yieldsolver.application.port.in;

import com.yieldsolver.domain.model.AmortizationRow;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for closed-form time-value-of-money functions and loan schedules
 */
public interface LoanCalculationUseCase {

    /**
     * Evaluate one of fv / pv / pmt / nper / ipmt / ppmt
     * @param command function name and its arguments; unused arguments may be null
     * @return Future with the computed value
     */
    Future<Double> evaluate(TimeValueCommand command);

    /**
     * Build the per-period amortization schedule of a loan
     */
    Future<List<AmortizationRow>> amortize(AmortizationCommand command);

    record TimeValueCommand(
            String function,
            Double rate,
            Double nper,
            Double pmt,
            Double pv,
            Double fv,
            Integer per,
            String when
    ) {}

    record AmortizationCommand(
            Double rate,
            Integer nper,
            Double pv,
            Double fv,
            String when
    ) {}
}
