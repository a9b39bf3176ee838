package com.yieldsolver.adapter.in.web.loan;

import com.yieldsolver.adapter.in.web.AbstractJsonHandler;
import com.yieldsolver.adapter.in.web.ValueResponse;
import com.yieldsolver.application.port.in.LoanCalculationUseCase;
import com.yieldsolver.application.port.in.LoanCalculationUseCase.TimeValueCommand;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for closed-form TVM functions
 * Handles POST /api/tvm/:function (fv, pv, pmt, nper, ipmt, ppmt)
 */
@Slf4j
@RequiredArgsConstructor
public class TimeValueHandler extends AbstractJsonHandler<Double> {

    private final LoanCalculationUseCase loanCalculationUseCase;

    @Override
    protected Future<Double> process(RoutingContext context, JsonObject body) {
        String function = context.pathParam("function");
        TimeValueRequest request = body.mapTo(TimeValueRequest.class);
        log.info("Received TVM request: {}", function);

        return loanCalculationUseCase.evaluate(new TimeValueCommand(
                function,
                request.rate(),
                request.nper(),
                request.pmt(),
                request.pv(),
                request.fv(),
                request.per(),
                request.when()
        ));
    }

    @Override
    protected Object toResponse(Double value) {
        return ValueResponse.of(value);
    }
}
