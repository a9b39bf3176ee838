package com.yieldsolver.adapter.in.web.valuation;

import com.yieldsolver.adapter.in.web.AbstractJsonHandler;
import com.yieldsolver.adapter.in.web.ValueResponse;
import com.yieldsolver.application.port.in.CashflowValuationUseCase;
import com.yieldsolver.application.port.in.CashflowValuationUseCase.MirrCommand;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handler for modified IRR
 * Handles POST /api/mirr
 */
@RequiredArgsConstructor
public class MirrHandler extends AbstractJsonHandler<Double> {

    private final CashflowValuationUseCase valuationUseCase;

    @Override
    protected Future<Double> process(RoutingContext context, JsonObject body) {
        MirrRequest request = body.mapTo(MirrRequest.class);

        return valuationUseCase.mirr(new MirrCommand(
                request.cashflows(),
                request.financeRate(),
                request.reinvestRate()
        ));
    }

    @Override
    protected Object toResponse(Double value) {
        return ValueResponse.of(value);
    }
}
