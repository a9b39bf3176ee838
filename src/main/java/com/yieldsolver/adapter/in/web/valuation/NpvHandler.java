package com.yieldsolver.adapter.in.web.valuation;

import com.yieldsolver.adapter.in.web.AbstractJsonHandler;
import com.yieldsolver.adapter.in.web.ValueResponse;
import com.yieldsolver.application.port.in.CashflowValuationUseCase;
import com.yieldsolver.application.port.in.CashflowValuationUseCase.NpvCommand;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handler for net present value
 * Handles POST /api/npv
 */
@RequiredArgsConstructor
public class NpvHandler extends AbstractJsonHandler<Double> {

    private final CashflowValuationUseCase valuationUseCase;

    @Override
    protected Future<Double> process(RoutingContext context, JsonObject body) {
        NpvRequest request = body.mapTo(NpvRequest.class);

        return valuationUseCase.npv(new NpvCommand(
                request.rate(),
                request.cashflows()
        ));
    }

    @Override
    protected Object toResponse(Double value) {
        return ValueResponse.of(value);
    }
}
