package com.yieldsolver.adapter.in.web.valuation;

import com.yieldsolver.adapter.in.web.AbstractJsonHandler;
import com.yieldsolver.adapter.in.web.ValueResponse;
import com.yieldsolver.application.port.in.CashflowValuationUseCase;
import com.yieldsolver.application.port.in.CashflowValuationUseCase.XnpvCommand;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handler for date-weighted net present value
 * Handles POST /api/xnpv
 */
@RequiredArgsConstructor
public class XnpvHandler extends AbstractJsonHandler<Double> {

    private final CashflowValuationUseCase valuationUseCase;

    @Override
    protected Future<Double> process(RoutingContext context, JsonObject body) {
        XnpvRequest request = body.mapTo(XnpvRequest.class);

        return valuationUseCase.xnpv(new XnpvCommand(
                request.rate(),
                request.cashflows(),
                request.dates()
        ));
    }

    @Override
    protected Object toResponse(Double value) {
        return ValueResponse.of(value);
    }
}
