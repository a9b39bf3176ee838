package com.yieldsolver.adapter.in.web.loan;

import com.yieldsolver.adapter.in.web.AbstractJsonHandler;
import com.yieldsolver.application.port.in.LoanCalculationUseCase;
import com.yieldsolver.application.port.in.LoanCalculationUseCase.AmortizationCommand;
import com.yieldsolver.domain.model.AmortizationRow;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * HTTP handler for amortization schedules
 * Handles POST /api/amortization
 */
@RequiredArgsConstructor
public class AmortizationHandler extends AbstractJsonHandler<List<AmortizationRow>> {

    private final LoanCalculationUseCase loanCalculationUseCase;

    @Override
    protected Future<List<AmortizationRow>> process(RoutingContext context, JsonObject body) {
        AmortizationRequest request = body.mapTo(AmortizationRequest.class);

        return loanCalculationUseCase.amortize(new AmortizationCommand(
                request.rate(),
                request.nper(),
                request.pv(),
                request.fv(),
                request.when()
        ));
    }

    @Override
    protected Object toResponse(List<AmortizationRow> rows) {
        return AmortizationResponse.from(rows);
    }
}
