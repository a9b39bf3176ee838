package com.yieldsolver.adapter.in.web.rate;

import com.yieldsolver.adapter.in.web.AbstractJsonHandler;
import com.yieldsolver.application.port.in.RateOfReturnUseCase;
import com.yieldsolver.application.port.in.RateOfReturnUseCase.IrrCommand;
import com.yieldsolver.domain.model.SolverResult;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for IRR
 * Handles POST /api/irr
 */
@Slf4j
@RequiredArgsConstructor
public class IrrHandler extends AbstractJsonHandler<SolverResult> {

    private final RateOfReturnUseCase rateOfReturnUseCase;

    @Override
    protected Future<SolverResult> process(RoutingContext context, JsonObject body) {
        IrrRequest request = body.mapTo(IrrRequest.class);
        log.info("Received IRR request with {} cashflows",
                request.cashflows() == null ? 0 : request.cashflows().size());

        return rateOfReturnUseCase.irr(new IrrCommand(
                request.cashflows(),
                request.guess(),
                request.tolerance()
        ));
    }

    @Override
    protected Object toResponse(SolverResult result) {
        return IrrResponse.from(result);
    }
}
