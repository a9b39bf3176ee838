package com.yieldsolver.adapter.in.web.rate;

import com.yieldsolver.adapter.in.web.AbstractJsonHandler;
import com.yieldsolver.application.port.in.RateOfReturnUseCase;
import com.yieldsolver.application.port.in.RateOfReturnUseCase.XirrCommand;
import com.yieldsolver.domain.model.SolverResult;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for XIRR
 * Handles POST /api/xirr
 */
@Slf4j
@RequiredArgsConstructor
public class XirrHandler extends AbstractJsonHandler<SolverResult> {

    private final RateOfReturnUseCase rateOfReturnUseCase;

    @Override
    protected Future<SolverResult> process(RoutingContext context, JsonObject body) {
        XirrRequest request = body.mapTo(XirrRequest.class);
        log.info("Received XIRR request with {} cashflows",
                request.cashflows() == null ? 0 : request.cashflows().size());

        return rateOfReturnUseCase.xirr(new XirrCommand(
                request.cashflows(),
                request.dates(),
                request.guess(),
                request.tolerance()
        ));
    }

    @Override
    protected Object toResponse(SolverResult result) {
        return XirrResponse.from(result);
    }
}
