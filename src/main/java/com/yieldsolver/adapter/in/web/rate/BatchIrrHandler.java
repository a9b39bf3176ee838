package com.yieldsolver.adapter.in.web.rate;

import com.yieldsolver.adapter.in.web.AbstractJsonHandler;
import com.yieldsolver.application.port.in.RateOfReturnUseCase;
import com.yieldsolver.application.port.in.RateOfReturnUseCase.BatchIrrCommand;
import com.yieldsolver.domain.model.SolverResult;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * HTTP handler for batch IRR
 * Handles POST /api/irr/batch
 */
@Slf4j
@RequiredArgsConstructor
public class BatchIrrHandler extends AbstractJsonHandler<List<SolverResult>> {

    private final RateOfReturnUseCase rateOfReturnUseCase;

    @Override
    protected Future<List<SolverResult>> process(RoutingContext context, JsonObject body) {
        BatchIrrRequest request = body.mapTo(BatchIrrRequest.class);
        log.info("Received batch IRR request with {} series",
                request.series() == null ? 0 : request.series().size());

        return rateOfReturnUseCase.batchIrr(new BatchIrrCommand(
                request.series(),
                request.guess(),
                request.tolerance()
        ));
    }

    @Override
    protected Object toResponse(List<SolverResult> results) {
        return BatchIrrResponse.from(results);
    }
}
