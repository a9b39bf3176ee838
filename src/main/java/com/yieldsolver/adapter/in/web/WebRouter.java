package com.yieldsolver.adapter.in.web;

import com.yieldsolver.adapter.in.web.loan.AmortizationHandler;
import com.yieldsolver.adapter.in.web.loan.TimeValueHandler;
import com.yieldsolver.adapter.in.web.rate.BatchIrrHandler;
import com.yieldsolver.adapter.in.web.rate.IrrHandler;
import com.yieldsolver.adapter.in.web.rate.XirrHandler;
import com.yieldsolver.adapter.in.web.valuation.MirrHandler;
import com.yieldsolver.adapter.in.web.valuation.NpvHandler;
import com.yieldsolver.adapter.in.web.valuation.XnpvHandler;
import io.vertx.ext.web.Router;
import lombok.Builder;

/**
 * Router configuration for calculation endpoints
 */
@Builder
public class WebRouter {

    private final Router router;
    private final IrrHandler irrHandler;
    private final XirrHandler xirrHandler;
    private final BatchIrrHandler batchIrrHandler;
    private final NpvHandler npvHandler;
    private final XnpvHandler xnpvHandler;
    private final MirrHandler mirrHandler;
    private final TimeValueHandler timeValueHandler;
    private final AmortizationHandler amortizationHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        // Rate of return
        router.post("/api/irr/batch").handler(batchIrrHandler);
        router.post("/api/irr").handler(irrHandler);
        router.post("/api/xirr").handler(xirrHandler);

        // Valuation at a known rate
        router.post("/api/npv").handler(npvHandler);
        router.post("/api/xnpv").handler(xnpvHandler);
        router.post("/api/mirr").handler(mirrHandler);

        // Loans
        router.post("/api/tvm/:function").handler(timeValueHandler);
        router.post("/api/amortization").handler(amortizationHandler);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"yield-solver\"}");
                });

        // Root endpoint
        router.get("/")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"name\":\"Yield Solver\",\"version\":\"1.0.0\"}");
                });
    }
}
