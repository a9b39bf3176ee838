package com.yieldsolver.adapter.in.web;

import com.yieldsolver.adapter.in.web.loan.AmortizationHandler;
import com.yieldsolver.adapter.in.web.loan.TimeValueHandler;
import com.yieldsolver.adapter.in.web.rate.BatchIrrHandler;
import com.yieldsolver.adapter.in.web.rate.IrrHandler;
import com.yieldsolver.adapter.in.web.rate.XirrHandler;
import com.yieldsolver.adapter.in.web.valuation.MirrHandler;
import com.yieldsolver.adapter.in.web.valuation.NpvHandler;
import com.yieldsolver.adapter.in.web.valuation.XnpvHandler;
import com.yieldsolver.adapter.out.config.InMemorySolverConfigurationAdapter;
import com.yieldsolver.application.port.in.CashflowValuationUseCase;
import com.yieldsolver.application.port.in.LoanCalculationUseCase;
import com.yieldsolver.application.port.in.RateOfReturnUseCase;
import com.yieldsolver.application.port.out.SolverConfigurationRepository;
import com.yieldsolver.application.service.CashflowRequestValidator;
import com.yieldsolver.application.service.CashflowValuationService;
import com.yieldsolver.application.service.LoanCalculationService;
import com.yieldsolver.application.service.RateOfReturnService;
import com.yieldsolver.domain.solver.NewtonSolver;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8080;
    private static final long MAX_BODY_BYTES = 1024 * 1024;

    private WebRouter.WebRouterBuilder routes;
    private HttpServer server;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeServices()
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        log.info("HTTP Server Verticle stopped");
    }

    /**
     * Port the server is bound to; differs from the configured one when that is 0
     */
    public int actualPort() {
        return server != null ? server.actualPort() : getPort();
    }

    private Future<Void> initializeServices() {
        try {
            // Output ports (adapters)
            SolverConfigurationRepository configurationRepository = new InMemorySolverConfigurationAdapter(config());

            // Application services (use cases)
            CashflowRequestValidator validator = new CashflowRequestValidator();
            RateOfReturnUseCase rateOfReturnUseCase = new RateOfReturnService(
                    vertx,
                    new NewtonSolver(),
                    validator,
                    configurationRepository
            );
            CashflowValuationUseCase valuationUseCase = new CashflowValuationService(validator);
            LoanCalculationUseCase loanCalculationUseCase = new LoanCalculationService(validator);

            // Input adapters (handlers)
            routes = WebRouter.builder()
                    .irrHandler(new IrrHandler(rateOfReturnUseCase))
                    .xirrHandler(new XirrHandler(rateOfReturnUseCase))
                    .batchIrrHandler(new BatchIrrHandler(rateOfReturnUseCase))
                    .npvHandler(new NpvHandler(valuationUseCase))
                    .xnpvHandler(new XnpvHandler(valuationUseCase))
                    .mirrHandler(new MirrHandler(valuationUseCase))
                    .timeValueHandler(new TimeValueHandler(loanCalculationUseCase))
                    .amortizationHandler(new AmortizationHandler(loanCalculationUseCase));

            log.info("Services wired up (Hexagonal Architecture)");
            return Future.succeededFuture();
        } catch (Exception e) {
            log.error("Error initializing services", e);
            return Future.failedFuture(e);
        }
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES));

        // Setup routes
        routes.router(router)
                .build()
                .setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(httpServer -> {
                    server = httpServer;
                    log.info("HTTP server listening on port {}", httpServer.actualPort());
                })
                .mapEmpty();
    }

    private int getPort() {
        return config().getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT);
    }
}
