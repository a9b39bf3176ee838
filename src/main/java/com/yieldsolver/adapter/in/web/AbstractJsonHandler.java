package com.yieldsolver.adapter.in.web;

import com.yieldsolver.application.service.RequestValidationException;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared request/response plumbing for the JSON calculation endpoints
 * Subclasses map the body to a command and return the use case future
 */
@Slf4j
public abstract class AbstractJsonHandler<T> implements Handler<RoutingContext> {

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody;
        try {
            requestBody = context.body().asJsonObject();
        } catch (DecodeException e) {
            log.warn("Malformed JSON body for {}: {}", context.normalizedPath(), e.getMessage());
            sendError(context, 400, ErrorResponse.error("Invalid request format: malformed JSON"));
            return;
        }

        if (requestBody == null) {
            log.warn("Request body is null for {}", context.normalizedPath());
            sendError(context, 400, ErrorResponse.error("Request body is required"));
            return;
        }

        Future<T> result;
        try {
            result = process(context, requestBody);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            sendError(context, 400, ErrorResponse.error("Invalid request format: " + e.getMessage()));
            return;
        }

        result.onSuccess(value -> send(context, 200, toResponse(value)))
                .onFailure(error -> handleFailure(context, error));
    }

    /**
     * Map the request body to a command and invoke the use case
     */
    protected abstract Future<T> process(RoutingContext context, JsonObject body);

    /**
     * Build the response DTO for a successful result
     */
    protected abstract Object toResponse(T value);

    private void handleFailure(RoutingContext context, Throwable error) {
        if (error instanceof RequestValidationException validation) {
            log.warn("Request validation failed: {}", validation.getErrors());
            sendError(context, 400, ErrorResponse.error("Validation failed", validation.getErrors()));
        } else if (error instanceof IllegalArgumentException) {
            log.warn("Invalid input: {}", error.getMessage());
            sendError(context, 400, ErrorResponse.error(error.getMessage()));
        } else {
            log.error("Calculation failed: {}", error.getMessage(), error);
            sendError(context, 500, ErrorResponse.error("Calculation failed: " + error.getMessage()));
        }
    }

    protected void send(RoutingContext context, int statusCode, Object body) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(body).encode());
    }

    private void sendError(RoutingContext context, int statusCode, ErrorResponse response) {
        send(context, statusCode, response);
    }
}
