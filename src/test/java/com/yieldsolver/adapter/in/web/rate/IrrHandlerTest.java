package com.yieldsolver.adapter.in.web.rate;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import static org.mockito.ArgumentMatchers.any;
import org.mockito.Mock;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.mockito.MockitoAnnotations;

import com.yieldsolver.application.port.in.RateOfReturnUseCase;
import com.yieldsolver.application.port.in.RateOfReturnUseCase.IrrCommand;
import com.yieldsolver.application.service.RequestValidationException;
import com.yieldsolver.domain.model.SolverResult;

import io.vertx.core.Future;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RequestBody;
import io.vertx.ext.web.RoutingContext;

/**
 * Unit test for IrrHandler
 * Drives the handler with a mocked routing context and inspects the written response
 */
class IrrHandlerTest {

    @Mock
    private RateOfReturnUseCase rateOfReturnUseCase;

    @Mock
    private RoutingContext context;

    @Mock
    private RequestBody body;

    private HttpServerResponse response;
    private IrrHandler handler;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        response = mock(HttpServerResponse.class, RETURNS_SELF);
        when(context.body()).thenReturn(body);
        when(context.response()).thenReturn(response);
        handler = new IrrHandler(rateOfReturnUseCase);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void handle_shouldReturnSolvedRate() {
        // Given
        when(body.asJsonObject()).thenReturn(new JsonObject()
                .put("cashflows", new JsonArray(List.of(-100.0, 39.0, 59.0, 55.0, 20.0))));
        when(rateOfReturnUseCase.irr(any())).thenReturn(
                Future.succeededFuture(SolverResult.converged(0.2809484212, 4)));

        // When
        handler.handle(context);

        // Then
        ArgumentCaptor<IrrCommand> command = ArgumentCaptor.forClass(IrrCommand.class);
        verify(rateOfReturnUseCase).irr(command.capture());
        assertEquals(5, command.getValue().cashflows().size());

        verify(response).setStatusCode(200);
        JsonObject json = writtenJson();
        assertEquals("success", json.getString("status"));
        assertEquals(0.2809484212, json.getDouble("irr"));
        assertEquals(4, json.getInteger("iterations"));
        assertTrue(json.getBoolean("converged"));
    }

    @Test
    void handle_shouldReturnNullRateWhenNotConverged() {
        // Given
        when(body.asJsonObject()).thenReturn(new JsonObject()
                .put("cashflows", new JsonArray(List.of(100.0, 50.0, 25.0))));
        when(rateOfReturnUseCase.irr(any())).thenReturn(Future.succeededFuture(SolverResult.notConverged(16)));

        // When
        handler.handle(context);

        // Then
        verify(response).setStatusCode(200);
        JsonObject json = writtenJson();
        assertTrue(json.containsKey("irr"));
        assertEquals(null, json.getValue("irr"));
        assertFalse(json.getBoolean("converged"));
    }

    @Test
    void handle_shouldMapValidationFailureTo400() {
        // Given
        when(body.asJsonObject()).thenReturn(new JsonObject());
        when(rateOfReturnUseCase.irr(any())).thenReturn(
                Future.failedFuture(new RequestValidationException(List.of("cashflows is required"))));

        // When
        handler.handle(context);

        // Then
        verify(response).setStatusCode(400);
        JsonObject json = writtenJson();
        assertEquals("error", json.getString("status"));
        assertEquals("Validation failed", json.getString("message"));
        assertEquals("cashflows is required", json.getJsonArray("errors").getString(0));
    }

    @Test
    void handle_shouldRejectMissingBody() {
        // Given
        when(body.asJsonObject()).thenReturn(null);

        // When
        handler.handle(context);

        // Then
        verify(response).setStatusCode(400);
        verify(rateOfReturnUseCase, never()).irr(any());
        assertEquals("Request body is required", writtenJson().getString("message"));
    }

    @Test
    void handle_shouldRejectMalformedJson() {
        // Given
        when(body.asJsonObject()).thenThrow(new DecodeException("Unexpected character"));

        // When
        handler.handle(context);

        // Then
        verify(response).setStatusCode(400);
        verify(rateOfReturnUseCase, never()).irr(any());
    }

    @Test
    void handle_shouldRejectWronglyTypedField() {
        // Given
        when(body.asJsonObject()).thenReturn(new JsonObject().put("cashflows", "not-a-list"));

        // When
        handler.handle(context);

        // Then
        verify(response).setStatusCode(400);
        verify(rateOfReturnUseCase, never()).irr(any());
        assertTrue(writtenJson().getString("message").startsWith("Invalid request format"));
    }

    @Test
    void handle_shouldMapUnexpectedFailureTo500() {
        // Given
        when(body.asJsonObject()).thenReturn(new JsonObject()
                .put("cashflows", new JsonArray(List.of(-1.0, 1.0))));
        when(rateOfReturnUseCase.irr(any())).thenReturn(Future.failedFuture(new IllegalStateException("boom")));

        // When
        handler.handle(context);

        // Then
        verify(response).setStatusCode(500);
    }

    private JsonObject writtenJson() {
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(response).end(payload.capture());
        return new JsonObject(payload.getValue());
    }
}
