package com.relayclaw.gateway.http;

import com.relayclaw.dispatch.ProviderExhaustedException;
import com.relayclaw.shared.model.AppFamily;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ApiExceptionHandlerTest {

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    @SuppressWarnings("unchecked")
    void claudeShape() {
        var body = ApiExceptionHandler.nativeError(AppFamily.CLAUDE, HttpStatus.SERVICE_UNAVAILABLE, "all down");
        assertEquals("error", body.get("type"));
        var error = (Map<String, Object>) body.get("error");
        assertEquals("overloaded_error", error.get("type"));
        assertEquals("all down", error.get("message"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void codexShape() {
        var error = (Map<String, Object>) ApiExceptionHandler
                .nativeError(AppFamily.CODEX, HttpStatus.BAD_REQUEST, "nope").get("error");
        assertEquals("invalid_request_error", error.get("type"));
        assertEquals(400, error.get("code"));

        var server = (Map<String, Object>) ApiExceptionHandler
                .nativeError(AppFamily.CODEX, HttpStatus.SERVICE_UNAVAILABLE, "down").get("error");
        assertEquals("server_error", server.get("type"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void geminiShape() {
        var error = (Map<String, Object>) ApiExceptionHandler
                .nativeError(AppFamily.GEMINI, HttpStatus.SERVICE_UNAVAILABLE, "down").get("error");
        assertEquals(503, error.get("code"));
        assertEquals("UNAVAILABLE", error.get("status"));
    }

    @Test
    void familyFollowsThePathWhenTheErrorHasNone() {
        var request = new MockHttpServletRequest("POST", "/gemini/v1beta/models/m:generateContent");
        var response = handler.handleBadRequest(new IllegalArgumentException("bad"), request);
        assertEquals(400, response.getStatusCode().value());
        assertInstanceOf(Map.class, response.getBody());
        assertTrue(((Map<?, ?>) response.getBody()).get("error").toString().contains("INVALID_ARGUMENT"));
    }

    @Test
    void adminPathsUseEnvelope() {
        var request = new MockHttpServletRequest("GET", "/relay/cooldowns");
        var response = handler.handleNotFound(new NoSuchElementException("ghost"), request);
        var body = assertInstanceOf(ApiExceptionHandler.ApiErrorResponse.class, response.getBody());
        assertEquals("NOT_FOUND", body.code());
        assertEquals("ghost", body.message());
    }

    @Test
    void exhaustionUsesTheDispatchedFamily() {
        var request = new MockHttpServletRequest("POST", "/v1/messages");
        var response = handler.handleExhausted(new ProviderExhaustedException(AppFamily.CLAUDE, List.of()), request);
        assertEquals(503, response.getStatusCode().value());
        assertEquals("error", ((Map<?, ?>) response.getBody()).get("type"));
    }

    @Test
    void unexpectedErrorsHideDetails() {
        var request = new MockHttpServletRequest("GET", "/relay/status");
        var response = handler.handleAny(new IllegalStateException("secret internals"), request);
        var body = (ApiExceptionHandler.ApiErrorResponse) response.getBody();
        assertEquals(500, response.getStatusCode().value());
        assertEquals("Unexpected error", body.message());
    }
}
