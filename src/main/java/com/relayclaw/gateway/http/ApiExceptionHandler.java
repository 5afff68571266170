package com.relayclaw.gateway.http;

import com.relayclaw.dispatch.DispatchCancelledException;
import com.relayclaw.dispatch.ProviderExhaustedException;
import com.relayclaw.providers.InvalidProviderException;
import com.relayclaw.routing.TransparentRouter;
import com.relayclaw.routing.UnclassifiedRequestException;
import com.relayclaw.shared.model.AppFamily;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Proxy errors are answered in the caller's own wire format so CLI tools can show them;
 * admin errors use a plain envelope.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ApiErrorResponse(String status, String code, String message, String requestId) {}

    @ExceptionHandler(ProviderExhaustedException.class)
    public ResponseEntity<Object> handleExhausted(ProviderExhaustedException ex, HttpServletRequest request) {
        return respond(request, ex.family(), HttpStatus.SERVICE_UNAVAILABLE, "EXHAUSTED", ex.getMessage());
    }

    @ExceptionHandler(UnclassifiedRequestException.class)
    public ResponseEntity<Object> handleUnclassified(UnclassifiedRequestException ex, HttpServletRequest request) {
        return respond(request, null, HttpStatus.BAD_REQUEST, "UNCLASSIFIED_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(DispatchCancelledException.class)
    public ResponseEntity<Object> handleCancelled(DispatchCancelledException ex, HttpServletRequest request) {
        return respond(request, null, HttpStatus.SERVICE_UNAVAILABLE, "CANCELLED", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, InvalidProviderException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Object> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(request, null, HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Object> handleNotFound(NoSuchElementException ex, HttpServletRequest request) {
        return respond(request, null, HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAny(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception requestId={}", currentRequestId(), ex);
        return respond(request, null, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    // ---------- helpers ----------

    private ResponseEntity<Object> respond(HttpServletRequest request, AppFamily family,
                                           HttpStatus status, String code, String message) {
        var path = request.getRequestURI();
        Object body;
        if (path.startsWith("/relay/")) {
            body = new ApiErrorResponse(status.name(), code, message, currentRequestId());
        } else {
            var f = family != null ? family : TransparentRouter.classifyByPath(path);
            body = nativeError(f == null ? AppFamily.CODEX : f, status, message);
        }
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }

    static Map<String, Object> nativeError(AppFamily family, HttpStatus status, String message) {
        var error = new LinkedHashMap<String, Object>();
        var out = new LinkedHashMap<String, Object>();
        switch (family) {
            case CLAUDE -> {
                error.put("type", switch (status) {
                    case BAD_REQUEST -> "invalid_request_error";
                    case NOT_FOUND -> "not_found_error";
                    case SERVICE_UNAVAILABLE -> "overloaded_error";
                    default -> "api_error";
                });
                error.put("message", message);
                out.put("type", "error");
                out.put("error", error);
            }
            case CODEX -> {
                error.put("message", message);
                error.put("type", status.is4xxClientError() ? "invalid_request_error" : "server_error");
                error.put("code", status.value());
                out.put("error", error);
            }
            case GEMINI -> {
                error.put("code", status.value());
                error.put("message", message);
                error.put("status", switch (status) {
                    case BAD_REQUEST -> "INVALID_ARGUMENT";
                    case NOT_FOUND -> "NOT_FOUND";
                    case SERVICE_UNAVAILABLE -> "UNAVAILABLE";
                    default -> "INTERNAL";
                });
                out.put("error", error);
            }
        }
        return out;
    }

    private String currentRequestId() {
        var rid = MDC.get(RequestIdFilter.MDC_KEY);
        return rid == null || rid.isBlank() ? "" : rid;
    }
}
