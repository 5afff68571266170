package com.relayclaw.resilience;

import com.relayclaw.shared.model.UpstreamResponse;

import java.net.ConnectException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps upstream answers and transport errors onto {@link FailureKind}s.
 */
public final class FailureClassifier {

    private static final long RETRY_AFTER_CAP_MS = 300_000;
    private static final Set<Integer> CALLER_FAULT = Set.of(400, 404, 405, 413, 422);
    private static final Pattern RETRY_AFTER = Pattern.compile(
            "(?i)retry[_-]after[\"':\\s]+([\\d.]+)");
    private static final int BODY_SNIPPET = 300;

    private FailureClassifier() {}

    /**
     * Requests the caller got wrong. Another provider would reject them the same way, so
     * they are returned as-is and count neither as failure nor as success.
     */
    public static boolean isCallerFault(int statusCode) {
        return CALLER_FAULT.contains(statusCode);
    }

    /** @return empty for a successful answer */
    public static Optional<UpstreamFailure> classify(UpstreamResponse response) {
        int code = response.statusCode();
        if (response.isSuccess()) return Optional.empty();
        var message = snippet(response.bodyText());
        if (code == 401 || code == 403) {
            return Optional.of(new UpstreamFailure(FailureKind.AUTH_FAILURE, code, message, Duration.ZERO));
        }
        if (isRateLimited(code, message)) {
            return Optional.of(new UpstreamFailure(FailureKind.RATE_LIMITED, code, message,
                    retryAfter(response.header("Retry-After"), message)));
        }
        if (code == 408) {
            return Optional.of(new UpstreamFailure(FailureKind.NETWORK_FAILURE, code, message, Duration.ZERO));
        }
        return Optional.of(new UpstreamFailure(FailureKind.UPSTREAM_ERROR, code, message, Duration.ZERO));
    }

    /** Transport errors: timeouts and refused connections are both network failures. */
    public static UpstreamFailure classify(Throwable error) {
        var root = unwrap(error);
        if (root instanceof HttpConnectTimeoutException) {
            return UpstreamFailure.network("connect timeout: " + root.getMessage());
        }
        if (root instanceof HttpTimeoutException) {
            return UpstreamFailure.network("request timeout: " + root.getMessage());
        }
        if (root instanceof ConnectException) {
            return UpstreamFailure.network("connection failed: " + root.getMessage());
        }
        var msg = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return UpstreamFailure.network(msg);
    }

    static boolean isRateLimited(int code, String body) {
        if (code == 429) return true;
        // 部分上游用 503 + 文案表示限流
        return code == 503 && body != null
                && (body.contains("Too Many") || body.contains("rate_limit") || body.contains("rate limit"));
    }

    static Duration retryAfter(String header, String body) {
        if (header != null && !header.isBlank()) {
            var fromHeader = parseRetryAfterHeader(header.trim());
            if (fromHeader != null) return fromHeader;
        }
        if (body == null) return Duration.ZERO;
        Matcher m = RETRY_AFTER.matcher(body);
        if (m.find()) {
            try {
                return capped(Double.parseDouble(m.group(1)));
            } catch (NumberFormatException e) {
                return Duration.ZERO;
            }
        }
        return Duration.ZERO;
    }

    private static Duration parseRetryAfterHeader(String value) {
        try {
            return capped(Double.parseDouble(value));
        } catch (NumberFormatException notSeconds) {
            try {
                var at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                var secs = Duration.between(ZonedDateTime.now(at.getZone()), at).toMillis() / 1000.0;
                return capped(Math.max(0, secs));
            } catch (DateTimeParseException notDate) {
                return null;
            }
        }
    }

    private static Duration capped(double secs) {
        if (!Double.isFinite(secs) || secs < 0) return Duration.ZERO;
        return Duration.ofMillis(Math.min((long) (secs * 1000), RETRY_AFTER_CAP_MS));
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String snippet(String body) {
        if (body == null) return "";
        var trimmed = body.strip();
        return trimmed.length() <= BODY_SNIPPET ? trimmed : trimmed.substring(0, BODY_SNIPPET) + "...";
    }
}
