package com.relayclaw.waf;

import com.relayclaw.shared.model.OutboundRequest;
import com.relayclaw.shared.model.UpstreamResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Ordered registry of WAF solvers. Builds the one retry request for a recognized
 * challenge; whether that retry happens, and only once, is the dispatcher's call.
 */
public class WafBypassHandler {

    private static final Logger log = LoggerFactory.getLogger(WafBypassHandler.class);

    public record Retry(String vendor, OutboundRequest request) {}

    private final List<WafChallengeSolver> solvers;

    public WafBypassHandler(List<WafChallengeSolver> solvers) {
        this.solvers = List.copyOf(solvers);
    }

    public static WafBypassHandler withDefaults() {
        return new WafBypassHandler(List.of(new AcwScV2Solver()));
    }

    public Optional<WafChallengeSolver> detect(UpstreamResponse response) {
        for (var solver : solvers) {
            if (solver.canSolve(response)) return Optional.of(solver);
        }
        return Optional.empty();
    }

    public boolean isChallenge(UpstreamResponse response) {
        return detect(response).isPresent();
    }

    /**
     * @return the original request with the challenge cookies attached, or empty when no
     *         solver recognizes the response or the payload cannot be solved
     */
    public Optional<Retry> prepareRetry(OutboundRequest original, UpstreamResponse challenge) {
        var solver = detect(challenge);
        if (solver.isEmpty()) return Optional.empty();
        WafSolution solution;
        try {
            solution = solver.get().solve(challenge);
        } catch (WafChallengeException e) {
            log.warn("{} challenge from {} could not be solved: {}", solver.get().vendor(), original.url(), e.getMessage());
            return Optional.empty();
        }

        var cookies = new LinkedHashMap<String, String>();
        parseCookieHeader(original.header("Cookie"), cookies);
        // 挑战页下发的会话 cookie（如 acw_tc）必须一并带回
        for (var setCookie : challenge.headers().entrySet()) {
            if (setCookie.getKey() == null || !setCookie.getKey().equalsIgnoreCase("Set-Cookie")) continue;
            for (var value : setCookie.getValue()) {
                var pair = value.split(";", 2)[0];
                parseCookieHeader(pair, cookies);
            }
        }
        cookies.putAll(solution.cookies());

        var header = new StringBuilder();
        cookies.forEach((k, v) -> {
            if (header.length() > 0) header.append("; ");
            header.append(k).append('=').append(v);
        });
        log.info("Solved {} challenge from {}, retrying once", solution.vendor(), original.url());
        return Optional.of(new Retry(solution.vendor(), original.withHeader("Cookie", header.toString())));
    }

    private static void parseCookieHeader(String header, LinkedHashMap<String, String> into) {
        if (header == null || header.isBlank()) return;
        for (var part : header.split(";")) {
            int eq = part.indexOf('=');
            if (eq <= 0) continue;
            into.put(part.substring(0, eq).trim(), part.substring(eq + 1).trim());
        }
    }
}
