package com.relayclaw.waf;

import com.relayclaw.shared.model.OutboundRequest;
import com.relayclaw.shared.model.UpstreamResponse;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WafBypassHandlerTest {

    private static final String ARG1 = "3A1E9C50F0C6D4A9B2E7F1843D5C6A7B8E9F0A1B";
    private static final String TOKEN = "99649e5a0f62d51e3bd913237fbec35e9e9ce31a";

    private final OutboundRequest original = new OutboundRequest("POST", "https://relay.example.com/v1/messages",
            Map.of("x-api-key", "sk-test", "Cookie", "session=abc"), "{}".getBytes(StandardCharsets.UTF_8));

    @Test
    void retryCarriesSolvedAndIssuedCookies() {
        var challenge = new UpstreamResponse(200,
                Map.of("Set-Cookie", List.of("acw_tc=xyz; Path=/; HttpOnly")),
                AcwScV2SolverTest.page(ARG1).body());

        var retry = WafBypassHandler.withDefaults().prepareRetry(original, challenge).orElseThrow();

        assertEquals("aliyun-acw", retry.vendor());
        assertEquals("session=abc; acw_tc=xyz; acw_sc__v2=" + TOKEN, retry.request().header("cookie"));
        assertEquals(original.url(), retry.request().url());
        assertEquals("sk-test", retry.request().header("x-api-key"));
        assertArrayEquals(original.body(), retry.request().body());
    }

    @Test
    void ordinaryResponsesAreNotChallenges() {
        var handler = WafBypassHandler.withDefaults();
        var response = UpstreamResponse.of(503, "application/json", "{\"error\":\"overloaded\"}");
        assertFalse(handler.isChallenge(response));
        assertTrue(handler.prepareRetry(original, response).isEmpty());
    }

    @Test
    void unsolvableChallengeYieldsNoRetry() {
        var handler = new WafBypassHandler(List.of(new WafChallengeSolver() {
            @Override
            public String vendor() {
                return "broken";
            }

            @Override
            public boolean canSolve(UpstreamResponse response) {
                return true;
            }

            @Override
            public WafSolution solve(UpstreamResponse response) {
                throw new WafChallengeException("garbled payload");
            }
        }));
        var response = UpstreamResponse.of(403, "text/html", "<html>blocked</html>");
        assertTrue(handler.isChallenge(response));
        assertTrue(handler.prepareRetry(original, response).isEmpty());
    }

    @Test
    void firstMatchingSolverWins() {
        var first = new FixedSolver("first");
        var second = new FixedSolver("second");
        var handler = new WafBypassHandler(List.of(first, second));
        var retry = handler.prepareRetry(original, UpstreamResponse.of(200, "text/html", "challenge"));
        assertEquals("first", retry.orElseThrow().vendor());
    }

    private record FixedSolver(String vendor) implements WafChallengeSolver {
        @Override
        public boolean canSolve(UpstreamResponse response) {
            return response.bodyText().contains("challenge");
        }

        @Override
        public WafSolution solve(UpstreamResponse response) {
            return new WafSolution(vendor, Map.of(vendor + "_token", "1"));
        }
    }
}
