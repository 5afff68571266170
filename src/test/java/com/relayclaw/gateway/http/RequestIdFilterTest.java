package com.relayclaw.gateway.http;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void callerIdIsEchoedAndVisibleInMdc() throws Exception {
        var request = new MockHttpServletRequest("POST", "/v1/messages");
        request.addHeader(RequestIdFilter.HEADER, "req-42");
        var response = new MockHttpServletResponse();
        var seen = new AtomicReference<String>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req,
                                   HttpServletResponse res) {
                seen.set(MDC.get(RequestIdFilter.MDC_KEY));
            }
        }));

        assertEquals("req-42", seen.get());
        assertEquals("req-42", response.getHeader(RequestIdFilter.HEADER));
        assertNull(MDC.get(RequestIdFilter.MDC_KEY));
    }

    @Test
    void missingIdIsGenerated() throws Exception {
        var request = new MockHttpServletRequest("GET", "/relay/health");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        var id = response.getHeader(RequestIdFilter.HEADER);
        assertNotNull(id);
        assertFalse(id.isBlank());
    }
}
