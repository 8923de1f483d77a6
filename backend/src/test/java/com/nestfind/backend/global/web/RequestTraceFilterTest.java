package com.nestfind.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestTraceFilterTest {

    private final RequestTraceFilter filter = new RequestTraceFilter();

    @Test
    void clientIpIgnoresSpoofedForwardedFor() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/auth/login");
        request.setRemoteAddr("203.0.113.9");
        request.addHeader("X-Forwarded-For", "10.9.8.7, 203.0.113.9");
        AtomicReference<String> mdcIp = new AtomicReference<>();

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                mdcIp.set(MDC.get("clientIp"));
            }
        });

        assertThat(RequestTraceFilter.clientIp(request)).isEqualTo("203.0.113.9");
        assertThat(mdcIp.get()).isEqualTo("203.0.113.9");
        assertThat(MDC.get("clientIp")).isNull();
    }

    @Test
    void requestIdIsEchoedOrGenerated() throws Exception {
        MockHttpServletRequest tagged = new MockHttpServletRequest("GET", "/auth/me");
        tagged.addHeader(RequestTraceFilter.REQUEST_ID_HEADER, "trace-42");
        MockHttpServletResponse taggedResponse = new MockHttpServletResponse();
        filter.doFilter(tagged, taggedResponse, new MockFilterChain());

        MockHttpServletResponse untaggedResponse = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest("GET", "/auth/me"), untaggedResponse, new MockFilterChain());

        assertThat(taggedResponse.getHeader(RequestTraceFilter.REQUEST_ID_HEADER)).isEqualTo("trace-42");
        assertThat(untaggedResponse.getHeader(RequestTraceFilter.REQUEST_ID_HEADER)).isNotBlank();
    }
}
