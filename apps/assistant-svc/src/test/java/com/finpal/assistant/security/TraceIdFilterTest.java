package com.finpal.assistant.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.FilterChain;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
    }

    @Test
    void echoesSuppliedTraceIdAndClearsContextAfterwards() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "trace-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        FilterChain chain = (req, res) -> {
            seen.put("mdcTrace", MDC.get(RequestContextHolder.MDC_TRACE_ID));
            seen.put("contextTrace", RequestContextHolder.currentTraceId().orElse(null));
            RequestContextHolder.setPhone("9823533097");
            seen.put("mdcUser", MDC.get(RequestContextHolder.MDC_USER));
            seen.put("contextPhone", RequestContextHolder.currentPhone().orElse(null));
            seen.put("traceAfterPhone", RequestContextHolder.currentTraceId().orElse(null));
        };
        filter.doFilter(request, response, chain);

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("trace-123");
        assertThat(seen)
                .containsEntry("mdcTrace", "trace-123")
                .containsEntry("contextTrace", "trace-123")
                .containsEntry("mdcUser", "******3097")
                .containsEntry("contextPhone", "9823533097")
                .containsEntry("traceAfterPhone", "trace-123");

        assertThat(MDC.get(RequestContextHolder.MDC_TRACE_ID)).isNull();
        assertThat(MDC.get(RequestContextHolder.MDC_USER)).isNull();
        assertThat(RequestContextHolder.get()).isEmpty();
    }

    @Test
    void mintsTraceIdWhenHeaderMissing() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), response, (req, res) -> { });

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).matches("[0-9a-f-]{36}");
    }

    @Test
    void replacesTraceIdThatIsNotAPlainToken() {
        assertThat(TraceIdFilter.resolveTraceId("abc\r\nInjected: 1")).isNotEqualTo("abc\r\nInjected: 1").hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId("x".repeat(65))).hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId("  ")).hasSize(36);
        assertThat(TraceIdFilter.resolveTraceId("req_42.a-b")).isEqualTo("req_42.a-b");
    }

    @Test
    void contextIsClearedWhenChainFails() {
        FilterChain failing = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() -> filter.doFilter(new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), failing))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        assertThat(MDC.get(RequestContextHolder.MDC_TRACE_ID)).isNull();
        assertThat(RequestContextHolder.get()).isEmpty();
    }
}
