package com.authgate.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void reusesIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/me");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "  trace-42 ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInMdc.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            }
        });

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("trace-42");
        assertThat(seenInMdc.get()).isEqualTo("trace-42");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void generatesIdWhenHeaderMissingOrTooLong() throws Exception {
        MockHttpServletResponse missing = new MockHttpServletResponse();
        filter.doFilter(new MockHttpServletRequest("POST", "/auth/login"), missing, new MockFilterChain());

        MockHttpServletRequest oversized = new MockHttpServletRequest("POST", "/auth/login");
        oversized.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "x".repeat(65));
        MockHttpServletResponse replaced = new MockHttpServletResponse();
        filter.doFilter(oversized, replaced, new MockFilterChain());

        assertThat(missing.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).hasSize(36);
        assertThat(replaced.getHeader(RequestIdFilter.REQUEST_ID_HEADER))
                .hasSize(36)
                .isNotEqualTo(missing.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
    }

    @Test
    void replacesIdsThatAreUnsafeToLog() {
        assertThat(RequestIdFilter.acceptOrGenerate("abc\r\nforged: 1")).hasSize(36).doesNotContain("forged");
        assertThat(RequestIdFilter.acceptOrGenerate("a b")).hasSize(36);
        assertThat(RequestIdFilter.acceptOrGenerate("   ")).hasSize(36);
        assertThat(RequestIdFilter.acceptOrGenerate("svc-a:0001.retry_2")).isEqualTo("svc-a:0001.retry_2");
    }

    @Test
    void currentRequestIdIsOnlyVisibleDuringTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "trace-7");
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(RequestIdFilter.currentRequestId().orElse(null));
            }
        });

        assertThat(seen.get()).isEqualTo("trace-7");
        assertThat(RequestIdFilter.currentRequestId()).isEmpty();
    }
}
