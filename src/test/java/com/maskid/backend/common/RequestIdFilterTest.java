package com.maskid.backend.common;

import com.maskid.backend.common.web.RequestIdFilter;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    private MockHttpServletResponse run(MockHttpServletRequest req, AtomicReference<String> seenInMdc) throws Exception {
        MockHttpServletResponse res = new MockHttpServletResponse();
        filter.doFilter(req, res, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest request, jakarta.servlet.ServletResponse response) {
                seenInMdc.set(MDC.get(RequestIdFilter.MDC_KEY));
            }
        });
        return res;
    }

    @Test
    void should_reuse_well_formed_upstream_id() throws Exception {
        var req = new MockHttpServletRequest("GET", "/api/v1/me");
        req.addHeader(RequestIdFilter.HEADER, "edge-42.abc");
        var mdc = new AtomicReference<String>();

        var res = run(req, mdc);

        assertThat(res.getHeader(RequestIdFilter.HEADER)).isEqualTo("edge-42.abc");
        assertThat(req.getAttribute(RequestIdFilter.ATTR)).isEqualTo("edge-42.abc");
        assertThat(mdc.get()).isEqualTo("edge-42.abc");
        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void should_replace_unsafe_or_oversized_id() throws Exception {
        var req = new MockHttpServletRequest("GET", "/api/v1/me");
        req.addHeader(RequestIdFilter.HEADER, "abc\n[FAKE LOG LINE]");
        var res = run(req, new AtomicReference<>());
        assertThat(res.getHeader(RequestIdFilter.HEADER)).matches("[0-9a-f-]{36}");

        var req2 = new MockHttpServletRequest("GET", "/api/v1/me");
        req2.addHeader(RequestIdFilter.HEADER, "x".repeat(65));
        var res2 = run(req2, new AtomicReference<>());
        assertThat(res2.getHeader(RequestIdFilter.HEADER)).matches("[0-9a-f-]{36}");
    }
}
