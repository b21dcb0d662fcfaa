package com.medclinic.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void suppliedIdIsEchoedAndVisibleInMdcDuringTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, " abc-123 ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                seen.set(MDC.get(RequestIdFilter.MDC_KEY));
            }
        });

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(seen.get()).isEqualTo("abc-123");
        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void unsafeOrOversizedIdsAreReplaced() {
        assertThat(RequestIdFilter.acceptOrGenerate("evil\nAUDIT forged")).hasSize(36);
        assertThat(RequestIdFilter.acceptOrGenerate("x".repeat(65))).hasSize(36);
        assertThat(RequestIdFilter.acceptOrGenerate(null)).hasSize(36);
        assertThat(RequestIdFilter.acceptOrGenerate("req_42.a")).isEqualTo("req_42.a");
    }
}
