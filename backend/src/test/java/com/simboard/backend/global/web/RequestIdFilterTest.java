package com.simboard.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void propagatesCallerIdToMdcAndResponse() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/tokens");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "ingest-run-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)));

        assertThat(seen.get()).isEqualTo("ingest-run-42");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("ingest-run-42");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void replacesUnsafeOrOversizedIds() {
        assertThat(RequestIdFilter.requestIdFor("abc\r\nforged log line")).isNotEqualTo("abc\r\nforged log line").hasSize(36);
        assertThat(RequestIdFilter.requestIdFor("x".repeat(65))).hasSize(36);
        assertThat(RequestIdFilter.requestIdFor(null)).hasSize(36);
        assertThat(RequestIdFilter.requestIdFor("  trimmed-id  ")).isEqualTo("trimmed-id");
    }
}
