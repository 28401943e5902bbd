package com.monumentlens.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    @Test
    void keepsWellFormedClientIds() {
        assertThat(RequestIdFilter.resolveRequestId(" trace-42.a_b ")).isEqualTo("trace-42.a_b");
    }

    @Test
    void replacesIdsThatCouldForgeLogLines() {
        assertThat(RequestIdFilter.resolveRequestId("abc\nFAKE LOG LINE")).matches("[0-9a-f-]{36}");
        assertThat(RequestIdFilter.resolveRequestId("x".repeat(65))).matches("[0-9a-f-]{36}");
        assertThat(RequestIdFilter.resolveRequestId(null)).matches("[0-9a-f-]{36}");
    }

    @Test
    void echoesTheIdInTheResponse() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/profile/me");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        new RequestIdFilter().doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("req-1");
    }
}
