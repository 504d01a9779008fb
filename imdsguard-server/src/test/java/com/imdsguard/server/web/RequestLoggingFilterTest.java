package com.imdsguard.server.web;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void request_fields_are_in_mdc_while_chain_runs() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/latest/meta-data/hostname");
        request.setRemoteAddr("10.0.0.5");
        AtomicReference<String> seenPath = new AtomicReference<>();
        AtomicReference<String> seenRemote = new AtomicReference<>();

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenPath.set(MDC.get(RequestLoggingFilter.MDC_PATH));
                seenRemote.set(MDC.get(RequestLoggingFilter.MDC_REMOTE_ADDR));
            }
        });

        assertThat(seenPath.get()).isEqualTo("/latest/meta-data/hostname");
        assertThat(seenRemote.get()).isEqualTo("10.0.0.5");
        assertThat(MDC.get(RequestLoggingFilter.MDC_PATH)).isNull();
    }

    @Test
    void previous_mdc_values_are_restored() throws Exception {
        MDC.put(RequestLoggingFilter.MDC_METHOD, "outer");

        filter.doFilter(new MockHttpServletRequest("PUT", "/ping"), new MockHttpServletResponse(), new MockFilterChain());

        assertThat(MDC.get(RequestLoggingFilter.MDC_METHOD)).isEqualTo("outer");
        assertThat(MDC.get(RequestLoggingFilter.MDC_REMOTE_ADDR)).isNull();
    }
}
