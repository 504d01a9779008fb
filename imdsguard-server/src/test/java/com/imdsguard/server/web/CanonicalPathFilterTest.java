package com.imdsguard.server.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CanonicalPathFilterTest {

    private final CanonicalPathFilter filter = new CanonicalPathFilter();

    @ParameterizedTest
    @CsvSource({
        "/latest/meta-data/iam/./security-credentials/, /latest/meta-data/iam/security-credentials/",
        "/latest/meta-data/iam/x/../security-credentials/, /latest/meta-data/iam/security-credentials/",
        "/latest/meta-data/iam/security-credentials/;x, /latest/meta-data/iam/security-credentials/",
        "/latest/meta-data/iam/security-credentials;x/role, /latest/meta-data/iam/security-credentials/role",
        "//latest/meta-data/iam/security-credentials/, /latest/meta-data/iam/security-credentials/",
        "/latest//meta-data/iam/security-credentials/role, /latest/meta-data/iam/security-credentials/role",
        "/latest/meta-data/iam/%2e/security-credentials/, /latest/meta-data/iam/security-credentials/",
        "/latest/meta-data/iam/x/%2E%2e/security-credentials/, /latest/meta-data/iam/security-credentials/",
        "/latest/meta-data/iam/security-credentials/role/., /latest/meta-data/iam/security-credentials/role",
        "/../latest/meta-data/, /latest/meta-data/",
        "/.., /"
    })
    void non_canonical_paths_are_normalized(String raw, String canonical) {
        assertThat(CanonicalPathFilter.canonicalPath(raw)).isEqualTo(canonical);
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "/",
                "/ping",
                "/latest/",
                "/latest/meta-data/iam/security-credentials",
                "/latest/meta-data/iam/security-credentials/",
                "/latest/meta-data/iam/security-credentials/team/reader",
                "/latest/user-data%2Fx",
                "/latest/meta-data/..hidden"
            })
    void canonical_paths_are_unchanged(String raw) {
        assertThat(CanonicalPathFilter.canonicalPath(raw)).isEqualTo(raw);
    }

    @Test
    void non_canonical_request_is_redirected_with_query_and_not_dispatched() throws Exception {
        MockHttpServletRequest request =
                new MockHttpServletRequest("GET", "/latest/meta-data/iam/./security-credentials/");
        request.setQueryString("ip=10.0.0.5");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(301);
        assertThat(response.getHeader("Location"))
                .isEqualTo("/latest/meta-data/iam/security-credentials/?ip=10.0.0.5");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void canonical_request_passes_through() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/latest/meta-data/hostname");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getStatus()).isEqualTo(200);
    }
}
