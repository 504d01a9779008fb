package com.imdsguard.server.forward;

import static org.assertj.core.api.Assertions.assertThat;

import com.imdsguard.server.FakeMetadataEndpoint;
import com.imdsguard.server.FakeMetadataEndpoint.RecordedRequest;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class HttpClientMetadataForwarderTest {

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(2))
            .build();
    private FakeMetadataEndpoint upstream;
    private HttpClientMetadataForwarder forwarder;

    @BeforeEach
    void setUp() throws Exception {
        upstream = new FakeMetadataEndpoint();
        forwarder = new HttpClientMetadataForwarder(client, URI.create(upstream.url()), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        upstream.close();
    }

    @Test
    void forwards_method_path_query_headers_and_body() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/latest/meta-data/placement/zone");
        request.setQueryString("a=1%202&b");
        request.addHeader("X-Custom", "kept");
        request.addHeader("Proxy-Authorization", "Basic c2VjcmV0");
        request.setContent("payload=1".getBytes(StandardCharsets.UTF_8));
        MockHttpServletResponse response = new MockHttpServletResponse();

        forwarder.forward(request, response);

        RecordedRequest seen = upstream.lastRequest();
        assertThat(seen.method()).isEqualTo("PUT");
        assertThat(seen.rawPath()).isEqualTo("/latest/meta-data/placement/zone");
        assertThat(seen.rawQuery()).isEqualTo("a=1%202&b");
        assertThat(seen.header("X-Custom")).isEqualTo("kept");
        assertThat(seen.header("Proxy-Authorization")).isNull();
        assertThat(seen.bodyAsString()).isEqualTo("payload=1");
    }

    @Test
    void relays_status_headers_and_body_from_upstream() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/latest/meta-data/hostname");
        MockHttpServletResponse response = new MockHttpServletResponse();

        forwarder.forward(request, response);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getHeader("X-Upstream")).isEqualTo("fake-imds");
        assertThat(response.getContentAsString()).isEqualTo("echo:GET:/latest/meta-data/hostname");
    }

    @Test
    void upstream_error_status_is_relayed_unchanged() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/not-metadata");
        MockHttpServletResponse response = new MockHttpServletResponse();

        forwarder.forward(request, response);

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.getContentAsString()).isEqualTo("not found");
    }

    @Test
    void unreachable_upstream_is_502() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = socket.getLocalPort();
        }
        HttpClientMetadataForwarder unreachable = new HttpClientMetadataForwarder(
                client, URI.create("http://127.0.0.1:" + closedPort), Duration.ofSeconds(2));
        MockHttpServletResponse response = new MockHttpServletResponse();

        unreachable.forward(new MockHttpServletRequest("GET", "/latest/meta-data/hostname"), response);

        assertThat(response.getStatus()).isEqualTo(502);
        assertThat(response.getContentAsString()).isEqualTo("metadata endpoint unreachable\n");
    }

    @Test
    void target_uri_keeps_raw_encoding() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/latest/user-data%2Fx");
        request.setQueryString("q=%C3%A9");

        assertThat(forwarder.targetUri(request).toString())
                .isEqualTo(upstream.url() + "/latest/user-data%2Fx?q=%C3%A9");
    }

    @Test
    void endpoint_base_path_is_joined_with_request_path() {
        HttpClientMetadataForwarder prefixed = new HttpClientMetadataForwarder(
                client, URI.create(upstream.url() + "/imds"), Duration.ofSeconds(2));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/latest/meta-data/hostname");
        request.setQueryString("x=1");

        assertThat(prefixed.targetUri(request).toString())
                .isEqualTo(upstream.url() + "/imds/latest/meta-data/hostname?x=1");
    }

    @Test
    void oversized_body_is_rejected_without_calling_upstream() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/latest/api/token");
        request.setContent(new byte[HttpClientMetadataForwarder.MAX_REQUEST_BODY_BYTES + 1]);
        MockHttpServletResponse response = new MockHttpServletResponse();

        forwarder.forward(request, response);

        assertThat(response.getStatus()).isEqualTo(413);
        assertThat(upstream.lastRequest()).isNull();
    }

    @Test
    void body_at_the_limit_is_forwarded() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/latest/meta-data/blob");
        request.setContent(new byte[HttpClientMetadataForwarder.MAX_REQUEST_BODY_BYTES]);
        MockHttpServletResponse response = new MockHttpServletResponse();

        forwarder.forward(request, response);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(upstream.lastRequest().body()).hasSize(HttpClientMetadataForwarder.MAX_REQUEST_BODY_BYTES);
    }
}
