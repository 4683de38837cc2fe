package com.example.mesh.service.gateway;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.mesh.PropertiesFixtures;
import com.example.mesh.config.HttpClientConfig;
import com.example.mesh.properties.ApplicationProperties.GatewayProperties.RouteProperties;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

@DisplayName("ProxyService header and body fidelity")
class ProxyServiceTest {

  private static WireMockServer backendServer;

  private ProxyService proxyService;
  private Route route;

  @BeforeAll
  static void startBackend() {
    // Responses are sent exactly as stubbed, whatever the request asks for.
    backendServer = new WireMockServer(WireMockConfiguration.options().dynamicPort().gzipDisabled(true));
    backendServer.start();
  }

  @AfterAll
  static void stopBackend() {
    backendServer.stop();
  }

  @BeforeEach
  void setUp() {
    backendServer.resetAll();
    HttpClientConfig config = new HttpClientConfig(PropertiesFixtures.gateway(List.of(
        new RouteProperties("/api/auth", backendServer.baseUrl(), "/api"))));
    OkHttpClient client = config.upstreamOkHttpClient(config.sharedConnectionPool(), config.sharedDispatcher());
    RouteTable routeTable = config.routeTable();
    proxyService = new ProxyService(client, routeTable);
    route = proxyService.resolve("/api/auth/plain");
  }

  @Test
  @DisplayName("Should not add Accept-Encoding or User-Agent the client never sent")
  void shouldNotAddDefaultHeaders() {
    backendServer.stubFor(get(urlEqualTo("/api/plain")).willReturn(aResponse().withStatus(200)));
    HttpHeaders headers = new HttpHeaders();
    headers.add("X-Request-Id", "req-1");

    ForwardedResponse response = proxyService.forward(route,
        new ForwardedRequest("GET", "/api/auth/plain", null, headers, new byte[0]));

    assertThat(response.status()).isEqualTo(200);
    backendServer.verify(getRequestedFor(urlEqualTo("/api/plain"))
        .withHeader("X-Request-Id", equalTo("req-1"))
        .withoutHeader("Accept-Encoding")
        .withoutHeader("User-Agent"));
  }

  @Test
  @DisplayName("Should pass client Accept-Encoding and User-Agent through verbatim")
  void shouldKeepClientHeaders() {
    backendServer.stubFor(get(urlEqualTo("/api/plain")).willReturn(aResponse().withStatus(200)));
    HttpHeaders headers = new HttpHeaders();
    headers.add(HttpHeaders.ACCEPT_ENCODING, "br, gzip");
    headers.add(HttpHeaders.USER_AGENT, "mesh-client/2.1");

    proxyService.forward(route, new ForwardedRequest("GET", "/api/auth/plain", null, headers, new byte[0]));

    backendServer.verify(getRequestedFor(urlEqualTo("/api/plain"))
        .withHeader("Accept-Encoding", equalTo("br, gzip"))
        .withHeader("User-Agent", equalTo("mesh-client/2.1")));
  }

  @Test
  @DisplayName("Should return a gzip body encoded, with its encoding headers")
  void shouldNotDecodeGzipBody() throws IOException {
    byte[] compressed = gzip("compressed upstream payload");
    backendServer.stubFor(get(urlEqualTo("/api/zipped"))
        .willReturn(aResponse()
            .withStatus(200)
            .withHeader("Content-Type", "text/plain")
            .withHeader("Content-Encoding", "gzip")
            .withHeader("Content-Length", String.valueOf(compressed.length))
            .withBody(compressed)));

    ForwardedResponse response = proxyService.forward(route,
        new ForwardedRequest("GET", "/api/auth/zipped", null, new HttpHeaders(), new byte[0]));

    assertThat(response.body()).isEqualTo(compressed);
    assertThat(response.headers().getFirst(HttpHeaders.CONTENT_ENCODING)).isEqualTo("gzip");
    assertThat(response.headers().getFirst(HttpHeaders.CONTENT_LENGTH))
        .isEqualTo(String.valueOf(compressed.length));
  }

  @Test
  @DisplayName("Should not decode gzip when the client asked for it either")
  void shouldNotDecodeGzipRequestedByClient() throws IOException {
    byte[] compressed = gzip("client asked for gzip");
    backendServer.stubFor(get(urlEqualTo("/api/zipped"))
        .willReturn(aResponse().withStatus(200).withHeader("Content-Encoding", "gzip").withBody(compressed)));
    HttpHeaders headers = new HttpHeaders();
    headers.add(HttpHeaders.ACCEPT_ENCODING, "gzip");

    ForwardedResponse response = proxyService.forward(route,
        new ForwardedRequest("GET", "/api/auth/zipped", null, headers, new byte[0]));

    assertThat(response.body()).isEqualTo(compressed);
    assertThat(response.headers().getFirst(HttpHeaders.CONTENT_ENCODING)).isEqualTo("gzip");
  }

  private static byte[] gzip(String text) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
      out.write(text.getBytes(StandardCharsets.UTF_8));
    }
    return bytes.toByteArray();
  }
}
