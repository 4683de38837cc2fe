package com.example.mesh.service.gateway;

import com.example.mesh.config.ServiceRole;
import com.example.mesh.exception.RouteNotFoundException;
import com.example.mesh.exception.UpstreamUnavailableException;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Forwards a fully-read client request to the internal service its path resolves to
 * and captures the upstream response in full.
 * <p>
 * One upstream attempt per call: the client is built without connection retries and
 * without following redirects, so a redirect is relayed like any other response.
 * Headers and bodies pass through as sent; see {@link ClientHeaderInterceptor}.
 */
@Slf4j
@Service
@Profile(ServiceRole.GATEWAY)
public class ProxyService {

  // Managed by the HTTP client on each hop.
  private static final Set<String> HOP_BY_HOP_REQUEST_HEADERS = Set.of(
      "host", "connection", "keep-alive", "proxy-connection",
      "transfer-encoding", "te", "upgrade", "http2-settings", "content-length");

  private static final Set<String> HOP_BY_HOP_RESPONSE_HEADERS = Set.of(
      "connection", "keep-alive", "transfer-encoding");

  private static final String IDENTITY_ENCODING = "identity";

  private static final Set<String> BODILESS_METHODS = Set.of("GET", "HEAD");
  private static final Set<String> BODY_REQUIRED_METHODS = Set.of(
      "POST", "PUT", "PATCH", "PROPPATCH", "REPORT");

  private final OkHttpClient upstreamClient;
  private final RouteTable routeTable;

  public ProxyService(@Qualifier("upstreamOkHttpClient") OkHttpClient upstreamClient,
                      RouteTable routeTable) {
    this.upstreamClient = upstreamClient;
    this.routeTable = routeTable;
  }

  /**
   * @throws RouteNotFoundException if no configured prefix matches
   */
  public Route resolve(String path) {
    return routeTable.resolve(path).orElseThrow(() -> {
      log.warn("No proxy route matched {}", path);
      return new RouteNotFoundException(path);
    });
  }

  /**
   * Sends the request to the route's internal service.
   *
   * @throws UpstreamUnavailableException if the upstream cannot be reached, times out,
   *                                      or its response cannot be read
   */
  public ForwardedResponse forward(Route route, ForwardedRequest forwarded) {
    String targetUrl = route.rewrite(forwarded.path(), forwarded.rawQuery());
    log.debug("Forwarding {} {} to {}", forwarded.method(), forwarded.path(), targetUrl);

    Headers headers = upstreamHeaders(forwarded.headers());
    Request.Builder builder = new Request.Builder()
        .url(targetUrl)
        .headers(headers)
        .method(forwarded.method(), requestBody(forwarded))
        .tag(ClientHeaderNames.class, ClientHeaderNames.of(forwarded.headers()));
    if (headers.get(HttpHeaders.ACCEPT_ENCODING) == null) {
      // Keeps OkHttp from asking for gzip and decoding the body; removed on the wire.
      builder.header(HttpHeaders.ACCEPT_ENCODING, IDENTITY_ENCODING);
    }
    Request request = builder.build();

    Response response = execute(request, targetUrl);
    try (response) {
      byte[] body = readBody(response, targetUrl);
      return new ForwardedResponse(response.code(), relayedHeaders(response.headers()), body);
    }
  }

  private Response execute(Request request, String targetUrl) {
    try {
      return upstreamClient.newCall(request).execute();
    } catch (IOException e) {
      log.error("Failed to send request to {}: {}", targetUrl, e.toString());
      throw new UpstreamUnavailableException("Upstream service unavailable", e);
    }
  }

  private byte[] readBody(Response response, String targetUrl) {
    ResponseBody body = response.body();
    if (body == null) {
      return new byte[0];
    }
    try {
      return body.bytes();
    } catch (IOException e) {
      log.error("Failed to read response body from {}: {}", targetUrl, e.toString());
      throw new UpstreamUnavailableException("Upstream response could not be read", e);
    }
  }

  private RequestBody requestBody(ForwardedRequest forwarded) {
    String method = forwarded.method().toUpperCase(Locale.ROOT);
    byte[] body = forwarded.body();
    if (BODILESS_METHODS.contains(method)) {
      if (body.length > 0) {
        log.warn("Dropping {} byte body on {} request to {}", body.length, method, forwarded.path());
      }
      return null;
    }
    if (body.length == 0 && !BODY_REQUIRED_METHODS.contains(method)) {
      return null;
    }
    // No media type: the Content-Type header is copied verbatim with the others.
    return RequestBody.create(body, (MediaType) null);
  }

  private Headers upstreamHeaders(HttpHeaders inbound) {
    Headers.Builder builder = new Headers.Builder();
    inbound.forEach((name, values) -> {
      if (!HOP_BY_HOP_REQUEST_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
        values.forEach(value -> builder.addUnsafeNonAscii(name, value));
      }
    });
    return builder.build();
  }

  private HttpHeaders relayedHeaders(Headers upstream) {
    HttpHeaders headers = new HttpHeaders();
    for (String name : upstream.names()) {
      if (!HOP_BY_HOP_RESPONSE_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
        headers.addAll(name, upstream.values(name));
      }
    }
    return headers;
  }
}
