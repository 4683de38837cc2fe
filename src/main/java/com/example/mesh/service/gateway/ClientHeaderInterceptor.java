package com.example.mesh.service.gateway;

import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.http.HttpHeaders;

/**
 * Network interceptor that removes the headers OkHttp adds on its own before a forwarded
 * request goes on the wire.
 * <p>
 * OkHttp fills in {@code Accept-Encoding: gzip} and a {@code User-Agent} when a request
 * has none, and decodes any gzip response it asked for itself. {@link ProxyService} sends
 * a placeholder {@code Accept-Encoding} so responses are never decoded; here that
 * placeholder and any added {@code User-Agent} are dropped unless the client sent them.
 * Requests without a {@link ClientHeaderNames} tag pass through untouched.
 */
@Slf4j
public class ClientHeaderInterceptor implements Interceptor {

  static final List<String> OKHTTP_DEFAULT_HEADERS = List.of(
      HttpHeaders.ACCEPT_ENCODING, HttpHeaders.USER_AGENT);

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    ClientHeaderNames sent = request.tag(ClientHeaderNames.class);
    if (sent == null) {
      return chain.proceed(request);
    }

    Request.Builder builder = request.newBuilder();
    boolean changed = false;
    for (String name : OKHTTP_DEFAULT_HEADERS) {
      if (!sent.contains(name) && request.header(name) != null) {
        builder.removeHeader(name);
        changed = true;
      }
    }
    if (changed) {
      log.trace("Removed OkHttp default headers before sending to {}", request.url());
    }
    return chain.proceed(changed ? builder.build() : request);
  }
}
