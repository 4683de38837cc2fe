package com.example.mesh.web.rest.controller;

import com.example.mesh.config.ServiceRole;
import com.example.mesh.exception.MalformedClientRequestException;
import com.example.mesh.exception.ResponseConstructionException;
import com.example.mesh.service.gateway.ForwardedRequest;
import com.example.mesh.service.gateway.ForwardedResponse;
import com.example.mesh.service.gateway.ProxyService;
import com.example.mesh.service.gateway.Route;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway entry point. Works on the raw servlet request and response so bodies and
 * headers pass through byte for byte, without message conversion.
 * <p>
 * The route is resolved before the body is read: an unknown prefix is answered
 * with 404 without consuming the body or contacting any backend.
 */
@Slf4j
@RestController
@Profile(ServiceRole.GATEWAY)
@RequiredArgsConstructor
public class GatewayController implements GatewayAPI {

  private final ProxyService proxyService;

  @Override
  public void forward(HttpServletRequest request, HttpServletResponse response) {
    String path = request.getRequestURI();
    Route route = proxyService.resolve(path);

    ForwardedRequest forwarded = new ForwardedRequest(
        request.getMethod(),
        path,
        request.getQueryString(),
        inboundHeaders(request),
        readBody(request));

    ForwardedResponse upstream = proxyService.forward(route, forwarded);
    relay(upstream, response);
    log.info("{} {} -> {} {}", forwarded.method(), path, route.baseUrl(), upstream.status());
  }

  private byte[] readBody(HttpServletRequest request) {
    try {
      return request.getInputStream().readAllBytes();
    } catch (IOException e) {
      log.warn("Failed to read request body for {} {}: {}",
          request.getMethod(), request.getRequestURI(), e.toString());
      throw new MalformedClientRequestException("Request body could not be read", e);
    }
  }

  private HttpHeaders inboundHeaders(HttpServletRequest request) {
    HttpHeaders headers = new HttpHeaders();
    for (String name : Collections.list(request.getHeaderNames())) {
      headers.addAll(name, Collections.list(request.getHeaders(name)));
    }
    return headers;
  }

  private void relay(ForwardedResponse upstream, HttpServletResponse response) {
    try {
      response.setStatus(upstream.status());
      upstream.headers().forEach((name, values) ->
          values.forEach(value -> response.addHeader(name, value)));
      ServletOutputStream out = response.getOutputStream();
      out.write(upstream.body());
      out.flush();
    } catch (IOException | IllegalStateException e) {
      if (!response.isCommitted()) {
        response.reset();
      }
      throw new ResponseConstructionException("Failed to relay upstream response", e);
    }
  }
}
