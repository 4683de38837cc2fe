package com.example.mesh.config;

import com.example.mesh.properties.ApplicationProperties;
import com.example.mesh.service.gateway.ClientHeaderInterceptor;
import com.example.mesh.service.gateway.Route;
import com.example.mesh.service.gateway.RouteTable;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Gateway upstream wiring: the route table and the OkHttp client used to reach
 * internal services, with a shared connection pool and dispatcher.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@Profile(ServiceRole.GATEWAY)
@RequiredArgsConstructor
public class HttpClientConfig {

  private final ApplicationProperties properties;

  @Bean
  public RouteTable routeTable() {
    RouteTable table = new RouteTable(properties.gateway().routes().stream()
        .map(route -> new Route(route.publicPrefix(), route.baseUrl(), route.internalPrefix()))
        .toList());
    table.routes().forEach(route -> log.info("Route {}/** -> {}{}/**",
        route.publicPrefix(), route.baseUrl(), route.internalPrefix()));
    return table;
  }

  /**
   * Shared connection pool to reduce connection establishment overhead
   */
  @Bean
  public ConnectionPool sharedConnectionPool() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    return new ConnectionPool(client.maxIdleConnections(), client.keepAliveDurationMinutes(), TimeUnit.MINUTES);
  }

  /**
   * Shared dispatcher for concurrent request management
   */
  @Bean
  public Dispatcher sharedDispatcher() {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(client.maxRequests());
    dispatcher.setMaxRequestsPerHost(client.maxRequestsPerHost());
    return dispatcher;
  }

  /**
   * Upstream client: a single attempt per request, redirects relayed rather than followed,
   * every timeout taken from configuration. OkHttp's own default headers never reach the
   * upstream.
   */
  @Bean(name = "upstreamOkHttpClient")
  public OkHttpClient upstreamOkHttpClient(ConnectionPool connectionPool, Dispatcher dispatcher) {
    ApplicationProperties.GatewayProperties.UpstreamProperties upstream = properties.gateway().upstream();
    return new OkHttpClient.Builder()
        .connectionPool(connectionPool)
        .dispatcher(dispatcher)
        .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
        .connectTimeout(upstream.connectTimeout())
        .readTimeout(upstream.readTimeout())
        .writeTimeout(upstream.writeTimeout())
        .callTimeout(upstream.callTimeout())
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false)
        .addNetworkInterceptor(new ClientHeaderInterceptor())
        .build();
  }
}
