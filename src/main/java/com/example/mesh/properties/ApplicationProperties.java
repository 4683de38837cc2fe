package com.example.mesh.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Centralized configuration properties for every service role.
 * Uses records for immutability and type safety; role-specific rules are
 * enforced by {@link com.example.mesh.config.ConfigurationValidator}.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid @DefaultValue TokenProperties token,
    @NotNull @Valid @DefaultValue SessionProperties session,
    @NotNull @Valid @DefaultValue RedisProperties redis,
    @NotNull @Valid @DefaultValue GatewayProperties gateway,
    @NotNull @Valid @DefaultValue OkHttpProperties http
) {

  /**
   * Session token signing configuration. The secret is shared by every
   * service that issues or verifies tokens.
   */
  public record TokenProperties(
      String secret,
      @DefaultValue("1h") @DurationUnit(ChronoUnit.SECONDS) Duration ttl
  ) {}

  /**
   * Session store configuration
   */
  public record SessionProperties(
      @DefaultValue("redis") @Pattern(regexp = "redis|memory") String store,
      @DefaultValue("48h") @DurationUnit(ChronoUnit.SECONDS) Duration ttl,
      String keyPrefix
  ) {
    public SessionProperties {
      keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }
  }

  /**
   * Redis connection configuration
   */
  public record RedisProperties(
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @NotNull @Valid @DefaultValue SslProperties ssl,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid @DefaultValue PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("false") boolean enabled
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("2") @PositiveOrZero int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }

  /**
   * Gateway routing and upstream call configuration
   */
  public record GatewayProperties(
      List<@Valid RouteProperties> routes,
      @NotNull @Valid @DefaultValue UpstreamProperties upstream
  ) {
    public GatewayProperties {
      routes = routes == null ? List.of() : List.copyOf(routes);
    }

    /**
     * One public prefix mapped onto an internal service.
     */
    public record RouteProperties(
        @NotBlank String publicPrefix,
        @NotBlank String baseUrl,
        @DefaultValue("/api") String internalPrefix
    ) {}

    public record UpstreamProperties(
        @DefaultValue("3s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
        @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration readTimeout,
        @DefaultValue("10s") @DurationUnit(ChronoUnit.SECONDS) Duration writeTimeout,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration callTimeout
    ) {}
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @NotNull @Valid @DefaultValue ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost
    ) {}
  }
}
