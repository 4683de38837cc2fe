package com.example.mesh.config;

import com.example.mesh.properties.ApplicationProperties;
import com.example.mesh.service.token.SharedSecret;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Configuration validator that enforces the rules of the active service role
 * beyond basic JSR-303 validation. Fails startup listing every error found.
 */
@Slf4j
@Component("configurationValidator")
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MUST_BE_POSITIVE = "%s must be greater than zero.";
  private static final String ERROR_INVALID_URL = "%s is not an absolute http(s) URL: %s";
  private static final String PATH_PREFIX_SLASH = "/";
  private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

  private final ApplicationProperties properties;
  private final Environment environment;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    if (environment.acceptsProfiles(Profiles.of(ServiceRole.GATEWAY))) {
      validateGatewayConfig(errors);
      validateHttpConfig(errors);
    } else {
      validateTokenConfig(errors);
      validateSessionConfig(errors);
    }

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateTokenConfig(List<String> errors) {
    String secret = properties.token().secret();
    if (secret == null || secret.isBlank()) {
      errors.add("Token secret 'app.token.secret' (JWT_SECRET) is not configured.");
    } else if (secret.getBytes(StandardCharsets.UTF_8).length < SharedSecret.MIN_LENGTH_BYTES) {
      errors.add("Token secret must be at least %d bytes.".formatted(SharedSecret.MIN_LENGTH_BYTES));
    }
    requirePositive(properties.token().ttl(), "Token ttl", errors);
  }

  private void validateSessionConfig(List<String> errors) {
    requirePositive(properties.session().ttl(), "Session ttl", errors);
  }

  private void validateGatewayConfig(List<String> errors) {
    List<ApplicationProperties.GatewayProperties.RouteProperties> routes = properties.gateway().routes();
    if (routes.isEmpty()) {
      errors.add("At least one route must be configured in 'app.gateway.routes'.");
    }

    Set<String> seenPrefixes = new HashSet<>();
    for (ApplicationProperties.GatewayProperties.RouteProperties route : routes) {
      String prefix = route.publicPrefix();
      if (!prefix.startsWith(PATH_PREFIX_SLASH) || prefix.endsWith(PATH_PREFIX_SLASH)) {
        errors.add("Public prefix must start with '/' and must not end with '/': " + prefix);
      }
      if (!seenPrefixes.add(prefix)) {
        errors.add("Public prefix is configured more than once: " + prefix);
      }
      String internalPrefix = route.internalPrefix();
      if (internalPrefix != null && !internalPrefix.isEmpty() && !internalPrefix.startsWith(PATH_PREFIX_SLASH)) {
        errors.add("Internal prefix must start with '/': " + internalPrefix);
      }
      validateBaseUrl(route.baseUrl(), "Base URL for " + prefix, errors);
    }

    ApplicationProperties.GatewayProperties.UpstreamProperties upstream = properties.gateway().upstream();
    requirePositive(upstream.connectTimeout(), "Upstream connect timeout", errors);
    requirePositive(upstream.readTimeout(), "Upstream read timeout", errors);
    requirePositive(upstream.writeTimeout(), "Upstream write timeout", errors);
    requirePositive(upstream.callTimeout(), "Upstream call timeout", errors);
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void validateBaseUrl(String url, String fieldName, List<String> errors) {
    try {
      URI uri = new URI(url);
      if (uri.getScheme() == null || !ALLOWED_SCHEMES.contains(uri.getScheme().toLowerCase())
          || uri.getHost() == null) {
        errors.add(ERROR_INVALID_URL.formatted(fieldName, url));
      }
    } catch (URISyntaxException e) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, url));
    }
  }

  private void requirePositive(Duration duration, String fieldName, List<String> errors) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted(fieldName));
    }
  }
}
