package com.example.mesh.config;

import com.example.mesh.properties.ApplicationProperties;
import com.example.mesh.service.session.InMemorySessionStore;
import com.example.mesh.service.session.RedisSessionStore;
import com.example.mesh.service.session.SessionStore;
import com.example.mesh.service.token.SharedSecret;
import com.example.mesh.service.token.TokenCodec;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Token signing and session store beans shared by every backend role.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@Profile(ServiceRole.BACKEND)
@RequiredArgsConstructor
public class SessionConfig {

  private final ApplicationProperties properties;

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // Startup rules report every configuration error before the secret is built.
  @Bean
  @DependsOn("configurationValidator")
  public SharedSecret sharedSecret() {
    return SharedSecret.of(properties.token().secret());
  }

  @Bean
  public TokenCodec tokenCodec(Clock clock) {
    return new TokenCodec(clock, properties.token().ttl());
  }

  @Bean
  @ConditionalOnProperty(prefix = "app.session", name = "store", havingValue = "redis", matchIfMissing = true)
  public SessionStore redisSessionStore(StringRedisTemplate stringRedisTemplate) {
    return new RedisSessionStore(stringRedisTemplate, properties.session().keyPrefix());
  }

  @Bean
  @ConditionalOnProperty(prefix = "app.session", name = "store", havingValue = "memory")
  public SessionStore inMemorySessionStore(Clock clock) {
    log.warn("Session store: in-memory. Sessions are not shared between processes");
    return new InMemorySessionStore(clock);
  }
}
