package com.example.mesh;

import com.example.mesh.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Session Mesh Application
 *
 * One artifact deployed once per service role, selected by Spring profile:
 * - identity: user registration, login and logout
 * - data: session-protected data resource
 * - status: login status check
 * - gateway: public entry point forwarding to the services above
 *
 * - all: every backend role in a single process, active when no profile is set
 *
 * Combining another profile with the backends needs "all" listed explicitly
 * (e.g. local,all). Authentication is
 * by session token only, so no default user is configured. The Redis connection is
 * built by {@link com.example.mesh.config.RedisConfig} only when the Redis session
 * store is selected.
 */
@SpringBootApplication(exclude = {
    UserDetailsServiceAutoConfiguration.class,
    RedisAutoConfiguration.class,
    RedisRepositoriesAutoConfiguration.class
})
@EnableConfigurationProperties(ApplicationProperties.class)
@EnableScheduling
public class MeshApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(MeshApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
