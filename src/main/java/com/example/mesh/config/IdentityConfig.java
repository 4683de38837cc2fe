package com.example.mesh.config;

import com.example.mesh.service.identity.InMemoryUserDirectory;
import com.example.mesh.service.identity.UserDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Credential hashing and user storage for the identity role.
 */
@Configuration(proxyBeanMethods = false)
@Profile({ServiceRole.IDENTITY, ServiceRole.ALL_BACKENDS})
public class IdentityConfig {

  /**
   * Argon2id with Spring Security's recommended parameters; needs Bouncy Castle at runtime.
   */
  @Bean
  public PasswordEncoder passwordEncoder() {
    return Argon2PasswordEncoder.defaultsForSpringSecurity_v5_8();
  }

  @Bean
  public UserDirectory userDirectory() {
    return new InMemoryUserDirectory();
  }
}
