package com.example.mesh.config;

import com.example.mesh.security.filter.BearerTokenAuthenticationFilter;
import com.example.mesh.service.resource.SessionValidator;
import com.example.mesh.web.rest.ApiConstants.ApiPath;
import com.example.mesh.web.rest.errors.DelegatedAuthenticationEntryPoint;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Stateless security configuration, one set of chains per service role.
 * <p>
 * RESOURCE CHAIN (@Order(1), backend roles): bearer-token authenticated resources,
 * including the identity service's current-user endpoint.
 * {@link BearerTokenAuthenticationFilter} validates the signed token and the shared session
 * record. GATEWAY CHAIN (@Order(1), gateway role): everything is relayed untouched, the
 * backends decide on authentication. DEFAULT CHAIN (@Order(3), backend roles): public
 * endpoints such as register, login, logout and health.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
public class SecurityConfig {

  @Bean
  @Order(1)
  @Profile(ServiceRole.BACKEND)
  public SecurityFilterChain resourceFilterChain(
      HttpSecurity http,
      SessionValidator sessionValidator,
      DelegatedAuthenticationEntryPoint entryPoint) throws Exception {
    http
        .securityMatcher(ApiPath.API_BASE + ApiPath.DATA,
                         ApiPath.API_BASE + ApiPath.IS_LOGGED_IN,
                         ApiPath.API_BASE + ApiPath.ME)
        .addFilterBefore(new BearerTokenAuthenticationFilter(sessionValidator),
                         UsernamePasswordAuthenticationFilter.class)
        // The login status check answers for anonymous callers too
        .authorizeHttpRequests(authorize -> authorize
            .requestMatchers(ApiPath.API_BASE + ApiPath.IS_LOGGED_IN).permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(entryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(1)
  @Profile(ServiceRole.GATEWAY)
  public SecurityFilterChain gatewayFilterChain(HttpSecurity http) throws Exception {
    http
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll())
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        // Relayed responses carry the backend's headers only
        .headers(AbstractHttpConfigurer::disable)
        .requestCache(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable);
    return http.build();
  }

  @Bean
  @Order(3)
  @Profile(ServiceRole.BACKEND)
  public SecurityFilterChain defaultFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());
    applyCommonSettings(http);
    return http.build();
  }

  /**
   * Common security settings applied to the backend chains
   */
  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Bearer tokens are sent explicitly, never by the browser
        .csrf(AbstractHttpConfigurer::disable)

        // Sessions live in the shared session store, not in the servlet container
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )
        .httpBasic(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .logout(AbstractHttpConfigurer::disable)

        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.NO_REFERRER)
                                    )
                     // Tokens and user data must not be cached
                     .cacheControl(cache -> {
                     })
                );
  }
}
