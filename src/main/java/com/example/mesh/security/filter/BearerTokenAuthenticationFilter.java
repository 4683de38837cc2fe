package com.example.mesh.security.filter;

import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.exception.SessionStoreException;
import com.example.mesh.service.resource.BearerTokens;
import com.example.mesh.service.resource.SessionValidator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates resource requests from the {@code Authorization: Bearer} header.
 * It delegates all session validation logic to the {@link SessionValidator}.
 * <p>
 * Requests without a live session continue unauthenticated; the security chain decides
 * whether the endpoint needs one. A session store failure is recorded on the request
 * under {@link #SESSION_STORE_FAILURE_ATTRIBUTE} so the entry point can answer with a
 * server error instead of 401.
 * <p>
 * Not a Spring component: it is added to the resource filter chain only.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  public static final String SESSION_STORE_FAILURE_ATTRIBUTE =
      BearerTokenAuthenticationFilter.class.getName() + ".SESSION_STORE_FAILURE";

  private final SessionValidator sessionValidator;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    Optional<String> token = BearerTokens.extract(request.getHeader(HttpHeaders.AUTHORIZATION));

    if (token.isPresent()) {
      try {
        Optional<SessionPrincipal> principal = sessionValidator.authenticate(token.get());
        if (principal.isPresent()) {
          UsernamePasswordAuthenticationToken authentication =
              new UsernamePasswordAuthenticationToken(principal.get(), null, Collections.emptyList());
          SecurityContextHolder.getContext().setAuthentication(authentication);
          log.trace("Authenticated subject {}", principal.get().subjectId());
        }
      } catch (SessionStoreException e) {
        log.error("Session store unavailable while authenticating {} {}",
            request.getMethod(), request.getRequestURI(), e);
        request.setAttribute(SESSION_STORE_FAILURE_ATTRIBUTE, e);
      }
    } else {
      log.debug("No bearer token on {} {}", request.getMethod(), request.getRequestURI());
    }

    filterChain.doFilter(request, response);
  }
}
