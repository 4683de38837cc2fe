package com.example.mesh.service.resource;

import static com.example.mesh.service.session.TokenMasking.mask;

import com.example.mesh.config.ServiceRole;
import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.service.session.SessionStore;
import com.example.mesh.service.token.SharedSecret;
import com.example.mesh.service.token.TokenClaims;
import com.example.mesh.service.token.TokenCodec;
import com.example.mesh.service.token.TokenVerification;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Decides whether a presented token belongs to a live session.
 * <p>
 * Both checks always run: the signature and embedded expiry locally, then the
 * session record in the shared store. Store failures propagate as
 * {@link com.example.mesh.exception.SessionStoreException} so callers fail closed.
 */
@Slf4j
@Service
@Profile(ServiceRole.BACKEND)
@RequiredArgsConstructor
public class SessionValidator {

  private final TokenCodec tokenCodec;
  private final SessionStore sessionStore;
  private final SharedSecret sharedSecret;

  /**
   * @param token bearer token as presented
   * @return the principal when the token verifies and its session is live, empty otherwise
   */
  public Optional<SessionPrincipal> authenticate(String token) {
    TokenVerification verification = tokenCodec.verify(token, sharedSecret);
    if (!verification.isValid()) {
      log.warn("Rejected token {}: {} ({})", mask(token), verification.status(), verification.detail());
      return Optional.empty();
    }

    if (!sessionStore.isLive(token)) {
      log.warn("Rejected token {}: session expired or revoked", mask(token));
      return Optional.empty();
    }

    TokenClaims claims = verification.claims();
    return Optional.of(new SessionPrincipal(claims.subjectId(), claims.identity()));
  }
}
