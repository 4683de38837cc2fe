package com.example.mesh.service.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.mesh.MutableClock;
import com.example.mesh.domain.entity.SessionPrincipal;
import com.example.mesh.exception.SessionStoreException;
import com.example.mesh.service.session.InMemorySessionStore;
import com.example.mesh.service.session.SessionStore;
import com.example.mesh.service.token.SharedSecret;
import com.example.mesh.service.token.TokenCodec;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionValidatorTest {

  private static final SharedSecret SECRET = SharedSecret.of("test-secret-must-be-at-least-32-bytes!");
  private static final SharedSecret OTHER_SECRET = SharedSecret.of("other-secret-must-be-at-least-32-bytes");

  private MutableClock clock;
  private TokenCodec tokenCodec;
  private InMemorySessionStore sessionStore;
  private SessionValidator validator;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    tokenCodec = new TokenCodec(clock, Duration.ofHours(1));
    sessionStore = new InMemorySessionStore(clock);
    validator = new SessionValidator(tokenCodec, sessionStore, SECRET);
  }

  @Test
  void authenticate_validTokenWithLiveSession_returnsPrincipal() {
    String token = tokenCodec.issue("user-1", "a@b.com", SECRET);
    sessionStore.register(token, Duration.ofHours(48));

    assertThat(validator.authenticate(token))
        .contains(new SessionPrincipal("user-1", "a@b.com"));
  }

  @Test
  void authenticate_revokedSession_isRejectedThoughTokenVerifies() {
    String token = tokenCodec.issue("user-1", "a@b.com", SECRET);
    sessionStore.register(token, Duration.ofHours(48));
    sessionStore.revoke(token);

    assertThat(tokenCodec.verify(token, SECRET).isValid()).isTrue();
    assertThat(validator.authenticate(token)).isEmpty();
  }

  @Test
  void authenticate_expiredToken_isRejectedThoughSessionLive() {
    String token = tokenCodec.issue("user-1", "a@b.com", SECRET);
    sessionStore.register(token, Duration.ofHours(48));

    clock.advance(Duration.ofHours(2));

    assertThat(sessionStore.isLive(token)).isTrue();
    assertThat(validator.authenticate(token)).isEmpty();
  }

  @Test
  void authenticate_foreignSignature_isRejectedWithoutStoreLookup() {
    SessionStore store = mock(SessionStore.class);
    SessionValidator strict = new SessionValidator(tokenCodec, store, SECRET);
    String forged = tokenCodec.issue("user-1", "a@b.com", OTHER_SECRET);

    assertThat(strict.authenticate(forged)).isEmpty();
    verifyNoInteractions(store);
  }

  @Test
  void authenticate_storeUnavailable_propagates() {
    SessionStore store = mock(SessionStore.class);
    when(store.isLive(anyString())).thenThrow(new SessionStoreException("down"));
    SessionValidator failing = new SessionValidator(tokenCodec, store, SECRET);
    String token = tokenCodec.issue("user-1", "a@b.com", SECRET);

    assertThatThrownBy(() -> failing.authenticate(token))
        .isInstanceOf(SessionStoreException.class);
  }
}
