package com.example.mesh.service.identity;

import static com.example.mesh.service.session.TokenMasking.mask;

import com.example.mesh.config.ServiceRole;
import com.example.mesh.domain.entity.User;
import com.example.mesh.exception.DuplicateRegistrationException;
import com.example.mesh.exception.InvalidCredentialsException;
import com.example.mesh.exception.UnauthenticatedException;
import com.example.mesh.exception.UserNotFoundException;
import com.example.mesh.properties.ApplicationProperties;
import com.example.mesh.service.session.SessionStore;
import com.example.mesh.service.token.SharedSecret;
import com.example.mesh.service.token.TokenCodec;
import com.example.mesh.service.token.TokenVerification;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Owns the user directory and issues sessions.
 * <p>
 * A login only returns a token after its session record has been written, so every
 * resource service can see the session as soon as the client holds the token.
 */
@Slf4j
@Service
@Profile({ServiceRole.IDENTITY, ServiceRole.ALL_BACKENDS})
public class IdentityService {

  private final UserDirectory userDirectory;
  private final PasswordEncoder passwordEncoder;
  private final TokenCodec tokenCodec;
  private final SessionStore sessionStore;
  private final SharedSecret sharedSecret;
  private final Duration sessionTtl;
  private final String unknownUserDigest;

  public IdentityService(
      UserDirectory userDirectory,
      PasswordEncoder passwordEncoder,
      TokenCodec tokenCodec,
      SessionStore sessionStore,
      SharedSecret sharedSecret,
      ApplicationProperties properties) {
    this.userDirectory = userDirectory;
    this.passwordEncoder = passwordEncoder;
    this.tokenCodec = tokenCodec;
    this.sessionStore = sessionStore;
    this.sharedSecret = sharedSecret;
    this.sessionTtl = properties.session().ttl();
    // Verified against when the email is unknown so both login failures cost the same.
    this.unknownUserDigest = passwordEncoder.encode(UUID.randomUUID().toString());
  }

  /**
   * Creates a user. No session is issued.
   *
   * @throws DuplicateRegistrationException if the email is already registered
   */
  public User register(String email, String password) {
    if (userDirectory.findByEmail(email).isPresent()) {
      log.info("Registration rejected: {} already registered", email);
      throw new DuplicateRegistrationException("Email is already registered");
    }

    User user = new User(UUID.randomUUID().toString(), email, passwordEncoder.encode(password));
    if (!userDirectory.insertIfAbsent(user)) {
      log.info("Registration rejected: {} registered concurrently", email);
      throw new DuplicateRegistrationException("Email is already registered");
    }

    log.info("Registered user {}", user.id());
    return user;
  }

  /**
   * Verifies credentials, issues a token and registers its session record.
   *
   * @return the session token
   * @throws InvalidCredentialsException for an unknown email or a wrong password alike
   * @throws com.example.mesh.exception.SessionStoreException if the session record
   *         cannot be written; no token is returned in that case
   */
  public String login(String email, String password) {
    Optional<User> found = userDirectory.findByEmail(email);

    if (found.isEmpty()) {
      passwordEncoder.matches(password, unknownUserDigest);
      log.warn("Login failed: no user registered for {}", email);
      throw new InvalidCredentialsException();
    }

    User user = found.get();
    if (!passwordEncoder.matches(password, user.credentialDigest())) {
      log.warn("Login failed: bad password for user {}", user.id());
      throw new InvalidCredentialsException();
    }

    String token = tokenCodec.issue(user.id(), user.email(), sharedSecret);
    sessionStore.register(token, sessionTtl);

    log.info("User {} logged in, session {}", user.id(), mask(token));
    return token;
  }

  /**
   * Looks up the user behind an authenticated session.
   *
   * @param subjectId the token's subject
   * @throws UserNotFoundException if no user has that id
   */
  public User currentUser(String subjectId) {
    return userDirectory.findById(subjectId).orElseThrow(() -> {
      log.warn("Session subject {} has no user", subjectId);
      return new UserNotFoundException("User not found");
    });
  }

  /**
   * Revokes the session behind a token this service issued.
   *
   * @throws UnauthenticatedException if the token does not verify
   */
  public void logout(String token) {
    TokenVerification verification = tokenCodec.verify(token, sharedSecret);
    if (!verification.isValid()) {
      log.warn("Logout rejected for {}: {} ({})",
          mask(token), verification.status(), verification.detail());
      throw new UnauthenticatedException("Authentication required");
    }

    sessionStore.revoke(token);
    log.info("User {} logged out, session {} revoked",
        verification.claims().subjectId(), mask(token));
  }
}
