package com.example.mesh.service.token;

import com.example.mesh.exception.TokenIssuanceException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates and verifies HS256-signed session tokens.
 * <p>
 * Verification is purely local: signature and embedded expiry are checked without
 * contacting the session store. Whether the session is still live is a separate
 * question answered by {@link com.example.mesh.service.session.SessionStore}.
 */
@Slf4j
public class TokenCodec {

  public static final String IDENTITY_CLAIM = "email";

  private final Clock clock;
  private final Duration ttl;

  /**
   * @param clock source of "now" for issued-at, expiry and expiry checks
   * @param ttl   lifetime embedded in every issued token
   */
  public TokenCodec(Clock clock, Duration ttl) {
    this.clock = clock;
    this.ttl = ttl;
  }

  /**
   * Issues a signed token for a successfully authenticated user.
   *
   * @param subjectId user id placed in {@code sub}
   * @param identity  display identity placed in {@code email}
   * @param secret    shared signing secret
   * @return compact JWS serialization
   * @throws TokenIssuanceException if signing fails
   */
  public String issue(String subjectId, String identity, SharedSecret secret) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    JWTClaimsSet claims = new JWTClaimsSet.Builder()
        .subject(subjectId)
        .claim(IDENTITY_CLAIM, identity)
        .issueTime(Date.from(now))
        .expirationTime(Date.from(now.plus(ttl)))
        .build();

    SignedJWT jwt = new SignedJWT(
        new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build(),
        claims);
    try {
      jwt.sign(new MACSigner(secret.key()));
    } catch (JOSEException e) {
      throw new TokenIssuanceException("Failed to sign session token", e);
    }
    log.debug("Issued session token for subject {} expiring at {}", subjectId, now.plus(ttl));
    return jwt.serialize();
  }

  /**
   * Parses a token, checks its signature, then its embedded expiry. Never throws.
   *
   * @param token  compact JWS serialization as presented by the client
   * @param secret shared signing secret
   * @return the verification outcome
   */
  public TokenVerification verify(String token, SharedSecret secret) {
    if (token == null || token.isBlank()) {
      return TokenVerification.malformed("Empty token");
    }

    SignedJWT jwt;
    try {
      jwt = SignedJWT.parse(token);
    } catch (ParseException e) {
      return TokenVerification.malformed(e.getMessage());
    }

    JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
    if (!JWSAlgorithm.HS256.equals(algorithm)) {
      return TokenVerification.badSignature("Unexpected algorithm " + algorithm);
    }
    try {
      if (!jwt.verify(new MACVerifier(secret.key()))) {
        return TokenVerification.badSignature("Signature mismatch");
      }
    } catch (JOSEException e) {
      return TokenVerification.badSignature(e.getMessage());
    }

    String subject;
    String identity;
    Date expiration;
    Date issuedAt;
    try {
      JWTClaimsSet claims = jwt.getJWTClaimsSet();
      subject = claims.getSubject();
      identity = claims.getStringClaim(IDENTITY_CLAIM);
      expiration = claims.getExpirationTime();
      issuedAt = claims.getIssueTime();
    } catch (ParseException e) {
      return TokenVerification.malformed(e.getMessage());
    }
    if (subject == null || identity == null || expiration == null) {
      return TokenVerification.malformed("Missing required claim");
    }

    Instant expiresAt = expiration.toInstant();
    if (!expiresAt.isAfter(clock.instant())) {
      return TokenVerification.expired("Expired at " + expiresAt);
    }
    return TokenVerification.valid(new TokenClaims(
        subject,
        identity,
        issuedAt != null ? issuedAt.toInstant() : null,
        expiresAt));
  }
}
