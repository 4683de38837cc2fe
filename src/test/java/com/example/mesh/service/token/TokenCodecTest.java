package com.example.mesh.service.token;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.mesh.MutableClock;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenCodecTest {

  private static final SharedSecret SECRET = SharedSecret.of("test-secret-must-be-at-least-32-bytes!");
  private static final SharedSecret WRONG_SECRET = SharedSecret.of("wrong-secret-must-be-at-least-32-bytes");
  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  private MutableClock clock;
  private TokenCodec codec;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    codec = new TokenCodec(clock, Duration.ofHours(1));
  }

  @Test
  void issueAndVerify_carriesClaims() {
    String token = codec.issue("user-1", "a@b.com", SECRET);

    TokenVerification verification = codec.verify(token, SECRET);

    assertThat(verification.isValid()).isTrue();
    assertThat(verification.claims().subjectId()).isEqualTo("user-1");
    assertThat(verification.claims().identity()).isEqualTo("a@b.com");
    assertThat(verification.claims().issuedAt()).isEqualTo(START);
    assertThat(verification.claims().expiresAt()).isEqualTo(START.plus(Duration.ofHours(1)));
  }

  @Test
  void issue_usesHs256WithStandardClaims() throws Exception {
    SignedJWT jwt = SignedJWT.parse(codec.issue("user-1", "a@b.com", SECRET));

    assertThat(jwt.getHeader().getAlgorithm()).isEqualTo(JWSAlgorithm.HS256);
    assertThat(jwt.getJWTClaimsSet().getSubject()).isEqualTo("user-1");
    assertThat(jwt.getJWTClaimsSet().getStringClaim("email")).isEqualTo("a@b.com");
  }

  @Test
  void verify_justBeforeExpiry_isValid() {
    String token = codec.issue("user-1", "a@b.com", SECRET);
    clock.advance(Duration.ofMinutes(59));

    assertThat(codec.verify(token, SECRET).isValid()).isTrue();
  }

  @Test
  void verify_atExpiry_isExpired() {
    String token = codec.issue("user-1", "a@b.com", SECRET);
    clock.advance(Duration.ofHours(1));

    TokenVerification verification = codec.verify(token, SECRET);

    assertThat(verification.status()).isEqualTo(TokenVerification.Status.EXPIRED);
    assertThat(verification.claims()).isNull();
  }

  @Test
  void verify_wrongSecret_isBadSignature() {
    String token = codec.issue("user-1", "a@b.com", SECRET);

    assertThat(codec.verify(token, WRONG_SECRET).status())
        .isEqualTo(TokenVerification.Status.BAD_SIGNATURE);
  }

  @Test
  void verify_tamperedSignature_isBadSignature() {
    String token = codec.issue("user-1", "a@b.com", SECRET);
    String signature = token.substring(token.lastIndexOf('.') + 1);
    char flipped = signature.charAt(0) == 'A' ? 'B' : 'A';
    String tampered = token.substring(0, token.lastIndexOf('.') + 1) + flipped + signature.substring(1);

    assertThat(codec.verify(tampered, SECRET).status())
        .isEqualTo(TokenVerification.Status.BAD_SIGNATURE);
  }

  @Test
  void verify_tamperedPayload_isBadSignature() {
    String token = codec.issue("user-1", "a@b.com", SECRET);
    String[] parts = token.split("\\.");
    String forgedPayload = Base64.getUrlEncoder().withoutPadding().encodeToString(
        "{\"sub\":\"admin\",\"email\":\"admin@b.com\",\"exp\":9999999999}".getBytes(StandardCharsets.UTF_8));
    String tampered = parts[0] + "." + forgedPayload + "." + parts[2];

    assertThat(codec.verify(tampered, SECRET).status())
        .isEqualTo(TokenVerification.Status.BAD_SIGNATURE);
  }

  @Test
  void verify_otherAlgorithm_isRejected() throws Exception {
    byte[] longKey = "another-secret-long-enough-for-hs512-signatures-0123456789abcdef"
        .getBytes(StandardCharsets.UTF_8);
    SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS512), new JWTClaimsSet.Builder()
        .subject("user-1")
        .claim("email", "a@b.com")
        .expirationTime(Date.from(START.plusSeconds(3600)))
        .build());
    jwt.sign(new MACSigner(longKey));

    assertThat(codec.verify(jwt.serialize(), SECRET).status())
        .isEqualTo(TokenVerification.Status.BAD_SIGNATURE);
  }

  @Test
  void verify_missingEmailClaim_isMalformed() throws Exception {
    SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), new JWTClaimsSet.Builder()
        .subject("user-1")
        .expirationTime(Date.from(START.plusSeconds(3600)))
        .build());
    jwt.sign(new MACSigner(SECRET.key()));

    assertThat(codec.verify(jwt.serialize(), SECRET).status())
        .isEqualTo(TokenVerification.Status.MALFORMED);
  }

  @Test
  void verify_garbage_isMalformed() {
    assertThat(codec.verify("not-a-token", SECRET).status()).isEqualTo(TokenVerification.Status.MALFORMED);
    assertThat(codec.verify("", SECRET).status()).isEqualTo(TokenVerification.Status.MALFORMED);
    assertThat(codec.verify(null, SECRET).status()).isEqualTo(TokenVerification.Status.MALFORMED);
  }

  @Test
  void verify_unsignedToken_isRejected() {
    String header = Base64.getUrlEncoder().withoutPadding()
        .encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));
    String payload = Base64.getUrlEncoder().withoutPadding().encodeToString(
        "{\"sub\":\"user-1\",\"email\":\"a@b.com\",\"exp\":9999999999}".getBytes(StandardCharsets.UTF_8));

    assertThat(codec.verify(header + "." + payload + ".", SECRET).isValid()).isFalse();
  }
}
