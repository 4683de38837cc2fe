package com.example.mesh.service.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SharedSecretTest {

  @Test
  void of_shortSecret_isRejected() {
    assertThatThrownBy(() -> SharedSecret.of("too-short"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("32 bytes");
  }

  @Test
  void of_missingSecret_isRejected() {
    assertThatThrownBy(() -> SharedSecret.of((String) null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toString_doesNotRevealKey() {
    SharedSecret secret = SharedSecret.of("test-secret-must-be-at-least-32-bytes!");

    assertThat(secret.toString()).doesNotContain("test-secret");
  }

  @Test
  void key_returnsDefensiveCopy() {
    SharedSecret secret = SharedSecret.of("test-secret-must-be-at-least-32-bytes!");
    byte[] first = secret.key();
    first[0] = 0;

    assertThat(secret.key()[0]).isEqualTo((byte) 't');
  }
}
