package com.example.mesh.service.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mesh.exception.SessionStoreException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisSessionStoreTest {

  @Mock
  private StringRedisTemplate redisTemplate;

  @Mock
  private ValueOperations<String, String> valueOperations;

  private RedisSessionStore store;

  @BeforeEach
  void setUp() {
    store = new RedisSessionStore(redisTemplate, "");
  }

  @Test
  void register_setsValidMarkerWithTtlUnderTokenKey() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);

    store.register("token-a", Duration.ofHours(48));

    verify(valueOperations).set("token-a", "valid", Duration.ofHours(48));
  }

  @Test
  void keyPrefix_isPrepended() {
    RedisSessionStore prefixed = new RedisSessionStore(redisTemplate, "session:");
    when(redisTemplate.hasKey("session:token-a")).thenReturn(true);

    assertThat(prefixed.isLive("token-a")).isTrue();
  }

  @Test
  void isLive_reflectsKeyExistence() {
    when(redisTemplate.hasKey("token-a")).thenReturn(true);
    when(redisTemplate.hasKey("token-b")).thenReturn(false);

    assertThat(store.isLive("token-a")).isTrue();
    assertThat(store.isLive("token-b")).isFalse();
  }

  @Test
  void isLive_nullReply_isNotLive() {
    when(redisTemplate.hasKey("token-a")).thenReturn(null);

    assertThat(store.isLive("token-a")).isFalse();
  }

  @Test
  void revoke_deletesKey() {
    store.revoke("token-a");

    verify(redisTemplate).delete("token-a");
  }

  @Test
  void isLive_connectionFailure_raisesStoreError() {
    when(redisTemplate.hasKey(anyString()))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    assertThatThrownBy(() -> store.isLive("token-a"))
        .isInstanceOf(SessionStoreException.class)
        .hasCauseInstanceOf(RedisConnectionFailureException.class);
  }

  @Test
  void register_connectionFailure_raisesStoreError() {
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    doThrow(new RedisConnectionFailureException("connection refused"))
        .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

    assertThatThrownBy(() -> store.register("token-a", Duration.ofHours(48)))
        .isInstanceOf(SessionStoreException.class);
  }
}
