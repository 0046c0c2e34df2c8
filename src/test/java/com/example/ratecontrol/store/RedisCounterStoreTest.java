package com.example.ratecontrol.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisCounterStore")
class RedisCounterStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private RedisScript<List> script;

    private RedisCounterStore store;

    @BeforeEach
    void setUp() {
        store = new RedisCounterStore(redisTemplate, script);
    }

    @Test
    @DisplayName("reads missing keys as absent and parses stored counts")
    void get() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get("missing")).willReturn(null);
        given(valueOperations.get("present")).willReturn("7");

        assertThat(store.get("missing")).isEmpty();
        assertThat(store.get("present")).hasValue(7);
    }

    @Test
    @DisplayName("increments and sets expiry through the template")
    void incrementAndExpire() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.increment("k")).willReturn(4L);

        assertThat(store.increment("k")).isEqualTo(4);
        store.expire("k", Duration.ofSeconds(60));

        verify(redisTemplate).expire("k", Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("passes limit and TTL to the script and maps its reply")
    void scriptReply() {
        given(redisTemplate.execute(eq(script), eq(List.of("k")), any(), any()))
                .willReturn(List.of(1L, 3L))
                .willReturn(List.of(0L, 5L));

        CounterUpdate accepted = store.incrementIfBelow("k", 5, Duration.ofSeconds(60));
        CounterUpdate rejected = store.incrementIfBelow("k", 5, Duration.ofSeconds(60));

        assertThat(accepted.isIncremented()).isTrue();
        assertThat(accepted.getCount()).isEqualTo(3);
        assertThat(rejected.isIncremented()).isFalse();
        assertThat(rejected.getCount()).isEqualTo(5);
        verify(redisTemplate, times(2)).execute(script, List.of("k"), "5", "60000");
    }

    @Test
    @DisplayName("translates connection failures and timeouts into CounterStoreException")
    void translatesFailures() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get("k")).willThrow(new RedisConnectionFailureException("refused"));
        given(redisTemplate.execute(eq(script), anyList(), any(), any()))
                .willThrow(new QueryTimeoutException("timed out"));

        assertThatThrownBy(() -> store.get("k"))
                .isInstanceOf(CounterStoreException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
        assertThatThrownBy(() -> store.incrementIfBelow("k", 1, Duration.ofSeconds(1)))
                .isInstanceOf(CounterStoreException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }

    @Test
    @DisplayName("treats malformed replies as store failures")
    void malformedReplies() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get("k")).willReturn("not-a-number");
        given(redisTemplate.execute(eq(script), anyList(), any(), any())).willReturn(List.of(1L));

        assertThatThrownBy(() -> store.get("k")).isInstanceOf(CounterStoreException.class);
        assertThatThrownBy(() -> store.incrementIfBelow("k", 1, Duration.ofSeconds(1)))
                .isInstanceOf(CounterStoreException.class);
    }
}
