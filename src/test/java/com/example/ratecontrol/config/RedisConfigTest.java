package com.example.ratecontrol.config;

import com.example.ratecontrol.model.RateLimitConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RedisConfig")
class RedisConfigTest {

    @Test
    @DisplayName("accepts redis and rediss URLs")
    void acceptsRedisSchemes() {
        URI plain = RedisConfig.parseUrl("redis://cache.internal:6380");
        URI tls = RedisConfig.parseUrl(" rediss://default@eu1-kv.example.net ");

        assertThat(plain.getHost()).isEqualTo("cache.internal");
        assertThat(plain.getPort()).isEqualTo(6380);
        assertThat(tls.getScheme()).isEqualTo("rediss");
        assertThat(tls.getUserInfo()).isEqualTo("default");
        assertThat(tls.getPort()).isEqualTo(-1);
    }

    @Test
    @DisplayName("rejects other schemes")
    void rejectsHttp() {
        assertThatThrownBy(() -> RedisConfig.parseUrl("https://kv.example.net"))
                .isInstanceOf(RateLimitConfigurationException.class)
                .hasMessageContaining("redis://");
    }

    @Test
    @DisplayName("rejects URLs without a host")
    void rejectsMissingHost() {
        assertThatThrownBy(() -> RedisConfig.parseUrl("redis:///0"))
                .isInstanceOf(RateLimitConfigurationException.class)
                .hasMessageContaining("no host");
    }

    @Test
    @DisplayName("rejects malformed URLs")
    void rejectsMalformed() {
        assertThatThrownBy(() -> RedisConfig.parseUrl("redis://bad host:6379"))
                .isInstanceOf(RateLimitConfigurationException.class)
                .hasMessageContaining("Malformed");
    }
}
