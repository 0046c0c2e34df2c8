package com.example.ratecontrol.config;

import com.example.ratecontrol.model.RateLimitConfigurationException;
import com.example.ratecontrol.store.RedisCounterStore;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.net.URI;
import java.util.List;

/**
 * Redis wiring for the distributed counter store. Only active when both the store URL and token
 * are supplied; otherwise the application runs on the local store alone.
 */
@Configuration
@Conditional(RedisConfig.DistributedStoreConfigured.class)
public class RedisConfig {

    private static final int DEFAULT_REDIS_PORT = 6379;

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RateLimiterProperties properties) {
        RateLimiterProperties.Distributed distributed = properties.getDistributed();
        URI uri = parseUrl(distributed.getUrl());

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(
                uri.getHost(), uri.getPort() == -1 ? DEFAULT_REDIS_PORT : uri.getPort());
        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isBlank() && !userInfo.startsWith(":")) {
            standalone.setUsername(userInfo.split(":", 2)[0]);
        }
        standalone.setPassword(RedisPassword.of(distributed.getToken()));

        // Both timeouts stay short so an unreachable store falls back instead of stalling requests.
        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .commandTimeout(distributed.getTimeout())
                .clientOptions(ClientOptions.builder()
                        .socketOptions(SocketOptions.builder().connectTimeout(distributed.getTimeout()).build())
                        .build());
        if ("rediss".equalsIgnoreCase(uri.getScheme())) {
            client.useSsl();
        }
        return new LettuceConnectionFactory(standalone, client.build());
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    /**
     * Lua script implementing the atomic fixed-window check-and-increment.
     * <p>
     * Loaded once at startup and cached by Spring/Data Redis.
     */
    @Bean
    public DefaultRedisScript<List> fixedWindowScript() {
        DefaultRedisScript<List> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource("lua/fixed_window.lua"));
        script.setResultType(List.class);
        return script;
    }

    @Bean
    public RedisCounterStore redisCounterStore(StringRedisTemplate stringRedisTemplate,
                                               DefaultRedisScript<List> fixedWindowScript) {
        return new RedisCounterStore(stringRedisTemplate, fixedWindowScript);
    }

    static URI parseUrl(String url) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException ex) {
            throw new RateLimitConfigurationException("Malformed rate-limiter.distributed.url", ex);
        }
        String scheme = uri.getScheme();
        if (!"redis".equalsIgnoreCase(scheme) && !"rediss".equalsIgnoreCase(scheme)) {
            throw new RateLimitConfigurationException(
                    "rate-limiter.distributed.url must use redis:// or rediss://, was " + scheme);
        }
        if (uri.getHost() == null) {
            throw new RateLimitConfigurationException("rate-limiter.distributed.url has no host");
        }
        return uri;
    }

    static class DistributedStoreConfigured implements Condition {

        @Override
        public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
            return Binder.get(context.getEnvironment())
                    .bind("rate-limiter.distributed", RateLimiterProperties.Distributed.class)
                    .map(RateLimiterProperties.Distributed::isConfigured)
                    .orElse(false);
        }
    }
}
