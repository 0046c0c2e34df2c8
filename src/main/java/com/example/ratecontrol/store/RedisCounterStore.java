package com.example.ratecontrol.store;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

/**
 * Counter store backed by the shared Redis instance.
 * <p>
 * {@link #incrementIfBelow} runs as one Lua script, so the compare and the increment happen atomically
 * inside Redis and concurrent callers can never push a bucket past its limit. Every Spring
 * {@link DataAccessException} (connection refused, command timeout, script error) is rethrown as
 * {@link CounterStoreException}.
 */
public class RedisCounterStore implements CounterStore {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<List> fixedWindowScript;

    public RedisCounterStore(StringRedisTemplate redisTemplate, RedisScript<List> fixedWindowScript) {
        this.redisTemplate = redisTemplate;
        this.fixedWindowScript = fixedWindowScript;
    }

    @Override
    public OptionalLong get(String key) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException ex) {
            throw new CounterStoreException("Redis GET failed for " + key, ex);
        }
        if (value == null) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value));
        } catch (NumberFormatException ex) {
            throw new CounterStoreException("Non-numeric counter value under " + key + ": " + value, ex);
        }
    }

    @Override
    public long increment(String key) {
        Long updated;
        try {
            updated = redisTemplate.opsForValue().increment(key);
        } catch (DataAccessException ex) {
            throw new CounterStoreException("Redis INCR failed for " + key, ex);
        }
        if (updated == null) {
            throw new CounterStoreException("Redis INCR returned no value for " + key);
        }
        return updated;
    }

    @Override
    public void expire(String key, Duration ttl) {
        try {
            redisTemplate.expire(key, ttl);
        } catch (DataAccessException ex) {
            throw new CounterStoreException("Redis PEXPIRE failed for " + key, ex);
        }
    }

    @Override
    public CounterUpdate incrementIfBelow(String key, long limit, Duration ttl) {
        Object result;
        try {
            result = redisTemplate.execute(
                    fixedWindowScript,
                    Collections.singletonList(key),
                    Long.toString(limit),
                    Long.toString(ttl.toMillis())
            );
        } catch (DataAccessException ex) {
            throw new CounterStoreException("Redis fixed-window script failed for " + key, ex);
        }

        if (!(result instanceof List<?> listResult) || listResult.size() < 2) {
            throw new CounterStoreException("Unexpected fixed-window script result for " + key + ": " + result);
        }
        long incrementedFlag = toLong(listResult.get(0));
        long count = toLong(listResult.get(1));
        return incrementedFlag == 1L ? CounterUpdate.accepted(count) : CounterUpdate.rejected(count);
    }

    @Override
    public String name() {
        return "redis";
    }

    private long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value));
        } catch (NumberFormatException ex) {
            throw new CounterStoreException("Non-numeric fixed-window script value: " + value, ex);
        }
    }
}
