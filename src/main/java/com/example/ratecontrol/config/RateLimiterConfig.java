package com.example.ratecontrol.config;

import com.example.ratecontrol.audit.AsyncAuditSink;
import com.example.ratecontrol.audit.AuditSink;
import com.example.ratecontrol.audit.LoggingAuditSink;
import com.example.ratecontrol.service.RateLimiterService;
import com.example.ratecontrol.store.CounterStore;
import com.example.ratecontrol.store.LocalCounterStore;
import com.example.ratecontrol.store.RedisCounterStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wires the rate limiter: stores, audit pipeline and the service holding them.
 */
@Configuration
public class RateLimiterConfig {

    private static final int AUDIT_QUEUE_CAPACITY = 500;

    /**
     * Clock bean for time-based operations in the rate limiter.
     * <p>
     * Using UTC clock for consistent window buckets across distributed instances.
     * Can be overridden in tests with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public LocalCounterStore localCounterStore(Clock clock, RateLimiterProperties properties) {
        RateLimiterProperties.Local local = properties.getLocal();
        return new LocalCounterStore(clock, local.getDefaultTtl(), local.getSweepInterval());
    }

    /**
     * Dedicated pool for audit delivery, isolated from request threads. When the queue is full new
     * violations are discarded; the decision they belong to has already been made.
     */
    @Bean(name = "rateLimitAuditExecutor")
    public ThreadPoolTaskExecutor rateLimitAuditExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(AUDIT_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("rate-limit-audit-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean
    public AuditSink auditSink(ThreadPoolTaskExecutor rateLimitAuditExecutor) {
        return new AsyncAuditSink(new LoggingAuditSink(), rateLimitAuditExecutor);
    }

    /**
     * Redis is the primary store when configured, with the local store as its fallback.
     * Without Redis the local store is primary from the start and there is no second attempt.
     */
    @Bean
    public RateLimiterService rateLimiterService(
            ObjectProvider<RedisCounterStore> redisCounterStore,
            LocalCounterStore localCounterStore,
            AuditSink auditSink,
            RateLimiterProperties properties,
            Clock clock
    ) {
        CounterStore primary = redisCounterStore.getIfAvailable();
        if (primary == null) {
            primary = localCounterStore;
        }
        return new RateLimiterService(primary, localCounterStore, auditSink, clock, properties.isFailOpen());
    }
}
