package com.example.ratecontrol.service;

import com.example.ratecontrol.audit.AuditSink;
import com.example.ratecontrol.audit.ViolationRecord;
import com.example.ratecontrol.identity.ClientRequest;
import com.example.ratecontrol.identity.IdentifierStrategy;
import com.example.ratecontrol.model.RateLimitConfig;
import com.example.ratecontrol.model.RateLimitResult;
import com.example.ratecontrol.store.CounterStore;
import com.example.ratecontrol.store.CounterUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Evaluates fixed-window rate limits for inbound requests.
 *
 * This service is responsible for:
 *  - naming the client under the policy's identifier strategy
 *  - exempting whitelisted addresses before any store is touched
 *  - building the window-bucket counter key
 *  - counting on the primary store, and on the fallback store while the primary is unreachable
 *  - defining the behavior when no store answers (fail-open vs fail-closed)
 *  - handing denials to the audit sink without waiting for it
 *
 * Windows are fixed (tumbling): a client can spend a full budget at the end of one window and another
 * at the start of the next.
 */
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    static final String KEY_PREFIX = "ratelimit:";
    static final String REASON_EXCEEDED = "Rate limit exceeded";
    static final String REASON_EXCEEDED_FALLBACK = "Rate limit exceeded (fallback)";

    private final CounterStore primaryStore;
    private final CounterStore fallbackStore;
    private final AuditSink auditSink;
    private final Clock clock;
    private final boolean failOpen;

    public RateLimiterService(
            CounterStore primaryStore,
            CounterStore fallbackStore,
            AuditSink auditSink,
            Clock clock,
            boolean failOpen
    ) {
        this.primaryStore = primaryStore;
        this.fallbackStore = fallbackStore;
        this.auditSink = auditSink;
        this.clock = clock;
        this.failOpen = failOpen;
        log.info("Rate limiter using {} store{} (failOpen={})", primaryStore.name(),
                hasSeparateFallback() ? " with " + fallbackStore.name() + " fallback" : "", failOpen);
    }

    /**
     * Counts one request against the policy and decides whether it may proceed.
     * Never throws; storage problems resolve to an allow or deny according to the failure policy.
     */
    public RateLimitResult check(ClientRequest request, RateLimitConfig config) {
        String identifier = config.getStrategy().extract(request);
        long windowMs = config.getWindowMs();
        long bucket = Math.floorDiv(clock.millis(), windowMs);
        long resetTime = bucket * windowMs + windowMs;

        if (isWhitelisted(request, config)) {
            return RateLimitResult.whitelisted(config.getMaxRequests(), resetTime, identifier);
        }

        String key = bucketKey(identifier, bucket);
        try {
            return count(primaryStore, key, request, config, identifier, resetTime, false);
        } catch (RuntimeException primaryFailure) {
            if (!hasSeparateFallback()) {
                log.error("Counter store {} failed for {}. failOpen={}", primaryStore.name(), identifier,
                        failOpen, primaryFailure);
                return handleStoreFailure(config, resetTime, identifier);
            }
            log.warn("Counter store {} failed for {}, counting on {} instead: {}", primaryStore.name(),
                    identifier, fallbackStore.name(), primaryFailure.getMessage());
            try {
                return count(fallbackStore, key, request, config, identifier, resetTime, true);
            } catch (RuntimeException fallbackFailure) {
                fallbackFailure.addSuppressed(primaryFailure);
                log.error("Fallback counter store {} also failed for {}. failOpen={}", fallbackStore.name(),
                        identifier, failOpen, fallbackFailure);
                return handleStoreFailure(config, resetTime, identifier);
            }
        }
    }

    /**
     * Reports where the client stands in the current window without counting a request.
     */
    public RateLimitResult status(ClientRequest request, RateLimitConfig config) {
        String identifier = config.getStrategy().extract(request);
        long windowMs = config.getWindowMs();
        long bucket = Math.floorDiv(clock.millis(), windowMs);
        long resetTime = bucket * windowMs + windowMs;

        if (isWhitelisted(request, config)) {
            return RateLimitResult.whitelisted(config.getMaxRequests(), resetTime, identifier);
        }

        String key = bucketKey(identifier, bucket);
        boolean degraded = false;
        long current;
        try {
            current = primaryStore.get(key).orElse(0L);
        } catch (RuntimeException primaryFailure) {
            if (!hasSeparateFallback()) {
                log.warn("Counter store {} failed reading status for {}", primaryStore.name(), identifier,
                        primaryFailure);
                return RateLimitResult.allowOnStoreFailure(config.getMaxRequests(), resetTime, identifier);
            }
            try {
                current = fallbackStore.get(key).orElse(0L);
                degraded = true;
            } catch (RuntimeException fallbackFailure) {
                log.warn("Both counter stores failed reading status for {}", identifier, fallbackFailure);
                return RateLimitResult.allowOnStoreFailure(config.getMaxRequests(), resetTime, identifier);
            }
        }

        if (current >= config.getMaxRequests()) {
            return RateLimitResult.rejectRateLimited(config.getMaxRequests(), current, resetTime, identifier,
                    degraded ? REASON_EXCEEDED_FALLBACK : REASON_EXCEEDED, degraded);
        }
        return RateLimitResult.allow(config.getMaxRequests(), current, resetTime, identifier, degraded);
    }

    private RateLimitResult count(
            CounterStore store,
            String key,
            ClientRequest request,
            RateLimitConfig config,
            String identifier,
            long resetTime,
            boolean degraded
    ) {
        CounterUpdate update = store.incrementIfBelow(key, config.getMaxRequests(), config.getWindow());

        if (update.isIncremented()) {
            return RateLimitResult.allow(config.getMaxRequests(), update.getCount(), resetTime, identifier,
                    degraded);
        }

        if (config.isEnableAuditLog()) {
            reportViolation(request, config, identifier, update.getCount());
        }
        return RateLimitResult.rejectRateLimited(config.getMaxRequests(), update.getCount(), resetTime, identifier,
                degraded ? REASON_EXCEEDED_FALLBACK : REASON_EXCEEDED, degraded);
    }

    private void reportViolation(ClientRequest request, RateLimitConfig config, String identifier, long count) {
        ViolationRecord violation = ViolationRecord.of(request, config, identifier, count, clock.instant());
        try {
            auditSink.report(violation);
        } catch (RuntimeException ex) {
            log.warn("Audit sink rejected rate-limit violation for {}", identifier, ex);
        }
    }

    private RateLimitResult handleStoreFailure(RateLimitConfig config, long resetTime, String identifier) {
        if (failOpen) {
            // Fail-open: requests pass unenforced until a store answers again.
            return RateLimitResult.allowOnStoreFailure(config.getMaxRequests(), resetTime, identifier);
        }
        return RateLimitResult.rejectStoreFailure(config.getMaxRequests(), resetTime, identifier);
    }

    private static boolean isWhitelisted(ClientRequest request, RateLimitConfig config) {
        return !config.getWhitelist().isEmpty()
                && config.getWhitelist().matches(IdentifierStrategy.networkAddress(request));
    }

    private boolean hasSeparateFallback() {
        return fallbackStore != null && fallbackStore != primaryStore;
    }

    static String bucketKey(String identifier, long bucket) {
        return KEY_PREFIX + identifier + ":" + bucket;
    }
}
