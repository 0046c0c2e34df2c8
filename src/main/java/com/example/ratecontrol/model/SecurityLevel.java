package com.example.ratecontrol.model;

import com.example.ratecontrol.identity.IdentifierStrategy;

import java.time.Duration;

/**
 * Protection tiers. Each tier is a policy template that individual routes override field by field.
 */
public enum SecurityLevel {

    /** Logins, payments, resets. */
    CRITICAL(5, IdentifierStrategy.COMPOSITE, true, true,
            "Security limit reached: too many requests, please wait a minute and retry."),
    /** Write operations. */
    HIGH(15, IdentifierStrategy.NETWORK_ADDRESS, true, true,
            "Too many requests, please retry later."),
    MEDIUM(60, IdentifierStrategy.NETWORK_ADDRESS, true, true,
            "Request rate exceeded, please retry later."),
    /** Public queries. */
    LOW(200, IdentifierStrategy.NETWORK_ADDRESS, false, true, null),
    /** Static and fully public resources. */
    PUBLIC(1000, IdentifierStrategy.NETWORK_ADDRESS, false, false, null);

    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);

    private final long maxRequests;
    private final IdentifierStrategy strategy;
    private final boolean enableAuditLog;
    private final boolean includeHeaders;
    private final String message;

    SecurityLevel(long maxRequests, IdentifierStrategy strategy, boolean enableAuditLog,
                  boolean includeHeaders, String message) {
        this.maxRequests = maxRequests;
        this.strategy = strategy;
        this.enableAuditLog = enableAuditLog;
        this.includeHeaders = includeHeaders;
        this.message = message;
    }

    /**
     * @return a builder seeded with this tier's defaults (one-minute window).
     */
    public RateLimitConfig.Builder template() {
        return RateLimitConfig.builder()
                .maxRequests(maxRequests)
                .window(ONE_MINUTE)
                .strategy(strategy)
                .enableAuditLog(enableAuditLog)
                .includeHeaders(includeHeaders)
                .message(message);
    }
}
