package com.example.ratecontrol.model;

import com.example.ratecontrol.identity.IdentifierStrategy;

import java.time.Duration;

/**
 * Ready-made policies for handlers that guard themselves through
 * {@link com.example.ratecontrol.filter.RequestGate}.
 */
public final class RateLimitPolicies {

    public static final RateLimitConfig API_STRICT = RateLimitConfig.builder()
            .maxRequests(5)
            .window(Duration.ofMinutes(1))
            .strategy(IdentifierStrategy.COMPOSITE)
            .enableAuditLog(true)
            .includeHeaders(true)
            .message("Too many requests, please wait one minute and retry.")
            .build();

    private RateLimitPolicies() {
    }
}
