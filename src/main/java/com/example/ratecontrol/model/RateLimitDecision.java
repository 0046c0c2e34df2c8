package com.example.ratecontrol.model;

/**
 * High-level outcome of a single rate-limit check.
 */
public enum RateLimitDecision {
    /**
     * Request is within its window budget (or whitelisted, or let through fail-open) and may proceed.
     */
    ALLOW,

    /**
     * The client used up its budget for the current window and must be rejected with 429.
     */
    REJECT_RATE_LIMITED,

    /**
     * Neither the primary nor the fallback counter store answered and we are configured to fail closed.
     */
    REJECT_STORE_FAILURE
}
