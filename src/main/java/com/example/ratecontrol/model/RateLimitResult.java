package com.example.ratecontrol.model;

/**
 * Result returned by the rate limiter for a single request.
 */
public class RateLimitResult {

    private final RateLimitDecision decision;
    private final long remaining;
    private final long limit;
    private final long resetTime;
    private final long currentRequests;
    private final String identifier;
    private final String reason;
    private final boolean degraded;

    public RateLimitResult(
            RateLimitDecision decision,
            long remaining,
            long limit,
            long resetTime,
            long currentRequests,
            String identifier,
            String reason,
            boolean degraded
    ) {
        this.decision = decision;
        this.remaining = remaining;
        this.limit = limit;
        this.resetTime = resetTime;
        this.currentRequests = currentRequests;
        this.identifier = identifier;
        this.reason = reason;
        this.degraded = degraded;
    }

    public static RateLimitResult allow(long limit, long currentRequests, long resetTime,
                                        String identifier, boolean degraded) {
        return new RateLimitResult(RateLimitDecision.ALLOW, Math.max(0, limit - currentRequests), limit,
                resetTime, currentRequests, identifier, null, degraded);
    }

    public static RateLimitResult whitelisted(long limit, long resetTime, String identifier) {
        return new RateLimitResult(RateLimitDecision.ALLOW, limit, limit, resetTime, 0, identifier, null, false);
    }

    public static RateLimitResult rejectRateLimited(long limit, long currentRequests, long resetTime,
                                                    String identifier, String reason, boolean degraded) {
        return new RateLimitResult(RateLimitDecision.REJECT_RATE_LIMITED, 0, limit, resetTime,
                currentRequests, identifier, reason, degraded);
    }

    public static RateLimitResult allowOnStoreFailure(long limit, long resetTime, String identifier) {
        return new RateLimitResult(RateLimitDecision.ALLOW, limit, limit, resetTime, 0, identifier,
                "Storage failure - allowing request", true);
    }

    public static RateLimitResult rejectStoreFailure(long limit, long resetTime, String identifier) {
        return new RateLimitResult(RateLimitDecision.REJECT_STORE_FAILURE, 0, limit, resetTime, 0, identifier,
                "Storage failure - rejecting request", true);
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    public boolean isAllowed() {
        return decision == RateLimitDecision.ALLOW;
    }

    public long getRemaining() {
        return remaining;
    }

    public long getLimit() {
        return limit;
    }

    /**
     * @return epoch millis at which the current window ends and the count starts over.
     */
    public long getResetTime() {
        return resetTime;
    }

    public long getCurrentRequests() {
        return currentRequests;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * @return why the request was denied or let through unusually, or {@code null} for an ordinary allow.
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return true if the result was produced while the system was in a degraded mode
     * (counting on the local fallback store, or no store answered at all).
     */
    public boolean isDegraded() {
        return degraded;
    }
}
