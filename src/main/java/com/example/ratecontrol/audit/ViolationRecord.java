package com.example.ratecontrol.audit;

import com.example.ratecontrol.identity.ClientRequest;
import com.example.ratecontrol.identity.IdentifierStrategy;
import com.example.ratecontrol.model.RateLimitConfig;

import java.time.Instant;

/**
 * Audit payload for one denied request. Client-supplied headers that are absent read as {@code unknown}.
 */
public final class ViolationRecord {

    private static final String UNKNOWN = "unknown";

    private final String identifier;
    private final IdentifierStrategy strategy;
    private final long limit;
    private final long windowMs;
    private final long currentCount;
    private final String networkAddress;
    private final String userAgent;
    private final String origin;
    private final String referer;
    private final String path;
    private final String method;
    private final Instant occurredAt;

    private ViolationRecord(ClientRequest request, RateLimitConfig config, String identifier, long currentCount,
                            Instant occurredAt) {
        this.identifier = identifier;
        this.strategy = config.getStrategy();
        this.limit = config.getMaxRequests();
        this.windowMs = config.getWindowMs();
        this.currentCount = currentCount;
        this.networkAddress = orUnknown(IdentifierStrategy.networkAddress(request));
        this.userAgent = orUnknown(request.header("User-Agent"));
        this.origin = orUnknown(request.header("Origin"));
        this.referer = orUnknown(request.header("Referer"));
        this.path = request.path();
        this.method = request.method();
        this.occurredAt = occurredAt;
    }

    public static ViolationRecord of(ClientRequest request, RateLimitConfig config, String identifier,
                                     long currentCount, Instant occurredAt) {
        return new ViolationRecord(request, config, identifier, currentCount, occurredAt);
    }

    public String getIdentifier() {
        return identifier;
    }

    public IdentifierStrategy getStrategy() {
        return strategy;
    }

    public long getLimit() {
        return limit;
    }

    public long getWindowMs() {
        return windowMs;
    }

    public long getCurrentCount() {
        return currentCount;
    }

    public String getNetworkAddress() {
        return networkAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getOrigin() {
        return origin;
    }

    public String getReferer() {
        return referer;
    }

    public String getPath() {
        return path;
    }

    public String getMethod() {
        return method;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
