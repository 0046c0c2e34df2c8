package com.example.ratecontrol.model;

import com.example.ratecontrol.identity.IdentifierStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable rate-limit policy for one protected operation.
 * <p>
 * Built through {@link #builder()}; {@link Builder#build()} validates and throws
 * {@link RateLimitConfigurationException} for anything that cannot be enforced.
 */
public final class RateLimitConfig {

    private final long maxRequests;
    private final Duration window;
    private final IdentifierStrategy strategy;
    private final Whitelist whitelist;
    private final boolean enableAuditLog;
    private final boolean includeHeaders;
    private final String message;

    private RateLimitConfig(Builder builder, Whitelist whitelist) {
        this.maxRequests = builder.maxRequests;
        this.window = builder.window;
        this.strategy = builder.strategy;
        this.whitelist = whitelist;
        this.enableAuditLog = builder.enableAuditLog;
        this.includeHeaders = builder.includeHeaders;
        this.message = builder.message;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    public long getWindowMs() {
        return window.toMillis();
    }

    public IdentifierStrategy getStrategy() {
        return strategy;
    }

    public Whitelist getWhitelist() {
        return whitelist;
    }

    public boolean isEnableAuditLog() {
        return enableAuditLog;
    }

    public boolean isIncludeHeaders() {
        return includeHeaders;
    }

    /**
     * @return the custom denial message, or {@code null} to use the default one.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "RateLimitConfig{maxRequests=" + maxRequests
                + ", window=" + window
                + ", strategy=" + strategy
                + ", whitelist=" + whitelist.entries()
                + ", enableAuditLog=" + enableAuditLog
                + ", includeHeaders=" + includeHeaders + '}';
    }

    public static final class Builder {

        private long maxRequests;
        private Duration window;
        private IdentifierStrategy strategy;
        private final List<String> whitelist = new ArrayList<>();
        private boolean enableAuditLog;
        private boolean includeHeaders = true;
        private String message;

        private Builder() {
        }

        public Builder maxRequests(long maxRequests) {
            this.maxRequests = maxRequests;
            return this;
        }

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        public Builder windowMs(long windowMs) {
            return window(Duration.ofMillis(windowMs));
        }

        public Builder strategy(IdentifierStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        /**
         * Replaces the whitelist.
         */
        public Builder whitelist(List<String> entries) {
            this.whitelist.clear();
            if (entries != null) {
                this.whitelist.addAll(entries);
            }
            return this;
        }

        public Builder addWhitelist(List<String> entries) {
            if (entries != null) {
                this.whitelist.addAll(entries);
            }
            return this;
        }

        public Builder enableAuditLog(boolean enableAuditLog) {
            this.enableAuditLog = enableAuditLog;
            return this;
        }

        public Builder includeHeaders(boolean includeHeaders) {
            this.includeHeaders = includeHeaders;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public RateLimitConfig build() {
            if (maxRequests <= 0) {
                throw new RateLimitConfigurationException("maxRequests must be positive, was " + maxRequests);
            }
            if (window == null || window.isNegative() || window.toMillis() <= 0) {
                throw new RateLimitConfigurationException("window must be at least 1ms, was " + window);
            }
            if (strategy == null) {
                throw new RateLimitConfigurationException("strategy is required");
            }
            if (message != null && message.isBlank()) {
                message = null;
            }
            return new RateLimitConfig(this, Whitelist.compile(whitelist));
        }
    }
}
