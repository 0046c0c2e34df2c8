package com.example.ratecontrol.config;

import com.example.ratecontrol.identity.IdentifierStrategy;
import com.example.ratecontrol.model.SecurityLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "rate-limiter")
public class RateLimiterProperties {

    /**
     * If true, requests are allowed when neither the distributed nor the local store can count them.
     * If false, such requests are rejected with 503.
     */
    private boolean failOpen = true;

    private final Distributed distributed = new Distributed();

    private final Local local = new Local();

    private final Filter filter = new Filter();

    /**
     * Policy applied to paths that match no entry in {@link #policies}.
     */
    private Policy defaultPolicy = new Policy();

    /**
     * Ant-style path pattern to policy; the first matching pattern in declaration order wins.
     */
    private Map<String, Policy> policies = new LinkedHashMap<>();

    public boolean isFailOpen() {
        return failOpen;
    }

    public void setFailOpen(boolean failOpen) {
        this.failOpen = failOpen;
    }

    public Distributed getDistributed() {
        return distributed;
    }

    public Local getLocal() {
        return local;
    }

    public Filter getFilter() {
        return filter;
    }

    public Policy getDefaultPolicy() {
        return defaultPolicy;
    }

    public void setDefaultPolicy(Policy defaultPolicy) {
        this.defaultPolicy = defaultPolicy;
    }

    public Map<String, Policy> getPolicies() {
        return policies;
    }

    public void setPolicies(Map<String, Policy> policies) {
        this.policies = policies;
    }

    public static class Distributed {

        /**
         * redis:// or rediss:// URL of the shared counter store. Blank means local-only mode.
         */
        private String url;

        /**
         * Access token, sent as the Redis password.
         */
        private String token;

        /**
         * Upper bound for a single store command, including connection attempts.
         */
        private Duration timeout = Duration.ofMillis(250);

        public boolean isConfigured() {
            return url != null && !url.isBlank() && token != null && !token.isBlank();
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Local {

        /**
         * TTL for counters created without an explicit expiry.
         */
        private Duration defaultTtl = Duration.ofSeconds(60);

        private Duration sweepInterval = Duration.ofSeconds(60);

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    public static class Filter {

        private boolean enabled = true;

        /**
         * Ant-style patterns the servlet filter never counts.
         */
        private List<String> excludedPaths = new ArrayList<>();

        /**
         * Addresses merged into every policy's whitelist.
         */
        private List<String> defaultWhitelist = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getExcludedPaths() {
            return excludedPaths;
        }

        public void setExcludedPaths(List<String> excludedPaths) {
            this.excludedPaths = excludedPaths;
        }

        public List<String> getDefaultWhitelist() {
            return defaultWhitelist;
        }

        public void setDefaultWhitelist(List<String> defaultWhitelist) {
            this.defaultWhitelist = defaultWhitelist;
        }
    }

    /**
     * One route's policy. Unset fields inherit from {@link #level} when given.
     */
    public static class Policy {

        private SecurityLevel level;

        private Long maxRequests;

        private Duration window;

        private IdentifierStrategy strategy;

        private List<String> whitelist = new ArrayList<>();

        private Boolean auditLog;

        private Boolean includeHeaders;

        private String message;

        public SecurityLevel getLevel() {
            return level;
        }

        public void setLevel(SecurityLevel level) {
            this.level = level;
        }

        public Long getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(Long maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public IdentifierStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(IdentifierStrategy strategy) {
            this.strategy = strategy;
        }

        public List<String> getWhitelist() {
            return whitelist;
        }

        public void setWhitelist(List<String> whitelist) {
            this.whitelist = whitelist;
        }

        public Boolean getAuditLog() {
            return auditLog;
        }

        public void setAuditLog(Boolean auditLog) {
            this.auditLog = auditLog;
        }

        public Boolean getIncludeHeaders() {
            return includeHeaders;
        }

        public void setIncludeHeaders(Boolean includeHeaders) {
            this.includeHeaders = includeHeaders;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }
}
