package com.example.ratecontrol.config;

import com.example.ratecontrol.model.RateLimitConfig;
import com.example.ratecontrol.model.RateLimitConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves which policy guards a request path.
 * <p>
 * All policies are built and validated once at startup, so a misconfigured policy fails the
 * application context instead of individual requests.
 */
@Component
public class RateLimitPolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimitPolicyRegistry.class);

    private final PathMatcher pathMatcher = new AntPathMatcher();
    private final List<String> excludedPaths;
    private final List<RoutePolicy> routes;
    private final RateLimitConfig defaultConfig;

    public RateLimitPolicyRegistry(RateLimiterProperties properties) {
        List<String> defaultWhitelist = properties.getFilter().getDefaultWhitelist();
        this.excludedPaths = List.copyOf(properties.getFilter().getExcludedPaths());
        this.defaultConfig = toConfig("default", properties.getDefaultPolicy(), defaultWhitelist);

        List<RoutePolicy> compiled = new ArrayList<>();
        for (Map.Entry<String, RateLimiterProperties.Policy> entry : properties.getPolicies().entrySet()) {
            compiled.add(new RoutePolicy(entry.getKey(), toConfig(entry.getKey(), entry.getValue(), defaultWhitelist)));
        }
        this.routes = List.copyOf(compiled);

        log.info("Loaded {} rate-limit route policies, {} excluded paths, default={}",
                routes.size(), excludedPaths.size(), defaultConfig);
    }

    /**
     * @return the policy for the path, or empty when the path is excluded from rate limiting.
     */
    public Optional<RateLimitConfig> resolve(String path) {
        for (String excluded : excludedPaths) {
            if (pathMatcher.match(excluded, path)) {
                return Optional.empty();
            }
        }
        for (RoutePolicy route : routes) {
            if (pathMatcher.match(route.pattern, path)) {
                return Optional.of(route.config);
            }
        }
        return Optional.of(defaultConfig);
    }

    public RateLimitConfig getDefaultConfig() {
        return defaultConfig;
    }

    static RateLimitConfig toConfig(String name, RateLimiterProperties.Policy policy, List<String> defaultWhitelist) {
        if (policy == null) {
            throw new RateLimitConfigurationException("Rate-limit policy '" + name + "' is empty");
        }
        RateLimitConfig.Builder builder = policy.getLevel() != null
                ? policy.getLevel().template()
                : RateLimitConfig.builder();
        if (policy.getMaxRequests() != null) {
            builder.maxRequests(policy.getMaxRequests());
        }
        if (policy.getWindow() != null) {
            builder.window(policy.getWindow());
        }
        if (policy.getStrategy() != null) {
            builder.strategy(policy.getStrategy());
        }
        if (policy.getAuditLog() != null) {
            builder.enableAuditLog(policy.getAuditLog());
        }
        if (policy.getIncludeHeaders() != null) {
            builder.includeHeaders(policy.getIncludeHeaders());
        }
        if (policy.getMessage() != null) {
            builder.message(policy.getMessage());
        }
        builder.addWhitelist(defaultWhitelist).addWhitelist(policy.getWhitelist());
        try {
            return builder.build();
        } catch (RateLimitConfigurationException ex) {
            throw new RateLimitConfigurationException(
                    "Invalid rate-limit policy '" + name + "': " + ex.getMessage(), ex);
        }
    }

    private static final class RoutePolicy {
        private final String pattern;
        private final RateLimitConfig config;

        private RoutePolicy(String pattern, RateLimitConfig config) {
            this.pattern = pattern;
            this.config = config;
        }
    }
}
