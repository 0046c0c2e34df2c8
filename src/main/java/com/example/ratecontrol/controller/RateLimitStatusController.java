package com.example.ratecontrol.controller;

import com.example.ratecontrol.config.RateLimitPolicyRegistry;
import com.example.ratecontrol.identity.ServletClientRequest;
import com.example.ratecontrol.model.RateLimitConfig;
import com.example.ratecontrol.model.RateLimitResult;
import com.example.ratecontrol.service.RateLimiterService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lets a client see its standing under the policy for a path without spending a request there.
 */
@RestController
public class RateLimitStatusController {

    private final RateLimiterService rateLimiterService;
    private final RateLimitPolicyRegistry policyRegistry;

    public RateLimitStatusController(RateLimiterService rateLimiterService, RateLimitPolicyRegistry policyRegistry) {
        this.rateLimiterService = rateLimiterService;
        this.policyRegistry = policyRegistry;
    }

    @GetMapping("/api/rate-limit/status")
    public ResponseEntity<Map<String, Object>> status(
            HttpServletRequest request,
            @RequestParam(name = "path", defaultValue = "/") String path
    ) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);

        Optional<RateLimitConfig> policy = policyRegistry.resolve(path);
        if (policy.isEmpty()) {
            body.put("limited", false);
            return ResponseEntity.ok(body);
        }

        RateLimitConfig config = policy.get();
        RateLimitResult result = rateLimiterService.status(ServletClientRequest.of(request), config);
        body.put("limited", true);
        body.put("allowed", result.isAllowed());
        body.put("limit", result.getLimit());
        body.put("remaining", result.getRemaining());
        body.put("currentRequests", result.getCurrentRequests());
        body.put("resetTime", result.getResetTime());
        body.put("windowMs", config.getWindowMs());
        body.put("strategy", config.getStrategy());
        if (result.getReason() != null) {
            body.put("reason", result.getReason());
        }
        return ResponseEntity.ok(body);
    }
}
