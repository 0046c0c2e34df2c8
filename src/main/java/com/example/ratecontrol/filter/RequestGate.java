package com.example.ratecontrol.filter;

import com.example.ratecontrol.identity.ServletClientRequest;
import com.example.ratecontrol.model.RateLimitConfig;
import com.example.ratecontrol.model.RateLimitResult;
import com.example.ratecontrol.service.RateLimiterService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Programmatic rate limiting for handlers that pick their own policy, as opposed to the path-based
 * {@link RateLimitingFilter}.
 */
@Component
public class RequestGate {

    private final RateLimiterService rateLimiterService;
    private final RateLimitResponses responses;

    public RequestGate(RateLimiterService rateLimiterService, RateLimitResponses responses) {
        this.rateLimiterService = rateLimiterService;
        this.responses = responses;
    }

    /**
     * Short-circuit mode: counts the request and returns the rejection to send, or empty when the
     * request may continue.
     */
    public Optional<ResponseEntity<RateLimitErrorResponse>> intercept(HttpServletRequest request,
                                                                      RateLimitConfig config) {
        RateLimitResult result = rateLimiterService.check(ServletClientRequest.of(request), config);
        if (result.isAllowed()) {
            return Optional.empty();
        }
        return Optional.of(responses.rejection(result, config));
    }

    /**
     * Decorator mode: the returned handler rejects over-limit requests itself and otherwise delegates,
     * adding {@code X-RateLimit-*} headers to successful responses when the policy asks for them.
     */
    public RateLimitedHandler wrap(RateLimitedHandler handler, RateLimitConfig config) {
        return request -> {
            RateLimitResult result = rateLimiterService.check(ServletClientRequest.of(request), config);
            if (!result.isAllowed()) {
                return responses.rejection(result, config);
            }

            ResponseEntity<?> response = handler.handle(request);
            if (!config.isIncludeHeaders() || response == null || !response.getStatusCode().is2xxSuccessful()) {
                return response;
            }
            HttpHeaders headers = new HttpHeaders();
            headers.addAll(response.getHeaders());
            headers.putAll(responses.rateLimitHeaders(result));
            return new ResponseEntity<>(response.getBody(), headers, response.getStatusCode());
        };
    }
}
