package com.example.ratecontrol.filter;

import com.example.ratecontrol.config.RateLimitPolicyRegistry;
import com.example.ratecontrol.identity.ServletClientRequest;
import com.example.ratecontrol.model.RateLimitConfig;
import com.example.ratecontrol.model.RateLimitDecision;
import com.example.ratecontrol.model.RateLimitResult;
import com.example.ratecontrol.service.RateLimiterService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Servlet filter that applies the path's rate-limit policy to every incoming HTTP request.
 *
 * The filter is deliberately simple: it delegates all decision-making to {@link RateLimiterService}
 * and translates the result into HTTP semantics (429 or 503) through {@link RateLimitResponses}.
 */
@Component
@ConditionalOnProperty(prefix = "rate-limiter.filter", name = "enabled", matchIfMissing = true)
public class RateLimitingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitingFilter.class);

    private final RateLimiterService rateLimiterService;
    private final RateLimitPolicyRegistry policyRegistry;
    private final RateLimitResponses responses;
    private final ObjectMapper objectMapper;

    public RateLimitingFilter(
            RateLimiterService rateLimiterService,
            RateLimitPolicyRegistry policyRegistry,
            RateLimitResponses responses,
            ObjectMapper objectMapper
    ) {
        this.rateLimiterService = rateLimiterService;
        this.policyRegistry = policyRegistry;
        this.responses = responses;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        ServletClientRequest clientRequest = ServletClientRequest.of(request);
        Optional<RateLimitConfig> policy = policyRegistry.resolve(clientRequest.path());
        if (policy.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        RateLimitConfig config = policy.get();
        RateLimitResult result = rateLimiterService.check(clientRequest, config);

        if (result.isAllowed()) {
            if (config.isIncludeHeaders()) {
                responses.rateLimitHeaders(result)
                        .forEach((name, values) -> values.forEach(value -> response.setHeader(name, value)));
            }
            if (result.isDegraded()) {
                response.setHeader(RateLimitResponses.HEADER_DEGRADED, "true");
            }
            filterChain.doFilter(request, response);
            return;
        }

        if (result.getDecision() == RateLimitDecision.REJECT_STORE_FAILURE) {
            log.error("Rejecting {} {} for {} due to counter store failure and fail-closed configuration",
                    request.getMethod(), clientRequest.path(), result.getIdentifier());
        } else {
            log.debug("Rate limit exceeded for {} on {} {}", result.getIdentifier(), request.getMethod(),
                    clientRequest.path());
        }
        writeRejection(response, responses.rejection(result, config));
    }

    private void writeRejection(HttpServletResponse response, ResponseEntity<RateLimitErrorResponse> rejection)
            throws IOException {
        response.setStatus(rejection.getStatusCode().value());
        rejection.getHeaders().forEach((name, values) -> values.forEach(value -> response.addHeader(name, value)));
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), rejection.getBody());
    }
}
