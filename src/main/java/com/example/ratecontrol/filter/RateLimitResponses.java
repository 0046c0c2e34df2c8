package com.example.ratecontrol.filter;

import com.example.ratecontrol.model.RateLimitConfig;
import com.example.ratecontrol.model.RateLimitDecision;
import com.example.ratecontrol.model.RateLimitResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Translates rate-limit results into HTTP semantics (429 or 503, informational headers).
 */
@Component
public class RateLimitResponses {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_DEGRADED = "X-RateLimit-Degraded";

    static final String DEFAULT_MESSAGE = "Too many requests, please try again later.";
    static final String UNAVAILABLE_MESSAGE = "Service temporarily unavailable (rate limiter backend error)";

    private final Clock clock;

    public RateLimitResponses(Clock clock) {
        this.clock = clock;
    }

    public HttpHeaders rateLimitHeaders(RateLimitResult result) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HEADER_LIMIT, Long.toString(result.getLimit()));
        headers.set(HEADER_REMAINING, Long.toString(result.getRemaining()));
        headers.set(HEADER_RESET, Long.toString(result.getResetTime()));
        return headers;
    }

    /**
     * Builds the rejection for a denied result.
     */
    public ResponseEntity<RateLimitErrorResponse> rejection(RateLimitResult result, RateLimitConfig config) {
        HttpHeaders headers = new HttpHeaders();
        if (config.isIncludeHeaders()) {
            headers.addAll(rateLimitHeaders(result));
        }
        RateLimitErrorResponse.Details details =
                new RateLimitErrorResponse.Details(result.getLimit(), result.getRemaining(), result.getResetTime());

        if (result.getDecision() == RateLimitDecision.REJECT_STORE_FAILURE) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .headers(headers)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new RateLimitErrorResponse(UNAVAILABLE_MESSAGE, RateLimitErrorResponse.CODE_UNAVAILABLE,
                            details));
        }

        headers.set(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds(result)));
        String message = config.getMessage() != null ? config.getMessage() : DEFAULT_MESSAGE;
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new RateLimitErrorResponse(message, RateLimitErrorResponse.CODE_EXCEEDED, details));
    }

    /**
     * Whole seconds until the next window opens, never less than one.
     */
    long retryAfterSeconds(RateLimitResult result) {
        long millisUntilReset = result.getResetTime() - clock.millis();
        return Math.max(1L, (millisUntilReset + 999) / 1000);
    }
}
