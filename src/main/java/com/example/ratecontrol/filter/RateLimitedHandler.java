package com.example.ratecontrol.filter;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;

/**
 * A request handler that {@link RequestGate#wrap} can guard.
 */
@FunctionalInterface
public interface RateLimitedHandler {

    ResponseEntity<?> handle(HttpServletRequest request);
}
