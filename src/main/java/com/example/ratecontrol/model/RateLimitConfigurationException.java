package com.example.ratecontrol.model;

/**
 * Invalid rate-limit policy. Raised while building configuration so a bad policy stops startup
 * instead of surfacing per request.
 */
public class RateLimitConfigurationException extends RuntimeException {

    public RateLimitConfigurationException(String message) {
        super(message);
    }

    public RateLimitConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
