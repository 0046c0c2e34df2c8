package com.example.ratecontrol.filter;

/**
 * JSON body of a rejected request.
 */
public class RateLimitErrorResponse {

    public static final String CODE_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    public static final String CODE_UNAVAILABLE = "RATE_LIMIT_UNAVAILABLE";

    private final String error;
    private final String code;
    private final Details details;

    public RateLimitErrorResponse(String error, String code, Details details) {
        this.error = error;
        this.code = code;
        this.details = details;
    }

    public String getError() {
        return error;
    }

    public boolean isSuccess() {
        return false;
    }

    public String getCode() {
        return code;
    }

    public Details getDetails() {
        return details;
    }

    public static class Details {

        private final long limit;
        private final long remaining;
        private final long resetTime;

        public Details(long limit, long remaining, long resetTime) {
            this.limit = limit;
            this.remaining = remaining;
            this.resetTime = resetTime;
        }

        public long getLimit() {
            return limit;
        }

        public long getRemaining() {
            return remaining;
        }

        public long getResetTime() {
            return resetTime;
        }
    }
}
