package com.example.ratecontrol.identity;

/**
 * Identifies the caller by API key, accepted under either {@value #API_KEY} or {@value #ADMIN_KEY}.
 */
public final class ApiKeyExtractor implements IdentifierExtractor {

    public static final String API_KEY = "X-API-Key";
    public static final String ADMIN_KEY = "X-Admin-Key";

    private static final int FINGERPRINT_LENGTH = 12;

    private final IdentifierExtractor fallback;

    public ApiKeyExtractor(IdentifierExtractor fallback) {
        this.fallback = fallback;
    }

    @Override
    public String extract(ClientRequest request) {
        String apiKey = firstNonBlank(request.header(ADMIN_KEY), request.header(API_KEY));
        if (apiKey == null) {
            return fallback.extract(request);
        }
        return "api:" + Fingerprints.sha256Hex(apiKey.trim(), FINGERPRINT_LENGTH);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }
}
