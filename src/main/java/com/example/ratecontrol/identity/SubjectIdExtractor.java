package com.example.ratecontrol.identity;

/**
 * Identifies the caller by its bearer credential. Only a hash fragment of the token
 * ever leaves this class, so the credential cannot end up in counter keys or logs.
 */
public final class SubjectIdExtractor implements IdentifierExtractor {

    public static final String AUTHORIZATION = "Authorization";

    private static final String BEARER_PREFIX = "bearer ";
    private static final int FINGERPRINT_LENGTH = 16;

    private final IdentifierExtractor fallback;

    public SubjectIdExtractor(IdentifierExtractor fallback) {
        this.fallback = fallback;
    }

    @Override
    public String extract(ClientRequest request) {
        String authorization = request.header(AUTHORIZATION);
        if (authorization == null || authorization.length() <= BEARER_PREFIX.length()
                || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return fallback.extract(request);
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty() || token.contains(" ")) {
            return fallback.extract(request);
        }
        return "user:" + Fingerprints.sha256Hex(token, FINGERPRINT_LENGTH);
    }
}
