package com.example.ratecontrol.identity;

/**
 * Network address plus a short user-agent fingerprint, so clients sharing one address
 * (NAT, office proxies) get separate counters.
 */
public final class CompositeExtractor implements IdentifierExtractor {

    public static final String USER_AGENT = "User-Agent";

    private static final int USER_AGENT_PREFIX = 20;
    private static final int FINGERPRINT_LENGTH = 8;

    private final IdentifierExtractor addressExtractor;

    public CompositeExtractor(IdentifierExtractor addressExtractor) {
        this.addressExtractor = addressExtractor;
    }

    @Override
    public String extract(ClientRequest request) {
        String address = addressExtractor.extract(request);
        String userAgent = request.header(USER_AGENT);
        if (userAgent == null) {
            userAgent = "";
        } else if (userAgent.length() > USER_AGENT_PREFIX) {
            userAgent = userAgent.substring(0, USER_AGENT_PREFIX);
        }
        return "combined:" + address + ":" + Fingerprints.sha256Hex(userAgent, FINGERPRINT_LENGTH);
    }
}
