package com.example.ratecontrol.identity;

/**
 * Client address as reported by the proxy chain in front of us.
 */
public final class NetworkAddressExtractor implements IdentifierExtractor {

    public static final String FORWARDED_FOR = "X-Forwarded-For";
    public static final String REAL_IP = "X-Real-IP";
    public static final String CDN_CONNECTING_IP = "CF-Connecting-IP";
    public static final String UNKNOWN = "unknown";

    @Override
    public String extract(ClientRequest request) {
        String forwardedFor = request.header(FORWARDED_FOR);
        if (forwardedFor != null) {
            // X-Forwarded-For is a comma-separated hop list; the first entry is the original client.
            int comma = forwardedFor.indexOf(',');
            String first = (comma < 0 ? forwardedFor : forwardedFor.substring(0, comma)).trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.header(REAL_IP);
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String connectingIp = request.header(CDN_CONNECTING_IP);
        if (connectingIp != null && !connectingIp.isBlank()) {
            return connectingIp.trim();
        }
        return UNKNOWN;
    }
}
