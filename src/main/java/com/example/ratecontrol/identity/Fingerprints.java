package com.example.ratecontrol.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

final class Fingerprints {

    private Fingerprints() {
    }

    /**
     * @return the first {@code length} hex characters of SHA-256 over the UTF-8 bytes of {@code value}.
     */
    static String sha256Hex(String value, int length) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, length);
        } catch (NoSuchAlgorithmException ex) {
            // Every JRE is required to ship SHA-256.
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
