package com.example.ratecontrol.model;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Addresses exempt from counting. Entries are exact addresses, {@code *} wildcard patterns
 * ({@code 10.0.*}) or CIDR blocks ({@code 192.168.0.0/16}, {@code fd00::/8}), parsed once at build time.
 * <p>
 * Addresses are only ever parsed as IP literals; IPv4 is parsed by hand and hostnames are never resolved.
 */
public final class Whitelist {

    private static final Whitelist EMPTY = new Whitelist(List.of(), List.of());

    private final List<String> entries;
    private final List<Matcher> matchers;

    private Whitelist(List<String> entries, List<Matcher> matchers) {
        this.entries = entries;
        this.matchers = matchers;
    }

    /**
     * @throws RateLimitConfigurationException if an entry is blank or a CIDR block is malformed
     */
    public static Whitelist compile(List<String> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        List<String> kept = new ArrayList<>();
        List<Matcher> matchers = new ArrayList<>();
        for (String raw : entries) {
            if (raw == null || raw.isBlank()) {
                throw new RateLimitConfigurationException("Whitelist entries must not be blank");
            }
            String entry = raw.trim();
            if (kept.contains(entry)) {
                continue;
            }
            kept.add(entry);
            if (entry.contains("/")) {
                matchers.add(parseCidr(entry));
            } else if (entry.contains("*")) {
                matchers.add(wildcard(entry));
            } else {
                matchers.add(entry::equals);
            }
        }
        return new Whitelist(Collections.unmodifiableList(kept), Collections.unmodifiableList(matchers));
    }

    public boolean matches(String address) {
        if (address == null || address.isEmpty()) {
            return false;
        }
        for (Matcher matcher : matchers) {
            if (matcher.matches(address)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return matchers.isEmpty();
    }

    public List<String> entries() {
        return entries;
    }

    @FunctionalInterface
    private interface Matcher {
        boolean matches(String address);
    }

    private static Matcher wildcard(String entry) {
        StringBuilder regex = new StringBuilder();
        for (String part : entry.split("\\*", -1)) {
            if (regex.length() > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(part));
        }
        Pattern pattern = Pattern.compile(regex.toString());
        return address -> pattern.matcher(address).matches();
    }

    private static Matcher parseCidr(String cidr) {
        String[] parts = cidr.split("/");
        if (parts.length != 2) {
            throw new RateLimitConfigurationException("Invalid CIDR (expected address/prefix): " + cidr);
        }
        byte[] network = parseLiteral(parts[0]);
        if (network == null) {
            throw new RateLimitConfigurationException("Invalid network address in CIDR: " + cidr);
        }
        int prefixLength;
        try {
            prefixLength = Integer.parseInt(parts[1]);
        } catch (NumberFormatException ex) {
            throw new RateLimitConfigurationException("Invalid prefix length in CIDR: " + cidr, ex);
        }
        if (prefixLength < 0 || prefixLength > network.length * 8) {
            throw new RateLimitConfigurationException(
                    "Prefix length out of range (max " + network.length * 8 + "): " + cidr);
        }
        return address -> {
            byte[] candidate = parseLiteral(address);
            return candidate != null && inBlock(candidate, network, prefixLength);
        };
    }

    private static boolean inBlock(byte[] address, byte[] network, int prefixLength) {
        if (address.length != network.length) {
            return false;
        }
        int fullBytes = prefixLength / 8;
        int remainingBits = prefixLength % 8;
        if (!Arrays.equals(address, 0, fullBytes, network, 0, fullBytes)) {
            return false;
        }
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (address[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    /**
     * @return the address bytes, or {@code null} if the input is not an IP literal.
     */
    private static byte[] parseLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return null;
        }
        if (input.indexOf(':') >= 0) {
            return parseIpv6(input);
        }
        return parseIpv4(input);
    }

    private static byte[] parseIpv4(String input) {
        String[] octets = input.split("\\.", -1);
        if (octets.length != 4) {
            return null;
        }
        byte[] address = new byte[4];
        for (int i = 0; i < 4; i++) {
            String octet = octets[i];
            if (octet.isEmpty() || octet.length() > 3) {
                return null;
            }
            int value = 0;
            for (int j = 0; j < octet.length(); j++) {
                char c = octet.charAt(j);
                if (c < '0' || c > '9') {
                    return null;
                }
                value = value * 10 + (c - '0');
            }
            if (value > 255) {
                return null;
            }
            address[i] = (byte) value;
        }
        return address;
    }

    private static byte[] parseIpv6(String input) {
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c != ':' && c != '.' && Character.digit(c, 16) < 0) {
                return null;
            }
        }
        try {
            // A string containing ':' is parsed as an IPv6 literal and never handed to the resolver.
            return InetAddress.getByName(input).getAddress();
        } catch (UnknownHostException ex) {
            return null;
        }
    }
}
