package com.example.ratecontrol.identity;

/**
 * Derives a stable client identity from request headers.
 * <p>
 * Implementations are pure and must not throw: anything malformed degrades to the network address.
 */
@FunctionalInterface
public interface IdentifierExtractor {

    String extract(ClientRequest request);
}
