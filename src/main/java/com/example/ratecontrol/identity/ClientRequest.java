package com.example.ratecontrol.identity;

/**
 * The parts of an inbound request that rate control reads. Header lookups are case-insensitive.
 */
public interface ClientRequest {

    /**
     * @return the first value of the header, or {@code null} when absent.
     */
    String header(String name);

    String path();

    String method();
}
