package com.example.ratecontrol.store;

/**
 * The counter backend could not answer (connection failure, timeout, corrupt value).
 */
public class CounterStoreException extends RuntimeException {

    public CounterStoreException(String message) {
        super(message);
    }

    public CounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
