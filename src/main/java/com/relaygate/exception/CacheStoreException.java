package com.relaygate.exception;

/**
 * Storage failure inside a response cache store. Never reaches a client.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
