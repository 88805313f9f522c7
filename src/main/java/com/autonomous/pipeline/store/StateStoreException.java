package com.autonomous.pipeline.store;

/**
 * Raised when a run's persisted state cannot be read or written.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
