package com.autonomous.pipeline.store;

/**
 * The persisted record exists but cannot be parsed. Fatal for the run; never repaired automatically.
 */
public class StateCorruptException extends StateStoreException {

    public StateCorruptException(String message, Throwable cause) {
        super(message, cause);
    }

    public StateCorruptException(String message) {
        super(message);
    }
}
