package com.example.storemap.exception;

/**
 * Base type for every failure the map synchronization core reports to its callers.
 */
public abstract class MapSyncException extends RuntimeException {

    protected MapSyncException(String message) {
        super(message);
    }

    protected MapSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
