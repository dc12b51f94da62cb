package com.example.storemap.exception;

/**
 * A multi-step mutation failed part way and was rolled back as a whole.
 */
public class TransactionFailureException extends MapSyncException {

    public TransactionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
