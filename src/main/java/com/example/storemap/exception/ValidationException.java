package com.example.storemap.exception;

public class ValidationException extends MapSyncException {

    public ValidationException(String message) {
        super(message);
    }
}
