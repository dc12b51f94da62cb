package com.example.storemap.exception;

public class NotFoundException extends MapSyncException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException store(long storeId) {
        return new NotFoundException("Store not found: " + storeId);
    }
}
