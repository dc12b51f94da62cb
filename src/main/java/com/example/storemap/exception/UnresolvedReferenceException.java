package com.example.storemap.exception;

/**
 * A pin or element reference matched neither a persisted id nor a client token.
 * During normal editing this means the element has not been saved yet, so the
 * message tells the user to save the map and retry.
 */
public class UnresolvedReferenceException extends NotFoundException {

    private final long storeId;
    private final String reference;

    public UnresolvedReferenceException(long storeId, String reference, String action) {
        super("Pin not found: element '" + reference + "' is not saved yet. "
                + "Please save your map first, then try " + action + " again.");
        this.storeId = storeId;
        this.reference = reference;
    }

    public long getStoreId() {
        return storeId;
    }

    public String getReference() {
        return reference;
    }
}
