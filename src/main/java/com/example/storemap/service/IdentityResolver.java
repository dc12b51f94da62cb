package com.example.storemap.service;

import com.example.storemap.exception.UnresolvedReferenceException;
import com.example.storemap.model.MapElement;
import com.example.storemap.store.MapDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalLong;

/**
 * Maps a client-held element reference to the id of the row that currently represents it.
 *
 * <p>The editor holds either the persisted id it received on the last load, or the token
 * it generated when the element was placed. The reference is tried as an id first and
 * as a token second. That order is fixed: if a numeric token happens to equal the id of
 * another row in the same store, the id wins.</p>
 */
@Service
public class IdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

    /** Ids are 32-bit; longer numbers are editor timestamps used as tokens. */
    static final long MAX_ELEMENT_ID = Integer.MAX_VALUE;

    private final MapDocumentStore store;

    public IdentityResolver(MapDocumentStore store) {
        this.store = store;
    }

    /**
     * @param action what the caller was doing, used in the "save first" message
     * @throws UnresolvedReferenceException if neither the id nor the token matches
     */
    public long resolve(long storeId, String reference, String action) {
        OptionalLong resolved = tryResolve(storeId, reference);
        if (resolved.isEmpty()) {
            throw new UnresolvedReferenceException(storeId, reference, action);
        }
        return resolved.getAsLong();
    }

    public OptionalLong tryResolve(long storeId, String reference) {
        if (reference == null || reference.isBlank()) {
            return OptionalLong.empty();
        }

        OptionalLong candidateId = parseElementId(reference);
        if (candidateId.isPresent() && store.findElement(storeId, candidateId.getAsLong()).isPresent()) {
            return candidateId;
        }

        List<MapElement> byToken = store.findElementsByToken(storeId, reference);
        if (byToken.size() == 1) {
            return OptionalLong.of(byToken.get(0).getId());
        }
        if (byToken.size() > 1) {
            logger.warn("Token {} matches {} elements in store {}; not resolving", reference, byToken.size(), storeId);
        } else {
            logger.debug("Reference {} does not resolve in store {}", reference, storeId);
        }
        return OptionalLong.empty();
    }

    static OptionalLong parseElementId(String reference) {
        String text = reference.trim();
        if (text.isEmpty() || text.length() > 10) {
            return OptionalLong.empty();
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalLong.empty();
            }
        }
        long value = Long.parseLong(text);
        if (value < 1 || value > MAX_ELEMENT_ID) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(value);
    }
}
