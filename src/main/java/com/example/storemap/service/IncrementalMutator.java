package com.example.storemap.service;

import com.example.storemap.dto.ElementPayload;
import com.example.storemap.exception.NotFoundException;
import com.example.storemap.exception.UnresolvedReferenceException;
import com.example.storemap.model.MapElement;
import com.example.storemap.store.MapDocumentStore;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single-element writes used by the editor's auto-save. Each call touches one row
 * (plus its links on delete) and never takes the store lock.
 */
@Service
public class IncrementalMutator {

    private static final Logger logger = LoggerFactory.getLogger(IncrementalMutator.class);

    private final MapDocumentStore store;
    private final IdentityResolver identityResolver;
    private final ElementPayloadMapper payloadMapper;
    private final PublishStateMachine publishStateMachine;
    private final PublishedMapCache publishedMapCache;

    public IncrementalMutator(MapDocumentStore store, IdentityResolver identityResolver,
                              ElementPayloadMapper payloadMapper, PublishStateMachine publishStateMachine,
                              PublishedMapCache publishedMapCache) {
        this.store = store;
        this.identityResolver = identityResolver;
        this.payloadMapper = payloadMapper;
        this.publishStateMachine = publishStateMachine;
        this.publishedMapCache = publishedMapCache;
    }

    /**
     * Inserts a new, unpublished element. Its token is the payload token, or else the
     * editor's own id for the element.
     */
    public CreateResult create(long storeId, ElementPayload payload) {
        requireStore(storeId);
        payloadMapper.validateForInsert(payload, "element");
        String token = payloadMapper.tokenOf(payload);
        if (token == null && payload.getId() != null && !payload.getId().isBlank()) {
            token = payload.getId();
        }

        MapElement created = store.insertElement(payloadMapper.toElement(storeId, payload, token));
        publishStateMachine.markDirty(storeId);
        publishedMapCache.evict(storeId);
        logger.debug("Created element {} (token {}) in store {}", created.getId(), token, storeId);
        return new CreateResult(true, created.getId(), token);
    }

    /**
     * Applies the supplied fields to an existing element and returns it to draft.
     *
     * @throws UnresolvedReferenceException if {@code reference} names no saved element
     */
    public MapElement update(long storeId, String reference, ElementPayload payload) {
        requireStore(storeId);
        long elementId = identityResolver.resolve(storeId, reference, "saving this element");
        MapElement element = store.findElement(storeId, elementId)
                .orElseThrow(() -> new UnresolvedReferenceException(storeId, reference, "saving this element"));

        payloadMapper.applyUpdate(element, payload);
        element.setPublished(false);
        if (!store.updateElementContent(element)) {
            // removed concurrently between read and write
            throw new UnresolvedReferenceException(storeId, reference, "saving this element");
        }
        publishStateMachine.markDirty(storeId);
        publishedMapCache.evict(storeId);
        logger.debug("Updated element {} in store {}", elementId, storeId);
        return store.findElement(storeId, elementId).orElse(element);
    }

    /**
     * Removes an element together with its product links.
     *
     * @throws UnresolvedReferenceException if {@code reference} names no saved element
     */
    public long delete(long storeId, String reference) {
        requireStore(storeId);
        long elementId = identityResolver.resolve(storeId, reference, "deleting this element");
        if (!store.deleteElement(storeId, elementId)) {
            // removed concurrently between resolve and delete
            throw new UnresolvedReferenceException(storeId, reference, "deleting this element");
        }
        publishedMapCache.evict(storeId);
        logger.debug("Deleted element {} from store {}", elementId, storeId);
        return elementId;
    }

    private void requireStore(long storeId) {
        if (store.findStore(storeId).isEmpty()) {
            throw NotFoundException.store(storeId);
        }
    }

    @Value
    public static class CreateResult {
        boolean success;
        long elementId;
        String token;
    }
}
