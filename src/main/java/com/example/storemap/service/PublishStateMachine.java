package com.example.storemap.service;

import com.example.storemap.exception.NotFoundException;
import com.example.storemap.model.MapStore;
import com.example.storemap.store.MapDocumentStore;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Draft/published lifecycle of a store map.
 *
 * <p>A map is in draft until it is explicitly published. Publishing stamps every element
 * that exists at that moment; anything created or edited afterwards is unpublished
 * again, and {@link #markDirty(long)} flips the store back to draft. There is no explicit
 * unpublish.</p>
 */
@Service
public class PublishStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(PublishStateMachine.class);

    private final MapDocumentStore store;
    private final PublishedMapCache publishedMapCache;
    private final Clock clock;

    public PublishStateMachine(MapDocumentStore store, PublishedMapCache publishedMapCache, Clock clock) {
        this.store = store;
        this.publishedMapCache = publishedMapCache;
        this.clock = clock;
    }

    /**
     * The one place that moves a store back to draft. Every mutator calls it; setting
     * the flag is idempotent, so concurrent callers need no coordination.
     */
    public void markDirty(long storeId) {
        store.markDraft(storeId);
    }

    public PublishResult publish(long storeId) {
        Instant now = Instant.now(clock);
        int published = store.inStoreTransaction(storeId, () -> {
            int count = store.publishAllElements(storeId, now);
            store.markPublished(storeId, now);
            return count;
        });
        publishedMapCache.evict(storeId);
        logger.info("Published map of store {}: {} elements", storeId, published);
        return new PublishResult(true, published, now);
    }

    /**
     * Draft status computed from the per-element flags; the store flag only ever adds to it.
     */
    public PublishStatus status(long storeId) {
        MapStore mapStore = store.findStore(storeId).orElseThrow(() -> NotFoundException.store(storeId));
        long unpublished = store.countUnpublishedElements(storeId);
        if (unpublished > 0 && !mapStore.isDraftChanges()) {
            logger.debug("Store {} has {} unpublished elements but a clean draft flag; repairing", storeId, unpublished);
            markDirty(storeId);
        }
        boolean hasDraftChanges = mapStore.isDraftChanges() || unpublished > 0 || mapStore.getPublishedAt() == null;
        return new PublishStatus(mapStore.getPublishedAt(), hasDraftChanges, unpublished);
    }

    /**
     * Result of a publish operation
     */
    @Value
    public static class PublishResult {
        boolean success;
        int publishedCount;
        Instant publishedAt;
    }

    @Value
    public static class PublishStatus {
        Instant lastPublishedAt;
        boolean hasDraftChanges;
        long unpublishedElementCount;
    }
}
