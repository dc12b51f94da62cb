package com.example.storemap.service;

import com.example.storemap.exception.NotFoundException;
import com.example.storemap.exception.ValidationException;
import com.example.storemap.model.MapElement;
import com.example.storemap.model.MapStore;
import com.example.storemap.store.MapDocumentStore;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Reads of the map document, plus the background-image handle the upload flow hands over.
 */
@Service
public class MapQueryService {

    private static final Logger logger = LoggerFactory.getLogger(MapQueryService.class);

    private final MapDocumentStore store;
    private final PublishedMapCache publishedMapCache;

    public MapQueryService(MapDocumentStore store, PublishedMapCache publishedMapCache) {
        this.store = store;
        this.publishedMapCache = publishedMapCache;
    }

    /**
     * The editable document: every element, drafts included, in z-order.
     */
    public MapView getMap(long storeId) {
        MapStore mapStore = requireStore(storeId);
        return new MapView(mapStore, store.findElements(storeId));
    }

    /**
     * What shoppers see: published elements only, served from the cache when possible.
     */
    public PublishedMapView getPublishedMap(long storeId) {
        MapStore mapStore = requireStore(storeId);
        PublishedMapCache.Lookup lookup = publishedMapCache.lookup(storeId);
        List<MapElement> elements;
        if (lookup.cached().isPresent()) {
            elements = lookup.getElements();
        } else {
            elements = store.findPublishedElements(storeId);
            publishedMapCache.put(storeId, lookup.getGeneration(), elements);
        }
        return new PublishedMapView(storeId, mapStore.getMapImageUrl(), mapStore.getPublishedAt(), elements);
    }

    /**
     * Records the URL of an uploaded background image. The URL is stored as given.
     */
    public void setMapImage(long storeId, String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new ValidationException("imageUrl is required");
        }
        requireStore(storeId);
        store.setMapImageUrl(storeId, imageUrl);
        publishedMapCache.evict(storeId);
    }

    /**
     * Removes the background image and every element (with their links) in one transaction.
     *
     * @return number of elements removed
     */
    public int clearMap(long storeId) {
        int removed = store.inStoreTransaction(storeId, () -> {
            store.setMapImageUrl(storeId, null);
            return store.deleteAllElements(storeId);
        });
        publishedMapCache.evict(storeId);
        logger.info("Cleared map of store {}: {} elements removed", storeId, removed);
        return removed;
    }

    private MapStore requireStore(long storeId) {
        return store.findStore(storeId).orElseThrow(() -> NotFoundException.store(storeId));
    }

    @Value
    public static class MapView {
        MapStore store;
        List<MapElement> elements;
    }

    @Value
    public static class PublishedMapView {
        long storeId;
        String mapImageUrl;
        Instant publishedAt;
        List<MapElement> elements;
    }
}
