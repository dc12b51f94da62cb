package com.example.storemap.service;

import com.example.storemap.kv.KvClient;
import com.example.storemap.model.MapElement;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Read-through cache of the published elements of each store, kept in the KV store.
 * The cache is an optimisation only: every failure is logged and treated as a miss.
 *
 * <p>Entries are keyed by a per-store generation that {@link #evict(long)} bumps. A reader
 * takes the generation before it reads the store and writes its result under that
 * generation, so a result read before a concurrent publish lands under a key that
 * nobody reads any more.</p>
 */
@Service
public class PublishedMapCache {

    private static final Logger logger = LoggerFactory.getLogger(PublishedMapCache.class);

    private static final TypeReference<List<MapElement>> ELEMENT_LIST = new TypeReference<>() {};

    /** Generation of a lookup whose result must not be cached. */
    static final long UNCACHEABLE = -1L;

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;

    @Value("${app.cache.published-map-ttl-sec:300}")
    private long ttlSeconds;

    public PublishedMapCache(KvClient kvClient, ObjectMapper objectMapper) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
    }

    static String generationKey(long storeId) {
        return "map:published:" + storeId + ":gen";
    }

    static String key(long storeId, long generation) {
        return "map:published:" + storeId + ":" + generation;
    }

    /**
     * Looks up the cached elements. On a miss, the returned generation is the one to
     * pass to {@link #put} once the elements have been read from the store.
     */
    public Lookup lookup(long storeId) {
        long generation;
        try {
            generation = kvClient.get(generationKey(storeId)).map(Long::parseLong).orElse(0L);
        } catch (Exception e) {
            logger.warn("Published map cache generation read failed for store {}", storeId, e);
            return new Lookup(UNCACHEABLE, null);
        }
        try {
            Optional<String> cached = kvClient.get(key(storeId, generation));
            if (cached.isEmpty()) {
                return new Lookup(generation, null);
            }
            return new Lookup(generation, objectMapper.readValue(cached.get(), ELEMENT_LIST));
        } catch (Exception e) {
            logger.warn("Published map cache read failed for store {}", storeId, e);
            return new Lookup(generation, null);
        }
    }

    public void put(long storeId, long generation, List<MapElement> elements) {
        if (generation == UNCACHEABLE) {
            return;
        }
        try {
            kvClient.set(key(storeId, generation), objectMapper.writeValueAsString(elements), Duration.ofSeconds(ttlSeconds));
        } catch (Exception e) {
            logger.warn("Published map cache write failed for store {}", storeId, e);
        }
    }

    public void evict(long storeId) {
        try {
            long generation = kvClient.incr(generationKey(storeId));
            logger.debug("Published map of store {} moved to cache generation {}", storeId, generation);
        } catch (Exception e) {
            logger.warn("Published map cache eviction failed for store {}", storeId, e);
        }
    }

    @lombok.Value
    public static class Lookup {
        long generation;
        List<MapElement> elements;

        public Optional<List<MapElement>> cached() {
            return Optional.ofNullable(elements);
        }
    }
}
