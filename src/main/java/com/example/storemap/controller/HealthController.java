package com.example.storemap.controller;

import com.example.storemap.kv.KvClient;
import com.example.storemap.store.MapDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the map service. The document store is required; the published-map cache is not,
 * so only a store failure turns the response into a 503.
 */
@RestController
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    static final String CACHE_PING_KEY = "map:health";

    private final KvClient kvClient;
    private final MapDocumentStore store;

    public HealthController(KvClient kvClient, MapDocumentStore store) {
        this.kvClient = kvClient;
        this.store = store;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return MapAdminController.blocking(this::check);
    }

    ResponseEntity<Map<String, Object>> check() {
        Map<String, Object> storeCheck = checkStore();
        Map<String, Object> cacheCheck = checkCache();
        boolean storeUp = "UP".equals(storeCheck.get("status"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", storeUp ? "UP" : "DOWN");
        body.put("store", storeCheck);
        body.put("cache", cacheCheck);
        return ResponseEntity.status(storeUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private Map<String, Object> checkStore() {
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            long elements = store.ping();
            result.put("status", "UP");
            result.put("elements", elements);
        } catch (Exception e) {
            logger.error("Map store health check failed", e);
            result.put("status", "DOWN");
            result.put("error", String.valueOf(e.getMessage()));
        }
        return result;
    }

    private Map<String, Object> checkCache() {
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            kvClient.get(CACHE_PING_KEY);
            result.put("status", "UP");
        } catch (Exception e) {
            logger.warn("Published map cache unreachable: {}", e.getMessage());
            result.put("status", "DOWN");
            result.put("error", String.valueOf(e.getMessage()));
        }
        return result;
    }
}
