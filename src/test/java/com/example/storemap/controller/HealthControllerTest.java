package com.example.storemap.controller;

import com.example.storemap.kv.KvClient;
import com.example.storemap.store.MapDocumentStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private KvClient kvClient;

    @Mock
    private MapDocumentStore store;

    @Test
    @SuppressWarnings("unchecked")
    void testCheck_ReportsElementCountFromStore() {
        when(store.ping()).thenReturn(42L);
        when(kvClient.get(HealthController.CACHE_PING_KEY)).thenReturn(Optional.empty());

        ResponseEntity<Map<String, Object>> response = new HealthController(kvClient, store).check();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> body = response.getBody();
        assertNotNull(body);
        assertEquals("UP", body.get("status"));
        Map<String, Object> storeCheck = (Map<String, Object>) body.get("store");
        assertEquals("UP", storeCheck.get("status"));
        assertEquals(42L, storeCheck.get("elements"));
        verify(store).ping();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCheck_CacheDownIsNotFatal() {
        when(store.ping()).thenReturn(0L);
        when(kvClient.get(HealthController.CACHE_PING_KEY)).thenThrow(new RuntimeException("Connection refused"));

        ResponseEntity<Map<String, Object>> response = new HealthController(kvClient, store).check();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> cacheCheck = (Map<String, Object>) response.getBody().get("cache");
        assertEquals("DOWN", cacheCheck.get("status"));
        assertEquals("Connection refused", cacheCheck.get("error"));
    }

    @Test
    void testHealth_StoreDownIsServiceUnavailable() {
        when(store.ping()).thenThrow(new RuntimeException("Timed out"));
        when(kvClient.get(HealthController.CACHE_PING_KEY)).thenReturn(Optional.empty());

        WebTestClient.bindToController(new HealthController(kvClient, store)).build()
                .get().uri("/health")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                .expectBody()
                .jsonPath("$.status").isEqualTo("DOWN")
                .jsonPath("$.store.error").isEqualTo("Timed out")
                .jsonPath("$.cache.status").isEqualTo("UP");
    }
}
