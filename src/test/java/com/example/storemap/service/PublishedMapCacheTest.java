package com.example.storemap.service;

import com.example.storemap.kv.KvClient;
import com.example.storemap.model.ElementMetadata;
import com.example.storemap.model.MapElement;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PublishedMapCacheTest {

    @Mock
    private KvClient kvClient;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private PublishedMapCache cache;

    @BeforeEach
    void setUp() {
        cache = new PublishedMapCache(kvClient, objectMapper);
        ReflectionTestUtils.setField(cache, "ttlSeconds", 60L);
    }

    @Test
    void testLookup_MissBeforeFirstEviction() {
        when(kvClient.get("map:published:7:gen")).thenReturn(Optional.empty());
        when(kvClient.get("map:published:7:0")).thenReturn(Optional.empty());

        PublishedMapCache.Lookup lookup = cache.lookup(7L);

        assertEquals(0L, lookup.getGeneration());
        assertTrue(lookup.cached().isEmpty());
    }

    @Test
    void testLookup_HitKeepsMetadataExtensions() throws Exception {
        // Given
        ElementMetadata metadata = ElementMetadata.builder().token("pin-1").build();
        metadata.putExtension("stroke", "#000000");
        MapElement element = MapElement.builder()
                .id(3L).storeId(7L).type("pin").x(1.0).y(2.0).width(3.0).height(4.0).zIndex(2)
                .metadata(metadata).published(true)
                .build();
        when(kvClient.get("map:published:7:gen")).thenReturn(Optional.of("4"));
        when(kvClient.get("map:published:7:4")).thenReturn(Optional.of(objectMapper.writeValueAsString(List.of(element))));

        // When
        List<MapElement> cached = cache.lookup(7L).cached().orElseThrow();

        // Then
        assertEquals(1, cached.size());
        assertEquals(2, cached.get(0).getZIndex());
        assertEquals("pin-1", cached.get(0).token());
        assertEquals("#000000", cached.get(0).getMetadata().getExtensions().get("stroke"));
    }

    @Test
    void testLookup_GenerationFailureIsUncacheable() {
        when(kvClient.get(anyString())).thenThrow(new RuntimeException("Connection refused"));

        PublishedMapCache.Lookup lookup = cache.lookup(7L);
        cache.put(7L, lookup.getGeneration(), List.of());

        assertTrue(lookup.cached().isEmpty());
        verify(kvClient, never()).set(anyString(), anyString(), any());
    }

    @Test
    void testLookup_CorruptEntryIsTreatedAsMiss() {
        when(kvClient.get("map:published:7:gen")).thenReturn(Optional.of("1"));
        when(kvClient.get("map:published:7:1")).thenReturn(Optional.of("{not json"));

        PublishedMapCache.Lookup lookup = cache.lookup(7L);

        assertEquals(1L, lookup.getGeneration());
        assertTrue(lookup.cached().isEmpty());
    }

    @Test
    void testPut_WritesUnderGenerationWithConfiguredTtl() {
        cache.put(7L, 3L, List.of());

        verify(kvClient, times(1)).set(eq("map:published:7:3"), eq("[]"), eq(Duration.ofSeconds(60)));
    }

    @Test
    void testEvict_AdvancesGeneration() {
        InMemoryKvClient kv = new InMemoryKvClient();
        PublishedMapCache realCache = new PublishedMapCache(kv, objectMapper);
        ReflectionTestUtils.setField(realCache, "ttlSeconds", 60L);

        // Given a reader that took generation 0 before an eviction
        long readerGeneration = realCache.lookup(7L).getGeneration();
        realCache.evict(7L);

        // When it writes its result late
        realCache.put(7L, readerGeneration, List.of());

        // Then the next reader does not see it
        PublishedMapCache.Lookup next = realCache.lookup(7L);
        assertEquals(1L, next.getGeneration());
        assertTrue(next.cached().isEmpty());
    }

    @Test
    void testEvict_FailureIsSwallowed() {
        when(kvClient.incr(anyString())).thenThrow(new RuntimeException("Connection refused"));

        assertDoesNotThrow(() -> cache.evict(7L));
        verify(kvClient).incr("map:published:7:gen");
    }
}
