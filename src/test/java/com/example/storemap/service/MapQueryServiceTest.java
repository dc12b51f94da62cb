package com.example.storemap.service;

import com.example.storemap.exception.NotFoundException;
import com.example.storemap.exception.ValidationException;
import com.example.storemap.store.InMemoryMapDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.example.storemap.service.MapServices.pin;
import static com.example.storemap.service.MapServices.product;
import static com.example.storemap.service.MapServices.rect;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class MapQueryServiceTest {

    private InMemoryMapDocumentStore store;
    private MapServices services;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryMapDocumentStore(MapServices.CLOCK));
        services = new MapServices(store);
        store.createStore(1L, "Main Street");
        store.addInventory(product(1L, 10L, "Whole Milk", "A", "3"));
    }

    @Test
    void testGetPublishedMap_FallsThroughThenServesFromCache() {
        // Given
        services.bulkReconciler.save(1L, List.of(pin("a"), rect("b", 1, 1)));
        services.publishStateMachine.publish(1L);

        // When
        MapQueryService.PublishedMapView first = services.mapQueryService.getPublishedMap(1L);
        MapQueryService.PublishedMapView second = services.mapQueryService.getPublishedMap(1L);

        // Then
        assertEquals(2, first.getElements().size());
        assertEquals(2, second.getElements().size());
        assertEquals("a", second.getElements().get(0).token());
        assertTrue(services.cache.lookup(1L).cached().isPresent());
        verify(store, times(1)).findPublishedElements(1L);
    }

    @Test
    void testGetPublishedMap_PublishDuringStoreReadIsNotHiddenByCache() {
        // Given a published map with one element and a second element waiting as a draft
        services.bulkReconciler.save(1L, List.of(pin("a")));
        services.publishStateMachine.publish(1L);
        services.incrementalMutator.create(1L, pin("b"));
        AtomicBoolean publishOnce = new AtomicBoolean(true);
        doAnswer(invocation -> {
            Object stale = invocation.callRealMethod();
            if (publishOnce.getAndSet(false)) {
                services.publishStateMachine.publish(1L);
            }
            return stale;
        }).when(store).findPublishedElements(1L);

        // When the publish commits between the store read and the cache write
        MapQueryService.PublishedMapView during = services.mapQueryService.getPublishedMap(1L);
        MapQueryService.PublishedMapView after = services.mapQueryService.getPublishedMap(1L);

        // Then the stale read is not what later readers get
        assertEquals(1, during.getElements().size());
        assertEquals(2, store.findPublishedElements(1L).size());
        assertEquals(2, after.getElements().size());
    }

    @Test
    void testGetPublishedMap_HidesDrafts() {
        services.bulkReconciler.save(1L, List.of(pin("a")));
        services.publishStateMachine.publish(1L);
        services.incrementalMutator.create(1L, pin("b"));

        MapQueryService.PublishedMapView view = services.mapQueryService.getPublishedMap(1L);

        assertEquals(1, view.getElements().size());
        assertEquals(MapServices.CLOCK.instant(), view.getPublishedAt());
        assertEquals(2, services.mapQueryService.getMap(1L).getElements().size());
    }

    @Test
    void testClearMap_RemovesImageElementsAndLinks() {
        services.mapQueryService.setMapImage(1L, "https://cdn.example.com/maps/1.png");
        services.bulkReconciler.save(1L, List.of(pin("a"), rect("b", 1, 1)));
        services.linkSynchronizer.link(1L, "a", List.of(10L));

        int removed = services.mapQueryService.clearMap(1L);

        assertEquals(2, removed);
        assertNull(store.findStore(1L).orElseThrow().getMapImageUrl());
        assertTrue(store.findElements(1L).isEmpty());
        assertTrue(store.findLinksForStore(1L).isEmpty());
    }

    @Test
    void testSetMapImage() {
        services.mapQueryService.setMapImage(1L, "https://cdn.example.com/maps/1.png");

        assertEquals("https://cdn.example.com/maps/1.png", services.mapQueryService.getMap(1L).getStore().getMapImageUrl());
        assertThrows(ValidationException.class, () -> services.mapQueryService.setMapImage(1L, " "));
        assertThrows(NotFoundException.class, () -> services.mapQueryService.setMapImage(2L, "x.png"));
    }

    @Test
    void testGetMap_UnknownStore() {
        assertThrows(NotFoundException.class, () -> services.mapQueryService.getMap(5L));
        assertThrows(NotFoundException.class, () -> services.mapQueryService.getPublishedMap(5L));
    }
}
