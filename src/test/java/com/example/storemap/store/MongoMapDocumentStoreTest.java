package com.example.storemap.store;

import com.example.storemap.exception.NotFoundException;
import com.example.storemap.exception.TransactionFailureException;
import com.example.storemap.model.ElementMetadata;
import com.example.storemap.model.LocationRollup;
import com.example.storemap.model.MapElement;
import com.example.storemap.model.MapStore;
import com.example.storemap.model.ProductLink;
import com.example.storemap.repo.InventoryRepo;
import com.example.storemap.repo.MapElementRepo;
import com.example.storemap.repo.MapStoreRepo;
import com.example.storemap.repo.ProductLinkRepo;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoMapDocumentStoreTest {

    @Mock
    private MongoTemplate mongo;

    @Mock
    private TransactionTemplate transactions;

    @Mock
    private SequenceGenerator sequences;

    @Mock
    private MapStoreRepo storeRepo;

    @Mock
    private MapElementRepo elementRepo;

    @Mock
    private ProductLinkRepo linkRepo;

    @Mock
    private InventoryRepo inventoryRepo;

    @Mock
    private TransactionStatus transactionStatus;

    private MongoMapDocumentStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        store = new MongoMapDocumentStore(mongo, transactions, sequences, storeRepo, elementRepo, linkRepo,
                inventoryRepo, clock);
    }

    private void runTransactionsInline() {
        when(transactions.execute(any())).thenAnswer(invocation -> {
            TransactionCallback<?> callback = invocation.getArgument(0);
            return callback.doInTransaction(transactionStatus);
        });
    }

    private static LocationRollup rollup(String aisle, String shelf) {
        return LocationRollup.builder()
                .aisles(List.of(aisle)).shelves(List.of(shelf))
                .primaryAisle(aisle).primaryShelf(shelf).locationCount(1)
                .build();
    }

    private void lockReturns(MapStore locked) {
        when(mongo.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class), eq(MapStore.class)))
                .thenReturn(locked);
    }

    @Test
    void testInStoreTransaction_LocksStoreBeforeWork() {
        // Given
        runTransactionsInline();
        lockReturns(MapStore.builder().id(1L).lockVersion(4L).build());

        // When
        String result = store.inStoreTransaction(1L, () -> "done");

        // Then
        assertEquals("done", result);
        verify(mongo, times(1)).findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(MapStore.class));
    }

    @Test
    void testInStoreTransaction_UnknownStore() {
        runTransactionsInline();
        lockReturns(null);

        assertThrows(NotFoundException.class, () -> store.inStoreTransaction(1L, () -> "never"));
    }

    @Test
    void testInStoreTransaction_WrapsDataLayerFailure() {
        runTransactionsInline();
        lockReturns(MapStore.builder().id(1L).build());

        TransactionFailureException e = assertThrows(TransactionFailureException.class,
                () -> store.inStoreTransaction(1L, () -> {
                    throw new IllegalStateException("WriteConflict");
                }));

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testInsertElements_AssignsReservedIds() {
        // Given
        when(sequences.reserve(MongoMapDocumentStore.ELEMENT_SEQUENCE, 2)).thenReturn(11L);
        when(mongo.insertAll(anyCollection())).thenAnswer(invocation -> invocation.getArgument(0));
        MapElement a = MapElement.builder().storeId(1L).type("pin").build();
        MapElement b = MapElement.builder().storeId(1L).type("label").build();

        // When
        List<MapElement> inserted = store.insertElements(List.of(a, b));

        // Then
        assertEquals(List.of(11L, 12L), inserted.stream().map(MapElement::getId).toList());
        assertNull(a.getId());
        verify(mongo).insertAll(any(Collection.class));
    }

    @Test
    void testInsertElements_EmptyListSkipsSequence() {
        assertTrue(store.insertElements(List.of()).isEmpty());
        verifyNoInteractions(sequences, mongo);
    }

    @Test
    void testInsertLinkIfAbsent_SkipsExistingLink() {
        when(linkRepo.existsByStoreIdAndProductIdAndElementId(1L, 10L, 5L)).thenReturn(true);

        assertFalse(store.insertLinkIfAbsent(1L, 10L, 5L));
        verify(mongo, never()).insert(any(ProductLink.class));
    }

    @Test
    void testInsertLinkIfAbsent_InsertsWithSequenceId() {
        when(linkRepo.existsByStoreIdAndProductIdAndElementId(1L, 10L, 5L)).thenReturn(false);
        when(sequences.next(MongoMapDocumentStore.LINK_SEQUENCE)).thenReturn(77L);

        assertTrue(store.insertLinkIfAbsent(1L, 10L, 5L));
        verify(mongo).insert(argThat((ProductLink link) -> link.getId() == 77L
                && link.getProductId() == 10L && link.getElementId() == 5L));
    }

    @Test
    void testFindInventory_EmptyIdsSkipsQuery() {
        assertTrue(store.findInventory(1L, List.of()).isEmpty());
        verifyNoInteractions(inventoryRepo);
    }

    @Test
    void testSaveRollup_NullClearsOnlyRollupKeys() {
        // Given
        when(mongo.updateFirst(any(Query.class), any(Update.class), eq(MapElement.class)))
                .thenReturn(UpdateResult.acknowledged(1L, 1L, null));
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);

        // When
        assertTrue(store.saveRollup(1L, 5L, null));

        // Then
        verify(mongo).updateFirst(any(Query.class), update.capture(), eq(MapElement.class));
        Document unset = (Document) update.getValue().getUpdateObject().get("$unset");
        assertEquals(Set.of("metadata.aisles", "metadata.shelves", "metadata.primaryAisle",
                "metadata.primaryShelf", "metadata.locationCount"), unset.keySet());
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertEquals(Set.of("updatedAt"), set.keySet());
    }

    @Test
    void testSaveRollup_MissingElement() {
        when(mongo.updateFirst(any(Query.class), any(Update.class), eq(MapElement.class)))
                .thenReturn(UpdateResult.acknowledged(0L, 0L, null));

        assertFalse(store.saveRollup(1L, 5L,
                rollup("A", "5")));
    }

    @Test
    void testUpdateElementContent_LeavesRollupUntouched() {
        // Given an element whose in-memory copy carries an outdated rollup
        ElementMetadata metadata = ElementMetadata.builder().token("pin-1").build();
        metadata.applyRollup(rollup("Z", "9"));
        MapElement element = MapElement.builder()
                .id(5L).storeId(1L).type("pin").x(30.0).y(2.0).width(20.0).height(20.0).zIndex(1)
                .metadata(metadata)
                .build();
        when(mongo.updateFirst(any(Query.class), any(Update.class), eq(MapElement.class)))
                .thenReturn(UpdateResult.acknowledged(1L, 1L, null));
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);

        // When
        assertTrue(store.updateElementContent(element));

        // Then
        verify(mongo).updateFirst(any(Query.class), update.capture(), eq(MapElement.class));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertEquals(30.0, set.get("x"));
        assertEquals("pin-1", set.get("metadata.token"));
        assertFalse(set.containsKey("metadata"));
        assertFalse(set.containsKey("metadata.aisles"));
        assertFalse(set.containsKey("metadata.locationCount"));
        assertNull(update.getValue().getUpdateObject().get("$unset"));
    }

    @Test
    void testPing_CountsElements() {
        when(mongo.estimatedCount(MapElement.class)).thenReturn(12L);

        assertEquals(12L, store.ping());
    }
}
