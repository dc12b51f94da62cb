package com.example.storemap.store;

import com.example.storemap.exception.MapSyncException;
import com.example.storemap.exception.NotFoundException;
import com.example.storemap.exception.TransactionFailureException;
import com.example.storemap.model.ElementMetadata;
import com.example.storemap.model.InventoryItem;
import com.example.storemap.model.LocationRollup;
import com.example.storemap.model.MapElement;
import com.example.storemap.model.MapStore;
import com.example.storemap.model.ProductLink;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-local store used for development runs and tests. Each store has its own
 * lock; a transaction snapshots the store's rows and restores them if the work fails.
 */
@Component
@ConditionalOnProperty(name = "app.store.backend", havingValue = "memory")
public class InMemoryMapDocumentStore implements MapDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryMapDocumentStore.class);

    private static final Comparator<MapElement> DOCUMENT_ORDER = Comparator
            .comparing((MapElement e) -> e.getZIndex() == null ? 0 : e.getZIndex())
            .thenComparing(MapElement::getId);

    private final Clock clock;
    private final Map<Long, StoreRows> stores = new ConcurrentHashMap<>();
    private final Map<Long, List<InventoryItem>> inventory = new ConcurrentHashMap<>();
    private final AtomicLong elementSequence = new AtomicLong();
    private final AtomicLong linkSequence = new AtomicLong();

    public InMemoryMapDocumentStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Stores are provisioned outside the map core; this registers one directly.
     */
    public MapStore createStore(long storeId, String name) {
        StoreRows rows = new StoreRows(MapStore.builder()
                .id(storeId)
                .name(name)
                .draftChanges(true)
                .updatedAt(Instant.now(clock))
                .build());
        stores.put(storeId, rows);
        return rows.store.toBuilder().build();
    }

    public void addInventory(InventoryItem item) {
        inventory.computeIfAbsent(item.getStoreId(), id -> new ArrayList<>()).add(item);
    }

    private StoreRows rows(long storeId) {
        StoreRows rows = stores.get(storeId);
        if (rows == null) {
            throw NotFoundException.store(storeId);
        }
        return rows;
    }

    private <T> T locked(long storeId, Supplier<T> work) {
        StoreRows rows = rows(storeId);
        rows.lock.lock();
        try {
            return work.get();
        } finally {
            rows.lock.unlock();
        }
    }

    @Override
    public Optional<MapStore> findStore(long storeId) {
        StoreRows rows = stores.get(storeId);
        if (rows == null) {
            return Optional.empty();
        }
        return Optional.of(locked(storeId, () -> rows.store.toBuilder().build()));
    }

    @Override
    public <T> T inStoreTransaction(long storeId, Supplier<T> work) {
        StoreRows rows = rows(storeId);
        rows.lock.lock();
        try {
            if (rows.lock.getHoldCount() > 1) {
                // nested call joins the outer transaction
                return work.get();
            }
            Snapshot snapshot = rows.snapshot();
            try {
                rows.store.setLockVersion(rows.store.getLockVersion() + 1);
                return work.get();
            } catch (MapSyncException e) {
                rows.restore(snapshot);
                throw e;
            } catch (RuntimeException e) {
                rows.restore(snapshot);
                logger.error("Transaction for store {} rolled back", storeId, e);
                throw new TransactionFailureException("Transaction for store " + storeId + " failed: " + e.getMessage(), e);
            }
        } finally {
            rows.lock.unlock();
        }
    }

    @Override
    public List<MapElement> findElements(long storeId) {
        return locked(storeId, () -> rows(storeId).elements.values().stream()
                .sorted(DOCUMENT_ORDER)
                .map(MapElement::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public List<MapElement> findPublishedElements(long storeId) {
        return locked(storeId, () -> rows(storeId).elements.values().stream()
                .filter(MapElement::isPublished)
                .sorted(DOCUMENT_ORDER)
                .map(MapElement::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<MapElement> findElement(long storeId, long elementId) {
        StoreRows rows = stores.get(storeId);
        if (rows == null) {
            return Optional.empty();
        }
        return locked(storeId, () -> Optional.ofNullable(rows.elements.get(elementId)).map(MapElement::copy));
    }

    @Override
    public List<MapElement> findElementsByToken(long storeId, String token) {
        return locked(storeId, () -> rows(storeId).elements.values().stream()
                .filter(e -> Objects.equals(token, e.token()))
                .map(MapElement::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public MapElement insertElement(MapElement element) {
        long storeId = element.getStoreId();
        return locked(storeId, () -> {
            MapElement row = element.copy();
            row.setId(elementSequence.incrementAndGet());
            row.setUpdatedAt(Instant.now(clock));
            rows(storeId).elements.put(row.getId(), row);
            return row.copy();
        });
    }

    @Override
    public List<MapElement> insertElements(List<MapElement> elements) {
        List<MapElement> inserted = new ArrayList<>(elements.size());
        for (MapElement element : elements) {
            inserted.add(insertElement(element));
        }
        return inserted;
    }

    @Override
    public boolean updateElementContent(MapElement element) {
        long storeId = element.getStoreId();
        return locked(storeId, () -> {
            MapElement row = rows(storeId).elements.get(element.getId());
            if (row == null) {
                return false;
            }
            LocationRollup rollup = row.getMetadata() == null ? null : row.getMetadata().getRollup();
            MapElement updated = element.copy();
            if (updated.getMetadata() == null) {
                updated.setMetadata(new ElementMetadata());
            }
            updated.getMetadata().applyRollup(rollup);
            updated.setPublishedAt(row.getPublishedAt());
            updated.setUpdatedAt(Instant.now(clock));
            rows(storeId).elements.put(updated.getId(), updated);
            return true;
        });
    }

    @Override
    public boolean saveRollup(long storeId, long elementId, LocationRollup rollup) {
        return locked(storeId, () -> {
            MapElement row = rows(storeId).elements.get(elementId);
            if (row == null) {
                return false;
            }
            if (row.getMetadata() == null) {
                row.setMetadata(new ElementMetadata());
            }
            row.getMetadata().applyRollup(rollup);
            row.setUpdatedAt(Instant.now(clock));
            return true;
        });
    }

    @Override
    public boolean deleteElement(long storeId, long elementId) {
        return locked(storeId, () -> {
            StoreRows rows = rows(storeId);
            rows.links.removeIf(link -> link.getElementId() == elementId);
            return rows.elements.remove(elementId) != null;
        });
    }

    @Override
    public int deleteAllElements(long storeId) {
        return locked(storeId, () -> {
            StoreRows rows = rows(storeId);
            int count = rows.elements.size();
            rows.elements.clear();
            rows.links.clear();
            return count;
        });
    }

    @Override
    public int publishAllElements(long storeId, Instant publishedAt) {
        return locked(storeId, () -> {
            Collection<MapElement> elements = rows(storeId).elements.values();
            for (MapElement element : elements) {
                element.setPublished(true);
                element.setPublishedAt(publishedAt);
            }
            return elements.size();
        });
    }

    @Override
    public long countUnpublishedElements(long storeId) {
        return locked(storeId, () -> rows(storeId).elements.values().stream()
                .filter(e -> !e.isPublished())
                .count());
    }

    @Override
    public void markDraft(long storeId) {
        locked(storeId, () -> {
            MapStore store = rows(storeId).store;
            store.setDraftChanges(true);
            store.setUpdatedAt(Instant.now(clock));
            return null;
        });
    }

    @Override
    public void markPublished(long storeId, Instant publishedAt) {
        locked(storeId, () -> {
            MapStore store = rows(storeId).store;
            store.setDraftChanges(false);
            store.setPublishedAt(publishedAt);
            store.setUpdatedAt(Instant.now(clock));
            return null;
        });
    }

    @Override
    public void setMapImageUrl(long storeId, String imageUrl) {
        locked(storeId, () -> {
            MapStore store = rows(storeId).store;
            store.setMapImageUrl(imageUrl);
            store.setUpdatedAt(Instant.now(clock));
            return null;
        });
    }

    @Override
    public List<ProductLink> findLinksForStore(long storeId) {
        return locked(storeId, () -> rows(storeId).links.stream()
                .map(InMemoryMapDocumentStore::copyOf)
                .collect(Collectors.toList()));
    }

    @Override
    public List<ProductLink> findLinks(long storeId, long elementId) {
        return locked(storeId, () -> rows(storeId).links.stream()
                .filter(link -> link.getElementId() == elementId)
                .map(InMemoryMapDocumentStore::copyOf)
                .collect(Collectors.toList()));
    }

    @Override
    public boolean insertLinkIfAbsent(long storeId, long productId, long elementId) {
        return locked(storeId, () -> {
            StoreRows rows = rows(storeId);
            if (!rows.elements.containsKey(elementId)) {
                throw new IllegalStateException("Element " + elementId + " does not exist in store " + storeId);
            }
            boolean exists = rows.links.stream()
                    .anyMatch(link -> link.getProductId() == productId && link.getElementId() == elementId);
            if (exists) {
                return false;
            }
            rows.links.add(ProductLink.builder()
                    .id(linkSequence.incrementAndGet())
                    .storeId(storeId)
                    .productId(productId)
                    .elementId(elementId)
                    .createdAt(Instant.now(clock))
                    .build());
            return true;
        });
    }

    @Override
    public int deleteLinks(long storeId, long elementId, Collection<Long> productIds) {
        Set<Long> targets = new HashSet<>(productIds);
        return locked(storeId, () -> {
            List<ProductLink> links = rows(storeId).links;
            int before = links.size();
            links.removeIf(link -> link.getElementId() == elementId && targets.contains(link.getProductId()));
            return before - links.size();
        });
    }

    @Override
    public int deleteAllLinks(long storeId, long elementId) {
        return locked(storeId, () -> {
            List<ProductLink> links = rows(storeId).links;
            int before = links.size();
            links.removeIf(link -> link.getElementId() == elementId);
            return before - links.size();
        });
    }

    @Override
    public List<InventoryItem> findInventory(long storeId, Collection<Long> productIds) {
        Set<Long> wanted = new HashSet<>(productIds);
        return inventory.getOrDefault(storeId, List.of()).stream()
                .filter(item -> wanted.contains(item.getProductId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<InventoryItem> searchInventory(long storeId, String search, int limit) {
        String needle = search == null ? "" : search.trim().toLowerCase(Locale.ROOT);
        return inventory.getOrDefault(storeId, List.of()).stream()
                .filter(item -> needle.isEmpty()
                        || contains(item.getProductName(), needle)
                        || contains(item.getSku(), needle))
                .sorted(Comparator.comparing(InventoryItem::getProductName, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(InventoryItem::getProductId))
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    @Override
    public long ping() {
        return stores.values().stream().mapToLong(rows -> rows.elements.size()).sum();
    }

    private static ProductLink copyOf(ProductLink link) {
        return ProductLink.builder()
                .id(link.getId())
                .storeId(link.getStoreId())
                .productId(link.getProductId())
                .elementId(link.getElementId())
                .createdAt(link.getCreatedAt())
                .build();
    }

    private static final class StoreRows {
        private final ReentrantLock lock = new ReentrantLock();
        private MapStore store;
        private final TreeMap<Long, MapElement> elements = new TreeMap<>();
        private final List<ProductLink> links = new ArrayList<>();

        private StoreRows(MapStore store) {
            this.store = store;
        }

        private Snapshot snapshot() {
            TreeMap<Long, MapElement> elementCopy = new TreeMap<>();
            elements.forEach((id, element) -> elementCopy.put(id, element.copy()));
            List<ProductLink> linkCopy = links.stream().map(InMemoryMapDocumentStore::copyOf).collect(Collectors.toList());
            return new Snapshot(store.toBuilder().build(), elementCopy, linkCopy);
        }

        private void restore(Snapshot snapshot) {
            store = snapshot.getStore();
            elements.clear();
            elements.putAll(snapshot.getElements());
            links.clear();
            links.addAll(snapshot.getLinks());
        }
    }

    @Value
    private static class Snapshot {
        MapStore store;
        TreeMap<Long, MapElement> elements;
        List<ProductLink> links;
    }
}
