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
import com.example.storemap.repo.InventoryRepo;
import com.example.storemap.repo.MapElementRepo;
import com.example.storemap.repo.MapStoreRepo;
import com.example.storemap.repo.ProductLinkRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

@Component
@ConditionalOnProperty(name = "app.store.backend", havingValue = "mongo", matchIfMissing = true)
public class MongoMapDocumentStore implements MapDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoMapDocumentStore.class);

    static final String ELEMENT_SEQUENCE = "map_elements";
    static final String LINK_SEQUENCE = "product_map_links";

    static final List<String> ROLLUP_KEYS = List.of("aisles", "shelves", "primaryAisle", "primaryShelf", "locationCount");

    private final MongoTemplate mongo;
    private final TransactionTemplate transactions;
    private final SequenceGenerator sequences;
    private final MapStoreRepo storeRepo;
    private final MapElementRepo elementRepo;
    private final ProductLinkRepo linkRepo;
    private final InventoryRepo inventoryRepo;
    private final Clock clock;

    @Autowired
    public MongoMapDocumentStore(MongoTemplate mongo, TransactionTemplate transactions, SequenceGenerator sequences,
                                 MapStoreRepo storeRepo, MapElementRepo elementRepo, ProductLinkRepo linkRepo,
                                 InventoryRepo inventoryRepo, Clock clock) {
        this.mongo = mongo;
        this.transactions = transactions;
        this.sequences = sequences;
        this.storeRepo = storeRepo;
        this.elementRepo = elementRepo;
        this.linkRepo = linkRepo;
        this.inventoryRepo = inventoryRepo;
        this.clock = clock;
    }

    @Override
    public Optional<MapStore> findStore(long storeId) {
        return storeRepo.findById(storeId);
    }

    @Override
    public <T> T inStoreTransaction(long storeId, Supplier<T> work) {
        try {
            return transactions.execute(status -> {
                lockStore(storeId);
                return work.get();
            });
        } catch (MapSyncException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Transaction for store {} rolled back", storeId, e);
            throw new TransactionFailureException("Transaction for store " + storeId + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Writing the store document inside the transaction makes any concurrent
     * transaction on the same store fail with a write conflict instead of interleaving.
     */
    private void lockStore(long storeId) {
        MapStore locked = mongo.findAndModify(
                query(where("id").is(storeId)),
                new Update().inc("lockVersion", 1).set("updatedAt", Instant.now(clock)),
                FindAndModifyOptions.options().returnNew(true),
                MapStore.class);
        if (locked == null) {
            throw NotFoundException.store(storeId);
        }
    }

    @Override
    public List<MapElement> findElements(long storeId) {
        Query q = query(where("storeId").is(storeId)).with(Sort.by("zIndex", "id"));
        return mongo.find(q, MapElement.class);
    }

    @Override
    public List<MapElement> findPublishedElements(long storeId) {
        Query q = query(where("storeId").is(storeId).and("published").is(true)).with(Sort.by("zIndex", "id"));
        return mongo.find(q, MapElement.class);
    }

    @Override
    public Optional<MapElement> findElement(long storeId, long elementId) {
        return elementRepo.findByIdAndStoreId(elementId, storeId);
    }

    @Override
    public List<MapElement> findElementsByToken(long storeId, String token) {
        return elementRepo.findByStoreIdAndMetadataToken(storeId, token);
    }

    @Override
    public MapElement insertElement(MapElement element) {
        MapElement row = element.copy();
        row.setId(sequences.next(ELEMENT_SEQUENCE));
        row.setUpdatedAt(Instant.now(clock));
        return mongo.insert(row);
    }

    @Override
    public List<MapElement> insertElements(List<MapElement> elements) {
        if (elements.isEmpty()) {
            return List.of();
        }
        long nextId = sequences.reserve(ELEMENT_SEQUENCE, elements.size());
        Instant now = Instant.now(clock);
        List<MapElement> rows = new ArrayList<>(elements.size());
        for (MapElement element : elements) {
            MapElement row = element.copy();
            row.setId(nextId++);
            row.setUpdatedAt(now);
            rows.add(row);
        }
        return new ArrayList<>(mongo.insertAll(rows));
    }

    @Override
    public boolean updateElementContent(MapElement element) {
        Update update = new Update()
                .set("type", element.getType())
                .set("name", element.getName())
                .set("x", element.getX())
                .set("y", element.getY())
                .set("width", element.getWidth())
                .set("height", element.getHeight())
                .set("zIndex", element.getZIndex())
                .set("colorPrimary", element.getColorPrimary())
                .set("published", element.isPublished())
                .set("updatedAt", Instant.now(clock));
        ElementMetadata metadata = element.getMetadata();
        if (metadata != null) {
            // rollup keys are written only by saveRollup
            update.set("metadata.token", metadata.getToken())
                    .set("metadata.type", metadata.getType())
                    .set("metadata.imageUrl", metadata.getImageUrl())
                    .set("metadata.extensions", metadata.getExtensions());
        }
        return mongo.updateFirst(elementQuery(element.getStoreId(), element.getId()), update, MapElement.class)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean saveRollup(long storeId, long elementId, LocationRollup rollup) {
        Update update = new Update().set("updatedAt", Instant.now(clock));
        if (rollup == null) {
            for (String key : ROLLUP_KEYS) {
                update.unset("metadata." + key);
            }
        } else {
            update.set("metadata.aisles", rollup.getAisles())
                    .set("metadata.shelves", rollup.getShelves())
                    .set("metadata.primaryAisle", rollup.getPrimaryAisle())
                    .set("metadata.primaryShelf", rollup.getPrimaryShelf())
                    .set("metadata.locationCount", rollup.getLocationCount());
        }
        return mongo.updateFirst(elementQuery(storeId, elementId), update, MapElement.class).getMatchedCount() > 0;
    }

    private static Query elementQuery(long storeId, long elementId) {
        return query(where("id").is(elementId).and("storeId").is(storeId));
    }

    @Override
    public boolean deleteElement(long storeId, long elementId) {
        Boolean deleted = transactions.execute(status -> {
            linkRepo.deleteByStoreIdAndElementId(storeId, elementId);
            return mongo.remove(elementQuery(storeId, elementId), MapElement.class)
                    .getDeletedCount() > 0;
        });
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    public int deleteAllElements(long storeId) {
        Long deleted = transactions.execute(status -> {
            long links = linkRepo.deleteByStoreId(storeId);
            logger.debug("Cascade removed {} product links of store {}", links, storeId);
            return mongo.remove(query(where("storeId").is(storeId)), MapElement.class).getDeletedCount();
        });
        return deleted == null ? 0 : deleted.intValue();
    }

    @Override
    public int publishAllElements(long storeId, Instant publishedAt) {
        long matched = mongo.updateMulti(
                query(where("storeId").is(storeId)),
                new Update().set("published", true).set("publishedAt", publishedAt),
                MapElement.class).getMatchedCount();
        return (int) matched;
    }

    @Override
    public long countUnpublishedElements(long storeId) {
        return elementRepo.countByStoreIdAndPublishedFalse(storeId);
    }

    @Override
    public void markDraft(long storeId) {
        updateStore(storeId, new Update().set("draftChanges", true));
    }

    @Override
    public void markPublished(long storeId, Instant publishedAt) {
        updateStore(storeId, new Update().set("draftChanges", false).set("publishedAt", publishedAt));
    }

    @Override
    public void setMapImageUrl(long storeId, String imageUrl) {
        Update update = imageUrl == null ? new Update().unset("mapImageUrl") : new Update().set("mapImageUrl", imageUrl);
        updateStore(storeId, update);
    }

    private void updateStore(long storeId, Update update) {
        long matched = mongo.updateFirst(query(where("id").is(storeId)), update.set("updatedAt", Instant.now(clock)),
                MapStore.class).getMatchedCount();
        if (matched == 0) {
            throw NotFoundException.store(storeId);
        }
    }

    @Override
    public List<ProductLink> findLinksForStore(long storeId) {
        return linkRepo.findByStoreId(storeId);
    }

    @Override
    public List<ProductLink> findLinks(long storeId, long elementId) {
        return linkRepo.findByStoreIdAndElementId(storeId, elementId);
    }

    @Override
    public boolean insertLinkIfAbsent(long storeId, long productId, long elementId) {
        // runs under the store lock, so check-then-insert cannot race another writer;
        // a duplicate-key error would abort the surrounding transaction
        if (linkRepo.existsByStoreIdAndProductIdAndElementId(storeId, productId, elementId)) {
            return false;
        }
        mongo.insert(ProductLink.builder()
                .id(sequences.next(LINK_SEQUENCE))
                .storeId(storeId)
                .productId(productId)
                .elementId(elementId)
                .createdAt(Instant.now(clock))
                .build());
        return true;
    }

    @Override
    public int deleteLinks(long storeId, long elementId, Collection<Long> productIds) {
        if (productIds.isEmpty()) {
            return 0;
        }
        return (int) linkRepo.deleteByStoreIdAndElementIdAndProductIdIn(storeId, elementId, productIds);
    }

    @Override
    public int deleteAllLinks(long storeId, long elementId) {
        return (int) linkRepo.deleteByStoreIdAndElementId(storeId, elementId);
    }

    @Override
    public List<InventoryItem> findInventory(long storeId, Collection<Long> productIds) {
        if (productIds.isEmpty()) {
            return List.of();
        }
        return inventoryRepo.findByStoreIdAndProductIdIn(storeId, productIds);
    }

    @Override
    public List<InventoryItem> searchInventory(long storeId, String search, int limit) {
        Criteria criteria = where("storeId").is(storeId);
        if (search != null && !search.isBlank()) {
            Pattern pattern = Pattern.compile(Pattern.quote(search.trim()), Pattern.CASE_INSENSITIVE);
            criteria = criteria.orOperator(where("productName").regex(pattern), where("sku").regex(pattern));
        }
        Query q = query(criteria).with(Sort.by("productName", "productId")).limit(limit);
        return mongo.find(q, InventoryItem.class);
    }

    @Override
    public long ping() {
        return mongo.estimatedCount(MapElement.class);
    }
}
