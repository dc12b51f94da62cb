package com.example.storemap.store;

import com.example.storemap.model.InventoryItem;
import com.example.storemap.model.LocationRollup;
import com.example.storemap.model.MapElement;
import com.example.storemap.model.MapStore;
import com.example.storemap.model.ProductLink;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence handle for store maps. Every service receives it explicitly, so the
 * Mongo-backed implementation can be swapped for the in-memory one.
 *
 * <p>Element and link reads return detached copies; changes only reach the store
 * through the write methods. Deleting an element always deletes its product links.</p>
 */
public interface MapDocumentStore {

    Optional<MapStore> findStore(long storeId);

    /**
     * Runs {@code work} as one all-or-nothing unit holding the write lock of the store.
     * Failures roll back every write made by {@code work}; anything other than a
     * {@link com.example.storemap.exception.MapSyncException} is rethrown as a
     * {@link com.example.storemap.exception.TransactionFailureException}.
     *
     * @throws com.example.storemap.exception.NotFoundException if the store does not exist
     */
    <T> T inStoreTransaction(long storeId, Supplier<T> work);

    // elements

    /** All elements of the store, ordered by z-index then id. */
    List<MapElement> findElements(long storeId);

    List<MapElement> findPublishedElements(long storeId);

    Optional<MapElement> findElement(long storeId, long elementId);

    List<MapElement> findElementsByToken(long storeId, String token);

    /** Assigns a fresh id and update time, and returns the stored element. */
    MapElement insertElement(MapElement element);

    /** Same as {@link #insertElement} for a batch; ids follow the input order. */
    List<MapElement> insertElements(List<MapElement> elements);

    /**
     * Writes the editable columns, the publish flag and the non-rollup metadata of an
     * existing element. The location rollup stored on the row is left untouched.
     *
     * @return false when the row no longer exists
     */
    boolean updateElementContent(MapElement element);

    /**
     * Replaces only the rollup keys of the element's metadata; {@code rollup == null} clears them.
     *
     * @return false when the row no longer exists
     */
    boolean saveRollup(long storeId, long elementId, LocationRollup rollup);

    boolean deleteElement(long storeId, long elementId);

    int deleteAllElements(long storeId);

    /** Stamps every current element of the store as published; returns how many. */
    int publishAllElements(long storeId, Instant publishedAt);

    long countUnpublishedElements(long storeId);

    // store flags

    void markDraft(long storeId);

    void markPublished(long storeId, Instant publishedAt);

    void setMapImageUrl(long storeId, String imageUrl);

    // product links

    List<ProductLink> findLinksForStore(long storeId);

    List<ProductLink> findLinks(long storeId, long elementId);

    /** @return false when the link already existed */
    boolean insertLinkIfAbsent(long storeId, long productId, long elementId);

    int deleteLinks(long storeId, long elementId, Collection<Long> productIds);

    int deleteAllLinks(long storeId, long elementId);

    // inventory (read only)

    List<InventoryItem> findInventory(long storeId, Collection<Long> productIds);

    List<InventoryItem> searchInventory(long storeId, String search, int limit);

    /** Touches the element collection; returns its approximate size. */
    long ping();
}
