package com.example.storemap.service;

import com.example.storemap.exception.NotFoundException;
import com.example.storemap.exception.ValidationException;
import com.example.storemap.model.InventoryItem;
import com.example.storemap.model.LocationRollup;
import com.example.storemap.model.ProductLink;
import com.example.storemap.store.MapDocumentStore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Product-to-pin links.
 *
 * <p>Each mutation resolves the pin and changes its links inside one store transaction.
 * Once that has committed, the pin's location rollup is recomputed in a separate step;
 * a failure there is logged and leaves the committed links alone.</p>
 */
@Service
public class LinkSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(LinkSynchronizer.class);

    private final MapDocumentStore store;
    private final IdentityResolver identityResolver;
    private final LocationRollupCalculator rollupCalculator;
    private final PublishedMapCache publishedMapCache;

    @Value("${app.pins.product-limit-default:100}")
    private int defaultProductLimit;

    @Value("${app.pins.product-limit-max:500}")
    private int maxProductLimit;

    public LinkSynchronizer(MapDocumentStore store, IdentityResolver identityResolver,
                            LocationRollupCalculator rollupCalculator, PublishedMapCache publishedMapCache) {
        this.store = store;
        this.identityResolver = identityResolver;
        this.rollupCalculator = rollupCalculator;
        this.publishedMapCache = publishedMapCache;
    }

    /**
     * Adds links; products already linked to the pin are skipped.
     */
    public LinkResult link(long storeId, String pinRef, Collection<Long> productIds) {
        Set<Long> ids = requireProductIds(productIds, false);
        LinkChange change = store.inStoreTransaction(storeId, () -> {
            long elementId = identityResolver.resolve(storeId, pinRef, "linking");
            int added = 0;
            for (Long productId : ids) {
                if (store.insertLinkIfAbsent(storeId, productId, elementId)) {
                    added++;
                }
            }
            return new LinkChange(elementId, added, 0, store.findLinks(storeId, elementId).size());
        });
        logger.info("Linked {} of {} products to element {} in store {}", change.getAdded(), ids.size(), change.getElementId(), storeId);
        return finish(storeId, change);
    }

    /**
     * Removes links; products that were not linked are ignored.
     */
    public LinkResult unlink(long storeId, String pinRef, Collection<Long> productIds) {
        Set<Long> ids = requireProductIds(productIds, false);
        LinkChange change = store.inStoreTransaction(storeId, () -> {
            long elementId = identityResolver.resolve(storeId, pinRef, "unlinking");
            int removed = store.deleteLinks(storeId, elementId, ids);
            return new LinkChange(elementId, 0, removed, store.findLinks(storeId, elementId).size());
        });
        logger.info("Unlinked {} products from element {} in store {}", change.getRemoved(), change.getElementId(), storeId);
        return finish(storeId, change);
    }

    /**
     * Replaces the pin's links with exactly {@code productIds}; an empty list clears them.
     */
    public LinkResult sync(long storeId, String pinRef, Collection<Long> productIds) {
        Set<Long> ids = requireProductIds(productIds, true);
        LinkChange change = store.inStoreTransaction(storeId, () -> {
            long elementId = identityResolver.resolve(storeId, pinRef, "linking");
            int removed = store.deleteAllLinks(storeId, elementId);
            int added = 0;
            for (Long productId : ids) {
                if (store.insertLinkIfAbsent(storeId, productId, elementId)) {
                    added++;
                }
            }
            return new LinkChange(elementId, added, removed, store.findLinks(storeId, elementId).size());
        });
        logger.info("Synced element {} in store {} to {} products", change.getElementId(), storeId, change.getProductCount());
        return finish(storeId, change);
    }

    private LinkResult finish(long storeId, LinkChange change) {
        LocationRollup rollup = refreshRollup(storeId, change.getElementId());
        return new LinkResult(true, change.getElementId(), change.getAdded(), change.getRemoved(), change.getProductCount(), rollup);
    }

    /**
     * Recomputes the location rollup stored on a pin. Best effort: failures are logged
     * and reported as a null rollup, never thrown.
     */
    public LocationRollup refreshRollup(long storeId, long elementId) {
        try {
            LocationRollup rollup = store.inStoreTransaction(storeId, () -> {
                if (store.findElement(storeId, elementId).isEmpty()) {
                    return null;
                }
                List<Long> productIds = store.findLinks(storeId, elementId).stream()
                        .map(ProductLink::getProductId)
                        .collect(Collectors.toList());
                LocationRollup computed = rollupCalculator.compute(store.findInventory(storeId, productIds));
                // targeted write, so a concurrent auto-save of the same element is not overwritten
                store.saveRollup(storeId, elementId, computed);
                return computed;
            });
            publishedMapCache.evict(storeId);
            return rollup;
        } catch (Exception e) {
            logger.warn("Could not refresh location rollup of element {} in store {}", elementId, storeId, e);
            return null;
        }
    }

    /**
     * Store inventory matching {@code search}, each flagged with whether it is linked to the pin.
     */
    public List<PinProduct> listProducts(long storeId, String pinRef, String search, Integer limit) {
        requireStore(storeId);
        long elementId = identityResolver.resolve(storeId, pinRef, "loading products");
        Map<Long, ProductLink> links = linksByProduct(storeId, elementId);
        int defaultLimit = defaultProductLimit > 0 ? defaultProductLimit : 100;
        int maxLimit = maxProductLimit > 0 ? maxProductLimit : 500;
        int effectiveLimit = limit == null || limit <= 0 ? defaultLimit : Math.min(limit, maxLimit);
        List<PinProduct> products = new ArrayList<>();
        for (InventoryItem item : store.searchInventory(storeId, search, effectiveLimit)) {
            products.add(PinProduct.of(item, links.get(item.getProductId())));
        }
        return products;
    }

    public List<PinProduct> listLinkedProducts(long storeId, String pinRef) {
        requireStore(storeId);
        long elementId = identityResolver.resolve(storeId, pinRef, "loading products");
        Map<Long, ProductLink> links = linksByProduct(storeId, elementId);
        List<PinProduct> products = new ArrayList<>();
        for (InventoryItem item : store.findInventory(storeId, links.keySet())) {
            products.add(PinProduct.of(item, links.get(item.getProductId())));
        }
        return products;
    }

    private Map<Long, ProductLink> linksByProduct(long storeId, long elementId) {
        return store.findLinks(storeId, elementId).stream()
                .collect(Collectors.toMap(ProductLink::getProductId, Function.identity(), (a, b) -> a));
    }

    private void requireStore(long storeId) {
        if (store.findStore(storeId).isEmpty()) {
            throw NotFoundException.store(storeId);
        }
    }

    private static Set<Long> requireProductIds(Collection<Long> productIds, boolean allowEmpty) {
        if (productIds == null) {
            throw new ValidationException("productIds must be an array");
        }
        if (!allowEmpty && productIds.isEmpty()) {
            throw new ValidationException("productIds must not be empty");
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (Long productId : productIds) {
            if (productId == null || productId < 1) {
                throw new ValidationException("Invalid product id: " + productId);
            }
            ids.add(productId);
        }
        return ids;
    }

    @lombok.Value
    private static class LinkChange {
        long elementId;
        int added;
        int removed;
        int productCount;
    }

    /**
     * Result of a link mutation; {@code rollup} is null when no linked product has a location
     * or the rollup could not be refreshed.
     */
    @lombok.Value
    public static class LinkResult {
        boolean success;
        long elementId;
        int added;
        int removed;
        int productCount;
        LocationRollup rollup;
    }

    @lombok.Value
    public static class PinProduct {
        long productId;
        String productName;
        String sku;
        String aisle;
        String shelf;
        @JsonProperty("isLinked")
        boolean linked;
        Long linkId;

        static PinProduct of(InventoryItem item, ProductLink link) {
            return new PinProduct(item.getProductId(), item.getProductName(), item.getSku(),
                    item.getAisle(), item.getShelf(), link != null, link == null ? null : link.getId());
        }
    }
}
