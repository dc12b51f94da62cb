package com.example.storemap.service;

import com.example.storemap.dto.ElementPayload;
import com.example.storemap.exception.ValidationException;
import com.example.storemap.model.MapElement;
import com.example.storemap.model.ProductLink;
import com.example.storemap.store.MapDocumentStore;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full-document save: replaces every element of a store with the editor's copy.
 *
 * <p>The old rows are deleted and the incoming ones inserted with fresh ids, which drops
 * every product link with them. Links are carried over by token instead of row id: each
 * link is remembered as (product, token of its element) before the wipe and re-created
 * against whichever new row carries that token. Links whose token did not come back, or
 * whose element never had a token, are dropped. The whole exchange is one transaction.</p>
 */
@Service
public class BulkReconciler {

    private static final Logger logger = LoggerFactory.getLogger(BulkReconciler.class);

    private final MapDocumentStore store;
    private final ElementPayloadMapper payloadMapper;
    private final PublishStateMachine publishStateMachine;
    private final LinkSynchronizer linkSynchronizer;
    private final PublishedMapCache publishedMapCache;

    public BulkReconciler(MapDocumentStore store, ElementPayloadMapper payloadMapper,
                          PublishStateMachine publishStateMachine, LinkSynchronizer linkSynchronizer,
                          PublishedMapCache publishedMapCache) {
        this.store = store;
        this.payloadMapper = payloadMapper;
        this.publishStateMachine = publishStateMachine;
        this.linkSynchronizer = linkSynchronizer;
        this.publishedMapCache = publishedMapCache;
    }

    public SaveResult save(long storeId, List<ElementPayload> elements) {
        if (elements == null) {
            throw new ValidationException("Elements must be an array");
        }
        for (int i = 0; i < elements.size(); i++) {
            payloadMapper.validateForInsert(elements.get(i), "elements[" + i + "]");
        }

        Reconciliation reconciliation = store.inStoreTransaction(storeId, () -> reconcile(storeId, elements));

        for (Long elementId : reconciliation.getRelinkedElements()) {
            linkSynchronizer.refreshRollup(storeId, elementId);
        }
        publishedMapCache.evict(storeId);

        logger.info("Saved map of store {}: {} elements, {} links preserved, {} dropped",
                storeId, elements.size(), reconciliation.getPreserved(), reconciliation.getDropped());
        return new SaveResult(true, elements.size(), reconciliation.getPreserved(), reconciliation.getDropped());
    }

    private Reconciliation reconcile(long storeId, List<ElementPayload> elements) {
        List<MapElement> current = store.findElements(storeId);
        Map<Long, String> tokenById = new HashMap<>();
        Map<String, MapElement> currentByIdText = new HashMap<>();
        for (MapElement element : current) {
            currentByIdText.put(String.valueOf(element.getId()), element);
            if (element.token() != null) {
                tokenById.put(element.getId(), element.token());
            }
        }

        List<RememberedLink> remembered = new ArrayList<>();
        int dropped = 0;
        for (ProductLink link : store.findLinksForStore(storeId)) {
            String token = tokenById.get(link.getElementId());
            if (token == null) {
                dropped++;
            } else {
                remembered.add(new RememberedLink(link.getProductId(), token));
            }
        }

        int deleted = store.deleteAllElements(storeId);
        logger.debug("Store {}: removed {} elements before reinsert", storeId, deleted);

        List<MapElement> rows = new ArrayList<>(elements.size());
        for (ElementPayload payload : elements) {
            rows.add(payloadMapper.toElement(storeId, payload, identityOf(payload, currentByIdText)));
        }
        Map<String, Long> newIdByToken = new HashMap<>();
        for (MapElement inserted : store.insertElements(rows)) {
            if (inserted.token() != null) {
                // duplicate tokens: the last element carrying it wins
                newIdByToken.put(inserted.token(), inserted.getId());
            }
        }

        int preserved = 0;
        Set<Long> relinked = new LinkedHashSet<>();
        for (RememberedLink link : remembered) {
            Long newId = newIdByToken.get(link.getToken());
            if (newId == null) {
                dropped++;
                continue;
            }
            if (store.insertLinkIfAbsent(storeId, link.getProductId(), newId)) {
                preserved++;
            }
            relinked.add(newId);
        }

        publishStateMachine.markDirty(storeId);
        return new Reconciliation(preserved, dropped, relinked);
    }

    /**
     * The token the new row will carry. A payload token wins; without one, an id that
     * names a current row inherits that row's token, and any other id is itself the
     * editor's token for a never-saved element.
     */
    private String identityOf(ElementPayload payload, Map<String, MapElement> currentByIdText) {
        String token = payloadMapper.tokenOf(payload);
        if (token != null) {
            return token;
        }
        String id = payload.getId();
        if (id == null || id.isBlank()) {
            return null;
        }
        MapElement existing = currentByIdText.get(id.trim());
        if (existing != null) {
            return existing.token();
        }
        return id;
    }

    @Value
    private static class RememberedLink {
        long productId;
        String token;
    }

    @Value
    private static class Reconciliation {
        int preserved;
        int dropped;
        Set<Long> relinkedElements;
    }

    /**
     * Result of a full-document save
     */
    @Value
    public static class SaveResult {
        boolean success;
        int count;
        int preservedLinks;
        int droppedLinks;
    }
}
