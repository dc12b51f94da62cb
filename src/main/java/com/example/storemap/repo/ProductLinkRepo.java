package com.example.storemap.repo;

import com.example.storemap.model.ProductLink;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface ProductLinkRepo extends MongoRepository<ProductLink, Long> {
    List<ProductLink> findByStoreId(Long storeId);
    List<ProductLink> findByStoreIdAndElementId(Long storeId, Long elementId);
    boolean existsByStoreIdAndProductIdAndElementId(Long storeId, Long productId, Long elementId);
    long deleteByStoreId(Long storeId);
    long deleteByStoreIdAndElementId(Long storeId, Long elementId);
    long deleteByStoreIdAndElementIdAndProductIdIn(Long storeId, Long elementId, Collection<Long> productIds);
}
