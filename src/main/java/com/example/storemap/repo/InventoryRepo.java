package com.example.storemap.repo;

import com.example.storemap.model.InventoryItem;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface InventoryRepo extends MongoRepository<InventoryItem, String> {
    List<InventoryItem> findByStoreIdAndProductIdIn(Long storeId, Collection<Long> productIds);
}
