package com.example.storemap.repo;

import com.example.storemap.model.MapElement;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface MapElementRepo extends MongoRepository<MapElement, Long> {
    Optional<MapElement> findByIdAndStoreId(Long id, Long storeId);
    List<MapElement> findByStoreIdAndMetadataToken(Long storeId, String token);
    long countByStoreIdAndPublishedFalse(Long storeId);
}
