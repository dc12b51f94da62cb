package com.example.storemap.repo;

import com.example.storemap.model.MapStore;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface MapStoreRepo extends MongoRepository<MapStore, Long> {}
