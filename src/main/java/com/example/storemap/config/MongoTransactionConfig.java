package com.example.storemap.config;

import com.mongodb.TransactionOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Multi-document transactions for map saves. Requires MongoDB running as a replica set.
 */
@Configuration
@ConditionalOnProperty(name = "app.store.backend", havingValue = "mongo", matchIfMissing = true)
public class MongoTransactionConfig {

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory,
                                                      @Value("${app.transaction.max-commit-ms:5000}") long maxCommitMs) {
        TransactionOptions options = TransactionOptions.builder()
                .maxCommitTime(maxCommitMs, TimeUnit.MILLISECONDS)
                .build();
        return new MongoTransactionManager(databaseFactory, options);
    }

    @Bean
    public TransactionTemplate transactionTemplate(MongoTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
