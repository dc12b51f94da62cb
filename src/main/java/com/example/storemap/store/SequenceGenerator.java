package com.example.storemap.store;

import org.bson.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * Integer surrogate keys backed by the {@code counters} collection.
 *
 * <p>Counters are shared by all stores, so they are advanced outside any surrounding
 * store transaction: the increment commits on its own and never holds the counter
 * document for the lifetime of another store's save. Ids reserved by a transaction
 * that later rolls back are simply skipped.</p>
 */
@Component
@ConditionalOnProperty(name = "app.store.backend", havingValue = "mongo", matchIfMissing = true)
public class SequenceGenerator {

    static final String COLLECTION = "counters";

    private final MongoTemplate mongo;
    private final TransactionTemplate outsideTransaction;

    @Autowired
    public SequenceGenerator(MongoTemplate mongo, PlatformTransactionManager transactionManager) {
        this.mongo = mongo;
        this.outsideTransaction = new TransactionTemplate(transactionManager);
        this.outsideTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_NOT_SUPPORTED);
    }

    public long next(String sequence) {
        return reserve(sequence, 1);
    }

    /**
     * Reserves {@code count} consecutive values and returns the first one.
     */
    public long reserve(String sequence, int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        Document counter = outsideTransaction.execute(status -> mongo.findAndModify(
                query(where("_id").is(sequence)),
                new Update().inc("seq", count),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                Document.class,
                COLLECTION));
        if (counter == null) {
            throw new IllegalStateException("Sequence " + sequence + " could not be advanced");
        }
        long last = ((Number) counter.get("seq")).longValue();
        return last - count + 1;
    }
}
