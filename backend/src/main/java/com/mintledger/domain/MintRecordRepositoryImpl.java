package com.mintledger.domain;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.ArrayOperators;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.group;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.match;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.newAggregation;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.project;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.sort;
import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of MintRecordRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class MintRecordRepositoryImpl implements MintRecordRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<MintRecord> findPageByWalletAddressAndStatus(String walletAddress, MintStatus status, long skip, int limit) {
        Query query = new Query(where("walletAddress").is(walletAddress).and("status").is(status.value()))
                .with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("_id")))
                .skip(skip)
                .limit(limit);
        query.fields().exclude("userAgent").exclude("ipAddress");
        return mongoTemplate.find(query, MintRecord.class);
    }

    @Override
    public List<EventStatistics> aggregateEventStatistics(MintStatus status) {
        Aggregation aggregation = newAggregation(
                match(where("status").is(status.value())),
                group("eventData.eventName")
                        .count().as("totalMints")
                        .addToSet("walletAddress").as("owners")
                        .min("eventData.mintedAt").as("firstMint")
                        .max("eventData.mintedAt").as("lastMint"),
                project("totalMints", "firstMint", "lastMint")
                        .and("eventName").previousOperation()
                        .and(ArrayOperators.Size.lengthOfArray("owners")).as("uniqueOwnerCount"),
                sort(Sort.Direction.ASC, "eventName")
        );
        return mongoTemplate.aggregate(aggregation, MintRecord.class, EventStatistics.class).getMappedResults();
    }

    @Override
    public Optional<MintRecord> updateStatusByTransactionHash(String transactionHash, MintStatus status, Instant updatedAt) {
        Query query = new Query(where("transactionHash").is(transactionHash));
        Update update = new Update().set("status", status.value()).set("updatedAt", updatedAt);
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), MintRecord.class));
    }

    @Override
    public boolean ping() {
        Document result = mongoTemplate.executeCommand(new Document("ping", 1));
        Object ok = result.get("ok");
        return ok instanceof Number n && n.doubleValue() == 1.0;
    }
}
