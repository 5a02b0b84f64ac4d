package com.mintledger.config;

import com.mintledger.domain.MintRecord;
import com.mintledger.domain.MintRecordFixtures;
import com.mintledger.domain.MintStatus;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.convert.NoOpDbRefResolver;
import org.springframework.data.mongodb.core.convert.QueryMapper;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.data.mongodb.core.query.Criteria.where;

class MongoConfigTest {

    MongoMappingContext mappingContext;
    MappingMongoConverter converter;

    @BeforeEach
    void setUp() {
        MongoCustomConversions conversions = new MongoConfig().customConversions();
        mappingContext = new MongoMappingContext();
        mappingContext.setSimpleTypeHolder(conversions.getSimpleTypeHolder());
        mappingContext.afterPropertiesSet();
        converter = new MappingMongoConverter(NoOpDbRefResolver.INSTANCE, mappingContext);
        converter.setCustomConversions(conversions);
        converter.afterPropertiesSet();
    }

    @Test
    @DisplayName("status is written as its lowercase value")
    void writesLowercaseStatus() {
        Document document = new Document();
        converter.write(MintRecordFixtures.record(), document);

        assertThat(document.get("status")).isEqualTo("confirmed");
    }

    @Test
    @DisplayName("documents with a lowercase status read back as the enum")
    void readsLowercaseStatus() {
        Document stored = new Document("walletAddress", MintRecordFixtures.WALLET.toLowerCase())
                .append("transactionHash", MintRecordFixtures.TX_HASH.toLowerCase())
                .append("tokenId", "1")
                .append("eventData", new Document("eventName", "Onchain Summer Lagos")
                        .append("mintedAt", Date.from(MintRecordFixtures.MINTED_AT)))
                .append("networkChainId", 8453)
                .append("status", "confirmed");

        MintRecord read = converter.read(MintRecord.class, stored);

        assertThat(read.getStatus()).isEqualTo(MintStatus.CONFIRMED);
        assertThat(read.getEventData().getMintedAt()).isEqualTo(MintRecordFixtures.MINTED_AT);
    }

    @Test
    @DisplayName("upper-case status values still read")
    void readsEnumNameStatus() {
        MintRecord read = converter.read(MintRecord.class, new Document("status", "PENDING"));

        assertThat(read.getStatus()).isEqualTo(MintStatus.PENDING);
    }

    @Test
    @DisplayName("status criteria are mapped to the stored value")
    void mapsStatusCriteria() {
        QueryMapper queryMapper = new QueryMapper(converter);

        Document mapped = queryMapper.getMappedObject(
                new Query(where("status").is(MintStatus.CONFIRMED)).getQueryObject(),
                mappingContext.getPersistentEntity(MintRecord.class));

        assertThat(mapped.get("status")).isEqualTo("confirmed");
    }
}
