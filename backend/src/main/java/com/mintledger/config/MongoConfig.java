package com.mintledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.Arrays;

/**
 * MongoDB configuration: MintStatus is stored lowercase.
 * Indexes are created from @CompoundIndex / @Indexed on MintRecord at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new MintStatusToStringConverter(),
                new StringToMintStatusConverter()
        ));
    }
}
