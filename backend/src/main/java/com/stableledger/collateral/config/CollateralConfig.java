package com.stableledger.collateral.config;

import com.stableledger.common.LedgerSerializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collateral module configuration: properties and the serializer shared by every mutating request.
 */
@Configuration
@EnableConfigurationProperties(CollateralProperties.class)
public class CollateralConfig {

    @Bean
    public LedgerSerializer ledgerSerializer() {
        return new LedgerSerializer();
    }
}
