package com.stori.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "stori.store")
public record StoreProperties(
        StoreType type,
        String tableName,
        String region,
        String endpoint,
        boolean autoCreateTable,
        int maxQueryLimit,
        int defaultPageSize,
        int batchSize,
        int batchMaxRetries,
        Duration batchBackoff,
        Boolean legacyIdScan
) {

    public enum StoreType {
        MEMORY,
        DYNAMODB
    }

    public StoreProperties {
        if (type == null) {
            type = StoreType.MEMORY;
        }
        if (tableName == null || tableName.isBlank()) {
            tableName = "stori-transactions-dev";
        }
        if (region == null || region.isBlank()) {
            region = "us-east-1";
        }
        if (maxQueryLimit <= 0) {
            maxQueryLimit = 1000;
        }
        if (defaultPageSize <= 0) {
            defaultPageSize = 50;
        }
        // 25 is the DynamoDB BatchWriteItem ceiling
        if (batchSize <= 0 || batchSize > 25) {
            batchSize = 25;
        }
        if (batchMaxRetries <= 0) {
            batchMaxRetries = 3;
        }
        if (batchBackoff == null) {
            batchBackoff = Duration.ofMillis(100);
        }
        if (legacyIdScan == null) {
            legacyIdScan = Boolean.TRUE;
        }
    }

    public static StoreProperties defaults() {
        return new StoreProperties(null, null, null, null, false, 0, 0, 0, 0, null, null);
    }
}
