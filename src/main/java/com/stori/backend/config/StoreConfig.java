package com.stori.backend.config;

import java.net.URI;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.stori.backend.store.DocumentStore;
import com.stori.backend.store.dynamodb.DynamoDbDocumentStore;
import com.stori.backend.store.dynamodb.DynamoDbTableInitializer;
import com.stori.backend.store.memory.InMemoryDocumentStore;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

@Slf4j
@Configuration
public class StoreConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "stori.store", name = "type", havingValue = "dynamodb")
    static class DynamoDbStoreConfig {

        @Bean(destroyMethod = "close")
        public DynamoDbClient dynamoDbClient(StoreProperties properties) {
            DynamoDbClientBuilder builder = DynamoDbClient.builder()
                    .region(Region.of(properties.region()));

            // DynamoDB Local accepts any credentials
            if (properties.endpoint() != null && !properties.endpoint().isBlank()) {
                log.info("Using DynamoDB endpoint {}", properties.endpoint());
                builder.endpointOverride(URI.create(properties.endpoint()))
                        .credentialsProvider(StaticCredentialsProvider.create(AwsBasicCredentials.create("local", "local")));
            }
            return builder.build();
        }

        @Bean
        public DocumentStore documentStore(DynamoDbClient dynamoDbClient, StoreProperties properties) {
            log.info("Document store: DynamoDB table {} in {}", properties.tableName(), properties.region());
            return new DynamoDbDocumentStore(dynamoDbClient, properties.tableName());
        }

        @Bean
        @ConditionalOnProperty(prefix = "stori.store", name = "auto-create-table", havingValue = "true")
        public DynamoDbTableInitializer dynamoDbTableInitializer(DynamoDbClient dynamoDbClient, StoreProperties properties) {
            return new DynamoDbTableInitializer(dynamoDbClient, properties.tableName());
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "stori.store", name = "type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStoreConfig {

        @Bean
        public DocumentStore documentStore() {
            log.info("Document store: in-memory (data is lost on shutdown)");
            return new InMemoryDocumentStore();
        }
    }
}
