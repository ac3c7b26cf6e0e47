package com.stori.backend.store.dynamodb;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import com.stori.backend.store.TableIndex;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Creates the single table with its secondary indexes on startup when it does not exist yet.
 * Intended for DynamoDB Local and development accounts.
 */
@Slf4j
public class DynamoDbTableInitializer implements ApplicationRunner {

    private static final long TABLE_CAPACITY = 10L;
    private static final long INDEX_CAPACITY = 5L;

    private final DynamoDbClient client;
    private final String tableName;

    public DynamoDbTableInitializer(DynamoDbClient client, String tableName) {
        this.client = client;
        this.tableName = tableName;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfMissing();
    }

    public boolean createTableIfMissing() {
        try {
            client.describeTable(DescribeTableRequest.builder().tableName(tableName).build());
            log.info("Table {} already exists", tableName);
            return false;
        } catch (ResourceNotFoundException e) {
            log.info("Table {} not found, creating it", tableName);
        }

        List<AttributeDefinition> attributes = new ArrayList<>();
        List<GlobalSecondaryIndex> indexes = new ArrayList<>();

        for (TableIndex index : TableIndex.values()) {
            attributes.add(stringAttribute(index.partitionAttribute()));
            attributes.add(stringAttribute(index.sortAttribute()));
            if (index.isPrimary()) {
                continue;
            }
            indexes.add(GlobalSecondaryIndex.builder()
                    .indexName(index.indexName())
                    .keySchema(keySchema(index))
                    .projection(Projection.builder().projectionType(ProjectionType.ALL).build())
                    .provisionedThroughput(throughput(INDEX_CAPACITY))
                    .build());
        }

        client.createTable(CreateTableRequest.builder()
                .tableName(tableName)
                .keySchema(keySchema(TableIndex.PRIMARY))
                .attributeDefinitions(attributes)
                .globalSecondaryIndexes(indexes)
                .provisionedThroughput(throughput(TABLE_CAPACITY))
                .build());

        log.info("Table {} created with {} secondary indexes", tableName, indexes.size());
        return true;
    }

    private static List<KeySchemaElement> keySchema(TableIndex index) {
        return List.of(
                KeySchemaElement.builder().attributeName(index.partitionAttribute()).keyType(KeyType.HASH).build(),
                KeySchemaElement.builder().attributeName(index.sortAttribute()).keyType(KeyType.RANGE).build()
        );
    }

    private static AttributeDefinition stringAttribute(String name) {
        return AttributeDefinition.builder()
                .attributeName(name)
                .attributeType(ScalarAttributeType.S)
                .build();
    }

    private static ProvisionedThroughput throughput(long capacity) {
        return ProvisionedThroughput.builder()
                .readCapacityUnits(capacity)
                .writeCapacityUnits(capacity)
                .build();
    }
}
