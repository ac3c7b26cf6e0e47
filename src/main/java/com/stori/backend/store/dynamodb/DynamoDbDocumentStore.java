package com.stori.backend.store.dynamodb;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.stori.backend.store.ConditionalCheckFailedStoreException;
import com.stori.backend.store.DocumentStore;
import com.stori.backend.store.Item;
import com.stori.backend.store.PrimaryKey;
import com.stori.backend.store.QueryPage;
import com.stori.backend.store.QuerySpec;
import com.stori.backend.store.SortKeyCondition;
import com.stori.backend.store.StoreException;
import com.stori.backend.store.TableIndex;
import com.stori.backend.store.TransientStoreException;
import com.stori.backend.store.WriteCondition;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * {@link DocumentStore} backed by a single DynamoDB table using the low-level AWS SDK v2 client.
 */
@Slf4j
public class DynamoDbDocumentStore implements DocumentStore {

    private static final String PK = TableIndex.PRIMARY.partitionAttribute();
    private static final String SK = TableIndex.PRIMARY.sortAttribute();

    private final DynamoDbClient client;
    private final String tableName;

    public DynamoDbDocumentStore(DynamoDbClient client, String tableName) {
        this.client = client;
        this.tableName = tableName;
    }

    @Override
    public void put(Item item, WriteCondition condition) {
        PutItemRequest.Builder request = PutItemRequest.builder()
                .tableName(tableName)
                .item(toAttributeMap(item));

        ConditionExpression expression = ConditionExpression.of(condition);
        if (expression != null) {
            request.conditionExpression(expression.expression())
                    .expressionAttributeNames(expression.names());
            if (!expression.values().isEmpty()) {
                request.expressionAttributeValues(expression.values());
            }
        }

        call("put", () -> client.putItem(request.build()));
    }

    @Override
    public Optional<Item> get(PrimaryKey key) {
        GetItemRequest request = GetItemRequest.builder()
                .tableName(tableName)
                .key(keyMap(key))
                .consistentRead(true)
                .build();

        GetItemResponse response = call("get", () -> client.getItem(request));
        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fromAttributeMap(response.item()));
    }

    @Override
    public void delete(PrimaryKey key, WriteCondition condition) {
        DeleteItemRequest.Builder request = DeleteItemRequest.builder()
                .tableName(tableName)
                .key(keyMap(key));

        ConditionExpression expression = ConditionExpression.of(condition);
        if (expression != null) {
            request.conditionExpression(expression.expression())
                    .expressionAttributeNames(expression.names());
            if (!expression.values().isEmpty()) {
                request.expressionAttributeValues(expression.values());
            }
        }

        call("delete", () -> client.deleteItem(request.build()));
    }

    @Override
    public QueryPage query(QuerySpec spec) {
        TableIndex index = spec.getIndex();
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();

        names.put("#pk", index.partitionAttribute());
        values.put(":pk", AttributeValue.fromS(spec.getPartitionKey()));
        String keyCondition = "#pk = :pk";

        SortKeyCondition sortKeyCondition = spec.getSortKeyCondition();
        if (sortKeyCondition != null) {
            names.put("#sk", index.sortAttribute());
            values.put(":sk", AttributeValue.fromS(sortKeyCondition.value()));
            keyCondition += sortKeyCondition.operator() == SortKeyCondition.Operator.EQUALS
                    ? " AND #sk = :sk"
                    : " AND begins_with(#sk, :sk)";
        }

        QueryRequest.Builder request = QueryRequest.builder()
                .tableName(tableName)
                .keyConditionExpression(keyCondition)
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .scanIndexForward(spec.isScanForward());

        if (!index.isPrimary()) {
            request.indexName(index.indexName());
        } else if (spec.isConsistentRead()) {
            request.consistentRead(true);
        }
        if (spec.getLimit() > 0) {
            request.limit(spec.getLimit());
        }
        if (spec.getExclusiveStartKey() != null && !spec.getExclusiveStartKey().isEmpty()) {
            Map<String, AttributeValue> startKey = new HashMap<>();
            spec.getExclusiveStartKey().forEach((name, value) -> startKey.put(name, AttributeValue.fromS(value)));
            request.exclusiveStartKey(startKey);
        }

        QueryResponse response = call("query", () -> client.query(request.build()));

        List<Item> items = new ArrayList<>(response.items().size());
        for (Map<String, AttributeValue> raw : response.items()) {
            items.add(fromAttributeMap(raw));
        }

        Map<String, String> lastEvaluatedKey = null;
        if (response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()) {
            lastEvaluatedKey = new LinkedHashMap<>();
            for (Map.Entry<String, AttributeValue> e : response.lastEvaluatedKey().entrySet()) {
                lastEvaluatedKey.put(e.getKey(), e.getValue().s());
            }
        }
        return new QueryPage(items, lastEvaluatedKey);
    }

    @Override
    public List<Item> batchWrite(List<Item> items) {
        if (items.isEmpty()) {
            return List.of();
        }

        List<WriteRequest> writes = new ArrayList<>(items.size());
        for (Item item : items) {
            writes.add(WriteRequest.builder()
                    .putRequest(PutRequest.builder().item(toAttributeMap(item)).build())
                    .build());
        }

        BatchWriteItemRequest request = BatchWriteItemRequest.builder()
                .requestItems(Map.of(tableName, writes))
                .build();

        BatchWriteItemResponse response = call("batchWrite", () -> client.batchWriteItem(request));
        if (!response.hasUnprocessedItems()) {
            return List.of();
        }

        List<Item> unprocessed = new ArrayList<>();
        for (WriteRequest write : response.unprocessedItems().getOrDefault(tableName, List.of())) {
            if (write.putRequest() != null) {
                unprocessed.add(fromAttributeMap(write.putRequest().item()));
            }
        }
        return unprocessed;
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (ConditionalCheckFailedException e) {
            throw new ConditionalCheckFailedStoreException(operation + " condition failed on table " + tableName, e);
        } catch (ProvisionedThroughputExceededException | RequestLimitExceededException e) {
            throw new TransientStoreException(operation + " throttled on table " + tableName, e);
        } catch (AwsServiceException e) {
            if (e.isThrottlingException() || e.retryable()) {
                throw new TransientStoreException(operation + " failed transiently on table " + tableName, e);
            }
            throw new StoreException(operation + " failed on table " + tableName + ": " + e.getMessage(), e);
        } catch (SdkClientException e) {
            log.warn("DynamoDB client error during {} on {}: {}", operation, tableName, e.getMessage());
            throw new TransientStoreException(operation + " client error on table " + tableName, e);
        }
    }

    private static Map<String, AttributeValue> keyMap(PrimaryKey key) {
        Map<String, AttributeValue> map = new HashMap<>();
        map.put(PK, AttributeValue.fromS(key.partitionKey()));
        map.put(SK, AttributeValue.fromS(key.sortKey()));
        return map;
    }

    @SuppressWarnings("unchecked")
    static Map<String, AttributeValue> toAttributeMap(Item item) {
        Map<String, AttributeValue> map = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : item.attributes().entrySet()) {
            Object value = e.getValue();
            if (value instanceof String s) {
                map.put(e.getKey(), AttributeValue.fromS(s));
            } else if (value instanceof BigDecimal n) {
                map.put(e.getKey(), AttributeValue.fromN(n.toPlainString()));
            } else if (value instanceof Map<?, ?> m) {
                Map<String, AttributeValue> nested = new LinkedHashMap<>();
                ((Map<String, String>) m).forEach((k, v) -> nested.put(k, AttributeValue.fromS(v)));
                map.put(e.getKey(), AttributeValue.fromM(nested));
            }
        }
        return map;
    }

    static Item fromAttributeMap(Map<String, AttributeValue> map) {
        Item.Builder builder = Item.builder();
        for (Map.Entry<String, AttributeValue> e : map.entrySet()) {
            AttributeValue value = e.getValue();
            switch (value.type()) {
                case S -> builder.string(e.getKey(), value.s());
                case N -> builder.number(e.getKey(), new BigDecimal(value.n()));
                case M -> {
                    Map<String, String> nested = new LinkedHashMap<>();
                    value.m().forEach((k, v) -> nested.put(k, v.s()));
                    builder.map(e.getKey(), nested);
                }
                default -> log.debug("Ignoring unsupported attribute {} of type {}", e.getKey(), value.type());
            }
        }
        return builder.build();
    }

    private record ConditionExpression(String expression, Map<String, String> names, Map<String, AttributeValue> values) {

        static ConditionExpression of(WriteCondition condition) {
            return switch (condition.kind()) {
                case NONE -> null;
                case ITEM_EXISTS -> new ConditionExpression("attribute_exists(#pk)", Map.of("#pk", PK), Map.of());
                case ITEM_NOT_EXISTS -> new ConditionExpression("attribute_not_exists(#pk)", Map.of("#pk", PK), Map.of());
                case ATTRIBUTE_EQUALS -> new ConditionExpression(
                        "#attr = :expected",
                        Map.of("#attr", condition.attribute()),
                        Map.of(":expected", toAttributeValue(condition.expected())));
            };
        }

        private static AttributeValue toAttributeValue(Object value) {
            if (value instanceof BigDecimal n) {
                return AttributeValue.fromN(n.toPlainString());
            }
            return AttributeValue.fromS(String.valueOf(value));
        }
    }
}
