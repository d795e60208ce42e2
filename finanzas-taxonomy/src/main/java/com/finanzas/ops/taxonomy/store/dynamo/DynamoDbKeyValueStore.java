package com.finanzas.ops.taxonomy.store.dynamo;

import com.finanzas.ops.taxonomy.store.AttributeUpdate;
import com.finanzas.ops.taxonomy.store.ConditionFailedException;
import com.finanzas.ops.taxonomy.store.KeySchema;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import com.finanzas.ops.taxonomy.store.ScanPage;
import com.finanzas.ops.taxonomy.store.StoreException;
import com.finanzas.ops.taxonomy.store.StoreKey;
import com.finanzas.ops.taxonomy.store.StoreWriteException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link KeyValueStore} backed by a DynamoDB table through the AWS SDK v2 synchronous client.
 * <p>
 * Reads are strongly consistent so that a put can be verified by reading it back. Scans are
 * not: items written concurrently with a scan may or may not be seen.
 */
@Slf4j
public class DynamoDbKeyValueStore implements KeyValueStore {

    private final DynamoDbClient client;
    private final String tableName;
    private final KeySchema keySchema;

    public DynamoDbKeyValueStore(DynamoDbClient client, String tableName, KeySchema keySchema) {
        this.client = client;
        this.tableName = tableName;
        this.keySchema = keySchema;
    }

    @Override
    public String tableName() {
        return tableName;
    }

    @Override
    public KeySchema keySchema() {
        return keySchema;
    }

    @Override
    public Optional<Map<String, Object>> get(StoreKey key) {
        try {
            GetItemResponse response = client.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(keyAttributes(key))
                    .consistentRead(true)
                    .build());
            if (!response.hasItem() || response.item().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(AttributeValues.fromAttributeMap(response.item()));
        } catch (SdkException e) {
            throw new StoreException("GetItem " + key + " on " + tableName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void put(Map<String, Object> item) {
        try {
            client.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(AttributeValues.toAttributeMap(item))
                    .build());
        } catch (SdkException e) {
            throw new StoreWriteException("PutItem on " + tableName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean putIfAbsent(Map<String, Object> item) {
        try {
            client.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(AttributeValues.toAttributeMap(item))
                    .conditionExpression("attribute_not_exists(#pk)")
                    .expressionAttributeNames(Map.of("#pk", keySchema.partitionKey()))
                    .build());
            return true;
        } catch (ConditionalCheckFailedException e) {
            log.debug("Conditional put skipped on {}: item already exists", tableName);
            return false;
        } catch (SdkException e) {
            throw new StoreWriteException("PutItem on " + tableName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> update(StoreKey key, AttributeUpdate update) {
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();
        List<String> clauses = new ArrayList<>();
        int index = 0;
        for (Map.Entry<String, Object> entry : update.getSets().entrySet()) {
            names.put("#a" + index, entry.getKey());
            values.put(":v" + index, AttributeValues.toAttributeValue(entry.getValue()));
            clauses.add("#a" + index + " = :v" + index);
            index++;
        }
        for (Map.Entry<String, Object> entry : update.getSetsIfAbsent().entrySet()) {
            names.put("#a" + index, entry.getKey());
            values.put(":v" + index, AttributeValues.toAttributeValue(entry.getValue()));
            clauses.add("#a" + index + " = if_not_exists(#a" + index + ", :v" + index + ")");
            index++;
        }
        if (clauses.isEmpty()) {
            return get(key).orElseThrow(() -> new ConditionFailedException(key,
                    "No item under " + key + " in " + tableName));
        }

        UpdateItemRequest.Builder request = UpdateItemRequest.builder()
                .tableName(tableName)
                .key(keyAttributes(key))
                .updateExpression("SET " + String.join(", ", clauses))
                .returnValues(ReturnValue.ALL_NEW);
        if (update.isExistingRequired()) {
            names.put("#pk", keySchema.partitionKey());
            request.conditionExpression("attribute_exists(#pk)");
        }
        request.expressionAttributeNames(names).expressionAttributeValues(values);

        try {
            UpdateItemResponse response = client.updateItem(request.build());
            return AttributeValues.fromAttributeMap(response.attributes());
        } catch (ConditionalCheckFailedException e) {
            throw new ConditionFailedException(key, "No item under " + key + " in " + tableName, e);
        } catch (SdkException e) {
            throw new StoreWriteException("UpdateItem " + key + " on " + tableName
                    + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(StoreKey key) {
        try {
            client.deleteItem(DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(keyAttributes(key))
                    .build());
        } catch (SdkException e) {
            throw new StoreWriteException("DeleteItem " + key + " on " + tableName
                    + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public ScanPage scan(StoreKey exclusiveStartKey, int pageSize) {
        ScanRequest.Builder request = ScanRequest.builder()
                .tableName(tableName)
                .limit(pageSize);
        if (exclusiveStartKey != null) {
            request.exclusiveStartKey(keyAttributes(exclusiveStartKey));
        }
        try {
            ScanResponse response = client.scan(request.build());
            List<Map<String, Object>> items = new ArrayList<>();
            response.items().forEach(item -> items.add(AttributeValues.fromAttributeMap(item)));
            StoreKey next = null;
            if (response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()) {
                next = keySchema.keyOf(AttributeValues.fromAttributeMap(response.lastEvaluatedKey()))
                        .orElse(null);
            }
            return new ScanPage(items, next);
        } catch (SdkException e) {
            throw new StoreException("Scan of " + tableName + " failed: " + e.getMessage(), e);
        }
    }

    private Map<String, AttributeValue> keyAttributes(StoreKey key) {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        attributes.put(keySchema.partitionKey(), AttributeValue.builder().s(key.pk()).build());
        if (keySchema.sortKey() != null && key.sk() != null) {
            attributes.put(keySchema.sortKey(), AttributeValue.builder().s(key.sk()).build());
        }
        return attributes;
    }
}
