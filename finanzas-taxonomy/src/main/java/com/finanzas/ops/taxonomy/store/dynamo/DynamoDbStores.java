package com.finanzas.ops.taxonomy.store.dynamo;

import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.store.KeySchema;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * Builds DynamoDB clients and table adapters from {@link TaxonomyOpsProperties}.
 */
@Slf4j
public final class DynamoDbStores {

    private DynamoDbStores() {
    }

    public static DynamoDbClient client(String region, String endpoint) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder().region(Region.of(region));
        if (endpoint != null && !endpoint.isBlank()) {
            log.info("Using DynamoDB endpoint override {}", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }

    public static DynamoDbKeyValueStore table(DynamoDbClient client, TaxonomyOpsProperties.Store store,
                                              String tableName) {
        return new DynamoDbKeyValueStore(client, tableName,
                new KeySchema(store.getPartitionKey(), store.getSortKey()));
    }
}
