package com.finanzas.ops.cli;

import com.finanzas.ops.taxonomy.config.TaxonomyOpsProperties;
import com.finanzas.ops.taxonomy.store.KeyValueStore;
import com.finanzas.ops.taxonomy.store.dynamo.DynamoDbStores;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Opens DynamoDB tables, sharing one client per run.
 */
@Slf4j
public class DynamoDbStoreFactory implements StoreFactory {

    private DynamoDbClient client;

    @Override
    public synchronized KeyValueStore open(TaxonomyOpsProperties properties, String tableName, boolean mutating) {
        TaxonomyOpsProperties.Store store = properties.getStore();
        if (client == null) {
            String region = mutating
                    ? store.requireRegion("commands that write to DynamoDB")
                    : store.regionOrDefault();
            log.info("Connecting to DynamoDB in {}", region);
            client = DynamoDbStores.client(region, store.getEndpoint());
        }
        return DynamoDbStores.table(client, store, tableName);
    }

    @Override
    public synchronized void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
