package com.finanzas.ops.taxonomy.store.dynamo;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttributeValuesTest {

    @Test
    void writesTypedAttributes() {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("pk", "PROJECT#P1");
        item.put("amount", 1200);
        item.put("active", true);
        item.put("note", null);

        Map<String, AttributeValue> attributes = AttributeValues.toAttributeMap(item);

        assertThat(attributes.get("pk").s()).isEqualTo("PROJECT#P1");
        assertThat(attributes.get("amount").n()).isEqualTo("1200");
        assertThat(attributes.get("active").bool()).isTrue();
        assertThat(attributes.get("note").nul()).isTrue();
        assertThat(AttributeValues.toAttributeValue("MOD-ING").s()).isEqualTo("MOD-ING");
    }

    @Test
    void readsStoredItemIntoPlainMap() {
        Map<String, AttributeValue> stored = Map.of(
                "sk", AttributeValue.builder().s("ALLOC#1").build(),
                "hours", AttributeValue.builder().n("160").build(),
                "rate", AttributeValue.builder().n("12.5").build(),
                "tags", AttributeValue.builder().ss("mod", "ing").build(),
                "meta", AttributeValue.builder().m(Map.of(
                        "source", AttributeValue.builder().s("MSP").build())).build());

        Map<String, Object> item = AttributeValues.fromAttributeMap(stored);

        assertThat(item)
                .containsEntry("sk", "ALLOC#1")
                .containsEntry("hours", 160L)
                .containsEntry("rate", new BigDecimal("12.5"))
                .containsEntry("meta", Map.of("source", "MSP"));
        assertThat((List<Object>) item.get("tags")).containsExactlyInAnyOrder("mod", "ing");
    }

    @Test
    void missingItemReadsAsEmpty() {
        assertThat(AttributeValues.fromAttributeMap(null)).isEmpty();
    }
}
