package com.finanzas.ops.taxonomy.store.dynamo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.finanzas.ops.taxonomy.report.OpsJson;
import com.finanzas.ops.taxonomy.store.StoreException;
import software.amazon.awssdk.enhanced.dynamodb.document.EnhancedDocument;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversion between plain Java attribute maps and DynamoDB attribute values, through the SDK's
 * {@link EnhancedDocument} JSON converters.
 * <p>
 * Integral numbers come back as {@code Long}, fractional ones as {@code BigDecimal}; string and
 * number sets come back as lists.
 */
final class AttributeValues {

    private static final ObjectMapper MAPPER = OpsJson.create()
            .disable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, DeserializationFeature.USE_LONG_FOR_INTS);

    private static final TypeReference<LinkedHashMap<String, Object>> ITEM = new TypeReference<>() {
    };

    private AttributeValues() {
    }

    static Map<String, AttributeValue> toAttributeMap(Map<String, Object> item) {
        try {
            return EnhancedDocument.fromJson(MAPPER.writeValueAsString(item)).toMap();
        } catch (JsonProcessingException e) {
            throw new StoreException("Item cannot be converted to DynamoDB attributes: " + e.getOriginalMessage(), e);
        }
    }

    static Map<String, Object> fromAttributeMap(Map<String, AttributeValue> item) {
        if (item == null || item.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(EnhancedDocument.fromAttributeValueMap(item).toJson(), ITEM);
        } catch (JsonProcessingException e) {
            throw new StoreException("DynamoDB item cannot be read: " + e.getOriginalMessage(), e);
        }
    }

    static AttributeValue toAttributeValue(Object value) {
        return toAttributeMap(Collections.singletonMap("value", value)).get("value");
    }
}
