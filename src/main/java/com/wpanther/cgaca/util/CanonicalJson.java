package com.wpanther.cgaca.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic JSON used for everything the CA signs or hashes.
 * Object keys are sorted at every depth, null members are omitted and instants are ISO-8601 strings.
 * Fractional numbers are written in their shortest plain decimal form, so 1.10, 1.1 and 1.1d
 * all hash the same before and after a trip through storage.
 */
@Component
public class CanonicalJson {

    public static final String HASH_ALGORITHM = "SHA-256";

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    /**
     * Writes any value as canonical JSON.
     * Values go through a tree that is rebuilt in canonical form: Jackson leaves SortedMaps and trees in their own order.
     */
    public String write(Object value) {
        try {
            JsonNode tree = value instanceof JsonNode ? (JsonNode) value : mapper.valueToTree(value);
            return mapper.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Value cannot be written as canonical JSON: " + e.getMessage(), e);
        }
    }

    public byte[] writeBytes(Object value) {
        return write(value).getBytes(StandardCharsets.UTF_8);
    }

    public JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON content: " + e.getOriginalMessage(), e);
        }
    }

    public <T> T read(byte[] json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new IllegalArgumentException("Cannot read " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * SHA-256 of the canonical form of a value, lower-case hex
     */
    public String sha256Hex(Object value) {
        return sha256Hex(writeBytes(value));
    }

    public static String sha256Hex(byte[] data) {
        try {
            return Hex.toHexString(MessageDigest.getInstance(HASH_ALGORITHM).digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }


    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = mapper.createObjectNode();
            for (String name : names) {
                JsonNode member = node.get(name);
                if (!member.isNull()) {
                    sorted.set(name, canonicalize(member));
                }
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode items = mapper.createArrayNode();
            for (JsonNode item : node) {
                items.add(canonicalize(item));
            }
            return items;
        }
        if (node.isFloatingPointNumber()) {
            // NaN and infinities raise NumberFormatException
            return DecimalNode.valueOf(node.decimalValue().stripTrailingZeros());
        }
        return node;
    }
}
