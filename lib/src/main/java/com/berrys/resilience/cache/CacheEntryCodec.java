package com.berrys.resilience.cache;

import com.berrys.resilience.model.CacheEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;

/**
 * JSON form of a cache entry in the shared store:
 * {@code {"data": <value>, "timestamp": <epoch millis>, "ttl": <millis>}}.
 */
class CacheEntryCodec<V> {
    
    private final ObjectMapper objectMapper;
    private final JavaType valueType;
    
    CacheEntryCodec(ObjectMapper objectMapper, JavaType valueType) {
        this.objectMapper = objectMapper;
        this.valueType = valueType;
    }
    
    String encode(CacheEntry<V> entry) {
        ObjectNode node = objectMapper.createObjectNode();
        node.set("data", objectMapper.valueToTree(entry.getValue()));
        node.put("timestamp", entry.getTimestamp().toEpochMilli());
        node.put("ttl", entry.getTtl().toMillis());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode cache entry", e);
        }
    }
    
    CacheEntry<V> decode(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            JsonNode data = node.get("data");
            if (data == null || data.isNull() || !node.has("timestamp") || !node.has("ttl")) {
                throw new IllegalArgumentException("Malformed cache entry: " + json);
            }
            V value = objectMapper.convertValue(data, valueType);
            return new CacheEntry<>(value,
                Instant.ofEpochMilli(node.get("timestamp").asLong()),
                Duration.ofMillis(node.get("ttl").asLong()));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to decode cache entry", e);
        }
    }
}
