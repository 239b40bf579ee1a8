package com.berrys.resilience.cache;

import com.berrys.resilience.model.CacheEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheEntryCodecTest {
    
    private final ObjectMapper mapper = new ObjectMapper();
    
    @Test
    void testEncodeUsesMillisecondFields() {
        CacheEntryCodec<String> codec = new CacheEntryCodec<>(mapper, mapper.constructType(String.class));
        
        String json = codec.encode(new CacheEntry<>("v", Instant.ofEpochMilli(1_000), Duration.ofSeconds(5)));
        
        assertEquals("{\"data\":\"v\",\"timestamp\":1000,\"ttl\":5000}", json);
    }
    
    @Test
    void testDecodesGenericValues() {
        CacheEntryCodec<Map<String, List<Integer>>> codec = new CacheEntryCodec<>(mapper,
            mapper.getTypeFactory().constructType(new TypeReference<Map<String, List<Integer>>>() { }));
        
        CacheEntry<Map<String, List<Integer>>> entry =
            codec.decode("{\"data\":{\"scores\":[1,2,3]},\"timestamp\":2000,\"ttl\":60000}");
        
        assertEquals(List.of(1, 2, 3), entry.getValue().get("scores"));
        assertEquals(Instant.ofEpochMilli(2000), entry.getTimestamp());
        assertEquals(Duration.ofMinutes(1), entry.getTtl());
    }
    
    @Test
    void testRejectsMalformedEntries() {
        CacheEntryCodec<String> codec = new CacheEntryCodec<>(mapper, mapper.constructType(String.class));
        
        assertThrows(UncheckedIOException.class, () -> codec.decode("not json"));
        assertThrows(IllegalArgumentException.class, () -> codec.decode("{\"timestamp\":1}"));
    }
}
