package com.annal.persistence;

import com.annal.store.Document;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentCodecTest {
    private final DocumentCodec codec = new DocumentCodec();

    @Test
    public void testInstantsAndNestedValuesSurvive() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("_id", "1");
        fields.put("at", Instant.parse("2024-05-06T07:08:09.123Z"));
        fields.put("count", 3);
        fields.put("ratio", 0.25);
        fields.put("missing", null);
        fields.put("nested", Map.of("list", List.of(1, "two", true)));

        Document decoded = codec.fromJson(codec.toJson(new Document(fields)));

        assertEquals(Instant.parse("2024-05-06T07:08:09.123Z"), decoded.get("at"));
        assertEquals(3L, decoded.get("count"));
        assertEquals(0.25, decoded.get("ratio"));
        assertTrue(decoded.containsKey("missing"));
        assertNull(decoded.get("missing"));
        assertEquals(Arrays.asList(1L, "two", true), decoded.getPath("nested.list"));
    }

    @Test
    public void testDateMarkerIsWrittenAsObject() {
        String json = codec.toJson(new Document(Map.of("at", Instant.parse("2024-01-01T00:00:00Z"))));
        assertEquals("{\"at\":{\"$date\":\"2024-01-01T00:00:00Z\"}}", json);
    }

    @Test
    public void testNonObjectIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.fromJson("[1, 2]"));
    }
}
