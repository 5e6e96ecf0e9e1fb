package io.workgate.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlatJsonCodecTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void emptyMapEncodesAsEmptyObject() {
        assertEquals("{}", codec.toJson(Map.of()));
        assertEquals("{}", codec.toJson(null));
    }

    @Test
    void encodesInInsertionOrderWithEscapes() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("file_path", "/in/\"quoted\"\\dir");
        fields.put("note", "line1\nline2\u0001");

        assertEquals("{\"file_path\":\"/in/\\\"quoted\\\"\\\\dir\",\"note\":\"line1\\nline2\\u0001\"}",
                codec.toJson(fields));
    }

    @Test
    void parsesScalarsAndDropsNulls() {
        Map<String, String> parsed = codec.parseObject(
                "{ \"execution_id\": \"exec-1\", \"ttl_seconds\": 300, \"ok\": true, \"gone\": null }");

        assertEquals("exec-1", parsed.get("execution_id"));
        assertEquals("300", parsed.get("ttl_seconds"));
        assertEquals("true", parsed.get("ok"));
        assertFalse(parsed.containsKey("gone"));
        assertEquals(3, parsed.size());
    }

    @Test
    void parsesEscapes() {
        Map<String, String> parsed = codec.parseObject("{\"p\":\"a\\/b\\u00e9\\t\"}");

        assertEquals("a/bé\t", parsed.get("p"));
    }

    @Test
    void blankInputIsEmpty() {
        assertTrue(codec.parseObject("").isEmpty());
        assertTrue(codec.parseObject(null).isEmpty());
        assertTrue(codec.parseObject(" { } ").isEmpty());
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":{\"b\":1}}"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"unterminated"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1} trailing"));
    }
}
