package com.github.anirbanmu.wisp.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonTest {

    @Test
    void readObjectDecodesObjects() throws Exception {
        Map<String, Object> decoded = Json.readObject("{\"id\": \"7\", \"tags\": [\"a\", \"b\"], \"nested\": {\"ok\": true}}");

        assertEquals("7", decoded.get("id"));
        assertEquals(List.of("a", "b"), decoded.get("tags"));
        assertEquals(Boolean.TRUE, ((Map<?, ?>) decoded.get("nested")).get("ok"));
    }

    @Test
    void readObjectRejectsNonObjects() throws Exception {
        assertNull(Json.readObject("[1, 2]"));
        assertNull(Json.readObject("\"text\""));
        assertNull(Json.readObject(""));
    }

    @Test
    void asObjectCopiesWithStringKeys() {
        Map<String, Object> copy = Json.asObject(Map.of(1, "one"));

        assertEquals("one", copy.get("1"));
        assertNull(Json.asObject(null));
        assertNull(Json.asObject(List.of()));
    }
}
