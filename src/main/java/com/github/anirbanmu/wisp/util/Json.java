package com.github.anirbanmu.wisp.util;

import com.dslplatform.json.DslJson;
import com.dslplatform.json.runtime.Settings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Json {
    public static final DslJson<Object> DSL = new DslJson<>(Settings.withRuntime().includeServiceLoader());

    private Json() {
    }

    public static String write(Object value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DSL.serialize(value, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    // untyped decode: objects become Map, arrays List, integers Long
    public static Object read(byte[] bytes) throws IOException {
        if (bytes.length == 0) {
            return null;
        }
        return DSL.deserialize(Object.class, bytes, bytes.length);
    }

    // null when the text is not a json object
    public static Map<String, Object> readObject(String text) throws IOException {
        return asObject(read(text.getBytes(StandardCharsets.UTF_8)));
    }

    // string-keyed copy of a decoded json object, null for anything else
    public static Map<String, Object> asObject(Object decoded) {
        if (!(decoded instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>(map.size());
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
