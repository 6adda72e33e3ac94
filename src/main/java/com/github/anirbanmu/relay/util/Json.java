package com.github.anirbanmu.relay.util;

import com.dslplatform.json.DslJson;
import com.dslplatform.json.runtime.Settings;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public final class Json {
    public static final DslJson<Object> DSL = new DslJson<>(Settings.withRuntime().includeServiceLoader());

    // outgoing frames: absent optional fields are left out instead of written as null
    public static final DslJson<Object> COMPACT = new DslJson<>(Settings.withRuntime().skipDefaultValues(true).includeServiceLoader());

    private Json() {
    }

    public static <T> T decode(Class<T> type, String raw) throws IOException {
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
        return DSL.deserialize(type, new ByteArrayInputStream(bytes));
    }

    public static String encode(Object value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DSL.serialize(value, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    // also drops zero and false primitives, so only for payloads where those mean "absent"
    public static String encodeCompact(Object value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        COMPACT.serialize(value, out);
        return out.toString(StandardCharsets.UTF_8);
    }
}
