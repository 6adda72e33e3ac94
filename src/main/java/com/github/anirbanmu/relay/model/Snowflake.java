package com.github.anirbanmu.relay.model;

import java.time.Instant;

// discord ids: unsigned 64 bit, transmitted as decimal strings
public final class Snowflake {
    public static final long DISCORD_EPOCH = 1420070400000L;

    private Snowflake() {
    }

    public static long parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("missing snowflake");
        }
        return Long.parseUnsignedLong(raw);
    }

    // null stays null
    public static Long parseNullable(String raw) {
        return raw == null ? null : parse(raw);
    }

    public static String toString(long id) {
        return Long.toUnsignedString(id);
    }

    public static Instant createdAt(long id) {
        return Instant.ofEpochMilli((id >>> 22) + DISCORD_EPOCH);
    }
}
