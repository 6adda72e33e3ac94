package com.github.anirbanmu.relay.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class SnowflakeTest {

    @Test
    void creationTimeComesFromTheTopBits() {
        assertEquals(Instant.parse("2016-04-30T11:18:25.796Z"), Snowflake.createdAt(175928847299117063L));
        assertEquals(Instant.ofEpochMilli(Snowflake.DISCORD_EPOCH), Snowflake.createdAt(0));
    }

    @Test
    void idsAreUnsigned() {
        long max = Snowflake.parse("18446744073709551615");
        assertEquals(-1L, max);
        assertEquals("18446744073709551615", Snowflake.toString(max));
    }

    @Test
    void missingOrBrokenIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Snowflake.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Snowflake.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Snowflake.parse("abc"));
        assertNull(Snowflake.parseNullable(null));
        assertEquals(Long.valueOf(12), Snowflake.parseNullable("12"));
    }
}
