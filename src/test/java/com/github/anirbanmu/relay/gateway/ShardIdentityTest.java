package com.github.anirbanmu.relay.gateway;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ShardIdentityTest {

    @Test
    void routesByRemainder() {
        assertEquals(0, ShardIdentity.shardFor(4L, 2));
        assertEquals(1, ShardIdentity.shardFor(5L, 2));
        assertEquals(0, ShardIdentity.shardFor(123456789L, 1));
    }

    @Test
    void idsAreUnsigned() {
        // 2^64 - 1
        assertEquals(5, ShardIdentity.shardFor(-1L, 10));
    }

    @Test
    void rejectsShardOutsideCount() {
        assertThrows(UnknownShardException.class, () -> new ShardIdentity(2, 2));
        assertThrows(UnknownShardException.class, () -> new ShardIdentity(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new ShardIdentity(0, 0));
    }
}
