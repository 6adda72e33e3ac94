package com.github.anirbanmu.relay.gateway;

public record ShardIdentity(int shardId, int shardCount) {

    public ShardIdentity {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be at least 1: " + shardCount);
        }
        if (shardId < 0 || shardId >= shardCount) {
            throw new UnknownShardException(shardId, shardCount);
        }
    }

    // snowflakes are unsigned 64 bit
    public static int shardFor(long entityId, int shardCount) {
        return (int) Long.remainderUnsigned(entityId, shardCount);
    }

    @Override
    public String toString() {
        return "[" + shardId + ", " + shardCount + "]";
    }
}
