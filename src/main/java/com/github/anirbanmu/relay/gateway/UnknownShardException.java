package com.github.anirbanmu.relay.gateway;

// addressing error: a shard id outside [0, shardCount)
public class UnknownShardException extends IllegalArgumentException {
    private final int shardId;

    public UnknownShardException(int shardId, int shardCount) {
        super("no shard " + shardId + " in a collection of " + shardCount);
        this.shardId = shardId;
    }

    public int shardId() {
        return shardId;
    }
}
