package com.github.anirbanmu.relay.gateway;

// a shard failed in a way reconnecting cannot fix
public class GatewayException extends Exception {
    private final int shardId;
    private final int closeCode;

    public GatewayException(int shardId, int closeCode, String message) {
        super(message);
        this.shardId = shardId;
        this.closeCode = closeCode;
    }

    public GatewayException(int shardId, String message) {
        this(shardId, -1, message);
    }

    public GatewayException(int shardId, String message, Throwable cause) {
        super(message, cause);
        this.shardId = shardId;
        this.closeCode = -1;
    }

    public int shardId() {
        return shardId;
    }

    // -1 when the failure was not a close frame
    public int closeCode() {
        return closeCode;
    }
}
