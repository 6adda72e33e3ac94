package com.github.anirbanmu.relay.config;

import java.time.Duration;

// shardCount 0 means "use the gateway's recommendation". maxReconnectAttempts 0 means unlimited.
public record GatewayConfig(int intents, int shardCount, int eventBuffer, int outgoingQueue, int largeThreshold, Duration connectTimeout, Duration backoffMin, Duration backoffMax, int maxReconnectAttempts, Duration shutdownTimeout) {

    // all non-privileged intents plus guild members and message content
    public static final int DEFAULT_INTENTS = (1 << 22) - 1;

    public GatewayConfig {
        if (shardCount < 0) {
            throw new ConfigException("gateway.shard_count must not be negative: " + shardCount);
        }
        if (eventBuffer < 1) {
            throw new ConfigException("gateway.event_buffer must be at least 1: " + eventBuffer);
        }
        if (outgoingQueue < 1) {
            throw new ConfigException("gateway.outgoing_queue must be at least 1: " + outgoingQueue);
        }
        if (maxReconnectAttempts < 0) {
            throw new ConfigException("gateway.max_reconnect_attempts must not be negative: " + maxReconnectAttempts);
        }
        if (backoffMin.isNegative() || backoffMax.compareTo(backoffMin) < 0) {
            throw new ConfigException("gateway.backoff_max must be >= gateway.backoff_min");
        }
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig(DEFAULT_INTENTS, 0, 16, 64, 50,
            Duration.ofSeconds(10), Duration.ofSeconds(1), Duration.ofSeconds(60), 0, Duration.ofSeconds(5));
    }

    public GatewayConfig withBackoff(Duration min, Duration max) {
        return new GatewayConfig(intents, shardCount, eventBuffer, outgoingQueue, largeThreshold, connectTimeout,
            min, max, maxReconnectAttempts, shutdownTimeout);
    }

    public GatewayConfig withEventBuffer(int size) {
        return new GatewayConfig(intents, shardCount, size, outgoingQueue, largeThreshold, connectTimeout,
            backoffMin, backoffMax, maxReconnectAttempts, shutdownTimeout);
    }

    public GatewayConfig withMaxReconnectAttempts(int attempts) {
        return new GatewayConfig(intents, shardCount, eventBuffer, outgoingQueue, largeThreshold, connectTimeout,
            backoffMin, backoffMax, attempts, shutdownTimeout);
    }
}
