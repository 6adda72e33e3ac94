package com.github.anirbanmu.relay.gateway;

// events a shard emits into the collection stream
public sealed interface IncomingGatewayEvent {

    int shardId();

    // voidable events are dropped instead of waiting when the stream is full
    default boolean voidable() {
        return true;
    }

    record Hello(int shardId, long heartbeatIntervalMs) implements IncomingGatewayEvent {
    }

    // payload is the whole frame; its "d" member carries the event body
    record Dispatch(int shardId, String eventName, int sequence, String payload) implements IncomingGatewayEvent {
        @Override
        public boolean voidable() {
            return false;
        }
    }

    record HeartbeatAck(int shardId, int ackCount) implements IncomingGatewayEvent {
    }

    record HeartbeatSent(int shardId, int heartbeatCount, Integer sequence) implements IncomingGatewayEvent {
    }

    record InvalidateSession(int shardId, boolean resumable) implements IncomingGatewayEvent {
    }

    record ReconnectRequested(int shardId) implements IncomingGatewayEvent {
    }
}
