package com.github.anirbanmu.relay.gateway;

// where a shard pushes what it receives
public interface EventSink {

    // waits for room
    void publish(IncomingGatewayEvent event) throws InterruptedException;

    // false when there was no room and the event was dropped
    boolean offer(IncomingGatewayEvent event);
}
