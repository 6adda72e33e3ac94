package com.github.anirbanmu.relay.event;

import com.github.anirbanmu.relay.gateway.IncomingGatewayEvent;

// handler for raw shard events (hello, heartbeat acks, dispatch frames, ...)
@FunctionalInterface
public interface GatewayEventHandler<E extends IncomingGatewayEvent> {
    void handle(E event) throws Exception;
}
