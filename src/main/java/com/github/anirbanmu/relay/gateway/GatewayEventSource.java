package com.github.anirbanmu.relay.gateway;

// a multiplexed stream of shard events, plus the way back to the shards
public interface GatewayEventSource {

    // blocks for the next event. null once the source is closed.
    IncomingGatewayEvent next() throws InterruptedException, GatewayException;

    void sendToShard(int shardId, OutgoingGatewayEvent event) throws InterruptedException;

    // routes by the event's routing key
    void send(OutgoingGatewayEvent event) throws InterruptedException;

    int shardCount();
}
