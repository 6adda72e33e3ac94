package com.github.anirbanmu.relay.event;

@FunctionalInterface
public interface EventHandler<E extends DispatchedEvent> {
    void handle(EventContext ctx, E event) throws Exception;
}
