package com.github.anirbanmu.relay.gateway;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

class QueueSink implements EventSink {
    final BlockingQueue<IncomingGatewayEvent> events;

    QueueSink(int capacity) {
        this.events = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public void publish(IncomingGatewayEvent event) throws InterruptedException {
        events.put(event);
    }

    @Override
    public boolean offer(IncomingGatewayEvent event) {
        return events.offer(event);
    }

    IncomingGatewayEvent take() throws InterruptedException {
        IncomingGatewayEvent event = events.poll(5, TimeUnit.SECONDS);
        if (event == null) {
            throw new AssertionError("no event arrived");
        }
        return event;
    }

    // skips events of other types
    <T extends IncomingGatewayEvent> T takeNext(Class<T> type) throws InterruptedException {
        while (true) {
            IncomingGatewayEvent event = take();
            if (type.isInstance(event)) {
                return type.cast(event);
            }
        }
    }
}
