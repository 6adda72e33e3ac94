package com.github.anirbanmu.relay.event;

import com.github.anirbanmu.relay.config.DispatchConfig;
import com.github.anirbanmu.relay.gateway.IncomingGatewayEvent;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.model.ModelFactory;
import com.github.anirbanmu.relay.util.Threads;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

// one bounded channel and one worker thread per registration. the loop hands every event to
// every matching channel and only moves on once all of them took it, so a slow handler
// holds up everything behind it.
public final class ChannelEventDispatcher extends AbstractEventDispatcher {
    private final DispatchConfig config;
    private final List<Route> routes = new CopyOnWriteArrayList<>();

    private record Delivery(EventContext ctx, Object event) {
    }

    private static final class Route {
        final Class<?> type;
        final BlockingQueue<Delivery> channel;
        final Thread worker;

        Route(Class<?> type, Object handler, int capacity, Invoker invoker) {
            this.type = type;
            // capacity 0: the put only returns once the worker has taken the event
            this.channel = capacity == 0 ? new SynchronousQueue<>() : new ArrayBlockingQueue<>(capacity);
            this.worker = Threads.start("event-channel-" + type.getSimpleName(), () -> {
                try {
                    while (!Thread.currentThread().isInterrupted()) {
                        Delivery delivery = channel.take();
                        int shard = delivery.ctx() != null
                            ? delivery.ctx().shardId()
                            : ((IncomingGatewayEvent) delivery.event()).shardId();
                        runHandler(delivery.event(), shard, handler, () -> invoker.invoke(delivery));
                    }
                } catch (InterruptedException ex) {
                    Log.debug("dispatcher.channel_stopped", "event", type.getSimpleName());
                }
            });
        }
    }

    @FunctionalInterface
    private interface Invoker {
        void invoke(Delivery delivery) throws Exception;
    }

    public ChannelEventDispatcher(CachedEventParser parser, ModelFactory factory, DispatchConfig config) {
        super(parser, factory, config.chunking());
        this.config = config;
    }

    public <E extends DispatchedEvent> void addHandler(Class<E> type, EventHandler<? super E> handler) {
        addHandler(type, config.channelCapacity(), handler);
    }

    public <E extends DispatchedEvent> void addHandler(Class<E> type, int capacity, EventHandler<? super E> handler) {
        checkCapacity(capacity);
        routes.add(new Route(type, handler, capacity, d -> handler.handle(d.ctx(), type.cast(d.event()))));
        Log.info("dispatcher.registered", "event", type.getSimpleName(), "capacity", capacity, "handler", handler.getClass().getName());
    }

    public <E extends IncomingGatewayEvent> void addGatewayHandler(Class<E> type, GatewayEventHandler<? super E> handler) {
        addGatewayHandler(type, config.channelCapacity(), handler);
    }

    public <E extends IncomingGatewayEvent> void addGatewayHandler(Class<E> type, int capacity, GatewayEventHandler<? super E> handler) {
        checkCapacity(capacity);
        routes.add(new Route(type, handler, capacity, d -> handler.handle(type.cast(d.event()))));
        Log.info("dispatcher.registered", "event", type.getSimpleName(), "capacity", capacity, "handler", handler.getClass().getName());
    }

    private static void checkCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("channel capacity must not be negative: " + capacity);
        }
    }

    @Override
    protected void deliverGateway(IncomingGatewayEvent event) throws InterruptedException {
        put(null, event);
    }

    @Override
    protected void deliver(EventContext ctx, DispatchedEvent event) throws InterruptedException {
        put(ctx, event);
    }

    private void put(EventContext ctx, Object event) throws InterruptedException {
        for (Route route : routes) {
            if (route.type == event.getClass()) {
                route.channel.put(new Delivery(ctx, event));
            }
        }
    }

    // stops every worker; anything still in a channel is dropped
    @Override
    public void close() {
        for (Route route : routes) {
            route.worker.interrupt();
        }
        long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
        for (Route route : routes) {
            try {
                long remaining = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
                route.worker.join(remaining);
                if (route.worker.isAlive()) {
                    Log.warn("dispatcher.channel_timeout", "event", route.type.getSimpleName());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
