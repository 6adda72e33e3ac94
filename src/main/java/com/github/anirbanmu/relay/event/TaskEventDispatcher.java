package com.github.anirbanmu.relay.event;

import com.github.anirbanmu.relay.config.DispatchConfig;
import com.github.anirbanmu.relay.gateway.IncomingGatewayEvent;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.model.ModelFactory;
import com.github.anirbanmu.relay.util.Threads;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

// every (event, handler) pair becomes a task on a worker pool. at most maxTasks run at once;
// when all permits are taken the pull loop waits, which in turn backs up the shards.
public final class TaskEventDispatcher extends AbstractEventDispatcher {
    private final DispatchConfig config;
    private final Semaphore permits;
    private final ExecutorService workers = Executors.newCachedThreadPool(Threads.factory("event-task"));
    private final Map<Class<?>, List<Registration<DomainCall>>> handlers = new ConcurrentHashMap<>();
    private final Map<Class<?>, List<Registration<GatewayCall>>> gatewayHandlers = new ConcurrentHashMap<>();

    // the handler is kept for logging; the call closes over its typed cast
    private record Registration<C>(Object handler, C call) {
    }

    @FunctionalInterface
    private interface DomainCall {
        void invoke(EventContext ctx, DispatchedEvent event) throws Exception;
    }

    @FunctionalInterface
    private interface GatewayCall {
        void invoke(IncomingGatewayEvent event) throws Exception;
    }

    public TaskEventDispatcher(CachedEventParser parser, ModelFactory factory, DispatchConfig config) {
        super(parser, factory, config.chunking());
        this.config = config;
        this.permits = new Semaphore(config.maxTasks());
    }

    public <E extends DispatchedEvent> void addHandler(Class<E> type, EventHandler<? super E> handler) {
        handlers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>())
            .add(new Registration<>(handler, (ctx, event) -> handler.handle(ctx, type.cast(event))));
        Log.info("dispatcher.registered", "event", type.getSimpleName(), "handler", handler.getClass().getName());
    }

    public <E extends IncomingGatewayEvent> void addGatewayHandler(Class<E> type, GatewayEventHandler<? super E> handler) {
        gatewayHandlers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>())
            .add(new Registration<>(handler, event -> handler.handle(type.cast(event))));
        Log.info("dispatcher.registered", "event", type.getSimpleName(), "handler", handler.getClass().getName());
    }

    // permits not currently held by a running task
    public int availablePermits() {
        return permits.availablePermits();
    }

    @Override
    protected void deliverGateway(IncomingGatewayEvent event) {
        List<Registration<GatewayCall>> registered = gatewayHandlers.get(event.getClass());
        if (registered == null) {
            return;
        }
        for (Registration<GatewayCall> r : registered) {
            runHandler(event, event.shardId(), r.handler(), () -> r.call().invoke(event));
        }
    }

    @Override
    protected void deliver(EventContext ctx, DispatchedEvent event) throws InterruptedException {
        List<Registration<DomainCall>> registered = handlers.get(event.getClass());
        if (registered == null) {
            return;
        }
        Log.debug("dispatcher.dispatch", "event", event.getClass().getSimpleName(), "shard", ctx.shardId());
        for (Registration<DomainCall> r : registered) {
            permits.acquire();
            try {
                workers.execute(() -> {
                    try {
                        runHandler(event, ctx.shardId(), r.handler(), () -> r.call().invoke(ctx, event));
                    } finally {
                        permits.release();
                    }
                });
            } catch (RejectedExecutionException ex) {
                permits.release();
                throw ex;
            }
        }
    }

    // interrupts running tasks and waits for them
    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                Log.warn("dispatcher.task_timeout", "timeout_ms", config.shutdownTimeout().toMillis());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
