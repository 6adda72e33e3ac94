package com.github.anirbanmu.relay.gateway;

import com.github.anirbanmu.relay.config.GatewayConfig;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.util.Threads;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;

// every shard of one bot, fanned into a single bounded stream.
// per-shard order is kept; nothing is promised across shards.
public class GatewayCollection implements GatewayEventSource, AutoCloseable {
    private static final Item END = new Item(null);

    private final GatewayConfig config;
    private final List<ShardConnection> shards;
    private final List<Thread> threads = new ArrayList<>();
    private final BlockingQueue<Item> stream;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<GatewayException> failure = new AtomicReference<>();

    private record Item(IncomingGatewayEvent event) {
    }

    public GatewayCollection(String token, URI gatewayUrl, int shardCount, GatewayConfig config, GatewayTransport transport) {
        this(token, gatewayUrl, shardCount, config, transport, () -> ThreadLocalRandom.current().nextDouble());
    }

    // jitter pins the first heartbeat delay in tests
    GatewayCollection(String token, URI gatewayUrl, int shardCount, GatewayConfig config, GatewayTransport transport,
                      DoubleSupplier jitter) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be at least 1: " + shardCount);
        }
        this.config = config;
        this.stream = new ArrayBlockingQueue<>(Math.max(1, config.eventBuffer()));
        List<ShardConnection> connections = new ArrayList<>(shardCount);
        EventSink sink = new StreamSink();
        for (int i = 0; i < shardCount; i++) {
            connections.add(new ShardConnection(new ShardIdentity(i, shardCount), token, gatewayUrl, config, transport, sink, jitter));
        }
        this.shards = List.copyOf(connections);
    }

    // one dedicated thread per shard
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Log.info("gateway_collection.starting", "shards", shards.size());
        for (ShardConnection shard : shards) {
            threads.add(Threads.start("shard-" + shard.shard().shardId(), () -> runShard(shard)));
        }
    }

    private void runShard(ShardConnection shard) {
        try {
            shard.run();
        } catch (GatewayException ex) {
            fail(ex);
        } catch (RuntimeException ex) {
            int id = shard.shard().shardId();
            fail(new GatewayException(id, "shard " + id + " stopped unexpectedly: " + ex, ex));
        }
    }

    private void fail(GatewayException ex) {
        Log.error("gateway_collection.shard_failed", ex, "shard", ex.shardId(), "code", ex.closeCode());
        if (failure.compareAndSet(null, ex)) {
            // close from elsewhere: close() joins this thread
            Threads.start("gateway-collection-close", this::close);
        }
    }

    @Override
    public IncomingGatewayEvent next() throws InterruptedException, GatewayException {
        Item item = stream.take();
        if (item == END) {
            // leave the marker for any other consumer
            stream.offer(END);
            GatewayException ex = failure.get();
            if (ex != null) {
                throw ex;
            }
            return null;
        }
        return item.event();
    }

    @Override
    public void sendToShard(int shardId, OutgoingGatewayEvent event) throws InterruptedException {
        if (shardId < 0 || shardId >= shards.size()) {
            throw new UnknownShardException(shardId, shards.size());
        }
        shards.get(shardId).send(event);
    }

    @Override
    public void send(OutgoingGatewayEvent event) throws InterruptedException {
        if (!(event instanceof OutgoingGatewayEvent.Routed routed)) {
            throw new IllegalArgumentException(event.getClass().getSimpleName() + " has no routing key; use sendToShard");
        }
        sendToShard(ShardIdentity.shardFor(routed.routingKey(), shards.size()), event);
    }

    @Override
    public int shardCount() {
        return shards.size();
    }

    public ConnectionState shardState(int shardId) {
        if (shardId < 0 || shardId >= shards.size()) {
            throw new UnknownShardException(shardId, shards.size());
        }
        return shards.get(shardId).state();
    }

    public boolean isClosed() {
        return closed.get();
    }

    // shuts every shard down, waits for their threads, then ends the stream
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Log.info("gateway_collection.closing", "shards", shards.size());
        for (ShardConnection shard : shards) {
            shard.shutdown();
        }
        long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
        for (Thread thread : threads) {
            if (thread == Thread.currentThread()) {
                continue;
            }
            try {
                long remaining = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
                thread.join(remaining);
                if (thread.isAlive()) {
                    Log.warn("gateway_collection.shard_join_timeout", "thread", thread.getName());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        while (!stream.offer(END)) {
            stream.clear();
        }
        Log.info("gateway_collection.closed");
    }

    private final class StreamSink implements EventSink {
        @Override
        public void publish(IncomingGatewayEvent event) throws InterruptedException {
            if (closed.get()) {
                return;
            }
            stream.put(new Item(event));
        }

        @Override
        public boolean offer(IncomingGatewayEvent event) {
            if (closed.get()) {
                return false;
            }
            boolean accepted = stream.offer(new Item(event));
            if (!accepted) {
                Log.debug("gateway_collection.event_dropped", "shard", event.shardId(), "event", event.getClass().getSimpleName());
            }
            return accepted;
        }
    }
}
