package com.github.anirbanmu.relay.gateway;

import com.github.anirbanmu.relay.config.GatewayConfig;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.util.Threads;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

// one shard's connection: reconnect loop around Gateway. a fresh gateway per attempt,
// session state carried across. outgoing commands are queued and written only while steady.
public class ShardConnection {
    private static final String QUERY = "?v=10&encoding=json";

    private final ShardIdentity shard;
    private final String token;
    private final URI gatewayUrl;
    private final GatewayConfig config;
    private final GatewayTransport transport;
    private final EventSink sink;
    private final DoubleSupplier jitter;
    private final SessionState session = new SessionState();
    private final BlockingQueue<OutgoingGatewayEvent> outgoing;
    private final Log.Bound log;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition stateChanged = stateLock.newCondition();
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private int steadyGeneration;

    private volatile boolean running = true;
    private volatile Gateway current;
    private volatile Thread runner;
    private volatile Thread sender;

    public ShardConnection(ShardIdentity shard, String token, URI gatewayUrl, GatewayConfig config,
                           GatewayTransport transport, EventSink sink) {
        this(shard, token, gatewayUrl, config, transport, sink, () -> ThreadLocalRandom.current().nextDouble());
    }

    // jitter supplies values in [0, 1) for the first heartbeat delay
    ShardConnection(ShardIdentity shard, String token, URI gatewayUrl, GatewayConfig config,
                    GatewayTransport transport, EventSink sink, DoubleSupplier jitter) {
        this.shard = shard;
        this.token = token;
        this.gatewayUrl = gatewayUrl;
        this.config = config;
        this.transport = transport;
        this.sink = sink;
        this.jitter = jitter;
        this.outgoing = new ArrayBlockingQueue<>(config.outgoingQueue());
        this.log = Log.bind("shard", shard.shardId());
    }

    public ShardIdentity shard() {
        return shard;
    }

    public ConnectionState state() {
        return state;
    }

    public SessionState.Snapshot session() {
        return session.snapshot();
    }

    // runs the connection on the calling thread until shutdown() or a fatal error
    public void run() throws GatewayException {
        runner = Thread.currentThread();
        sender = Threads.start("shard-" + shard.shardId() + "-sender", this::senderLoop);
        int attempt = 0;
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                Gateway gw = new Gateway(shard, token, config, session, sink, this::setState, jitter);
                current = gw;

                Gateway.Closure closure;
                try {
                    gw.connect(transport, connectUrl());
                    closure = gw.awaitClosed();
                } catch (IOException ex) {
                    log.warn("shard.connect_failed", "error", ex.getMessage());
                    closure = new Gateway.Closure(Gateway.CloseKind.RECONNECT, -1, ex.getMessage());
                } catch (RuntimeException ex) {
                    // a rejected url or a transport bug; the stored resume url may be the culprit
                    log.warn("shard.connect_failed", ex, "resume", session.canResume());
                    session.invalidate();
                    closure = new Gateway.Closure(Gateway.CloseKind.RECONNECT, -1, String.valueOf(ex.getMessage()));
                } catch (InterruptedException ex) {
                    break;
                } finally {
                    if (!running) {
                        gw.disconnect();
                    }
                    current = null;
                }

                if (closure.kind() == Gateway.CloseKind.FATAL) {
                    throw new GatewayException(shard.shardId(), closure.code(),
                        "shard " + shard.shardId() + " closed with code " + closure.code() + ": " + closure.reason());
                }
                if (!running) {
                    break;
                }

                if (gw.wasReady()) {
                    attempt = 0;
                }
                attempt++;
                if (config.maxReconnectAttempts() > 0 && attempt > config.maxReconnectAttempts()) {
                    throw new GatewayException(shard.shardId(),
                        "shard " + shard.shardId() + " gave up after " + config.maxReconnectAttempts() + " reconnect attempts");
                }

                setState(ConnectionState.RECONNECTING);
                long delay = backoffDelay(attempt, config.backoffMin(), config.backoffMax(), ThreadLocalRandom.current().nextDouble());
                log.info("shard.reconnect_scheduled", "attempt", attempt, "delay_ms", delay, "resume", session.canResume());

                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ex) {
                    break;
                }
            }
        } finally {
            running = false;
            Thread s = sender;
            if (s != null) {
                s.interrupt();
            }
            outgoing.clear();
            setState(ConnectionState.CLOSED);
        }
    }

    // queue a command for this shard. blocks while the outgoing queue is full.
    public void send(OutgoingGatewayEvent event) throws InterruptedException {
        if (!running) {
            throw new IllegalStateException("shard " + shard.shardId() + " is closed");
        }
        if (event instanceof OutgoingGatewayEvent.Identify || event instanceof OutgoingGatewayEvent.Resume) {
            throw new IllegalArgumentException("identify and resume are sent by the connection itself");
        }
        if (event instanceof OutgoingGatewayEvent.Heartbeat) {
            // never queued: only meaningful on the live socket
            Gateway gw = current;
            if (state == ConnectionState.STEADY && gw != null) {
                gw.send(event);
            } else {
                log.debug("shard.heartbeat_dropped", "state", state);
            }
            return;
        }
        outgoing.put(event);
    }

    // from any state to CLOSED. sends close 1000 on a live socket.
    public void shutdown() {
        if (!running && state == ConnectionState.CLOSED) {
            return;
        }
        running = false;
        Gateway gw = current;
        if (gw != null) {
            gw.disconnect();
        }
        Thread r = runner;
        if (r != null) {
            r.interrupt();
        }
        Thread s = sender;
        if (s != null) {
            s.interrupt();
        }
        outgoing.clear();
        setState(ConnectionState.CLOSED);
        log.info("shard.shutdown");
    }

    // min(min * 2^(attempt-1), max), then uniformly within [delay/2, delay]
    static long backoffDelay(int attempt, Duration min, Duration max, double random) {
        long base = min.toMillis();
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = Math.min(base << shift, max.toMillis());
        if (delay < 0) {
            delay = max.toMillis();
        }
        long half = delay / 2;
        return half + (long) ((delay - half) * random);
    }

    URI connectUrl() {
        String resumeUrl = session.resumeUrl();
        if (session.canResume() && resumeUrl != null) {
            return URI.create(stripQuery(resumeUrl) + QUERY);
        }
        return URI.create(stripQuery(gatewayUrl.toString()) + QUERY);
    }

    private static String stripQuery(String url) {
        int q = url.indexOf('?');
        String base = q >= 0 ? url.substring(0, q) : url;
        return base.endsWith("/") ? base : base + "/";
    }

    private void setState(ConnectionState next) {
        stateLock.lock();
        try {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            if (state != next) {
                log.debug("shard.state", "from", state, "to", next);
            }
            state = next;
            if (next == ConnectionState.STEADY) {
                steadyGeneration++;
            }
            stateChanged.signalAll();
        } finally {
            stateLock.unlock();
        }
    }

    // waits for a STEADY period newer than the one identified by seenGeneration
    private int awaitSteady(int seenGeneration) throws InterruptedException {
        stateLock.lock();
        try {
            while (state != ConnectionState.STEADY || steadyGeneration == seenGeneration) {
                if (state == ConnectionState.CLOSED) {
                    throw new InterruptedException("shard closed");
                }
                stateChanged.await();
            }
            return steadyGeneration;
        } finally {
            stateLock.unlock();
        }
    }

    private void senderLoop() {
        try {
            while (running) {
                OutgoingGatewayEvent event = outgoing.take();
                int generation = -1;
                while (true) {
                    generation = awaitSteady(generation);
                    Gateway gw = current;
                    if (gw != null && gw.send(event)) {
                        log.debug("shard.sent", "event", event.getClass().getSimpleName());
                        break;
                    }
                    log.info("shard.send_deferred", "event", event.getClass().getSimpleName());
                }
            }
        } catch (InterruptedException ex) {
            log.debug("shard.sender_stopped");
        }
    }
}
