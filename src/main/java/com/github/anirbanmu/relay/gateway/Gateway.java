package com.github.anirbanmu.relay.gateway;

import com.github.anirbanmu.relay.config.GatewayConfig;
import com.github.anirbanmu.relay.discord.json.Identify;
import com.github.anirbanmu.relay.discord.json.RequestGuildMembers;
import com.github.anirbanmu.relay.discord.json.Resume;
import com.github.anirbanmu.relay.gateway.GatewayFrameParser.Frame;
import com.github.anirbanmu.relay.gateway.GatewayFrameParser.ParseResult;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.util.Json;
import com.github.anirbanmu.relay.util.Threads;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.DoubleSupplier;

// single-use gateway connection for one shard. connects once, runs until dead.
// session state is shared with the owning ShardConnection and outlives this instance.
public class Gateway {
    public static final int NORMAL_CLOSURE = 1000;

    // authentication failed, invalid shard, sharding required, invalid api version, invalid/disallowed intents
    static final Set<Integer> FATAL_CLOSE_CODES = Set.of(4004, 4010, 4011, 4012, 4013, 4014);

    public enum CloseKind {
        RECONNECT,
        SHUTDOWN,
        FATAL
    }

    public record Closure(CloseKind kind, int code, String reason) {
    }

    private final ShardIdentity shard;
    private final String token;
    private final GatewayConfig config;
    private final SessionState session;
    private final EventSink sink;
    private final Consumer<ConnectionState> stateListener;
    private final DoubleSupplier jitter;
    private final GatewayFrameParser parser = new GatewayFrameParser();
    private final Log.Bound log;

    private volatile GatewaySocket socket;
    private volatile Thread heartbeatThread;
    private volatile Thread publishingThread;
    private final CountDownLatch helloReceived = new CountDownLatch(1);
    private volatile long heartbeatInterval;
    private volatile long lastHeartbeatSentAt;
    private volatile long lastAckAt = System.nanoTime(); // init to now so first heartbeat check doesn't false-positive
    private final AtomicInteger heartbeatCount = new AtomicInteger();
    private final AtomicInteger ackCount = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CompletableFuture<Closure> closedFuture = new CompletableFuture<>();
    private volatile boolean gotReady;

    public Gateway(ShardIdentity shard, String token, GatewayConfig config, SessionState session, EventSink sink,
                   Consumer<ConnectionState> stateListener, DoubleSupplier jitter) {
        this.shard = shard;
        this.token = token;
        this.config = config;
        this.session = session;
        this.sink = sink;
        this.stateListener = stateListener;
        this.jitter = jitter;
        this.log = Log.bind("shard", shard.shardId());
    }

    // blocks until the websocket handshake completes (or throws)
    public void connect(GatewayTransport transport, URI url) throws IOException, InterruptedException {
        log.info("gateway.connecting", "host", url.getHost());
        stateListener.accept(ConnectionState.CONNECTING);
        GatewaySocket opened = transport.open(url, config.connectTimeout(), new Listener());
        if (socket == null) {
            socket = opened;
        }
        if (closed.get()) {
            // shut down while the handshake was in flight
            opened.abort();
            return;
        }
        heartbeatThread = Threads.start("shard-" + shard.shardId() + "-heartbeat", this::heartbeatLoop);
    }

    // blocks until this gateway dies
    public Closure awaitClosed() throws InterruptedException {
        try {
            return closedFuture.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("gateway future completed exceptionally", ex.getCause());
        }
    }

    // shutdown: close handshake with 1000, session left as is
    public void disconnect() {
        close(CloseKind.SHUTDOWN, NORMAL_CLOSURE, "closing", true);
    }

    // true if we got READY or RESUMED on this connection
    public boolean wasReady() {
        return gotReady;
    }

    // write one outgoing command. identify and resume are driven by the connection itself.
    public boolean send(OutgoingGatewayEvent event) {
        if (event instanceof OutgoingGatewayEvent.Heartbeat) {
            return sendHeartbeat();
        }
        if (event instanceof OutgoingGatewayEvent.MemberChunkRequest request) {
            return sendOpcode(GatewayFrameParser.OP_REQUEST_GUILD_MEMBERS, toWire(request), true);
        }
        throw new IllegalArgumentException("cannot send " + event.getClass().getSimpleName() + " on an established connection");
    }

    static RequestGuildMembers toWire(OutgoingGatewayEvent.MemberChunkRequest request) {
        List<String> userIds = null;
        if (!request.userIds().isEmpty()) {
            userIds = new ArrayList<>(request.userIds().size());
            for (Long id : request.userIds()) {
                userIds.add(Long.toUnsignedString(id));
            }
        }
        return new RequestGuildMembers(Long.toUnsignedString(request.guildId()), request.query(), request.limit(),
            request.presences(), userIds, request.nonce());
    }

    private void closeForReconnect(int code, String reason) {
        close(CloseKind.RECONNECT, code, reason, false);
    }

    private void close(CloseKind kind, int code, String reason, boolean sendCloseFrame) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        Thread hb = heartbeatThread;
        if (hb != null) {
            hb.interrupt();
        }
        if (kind == CloseKind.SHUTDOWN) {
            // a dispatch waiting for room in the stream would otherwise never return
            Thread publisher = publishingThread;
            if (publisher != null) {
                publisher.interrupt();
            }
        }

        GatewaySocket ws = socket;
        if (ws != null) {
            if (sendCloseFrame) {
                ws.close(NORMAL_CLOSURE, reason);
            } else {
                ws.abort();
            }
        }

        log.info("gateway.closed", "kind", kind, "code", code, "reason", reason);
        closedFuture.complete(new Closure(kind, code, reason));
    }

    private void handleMessage(String raw) {
        if (closed.get()) {
            return;
        }
        try {
            ParseResult result = parser.parse(raw);
            Frame frame = result.frame();

            if (frame instanceof Frame.Hello hello) {
                onHello(hello);
            } else if (frame instanceof Frame.Ready ready) {
                Integer seq = result.sequence();
                if (seq != null) {
                    session.recordSequence(seq);
                }
                session.establish(ready.sessionId(), ready.resumeGatewayUrl());
                gotReady = true;
                log.info("gateway.ready", "session", redact(ready.sessionId()));
                stateListener.accept(ConnectionState.STEADY);
                publish("READY", seq, ready.raw());
            } else if (frame instanceof Frame.Dispatch dispatch) {
                // sequence is recorded before the event leaves this shard
                Integer seq = result.sequence();
                if (seq != null) {
                    session.recordSequence(seq);
                }
                if ("RESUMED".equals(dispatch.eventName())) {
                    gotReady = true;
                    log.info("gateway.resumed");
                    stateListener.accept(ConnectionState.STEADY);
                }
                publish(dispatch.eventName(), seq, dispatch.raw());
            } else if (frame instanceof Frame.HeartbeatRequest) {
                sendHeartbeat();
            } else if (frame instanceof Frame.HeartbeatAck) {
                lastAckAt = System.nanoTime();
                sink.offer(new IncomingGatewayEvent.HeartbeatAck(shard.shardId(), ackCount.incrementAndGet()));
            } else if (frame instanceof Frame.Reconnect) {
                log.info("gateway.reconnect_requested");
                sink.offer(new IncomingGatewayEvent.ReconnectRequested(shard.shardId()));
                session.invalidate();
                closeForReconnect(NORMAL_CLOSURE, "reconnect requested");
            } else if (frame instanceof Frame.InvalidSession invalid) {
                log.info("gateway.invalid_session", "resumable", invalid.resumable());
                sink.offer(new IncomingGatewayEvent.InvalidateSession(shard.shardId(), invalid.resumable()));
                if (!invalid.resumable()) {
                    session.invalidate();
                }
                closeForReconnect(NORMAL_CLOSURE, "invalid session");
            } else if (frame instanceof Frame.Unknown unknown) {
                log.debug("gateway.unknown_op", "op", unknown.op());
            }
        } catch (IOException ex) {
            log.error("gateway.message_error", ex);
            closeForReconnect(-1, "unreadable frame");
        } catch (RuntimeException ex) {
            log.error("gateway.message_error", ex);
            closeForReconnect(-1, "frame handling failed");
        }
    }

    private void onHello(Frame.Hello hello) {
        heartbeatInterval = hello.heartbeatInterval();
        log.info("gateway.hello", "interval_ms", hello.heartbeatInterval());
        sink.offer(new IncomingGatewayEvent.Hello(shard.shardId(), hello.heartbeatInterval()));
        if (session.canResume()) {
            sendResume();
        } else {
            sendIdentify();
        }
        // heartbeats start only after identify/resume went out
        helloReceived.countDown();
    }

    private void publish(String eventName, Integer seq, String raw) {
        if (seq == null) {
            log.warn("gateway.dispatch_without_sequence", "event", eventName);
            return;
        }
        publishingThread = Thread.currentThread();
        try {
            sink.publish(new IncomingGatewayEvent.Dispatch(shard.shardId(), eventName, seq, raw));
        } catch (InterruptedException ex) {
            // only happens when shutting down
            log.debug("gateway.publish_interrupted", "event", eventName);
        } finally {
            publishingThread = null;
            Thread.interrupted();
        }
    }

    private void sendIdentify() {
        stateListener.accept(ConnectionState.IDENTIFYING);
        Identify identify = Identify.create(token, config.intents(), shard.shardId(), shard.shardCount(), config.largeThreshold());
        if (!sendOpcode(GatewayFrameParser.OP_IDENTIFY, identify, false)) {
            // network dead, but no session established yet
            closeForReconnect(-1, "identify failed");
            return;
        }
        log.info("gateway.identify_sent");
    }

    private void sendResume() {
        stateListener.accept(ConnectionState.RESUMING);
        SessionState.Snapshot snapshot = session.snapshot();
        Resume resume = new Resume(token, snapshot.sessionId(), snapshot.sequence());
        if (!sendOpcode(GatewayFrameParser.OP_RESUME, resume, false)) {
            closeForReconnect(-1, "resume failed");
            return;
        }
        log.info("gateway.resume_sent", "seq", snapshot.sequence());
    }

    private boolean sendHeartbeat() {
        GatewaySocket ws = socket;
        if (ws == null || closed.get()) {
            return false;
        }
        Integer seq = session.sequence();
        String hb = seq == null ? "{\"op\":1,\"d\":null}" : "{\"op\":1,\"d\":" + seq + "}";
        if (!ws.sendText(hb)) {
            log.warn("gateway.heartbeat_send_failed");
            closeForReconnect(-1, "heartbeat failed");
            return false;
        }
        lastHeartbeatSentAt = System.nanoTime();
        sink.offer(new IncomingGatewayEvent.HeartbeatSent(shard.shardId(), heartbeatCount.incrementAndGet(), seq));
        return true;
    }

    private boolean sendOpcode(int op, Object data, boolean compact) {
        GatewaySocket ws = socket;
        if (ws == null || closed.get()) {
            return false;
        }
        String payload;
        try {
            String body = compact ? Json.encodeCompact(data) : Json.encode(data);
            payload = "{\"op\":" + op + ",\"d\":" + body + "}";
        } catch (IOException ex) {
            log.error("gateway.encode_failed", ex, "op", op);
            return false;
        }
        return ws.sendText(payload);
    }

    private void heartbeatLoop() {
        try {
            if (!helloReceived.await(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("gateway.hello_timeout", "timeout_ms", config.connectTimeout().toMillis());
                closeForReconnect(-1, "no hello");
                return;
            }

            // initial jitter per discord docs
            Thread.sleep((long) (heartbeatInterval * jitter.getAsDouble()));

            while (!closed.get() && !Thread.currentThread().isInterrupted()) {
                sendHeartbeat();
                Thread.sleep(heartbeatInterval);

                if (lastAckAt < lastHeartbeatSentAt) {
                    log.warn("gateway.heartbeat_timeout", "interval_ms", heartbeatInterval);
                    closeForReconnect(-1, "heartbeat not acknowledged");
                    return;
                }
            }
        } catch (InterruptedException ex) {
            log.debug("gateway.heartbeat_stopped");
        }
    }

    private static String redact(String sessionId) {
        if (sessionId == null) {
            return "null";
        }
        return sessionId.length() > 4 ? "..." + sessionId.substring(sessionId.length() - 4) : "REDACTED";
    }

    private class Listener implements GatewaySocket.Listener {
        @Override
        public void onOpen(GatewaySocket ws) {
            socket = ws;
            log.info("gateway.connected");
            stateListener.accept(ConnectionState.AWAITING_HELLO);
        }

        @Override
        public void onText(String frame) {
            handleMessage(frame);
        }

        @Override
        public void onClosed(int code, String reason) {
            if (FATAL_CLOSE_CODES.contains(code)) {
                log.error("gateway.fatal_close", "code", code, "reason", reason);
                close(CloseKind.FATAL, code, reason, false);
                return;
            }
            closeForReconnect(code, reason);
        }

        @Override
        public void onError(Throwable error) {
            log.error("gateway.error", error);
            closeForReconnect(-1, String.valueOf(error.getMessage()));
        }
    }
}
