package com.github.anirbanmu.relay.event;

import com.github.anirbanmu.relay.gateway.GatewayEventSource;
import com.github.anirbanmu.relay.gateway.GatewayException;
import com.github.anirbanmu.relay.gateway.IncomingGatewayEvent;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.model.ModelFactory;
import java.util.BitSet;

// the shared pull loop: read from the source, hand raw events to gateway handlers,
// parse dispatches and hand the results to domain handlers. subclasses decide how handlers run.
public abstract class AbstractEventDispatcher implements AutoCloseable {
    protected final CachedEventParser parser;
    protected final ModelFactory factory;
    private final GuildChunker chunker;
    private final BitSet readyShards = new BitSet();
    private boolean readyFired;

    protected AbstractEventDispatcher(CachedEventParser parser, ModelFactory factory, boolean chunking) {
        this.parser = parser;
        this.factory = factory;
        this.chunker = chunking ? new GuildChunker() : null;
    }

    // null when automatic chunking is off
    public GuildChunker chunker() {
        return chunker;
    }

    // runs until the source is exhausted. a fatal shard error is rethrown.
    public final void run(GatewayEventSource source) throws GatewayException, InterruptedException {
        int shardCount = source.shardCount();
        Log.info("dispatcher.started", "type", getClass().getSimpleName(), "shards", shardCount, "chunking", chunker != null);
        if (chunker != null) {
            chunker.start(source);
        }
        try {
            while (true) {
                IncomingGatewayEvent event = source.next();
                if (event == null) {
                    break;
                }
                deliverGateway(event);

                if (!(event instanceof IncomingGatewayEvent.Dispatch)) {
                    continue;
                }
                IncomingGatewayEvent.Dispatch dispatch = (IncomingGatewayEvent.Dispatch) event;
                EventContext ctx = new EventContext(dispatch.shardId(), dispatch.eventName(), dispatch.sequence(), factory.client());

                for (DispatchedEvent parsed : parser.parse(dispatch, factory)) {
                    observe(ctx, parsed);
                    deliver(ctx, parsed);
                    if (parsed instanceof DispatchedEvent.ShardReady) {
                        readyShards.set(ctx.shardId());
                        if (!readyFired && readyShards.cardinality() >= shardCount) {
                            readyFired = true;
                            Log.info("dispatcher.ready", "shards", shardCount);
                            deliver(ctx, new DispatchedEvent.Ready());
                        }
                    }
                }
            }
        } finally {
            if (chunker != null) {
                chunker.stop();
            }
            Log.info("dispatcher.stopped", "type", getClass().getSimpleName());
        }
    }

    private void observe(EventContext ctx, DispatchedEvent event) {
        if (chunker == null) {
            return;
        }
        if (event instanceof DispatchedEvent.GuildJoined joined) {
            chunker.handleGuild(ctx.shardId(), joined.guild());
        } else if (event instanceof DispatchedEvent.GuildStreamed streamed) {
            chunker.handleGuild(ctx.shardId(), streamed.guild());
        } else if (event instanceof DispatchedEvent.GuildAvailable available) {
            chunker.handleGuild(ctx.shardId(), available.guild());
        } else if (event instanceof DispatchedEvent.GuildMemberChunk chunk) {
            chunker.handleChunk(chunk);
        }
    }

    protected abstract void deliverGateway(IncomingGatewayEvent event) throws InterruptedException;

    protected abstract void deliver(EventContext ctx, DispatchedEvent event) throws InterruptedException;

    // a failing handler never stops the loop
    protected static void runHandler(Object event, int shardId, Object handler, HandlerCall call) {
        try {
            call.run();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            Log.debug("dispatcher.handler_interrupted", "event", event.getClass().getSimpleName(), "shard", shardId);
        } catch (Exception ex) {
            Log.error("dispatcher.handler_failed", ex,
                "event", event.getClass().getSimpleName(), "shard", shardId, "handler", handler.getClass().getName());
        }
    }

    @FunctionalInterface
    protected interface HandlerCall {
        void run() throws Exception;
    }

    @Override
    public abstract void close();
}
