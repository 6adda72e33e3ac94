package com.github.anirbanmu.relay.event;

import com.github.anirbanmu.relay.gateway.GatewayEventSource;
import com.github.anirbanmu.relay.gateway.OutgoingGatewayEvent;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.model.Guild;
import com.github.anirbanmu.relay.model.Snowflake;
import com.github.anirbanmu.relay.util.Threads;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

// requests member chunks for large guilds as they arrive and tracks which guilds are complete.
// small guilds already carry their members and count as chunked immediately.
public final class GuildChunker {
    private record PendingRequest(int shardId, OutgoingGatewayEvent.MemberChunkRequest request) {
    }

    private final BlockingQueue<PendingRequest> pending = new LinkedBlockingQueue<>();
    private final ConcurrentHashMap<Long, CountDownLatch> fullyChunked = new ConcurrentHashMap<>();
    private volatile Thread sender;

    public void start(GatewayEventSource source) {
        if (sender != null) {
            return;
        }
        sender = Threads.start("guild-chunker", () -> sendLoop(source));
    }

    public void stop() {
        Thread s = sender;
        if (s != null) {
            s.interrupt();
        }
    }

    private void sendLoop(GatewayEventSource source) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                PendingRequest next = pending.take();
                try {
                    source.sendToShard(next.shardId(), next.request());
                } catch (IllegalStateException ex) {
                    Log.warn("chunker.send_failed", "shard", next.shardId(), "guild", Snowflake.toString(next.request().guildId()), "error", ex.getMessage());
                }
            }
        } catch (InterruptedException ex) {
            Log.debug("chunker.stopped", "pending", pending.size());
        }
    }

    // joined, streamed or available guilds
    public void handleGuild(int shardId, Guild guild) {
        CountDownLatch latch = new CountDownLatch(1);
        if (fullyChunked.putIfAbsent(guild.id(), latch) != null) {
            return;
        }
        if (!guild.isLarge()) {
            latch.countDown();
            return;
        }
        Log.debug("chunker.request", "shard", shardId, "guild", Snowflake.toString(guild.id()));
        pending.add(new PendingRequest(shardId, OutgoingGatewayEvent.MemberChunkRequest.allMembers(guild.id(), null)));
    }

    public void handleChunk(DispatchedEvent.GuildMemberChunk chunk) {
        long guildId = chunk.guild().id();
        Log.debug("chunker.chunk", "guild", Snowflake.toString(guildId), "index", chunk.chunkIndex() + 1, "count", chunk.chunkCount());
        if (chunk.isLast()) {
            fullyChunked.computeIfAbsent(guildId, id -> new CountDownLatch(1)).countDown();
            Log.debug("chunker.guild_complete", "guild", Snowflake.toString(guildId));
        }
    }

    public boolean isChunked(long guildId) {
        CountDownLatch latch = fullyChunked.get(guildId);
        return latch != null && latch.getCount() == 0;
    }

    // blocks until the guild's last chunk has arrived
    public void awaitGuild(long guildId) throws InterruptedException {
        latchFor(guildId).await();
    }

    public boolean awaitGuild(long guildId, Duration timeout) throws InterruptedException {
        return latchFor(guildId).await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private CountDownLatch latchFor(long guildId) {
        CountDownLatch latch = fullyChunked.get(guildId);
        if (latch == null) {
            throw new IllegalArgumentException("no such guild: " + Snowflake.toString(guildId));
        }
        return latch;
    }
}
