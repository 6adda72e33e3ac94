package com.github.anirbanmu.relay.event;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.relay.cache.ObjectCache;
import com.github.anirbanmu.relay.config.DispatchConfig;
import com.github.anirbanmu.relay.gateway.IncomingGatewayEvent;
import com.github.anirbanmu.relay.gateway.OutgoingGatewayEvent;
import com.github.anirbanmu.relay.model.ModelFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TaskEventDispatcherTest {
    private TaskEventDispatcher dispatcher;
    private Thread loop;

    private TaskEventDispatcher dispatcher(int shards, int maxTasks, boolean chunking) {
        CachedEventParser parser = new CachedEventParser(new ObjectCache(), shards);
        dispatcher = new TaskEventDispatcher(parser, new ModelFactory(null),
            DispatchConfig.defaults().withMaxTasks(maxTasks).withChunking(chunking));
        return dispatcher;
    }

    private void runInBackground(QueueEventSource source) {
        loop = new Thread(() -> {
            try {
                dispatcher.run(source);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } catch (Exception ex) {
                throw new RuntimeException(ex);
            }
        }, "dispatcher-loop");
        loop.setDaemon(true);
        loop.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (loop != null) {
            loop.interrupt();
            loop.join(5000);
        }
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Test
    void runningTasksNeverExceedTheLimit() throws Exception {
        dispatcher(1, 2, false);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch twoStarted = new CountDownLatch(2);
        CountDownLatch allDone = new CountDownLatch(5);
        dispatcher.addHandler(DispatchedEvent.MessageCreate.class, (ctx, event) -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            twoStarted.countDown();
            try {
                release.await();
            } finally {
                running.decrementAndGet();
                allDone.countDown();
            }
        });

        QueueEventSource source = new QueueEventSource(1);
        for (int i = 1; i <= 5; i++) {
            source.dispatch(0, "MESSAGE_CREATE", Payloads.message(i, 9, "m" + i));
        }
        runInBackground(source);

        assertTrue(twoStarted.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);
        assertEquals(2, peak.get());
        assertEquals(0, dispatcher.availablePermits());

        release.countDown();
        assertTrue(allDone.await(5, TimeUnit.SECONDS));
        assertEquals(2, peak.get());
        source.end();
        loop.join(5000);
        assertFalse(loop.isAlive());
    }

    @Test
    void failingHandlerDoesNotStopTheLoop() throws Exception {
        dispatcher(1, 4, false);
        CountDownLatch handled = new CountDownLatch(3);
        AtomicInteger calls = new AtomicInteger();
        dispatcher.addHandler(DispatchedEvent.MessageCreate.class, (ctx, event) -> {
            handled.countDown();
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        });

        QueueEventSource source = new QueueEventSource(1);
        for (int i = 1; i <= 3; i++) {
            source.dispatch(0, "MESSAGE_CREATE", Payloads.message(i, 9, "m" + i));
        }
        source.end();
        dispatcher.run(source);

        assertTrue(handled.await(5, TimeUnit.SECONDS));
        assertEquals(3, calls.get());
    }

    @Test
    void malformedDispatchIsSkipped() throws Exception {
        dispatcher(1, 4, false);
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch handled = new CountDownLatch(1);
        dispatcher.addHandler(DispatchedEvent.GuildMemberRemove.class, (ctx, event) -> seen.add("remove"));
        dispatcher.addHandler(DispatchedEvent.MessageCreate.class, (ctx, event) -> {
            seen.add(event.message().content());
            handled.countDown();
        });

        QueueEventSource source = new QueueEventSource(1);
        source.dispatch(0, "GUILD_MEMBER_REMOVE", "{\"guild_id\":\"1\"}");
        source.dispatch(0, "MESSAGE_CREATE", Payloads.message(1, 9, "after"));
        source.end();
        dispatcher.run(source);

        assertTrue(handled.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("after"), seen);
    }

    @Test
    void gatewayHandlersRunOnTheLoopThread() throws Exception {
        dispatcher(1, 1, false);
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        List<Integer> acks = Collections.synchronizedList(new ArrayList<>());
        dispatcher.addGatewayHandler(IncomingGatewayEvent.HeartbeatAck.class, event -> {
            threads.add(Thread.currentThread().getName());
            acks.add(event.ackCount());
        });

        QueueEventSource source = new QueueEventSource(1);
        source.push(new IncomingGatewayEvent.HeartbeatAck(0, 1));
        source.push(new IncomingGatewayEvent.Hello(0, 41250));
        source.push(new IncomingGatewayEvent.HeartbeatAck(0, 2));
        source.end();
        dispatcher.run(source);

        assertEquals(List.of(1, 2), acks);
        assertEquals(List.of(Thread.currentThread().getName(), Thread.currentThread().getName()), threads);
    }

    @Test
    void readyFiresOnceAfterEveryShard() throws Exception {
        dispatcher(2, 4, false);
        AtomicInteger shardReady = new AtomicInteger();
        AtomicInteger ready = new AtomicInteger();
        CountDownLatch readySeen = new CountDownLatch(1);
        dispatcher.addHandler(DispatchedEvent.ShardReady.class, (ctx, event) -> shardReady.incrementAndGet());
        dispatcher.addHandler(DispatchedEvent.Ready.class, (ctx, event) -> {
            ready.incrementAndGet();
            readySeen.countDown();
        });

        QueueEventSource source = new QueueEventSource(2);
        source.dispatch(0, "READY", Payloads.ready());
        source.dispatch(1, "READY", Payloads.ready(7));
        source.dispatch(1, "GUILD_CREATE", Payloads.guild(7, "seven", false));
        // a later re-identify on shard 0
        source.dispatch(0, "READY", Payloads.ready());
        source.end();
        dispatcher.run(source);

        assertTrue(readySeen.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(1, ready.get());
        assertEquals(2, shardReady.get());
    }

    @Test
    void largeGuildsAreChunkedOnTheirShard() throws Exception {
        dispatcher(2, 4, true);
        QueueEventSource source = new QueueEventSource(2);
        runInBackground(source);

        source.dispatch(1, "READY", Payloads.ready());
        source.dispatch(1, "GUILD_CREATE", Payloads.guild(4, "small", false));
        source.dispatch(1, "GUILD_CREATE", Payloads.guild(3, "big", true));

        QueueEventSource.Sent sent = source.awaitSent();
        assertEquals(1, sent.shardId());
        OutgoingGatewayEvent.MemberChunkRequest request =
            assertInstanceOf(OutgoingGatewayEvent.MemberChunkRequest.class, sent.event());
        assertEquals(3, request.guildId());
        assertEquals("", request.query());
        assertEquals(Integer.valueOf(0), request.limit());

        GuildChunker chunker = dispatcher.chunker();
        assertTrue(chunker.awaitGuild(4, Duration.ofSeconds(5)));
        assertFalse(chunker.isChunked(3));

        String chunk = "{\"guild_id\":\"3\",\"chunk_index\":0,\"chunk_count\":2,\"members\":[" + Payloads.member(10, "a") + "]}";
        String last = "{\"guild_id\":\"3\",\"chunk_index\":1,\"chunk_count\":2,\"members\":[" + Payloads.member(11, "b") + "]}";
        source.dispatch(1, "GUILD_MEMBERS_CHUNK", chunk);
        assertFalse(chunker.awaitGuild(3, Duration.ofMillis(200)));
        source.dispatch(1, "GUILD_MEMBERS_CHUNK", last);
        assertTrue(chunker.awaitGuild(3, Duration.ofSeconds(5)));

        assertThrows(IllegalArgumentException.class, () -> chunker.awaitGuild(99, Duration.ofMillis(1)));
        assertNull(source.sent.poll(100, TimeUnit.MILLISECONDS));
    }
}
