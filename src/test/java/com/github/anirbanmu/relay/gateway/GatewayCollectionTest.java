package com.github.anirbanmu.relay.gateway;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.relay.config.GatewayConfig;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GatewayCollectionTest {
    private final FakeTransport transport = new FakeTransport();
    private GatewayCollection collection;

    private GatewayCollection open(int shards) {
        GatewayConfig config = GatewayConfig.defaults()
            .withBackoff(Duration.ofMillis(10), Duration.ofMillis(20))
            .withEventBuffer(64);
        collection = new GatewayCollection("tok", URI.create("wss://gateway.test"), shards, config, transport, () -> 0.999);
        collection.start();
        return collection;
    }

    @AfterEach
    void close() {
        if (collection != null) {
            collection.close();
        }
    }

    // says hello on every socket and sorts them by the shard they identified as
    private FakeTransport.FakeSocket[] identifyAll(int shards) throws InterruptedException {
        FakeTransport.FakeSocket[] byShard = new FakeTransport.FakeSocket[shards];
        for (int i = 0; i < shards; i++) {
            FakeTransport.FakeSocket socket = transport.awaitOpen();
            socket.receive(Frames.hello(41250));
            String identify = socket.nextSent();
            for (int shard = 0; shard < shards; shard++) {
                if (identify.contains("\"shard\":[" + shard + "," + shards + "]")) {
                    byShard[shard] = socket;
                }
            }
        }
        for (int shard = 0; shard < shards; shard++) {
            assertNotNull(byShard[shard], "shard " + shard + " never identified");
        }
        return byShard;
    }

    @Test
    void chunkRequestsRouteByGuildId() throws Exception {
        open(2);
        FakeTransport.FakeSocket[] sockets = identifyAll(2);
        sockets[0].receive(Frames.ready(1, "s0", "wss://resume.test"));
        sockets[1].receive(Frames.ready(1, "s1", "wss://resume.test"));

        collection.send(OutgoingGatewayEvent.MemberChunkRequest.forUsers(5L, List.of(1L)));

        String frame = sockets[1].nextSent();
        assertTrue(frame.contains("\"guild_id\":\"5\""), frame);
        assertNull(sockets[0].pollSent(200));
    }

    @Test
    void unknownShardIsAnAddressingError() throws Exception {
        open(2);
        FakeTransport.FakeSocket[] sockets = identifyAll(2);
        sockets[0].receive(Frames.ready(1, "s0", "wss://resume.test"));
        sockets[1].receive(Frames.ready(1, "s1", "wss://resume.test"));
        OutgoingGatewayEvent event = OutgoingGatewayEvent.MemberChunkRequest.forUsers(5L, List.of(1L));

        UnknownShardException ex = assertThrows(UnknownShardException.class, () -> collection.sendToShard(2, event));
        assertEquals(2, ex.shardId());
        assertThrows(UnknownShardException.class, () -> collection.sendToShard(-1, event));
        assertThrows(UnknownShardException.class, () -> collection.shardState(2));

        assertNull(sockets[0].pollSent(200));
        assertNull(sockets[1].pollSent(200));
    }

    @Test
    void transportFailureDoesNotStopTheShard() throws Exception {
        transport.failNextOpen(new IllegalArgumentException("bad header"));
        open(1);

        FakeTransport.FakeSocket socket = identifyAll(1)[0];
        socket.receive(Frames.ready(1, "s0", "wss://resume.test"));

        IncomingGatewayEvent event;
        do {
            event = collection.next();
        } while (!(event instanceof IncomingGatewayEvent.Dispatch));
        assertEquals(1, ((IncomingGatewayEvent.Dispatch) event).sequence());
        assertEquals(2, transport.openCount());
        assertFalse(collection.isClosed());
    }

    @Test
    void eventsFromOneShardKeepTheirOrder() throws Exception {
        open(2);
        FakeTransport.FakeSocket[] sockets = identifyAll(2);
        sockets[0].receive(Frames.ready(1, "s0", "wss://resume.test"));
        sockets[1].receive(Frames.ready(1, "s1", "wss://resume.test"));
        for (int seq = 2; seq <= 5; seq++) {
            sockets[0].receive(Frames.dispatch("MESSAGE_CREATE", seq, "{}"));
            sockets[1].receive(Frames.dispatch("MESSAGE_CREATE", seq, "{}"));
        }

        List<Integer> shard0 = new ArrayList<>();
        List<Integer> shard1 = new ArrayList<>();
        while (shard0.size() < 5 || shard1.size() < 5) {
            IncomingGatewayEvent event = collection.next();
            if (event instanceof IncomingGatewayEvent.Dispatch dispatch) {
                (dispatch.shardId() == 0 ? shard0 : shard1).add(dispatch.sequence());
            }
        }
        assertEquals(List.of(1, 2, 3, 4, 5), shard0);
        assertEquals(List.of(1, 2, 3, 4, 5), shard1);
    }

    @Test
    void closeEndsTheStream() throws Exception {
        open(2);
        identifyAll(2);

        collection.close();

        assertEquals(ConnectionState.CLOSED, collection.shardState(0));
        assertEquals(ConnectionState.CLOSED, collection.shardState(1));
        IncomingGatewayEvent event;
        do {
            event = collection.next();
        } while (event != null);
        // stays ended
        assertNull(collection.next());
    }

    @Test
    void fatalShardErrorClosesEverything() throws Exception {
        open(2);
        FakeTransport.FakeSocket[] sockets = identifyAll(2);

        sockets[1].serverClose(4014, "Disallowed intent(s).");

        GatewayException ex = assertThrows(GatewayException.class, () -> {
            while (true) {
                collection.next();
            }
        });
        assertEquals(4014, ex.closeCode());
        assertEquals(1, ex.shardId());
        assertTrue(collection.isClosed());
        assertEquals(ConnectionState.CLOSED, collection.shardState(0));
    }
}
