package com.github.anirbanmu.relay.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {

    @Test
    void testLoadConfig() {
        String toml = """
            [gateway]
            intents = 513
            shard_count = 4
            event_buffer = 32
            outgoing_queue = 8
            large_threshold = 250
            connect_timeout = "PT5S"
            backoff_min = "PT0.5S"
            backoff_max = "PT30S"
            max_reconnect_attempts = 10
            shutdown_timeout = "PT2S"

            [dispatch]
            max_tasks = 4
            channel_capacity = 2
            chunking = false
            shutdown_timeout = "PT1S"
            """;

        BotConfig config = ConfigLoader.load(toml);

        GatewayConfig gateway = config.gateway();
        assertEquals(513, gateway.intents());
        assertEquals(4, gateway.shardCount());
        assertEquals(32, gateway.eventBuffer());
        assertEquals(8, gateway.outgoingQueue());
        assertEquals(250, gateway.largeThreshold());
        assertEquals(Duration.ofSeconds(5), gateway.connectTimeout());
        assertEquals(Duration.ofMillis(500), gateway.backoffMin());
        assertEquals(Duration.ofSeconds(30), gateway.backoffMax());
        assertEquals(10, gateway.maxReconnectAttempts());
        assertEquals(Duration.ofSeconds(2), gateway.shutdownTimeout());

        DispatchConfig dispatch = config.dispatch();
        assertEquals(4, dispatch.maxTasks());
        assertEquals(2, dispatch.channelCapacity());
        assertFalse(dispatch.chunking());
        assertEquals(Duration.ofSeconds(1), dispatch.shutdownTimeout());
    }

    @Test
    void testEmptyConfigUsesDefaults() {
        BotConfig config = ConfigLoader.load("");

        assertEquals(BotConfig.defaults(), config);
        assertEquals(0, config.gateway().shardCount());
        assertEquals(GatewayConfig.DEFAULT_INTENTS, config.gateway().intents());
        assertTrue(config.dispatch().chunking());
    }

    @Test
    void testPartialSectionKeepsOtherDefaults() {
        BotConfig config = ConfigLoader.load("""
            [gateway]
            shard_count = 2
            """);

        assertEquals(2, config.gateway().shardCount());
        assertEquals(GatewayConfig.defaults().backoffMax(), config.gateway().backoffMax());
        assertEquals(DispatchConfig.defaults(), config.dispatch());
    }

    @Test
    void testWrongTypeIsRejected() {
        ConfigException ex = assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [gateway]
            shard_count = "two"
            """));
        assertTrue(ex.getMessage().contains("gateway.shard_count"));

        assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [dispatch]
            chunking = 1
            """));
        assertThrows(ConfigException.class, () -> ConfigLoader.load("gateway = 3"));
    }

    @Test
    void testBadDurationIsRejected() {
        ConfigException ex = assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [gateway]
            backoff_max = "30 seconds"
            """));
        assertTrue(ex.getMessage().contains("gateway.backoff_max"));
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [gateway]
            backoff_min = "PT10S"
            backoff_max = "PT1S"
            """));
        assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [dispatch]
            max_tasks = 0
            """));
        assertThrows(ConfigException.class, () -> ConfigLoader.load("""
            [gateway]
            event_buffer = 0
            """));
    }

    @Test
    void testSyntaxErrorIsReported() {
        ConfigException ex = assertThrows(ConfigException.class, () -> ConfigLoader.load("[gateway"));
        assertTrue(ex.getMessage().startsWith("Failed to parse TOML"));
    }
}
