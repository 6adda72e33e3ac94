package com.github.anirbanmu.relay.discord.json;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.relay.util.Json;
import java.util.List;
import org.junit.jupiter.api.Test;

class GatewayPayloadTest {

    @Test
    void deserializePayloadExtractsOpAndT() throws Exception {
        String json = """
            {"op": 10, "t": null, "s": null, "d": {"heartbeat_interval": 41250}}
            """;

        var payload = Json.decode(GatewayPayload.class, json);

        assertEquals(10, payload.op());
        assertNull(payload.sequence());
        assertNull(payload.eventType());
    }

    @Test
    void deserializeDispatchPayload() throws Exception {
        String json = """
            {"op": 0, "t": "GUILD_CREATE", "s": 42, "d": {"id": "1"}}
            """;

        var payload = Json.decode(GatewayPayload.class, json);

        assertEquals(0, payload.op());
        assertEquals(42, payload.sequence());
        assertEquals("GUILD_CREATE", payload.eventType());
    }

    @Test
    void deserializeHello() throws Exception {
        var hello = Json.decode(Hello.class, """
            {"heartbeat_interval": 41250}
            """);

        assertEquals(41250, hello.heartbeatInterval());
    }

    @Test
    void serializeIdentifyKeepsZeroIntents() throws Exception {
        String json = Json.encode(Identify.create("test-token", 0, 1, 4, 50));

        assertTrue(json.contains("\"token\":\"test-token\""), json);
        assertTrue(json.contains("\"intents\":0"), json);
        assertTrue(json.contains("\"shard\":[1,4]"), json);
        assertTrue(json.contains("\"large_threshold\":50"), json);
        assertTrue(json.contains("\"browser\":\"relay\""), json);
    }

    @Test
    void serializeResume() throws Exception {
        String json = Json.encode(new Resume("tok", "abc", 0));

        assertTrue(json.contains("\"session_id\":\"abc\""), json);
        assertTrue(json.contains("\"seq\":0"), json);
    }

    @Test
    void serializeMemberRequestOmitsAbsentFields() throws Exception {
        String json = Json.encodeCompact(new RequestGuildMembers("5", null, null, false, List.of("1", "2"), null));

        assertTrue(json.contains("\"guild_id\":\"5\""), json);
        assertTrue(json.contains("\"user_ids\":[\"1\",\"2\"]"), json);
        assertFalse(json.contains("query"), json);
        assertFalse(json.contains("nonce"), json);
    }

    @Test
    void deserializeGatewayBot() throws Exception {
        String json = """
            {
                "url": "wss://gateway.discord.gg",
                "shards": 9,
                "session_start_limit": {"total": 1000, "remaining": 999, "reset_after": 14400000, "max_concurrency": 1}
            }
            """;

        var bot = Json.decode(GatewayBot.class, json);

        assertEquals("wss://gateway.discord.gg", bot.url());
        assertEquals(9, bot.shards());
        assertEquals(999, bot.sessionStartLimit().remaining());
        assertEquals(1, bot.sessionStartLimit().maxConcurrency());
    }

    @Test
    void deserializeGuildWithUnknownFields() throws Exception {
        String json = """
            {
                "id": "81384788765712384",
                "name": "Discord API",
                "large": true,
                "member_count": 120000,
                "features": ["COMMUNITY"],
                "channels": [{"id": "1", "type": 0, "name": "general", "permission_overwrites": []}],
                "members": [{"user": {"id": "2", "username": "nelly"}, "roles": ["3"], "joined_at": "2015-04-26T06:26:56.936000+00:00"}]
            }
            """;

        var guild = Json.decode(RawGuild.class, json);

        assertEquals("81384788765712384", guild.id());
        assertTrue(guild.large());
        assertEquals(120000, guild.memberCount());
        assertEquals("general", guild.channels().get(0).name());
        assertEquals("nelly", guild.members().get(0).user().username());
        assertNull(guild.unavailable());
    }

    @Test
    void deserializePartialMessage() throws Exception {
        var message = Json.decode(RawMessage.class, """
            {"id": "10", "channel_id": "20", "content": "edited"}
            """);

        assertEquals("edited", message.content());
        assertNull(message.author());
        assertNull(message.guildId());
    }
}
