package com.github.anirbanmu.relay.event;

// dispatch bodies ("d") used by event tests
final class Payloads {
    private Payloads() {
    }

    static String user(long id, String name) {
        return "{\"id\":\"" + id + "\",\"username\":\"" + name + "\"}";
    }

    static String member(long userId, String name) {
        return "{\"user\":" + user(userId, name) + ",\"roles\":[],\"joined_at\":\"2020-01-01T00:00:00Z\"}";
    }

    static String guildMember(long guildId, long userId, String nick) {
        return "{\"guild_id\":\"" + guildId + "\",\"user\":" + user(userId, "u" + userId) + ",\"nick\":\"" + nick
            + "\",\"roles\":[\"" + (guildId + 1) + "\"]}";
    }

    static String channel(long id, int type, String name) {
        return "{\"id\":\"" + id + "\",\"type\":" + type + ",\"name\":\"" + name + "\"}";
    }

    static String guildChannel(long id, long guildId, String name) {
        return "{\"id\":\"" + id + "\",\"type\":0,\"guild_id\":\"" + guildId + "\",\"name\":\"" + name + "\"}";
    }

    static String ready(long... guildIds) {
        StringBuilder guilds = new StringBuilder();
        for (long id : guildIds) {
            if (guilds.length() > 0) {
                guilds.append(',');
            }
            guilds.append("{\"id\":\"").append(id).append("\",\"unavailable\":true}");
        }
        return "{\"v\":10,\"session_id\":\"s\",\"resume_gateway_url\":\"wss://r\",\"user\":" + user(1, "bot")
            + ",\"guilds\":[" + guilds + "]}";
    }

    static String guild(long id, String name, boolean large) {
        return "{\"id\":\"" + id + "\",\"name\":\"" + name + "\",\"large\":" + large + ",\"member_count\":2,"
            + "\"channels\":[" + channel(id * 10, 0, "general") + "," + channel(id * 10 + 1, 2, "voice") + "],"
            + "\"members\":[" + member(500, "alice") + "]}";
    }

    static String message(long id, long channelId, String content) {
        return "{\"id\":\"" + id + "\",\"channel_id\":\"" + channelId + "\",\"author\":" + user(500, "alice")
            + ",\"content\":\"" + content + "\",\"timestamp\":\"2024-01-01T00:00:00Z\",\"type\":0}";
    }
}
