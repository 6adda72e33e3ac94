package com.github.anirbanmu.relay.model;

import com.github.anirbanmu.relay.DiscordClient;
import com.github.anirbanmu.relay.discord.DiscordResult;
import com.github.anirbanmu.relay.discord.json.RawChannel;
import com.github.anirbanmu.relay.discord.json.RawMessage;

public final class Channel {
    private final RawChannel raw;
    private final long id;
    private final Long guildId;
    private final ChannelKind kind;
    private final DiscordClient client;

    Channel(RawChannel raw, Long guildId, DiscordClient client) {
        this.raw = raw;
        this.id = Snowflake.parse(raw.id());
        this.guildId = guildId;
        this.kind = ChannelKind.of(raw.type());
        this.client = client;
    }

    public long id() {
        return id;
    }

    // null outside guilds
    public Long guildId() {
        return guildId;
    }

    public ChannelKind kind() {
        return kind;
    }

    public String name() {
        return raw.name();
    }

    public String topic() {
        return raw.topic();
    }

    public Long parentId() {
        return Snowflake.parseNullable(raw.parentId());
    }

    public int position() {
        return raw.position() == null ? 0 : raw.position();
    }

    public RawChannel raw() {
        return raw;
    }

    public String mention() {
        return "<#" + Snowflake.toString(id) + ">";
    }

    public DiscordResult<Message> sendMessage(String content) {
        if (!kind.isTextual()) {
            return new DiscordResult.Failure<>("cannot send messages to a " + kind + " channel");
        }
        if (client == null) {
            throw new IllegalStateException("channel " + Snowflake.toString(id) + " is not attached to a client");
        }
        DiscordResult<RawMessage> result = client.http().createMessage(id, content);
        if (result instanceof DiscordResult.Success<RawMessage> success) {
            return new DiscordResult.Success<>(client.models().message(success.value()));
        }
        if (result instanceof DiscordResult.RateLimited<RawMessage> limited) {
            return new DiscordResult.RateLimited<>(limited.retryAfter(), limited.global());
        }
        DiscordResult.Failure<RawMessage> failure = (DiscordResult.Failure<RawMessage>) result;
        return new DiscordResult.Failure<>(failure.message(), failure.statusCode(), failure.exception());
    }

    @Override
    public String toString() {
        return "Channel[" + Snowflake.toString(id) + " " + kind + "]";
    }
}
