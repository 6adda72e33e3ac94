package com.github.anirbanmu.relay.model;

import com.github.anirbanmu.relay.discord.json.RawMessage;

public final class Message {
    private final RawMessage raw;
    private final long id;
    private final long channelId;
    private final Long guildId;
    private final User author;
    private final Member member;

    Message(RawMessage raw, User author, Member member) {
        this.raw = raw;
        this.id = Snowflake.parse(raw.id());
        this.channelId = Snowflake.parse(raw.channelId());
        this.guildId = Snowflake.parseNullable(raw.guildId());
        this.author = author;
        this.member = member;
    }

    public long id() {
        return id;
    }

    public long channelId() {
        return channelId;
    }

    // null for direct messages
    public Long guildId() {
        return guildId;
    }

    // null on partial updates
    public User author() {
        return author;
    }

    public Member member() {
        return member;
    }

    public String content() {
        return raw.content() == null ? "" : raw.content();
    }

    public String timestamp() {
        return raw.timestamp();
    }

    public RawMessage raw() {
        return raw;
    }

    @Override
    public String toString() {
        return "Message[" + Snowflake.toString(id) + " in " + Snowflake.toString(channelId) + "]";
    }
}
