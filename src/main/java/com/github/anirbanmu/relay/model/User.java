package com.github.anirbanmu.relay.model;

import com.github.anirbanmu.relay.discord.json.RawUser;

public final class User {
    private final RawUser raw;
    private final long id;

    User(RawUser raw) {
        this.raw = raw;
        this.id = Snowflake.parse(raw.id());
    }

    public long id() {
        return id;
    }

    public String username() {
        return raw.username();
    }

    // global display name when set, otherwise the username
    public String displayName() {
        return raw.globalName() != null ? raw.globalName() : raw.username();
    }

    public boolean isBot() {
        return Boolean.TRUE.equals(raw.bot());
    }

    public String mention() {
        return "<@" + Snowflake.toString(id) + ">";
    }

    public RawUser raw() {
        return raw;
    }

    @Override
    public String toString() {
        return "User[" + Snowflake.toString(id) + " " + raw.username() + "]";
    }
}
