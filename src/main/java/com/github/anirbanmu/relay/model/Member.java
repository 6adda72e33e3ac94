package com.github.anirbanmu.relay.model;

import com.github.anirbanmu.relay.discord.json.RawMember;
import java.util.ArrayList;
import java.util.List;

// a user's membership in one guild
public final class Member {
    private final RawMember raw;
    private final long guildId;
    private final User user;
    private final List<Long> roles;

    Member(RawMember raw, long guildId, User user) {
        this.raw = raw;
        this.guildId = guildId;
        this.user = user;
        List<Long> parsed = new ArrayList<>();
        if (raw.roles() != null) {
            for (String role : raw.roles()) {
                parsed.add(Snowflake.parse(role));
            }
        }
        this.roles = List.copyOf(parsed);
    }

    public long id() {
        return user.id();
    }

    public long guildId() {
        return guildId;
    }

    public User user() {
        return user;
    }

    public String nick() {
        return raw.nick();
    }

    public String displayName() {
        return raw.nick() != null ? raw.nick() : user.displayName();
    }

    public List<Long> roles() {
        return roles;
    }

    public String joinedAt() {
        return raw.joinedAt();
    }

    public RawMember raw() {
        return raw;
    }

    @Override
    public String toString() {
        return "Member[" + Snowflake.toString(id()) + " in " + Snowflake.toString(guildId) + "]";
    }
}
