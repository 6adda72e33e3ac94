package com.github.anirbanmu.relay.model;

import com.github.anirbanmu.relay.DiscordClient;
import com.github.anirbanmu.relay.discord.json.RawChannel;
import com.github.anirbanmu.relay.discord.json.RawGuild;
import com.github.anirbanmu.relay.discord.json.RawMember;
import com.github.anirbanmu.relay.discord.json.RawMessage;
import com.github.anirbanmu.relay.discord.json.RawUser;
import java.util.LinkedHashMap;
import java.util.Map;

// raw wire records -> stateful models bound to a client
public final class ModelFactory {
    private final DiscordClient client;

    // client may be null when models are only inspected
    public ModelFactory(DiscordClient client) {
        this.client = client;
    }

    public DiscordClient client() {
        return client;
    }

    public User user(RawUser raw) {
        return new User(raw);
    }

    public Member member(long guildId, RawMember raw) {
        if (raw.user() == null) {
            throw new IllegalArgumentException("member without user in guild " + Snowflake.toString(guildId));
        }
        return new Member(raw, guildId, new User(raw.user()));
    }

    // channel objects nested in a guild payload carry no guild_id of their own
    public Channel channel(RawChannel raw, Long fallbackGuildId) {
        Long guildId = raw.guildId() != null ? Snowflake.parse(raw.guildId()) : fallbackGuildId;
        return new Channel(raw, guildId, client);
    }

    public Channel channel(RawChannel raw) {
        return channel(raw, null);
    }

    public Guild guild(RawGuild raw) {
        long guildId = Snowflake.parse(raw.id());
        Map<Long, Channel> channels = new LinkedHashMap<>();
        if (raw.channels() != null) {
            for (RawChannel rc : raw.channels()) {
                Channel channel = channel(rc, guildId);
                channels.put(channel.id(), channel);
            }
        }
        Map<Long, Member> members = new LinkedHashMap<>();
        if (raw.members() != null) {
            for (RawMember rm : raw.members()) {
                if (rm.user() != null) {
                    Member member = member(guildId, rm);
                    members.put(member.id(), member);
                }
            }
        }
        // nested lists live in the maps, not in the snapshot
        RawGuild flat = new RawGuild(raw.id(), raw.name(), raw.icon(), raw.unavailable(), raw.large(), raw.memberCount(), null, null);
        return new Guild(flat, channels, members);
    }

    public Guild unavailableGuild(long guildId) {
        RawGuild stub = new RawGuild(Snowflake.toString(guildId), null, null, Boolean.TRUE, null, null, null, null);
        return new Guild(stub, Map.of(), Map.of());
    }

    public Message message(RawMessage raw) {
        User author = raw.author() == null ? null : new User(raw.author());
        Member member = null;
        if (raw.member() != null && author != null && raw.guildId() != null) {
            // message members omit the user; it is the author
            RawMember rm = raw.member();
            RawMember withUser = new RawMember(raw.author(), rm.nick(), rm.roles(), rm.joinedAt(), raw.guildId());
            member = new Member(withUser, Snowflake.parse(raw.guildId()), author);
        }
        return new Message(raw, author, member);
    }
}
