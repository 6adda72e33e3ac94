package com.github.anirbanmu.relay.model;

import com.github.anirbanmu.relay.discord.json.RawGuild;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// immutable guild snapshot. every change produces a new instance.
public final class Guild {
    private final RawGuild raw;
    private final long id;
    private final Map<Long, Channel> channels;
    private final Map<Long, Member> members;

    Guild(RawGuild raw, Map<Long, Channel> channels, Map<Long, Member> members) {
        this.raw = raw;
        this.id = Snowflake.parse(raw.id());
        this.channels = Collections.unmodifiableMap(new LinkedHashMap<>(channels));
        this.members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
    }

    public long id() {
        return id;
    }

    public String name() {
        return raw.name();
    }

    // placeholder for a guild discord has not sent yet or lost to an outage
    public boolean isUnavailable() {
        return Boolean.TRUE.equals(raw.unavailable());
    }

    public boolean isLarge() {
        return Boolean.TRUE.equals(raw.large());
    }

    public int memberCount() {
        return raw.memberCount() == null ? members.size() : raw.memberCount();
    }

    public Map<Long, Channel> channels() {
        return channels;
    }

    public Channel channel(long channelId) {
        return channels.get(channelId);
    }

    public Map<Long, Member> members() {
        return members;
    }

    public Member member(long userId) {
        return members.get(userId);
    }

    public RawGuild raw() {
        return raw;
    }

    // new top-level fields, same channels and members
    public Guild withRaw(RawGuild update) {
        return new Guild(update, channels, members);
    }

    public Guild withChannel(Channel channel) {
        Map<Long, Channel> next = new LinkedHashMap<>(channels);
        next.put(channel.id(), channel);
        return new Guild(raw, next, members);
    }

    public Guild withoutChannel(long channelId) {
        Map<Long, Channel> next = new LinkedHashMap<>(channels);
        next.remove(channelId);
        return new Guild(raw, next, members);
    }

    public Guild withMember(Member member) {
        Map<Long, Member> next = new LinkedHashMap<>(members);
        next.put(member.id(), member);
        return new Guild(raw, channels, next);
    }

    public Guild withMembers(Collection<Member> added) {
        Map<Long, Member> next = new LinkedHashMap<>(members);
        for (Member member : added) {
            next.put(member.id(), member);
        }
        return new Guild(raw, channels, next);
    }

    public Guild withoutMember(long userId) {
        Map<Long, Member> next = new LinkedHashMap<>(members);
        next.remove(userId);
        return new Guild(raw, channels, next);
    }

    @Override
    public String toString() {
        return "Guild[" + Snowflake.toString(id) + (isUnavailable() ? " unavailable" : " " + raw.name()) + "]";
    }
}
