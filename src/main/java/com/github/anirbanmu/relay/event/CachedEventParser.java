package com.github.anirbanmu.relay.event;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.relay.cache.ObjectCache;
import com.github.anirbanmu.relay.discord.json.RawChannel;
import com.github.anirbanmu.relay.discord.json.RawGuild;
import com.github.anirbanmu.relay.discord.json.RawMember;
import com.github.anirbanmu.relay.discord.json.RawMessage;
import com.github.anirbanmu.relay.discord.json.RawUser;
import com.github.anirbanmu.relay.gateway.IncomingGatewayEvent;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.model.Channel;
import com.github.anirbanmu.relay.model.Guild;
import com.github.anirbanmu.relay.model.Member;
import com.github.anirbanmu.relay.model.Message;
import com.github.anirbanmu.relay.model.ModelFactory;
import com.github.anirbanmu.relay.model.Snowflake;
import com.github.anirbanmu.relay.model.User;
import com.github.anirbanmu.relay.util.Json;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

// turns dispatch frames into DispatchedEvents, keeping the object cache current on the way.
// every body is decoded before the cache is touched, so a bad payload changes nothing.
// not thread-safe: driven by a single dispatcher loop.
public final class CachedEventParser {
    private final ObjectCache cache;
    private final List<Set<Long>> pendingGuilds;
    private final boolean[] startupFired;

    public CachedEventParser(ObjectCache cache, int shardCount) {
        this.cache = cache;
        this.pendingGuilds = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            pendingGuilds.add(new HashSet<>());
        }
        this.startupFired = new boolean[shardCount];
    }

    public ObjectCache cache() {
        return cache;
    }

    public List<DispatchedEvent> parse(IncomingGatewayEvent.Dispatch dispatch, ModelFactory factory) {
        String raw = dispatch.payload();
        int shard = dispatch.shardId();
        try {
            switch (dispatch.eventName()) {
                case "READY":
                    return ready(shard, decode(ReadyMsg.class, raw).d(), factory);
                case "RESUMED":
                    return List.of();
                case "GUILD_CREATE":
                    return guildCreate(shard, decode(GuildMsg.class, raw).d(), factory);
                case "GUILD_UPDATE":
                    return guildUpdate(decode(GuildMsg.class, raw).d(), factory);
                case "GUILD_DELETE":
                    return guildDelete(shard, decode(GuildMsg.class, raw).d(), factory);
                case "CHANNEL_CREATE":
                    return channelCreate(decode(ChannelMsg.class, raw).d(), factory);
                case "CHANNEL_UPDATE":
                    return channelUpdate(decode(ChannelMsg.class, raw).d(), factory);
                case "CHANNEL_DELETE":
                    return channelDelete(decode(ChannelMsg.class, raw).d(), factory);
                case "MESSAGE_CREATE":
                    return List.of(new DispatchedEvent.MessageCreate(factory.message(decode(MessageMsg.class, raw).d())));
                case "MESSAGE_UPDATE":
                    return List.of(new DispatchedEvent.MessageUpdate(factory.message(decode(MessageMsg.class, raw).d())));
                case "MESSAGE_DELETE":
                    return messageDelete(decode(MessageDeleteMsg.class, raw).d());
                case "MESSAGE_DELETE_BULK":
                    return messageBulkDelete(decode(MessageBulkDeleteMsg.class, raw).d());
                case "GUILD_MEMBER_ADD":
                    return memberAdd(decode(MemberMsg.class, raw).d(), factory);
                case "GUILD_MEMBER_UPDATE":
                    return memberUpdate(decode(MemberMsg.class, raw).d(), factory);
                case "GUILD_MEMBER_REMOVE":
                    return memberRemove(decode(MemberRemoveMsg.class, raw).d(), factory);
                case "GUILD_MEMBERS_CHUNK":
                    return membersChunk(decode(MembersChunkMsg.class, raw).d(), factory);
                default:
                    Log.info("parser.unknown_dispatch", "event", dispatch.eventName(), "shard", shard);
                    return List.of();
            }
        } catch (IOException | IllegalArgumentException ex) {
            Log.warn("parser.malformed_dispatch", "event", dispatch.eventName(), "shard", shard, "seq", dispatch.sequence(), "error", ex.getMessage());
            return List.of();
        } catch (RuntimeException ex) {
            // a field the payload should have carried was missing
            Log.warn("parser.malformed_dispatch", ex, "event", dispatch.eventName(), "shard", shard, "seq", dispatch.sequence());
            return List.of();
        }
    }

    private static <T extends Body<?>> T decode(Class<T> type, String raw) throws IOException {
        T msg = Json.decode(type, raw);
        if (msg == null || msg.d() == null) {
            throw new IOException("dispatch without a body");
        }
        return msg;
    }

    private List<DispatchedEvent> ready(int shard, ReadyData data, ModelFactory factory) {
        List<Guild> stubs = new ArrayList<>();
        if (data.guilds() != null) {
            for (RawGuild g : data.guilds()) {
                stubs.add(factory.unavailableGuild(Snowflake.parse(g.id())));
            }
        }
        Set<Long> pending = pendingGuilds.get(shard);
        for (Guild stub : stubs) {
            cache.putGuildIfAbsent(stub);
            if (!startupFired[shard]) {
                pending.add(stub.id());
            }
        }
        Log.info("parser.ready", "shard", shard, "guilds", stubs.size());

        List<DispatchedEvent> events = new ArrayList<>(2);
        events.add(new DispatchedEvent.Connected());
        if (!startupFired[shard] && pending.isEmpty()) {
            startupFired[shard] = true;
            events.add(new DispatchedEvent.ShardReady());
        }
        return events;
    }

    private List<DispatchedEvent> guildCreate(int shard, RawGuild raw, ModelFactory factory) {
        Guild guild = factory.guild(raw);
        if (guild.isUnavailable()) {
            cache.putGuildIfAbsent(guild);
            return List.of();
        }
        Guild previous = cache.putGuild(guild);

        Set<Long> pending = pendingGuilds.get(shard);
        if (pending.remove(guild.id())) {
            List<DispatchedEvent> events = new ArrayList<>(2);
            events.add(new DispatchedEvent.GuildStreamed(guild));
            if (pending.isEmpty() && !startupFired[shard]) {
                startupFired[shard] = true;
                events.add(new DispatchedEvent.ShardReady());
            }
            return events;
        }
        if (previous == null) {
            return List.of(new DispatchedEvent.GuildJoined(guild));
        }
        return List.of(new DispatchedEvent.GuildAvailable(guild));
    }

    private List<DispatchedEvent> guildUpdate(RawGuild raw, ModelFactory factory) {
        Guild incoming = factory.guild(raw);
        Guild[] old = new Guild[1];
        Guild updated = cache.updateGuild(incoming.id(), current -> {
            old[0] = current;
            return current == null ? incoming : current.withRaw(incoming.raw());
        });
        return List.of(new DispatchedEvent.GuildUpdate(old[0], updated));
    }

    private List<DispatchedEvent> guildDelete(int shard, RawGuild raw, ModelFactory factory) {
        long id = Snowflake.parse(raw.id());
        if (Boolean.TRUE.equals(raw.unavailable())) {
            Guild stub = factory.unavailableGuild(id);
            cache.putGuild(stub);
            return List.of(new DispatchedEvent.GuildUnavailable(stub));
        }
        Guild removed = cache.removeGuild(id);
        List<DispatchedEvent> events = new ArrayList<>(2);
        events.add(new DispatchedEvent.GuildLeft(id, removed));

        // left while still streaming: one fewer guild to wait for
        Set<Long> pending = pendingGuilds.get(shard);
        if (pending.remove(id) && pending.isEmpty() && !startupFired[shard]) {
            startupFired[shard] = true;
            events.add(new DispatchedEvent.ShardReady());
        }
        return events;
    }

    private List<DispatchedEvent> channelCreate(RawChannel raw, ModelFactory factory) {
        Channel channel = factory.channel(raw);
        if (channel.guildId() == null) {
            cache.putChannel(channel);
        } else {
            updateIfCached(channel.guildId(), guild -> guild.withChannel(channel));
        }
        return List.of(new DispatchedEvent.ChannelCreate(channel));
    }

    private List<DispatchedEvent> channelUpdate(RawChannel raw, ModelFactory factory) {
        Channel channel = factory.channel(raw);
        Channel old;
        if (channel.guildId() == null) {
            old = cache.putChannel(channel);
        } else {
            Channel[] previous = new Channel[1];
            updateIfCached(channel.guildId(), guild -> {
                previous[0] = guild.channel(channel.id());
                return guild.withChannel(channel);
            });
            old = previous[0];
        }
        return List.of(new DispatchedEvent.ChannelUpdate(old, channel));
    }

    private List<DispatchedEvent> channelDelete(RawChannel raw, ModelFactory factory) {
        Channel channel = factory.channel(raw);
        if (channel.guildId() == null) {
            cache.removeChannel(channel.id());
        } else {
            updateIfCached(channel.guildId(), guild -> guild.withoutChannel(channel.id()));
        }
        return List.of(new DispatchedEvent.ChannelDelete(channel));
    }

    private List<DispatchedEvent> messageDelete(MessageDeleteData data) {
        long id = Snowflake.parse(data.id());
        long channelId = Snowflake.parse(data.channelId());
        Long guildId = Snowflake.parseNullable(data.guildId());
        Guild guild = guildId == null ? null : cache.guild(guildId);
        return List.of(new DispatchedEvent.MessageDelete(id, channelId, lookupChannel(channelId, guild), guild));
    }

    private List<DispatchedEvent> messageBulkDelete(MessageBulkDeleteData data) {
        List<Long> ids = new ArrayList<>();
        if (data.ids() != null) {
            for (String id : data.ids()) {
                ids.add(Snowflake.parse(id));
            }
        }
        long channelId = Snowflake.parse(data.channelId());
        Long guildId = Snowflake.parseNullable(data.guildId());
        Guild guild = guildId == null ? null : cache.guild(guildId);
        return List.of(new DispatchedEvent.MessageBulkDelete(ids, channelId, lookupChannel(channelId, guild), guild));
    }

    private Channel lookupChannel(long channelId, Guild guild) {
        return guild != null ? guild.channel(channelId) : cache.channel(channelId);
    }

    private List<DispatchedEvent> memberAdd(RawMember raw, ModelFactory factory) {
        if (raw.guildId() == null) {
            throw new IllegalArgumentException("member add without guild_id");
        }
        long guildId = Snowflake.parse(raw.guildId());
        Member member = factory.member(guildId, raw);
        Guild updated = updateIfCached(guildId, guild -> guild.withMember(member));
        if (updated == null) {
            Log.warn("parser.member_for_unknown_guild", "guild", Snowflake.toString(guildId));
            return List.of();
        }
        return List.of(new DispatchedEvent.GuildMemberAdd(updated, member));
    }

    private List<DispatchedEvent> memberUpdate(RawMember raw, ModelFactory factory) {
        if (raw.guildId() == null) {
            throw new IllegalArgumentException("member update without guild_id");
        }
        long guildId = Snowflake.parse(raw.guildId());
        Member member = factory.member(guildId, raw);
        Member[] old = new Member[1];
        Guild updated = updateIfCached(guildId, guild -> {
            old[0] = guild.member(member.id());
            return guild.withMember(member);
        });
        if (updated == null) {
            Log.warn("parser.member_for_unknown_guild", "guild", Snowflake.toString(guildId));
            return List.of();
        }
        return List.of(new DispatchedEvent.GuildMemberUpdate(updated, old[0], member));
    }

    private List<DispatchedEvent> memberRemove(MemberRemoveData data, ModelFactory factory) {
        if (data.user() == null) {
            throw new IllegalArgumentException("member removal without a user");
        }
        long guildId = Snowflake.parse(data.guildId());
        User user = factory.user(data.user());
        Member[] old = new Member[1];
        Guild updated = updateIfCached(guildId, guild -> {
            old[0] = guild.member(user.id());
            return guild.withoutMember(user.id());
        });
        return List.of(new DispatchedEvent.GuildMemberRemove(guildId, user, old[0], updated));
    }

    private List<DispatchedEvent> membersChunk(MembersChunkData data, ModelFactory factory) {
        long guildId = Snowflake.parse(data.guildId());
        List<Member> members = new ArrayList<>();
        if (data.members() != null) {
            for (RawMember raw : data.members()) {
                members.add(factory.member(guildId, raw));
            }
        }
        Guild updated = updateIfCached(guildId, guild -> guild.withMembers(members));
        if (updated == null) {
            Log.warn("parser.chunk_for_unknown_guild", "guild", Snowflake.toString(guildId));
            return List.of(new DispatchedEvent.InvalidGuildChunk(guildId));
        }
        return List.of(new DispatchedEvent.GuildMemberChunk(updated, members, data.chunkIndex(), data.chunkCount(), data.nonce()));
    }

    // null when the guild is not cached; nothing is inserted in that case
    private Guild updateIfCached(long guildId, UnaryOperator<Guild> update) {
        return cache.updateGuild(guildId, current -> current == null ? null : update.apply(current));
    }

    // wire format records - private implementation details

    interface Body<T> {
        T d();
    }

    @CompiledJson
    record ReadyMsg(int op, ReadyData d) implements Body<ReadyData> {
    }

    @CompiledJson
    record ReadyData(@JsonAttribute(nullable = true) List<RawGuild> guilds) {
    }

    @CompiledJson
    record GuildMsg(int op, RawGuild d) implements Body<RawGuild> {
    }

    @CompiledJson
    record ChannelMsg(int op, RawChannel d) implements Body<RawChannel> {
    }

    @CompiledJson
    record MessageMsg(int op, RawMessage d) implements Body<RawMessage> {
    }

    @CompiledJson
    record MessageDeleteMsg(int op, MessageDeleteData d) implements Body<MessageDeleteData> {
    }

    @CompiledJson
    record MessageDeleteData(String id, @JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "guild_id", nullable = true) String guildId) {
    }

    @CompiledJson
    record MessageBulkDeleteMsg(int op, MessageBulkDeleteData d) implements Body<MessageBulkDeleteData> {
    }

    @CompiledJson
    record MessageBulkDeleteData(List<String> ids, @JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "guild_id", nullable = true) String guildId) {
    }

    @CompiledJson
    record MemberMsg(int op, RawMember d) implements Body<RawMember> {
    }

    @CompiledJson
    record MemberRemoveMsg(int op, MemberRemoveData d) implements Body<MemberRemoveData> {
    }

    @CompiledJson
    record MemberRemoveData(@JsonAttribute(name = "guild_id") String guildId, RawUser user) {
    }

    @CompiledJson
    record MembersChunkMsg(int op, MembersChunkData d) implements Body<MembersChunkData> {
    }

    @CompiledJson
    record MembersChunkData(@JsonAttribute(name = "guild_id") String guildId, List<RawMember> members,
                            @JsonAttribute(name = "chunk_index") int chunkIndex, @JsonAttribute(name = "chunk_count") int chunkCount,
                            @JsonAttribute(nullable = true) String nonce) {
    }
}
