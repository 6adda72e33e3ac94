package com.github.anirbanmu.relay.cache;

import com.github.anirbanmu.relay.model.Channel;
import com.github.anirbanmu.relay.model.Guild;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

// guilds and non-guild channels by id. values are immutable and replaced whole;
// writes to one key are serialized, reads never block.
public final class ObjectCache {
    private final ConcurrentHashMap<Long, Guild> guilds = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Channel> channels = new ConcurrentHashMap<>();

    public Guild guild(long id) {
        return guilds.get(id);
    }

    public Channel channel(long id) {
        return channels.get(id);
    }

    public Collection<Guild> guilds() {
        return Collections.unmodifiableCollection(guilds.values());
    }

    public Map<Long, Channel> channels() {
        return Collections.unmodifiableMap(channels);
    }

    public int guildCount() {
        return guilds.size();
    }

    // returns the previous value
    public Guild putGuild(Guild guild) {
        return guilds.put(guild.id(), guild);
    }

    public Guild putGuildIfAbsent(Guild guild) {
        return guilds.putIfAbsent(guild.id(), guild);
    }

    public Guild removeGuild(long id) {
        return guilds.remove(id);
    }

    // applies the update under the key's lock; a null result removes the entry.
    // the update must be quick and must not touch other cache keys.
    public Guild updateGuild(long id, UnaryOperator<Guild> update) {
        return guilds.compute(id, (key, current) -> update.apply(current));
    }

    public Channel putChannel(Channel channel) {
        return channels.put(channel.id(), channel);
    }

    public Channel removeChannel(long id) {
        return channels.remove(id);
    }

    public void clear() {
        guilds.clear();
        channels.clear();
    }
}
