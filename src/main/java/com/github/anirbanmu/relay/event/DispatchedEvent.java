package com.github.anirbanmu.relay.event;

import com.github.anirbanmu.relay.model.Channel;
import com.github.anirbanmu.relay.model.Guild;
import com.github.anirbanmu.relay.model.Member;
import com.github.anirbanmu.relay.model.Message;
import com.github.anirbanmu.relay.model.User;
import java.util.ArrayList;
import java.util.List;

// high level events produced from gateway dispatches
public sealed interface DispatchedEvent {

    // a shard identified; guilds are about to stream in
    record Connected() implements DispatchedEvent {
    }

    // every guild of one shard has streamed in
    record ShardReady() implements DispatchedEvent {
    }

    // every shard is ready. fired once.
    record Ready() implements DispatchedEvent {
    }

    // a guild arriving during startup streaming
    record GuildStreamed(Guild guild) implements DispatchedEvent {
    }

    // the bot was added to a guild
    record GuildJoined(Guild guild) implements DispatchedEvent {
    }

    // a guild came back after an outage
    record GuildAvailable(Guild guild) implements DispatchedEvent {
    }

    record GuildUpdate(Guild oldGuild, Guild guild) implements DispatchedEvent {
    }

    // outage; the cache keeps an unavailable stub
    record GuildUnavailable(Guild guild) implements DispatchedEvent {
    }

    // removed from a guild. guild is the last cached state, may be null.
    record GuildLeft(long guildId, Guild guild) implements DispatchedEvent {
    }

    record ChannelCreate(Channel channel) implements DispatchedEvent {
    }

    record ChannelUpdate(Channel oldChannel, Channel channel) implements DispatchedEvent {
    }

    record ChannelDelete(Channel channel) implements DispatchedEvent {
    }

    record MessageCreate(Message message) implements DispatchedEvent {
    }

    record MessageUpdate(Message message) implements DispatchedEvent {
    }

    // channel and guild are null when not cached
    record MessageDelete(long messageId, long channelId, Channel channel, Guild guild) implements DispatchedEvent {
    }

    record MessageBulkDelete(List<Long> messageIds, long channelId, Channel channel, Guild guild) implements DispatchedEvent {
        public MessageBulkDelete {
            messageIds = List.copyOf(messageIds);
        }

        public List<MessageDelete> asSingleEvents() {
            List<MessageDelete> out = new ArrayList<>(messageIds.size());
            for (Long id : messageIds) {
                out.add(new MessageDelete(id, channelId, channel, guild));
            }
            return out;
        }
    }

    record GuildMemberAdd(Guild guild, Member member) implements DispatchedEvent {
    }

    // oldMember is null when the member was not cached
    record GuildMemberUpdate(Guild guild, Member oldMember, Member member) implements DispatchedEvent {
    }

    record GuildMemberRemove(long guildId, User user, Member cachedMember, Guild guild) implements DispatchedEvent {
    }

    // members in payload order
    record GuildMemberChunk(Guild guild, List<Member> members, int chunkIndex, int chunkCount, String nonce) implements DispatchedEvent {
        public GuildMemberChunk {
            members = List.copyOf(members);
        }

        public boolean isLast() {
            return chunkIndex + 1 >= chunkCount;
        }
    }

    // a chunk for a guild that is not cached
    record InvalidGuildChunk(long guildId) implements DispatchedEvent {
    }
}
