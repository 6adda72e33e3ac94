package com.github.anirbanmu.relay.event;

import com.github.anirbanmu.relay.DiscordClient;

// where a dispatched event came from. client may be null outside a running bot.
public record EventContext(int shardId, String dispatchName, int sequence, DiscordClient client) {
}
