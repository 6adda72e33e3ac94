package com.github.anirbanmu.relay.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// MESSAGE_UPDATE bodies may be partial, so almost everything is nullable
@CompiledJson
public record RawMessage(String id, @JsonAttribute(name = "channel_id") String channelId, @JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(nullable = true) RawUser author, @JsonAttribute(nullable = true) RawMember member, @JsonAttribute(nullable = true) String content, @JsonAttribute(nullable = true) String timestamp, @JsonAttribute(nullable = true) Integer type) {
}
