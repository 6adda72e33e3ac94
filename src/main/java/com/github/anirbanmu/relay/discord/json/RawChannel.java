package com.github.anirbanmu.relay.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record RawChannel(String id, int type, @JsonAttribute(nullable = true) String name, @JsonAttribute(name = "guild_id", nullable = true) String guildId, @JsonAttribute(nullable = true) Integer position, @JsonAttribute(nullable = true) String topic, @JsonAttribute(name = "parent_id", nullable = true) String parentId, @JsonAttribute(nullable = true) Boolean nsfw) {
}
