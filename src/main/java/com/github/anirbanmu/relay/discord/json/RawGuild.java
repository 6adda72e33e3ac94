package com.github.anirbanmu.relay.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// also used for the {"id": ..., "unavailable": true} stubs in READY and GUILD_DELETE
@CompiledJson
public record RawGuild(String id, @JsonAttribute(nullable = true) String name, @JsonAttribute(nullable = true) String icon, @JsonAttribute(nullable = true) Boolean unavailable, @JsonAttribute(nullable = true) Boolean large, @JsonAttribute(name = "member_count", nullable = true) Integer memberCount, @JsonAttribute(nullable = true) List<RawChannel> channels, @JsonAttribute(nullable = true) List<RawMember> members) {
}
