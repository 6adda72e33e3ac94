package com.github.anirbanmu.relay.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// guild_id is only present on GUILD_MEMBER_ADD / GUILD_MEMBER_UPDATE bodies
@CompiledJson
public record RawMember(@JsonAttribute(nullable = true) RawUser user, @JsonAttribute(nullable = true) String nick, @JsonAttribute(nullable = true) List<String> roles, @JsonAttribute(name = "joined_at", nullable = true) String joinedAt, @JsonAttribute(name = "guild_id", nullable = true) String guildId) {
}
