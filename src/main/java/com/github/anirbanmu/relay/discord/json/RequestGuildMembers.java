package com.github.anirbanmu.relay.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// opcode 8 request guild members payload
@CompiledJson
public record RequestGuildMembers(@JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(nullable = true) String query, @JsonAttribute(nullable = true) Integer limit, boolean presences, @JsonAttribute(name = "user_ids", nullable = true) List<String> userIds, @JsonAttribute(nullable = true) String nonce) {
}
