package com.github.anirbanmu.relay.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

@CompiledJson
public record RawUser(String id, String username, @JsonAttribute(nullable = true) String discriminator, @JsonAttribute(name = "global_name", nullable = true) String globalName, @JsonAttribute(nullable = true) String avatar, @JsonAttribute(nullable = true) Boolean bot) {
}
