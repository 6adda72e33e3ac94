package com.github.anirbanmu.relay.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// opcode 6 resume payload
@CompiledJson
public record Resume(String token, @JsonAttribute(name = "session_id") String sessionId, int seq) {
}
