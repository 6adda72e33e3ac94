package com.github.anirbanmu.relay.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// opcode 2 identify payload - sent after receiving hello
@CompiledJson
public record Identify(String token, int intents, Properties properties, int[] shard, @JsonAttribute(name = "large_threshold") int largeThreshold) {

    public static Identify create(String token, int intents, int shardId, int shardCount, int largeThreshold) {
        return new Identify(token, intents, Properties.DEFAULT, new int[]{shardId, shardCount}, largeThreshold);
    }

    // connection properties for identify
    @CompiledJson
    public record Properties(String os, String browser, String device) {
        public static final Properties DEFAULT = new Properties(System.getProperty("os.name", "linux").toLowerCase(), "relay", "relay");
    }
}
