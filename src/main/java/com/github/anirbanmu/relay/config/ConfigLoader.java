package com.github.anirbanmu.relay.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

// every key is optional; missing keys fall back to GatewayConfig.defaults() / DispatchConfig.defaults()
public class ConfigLoader {
    public static BotConfig load(Path path) throws IOException {
        TomlParseResult result = Toml.parse(path);
        return parse(result);
    }

    public static BotConfig load(InputStream stream) throws IOException {
        TomlParseResult result = Toml.parse(stream);
        return parse(result);
    }

    public static BotConfig load(String content) {
        TomlParseResult result = Toml.parse(content);
        return parse(result);
    }

    private static BotConfig parse(TomlParseResult result) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("Failed to parse TOML configuration:\n");
            result.errors().forEach(error -> sb.append("- ").append(error.toString()).append("\n"));
            throw new ConfigException(sb.toString());
        }

        GatewayConfig gateway = GatewayConfig.defaults();
        if (result.contains("gateway")) {
            if (!result.isTable("gateway")) {
                throw new ConfigException("'gateway' must be a table.");
            }
            gateway = parseGateway(result.getTable("gateway"), gateway);
        }

        DispatchConfig dispatch = DispatchConfig.defaults();
        if (result.contains("dispatch")) {
            if (!result.isTable("dispatch")) {
                throw new ConfigException("'dispatch' must be a table.");
            }
            dispatch = parseDispatch(result.getTable("dispatch"), dispatch);
        }

        return new BotConfig(gateway, dispatch);
    }

    private static GatewayConfig parseGateway(TomlTable table, GatewayConfig d) {
        return new GatewayConfig(
            getInt(table, "gateway", "intents", d.intents()),
            getInt(table, "gateway", "shard_count", d.shardCount()),
            getInt(table, "gateway", "event_buffer", d.eventBuffer()),
            getInt(table, "gateway", "outgoing_queue", d.outgoingQueue()),
            getInt(table, "gateway", "large_threshold", d.largeThreshold()),
            getDuration(table, "gateway", "connect_timeout", d.connectTimeout()),
            getDuration(table, "gateway", "backoff_min", d.backoffMin()),
            getDuration(table, "gateway", "backoff_max", d.backoffMax()),
            getInt(table, "gateway", "max_reconnect_attempts", d.maxReconnectAttempts()),
            getDuration(table, "gateway", "shutdown_timeout", d.shutdownTimeout()));
    }

    private static DispatchConfig parseDispatch(TomlTable table, DispatchConfig d) {
        if (table.contains("chunking") && !table.isBoolean("chunking")) {
            throw new ConfigException("'dispatch.chunking' must be a boolean.");
        }
        Boolean chunking = table.getBoolean("chunking");
        return new DispatchConfig(
            getInt(table, "dispatch", "max_tasks", d.maxTasks()),
            getInt(table, "dispatch", "channel_capacity", d.channelCapacity()),
            chunking != null ? chunking : d.chunking(),
            getDuration(table, "dispatch", "shutdown_timeout", d.shutdownTimeout()));
    }

    private static int getInt(TomlTable table, String section, String key, int fallback) {
        if (!table.contains(key)) {
            return fallback;
        }
        if (!table.isLong(key)) {
            throw new ConfigException("'" + section + "." + key + "' must be an integer.");
        }
        long value = table.getLong(key);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ConfigException("'" + section + "." + key + "' is out of range: " + value);
        }
        return (int) value;
    }

    // ISO-8601, e.g. "PT10S", "PT1M"
    private static Duration getDuration(TomlTable table, String section, String key, Duration fallback) {
        if (!table.contains(key)) {
            return fallback;
        }
        if (!table.isString(key)) {
            throw new ConfigException("'" + section + "." + key + "' must be an ISO-8601 duration string.");
        }
        String raw = table.getString(key);
        try {
            return Duration.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ConfigException("'" + section + "." + key + "' has invalid duration: " + raw);
        }
    }
}
