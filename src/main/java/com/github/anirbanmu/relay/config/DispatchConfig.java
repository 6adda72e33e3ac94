package com.github.anirbanmu.relay.config;

import java.time.Duration;

public record DispatchConfig(int maxTasks, int channelCapacity, boolean chunking, Duration shutdownTimeout) {

    public DispatchConfig {
        if (maxTasks < 1) {
            throw new ConfigException("dispatch.max_tasks must be at least 1: " + maxTasks);
        }
        if (channelCapacity < 0) {
            throw new ConfigException("dispatch.channel_capacity must not be negative: " + channelCapacity);
        }
    }

    public static DispatchConfig defaults() {
        return new DispatchConfig(16, 0, true, Duration.ofSeconds(5));
    }

    public DispatchConfig withMaxTasks(int tasks) {
        return new DispatchConfig(tasks, channelCapacity, chunking, shutdownTimeout);
    }

    public DispatchConfig withChunking(boolean enabled) {
        return new DispatchConfig(maxTasks, channelCapacity, enabled, shutdownTimeout);
    }
}
