package com.github.anirbanmu.relay.discord;

import java.time.Duration;

public sealed interface DiscordResult<T> {
    record Success<T>(T value) implements DiscordResult<T> {
    }

    // 429 from discord; the request was not applied and may be retried after the delay
    record RateLimited<T>(Duration retryAfter, boolean global) implements DiscordResult<T> {
    }

    record Failure<T>(String message, int statusCode, Throwable exception) implements DiscordResult<T> {
        public Failure(String message) {
            this(message, -1, null);
        }

        public Failure(String message, Throwable exception) {
            this(message, -1, exception);
        }

        public Failure(String message, int statusCode) {
            this(message, statusCode, null);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
