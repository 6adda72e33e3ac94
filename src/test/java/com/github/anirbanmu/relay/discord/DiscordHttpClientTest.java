package com.github.anirbanmu.relay.discord;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DiscordHttpClientTest {

    @Test
    void successfulResponseKeepsBody() {
        byte[] body = "{\"id\":\"1\"}".getBytes(StandardCharsets.UTF_8);
        var result = DiscordHttpClient.classify(200, body, null, false);

        var success = assertInstanceOf(DiscordResult.Success.class, result);
        assertArrayEquals(body, (byte[]) success.value());
        assertTrue(result.isSuccess());
    }

    @Test
    void rateLimitUsesRetryAfterSeconds() {
        var result = DiscordHttpClient.classify(429, new byte[0], "1.5", true);

        var limited = assertInstanceOf(DiscordResult.RateLimited.class, result);
        assertEquals(Duration.ofMillis(1500), limited.retryAfter());
        assertTrue(limited.global());
        assertFalse(result.isSuccess());
    }

    @Test
    void rateLimitWithUnreadableHeaderWaitsOneSecond() {
        var result = DiscordHttpClient.classify(429, new byte[0], "soon", false);

        var limited = assertInstanceOf(DiscordResult.RateLimited.class, result);
        assertEquals(Duration.ofSeconds(1), limited.retryAfter());
        assertFalse(limited.global());
    }

    @Test
    void clientErrorIsAFailureWithStatus() {
        byte[] body = "{\"message\":\"Missing Access\",\"code\":50001}".getBytes(StandardCharsets.UTF_8);
        var result = DiscordHttpClient.classify(403, body, null, false);

        var failure = assertInstanceOf(DiscordResult.Failure.class, result);
        assertEquals(403, failure.statusCode());
        assertTrue(failure.message().contains("Missing Access"));
        assertNull(failure.exception());
    }
}
