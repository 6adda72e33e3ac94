package com.github.anirbanmu.relay.discord;

import com.github.anirbanmu.relay.discord.json.GatewayBot;
import com.github.anirbanmu.relay.discord.json.RawMessage;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.util.Http;
import com.github.anirbanmu.relay.util.Json;
import com.github.anirbanmu.relay.util.Threads;
import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Semaphore;

// thin REST client. one global token bucket; no per-route bucket accounting.
public class DiscordHttpClient implements AutoCloseable {
    private static final String BASE_URL = "https://discord.com/api/v10";
    private static final int MAX_BURST = 45;
    private static final int REFILL_MS = 22; // ~45 req/s
    private static final Duration REQUEST_TIMEOUT = Duration.ofMillis(2500);
    private static final String USER_AGENT = "DiscordBot (https://github.com/anirbanmu/relay, 0.1.0)";

    private final String token;
    private final String baseUrl;
    private final Semaphore limiter;
    private final Thread refillThread;

    public DiscordHttpClient(String token) {
        this(token, BASE_URL);
    }

    public DiscordHttpClient(String token, String baseUrl) {
        this.token = token;
        this.baseUrl = baseUrl;
        this.limiter = new Semaphore(MAX_BURST);
        this.refillThread = Threads.start("rate-limiter-refill", this::refillLoop);
    }

    private void refillLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                Thread.sleep(REFILL_MS);
                if (limiter.availablePermits() < MAX_BURST) {
                    limiter.release();
                }
            } catch (InterruptedException e) {
                return;
            } catch (Exception e) {
                Log.error("rate_limiter.refill_error", e);
            }
        }
    }

    @Override
    public void close() {
        refillThread.interrupt();
    }

    // GET /gateway/bot - websocket url and recommended shard count
    public DiscordResult<GatewayBot> getGatewayBot() {
        DiscordResult<byte[]> result = request("/gateway/bot", "GET", null);
        return decode(result, GatewayBot.class);
    }

    public DiscordResult<RawMessage> createMessage(long channelId, String content) {
        String route = "/channels/" + Long.toUnsignedString(channelId) + "/messages";
        Log.debug("http.create_message", "channel", Long.toUnsignedString(channelId));
        DiscordResult<byte[]> result = request(route, "POST", new CreateMessage(content));
        return decode(result, RawMessage.class);
    }

    // raw request against an API route, body serialized as json when present
    public DiscordResult<byte[]> request(String route, String method, Object body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + route))
            .header("Authorization", "Bot " + token)
            .header("User-Agent", USER_AGENT);

        if (body != null) {
            try {
                builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(Json.encode(body)));
            } catch (IOException e) {
                return new DiscordResult.Failure<>("Failed to serialize request body", e);
            }
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        return sendRequest(builder);
    }

    private DiscordResult<byte[]> sendRequest(HttpRequest.Builder builder) {
        try {
            limiter.acquire();
            HttpResponse<byte[]> response = Http.CLIENT.send(
                builder.timeout(REQUEST_TIMEOUT).build(),
                HttpResponse.BodyHandlers.ofByteArray());
            return classify(response.statusCode(), response.body(),
                response.headers().firstValue("Retry-After").orElse(null),
                response.headers().firstValue("X-RateLimit-Global").isPresent());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new DiscordResult.Failure<>("HTTP request interrupted", e);
        } catch (IOException e) {
            return new DiscordResult.Failure<>("HTTP request failed", e);
        }
    }

    static DiscordResult<byte[]> classify(int status, byte[] body, String retryAfter, boolean global) {
        if (status == 429) {
            Duration delay = Duration.ofSeconds(1);
            if (retryAfter != null) {
                try {
                    delay = Duration.ofMillis((long) (Double.parseDouble(retryAfter) * 1000));
                } catch (NumberFormatException e) {
                    Log.warn("http.bad_retry_after", "value", retryAfter);
                }
            }
            Log.warn("http.rate_limited", "retry_after_ms", delay.toMillis(), "global", global);
            return new DiscordResult.RateLimited<>(delay, global);
        }
        if (status >= 400) {
            String text = body == null ? "" : new String(body, StandardCharsets.UTF_8);
            Log.error("http.request_failed", "status", status, "body", text);
            return new DiscordResult.Failure<>("Discord API error: " + text, status);
        }
        return new DiscordResult.Success<>(body);
    }

    private static <T> DiscordResult<T> decode(DiscordResult<byte[]> result, Class<T> type) {
        if (result instanceof DiscordResult.Success<byte[]> success) {
            try {
                return new DiscordResult.Success<>(Json.decode(type, new String(success.value(), StandardCharsets.UTF_8)));
            } catch (IOException e) {
                return new DiscordResult.Failure<>("Failed to decode " + type.getSimpleName(), e);
            }
        }
        if (result instanceof DiscordResult.RateLimited<byte[]> limited) {
            return new DiscordResult.RateLimited<>(limited.retryAfter(), limited.global());
        }
        DiscordResult.Failure<byte[]> failure = (DiscordResult.Failure<byte[]>) result;
        return new DiscordResult.Failure<>(failure.message(), failure.statusCode(), failure.exception());
    }

    @CompiledJson
    record CreateMessage(@JsonAttribute(nullable = true) String content) {
    }
}
