package com.github.anirbanmu.relay;

import com.github.anirbanmu.relay.cache.ObjectCache;
import com.github.anirbanmu.relay.config.BotConfig;
import com.github.anirbanmu.relay.discord.DiscordHttpClient;
import com.github.anirbanmu.relay.discord.DiscordResult;
import com.github.anirbanmu.relay.discord.json.GatewayBot;
import com.github.anirbanmu.relay.event.CachedEventParser;
import com.github.anirbanmu.relay.event.ChannelEventDispatcher;
import com.github.anirbanmu.relay.event.TaskEventDispatcher;
import com.github.anirbanmu.relay.gateway.GatewayCollection;
import com.github.anirbanmu.relay.gateway.GatewayTransport;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.model.ModelFactory;
import java.io.IOException;
import java.net.URI;

// the bot: token, REST client, object cache and model factory. models hold a reference back to it.
public final class DiscordClient implements AutoCloseable {
    private final String token;
    private final BotConfig config;
    private final DiscordHttpClient http;
    private final ObjectCache cache = new ObjectCache();
    private final ModelFactory models;
    private volatile GatewayBot gatewayInfo;

    public DiscordClient(String token, BotConfig config, DiscordHttpClient http) {
        this.token = token;
        this.config = config;
        this.http = http;
        this.models = new ModelFactory(this);
    }

    public static DiscordClient open(String token, BotConfig config) {
        return new DiscordClient(token, config, new DiscordHttpClient(token));
    }

    public BotConfig config() {
        return config;
    }

    public DiscordHttpClient http() {
        return http;
    }

    public ObjectCache cache() {
        return cache;
    }

    public ModelFactory models() {
        return models;
    }

    // last result of fetchGatewayInfo, null before the first call
    public GatewayBot gatewayInfo() {
        return gatewayInfo;
    }

    public GatewayBot fetchGatewayInfo() throws IOException {
        DiscordResult<GatewayBot> result = http.getGatewayBot();
        if (result instanceof DiscordResult.Success<GatewayBot> success) {
            GatewayBot info = success.value();
            gatewayInfo = info;
            Log.info("client.gateway_info", "shards", info.shards(),
                "sessions_remaining", info.sessionStartLimit() == null ? -1 : info.sessionStartLimit().remaining());
            return info;
        }
        if (result instanceof DiscordResult.RateLimited<GatewayBot> limited) {
            throw new IOException("rate limited fetching gateway info, retry after " + limited.retryAfter().toMillis() + "ms");
        }
        DiscordResult.Failure<GatewayBot> failure = (DiscordResult.Failure<GatewayBot>) result;
        throw new IOException("failed to fetch gateway info: " + failure.message(), failure.exception());
    }

    // configured shard count wins over discord's recommendation
    public GatewayCollection openGateway(GatewayTransport transport) throws IOException {
        GatewayBot info = gatewayInfo != null ? gatewayInfo : fetchGatewayInfo();
        int shards = config.gateway().shardCount() > 0 ? config.gateway().shardCount() : Math.max(1, info.shards());
        Log.info("client.opening_gateway", "shards", shards);
        return new GatewayCollection(token, URI.create(info.url()), shards, config.gateway(), transport);
    }

    public TaskEventDispatcher taskDispatcher(int shardCount) {
        return new TaskEventDispatcher(new CachedEventParser(cache, shardCount), models, config.dispatch());
    }

    public ChannelEventDispatcher channelDispatcher(int shardCount) {
        return new ChannelEventDispatcher(new CachedEventParser(cache, shardCount), models, config.dispatch());
    }

    @Override
    public void close() {
        http.close();
    }
}
