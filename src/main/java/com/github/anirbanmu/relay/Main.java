package com.github.anirbanmu.relay;

import com.github.anirbanmu.relay.config.BotConfig;
import com.github.anirbanmu.relay.config.ConfigLoader;
import com.github.anirbanmu.relay.discord.DiscordResult;
import com.github.anirbanmu.relay.discord.json.RawChannel;
import com.github.anirbanmu.relay.event.DispatchedEvent;
import com.github.anirbanmu.relay.event.TaskEventDispatcher;
import com.github.anirbanmu.relay.gateway.GatewayCollection;
import com.github.anirbanmu.relay.gateway.GatewayException;
import com.github.anirbanmu.relay.gateway.WebSocketTransport;
import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.model.Channel;
import com.github.anirbanmu.relay.model.ChannelKind;
import com.github.anirbanmu.relay.model.Guild;
import com.github.anirbanmu.relay.model.Message;
import com.github.anirbanmu.relay.model.Snowflake;
import java.nio.file.Files;
import java.nio.file.Path;

// example bot: answers "!ping" in any channel it can see
public class Main {
    public static void main(String[] args) {
        String token = System.getenv("DISCORD_TOKEN");
        if (token == null) {
            Log.error("startup.missing_token", "message", "DISCORD_TOKEN env var is required");
            System.exit(1);
        }

        Path configPath = Path.of(System.getProperty("config", "relay.toml"));
        BotConfig config;
        try {
            config = Files.exists(configPath) ? ConfigLoader.load(configPath) : BotConfig.defaults();
            Log.info("startup.config_loaded", "path", configPath.toAbsolutePath().toString(), "exists", Files.exists(configPath));
        } catch (Exception e) {
            Log.error("startup.config_error", e);
            System.exit(1);
            return;
        }

        Log.info("bot_startup", "status", "starting", "version", "0.1.0");

        try (DiscordClient client = DiscordClient.open(token, config);
             GatewayCollection gateway = client.openGateway(new WebSocketTransport());
             TaskEventDispatcher dispatcher = client.taskDispatcher(gateway.shardCount())) {

            dispatcher.addHandler(DispatchedEvent.Ready.class, (ctx, e) ->
                Log.info("bot.ready", "guilds", client.cache().guildCount()));
            dispatcher.addHandler(DispatchedEvent.MessageCreate.class, (ctx, e) -> answerPing(client, e.message()));

            Runtime.getRuntime().addShutdownHook(new Thread(gateway::close, "shutdown"));
            gateway.start();
            dispatcher.run(gateway);
        } catch (GatewayException e) {
            Log.error("bot.fatal", e, "shard", e.shardId(), "code", e.closeCode());
            System.exit(2);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            Log.error("bot.startup_failed", e);
            System.exit(1);
        }
    }

    private static void answerPing(DiscordClient client, Message message) {
        if (message.author() == null || message.author().isBot() || message.content() == null
            || !"!ping".equals(message.content().trim())) {
            return;
        }
        Channel channel = findChannel(client, message);
        if (channel == null) {
            Log.warn("bot.unknown_channel", "channel", message.channelId());
            return;
        }
        DiscordResult<Message> result = channel.sendMessage("pong!");
        if (result instanceof DiscordResult.Failure<Message> f) {
            Log.error("bot.reply_failed", "error", f.message(), "status", f.statusCode());
        }
    }

    private static Channel findChannel(DiscordClient client, Message message) {
        if (message.guildId() != null) {
            Guild guild = client.cache().guild(message.guildId());
            return guild == null ? null : guild.channel(message.channelId());
        }
        Channel cached = client.cache().channel(message.channelId());
        if (cached != null) {
            return cached;
        }
        // discord does not announce dm channels before their first message
        RawChannel dm = new RawChannel(Snowflake.toString(message.channelId()), ChannelKind.DM.code(), null, null, null, null, null, null);
        return client.models().channel(dm);
    }
}
