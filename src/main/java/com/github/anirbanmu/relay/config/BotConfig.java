package com.github.anirbanmu.relay.config;

public record BotConfig(GatewayConfig gateway, DispatchConfig dispatch) {

    public static BotConfig defaults() {
        return new BotConfig(GatewayConfig.defaults(), DispatchConfig.defaults());
    }
}
