package com.github.anirbanmu.relay.gateway;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AWAITING_HELLO,
    IDENTIFYING,
    RESUMING,
    STEADY,
    RECONNECTING,
    CLOSED
}
