package com.github.anirbanmu.relay.config;

public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }
}
