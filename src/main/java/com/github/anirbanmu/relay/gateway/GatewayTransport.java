package com.github.anirbanmu.relay.gateway;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

public interface GatewayTransport {

    // blocks until the handshake completes
    GatewaySocket open(URI uri, Duration timeout, GatewaySocket.Listener listener) throws IOException, InterruptedException;
}
