package com.github.anirbanmu.relay.util;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Executors;

public final class Http {
    // websocket listeners may block on backpressure, so the executor has to be able to grow
    public static final HttpClient CLIENT = HttpClient.newBuilder()
        .executor(Executors.newCachedThreadPool(Threads.factory("relay-http")))
        .connectTimeout(Duration.ofMillis(2500))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();

    private Http() {
    }
}
