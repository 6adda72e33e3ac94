package com.github.anirbanmu.relay.gateway;

// one open websocket. text frames only.
public interface GatewaySocket {

    // false when the frame could not be written
    boolean sendText(String frame);

    // graceful close handshake
    void close(int code, String reason);

    // drop the connection without a close frame
    void abort();

    // callbacks arrive one at a time; the next frame is not requested until onText returns
    interface Listener {
        void onOpen(GatewaySocket socket);

        void onText(String frame);

        void onClosed(int code, String reason);

        void onError(Throwable error);
    }
}
