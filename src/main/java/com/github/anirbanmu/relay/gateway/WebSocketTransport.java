package com.github.anirbanmu.relay.gateway;

import com.github.anirbanmu.relay.log.Log;
import com.github.anirbanmu.relay.util.Http;
import java.io.IOException;
import java.net.URI;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

// GatewayTransport over java.net.http
public final class WebSocketTransport implements GatewayTransport {

    @Override
    public GatewaySocket open(URI uri, Duration timeout, GatewaySocket.Listener listener) throws IOException, InterruptedException {
        Adapter adapter = new Adapter(listener);
        try {
            Http.CLIENT.newWebSocketBuilder()
                .connectTimeout(timeout)
                .buildAsync(uri, adapter)
                .get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new IOException("websocket handshake failed: " + uri.getHost(), cause);
        }
        return adapter.socket;
    }

    private static final class Socket implements GatewaySocket {
        private final WebSocket ws;

        Socket(WebSocket ws) {
            this.ws = ws;
        }

        // java.net.http allows one outstanding send at a time
        @Override
        public synchronized boolean sendText(String frame) {
            try {
                ws.sendText(frame, true).join();
                return true;
            } catch (Exception ex) {
                Log.warn("websocket.send_failed", "error", ex.getMessage());
                return false;
            }
        }

        @Override
        public synchronized void close(int code, String reason) {
            try {
                ws.sendClose(code, reason).join();
            } catch (Exception ex) {
                Log.debug("websocket.close_failed", "error", ex.getMessage());
                ws.abort();
            }
        }

        @Override
        public void abort() {
            ws.abort();
        }
    }

    private static final class Adapter implements WebSocket.Listener {
        private final GatewaySocket.Listener listener;
        private final StringBuilder messageBuffer = new StringBuilder();
        private volatile Socket socket;

        Adapter(GatewaySocket.Listener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            socket = new Socket(webSocket);
            listener.onOpen(socket);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            messageBuffer.append(data);
            if (last) {
                String frame = messageBuffer.toString();
                messageBuffer.setLength(0);
                // handled synchronously so a slow consumer stops further reads on this socket
                listener.onText(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            Log.warn("websocket.binary_ignored", "bytes", data.remaining());
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }
}
