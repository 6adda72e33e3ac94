package com.github.anirbanmu.relay.gateway;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.relay.discord.json.GatewayPayload;
import com.github.anirbanmu.relay.discord.json.Hello;
import com.github.anirbanmu.relay.util.Json;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

// raw gateway json -> typed frame. dispatch bodies are left as text for the event parser.
final class GatewayFrameParser {
    static final int OP_DISPATCH = 0;
    static final int OP_HEARTBEAT = 1;
    static final int OP_IDENTIFY = 2;
    static final int OP_RESUME = 6;
    static final int OP_RECONNECT = 7;
    static final int OP_REQUEST_GUILD_MEMBERS = 8;
    static final int OP_INVALID_SESSION = 9;
    static final int OP_HELLO = 10;
    static final int OP_HEARTBEAT_ACK = 11;

    record ParseResult(Frame frame, Integer sequence) {
    }

    sealed interface Frame {
        record Hello(long heartbeatInterval) implements Frame {
        }

        record Dispatch(String eventName, String raw) implements Frame {
        }

        record Ready(String sessionId, String resumeGatewayUrl, String raw) implements Frame {
        }

        record HeartbeatRequest() implements Frame {
        }

        record HeartbeatAck() implements Frame {
        }

        record Reconnect() implements Frame {
        }

        record InvalidSession(boolean resumable) implements Frame {
        }

        record Unknown(int op) implements Frame {
        }
    }

    ParseResult parse(String raw) throws IOException {
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);
        ByteArrayInputStream bais = new ByteArrayInputStream(bytes);

        // first pass: op, s, t
        GatewayPayload envelope = Json.DSL.deserialize(GatewayPayload.class, bais);
        if (envelope == null) {
            throw new IOException("empty gateway frame");
        }

        // second pass over the same bytes for the typed body
        Frame frame;
        switch (envelope.op()) {
            case OP_HELLO -> {
                bais.reset();
                HelloMsg msg = Json.DSL.deserialize(HelloMsg.class, bais);
                if (msg == null || msg.d() == null || msg.d().heartbeatInterval() <= 0) {
                    throw new IOException("hello without a heartbeat interval");
                }
                frame = new Frame.Hello(msg.d().heartbeatInterval());
            }
            case OP_HEARTBEAT -> frame = new Frame.HeartbeatRequest();
            case OP_HEARTBEAT_ACK -> frame = new Frame.HeartbeatAck();
            case OP_RECONNECT -> frame = new Frame.Reconnect();
            case OP_INVALID_SESSION -> {
                bais.reset();
                InvalidSessionMsg msg = Json.DSL.deserialize(InvalidSessionMsg.class, bais);
                frame = new Frame.InvalidSession(msg != null && msg.d() != null && msg.d());
            }
            case OP_DISPATCH -> {
                if (envelope.eventType() == null) {
                    throw new IOException("dispatch frame without an event name");
                }
                if ("READY".equals(envelope.eventType())) {
                    bais.reset();
                    ReadyMsg msg = Json.DSL.deserialize(ReadyMsg.class, bais);
                    if (msg == null || msg.d() == null || msg.d().sessionId() == null) {
                        throw new IOException("ready without a session id");
                    }
                    frame = new Frame.Ready(msg.d().sessionId(), msg.d().resumeGatewayUrl(), raw);
                } else {
                    frame = new Frame.Dispatch(envelope.eventType(), raw);
                }
            }
            default -> frame = new Frame.Unknown(envelope.op());
        }

        return new ParseResult(frame, envelope.sequence());
    }

    // wire format records - private implementation details

    @CompiledJson
    record HelloMsg(int op, Hello d) {
    }

    @CompiledJson
    record InvalidSessionMsg(int op, @JsonAttribute(nullable = true) Boolean d) {
    }

    @CompiledJson
    record ReadyMsg(int op, ReadyData d) {
    }

    @CompiledJson
    record ReadyData(@JsonAttribute(name = "session_id") String sessionId, @JsonAttribute(name = "resume_gateway_url", nullable = true) String resumeGatewayUrl) {
    }
}
