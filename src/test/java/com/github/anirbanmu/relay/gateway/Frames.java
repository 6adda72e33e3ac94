package com.github.anirbanmu.relay.gateway;

// server frames used across gateway tests
final class Frames {
    private Frames() {
    }

    static String hello(long interval) {
        return "{\"op\":10,\"d\":{\"heartbeat_interval\":" + interval + "}}";
    }

    static String ready(int seq, String sessionId, String resumeUrl) {
        return "{\"op\":0,\"t\":\"READY\",\"s\":" + seq + ",\"d\":{\"v\":10,\"session_id\":\"" + sessionId
            + "\",\"resume_gateway_url\":\"" + resumeUrl + "\",\"guilds\":[]}}";
    }

    static String dispatch(String name, int seq, String body) {
        return "{\"op\":0,\"t\":\"" + name + "\",\"s\":" + seq + ",\"d\":" + body + "}";
    }

    static String heartbeatRequest() {
        return "{\"op\":1,\"d\":null}";
    }

    static String heartbeatAck() {
        return "{\"op\":11}";
    }

    static String invalidSession(boolean resumable) {
        return "{\"op\":9,\"d\":" + resumable + "}";
    }

    static String reconnect() {
        return "{\"op\":7,\"d\":null}";
    }
}
