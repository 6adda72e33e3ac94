package com.github.anirbanmu.relay.gateway;

// resume bookkeeping for one shard. written from the socket thread, read by heartbeat and reconnect loop.
public final class SessionState {
    private String sessionId;
    private String resumeUrl;
    private int sequence = -1;

    public record Snapshot(String sessionId, Integer sequence, String resumeUrl) {
    }

    public synchronized void recordSequence(int seq) {
        if (seq > sequence) {
            sequence = seq;
        }
    }

    public synchronized void establish(String sessionId, String resumeUrl) {
        this.sessionId = sessionId;
        this.resumeUrl = resumeUrl;
    }

    public synchronized void invalidate() {
        sessionId = null;
        resumeUrl = null;
        sequence = -1;
    }

    public synchronized boolean canResume() {
        return sessionId != null && sequence >= 0;
    }

    public synchronized Integer sequence() {
        return sequence < 0 ? null : sequence;
    }

    public synchronized String sessionId() {
        return sessionId;
    }

    public synchronized String resumeUrl() {
        return resumeUrl;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(sessionId, sequence < 0 ? null : sequence, resumeUrl);
    }
}
