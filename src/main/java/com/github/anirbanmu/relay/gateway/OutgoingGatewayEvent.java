package com.github.anirbanmu.relay.gateway;

import java.util.List;

// commands a client can hand to a shard
public sealed interface OutgoingGatewayEvent {

    // events that know which shard owns them
    interface Routed {
        long routingKey();
    }

    record Identify(String token, ShardIdentity shard, int intents) implements OutgoingGatewayEvent {
        @Override
        public String toString() {
            return "Identify[shard=" + shard + ", intents=" + intents + "]";
        }
    }

    record Resume(String token, String sessionId, int sequence) implements OutgoingGatewayEvent {
        @Override
        public String toString() {
            return "Resume[sessionId=" + sessionId + ", sequence=" + sequence + "]";
        }
    }

    record Heartbeat(Integer sequence) implements OutgoingGatewayEvent {
    }

    record MemberChunkRequest(long guildId, List<Long> userIds, String query, Integer limit, boolean presences, String nonce)
        implements OutgoingGatewayEvent, Routed {

        public MemberChunkRequest {
            userIds = userIds == null ? List.of() : List.copyOf(userIds);
            if (userIds.isEmpty() && query == null) {
                throw new IllegalArgumentException("member chunk request needs user ids or a query");
            }
            if (query != null && limit == null) {
                throw new IllegalArgumentException("member chunk request with a query needs a limit");
            }
        }

        // every member of the guild
        public static MemberChunkRequest allMembers(long guildId, String nonce) {
            return new MemberChunkRequest(guildId, List.of(), "", 0, false, nonce);
        }

        public static MemberChunkRequest forUsers(long guildId, List<Long> userIds) {
            return new MemberChunkRequest(guildId, userIds, null, null, false, null);
        }

        @Override
        public long routingKey() {
            return guildId;
        }
    }
}
