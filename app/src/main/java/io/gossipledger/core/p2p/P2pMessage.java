package io.gossipledger.core.p2p;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Transport frame. {@code data} carries a gossip payload untouched (JSON text).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record P2pMessage(String type, String nodeId, String topic, String data) {
    public static final String HANDSHAKE = "handshake";
    public static final String PING = "ping";
    public static final String PONG = "pong";
    public static final String PUBLISH = "publish";

    public P2pMessage {
        Objects.requireNonNull(type, "type");
    }

    public static P2pMessage handshake(String nodeId) {
        return new P2pMessage(HANDSHAKE, nodeId, null, null);
    }

    public static P2pMessage ping() {
        return new P2pMessage(PING, null, null, null);
    }

    public static P2pMessage pong() {
        return new P2pMessage(PONG, null, null, null);
    }

    public static P2pMessage publish(String topic, String data) {
        return new P2pMessage(PUBLISH, null, Objects.requireNonNull(topic, "topic"), Objects.requireNonNull(data, "data"));
    }
}
