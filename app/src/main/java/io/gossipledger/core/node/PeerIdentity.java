package io.gossipledger.core.node;

import java.util.Objects;
import java.util.UUID;

/** This node's identity on the gossip network. Fixed for the lifetime of the process. */
public record PeerIdentity(String value) {
    public PeerIdentity {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("peer identity must not be blank");
        }
    }

    public static PeerIdentity random() {
        return new PeerIdentity(UUID.randomUUID().toString());
    }

    /** Is {@code peerId} (as seen on the wire) this node? */
    public boolean matches(String peerId) {
        return value.equals(peerId);
    }

    @Override public String toString() { return value; }
}
