package io.gossipledger.core.p2p;

import java.util.Objects;

/** A named gossip channel. Peers only deliver publications for topics they subscribed to. */
public record Topic(String name) {
    public Topic {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("topic name must not be blank");
        }
    }

    /** Chain-level traffic: ChainRequest and ChainResponse. */
    public static Topic chains() { return new Topic("chains"); }

    /** Single-block announcements. */
    public static Topic blocks() { return new Topic("blocks"); }

    @Override public String toString() { return name; }
}
