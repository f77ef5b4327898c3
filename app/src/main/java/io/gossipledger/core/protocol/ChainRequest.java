package io.gossipledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Asks the peer identified by {@code from_peer_id} to publish its full ledger. */
public record ChainRequest(
        @JsonProperty(value = "from_peer_id", required = true) String fromPeerId
) implements GossipMessage {
    public ChainRequest {
        Objects.requireNonNull(fromPeerId, "fromPeerId");
    }

    @JsonIgnore
    @Override public String kind() { return "chain_request"; }
}
