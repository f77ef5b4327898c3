package io.gossipledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A peer's full ledger, addressed to the peer that asked for it. */
@JsonPropertyOrder({"receiver", "blocks"})
public record ChainResponse(
        @JsonProperty(value = "receiver", required = true) String receiver,
        @JsonProperty(value = "blocks", required = true) List<Block> blocks
) implements GossipMessage {
    public ChainResponse {
        Objects.requireNonNull(receiver, "receiver");
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
    }

    @JsonIgnore
    @Override public String kind() { return "chain_response"; }

    @Override public String toString() {
        return "ChainResponse{receiver=" + receiver + ", blocks=" + blocks.size() + "}";
    }
}
