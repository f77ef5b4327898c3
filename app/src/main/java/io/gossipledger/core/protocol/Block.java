package io.gossipledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One ledger entry. Field names and order match the JSON wire shape:
 * {@code {id, hash, previous_hash, timestamp, data, nonce}}.
 *
 * Immutable; the hash is carried as received and is only trusted after
 * the consensus rules have checked it against the other five fields.
 */
@JsonPropertyOrder({"id", "hash", "previous_hash", "timestamp", "data", "nonce"})
public record Block(
        @JsonProperty(value = "id", required = true) long id,
        @JsonProperty(value = "hash", required = true) String hash,
        @JsonProperty(value = "previous_hash", required = true) String previousHash,
        @JsonProperty(value = "timestamp", required = true) long timestamp,
        @JsonProperty(value = "data", required = true) String data,
        @JsonProperty(value = "nonce", required = true) long nonce
) {
    public Block {
        if (id < 0) throw new IllegalArgumentException("id must be non-negative: " + id);
        if (nonce < 0) throw new IllegalArgumentException("nonce must be non-negative: " + nonce);
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(previousHash, "previousHash");
        Objects.requireNonNull(data, "data");
    }

    @Override public String toString() {
        String shortHash = hash.length() > 12 ? hash.substring(0, 12) + "…" : hash;
        return "Block{id=" + id + ", hash=" + shortHash + ", nonce=" + nonce + ", data=" + data + "}";
    }
}
