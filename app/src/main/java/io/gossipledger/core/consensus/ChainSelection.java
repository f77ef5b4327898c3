package io.gossipledger.core.consensus;

import io.gossipledger.core.protocol.Block;

import java.util.List;
import java.util.Objects;

/**
 * Result of fork choice. {@code chain} is empty only for {@link Outcome#NO_VALID_CHAIN}.
 */
public record ChainSelection(Outcome outcome, List<Block> chain) {

    public enum Outcome {
        /** Keep the local ledger. */
        LOCAL,
        /** Adopt the remote ledger. */
        REMOTE,
        /** Neither side passed chain validation; nothing may be adopted. */
        NO_VALID_CHAIN
    }

    public ChainSelection {
        Objects.requireNonNull(outcome, "outcome");
        chain = chain == null ? List.of() : List.copyOf(chain);
    }

    public static ChainSelection local(List<Block> chain) { return new ChainSelection(Outcome.LOCAL, chain); }
    public static ChainSelection remote(List<Block> chain) { return new ChainSelection(Outcome.REMOTE, chain); }
    public static ChainSelection noValidChain() { return new ChainSelection(Outcome.NO_VALID_CHAIN, List.of()); }

    public boolean isAdoptable() {
        return outcome != Outcome.NO_VALID_CHAIN;
    }
}
