package io.gossipledger.core.storage;

import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.ValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * The node's authoritative ordered ledger.
 *
 * Notes:
 * - Index 0 is always the genesis block once {@link #initialize(Block)} ran.
 * - Appends are validated against the current last block; replacements are not validated here,
 *   callers run fork choice first.
 */
public interface ChainStore {

    /** Seed the genesis block into an empty store. No-op if the store already has blocks. */
    void initialize(Block genesis);

    /**
     * Append the block if it validly extends the current last block.
     * Returns the validation outcome; on failure the ledger is unchanged.
     *
     * @throws IllegalStateException if the store is empty
     */
    ValidationResult appendIfValid(Block candidate);

    /** Overwrite the whole ledger. No validation. */
    void replaceWith(List<Block> chain);

    /** Last block in the ledger. */
    Optional<Block> last();

    /** Block at the given position (which equals its id on a valid ledger). */
    Optional<Block> getBlock(long id);

    /** Immutable copy of the current ledger. */
    List<Block> snapshot();

    /** Number of blocks, genesis included. */
    int size();
}
