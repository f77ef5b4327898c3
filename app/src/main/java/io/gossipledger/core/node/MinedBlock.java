package io.gossipledger.core.node;

import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.ValidationResult;

/** A locally mined block and what the ledger made of it. */
public record MinedBlock(Block block, ValidationResult result, int announcedTo) {
    public boolean accepted() {
        return result.ok;
    }
}
