package io.gossipledger.core.node;

import io.gossipledger.core.protocol.Block;

/**
 * The trust anchor every ledger starts from.
 * - id = 0
 * - previous_hash = "genesis"
 * - hash/nonce are fixed constants, never checked by the consensus rules
 */
public final class GenesisBlock {
    public static final String PREVIOUS_HASH = "genesis";

    private static final Block GENESIS = new Block(
            0L,
            "0000f816a87f806bb0073dcf026a64fb40c946b5abee2573702828694d5b4c43",
            PREVIOUS_HASH,
            1_636_028_544L,
            "genesis!",
            2836L
    );

    private GenesisBlock(){}

    public static Block get() {
        return GENESIS;
    }
}
