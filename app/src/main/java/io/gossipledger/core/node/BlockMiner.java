package io.gossipledger.core.node;

import io.gossipledger.core.consensus.ProofOfWork;
import io.gossipledger.core.metrics.LedgerMetrics;
import io.gossipledger.core.protocol.Block;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds the next block on top of a parent and searches for a nonce that meets the difficulty.
 * Stateless; the node decides what to do with the result.
 */
public final class BlockMiner {
    private static final Logger LOG = Logger.getLogger(BlockMiner.class.getName());

    private final long maxTries;
    private final Clock clock;

    public BlockMiner(long maxTries) {
        this(maxTries, Clock.systemUTC());
    }

    public BlockMiner(long maxTries, Clock clock) {
        this.maxTries = maxTries;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** One mining attempt: returns the mined block, or empty if no nonce was found within maxTries. */
    public Optional<Block> mine(Block parent, String data) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(data, "data");

        Block template = new Block(
                parent.id() + 1,
                "",                 // filled in by the search
                parent.hash(),
                clock.instant().getEpochSecond(),
                data,
                0L
        );
        LOG.info(() -> "mining block " + template.id() + " on top of " + parent.hash());
        Optional<Block> mined = LedgerMetrics.recordMining(() -> ProofOfWork.mine(template, maxTries));
        if (mined.isPresent()) {
            LedgerMetrics.incrementMined();
            LOG.info(() -> "mined! nonce: " + mined.get().nonce() + ", hash: " + mined.get().hash());
        } else {
            LOG.warning(() -> "gave up mining block " + template.id() + " after " + maxTries + " tries");
        }
        return mined;
    }
}
