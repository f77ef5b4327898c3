package io.gossipledger.core.storage;

import io.gossipledger.core.consensus.ConsensusRules;
import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * In-memory ledger backed by an ArrayList.
 * Writes come from the node's single event loop; methods are synchronized so
 * snapshots taken from API or console threads never observe a half-replaced ledger.
 */
public final class InMemoryChainStore implements ChainStore {
    private static final Logger LOG = Logger.getLogger(InMemoryChainStore.class.getName());

    private final List<Block> blocks = new ArrayList<>();

    @Override
    public synchronized void initialize(Block genesis) {
        Objects.requireNonNull(genesis, "genesis");
        if (!blocks.isEmpty()) return;
        blocks.add(genesis);
    }

    @Override
    public synchronized ValidationResult appendIfValid(Block candidate) {
        Objects.requireNonNull(candidate, "candidate");
        if (blocks.isEmpty()) {
            throw new IllegalStateException("ledger has no genesis block");
        }
        Block latest = blocks.get(blocks.size() - 1);
        ValidationResult result = ConsensusRules.validateBlock(candidate, latest);
        if (result.ok) {
            blocks.add(candidate);
        } else {
            LOG.warning(() -> "could not add block " + candidate.id() + " - invalid: " + result);
        }
        return result;
    }

    @Override
    public synchronized void replaceWith(List<Block> chain) {
        Objects.requireNonNull(chain, "chain");
        List<Block> copy = List.copyOf(chain);
        blocks.clear();
        blocks.addAll(copy);
    }

    @Override
    public synchronized Optional<Block> last() {
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public synchronized Optional<Block> getBlock(long id) {
        if (id < 0 || id >= blocks.size()) return Optional.empty();
        return Optional.of(blocks.get((int) id));
    }

    @Override
    public synchronized List<Block> snapshot() {
        return List.copyOf(blocks);
    }

    @Override
    public synchronized int size() {
        return blocks.size();
    }
}
