package io.gossipledger.core.consensus;

import io.gossipledger.core.protocol.Block;

import java.util.List;
import java.util.logging.Logger;

/**
 * Longest valid chain wins; ties keep the local chain.
 * With a fixed difficulty every block carries the same work, so length stands in for total work.
 */
public final class ForkChoice {
    private static final Logger LOG = Logger.getLogger(ForkChoice.class.getName());

    private ForkChoice() {}

    public static ChainSelection selectChain(List<Block> local, List<Block> remote) {
        boolean localValid = ConsensusRules.isChainValid(local);
        boolean remoteValid = ConsensusRules.isChainValid(remote);

        if (localValid && remoteValid) {
            return local.size() >= remote.size() ? ChainSelection.local(local) : ChainSelection.remote(remote);
        }
        if (localValid) {
            return ChainSelection.local(local);
        }
        if (remoteValid) {
            return ChainSelection.remote(remote);
        }
        LOG.severe("local and remote chains are both invalid (local=" + local.size()
                + " blocks, remote=" + remote.size() + " blocks)");
        return ChainSelection.noValidChain();
    }
}
