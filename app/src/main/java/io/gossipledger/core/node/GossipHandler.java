package io.gossipledger.core.node;

import io.gossipledger.core.consensus.ChainSelection;
import io.gossipledger.core.consensus.ForkChoice;
import io.gossipledger.core.metrics.LedgerMetrics;
import io.gossipledger.core.p2p.GossipPublisher;
import io.gossipledger.core.p2p.PeerMembership;
import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.ChainRequest;
import io.gossipledger.core.protocol.ChainResponse;
import io.gossipledger.core.protocol.GossipCodec;
import io.gossipledger.core.protocol.GossipMessage;
import io.gossipledger.core.protocol.ValidationResult;
import io.gossipledger.core.storage.ChainStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Interprets inbound gossip and drives the ledger.
 *
 * Not thread-safe for ledger mutations: callers must invoke {@link #handle} from a single
 * thread (see {@link Node}). Membership callbacks may come from any thread.
 * Rejections are logged and counted, never answered on the wire.
 */
public final class GossipHandler {
    private static final Logger LOG = Logger.getLogger(GossipHandler.class.getName());

    private final NodeConfig config;
    private final ChainStore chain;
    private final GossipPublisher publisher;
    private final PeerMembership membership;

    public GossipHandler(NodeConfig config, ChainStore chain, GossipPublisher publisher, PeerMembership membership) {
        this.config = Objects.requireNonNull(config, "config");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.membership = Objects.requireNonNull(membership, "membership");
    }

    /** Decode one payload from {@code sourcePeer} and act on it. Returns what the payload was read as. */
    public GossipMessage handle(String sourcePeer, byte[] payload) {
        GossipMessage message = GossipCodec.decode(payload);
        LedgerMetrics.incrementMessages(message.kind());
        if (message instanceof ChainResponse response) {
            onChainResponse(sourcePeer, response);
        } else if (message instanceof ChainRequest request) {
            onChainRequest(sourcePeer, request);
        } else if (message instanceof GossipMessage.BlockAnnouncement announcement) {
            onBlock(sourcePeer, announcement.block());
        } else {
            LOG.fine(() -> "Dropping unrecognized payload (" + payload.length + " bytes) from " + sourcePeer);
        }
        return message;
    }

    /**
     * A peer sent its ledger. Only responses addressed to this node are considered.
     * Returns the fork-choice outcome, or empty if the response was for someone else.
     */
    public Optional<ChainSelection> onChainResponse(String sourcePeer, ChainResponse response) {
        if (!config.identity.matches(response.receiver())) {
            LOG.fine(() -> "Ignoring chain response for " + response.receiver() + " from " + sourcePeer);
            return Optional.empty();
        }
        LOG.info(() -> "Response from " + sourcePeer + ": " + response.blocks().size() + " blocks");
        response.blocks().forEach(b -> LOG.fine(b::toString));

        List<Block> local = chain.snapshot();
        ChainSelection selection = ForkChoice.selectChain(local, response.blocks());
        if (!selection.isAdoptable()) {
            LedgerMetrics.incrementNoValidChain();
            LOG.severe(() -> "Refusing chain adoption from " + sourcePeer + ": no valid chain, ledger left unchanged");
        } else if (selection.outcome() == ChainSelection.Outcome.REMOTE) {
            chain.replaceWith(selection.chain());
            LedgerMetrics.incrementChainReplaced();
            LOG.info(() -> "Adopted chain from " + sourcePeer + " (" + local.size() + " -> " + selection.chain().size() + " blocks)");
        } else {
            LedgerMetrics.incrementChainKept();
            LOG.info(() -> "Kept local chain (" + local.size() + " blocks) over " + response.blocks().size() + " from " + sourcePeer);
        }
        return Optional.of(selection);
    }

    /**
     * A peer asked for a ledger. Answer only if this node is the one asked.
     * Returns true if a response was published.
     */
    public boolean onChainRequest(String sourcePeer, ChainRequest request) {
        if (!config.identity.matches(request.fromPeerId())) {
            LOG.fine(() -> "Ignoring chain request for " + request.fromPeerId() + " from " + sourcePeer);
            return false;
        }
        LOG.info(() -> "sending local chain to " + sourcePeer);
        ChainResponse response = new ChainResponse(sourcePeer, chain.snapshot());
        publisher.publish(config.chainTopic, GossipCodec.encode(response));
        return true;
    }

    /** A peer (or the local miner) announced a block: try to append it. */
    public ValidationResult onBlock(String sourcePeer, Block block) {
        LOG.info(() -> "received new block " + block.id() + " from " + sourcePeer);
        ValidationResult result = chain.appendIfValid(block);
        if (result.ok) {
            LedgerMetrics.incrementAccepted();
        } else {
            LedgerMetrics.incrementRejected(result.error);
        }
        return result;
    }

    /**
     * A connection to {@code peerId} came up. The first live connection adds the peer to the
     * gossip group and triggers a one-off request for its ledger.
     */
    public boolean onPeerJoined(String peerId, String voucher) {
        boolean joined = membership.join(peerId, voucher);
        if (joined) {
            requestChain(peerId);
        }
        return joined;
    }

    /** A connection went away. The peer leaves only when nothing else vouches for it. */
    public boolean onPeerExpired(String peerId, String voucher) {
        return membership.expire(peerId, voucher);
    }

    /** Publish a ChainRequest asking {@code peerId} for its ledger. Fire-and-forget. */
    public int requestChain(String peerId) {
        LOG.info(() -> "Requesting chain from " + peerId);
        return publisher.publish(config.chainTopic, GossipCodec.encode(new ChainRequest(peerId)));
    }

    /** Publish a block announcement to the gossip group. */
    public int announceBlock(Block block) {
        return publisher.publish(config.blockTopic, GossipCodec.encode(block));
    }
}
