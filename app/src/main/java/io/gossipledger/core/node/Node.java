package io.gossipledger.core.node;

import io.gossipledger.core.p2p.GossipPublisher;
import io.gossipledger.core.p2p.P2pServer;
import io.gossipledger.core.p2p.PeerMembership;
import io.gossipledger.core.p2p.Topic;
import io.gossipledger.core.protocol.Block;
import io.gossipledger.core.protocol.GossipMessage;
import io.gossipledger.core.protocol.ValidationResult;
import io.gossipledger.core.storage.ChainStore;
import io.gossipledger.core.storage.InMemoryChainStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the ledger, the gossip handler, the miner and the transport.
 *
 * Every inbound payload and every locally mined block is processed on one
 * "ledger-events" thread, in arrival order, so the ledger has a single writer.
 * Mining runs on its own thread and hands its result back to that queue.
 */
public final class Node implements P2pServer.PeerListener, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final NodeConfig config;
    private final ChainStore chain;
    private final PeerMembership membership;
    private final GossipHandler handler;
    private final BlockMiner miner;
    private final ExecutorService eventLoop;
    private final ExecutorService miningExecutor;

    private volatile GossipPublisher transport = (topic, payload) -> 0;
    private ScheduledExecutorService syncScheduler;

    public Node(NodeConfig config, ChainStore chain, PeerMembership membership, BlockMiner miner) {
        this.config = Objects.requireNonNull(config, "config");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.membership = Objects.requireNonNull(membership, "membership");
        this.miner = Objects.requireNonNull(miner, "miner");
        this.handler = new GossipHandler(config, chain, this::publish, membership);
        this.eventLoop = Executors.newSingleThreadExecutor(daemon("ledger-events-" + config.identity));
        this.miningExecutor = Executors.newSingleThreadExecutor(daemon("ledger-miner-" + config.identity));
    }

    /** Convenience factory for an in-memory node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(config, new InMemoryChainStore(), new PeerMembership(), new BlockMiner(config.minerMaxTries));
    }

    /** Seed genesis and start the optional periodic re-sync. Safe to call more than once. */
    public synchronized void start() {
        chain.initialize(GenesisBlock.get());
        if (config.syncIntervalMillis > 0 && syncScheduler == null) {
            syncScheduler = Executors.newSingleThreadScheduledExecutor(daemon("ledger-sync-" + config.identity));
            syncScheduler.scheduleAtFixedRate(this::syncWithRandomPeer,
                    config.syncIntervalMillis, config.syncIntervalMillis, TimeUnit.MILLISECONDS);
        }
        LOG.info(() -> "Node " + config.identity + " started with " + chain.size() + " block(s)");
    }

    /** Route outbound publications through this transport from now on. */
    public void bindTransport(GossipPublisher transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /** Queue an inbound gossip payload for processing. */
    public CompletableFuture<GossipMessage> submit(String sourcePeer, byte[] payload) {
        return onEventLoop("payload from " + sourcePeer, () -> handler.handle(sourcePeer, payload));
    }

    /** Queue a block (e.g. from an external miner) exactly like an inbound announcement. */
    public CompletableFuture<ValidationResult> submitBlock(String sourcePeer, Block block) {
        return onEventLoop("block from " + sourcePeer, () -> handler.onBlock(sourcePeer, block));
    }

    /**
     * Mine a block carrying {@code data} on top of the current last block, append it locally and,
     * if the ledger accepted it, announce it to the gossip group.
     * Completes with empty when the miner gave up. Cancelling the returned future before the
     * search ends discards the block: it is neither appended nor announced.
     */
    public CompletableFuture<Optional<MinedBlock>> mine(String data) {
        Objects.requireNonNull(data, "data");
        return CompletableFuture
                .supplyAsync(() -> {
                    Block parent = chain.last().orElseThrow(() -> new IllegalStateException("node not started"));
                    return miner.mine(parent, data);
                }, miningExecutor)
                .thenApplyAsync(mined -> mined.map(block -> {
                    ValidationResult result = handler.onBlock(config.identity.value(), block);
                    int announced = result.ok ? handler.announceBlock(block) : 0;
                    return new MinedBlock(block, result, announced);
                }), eventLoop);
    }

    /** Ask one peer for its ledger. */
    public int requestChain(String peerId) {
        return handler.requestChain(peerId);
    }

    /** Ask every active peer for its ledger. */
    public int requestChainFromAll() {
        int sent = 0;
        for (String peerId : membership.activePeers()) {
            sent += handler.requestChain(peerId);
        }
        return sent;
    }

    @Override
    public void onPeerConnected(P2pServer.Peer peer) {
        handler.onPeerJoined(peer.nodeId(), peer.connectionId());
    }

    @Override
    public void onPeerDisconnected(P2pServer.Peer peer) {
        handler.onPeerExpired(peer.nodeId(), peer.connectionId());
    }

    @Override
    public void onMessage(P2pServer.Peer peer, Topic topic, byte[] payload) {
        submit(peer.nodeId(), payload);
    }

    public synchronized void close() {
        if (syncScheduler != null) {
            syncScheduler.shutdownNow();
            syncScheduler = null;
        }
        miningExecutor.shutdownNow();
        eventLoop.shutdown();
        try {
            if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                eventLoop.shutdownNow();
            }
        } catch (InterruptedException e) {
            eventLoop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // Properly typed accessors
    public NodeConfig config() { return config; }
    public ChainStore chain() { return chain; }
    public PeerMembership membership() { return membership; }
    public GossipHandler handler() { return handler; }

    private int publish(Topic topic, byte[] payload) {
        return transport.publish(topic, payload);
    }

    private void syncWithRandomPeer() {
        try {
            List<String> peers = new ArrayList<>(membership.activePeers());
            if (peers.isEmpty()) {
                return;
            }
            handler.requestChain(peers.get(ThreadLocalRandom.current().nextInt(peers.size())));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Periodic chain sync failed", e);
        }
    }

    private <T> CompletableFuture<T> onEventLoop(String what, java.util.function.Supplier<T> task) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(task, eventLoop);
        future.whenComplete((ignored, error) -> {
            if (error != null) {
                LOG.log(Level.SEVERE, "Failed to process " + what, error);
            }
        });
        return future;
    }

    private static java.util.concurrent.ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
