package io.gossipledger.core.node;

import io.gossipledger.core.p2p.P2pServer;
import io.gossipledger.core.p2p.Topic;

import java.util.List;

/** Immutable settings for one node, built once at startup and passed to the components that need them. */
public final class NodeConfig {
    public final PeerIdentity identity;
    public final Topic chainTopic;
    public final Topic blockTopic;
    public final int p2pPort;
    public final List<String> bootstrapPeers;
    public final long pingIntervalMillis;
    public final long idleTimeoutMillis;
    public final int maxFrameBytes;
    public final long minerMaxTries;
    public final long syncIntervalMillis;

    public NodeConfig(PeerIdentity identity, Topic chainTopic, Topic blockTopic, int p2pPort, List<String> bootstrapPeers,
                      long pingIntervalMillis, long idleTimeoutMillis, int maxFrameBytes,
                      long minerMaxTries, long syncIntervalMillis) {
        this.identity = identity;
        this.chainTopic = chainTopic;
        this.blockTopic = blockTopic;
        this.p2pPort = p2pPort;
        this.bootstrapPeers = bootstrapPeers == null ? List.of() : List.copyOf(bootstrapPeers);
        this.pingIntervalMillis = pingIntervalMillis;
        this.idleTimeoutMillis = idleTimeoutMillis;
        this.maxFrameBytes = maxFrameBytes;
        this.minerMaxTries = minerMaxTries;
        this.syncIntervalMillis = syncIntervalMillis;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                PeerIdentity.random(),
                Topic.chains(),
                Topic.blocks(),
                9000,                                   // p2p listen port
                List.of(),                              // no bootstrap peers
                P2pServer.DEFAULT_PING_INTERVAL_MS,
                P2pServer.DEFAULT_IDLE_TIMEOUT_MS,
                P2pServer.DEFAULT_MAX_FRAME_BYTES,
                50_000_000L,                            // nonce attempts before a mining job gives up
                0L                                      // periodic re-sync disabled
        );
    }

    public NodeConfig withIdentity(PeerIdentity identity) {
        return new NodeConfig(identity, chainTopic, blockTopic, p2pPort, bootstrapPeers,
                pingIntervalMillis, idleTimeoutMillis, maxFrameBytes, minerMaxTries, syncIntervalMillis);
    }

    public NodeConfig withNetwork(int p2pPort, List<String> bootstrapPeers) {
        return new NodeConfig(identity, chainTopic, blockTopic, p2pPort, bootstrapPeers,
                pingIntervalMillis, idleTimeoutMillis, maxFrameBytes, minerMaxTries, syncIntervalMillis);
    }

    public NodeConfig withSyncInterval(long syncIntervalMillis) {
        return new NodeConfig(identity, chainTopic, blockTopic, p2pPort, bootstrapPeers,
                pingIntervalMillis, idleTimeoutMillis, maxFrameBytes, minerMaxTries, syncIntervalMillis);
    }

    public NodeConfig withMinerMaxTries(long minerMaxTries) {
        return new NodeConfig(identity, chainTopic, blockTopic, p2pPort, bootstrapPeers,
                pingIntervalMillis, idleTimeoutMillis, maxFrameBytes, minerMaxTries, syncIntervalMillis);
    }
}
