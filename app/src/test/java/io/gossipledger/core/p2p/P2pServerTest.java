package io.gossipledger.core.p2p;

import io.gossipledger.core.TestChains;
import io.gossipledger.core.node.Node;
import io.gossipledger.core.node.NodeConfig;
import io.gossipledger.core.node.PeerIdentity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class P2pServerTest {

    private final List<P2pServer> servers = new CopyOnWriteArrayList<>();
    private final List<Node> nodes = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        for (P2pServer server : servers) {
            try {
                server.stop();
            } catch (Exception ignored) {
            }
        }
        servers.clear();
        for (Node node : nodes) {
            node.close();
        }
        nodes.clear();
    }

    @Test
    void handshakeExchangesNodeIds() throws Exception {
        int portA = freePort();
        int portB = freePort();

        CountDownLatch latch = new CountDownLatch(2);
        RecordingListener listenerA = new RecordingListener(new PeerMembership(), latch, null);
        RecordingListener listenerB = new RecordingListener(new PeerMembership(), latch, null);

        P2pServer serverA = createServer("node-A", portA, listenerA);
        P2pServer serverB = createServer("node-B", portB, listenerB);

        serverA.start();
        serverB.start();

        serverB.connect("127.0.0.1:" + portA);

        assertTrue(latch.await(5, TimeUnit.SECONDS), "Peers should handshake in time");
        assertTrue(listenerA.membership.isActive("node-B"));
        assertTrue(listenerB.membership.isActive("node-A"));

        assertEquals(1, serverA.peers().size());
        P2pServer.Peer peerFromA = serverA.peers().iterator().next();
        assertEquals("node-B", peerFromA.nodeId());
        assertNotNull(peerFromA.connectionId());
    }

    @Test
    void publicationsReachSubscribedPeersOnly() throws Exception {
        int portA = freePort();
        int portB = freePort();

        CountDownLatch handshake = new CountDownLatch(2);
        CountDownLatch delivered = new CountDownLatch(1);
        RecordingListener listenerA = new RecordingListener(new PeerMembership(), handshake, null);
        RecordingListener listenerB = new RecordingListener(new PeerMembership(), handshake, delivered);

        P2pServer serverA = createServer("node-A", portA, listenerA);
        P2pServer serverB = createServer("node-B", portB, listenerB);
        serverB.subscribe(Topic.chains());

        serverA.start();
        serverB.start();
        serverB.connect("127.0.0.1", portA);
        assertTrue(handshake.await(5, TimeUnit.SECONDS));

        assertEquals(1, serverA.publish(Topic.blocks(), "{\"skipped\":true}".getBytes(StandardCharsets.UTF_8)));
        assertEquals(1, serverA.publish(Topic.chains(), "{\"from_peer_id\":\"node-B\"}".getBytes(StandardCharsets.UTF_8)));

        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertEquals(1, listenerB.received.size());
        assertEquals("chains", listenerB.received.get(0).topic);
        assertEquals("{\"from_peer_id\":\"node-B\"}", listenerB.received.get(0).payload);
    }

    @Test
    void publishWithoutActivePeersSendsNothing() {
        P2pServer server = createServer("node-A", 0, new RecordingListener(new PeerMembership(), new CountDownLatch(1), null));
        assertEquals(0, server.publish(Topic.blocks(), new byte[] {'{', '}'}));
    }

    @Test
    void stalePeerIsDisconnectedWhenNoHeartbeat() throws Exception {
        int portA = freePort();
        int portB = freePort();

        CountDownLatch handshake = new CountDownLatch(2);
        CountDownLatch disconnectLatch = new CountDownLatch(1);

        RecordingListener listenerA = new RecordingListener(new PeerMembership(), handshake, null);
        listenerA.disconnects = disconnectLatch;
        RecordingListener listenerB = new RecordingListener(new PeerMembership(), handshake, null);

        PeerMembership membershipA = listenerA.membership;
        P2pServer serverA = createServer("node-A", portA, listenerA, membershipA, 200L, 600L, true);
        P2pServer serverB = createServer("node-B", portB, listenerB, listenerB.membership, 50_000L, 600L, false);

        serverA.start();
        serverB.start();

        serverB.connect("127.0.0.1", portA);

        assertTrue(handshake.await(5, TimeUnit.SECONDS));
        assertTrue(disconnectLatch.await(5, TimeUnit.SECONDS));
        assertTrue(serverA.peers().isEmpty());
        assertFalse(membershipA.isActive("node-B"));
    }

    @Test
    void connectionToSelfIsDropped() throws Exception {
        int port = freePort();
        CountDownLatch handshake = new CountDownLatch(1);
        RecordingListener listener = new RecordingListener(new PeerMembership(), handshake, null);
        P2pServer server = createServer("node-A", port, listener);
        server.start();

        server.connect("127.0.0.1", port);

        assertFalse(handshake.await(1, TimeUnit.SECONDS));
        assertTrue(server.peers().isEmpty());
    }

    @Test
    void joiningNodeAdoptsLongerChainOverTheWire() throws Exception {
        Node nodeA = startNode("node-A");
        nodeA.chain().replaceWith(TestChains.mainChain());
        Node nodeB = startNode("node-B");

        int portA = freePort();
        int portB = freePort();
        P2pServer serverA = wire(nodeA, portA);
        P2pServer serverB = wire(nodeB, portB);
        serverA.start();
        serverB.start();

        serverB.connect("127.0.0.1", portA);

        long deadline = System.currentTimeMillis() + 10_000L;
        while (nodeB.chain().size() < TestChains.mainChain().size() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50L);
        }
        assertEquals(TestChains.mainChain(), nodeB.chain().snapshot());
        assertEquals(TestChains.mainChain(), nodeA.chain().snapshot());
        assertTrue(nodeA.membership().isActive("node-B"));
        assertTrue(nodeB.membership().isActive("node-A"));
    }

    @Test
    void parsesEndpoints() {
        java.net.InetSocketAddress address = P2pServer.parseEndpoint("peer1:9000");
        assertNotNull(address);
        assertEquals("peer1", address.getHostString());
        assertEquals(9000, address.getPort());

        assertNull(P2pServer.parseEndpoint("peer1"));
        assertNull(P2pServer.parseEndpoint(":9000"));
        assertNull(P2pServer.parseEndpoint("peer1:"));
        assertNull(P2pServer.parseEndpoint("peer1:notaport"));
        assertNull(P2pServer.parseEndpoint("peer1:70000"));
        assertNull(P2pServer.parseEndpoint(null));
    }

    private Node startNode(String id) {
        Node node = Node.inMemory(NodeConfig.defaultLocal().withIdentity(new PeerIdentity(id)));
        node.start();
        nodes.add(node);
        return node;
    }

    private P2pServer wire(Node node, int port) {
        P2pServer server = createServer(node.config().identity.value(), port, node, node.membership(), 10_000L, 30_000L, true);
        server.subscribe(node.config().chainTopic);
        server.subscribe(node.config().blockTopic);
        node.bindTransport(server);
        return server;
    }

    private P2pServer createServer(String nodeId, int port, RecordingListener listener) {
        return createServer(nodeId, port, listener, listener.membership, 10_000L, 30_000L, true);
    }

    private P2pServer createServer(String nodeId, int port, P2pServer.PeerListener listener, PeerMembership membership,
                                   long pingIntervalMillis, long idleTimeoutMillis, boolean autoRespondPings) {
        P2pServer server = new P2pServer(nodeId, port, listener, membership, pingIntervalMillis, idleTimeoutMillis,
                autoRespondPings, P2pServer.DEFAULT_MAX_FRAME_BYTES);
        servers.add(server);
        return server;
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

    private record Received(String topic, String payload) {}

    /** Keeps the shared membership in step with connections, the way the node does. */
    private static final class RecordingListener implements P2pServer.PeerListener {
        private final PeerMembership membership;
        private final CountDownLatch handshakes;
        private final CountDownLatch messages;
        private final CopyOnWriteArrayList<Received> received = new CopyOnWriteArrayList<>();
        private volatile CountDownLatch disconnects;

        RecordingListener(PeerMembership membership, CountDownLatch handshakes, CountDownLatch messages) {
            this.membership = membership;
            this.handshakes = handshakes;
            this.messages = messages;
        }

        @Override
        public void onPeerConnected(P2pServer.Peer peer) {
            membership.join(peer.nodeId(), peer.connectionId());
            handshakes.countDown();
        }

        @Override
        public void onPeerDisconnected(P2pServer.Peer peer) {
            membership.expire(peer.nodeId(), peer.connectionId());
            if (disconnects != null) {
                disconnects.countDown();
            }
        }

        @Override
        public void onMessage(P2pServer.Peer peer, Topic topic, byte[] payload) {
            received.add(new Received(topic.name(), new String(payload, StandardCharsets.UTF_8)));
            if (messages != null) {
                messages.countDown();
            }
        }
    }
}
