package io.gossipledger.core.p2p;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.AttributeKey;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.ScheduledFuture;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Netty transport: length-prefixed JSON frames, node-id handshake, ping/pong heartbeat,
 * and topic publications delivered to a {@link PeerListener}.
 *
 * Publications go to every peer in the shared {@link PeerMembership}, over one live
 * connection per peer. The server reports connections and disconnections to the
 * listener but never edits membership itself.
 */
public final class P2pServer implements GossipPublisher {
    public interface PeerListener {
        void onPeerConnected(Peer peer);
        void onPeerDisconnected(Peer peer);
        void onMessage(Peer peer, Topic topic, byte[] payload);
    }

    /** One handshaken connection. {@code connectionId} is unique per channel. */
    public record Peer(String nodeId, String remoteAddress, String connectionId) {}

    private static final Logger LOG = Logger.getLogger(P2pServer.class.getName());
    private static final ObjectMapper FRAME_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final AttributeKey<Connection> CONNECTION = AttributeKey.valueOf("gossip-connection");

    public static final long DEFAULT_PING_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final String localId;
    private final int listenPort;
    private final PeerListener listener;
    private final PeerMembership membership;
    private final Set<String> subscribedTopics = ConcurrentHashMap.newKeySet();
    private final long pingIntervalMillis;
    private final long idleTimeoutMillis;
    private final boolean answerPings;
    private final int maxFrameBytes;

    private final NioEventLoopGroup acceptors = new NioEventLoopGroup(1);
    private final NioEventLoopGroup io = new NioEventLoopGroup();
    private final ChannelGroup openChannels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    private volatile Channel listenChannel;
    private volatile ScheduledFuture<?> heartbeat;

    public P2pServer(String nodeId, int port, PeerListener listener, PeerMembership membership) {
        this(nodeId, port, listener, membership, DEFAULT_PING_INTERVAL_MS, DEFAULT_IDLE_TIMEOUT_MS, true, DEFAULT_MAX_FRAME_BYTES);
    }

    public P2pServer(String nodeId, int port, PeerListener listener, PeerMembership membership,
                     long pingIntervalMillis, long idleTimeoutMillis, boolean answerPings, int maxFrameBytes) {
        this.localId = Objects.requireNonNull(nodeId, "nodeId");
        this.listenPort = port;
        this.listener = listener == null ? new LoggingPeerListener() : listener;
        this.membership = Objects.requireNonNull(membership, "membership");
        this.pingIntervalMillis = Math.max(100L, pingIntervalMillis);
        this.idleTimeoutMillis = Math.max(this.pingIntervalMillis, idleTimeoutMillis);
        this.answerPings = answerPings;
        this.maxFrameBytes = Math.max(1024, maxFrameBytes);
    }

    /** Accept publications on this topic. Publications on other topics are dropped. */
    public void subscribe(Topic topic) {
        subscribedTopics.add(topic.name());
    }

    public void start() {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(acceptors, io)
                .channel(NioServerSocketChannel.class)
                .childHandler(new FrameInitializer());
        try {
            listenChannel = bootstrap.bind(listenPort).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while binding gossip port " + listenPort, e);
        }
        openChannels.add(listenChannel);
        heartbeat = io.scheduleAtFixedRate(this::heartbeat, pingIntervalMillis, pingIntervalMillis, TimeUnit.MILLISECONDS);
        LOG.info(() -> "Gossip transport for " + localId + " listening on " + boundPort() + ", topics " + subscribedTopics);
    }

    /** Port actually bound, which differs from the configured one when that was 0. */
    public int boundPort() {
        Channel channel = listenChannel;
        return channel == null ? listenPort : ((InetSocketAddress) channel.localAddress()).getPort();
    }

    /** Dials {@code host:port}. A malformed endpoint is logged and skipped. */
    public void connect(String endpoint) {
        InetSocketAddress address = parseEndpoint(endpoint);
        if (address == null) {
            LOG.warning(() -> "Skipping malformed peer endpoint '" + endpoint + "'");
            return;
        }
        connect(address.getHostString(), address.getPort());
    }

    public void connect(Collection<String> endpoints) {
        if (endpoints != null) {
            endpoints.forEach(this::connect);
        }
    }

    public void connect(String host, int port) {
        new Bootstrap()
                .group(io)
                .channel(NioSocketChannel.class)
                .handler(new FrameInitializer())
                .connect(host, port)
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        LOG.log(Level.WARNING, "Dial to " + host + ':' + port + " failed", future.cause());
                        return;
                    }
                    openChannels.add(future.channel());
                    LOG.fine(() -> "Dialed " + host + ':' + port);
                });
    }

    @Override
    public int publish(Topic topic, byte[] payload) {
        if (topic == null || payload == null) {
            return 0;
        }
        P2pMessage frame = P2pMessage.publish(topic.name(), new String(payload, StandardCharsets.UTF_8));
        int delivered = 0;
        for (String peerId : membership.activePeers()) {
            Connection connection = liveConnectionTo(peerId);
            if (connection != null) {
                connection.channel.writeAndFlush(frame);
                delivered++;
            }
        }
        int count = delivered;
        LOG.fine(() -> topic + ": " + payload.length + " bytes to " + count + " peer(s)");
        return delivered;
    }

    /** Handshaken connections (a peer connected twice shows up twice). */
    public Collection<Peer> peers() {
        return connections.values().stream()
                .filter(Connection::handshaken)
                .map(Connection::peer)
                .collect(Collectors.toList());
    }

    public void stop() {
        ScheduledFuture<?> task = heartbeat;
        if (task != null) {
            task.cancel(false);
        }
        openChannels.close().awaitUninterruptibly();
        acceptors.shutdownGracefully();
        io.shutdownGracefully();
        connections.clear();
        LOG.info(() -> "Gossip transport for " + localId + " stopped");
    }

    static InetSocketAddress parseEndpoint(String endpoint) {
        if (endpoint == null) {
            return null;
        }
        int colon = endpoint.lastIndexOf(':');
        if (colon <= 0 || colon == endpoint.length() - 1) {
            return null;
        }
        try {
            int port = Integer.parseInt(endpoint.substring(colon + 1).trim());
            if (port < 1 || port > 65_535) {
                return null;
            }
            return InetSocketAddress.createUnresolved(endpoint.substring(0, colon).trim(), port);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Connection liveConnectionTo(String peerId) {
        return connections.values().stream()
                .filter(c -> peerId.equals(c.remoteId) && c.channel.isActive())
                .findFirst()
                .orElse(null);
    }

    // Runs on an io event loop; an exception here would cancel the schedule.
    private void heartbeat() {
        long now = System.currentTimeMillis();
        for (Connection connection : connections.values()) {
            if (!connection.handshaken() || !connection.channel.isActive()) {
                continue;
            }
            try {
                if (now - connection.lastSeen > idleTimeoutMillis) {
                    LOG.fine(() -> "Peer " + connection.remoteId + " silent for " + (now - connection.lastSeen) + " ms, closing");
                    connection.channel.close();
                } else if (now - connection.lastPingSent >= pingIntervalMillis) {
                    connection.lastPingSent = now;
                    connection.channel.writeAndFlush(P2pMessage.ping());
                }
            } catch (RuntimeException e) {
                LOG.log(Level.FINE, "Heartbeat to " + connection.remoteId + " failed", e);
            }
        }
    }

    private final class FrameInitializer extends ChannelInitializer<SocketChannel> {
        @Override
        protected void initChannel(SocketChannel ch) {
            ch.pipeline()
                    .addLast(new LengthFieldBasedFrameDecoder(maxFrameBytes, 0, 4, 0, 4))
                    .addLast(new LengthFieldPrepender(4))
                    .addLast(new StringDecoder(CharsetUtil.UTF_8))
                    .addLast(new StringEncoder(CharsetUtil.UTF_8))
                    .addLast(new FrameJsonCodec())
                    .addLast(new GossipChannelHandler());
        }
    }

    private final class GossipChannelHandler extends SimpleChannelInboundHandler<P2pMessage> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            Connection connection = new Connection(ctx.channel());
            ctx.channel().attr(CONNECTION).set(connection);
            openChannels.add(ctx.channel());
            connections.put(connection.connectionId, connection);
            ctx.writeAndFlush(P2pMessage.handshake(localId));
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            Connection connection = ctx.channel().attr(CONNECTION).get();
            if (connection == null) {
                return;
            }
            connections.remove(connection.connectionId);
            if (connection.handshaken()) {
                listener.onPeerDisconnected(connection.peer());
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, P2pMessage frame) {
            Connection connection = ctx.channel().attr(CONNECTION).get();
            if (connection == null) {
                return;
            }
            String type = frame.type();
            if (P2pMessage.HANDSHAKE.equals(type)) {
                onHandshake(ctx, connection, frame.nodeId());
            } else if (!connection.touch()) {
                LOG.finest(() -> "Ignoring " + type + " before handshake");
            } else if (P2pMessage.PING.equals(type)) {
                if (answerPings) {
                    ctx.writeAndFlush(P2pMessage.pong());
                }
            } else if (P2pMessage.PUBLISH.equals(type)) {
                onPublish(connection, frame);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Closing gossip channel " + ctx.channel().id().asShortText(), cause);
            ctx.close();
        }

        private void onHandshake(ChannelHandlerContext ctx, Connection connection, String remoteId) {
            if (remoteId == null || remoteId.isBlank() || connection.handshaken()) {
                return;
            }
            if (remoteId.equals(localId)) {
                LOG.fine(() -> "Dialed ourselves at " + connection.peer().remoteAddress() + ", dropping");
                ctx.close();
                return;
            }
            connection.remoteId = remoteId;
            connection.lastSeen = System.currentTimeMillis();
            listener.onPeerConnected(connection.peer());
        }

        private void onPublish(Connection connection, P2pMessage frame) {
            String topic = frame.topic();
            if (topic == null || frame.data() == null) {
                return;
            }
            if (!subscribedTopics.contains(topic)) {
                LOG.finest(() -> "Not subscribed to " + topic + ", dropping publication");
                return;
            }
            listener.onMessage(connection.peer(), new Topic(topic), frame.data().getBytes(StandardCharsets.UTF_8));
        }
    }

    private static final class FrameJsonCodec extends MessageToMessageCodec<String, P2pMessage> {
        @Override
        protected void encode(ChannelHandlerContext ctx, P2pMessage frame, List<Object> out) throws Exception {
            out.add(FRAME_MAPPER.writeValueAsString(frame));
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, String text, List<Object> out) throws Exception {
            out.add(FRAME_MAPPER.readValue(text, P2pMessage.class));
        }
    }

    private static final class Connection {
        final Channel channel;
        final String connectionId;
        volatile String remoteId;
        volatile long lastSeen = System.currentTimeMillis();
        volatile long lastPingSent;

        Connection(Channel channel) {
            this.channel = channel;
            this.connectionId = channel.id().asLongText();
        }

        boolean handshaken() {
            return remoteId != null;
        }

        /** Records traffic from a handshaken peer. Returns false before the handshake. */
        boolean touch() {
            if (!handshaken()) {
                return false;
            }
            lastSeen = System.currentTimeMillis();
            return true;
        }

        Peer peer() {
            InetSocketAddress address = (InetSocketAddress) channel.remoteAddress();
            String remote = address == null ? "unknown" : address.getHostString() + ':' + address.getPort();
            return new Peer(remoteId, remote, connectionId);
        }
    }

    private static final class LoggingPeerListener implements PeerListener {
        @Override
        public void onPeerConnected(Peer peer) {
            LOG.info(() -> "Peer connected: " + peer);
        }

        @Override
        public void onPeerDisconnected(Peer peer) {
            LOG.info(() -> "Peer disconnected: " + peer);
        }

        @Override
        public void onMessage(Peer peer, Topic topic, byte[] payload) {
            LOG.fine(() -> "Received " + payload.length + " bytes on " + topic + " from " + peer.nodeId());
        }
    }
}
