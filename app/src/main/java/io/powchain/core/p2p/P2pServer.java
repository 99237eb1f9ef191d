package io.powchain.core.p2p;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.util.AttributeKey;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.powchain.core.protocol.Block;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Newline-framed TCP transport for the block protocol.
 *
 * - Accepts inbound peers on {@code port}; dials outbound peers and re-dials them
 *   after {@code reconnectDelayMillis} whenever a dial fails or the connection drops, forever.
 * - Frames are bounded by {@code maxFrameBytes}; a peer that overflows it is disconnected.
 * - The peer list and the pending-block queue share one lock, so broadcast snapshots
 *   never race with connects and disconnects.
 * - Locally originated blocks (no excluded sender) broadcast while nobody can receive them are queued
 *   and flushed to the next peer that connects. Relays are never queued.
 */
public final class P2pServer implements PeerNetwork {
    public interface PeerListener {
        void onPeerConnected(Peer peer);
        void onPeerDisconnected(Peer peer);
        void onMessage(Peer peer, P2pMessage message);
    }

    /** A connected peer; identity for broadcast exclusion is {@code remoteAddress}. */
    public record Peer(String remoteAddress, boolean outbound) {
        public boolean sameAddress(Peer other) {
            return other != null && remoteAddress.equals(other.remoteAddress);
        }
    }

    private static final Logger LOG = Logger.getLogger(P2pServer.class.getName());
    private static final AttributeKey<PeerContext> CTX_KEY = AttributeKey.valueOf("peer-context");
    private static final AttributeKey<DialTarget> DIAL_KEY = AttributeKey.valueOf("dial-target");

    public static final long DEFAULT_RECONNECT_DELAY_MS = 5_000L;
    public static final int DEFAULT_MAX_FRAME_BYTES = 4096;

    private final int port;
    private final PeerListener listener;
    private final long reconnectDelayMillis;
    private final int maxFrameBytes;

    private final NioEventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final NioEventLoopGroup workerGroup = new NioEventLoopGroup();
    private final NioEventLoopGroup clientGroup = new NioEventLoopGroup();
    private final ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private final Object lock = new Object();
    private final Map<String, PeerContext> peersByAddress = new LinkedHashMap<>();
    private final List<Block> pendingBlocks = new ArrayList<>();

    private volatile boolean running;
    private Channel serverChannel;

    public P2pServer(int port, PeerListener listener) {
        this(port, listener, DEFAULT_RECONNECT_DELAY_MS, DEFAULT_MAX_FRAME_BYTES);
    }

    public P2pServer(int port, PeerListener listener, long reconnectDelayMillis, int maxFrameBytes) {
        this.port = port;
        this.listener = listener == null ? new LoggingPeerListener() : listener;
        this.reconnectDelayMillis = Math.max(10L, reconnectDelayMillis);
        this.maxFrameBytes = Math.max(64, maxFrameBytes);
    }

    public void start() {
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            configurePipeline(ch.pipeline());
                        }
                    });

            serverChannel = bootstrap.bind(port).sync().channel();
            channels.add(serverChannel);
            running = true;
            LOG.info(() -> "P2P network listening on port " + port);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting P2P server", e);
        }
    }

    public void connect(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return;
        }
        InetSocketAddress address;
        try {
            address = parseEndpoint(endpoint);
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> "Invalid peer endpoint: " + e.getMessage());
            return;
        }
        connect(address.getHostString(), address.getPort());
    }

    /**
     * Split {@code host:port} on the LAST colon, so bare IPv6 literals such as {@code ::1:9000} work;
     * {@code [::1]:9000} is accepted too. The host is not resolved.
     *
     * @throws IllegalArgumentException if there is no host, no port, or the port is not 1-65535
     */
    public static InetSocketAddress parseEndpoint(String endpoint) {
        String value = endpoint == null ? "" : endpoint.trim();
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("expected host:port, got '" + value + "'");
        }
        String host = value.substring(0, colon).trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("missing host in '" + value + "'");
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in '" + value + "'");
        }
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("invalid port in '" + value + "'");
        }
        return InetSocketAddress.createUnresolved(host, port);
    }

    public void connect(Collection<String> endpoints) {
        if (endpoints == null) {
            return;
        }
        for (String endpoint : endpoints) {
            connect(endpoint);
        }
    }

    /** Dial {@code host:targetPort}, retrying every reconnect delay until connected, and again after every disconnect. */
    public void connect(String host, int targetPort) {
        dial(new DialTarget(host, targetPort));
    }

    private void dial(DialTarget target) {
        if (!running) {
            return;
        }
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(clientGroup)
                .channel(NioSocketChannel.class)
                .attr(DIAL_KEY, target)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        configurePipeline(ch.pipeline());
                    }
                });

        bootstrap.connect(target.host(), target.port()).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                LOG.info(() -> "Connected to peer " + target);
            } else {
                LOG.warning(() -> "Failed to connect to peer " + target + ": " + future.cause()
                        + " - retrying in " + reconnectDelayMillis + " ms");
                scheduleReconnect(target);
            }
        });
    }

    private void scheduleReconnect(DialTarget target) {
        if (!running || clientGroup.isShuttingDown()) {
            return;
        }
        try {
            clientGroup.schedule(() -> dial(target), reconnectDelayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.fine(() -> "Reconnect to " + target + " dropped, client group is shutting down");
        }
    }

    @Override
    public boolean send(Peer peer, P2pMessage message) {
        if (peer == null || message == null) {
            return false;
        }
        PeerContext context;
        synchronized (lock) {
            context = peersByAddress.get(peer.remoteAddress());
        }
        if (context == null) {
            return false;
        }
        write(context, message);
        return true;
    }

    @Override
    public void broadcast(Block block, Peer exclude) {
        if (block == null) {
            return;
        }
        List<PeerContext> targets = new ArrayList<>();
        synchronized (lock) {
            for (PeerContext context : peersByAddress.values()) {
                if (exclude != null && context.peer.sameAddress(exclude)) {
                    LOG.fine(() -> "Skipping sender " + context.peer.remoteAddress());
                    continue;
                }
                targets.add(context);
            }
            if (targets.isEmpty()) {
                if (exclude == null) {
                    pendingBlocks.add(block);
                    LOG.warning(() -> "No peers yet - queueing block index=" + block.index());
                } else {
                    LOG.fine(() -> "No peer to relay block index=" + block.index() + " to");
                }
                return;
            }
        }

        P2pMessage message = P2pMessage.block(block);
        AtomicInteger outstanding = new AtomicInteger(targets.size());
        AtomicBoolean delivered = new AtomicBoolean();
        for (PeerContext context : targets) {
            write(context, message).addListener((ChannelFutureListener) future -> {
                if (future.isSuccess()) {
                    delivered.set(true);
                }
                if (outstanding.decrementAndGet() == 0 && !delivered.get() && exclude == null) {
                    synchronized (lock) {
                        pendingBlocks.add(block);
                    }
                    LOG.warning(() -> "Broadcast failed for every peer - queueing block index=" + block.index());
                }
            });
        }
    }

    @Override
    public Collection<Peer> peers() {
        List<Peer> peers = new ArrayList<>();
        synchronized (lock) {
            for (PeerContext context : peersByAddress.values()) {
                peers.add(context.peer);
            }
        }
        return peers;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    /** Blocks waiting for the next peer to connect. */
    public List<Block> pendingBlocks() {
        synchronized (lock) {
            return List.copyOf(pendingBlocks);
        }
    }

    public void stop() {
        running = false;
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        channels.close().awaitUninterruptibly();
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        clientGroup.shutdownGracefully();
        synchronized (lock) {
            peersByAddress.clear();
        }
        LOG.info("P2P server stopped");
    }

    private ChannelFuture write(PeerContext context, P2pMessage message) {
        return context.channel.writeAndFlush(message).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                LOG.log(Level.WARNING, "Error sending to peer " + context.peer.remoteAddress(), future.cause());
                future.channel().close();
            }
        });
    }

    private void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new LineBasedFrameDecoder(maxFrameBytes, true, true));
        pipeline.addLast(new StringDecoder(CharsetUtil.UTF_8));
        pipeline.addLast(new StringEncoder(CharsetUtil.UTF_8));
        pipeline.addLast(new LineCodec());
        pipeline.addLast(new PeerChannelHandler());
    }

    private final class PeerChannelHandler extends SimpleChannelInboundHandler<P2pMessage> {
        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            Channel channel = ctx.channel();
            DialTarget target = channel.attr(DIAL_KEY).get();
            Peer peer = new Peer(remoteAddress(channel), target != null);
            PeerContext context = new PeerContext(channel, peer, target);
            channel.attr(CTX_KEY).set(context);
            channels.add(channel);

            List<Block> queued;
            int count;
            synchronized (lock) {
                peersByAddress.put(peer.remoteAddress(), context);
                count = peersByAddress.size();
                queued = List.copyOf(pendingBlocks);
                pendingBlocks.clear();
            }
            LOG.info(() -> "Peer connected: " + peer.remoteAddress() + (peer.outbound() ? " (outbound)" : " (inbound)")
                    + ", peers=" + count);
            if (!queued.isEmpty()) {
                LOG.info(() -> "Flushing " + queued.size() + " pending blocks to new peer " + peer.remoteAddress());
                for (Block block : queued) {
                    write(context, P2pMessage.block(block));
                }
            }
            listener.onPeerConnected(peer);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            PeerContext context = ctx.channel().attr(CTX_KEY).get();
            channels.remove(ctx.channel());
            if (context == null) {
                return;
            }
            synchronized (lock) {
                peersByAddress.remove(context.peer.remoteAddress(), context);
            }
            LOG.info(() -> "Peer " + context.peer.remoteAddress() + " disconnected.");
            listener.onPeerDisconnected(context.peer);
            if (context.target != null) {
                scheduleReconnect(context.target);
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, P2pMessage msg) {
            PeerContext context = ctx.channel().attr(CTX_KEY).get();
            if (context == null) {
                return;
            }
            try {
                listener.onMessage(context.peer, msg);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to handle " + msg.type() + " from " + context.peer.remoteAddress(), e);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (cause instanceof TooLongFrameException) {
                LOG.warning(() -> "Message too long, buffer full from peer " + remoteAddress(ctx.channel()));
            } else {
                LOG.log(Level.WARNING, "P2P channel error", cause);
            }
            ctx.close();
        }
    }

    /** One frame &lt;-&gt; one message; the encoder appends the newline terminator. */
    private static final class LineCodec extends MessageToMessageCodec<String, P2pMessage> {
        @Override
        protected void encode(ChannelHandlerContext ctx, P2pMessage msg, List<Object> out) {
            out.add(msg.toLine() + "\n");
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, String msg, List<Object> out) {
            out.add(P2pMessage.parse(msg));
        }
    }

    private static String remoteAddress(Channel channel) {
        InetSocketAddress address = (InetSocketAddress) channel.remoteAddress();
        if (address == null) {
            return "unknown";
        }
        String host = address.getAddress() != null ? address.getAddress().getHostAddress() : address.getHostString();
        return host + ':' + address.getPort();
    }

    private record DialTarget(String host, int port) {
        DialTarget {
            Objects.requireNonNull(host, "host");
        }

        @Override public String toString() {
            return host + ':' + port;
        }
    }

    private static final class PeerContext {
        final Channel channel;
        final Peer peer;
        final DialTarget target;

        PeerContext(Channel channel, Peer peer, DialTarget target) {
            this.channel = channel;
            this.peer = peer;
            this.target = target;
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
        public void onMessage(Peer peer, P2pMessage message) {
            LOG.fine(() -> "Received " + message.type() + " from " + peer.remoteAddress());
        }
    }
}
