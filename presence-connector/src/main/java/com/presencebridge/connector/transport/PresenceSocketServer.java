package com.presencebridge.connector.transport;

import com.presencebridge.common.channel.EventChannel;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;
import io.netty.handler.codec.http.websocketx.*;
import io.netty.util.CharsetUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Netty WebSocket listener feeding the connector.
 *
 * <p>
 * Every accepted connection gets a unique id and produces, in order, one
 * {@link TransportEvent.Connected}, any number of
 * {@link TransportEvent.InboundMessage}s and exactly one
 * {@link TransportEvent.Disconnected} on {@link #events()}. Upgrades are
 * accepted on any path; plain HTTP requests are refused with 400.
 */
@Slf4j
public class PresenceSocketServer {

    static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    @Getter
    private final String host;
    private final int port;
    private final EventChannel<TransportEvent> events = new EventChannel<>("transport");
    private final AtomicLong nextClientId = new AtomicLong(0);
    private final Map<Long, NettyClientHandle> openClients = new ConcurrentHashMap<>();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public PresenceSocketServer(String host, int port) {
        this.host = host;
        this.port = port;
    }

    /**
     * Bind and start accepting connections.
     *
     * @throws TransportBindException if the address cannot be bound
     */
    public synchronized void start() {
        if (serverChannel != null) {
            log.debug("presence socket server already running");
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(MAX_CONTENT_LENGTH),
                                new SocketHandler());
                    }
                });
        try {
            serverChannel = b.bind(host, port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownGroups();
            throw new TransportBindException(host, port, e);
        } catch (Exception e) {
            shutdownGroups();
            throw new TransportBindException(host, port, e);
        }
        log.info("presence socket server listening on ws://{}:{}", host, getBoundPort());
    }

    /**
     * Close every client and the listener, then close {@link #events()}.
     */
    public synchronized void stop() {
        for (NettyClientHandle handle : openClients.values()) {
            handle.close();
        }
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            serverChannel = null;
        }
        shutdownGroups();
        events.close();
        log.info("presence socket server stopped");
    }

    /**
     * Listener event stream; closed by {@link #stop()}.
     */
    public EventChannel<TransportEvent> events() {
        return events;
    }

    /**
     * Actual listening port, useful when configured with port 0.
     */
    public int getBoundPort() {
        Channel ch = serverChannel;
        if (ch == null) {
            return port;
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    public boolean isRunning() {
        Channel ch = serverChannel;
        return ch != null && ch.isActive();
    }

    public int getOpenClientCount() {
        return openClients.size();
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    // ==================== Channel handler ====================

    private class SocketHandler extends SimpleChannelInboundHandler<Object> {

        private WebSocketServerHandshaker handshaker;
        private NettyClientHandle handle;
        private boolean disconnected;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof FullHttpRequest request) {
                handleHttpRequest(ctx, request);
            } else if (msg instanceof WebSocketFrame frame) {
                handleFrame(ctx, frame);
            }
        }

        private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest req) {
            if (handshaker != null
                    || !req.headers().contains(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
                sendHttpError(ctx, HttpResponseStatus.BAD_REQUEST, "websocket upgrade required");
                return;
            }
            WebSocketServerHandshakerFactory factory = new WebSocketServerHandshakerFactory(
                    "ws://" + req.headers().get(HttpHeaderNames.HOST) + req.uri(), null, true,
                    MAX_CONTENT_LENGTH);
            handshaker = factory.newHandshaker(req);
            if (handshaker == null) {
                WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
                return;
            }
            handshaker.handshake(ctx.channel(), req).addListener((ChannelFutureListener) f -> {
                if (!f.isSuccess()) {
                    log.debug("websocket handshake failed: {}",
                            f.cause() != null ? f.cause().getMessage() : "unknown");
                    ctx.close();
                    return;
                }
                ctx.pipeline().addBefore(ctx.name(), "ws-aggregator",
                        new WebSocketFrameAggregator(MAX_CONTENT_LENGTH));
                long clientId = nextClientId.getAndIncrement();
                handle = new NettyClientHandle(clientId, ctx.channel());
                openClients.put(clientId, handle);
                log.debug("ws:open client={} remote={}", clientId, ctx.channel().remoteAddress());
                events.send(new TransportEvent.Connected(clientId, handle));
            });
        }

        private void handleFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof CloseWebSocketFrame) {
                handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
                return;
            }
            if (frame instanceof PingWebSocketFrame) {
                ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
                return;
            }
            if (handle == null) {
                return;
            }
            if (frame instanceof TextWebSocketFrame text) {
                events.send(new TransportEvent.InboundMessage(handle.getClientId(),
                        SocketMessage.text(text.text())));
            } else if (frame instanceof BinaryWebSocketFrame binary) {
                events.send(new TransportEvent.InboundMessage(handle.getClientId(),
                        SocketMessage.binary(ByteBufUtil.getBytes(binary.content()))));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            if (handle != null && !disconnected) {
                disconnected = true;
                openClients.remove(handle.getClientId());
                log.debug("ws:close client={}", handle.getClientId());
                events.send(new TransportEvent.Disconnected(handle.getClientId()));
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("socket handler error: {}", cause.getMessage());
            ctx.close();
        }
    }

    private static void sendHttpError(ChannelHandlerContext ctx, HttpResponseStatus status, String body) {
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(body, CharsetUtil.UTF_8));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        resp.headers().set(HttpHeaderNames.CONTENT_LENGTH, resp.content().readableBytes());
        resp.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }
}
