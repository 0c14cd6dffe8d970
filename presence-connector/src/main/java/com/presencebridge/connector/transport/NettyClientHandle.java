package com.presencebridge.connector.transport;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ClientHandle} over a Netty channel. Writes are queued on the
 * channel's event loop, so a slow peer never stalls the caller.
 */
@Slf4j
class NettyClientHandle implements ClientHandle {

    private final long clientId;
    private final Channel channel;

    NettyClientHandle(long clientId, Channel channel) {
        this.clientId = clientId;
        this.channel = channel;
    }

    @Override
    public long getClientId() {
        return clientId;
    }

    @Override
    public void send(SocketMessage message) {
        if (!channel.isActive()) {
            log.debug("send to closed client {} dropped", clientId);
            return;
        }
        WebSocketFrame frame = message.isText()
                ? new TextWebSocketFrame(message.asText())
                : new BinaryWebSocketFrame(Unpooled.wrappedBuffer(message.asBytes()));
        channel.writeAndFlush(frame).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("send to client {} failed: {}", clientId,
                        f.cause() != null ? f.cause().getMessage() : "unknown");
            }
        });
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    void close() {
        channel.close();
    }

    @Override
    public String toString() {
        return "NettyClientHandle[" + clientId + " " + channel.remoteAddress() + "]";
    }
}
