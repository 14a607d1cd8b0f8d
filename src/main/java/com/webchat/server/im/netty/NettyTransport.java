package com.webchat.server.im.netty;

import com.webchat.server.im.connection.Transport;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;

import java.io.IOException;
import java.time.Duration;

/**
 * {@link Transport} over a Netty channel. Must not be used from the channel's event loop,
 * since writes wait for their future.
 */
public class NettyTransport implements Transport {

    private final Channel channel;

    public NettyTransport(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void write(String text, Duration deadline) throws IOException {
        send(new TextWebSocketFrame(text), deadline);
    }

    @Override
    public void ping(Duration deadline) throws IOException {
        send(new PingWebSocketFrame(), deadline);
    }

    private void send(WebSocketFrame frame, Duration deadline) throws IOException {
        if (!channel.isActive()) {
            frame.release();
            throw new IOException("channel " + id() + " is closed");
        }
        ChannelFuture future = channel.writeAndFlush(frame);
        if (!future.awaitUninterruptibly(deadline.toMillis())) {
            throw new IOException("write to " + id() + " timed out after " + deadline.toMillis() + " ms");
        }
        if (!future.isSuccess()) {
            throw new IOException("write to " + id() + " failed", future.cause());
        }
    }

    @Override
    public void pauseReads() {
        channel.config().setAutoRead(false);
    }

    @Override
    public void resumeReads() {
        channel.config().setAutoRead(true);
    }

    @Override
    public void close() {
        if (channel.isActive()) {
            channel.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public String id() {
        return channel.id().asShortText();
    }
}
