package com.webchat.server.im.netty.handler;

import com.webchat.server.im.connection.Connection;
import com.webchat.server.im.connection.ConnectionFactory;
import com.webchat.server.im.model.UserIdentity;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reader side of a connection: opens the {@link Connection} once the handshake completes,
 * forwards text frames to it and tears it down when the channel goes away.
 */
@Component
@ChannelHandler.Sharable
public class WebSocketHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    public static final AttributeKey<Connection> ATTR_CONNECTION = AttributeKey.valueOf("connection");

    @Autowired
    private ConnectionFactory connectionFactory;

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            UserIdentity identity = ctx.channel().attr(HandshakeAuthHandler.ATTR_IDENTITY).get();
            if (identity == null) {
                log.error("Handshake completed without identity on {}, closing", ctx.channel().id());
                ctx.close();
                return;
            }
            Connection connection = connectionFactory.open(identity, ctx.channel());
            ctx.channel().attr(ATTR_CONNECTION).set(connection);
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        Connection connection = ctx.channel().attr(ATTR_CONNECTION).get();
        if (connection == null) {
            log.warn("Frame before handshake completion on {}, ignoring", ctx.channel().id());
            return;
        }
        connection.onInbound(frame.text());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        teardown(ctx);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("WebSocket error on {}", ctx.channel().id(), cause);
        teardown(ctx);
        ctx.close();
    }

    private void teardown(ChannelHandlerContext ctx) {
        Connection connection = ctx.channel().attr(ATTR_CONNECTION).getAndSet(null);
        if (connection != null) {
            connection.terminate();
        }
    }
}
