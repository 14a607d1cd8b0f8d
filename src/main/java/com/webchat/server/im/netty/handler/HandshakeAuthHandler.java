package com.webchat.server.im.netty.handler;

import com.webchat.server.im.auth.TokenValidator;
import com.webchat.server.im.exception.InvalidTokenException;
import com.webchat.server.im.model.UserIdentity;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Authenticates the upgrade request before the WebSocket handshake. The token comes from
 * the {@code token} query parameter or an {@code Authorization: Bearer} header. On success
 * the identity is attached to the channel and this handler leaves the pipeline.
 * <p>
 * One instance per channel.
 */
public class HandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(HandshakeAuthHandler.class);

    public static final AttributeKey<UserIdentity> ATTR_IDENTITY = AttributeKey.valueOf("identity");

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenValidator tokenValidator;

    public HandshakeAuthHandler(TokenValidator tokenValidator) {
        super(false);
        this.tokenValidator = tokenValidator;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String token = extractToken(request);
        if (token == null) {
            request.release();
            reject(ctx, "Token required");
            return;
        }

        UserIdentity identity;
        try {
            identity = tokenValidator.validate(token);
        } catch (InvalidTokenException e) {
            log.warn("Rejected upgrade from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            request.release();
            reject(ctx, "Invalid token");
            return;
        }

        ctx.channel().attr(ATTR_IDENTITY).set(identity);
        ctx.pipeline().remove(this);
        ctx.fireChannelRead(request);
    }

    static String extractToken(FullHttpRequest request) {
        List<String> tokens = new QueryStringDecoder(request.uri()).parameters().get("token");
        if (tokens != null && !tokens.isEmpty() && !tokens.get(0).isEmpty()) {
            return tokens.get(0);
        }
        String header = request.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    private void reject(ChannelHandlerContext ctx, String reason) {
        byte[] body = ("{\"error\":\"" + reason + "\"}").getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1,
                HttpResponseStatus.UNAUTHORIZED, Unpooled.wrappedBuffer(body));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body.length);
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }
}
