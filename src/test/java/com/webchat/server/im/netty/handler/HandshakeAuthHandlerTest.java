package com.webchat.server.im.netty.handler;

import com.webchat.server.im.auth.TokenValidator;
import com.webchat.server.im.exception.InvalidTokenException;
import com.webchat.server.im.model.UserIdentity;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HandshakeAuthHandlerTest {

    private final TokenValidator validator = token -> {
        if ("good".equals(token)) {
            return new UserIdentity(42, "alice");
        }
        throw new InvalidTokenException("bad token");
    };

    @Test
    void queryTokenAuthenticatesAndPassesTheUpgradeOn() {
        EmbeddedChannel channel = new EmbeddedChannel(new HandshakeAuthHandler(validator));

        FullHttpRequest request = request("/ws?token=good");
        channel.writeInbound(request);

        assertThat(channel.attr(HandshakeAuthHandler.ATTR_IDENTITY).get()).isEqualTo(new UserIdentity(42, "alice"));
        assertThat(channel.pipeline().get(HandshakeAuthHandler.class)).isNull();
        FullHttpRequest forwarded = channel.readInbound();
        assertThat(forwarded).isSameAs(request);
        forwarded.release();
        channel.finishAndReleaseAll();
    }

    @Test
    void bearerHeaderIsAccepted() {
        EmbeddedChannel channel = new EmbeddedChannel(new HandshakeAuthHandler(validator));
        FullHttpRequest request = request("/ws");
        request.headers().set(HttpHeaderNames.AUTHORIZATION, "Bearer good");

        channel.writeInbound(request);

        assertThat(channel.attr(HandshakeAuthHandler.ATTR_IDENTITY).get().getUserId()).isEqualTo(42L);
        channel.finishAndReleaseAll();
    }

    @Test
    void missingTokenIsRejectedWith401() {
        EmbeddedChannel channel = new EmbeddedChannel(new HandshakeAuthHandler(validator));

        channel.writeInbound(request("/ws"));

        FullHttpResponse response = channel.readOutbound();
        assertThat(response.status()).isEqualTo(HttpResponseStatus.UNAUTHORIZED);
        assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("Token required");
        response.release();
        assertThat(channel.isOpen()).isFalse();
        assertThat((Object) channel.readInbound()).isNull();
    }

    @Test
    void invalidTokenIsRejectedWith401() {
        EmbeddedChannel channel = new EmbeddedChannel(new HandshakeAuthHandler(validator));

        channel.writeInbound(request("/ws?token=forged"));

        FullHttpResponse response = channel.readOutbound();
        assertThat(response.status()).isEqualTo(HttpResponseStatus.UNAUTHORIZED);
        assertThat(response.content().toString(StandardCharsets.UTF_8)).contains("Invalid token");
        response.release();
        assertThat(channel.attr(HandshakeAuthHandler.ATTR_IDENTITY).get()).isNull();
        assertThat(channel.isOpen()).isFalse();
    }

    @Test
    void queryParameterWinsOverHeader() {
        FullHttpRequest request = request("/ws?token=from-query");
        request.headers().set(HttpHeaderNames.AUTHORIZATION, "Bearer from-header");

        assertThat(HandshakeAuthHandler.extractToken(request)).isEqualTo("from-query");
        request.release();
    }

    @Test
    void nonBearerHeaderIsIgnored() {
        FullHttpRequest request = request("/ws");
        request.headers().set(HttpHeaderNames.AUTHORIZATION, "Basic dXNlcjpwYXNz");

        assertThat(HandshakeAuthHandler.extractToken(request)).isNull();
        request.release();
    }

    private static FullHttpRequest request(String uri) {
        return new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
    }
}
