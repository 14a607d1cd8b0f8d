package com.webchat.server.im.netty;

import com.webchat.server.im.auth.TokenValidator;
import com.webchat.server.im.connection.ConnectionSettings;
import com.webchat.server.im.netty.handler.HandshakeAuthHandler;
import com.webchat.server.im.netty.handler.HeartbeatHandler;
import com.webchat.server.im.netty.handler.WebSocketHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class WebSocketChannelInitializer extends ChannelInitializer<SocketChannel> {

    @Autowired
    private WebSocketHandler webSocketHandler;

    @Autowired
    private HeartbeatHandler heartbeatHandler;

    @Autowired
    private TokenValidator tokenValidator;

    @Autowired
    private ConnectionSettings settings;

    @Value("${netty.websocket-path:/ws}")
    private String websocketPath;

    @Override
    protected void initChannel(SocketChannel ch) throws Exception {
        ChannelPipeline pipeline = ch.pipeline();

        pipeline.addLast(new HttpServerCodec());
        pipeline.addLast(new HttpObjectAggregator(65536));

        // Reader idle for longer than the pong wait means the peer stopped answering pings
        pipeline.addLast(new IdleStateHandler(settings.getPongWait().toMillis(), 0, 0, TimeUnit.MILLISECONDS));
        pipeline.addLast(heartbeatHandler);

        pipeline.addLast(new HandshakeAuthHandler(tokenValidator));
        // checkStartsWith: the token travels in the query string
        pipeline.addLast(new WebSocketServerProtocolHandler(websocketPath, null, true,
                settings.getMaxMessageSize(), false, true));
        pipeline.addLast(webSocketHandler);
    }
}
