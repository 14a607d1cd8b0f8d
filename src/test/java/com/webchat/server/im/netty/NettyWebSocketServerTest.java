package com.webchat.server.im.netty;

import io.netty.handler.logging.LoggingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.Socket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NettyWebSocketServerTest {

    private NettyWebSocketServer server;
    private NettyWebSocketServer other;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (other != null) {
            other.stop();
        }
    }

    @Test
    void stopWithoutStartIsANoOp() {
        server = new NettyWebSocketServer(0, new LoggingHandler());

        server.stop();

        assertThat(server.isRunning()).isFalse();
        assertThat(server.getBoundPort()).isEqualTo(-1);
    }

    @Test
    void bindsDuringStartAndStopsOnce() throws Exception {
        server = new NettyWebSocketServer(0, new LoggingHandler());
        server.start();

        int port = server.getBoundPort();
        assertThat(port).isPositive();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress("127.0.0.1", port), 2000);
            assertThat(socket.isConnected()).isTrue();
        }

        server.stop();
        server.stop();
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    void portInUseFailsStartup() {
        server = new NettyWebSocketServer(0, new LoggingHandler());
        server.start();

        other = new NettyWebSocketServer(server.getBoundPort(), new LoggingHandler());
        assertThatThrownBy(other::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(String.valueOf(server.getBoundPort()));
        assertThat(other.isRunning()).isFalse();
    }
}
