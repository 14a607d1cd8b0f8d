package com.webchat.server.im.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Owns the boss/worker groups and the listening channel. The port is bound during
 * startup, so a port already in use fails the application context.
 */
@Component
public class NettyWebSocketServer {

    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketServer.class);

    private final int port;
    private final ChannelHandler channelInitializer;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    @Autowired
    public NettyWebSocketServer(@Value("${netty.port:8088}") int port,
                                WebSocketChannelInitializer channelInitializer) {
        this(port, (ChannelHandler) channelInitializer);
    }

    NettyWebSocketServer(int port, ChannelHandler channelInitializer) {
        this.port = port;
        this.channelInitializer = channelInitializer;
    }

    @PostConstruct
    public synchronized void start() {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(channelInitializer);
            serverChannel = b.bind(port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownGroups();
            throw new IllegalStateException("Interrupted while binding port " + port, e);
        } catch (Exception e) {
            shutdownGroups();
            throw new IllegalStateException("Cannot bind WebSocket server on port " + port, e);
        }
        log.info("Netty WebSocket server started on port: {}", getBoundPort());
    }

    /**
     * Port actually bound, or -1 when not running.
     */
    public synchronized int getBoundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized boolean isRunning() {
        return serverChannel != null;
    }

    /**
     * Close the listening channel, then every open connection; each close unregisters its
     * connection. Does nothing when the server is not running.
     */
    public synchronized void stop() {
        if (serverChannel == null) {
            return;
        }
        log.info("Stopping Netty WebSocket server...");
        serverChannel.close().awaitUninterruptibly(5, TimeUnit.SECONDS);
        serverChannel = null;
        shutdownGroups();
        log.info("Netty WebSocket server stopped.");
    }

    private void shutdownGroups() {
        try {
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Netty shutdown interrupted");
        } finally {
            bossGroup = null;
            workerGroup = null;
        }
    }
}
