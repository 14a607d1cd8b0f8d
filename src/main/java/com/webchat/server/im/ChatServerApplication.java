package com.webchat.server.im;

import com.webchat.server.im.netty.NettyWebSocketServer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ChatServerApplication implements ApplicationListener<ContextClosedEvent> {

    @Autowired
    private NettyWebSocketServer nettyWebSocketServer;

    public static void main(String[] args) {
        SpringApplication.run(ChatServerApplication.class, args);
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        // ContextClosedEvent is published before beans are destroyed, so the router and
        // Redis are still up while closing channels unregisters their connections.
        if (nettyWebSocketServer != null) {
            nettyWebSocketServer.stop();
        }
    }
}
