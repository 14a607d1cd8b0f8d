package com.webchat.server.im.config;

import com.webchat.server.im.connection.ConnectionSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ChatServerConfig {

    @Bean
    public ConnectionSettings connectionSettings(
            @Value("${chat.connection.send-buffer-size:256}") int sendBufferSize,
            @Value("${chat.connection.write-wait:10s}") Duration writeWait,
            @Value("${chat.connection.pong-wait:60s}") Duration pongWait,
            @Value("${chat.connection.ping-period:54s}") Duration pingPeriod,
            @Value("${chat.connection.max-message-size:524288}") int maxMessageSize,
            @Value("${chat.connection.relay-offer-timeout:1s}") Duration relayOfferTimeout) {
        if (pingPeriod.compareTo(pongWait) >= 0) {
            throw new IllegalStateException("chat.connection.ping-period must be shorter than chat.connection.pong-wait");
        }
        return ConnectionSettings.builder()
                .sendBufferSize(sendBufferSize)
                .writeWait(writeWait)
                .pongWait(pongWait)
                .pingPeriod(pingPeriod)
                .maxMessageSize(maxMessageSize)
                .relayOfferTimeout(relayOfferTimeout)
                .build();
    }

    /**
     * Runs one writer task per live connection.
     */
    @Bean(name = "connectionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService connectionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ws-writer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
