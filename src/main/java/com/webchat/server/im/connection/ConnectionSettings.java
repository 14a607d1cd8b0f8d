package com.webchat.server.im.connection;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class ConnectionSettings {

    // Outbound queue capacity
    @Builder.Default
    int sendBufferSize = 256;

    // Time allowed to write a frame to the peer
    @Builder.Default
    Duration writeWait = Duration.ofSeconds(10);

    // Time allowed to read the next frame (or pong) from the peer
    @Builder.Default
    Duration pongWait = Duration.ofSeconds(60);

    // Ping period, must be less than pongWait
    @Builder.Default
    Duration pingPeriod = Duration.ofSeconds(54);

    // Maximum inbound frame size
    @Builder.Default
    int maxMessageSize = 512 * 1024;

    // How long a relayed message may wait for room in a full outbound queue
    @Builder.Default
    Duration relayOfferTimeout = Duration.ofSeconds(1);

    public static ConnectionSettings defaults() {
        return ConnectionSettings.builder().build();
    }
}
