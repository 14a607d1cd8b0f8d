package com.webchat.server.im.config;

import com.webchat.server.im.connection.ConnectionSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatServerConfigTest {

    private final ChatServerConfig config = new ChatServerConfig();

    @Test
    void buildsSettingsFromProperties() {
        ConnectionSettings settings = config.connectionSettings(16, Duration.ofSeconds(5), Duration.ofSeconds(30),
                Duration.ofSeconds(27), 1024, Duration.ofMillis(500));

        assertThat(settings.getSendBufferSize()).isEqualTo(16);
        assertThat(settings.getPingPeriod()).isEqualTo(Duration.ofSeconds(27));
        assertThat(settings.getMaxMessageSize()).isEqualTo(1024);
    }

    @Test
    void pingPeriodMustBeShorterThanPongWait() {
        assertThatThrownBy(() -> config.connectionSettings(16, Duration.ofSeconds(5), Duration.ofSeconds(30),
                Duration.ofSeconds(30), 1024, Duration.ofMillis(500)))
                .isInstanceOf(IllegalStateException.class);
    }
}
