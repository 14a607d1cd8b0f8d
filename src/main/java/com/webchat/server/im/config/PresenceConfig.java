package com.webchat.server.im.config;

import com.webchat.server.im.cluster.InstanceIdentity;
import com.webchat.server.im.presence.InMemoryPresenceStore;
import com.webchat.server.im.presence.PresenceStore;
import com.webchat.server.im.presence.RedisPresenceStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.time.Duration;

/**
 * {@code chat.presence.store=redis} (default) shares presence and relays across instances;
 * {@code memory} keeps everything inside this process.
 */
@Configuration
public class PresenceConfig {

    @Bean
    @ConditionalOnProperty(name = "chat.presence.store", havingValue = "redis", matchIfMissing = true)
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }

    @Bean
    @ConditionalOnProperty(name = "chat.presence.store", havingValue = "redis", matchIfMissing = true)
    public PresenceStore redisPresenceStore(StringRedisTemplate redisTemplate,
                                            RedisMessageListenerContainer listenerContainer,
                                            InstanceIdentity instanceIdentity,
                                            @Value("${chat.presence.typing-ttl:10s}") Duration typingTtl) {
        return new RedisPresenceStore(redisTemplate, listenerContainer, instanceIdentity, typingTtl);
    }

    @Bean
    @ConditionalOnProperty(name = "chat.presence.store", havingValue = "memory")
    public PresenceStore inMemoryPresenceStore(@Value("${chat.presence.typing-ttl:10s}") Duration typingTtl) {
        return new InMemoryPresenceStore(typingTtl);
    }
}
