package com.webchat.server.im.presence;

import com.webchat.server.im.cluster.ClusterKeys;
import com.webchat.server.im.cluster.InstanceIdentity;
import com.webchat.server.im.entity.Envelope;
import com.webchat.server.im.entity.EnvelopeCodec;
import com.webchat.server.im.exception.InvalidEnvelopeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Presence store shared by all instances through Redis.
 * <p>
 * Besides the online key, {@link #setPresent} records the user in this instance's session
 * set so that the cluster sweep can clear presence left behind by a crashed instance.
 */
public class RedisPresenceStore implements PresenceStore {

    private static final Logger log = LoggerFactory.getLogger(RedisPresenceStore.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final InstanceIdentity instanceIdentity;
    private final Duration typingTtl;

    public RedisPresenceStore(StringRedisTemplate redisTemplate,
                              RedisMessageListenerContainer listenerContainer,
                              InstanceIdentity instanceIdentity,
                              Duration typingTtl) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.instanceIdentity = instanceIdentity;
        this.typingTtl = typingTtl;
    }

    @Override
    public void setPresent(long userId) {
        redisTemplate.opsForValue().set(PresenceKeys.onlineKey(userId), "1");
        redisTemplate.opsForSet().add(ClusterKeys.instanceSessions(instanceIdentity.getInstanceId()), String.valueOf(userId));
    }

    @Override
    public void clearPresent(long userId) {
        redisTemplate.delete(PresenceKeys.onlineKey(userId));
        redisTemplate.opsForSet().remove(ClusterKeys.instanceSessions(instanceIdentity.getInstanceId()), String.valueOf(userId));
    }

    @Override
    public boolean isPresent(long userId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(PresenceKeys.onlineKey(userId)));
    }

    @Override
    public Set<Long> getPresentUsers() {
        return idsOf(redisTemplate.keys(PresenceKeys.ONLINE_PREFIX + "*"));
    }

    @Override
    public void setTyping(long userId, String conversationKey) {
        redisTemplate.opsForValue().set(PresenceKeys.typingKey(conversationKey, userId), "1", typingTtl);
    }

    @Override
    public boolean isTyping(long userId, String conversationKey) {
        // Expired keys are gone, so existence is the whole answer
        return Boolean.TRUE.equals(redisTemplate.hasKey(PresenceKeys.typingKey(conversationKey, userId)));
    }

    @Override
    public Set<Long> getTypingUsers(String conversationKey) {
        return idsOf(redisTemplate.keys(PresenceKeys.typingPattern(conversationKey)));
    }

    @Override
    public void publish(String topic, Envelope envelope) {
        redisTemplate.convertAndSend(topic, EnvelopeCodec.encodeRelay(envelope, envelope.getOrigin()));
    }

    @Override
    public Subscription subscribe(String topic, Consumer<Envelope> listener) {
        ChannelTopic channelTopic = new ChannelTopic(topic);
        MessageListener messageListener = (message, pattern) -> {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            try {
                listener.accept(EnvelopeCodec.decode(body));
            } catch (InvalidEnvelopeException e) {
                log.warn("Dropping undecodable relay message on {}: {}", topic, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Relay listener failed on {}", topic, e);
            }
        };
        listenerContainer.addMessageListener(messageListener, channelTopic);
        log.debug("Subscribed to {}", topic);

        AtomicBoolean stopped = new AtomicBoolean();
        return () -> {
            if (stopped.compareAndSet(false, true)) {
                listenerContainer.removeMessageListener(messageListener, channelTopic);
                log.debug("Unsubscribed from {}", topic);
            }
        };
    }

    private static Set<Long> idsOf(Set<String> keys) {
        Set<Long> ids = new HashSet<>();
        if (keys == null) {
            return ids;
        }
        for (String key : keys) {
            Long id = PresenceKeys.trailingId(key);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }
}
