package com.webchat.server.im.presence;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import com.webchat.server.im.cluster.InstanceIdentity;
import com.webchat.server.im.entity.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisPresenceStoreTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private SetOperations<String, String> setOps;
    private RedisMessageListenerContainer container;
    private RedisPresenceStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        setOps = mock(SetOperations.class);
        container = mock(RedisMessageListenerContainer.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForSet()).thenReturn(setOps);
        store = new RedisPresenceStore(redisTemplate, container, new InstanceIdentity("instance-a"), Duration.ofSeconds(10));
    }

    @Test
    void presenceIsRecordedGloballyAndPerInstance() {
        store.setPresent(5);
        verify(valueOps).set("user:online:5", "1");
        verify(setOps).add("instance_sessions:instance-a", "5");

        store.clearPresent(5);
        verify(redisTemplate).delete("user:online:5");
        verify(setOps).remove("instance_sessions:instance-a", "5");
    }

    @Test
    void typingKeysCarryTheTtl() {
        store.setTyping(5, "group:7");

        verify(valueOps).set("typing:group:7:5", "1", Duration.ofSeconds(10));
    }

    @Test
    void typingUsersComeFromKeySuffixes() {
        when(redisTemplate.keys("typing:group:7:*")).thenReturn(Set.of("typing:group:7:5", "typing:group:7:6", "typing:group:7:x"));

        assertThat(store.getTypingUsers("group:7")).containsExactlyInAnyOrder(5L, 6L);
    }

    @Test
    void publishWritesTheOrigin() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("content", "hi");

        store.publish("ws:user:2", new Envelope("private_message", data, "instance-a"));

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq("ws:user:2"), body.capture());
        JSONObject json = JSON.parseObject(body.getValue());
        assertThat(json.getString("event")).isEqualTo("private_message");
        assertThat(json.getString("origin")).isEqualTo("instance-a");
        assertThat(json.getJSONObject("data").getString("content")).isEqualTo("hi");
    }

    @Test
    void subscriptionDecodesMessagesUntilStopped() {
        List<Envelope> received = new ArrayList<>();
        PresenceStore.Subscription subscription = store.subscribe("ws:user:2", received::add);

        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(container).addMessageListener(listener.capture(), any(ChannelTopic.class));

        listener.getValue().onMessage(message("ws:user:2",
                "{\"event\":\"private_message\",\"data\":{\"content\":\"hi\"},\"origin\":\"instance-b\"}"), null);
        listener.getValue().onMessage(message("ws:user:2", "garbage"), null);

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getOrigin()).isEqualTo("instance-b");

        subscription.stop();
        subscription.stop();
        verify(container, times(1)).removeMessageListener(eq(listener.getValue()), any(ChannelTopic.class));
    }

    private static DefaultMessage message(String channel, String body) {
        return new DefaultMessage(channel.getBytes(StandardCharsets.UTF_8), body.getBytes(StandardCharsets.UTF_8));
    }
}
