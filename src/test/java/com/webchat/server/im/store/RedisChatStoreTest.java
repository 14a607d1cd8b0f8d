package com.webchat.server.im.store;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import com.webchat.server.im.entity.ChatMessage;
import com.webchat.server.im.entity.MessageType;
import com.webchat.server.im.exception.MessagePersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisChatStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private ListOperations<String, String> listOps;
    private HashOperations<String, Object, Object> hashOps;
    private RedisChatStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        listOps = mock(ListOperations.class);
        hashOps = mock(HashOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOps);
        store = new RedisChatStore(redisTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void privateMessageGetsSequenceIdAndConversationIndex() throws Exception {
        when(valueOps.increment("message:private:seq")).thenReturn(5L);

        ChatMessage message = store.savePrivateMessage(2, 1, "hi", MessageType.FILE, 9L);

        assertThat(message.getId()).isEqualTo(5L);
        assertThat(message.getReceiverId()).isEqualTo(1L);
        assertThat(message.getCreatedAt()).isEqualTo(NOW);
        assertThat(message.getUpdatedAt()).isEqualTo(NOW);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("message:private:5"), json.capture());
        JSONObject record = JSON.parseObject(json.getValue());
        assertThat(record.getLong("sender_id")).isEqualTo(2L);
        assertThat(record.getLong("receiver_id")).isEqualTo(1L);
        assertThat(record.getString("type")).isEqualTo("file");
        assertThat(record.getLong("file_id")).isEqualTo(9L);
        assertThat(record.getBoolean("is_read")).isFalse();
        verify(listOps).rightPush("conversation:private:1:2", "5");
    }

    @Test
    void groupMessageRequiresMembership() {
        when(hashOps.hasKey("group:info:7", "3")).thenReturn(false);

        assertThatThrownBy(() -> store.saveGroupMessage(3, 7, "hi", MessageType.TEXT, null))
                .isInstanceOf(MessagePersistenceException.class)
                .hasMessageContaining("not a member");
        verify(valueOps, never()).increment(anyString());
    }

    @Test
    void groupMessageIsStoredForMembers() throws Exception {
        when(hashOps.hasKey("group:info:7", "3")).thenReturn(true);
        when(valueOps.increment("message:group:seq")).thenReturn(11L);

        ChatMessage message = store.saveGroupMessage(3, 7, "hi", null, null);

        assertThat(message.getId()).isEqualTo(11L);
        assertThat(message.isGroupMessage()).isTrue();
        assertThat(message.getType()).isEqualTo(MessageType.TEXT);
        verify(listOps).rightPush("conversation:group:7", "11");
    }

    @Test
    void redisFailuresBecomePersistenceErrors() {
        when(valueOps.increment("message:private:seq")).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> store.savePrivateMessage(1, 2, "hi", MessageType.TEXT, null))
                .isInstanceOf(MessagePersistenceException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    void groupMembersAreReadFromTheGroupHash() {
        when(hashOps.keys("group:info:7")).thenReturn(Set.of("1", "2", "admin"));

        assertThat(store.getGroupMembers(7)).containsExactlyInAnyOrder(1L, 2L);
    }
}
