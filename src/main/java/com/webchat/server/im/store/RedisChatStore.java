package com.webchat.server.im.store;

import com.alibaba.fastjson.JSON;
import com.webchat.server.im.entity.ChatMessage;
import com.webchat.server.im.entity.MessageType;
import com.webchat.server.im.exception.MessagePersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Minimal Redis-backed message store and group directory.
 * <p>
 * Messages are stored as JSON under {@code message:{private|group}:{id}} with ids taken
 * from per-kind sequences, and indexed per conversation. Group membership lives in the
 * hash {@code group:info:{groupId}} whose fields are member user ids.
 */
@Component
public class RedisChatStore implements MessageStore, GroupDirectory {

    private static final Logger log = LoggerFactory.getLogger(RedisChatStore.class);

    static final String PRIVATE_SEQ = "message:private:seq";
    static final String GROUP_SEQ = "message:group:seq";
    static final String PRIVATE_PREFIX = "message:private:";
    static final String GROUP_PREFIX = "message:group:";
    static final String GROUP_INFO_PREFIX = "group:info:";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public RedisChatStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, Clock.systemUTC());
    }

    RedisChatStore(StringRedisTemplate redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public ChatMessage savePrivateMessage(long senderId, long receiverId, String content, MessageType type, Long fileId)
            throws MessagePersistenceException {
        try {
            ChatMessage message = newMessage(senderId, content, type, fileId);
            message.setReceiverId(receiverId);
            message.setId(nextId(PRIVATE_SEQ));

            redisTemplate.opsForValue().set(PRIVATE_PREFIX + message.getId(), JSON.toJSONString(message.toRecord()));
            redisTemplate.opsForList().rightPush(privateConversationKey(senderId, receiverId), String.valueOf(message.getId()));
            log.debug("Stored private message {} from {} to {}", message.getId(), senderId, receiverId);
            return message;
        } catch (DataAccessException e) {
            throw new MessagePersistenceException("failed to store private message", e);
        }
    }

    @Override
    public ChatMessage saveGroupMessage(long senderId, long groupId, String content, MessageType type, Long fileId)
            throws MessagePersistenceException {
        try {
            // Verify user is a member of the group
            Boolean member = redisTemplate.opsForHash().hasKey(GROUP_INFO_PREFIX + groupId, String.valueOf(senderId));
            if (!Boolean.TRUE.equals(member)) {
                throw new MessagePersistenceException("user " + senderId + " is not a member of group " + groupId);
            }

            ChatMessage message = newMessage(senderId, content, type, fileId);
            message.setGroupId(groupId);
            message.setId(nextId(GROUP_SEQ));

            redisTemplate.opsForValue().set(GROUP_PREFIX + message.getId(), JSON.toJSONString(message.toRecord()));
            redisTemplate.opsForList().rightPush("conversation:group:" + groupId, String.valueOf(message.getId()));
            log.debug("Stored group message {} from {} in group {}", message.getId(), senderId, groupId);
            return message;
        } catch (DataAccessException e) {
            throw new MessagePersistenceException("failed to store group message", e);
        }
    }

    @Override
    public List<Long> getGroupMembers(long groupId) {
        Set<Object> memberIds = redisTemplate.opsForHash().keys(GROUP_INFO_PREFIX + groupId);
        List<Long> members = new ArrayList<>();
        if (memberIds == null) {
            return members;
        }
        for (Object memberId : memberIds) {
            try {
                members.add(Long.parseLong(memberId.toString()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid member id {} in group {}", memberId, groupId);
            }
        }
        return members;
    }

    private ChatMessage newMessage(long senderId, String content, MessageType type, Long fileId) {
        Instant now = clock.instant();
        ChatMessage message = new ChatMessage();
        message.setSenderId(senderId);
        message.setContent(content);
        message.setType(type == null ? MessageType.TEXT : type);
        message.setFileId(fileId);
        message.setRead(false);
        message.setCreatedAt(now);
        message.setUpdatedAt(now);
        return message;
    }

    private long nextId(String sequenceKey) throws MessagePersistenceException {
        Long id = redisTemplate.opsForValue().increment(sequenceKey);
        if (id == null) {
            throw new MessagePersistenceException("sequence " + sequenceKey + " returned no value");
        }
        return id;
    }

    static String privateConversationKey(long a, long b) {
        return "conversation:private:" + Math.min(a, b) + ":" + Math.max(a, b);
    }
}
