package com.webchat.server.im.store;

import com.webchat.server.im.entity.ChatMessage;
import com.webchat.server.im.entity.MessageType;
import com.webchat.server.im.exception.MessagePersistenceException;

/**
 * Durable store for chat messages. The returned id and timestamps are authoritative and
 * are echoed to every recipient.
 */
public interface MessageStore {

    ChatMessage savePrivateMessage(long senderId, long receiverId, String content, MessageType type, Long fileId)
            throws MessagePersistenceException;

    /**
     * @throws MessagePersistenceException also when the sender is not a member of the group
     */
    ChatMessage saveGroupMessage(long senderId, long groupId, String content, MessageType type, Long fileId)
            throws MessagePersistenceException;
}
