package com.webchat.server.im.handler.impl;

import com.webchat.server.im.entity.ChatMessage;
import com.webchat.server.im.entity.MessageType;
import com.webchat.server.im.exception.InvalidEnvelopeException;
import com.webchat.server.im.exception.MessagePersistenceException;
import com.webchat.server.im.handler.EventHandler;
import com.webchat.server.im.handler.Events;
import com.webchat.server.im.handler.PayloadReader;
import com.webchat.server.im.model.GroupMessageRequest;
import com.webchat.server.im.model.UserIdentity;
import com.webchat.server.im.service.MessageSender;
import com.webchat.server.im.store.GroupDirectory;
import com.webchat.server.im.store.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists a group message and fans it out to every member, the sender included.
 */
@Component
public class GroupMessageHandler implements EventHandler<GroupMessageRequest> {

    private static final Logger log = LoggerFactory.getLogger(GroupMessageHandler.class);

    private final MessageStore messageStore;
    private final GroupDirectory groupDirectory;
    private final MessageSender messageSender;

    @Autowired
    public GroupMessageHandler(MessageStore messageStore, GroupDirectory groupDirectory, MessageSender messageSender) {
        this.messageStore = messageStore;
        this.groupDirectory = groupDirectory;
        this.messageSender = messageSender;
    }

    @Override
    public String getEvent() {
        return Events.SEND_GROUP_MESSAGE;
    }

    @Override
    public GroupMessageRequest parse(Map<String, Object> data) throws InvalidEnvelopeException {
        return new GroupMessageRequest(
                PayloadReader.requireLong(data, "group_id"),
                PayloadReader.requireString(data, "content"),
                MessageType.fromWire(PayloadReader.optionalString(data, "type")),
                PayloadReader.optionalPositiveLong(data, "file_id"),
                data);
    }

    @Override
    public void handle(UserIdentity sender, GroupMessageRequest request) {
        long groupId = request.getGroupId();

        ChatMessage message;
        try {
            message = messageStore.saveGroupMessage(sender.getUserId(), groupId,
                    request.getContent(), request.getType(), request.getFileId());
        } catch (MessagePersistenceException e) {
            log.error("Failed to save group message from {} to group {}", sender.getUserId(), groupId, e);
            return;
        }

        Map<String, Object> data = new LinkedHashMap<>(request.getData());
        data.put("message_id", message.getId());
        data.put("created_at", message.getCreatedAt().toString());
        data.put("updated_at", message.getUpdatedAt().toString());

        List<Long> members;
        try {
            members = groupDirectory.getGroupMembers(groupId);
        } catch (RuntimeException e) {
            log.error("Message {} stored but members of group {} could not be loaded", message.getId(), groupId, e);
            return;
        }

        log.info("Sending group message {} to {} members in group {}", message.getId(), members.size(), groupId);
        for (Long memberId : members) {
            messageSender.deliver(memberId, Events.GROUP_MESSAGE, data);
        }
    }
}
