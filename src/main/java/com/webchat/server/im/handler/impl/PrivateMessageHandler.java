package com.webchat.server.im.handler.impl;

import com.webchat.server.im.entity.ChatMessage;
import com.webchat.server.im.entity.MessageType;
import com.webchat.server.im.exception.InvalidEnvelopeException;
import com.webchat.server.im.exception.MessagePersistenceException;
import com.webchat.server.im.handler.EventHandler;
import com.webchat.server.im.handler.Events;
import com.webchat.server.im.handler.PayloadReader;
import com.webchat.server.im.model.PrivateMessageRequest;
import com.webchat.server.im.model.UserIdentity;
import com.webchat.server.im.service.MessageSender;
import com.webchat.server.im.store.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class PrivateMessageHandler implements EventHandler<PrivateMessageRequest> {

    private static final Logger log = LoggerFactory.getLogger(PrivateMessageHandler.class);

    private final MessageStore messageStore;
    private final MessageSender messageSender;

    @Autowired
    public PrivateMessageHandler(MessageStore messageStore, MessageSender messageSender) {
        this.messageStore = messageStore;
        this.messageSender = messageSender;
    }

    @Override
    public String getEvent() {
        return Events.SEND_PRIVATE_MESSAGE;
    }

    @Override
    public PrivateMessageRequest parse(Map<String, Object> data) throws InvalidEnvelopeException {
        return new PrivateMessageRequest(
                PayloadReader.requireLong(data, "receiver_id"),
                PayloadReader.requireString(data, "content"),
                MessageType.fromWire(PayloadReader.optionalString(data, "type")),
                PayloadReader.optionalPositiveLong(data, "file_id"),
                data);
    }

    @Override
    public void handle(UserIdentity sender, PrivateMessageRequest request) {
        long receiverId = request.getReceiverId();

        // 1. Persist first; nothing is delivered if this fails
        ChatMessage message;
        try {
            message = messageStore.savePrivateMessage(sender.getUserId(), receiverId,
                    request.getContent(), request.getType(), request.getFileId());
        } catch (MessagePersistenceException e) {
            log.error("Failed to save private message from {} to {}", sender.getUserId(), receiverId, e);
            return;
        }

        // 2. Echo the stored id and timestamps to everyone
        Map<String, Object> data = new LinkedHashMap<>(request.getData());
        data.put("message_id", message.getId());
        data.put("created_at", message.getCreatedAt().toString());
        data.put("updated_at", message.getUpdatedAt().toString());

        // 3. Receiver, here and on other instances
        messageSender.deliver(receiverId, Events.PRIVATE_MESSAGE, data);

        // 4. Confirmation back to the sender's own connection
        messageSender.sendToUser(sender.getUserId(), Events.MESSAGE_SENT, data);

        log.info("Private message {} from {} to {} delivered", message.getId(), sender.getUserId(), receiverId);
    }
}
