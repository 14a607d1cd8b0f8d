package com.webchat.server.im.handler.impl;

import com.webchat.server.im.exception.InvalidEnvelopeException;
import com.webchat.server.im.handler.EventHandler;
import com.webchat.server.im.handler.Events;
import com.webchat.server.im.handler.PayloadReader;
import com.webchat.server.im.model.ConversationKey;
import com.webchat.server.im.model.TypingSignal;
import com.webchat.server.im.model.UserIdentity;
import com.webchat.server.im.presence.PresenceStore;
import com.webchat.server.im.service.MessageSender;
import com.webchat.server.im.store.GroupDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class TypingHandler implements EventHandler<TypingSignal> {

    private static final Logger log = LoggerFactory.getLogger(TypingHandler.class);

    private final PresenceStore presenceStore;
    private final GroupDirectory groupDirectory;
    private final MessageSender messageSender;

    @Autowired
    public TypingHandler(PresenceStore presenceStore, GroupDirectory groupDirectory, MessageSender messageSender) {
        this.presenceStore = presenceStore;
        this.groupDirectory = groupDirectory;
        this.messageSender = messageSender;
    }

    @Override
    public String getEvent() {
        return Events.USER_TYPING;
    }

    @Override
    public TypingSignal parse(Map<String, Object> data) throws InvalidEnvelopeException {
        ConversationKey conversation = ConversationKey.parse(PayloadReader.requireString(data, "conversation_id"));
        return new TypingSignal(conversation, PayloadReader.optionalBoolean(data, "is_typing", true));
    }

    @Override
    public void handle(UserIdentity sender, TypingSignal signal) {
        ConversationKey conversation = signal.getConversation();

        try {
            presenceStore.setTyping(sender.getUserId(), conversation.toString());
        } catch (RuntimeException e) {
            log.error("Failed to record typing state of user {} in {}", sender.getUserId(), conversation, e);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", sender.getUserId());
        data.put("username", sender.getUsername());
        data.put("is_typing", signal.isTyping());
        data.put("chat_type", conversation.getScope().getPrefix());
        // The recipient of a private typing signal sees the chat under the sender's id
        data.put("chat_id", conversation.isGroup() ? conversation.getTargetId() : sender.getUserId());

        if (!conversation.isGroup()) {
            messageSender.deliver(conversation.getTargetId(), Events.TYPING, data);
            return;
        }

        List<Long> members;
        try {
            members = groupDirectory.getGroupMembers(conversation.getTargetId());
        } catch (RuntimeException e) {
            log.error("Failed to get members of group {}", conversation.getTargetId(), e);
            return;
        }
        for (Long memberId : members) {
            if (memberId != sender.getUserId()) {
                messageSender.deliver(memberId, Events.TYPING, data);
            }
        }
    }
}
