package com.webchat.server.im.model;

import lombok.Value;

@Value
public class TypingSignal {
    ConversationKey conversation;
    boolean typing;
}
