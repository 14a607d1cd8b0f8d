package com.webchat.server.im.model;

import com.webchat.server.im.entity.MessageType;
import lombok.Value;

import java.util.Map;

@Value
public class PrivateMessageRequest {
    long receiverId;
    String content;
    MessageType type;
    Long fileId;
    Map<String, Object> data; // Original payload, echoed to recipients with the stored ids merged in
}
