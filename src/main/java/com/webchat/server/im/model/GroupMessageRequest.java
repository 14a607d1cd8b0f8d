package com.webchat.server.im.model;

import com.webchat.server.im.entity.MessageType;
import lombok.Value;

import java.util.Map;

@Value
public class GroupMessageRequest {
    long groupId;
    String content;
    MessageType type;
    Long fileId;
    Map<String, Object> data;
}
