package com.webchat.server.im.entity;

import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A persisted chat message as returned by the message store. Exactly one of
 * {@code receiverId} and {@code groupId} is set.
 */
@Data
public class ChatMessage {

    private long id;
    private long senderId;
    private Long receiverId;
    private Long groupId;
    private String content;
    private MessageType type = MessageType.TEXT;
    private Long fileId;
    private boolean read;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean isGroupMessage() {
        return groupId != null;
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", id);
        record.put("sender_id", senderId);
        if (groupId != null) {
            record.put("group_id", groupId);
        } else {
            record.put("receiver_id", receiverId);
        }
        record.put("content", content);
        record.put("type", type.getWireName());
        if (fileId != null) {
            record.put("file_id", fileId);
        }
        record.put("is_read", read);
        record.put("created_at", createdAt.toString());
        record.put("updated_at", updatedAt.toString());
        return record;
    }
}
