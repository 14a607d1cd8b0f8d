package com.webchat.server.im.entity;

import com.webchat.server.im.exception.InvalidEnvelopeException;

public enum MessageType {
    TEXT("text"),
    FILE("file");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Missing or empty type means plain text.
     */
    public static MessageType fromWire(String value) throws InvalidEnvelopeException {
        if (value == null || value.isEmpty()) {
            return TEXT;
        }
        for (MessageType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new InvalidEnvelopeException("unknown message type: " + value);
    }
}
