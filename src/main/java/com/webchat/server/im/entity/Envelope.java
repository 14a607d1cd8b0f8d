package com.webchat.server.im.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Envelope {

    private String event; // Event name, e.g. send_private_message, private_message, typing

    private Map<String, Object> data; // Open payload, keys depend on the event

    private String origin; // Instance id of the publisher, only set on relayed envelopes

    public Envelope(String event, Map<String, Object> data) {
        this(event, data, null);
    }

    public static Envelope of(String event, Map<String, Object> data) {
        return new Envelope(event, data == null ? new LinkedHashMap<>() : data);
    }
}
