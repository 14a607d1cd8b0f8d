package com.webchat.server.im.entity;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.webchat.server.im.exception.InvalidEnvelopeException;

import java.util.Map;

/**
 * JSON text form of {@link Envelope}.
 * <p>
 * Client frames carry {@code event} and {@code data} only. Relay frames published on the
 * pub/sub topics additionally carry {@code origin} and {@code timestamp}.
 */
public final class EnvelopeCodec {

    private EnvelopeCodec() {
    }

    public static Envelope decode(String text) throws InvalidEnvelopeException {
        if (text == null || text.trim().isEmpty()) {
            throw new InvalidEnvelopeException("empty frame");
        }

        JSONObject json;
        try {
            json = JSON.parseObject(text);
        } catch (JSONException | ClassCastException e) {
            throw new InvalidEnvelopeException("malformed envelope: " + e.getMessage(), e);
        }
        if (json == null) {
            throw new InvalidEnvelopeException("empty envelope");
        }

        Object data = json.get("data");
        if (data != null && !(data instanceof JSONObject)) {
            throw new InvalidEnvelopeException("data must be an object");
        }

        Envelope envelope = new Envelope();
        envelope.setEvent(json.getString("event"));
        envelope.setData((JSONObject) data);
        envelope.setOrigin(json.getString("origin"));
        return envelope;
    }

    public static String encode(Envelope envelope) {
        JSONObject json = new JSONObject(true);
        json.put("event", envelope.getEvent());
        json.put("data", envelope.getData());
        return json.toJSONString();
    }

    public static String encode(String event, Map<String, Object> data) {
        return encode(new Envelope(event, data));
    }

    public static String encodeRelay(Envelope envelope, String origin) {
        JSONObject json = new JSONObject(true);
        json.put("event", envelope.getEvent());
        json.put("data", envelope.getData());
        json.put("origin", origin);
        json.put("timestamp", System.currentTimeMillis() / 1000);
        return json.toJSONString();
    }
}
