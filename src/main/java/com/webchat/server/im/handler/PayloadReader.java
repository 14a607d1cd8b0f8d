package com.webchat.server.im.handler;

import com.webchat.server.im.exception.InvalidEnvelopeException;

import java.util.Map;

/**
 * Typed access to envelope payload keys.
 */
public final class PayloadReader {

    private PayloadReader() {
    }

    public static long requireLong(Map<String, Object> data, String key) throws InvalidEnvelopeException {
        Object value = data.get(key);
        if (!(value instanceof Number)) {
            throw new InvalidEnvelopeException(key + " must be numeric");
        }
        return ((Number) value).longValue();
    }

    public static String requireString(Map<String, Object> data, String key) throws InvalidEnvelopeException {
        Object value = data.get(key);
        if (!(value instanceof String)) {
            throw new InvalidEnvelopeException(key + " must be a string");
        }
        return (String) value;
    }

    public static String optionalString(Map<String, Object> data, String key) throws InvalidEnvelopeException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new InvalidEnvelopeException(key + " must be a string");
        }
        return (String) value;
    }

    /**
     * Attachment references are optional; zero or negative ids mean "none".
     */
    public static Long optionalPositiveLong(Map<String, Object> data, String key) throws InvalidEnvelopeException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new InvalidEnvelopeException(key + " must be numeric");
        }
        long id = ((Number) value).longValue();
        return id > 0 ? id : null;
    }

    public static boolean optionalBoolean(Map<String, Object> data, String key, boolean fallback)
            throws InvalidEnvelopeException {
        Object value = data.get(key);
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Boolean)) {
            throw new InvalidEnvelopeException(key + " must be a boolean");
        }
        return (Boolean) value;
    }
}
