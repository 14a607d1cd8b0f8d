package com.webchat.server.im.presence;

/**
 * Key and topic names shared by every instance.
 */
public final class PresenceKeys {

    // user:online:{userId} -> "1", no expiry
    public static final String ONLINE_PREFIX = "user:online:";
    // typing:{conversationKey}:{userId} -> "1", expires after the typing TTL
    public static final String TYPING_PREFIX = "typing:";
    // Per-user relay topic: ws:user:{userId}
    public static final String USER_TOPIC_PREFIX = "ws:user:";
    // Presence change notifications for every instance
    public static final String PRESENCE_TOPIC = "ws:presence";

    private PresenceKeys() {
    }

    public static String onlineKey(long userId) {
        return ONLINE_PREFIX + userId;
    }

    public static String typingKey(String conversationKey, long userId) {
        return TYPING_PREFIX + conversationKey + ":" + userId;
    }

    public static String typingPattern(String conversationKey) {
        return TYPING_PREFIX + conversationKey + ":*";
    }

    public static String userTopic(long userId) {
        return USER_TOPIC_PREFIX + userId;
    }

    /**
     * Trailing numeric id of a key, or null when the suffix is not a number.
     */
    public static Long trailingId(String key) {
        int sep = key.lastIndexOf(':');
        if (sep < 0 || sep == key.length() - 1) {
            return null;
        }
        try {
            return Long.parseLong(key.substring(sep + 1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
