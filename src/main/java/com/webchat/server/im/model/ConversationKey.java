package com.webchat.server.im.model;

import com.webchat.server.im.exception.InvalidEnvelopeException;
import lombok.Value;

/**
 * Conversation identifier of the form {@code private:<userId>} or {@code group:<groupId>}.
 * For a private conversation the target is the other participant.
 */
@Value
public class ConversationKey {

    public enum Scope {
        PRIVATE("private"),
        GROUP("group");

        private final String prefix;

        Scope(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    Scope scope;
    long targetId;

    public static ConversationKey parse(String value) throws InvalidEnvelopeException {
        if (value == null) {
            throw new InvalidEnvelopeException("conversation_id is required");
        }
        int sep = value.indexOf(':');
        if (sep <= 0 || sep == value.length() - 1) {
            throw new InvalidEnvelopeException("invalid conversation_id format: " + value);
        }

        String prefix = value.substring(0, sep);
        String id = value.substring(sep + 1);
        for (Scope scope : Scope.values()) {
            if (scope.prefix.equals(prefix)) {
                return new ConversationKey(scope, parseId(value, id));
            }
        }
        throw new InvalidEnvelopeException("invalid conversation_id format: " + value);
    }

    private static long parseId(String value, String id) throws InvalidEnvelopeException {
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                throw new InvalidEnvelopeException("invalid conversation id in " + value);
            }
        }
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new InvalidEnvelopeException("invalid conversation id in " + value, e);
        }
    }

    public boolean isGroup() {
        return scope == Scope.GROUP;
    }

    @Override
    public String toString() {
        return scope.prefix + ":" + targetId;
    }
}
