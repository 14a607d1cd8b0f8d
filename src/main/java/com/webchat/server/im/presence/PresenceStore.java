package com.webchat.server.im.presence;

import com.webchat.server.im.entity.Envelope;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Shared presence, typing and relay state used by the router.
 * <p>
 * Presence records never expire: a user stays present until {@link #clearPresent} is
 * called. Typing markers expire on their own. Pub/sub delivery is at-most-once with no
 * replay: a topic without an active subscriber drops the message.
 * <p>
 * Implementations signal backend failures with runtime exceptions; callers treat
 * presence as advisory and log them.
 */
public interface PresenceStore {

    void setPresent(long userId);

    void clearPresent(long userId);

    boolean isPresent(long userId);

    Set<Long> getPresentUsers();

    void setTyping(long userId, String conversationKey);

    boolean isTyping(long userId, String conversationKey);

    Set<Long> getTypingUsers(String conversationKey);

    /**
     * Publish an envelope on a topic. The envelope's origin is written with it.
     */
    void publish(String topic, Envelope envelope);

    /**
     * Subscribe to a topic until the returned handle is stopped.
     */
    Subscription subscribe(String topic, Consumer<Envelope> listener);

    interface Subscription {

        /**
         * Stop receiving messages. Safe to call more than once.
         */
        void stop();
    }
}
