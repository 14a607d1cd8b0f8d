package com.webchat.server.im.presence;

import com.webchat.server.im.entity.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Presence store for a single instance. Pub/sub is delivered synchronously on the
 * publishing thread to the subscribers registered at that moment.
 * <p>
 * Expired typing markers are dropped when read and by a periodic sweep; a topic
 * disappears with its last subscriber.
 */
public class InMemoryPresenceStore implements PresenceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPresenceStore.class);

    private final Set<Long> present = ConcurrentHashMap.newKeySet();
    // typing key -> expiry
    private final Map<String, Instant> typing = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<Envelope>>> topics = new ConcurrentHashMap<>();

    private final Duration typingTtl;
    private final Clock clock;

    public InMemoryPresenceStore(Duration typingTtl) {
        this(typingTtl, Clock.systemUTC());
    }

    public InMemoryPresenceStore(Duration typingTtl, Clock clock) {
        this.typingTtl = typingTtl;
        this.clock = clock;
    }

    @Override
    public void setPresent(long userId) {
        present.add(userId);
    }

    @Override
    public void clearPresent(long userId) {
        present.remove(userId);
    }

    @Override
    public boolean isPresent(long userId) {
        return present.contains(userId);
    }

    @Override
    public Set<Long> getPresentUsers() {
        return new HashSet<>(present);
    }

    @Override
    public void setTyping(long userId, String conversationKey) {
        typing.put(PresenceKeys.typingKey(conversationKey, userId), clock.instant().plus(typingTtl));
    }

    @Override
    public boolean isTyping(long userId, String conversationKey) {
        String key = PresenceKeys.typingKey(conversationKey, userId);
        Instant expiry = typing.get(key);
        if (expiry == null) {
            return false;
        }
        if (!clock.instant().isBefore(expiry)) {
            typing.remove(key, expiry);
            return false;
        }
        return true;
    }

    @Override
    public Set<Long> getTypingUsers(String conversationKey) {
        String prefix = PresenceKeys.TYPING_PREFIX + conversationKey + ":";
        Set<Long> users = new HashSet<>();
        for (String key : typing.keySet()) {
            if (key.startsWith(prefix)) {
                Long userId = PresenceKeys.trailingId(key);
                if (userId != null && isTyping(userId, conversationKey)) {
                    users.add(userId);
                }
            }
        }
        return users;
    }

    @Scheduled(fixedRateString = "${chat.presence.purge-interval-ms:30000}")
    public void purgeExpiredTyping() {
        Instant now = clock.instant();
        int purged = 0;
        Iterator<Map.Entry<String, Instant>> it = typing.entrySet().iterator();
        while (it.hasNext()) {
            if (!now.isBefore(it.next().getValue())) {
                it.remove();
                purged++;
            }
        }
        if (purged > 0) {
            log.debug("Purged {} expired typing markers", purged);
        }
    }

    int typingMarkerCount() {
        return typing.size();
    }

    int topicCount() {
        return topics.size();
    }

    @Override
    public void publish(String topic, Envelope envelope) {
        List<Consumer<Envelope>> listeners = topics.get(topic);
        if (listeners == null) {
            return;
        }
        for (Consumer<Envelope> listener : listeners) {
            try {
                listener.accept(envelope);
            } catch (RuntimeException e) {
                log.error("Relay listener failed on {}", topic, e);
            }
        }
    }

    @Override
    public Subscription subscribe(String topic, Consumer<Envelope> listener) {
        topics.compute(topic, (k, listeners) -> {
            List<Consumer<Envelope>> updated = listeners == null ? new CopyOnWriteArrayList<>() : listeners;
            updated.add(listener);
            return updated;
        });
        return () -> topics.computeIfPresent(topic, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }
}
