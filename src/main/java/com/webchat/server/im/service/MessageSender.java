package com.webchat.server.im.service;

import com.webchat.server.im.cluster.InstanceIdentity;
import com.webchat.server.im.connection.Connection;
import com.webchat.server.im.entity.Envelope;
import com.webchat.server.im.entity.EnvelopeCodec;
import com.webchat.server.im.handler.Events;
import com.webchat.server.im.presence.PresenceKeys;
import com.webchat.server.im.presence.PresenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound delivery: directly to a local connection, and through the presence store's
 * pub/sub to connections held by other instances.
 */
@Service
public class MessageSender {

    private static final Logger log = LoggerFactory.getLogger(MessageSender.class);

    private final ConnectionRegistry registry;
    private final PresenceStore presenceStore;
    private final InstanceIdentity instanceIdentity;

    public MessageSender(ConnectionRegistry registry, PresenceStore presenceStore, InstanceIdentity instanceIdentity) {
        this.registry = registry;
        this.presenceStore = presenceStore;
        this.instanceIdentity = instanceIdentity;
    }

    /**
     * Best-effort local delivery. Never blocks: a full outbound queue drops the message.
     * @return true if the envelope was queued on a local connection
     */
    public boolean sendToUser(long userId, String event, Map<String, Object> data) {
        Connection connection = registry.get(userId);
        if (connection == null) {
            log.debug("No local connection for user {}, event {}", userId, event);
            return false;
        }
        boolean queued = connection.enqueue(EnvelopeCodec.encode(event, data));
        if (queued) {
            log.debug("Queued {} for user {}", event, userId);
        }
        return queued;
    }

    /**
     * Local delivery plus a relay publish on the user's topic so that other instances
     * holding a connection for the user can deliver too. Relay failures are logged.
     */
    public void deliver(long userId, String event, Map<String, Object> data) {
        sendToUser(userId, event, data);

        Envelope envelope = new Envelope(event, data, instanceIdentity.getInstanceId());
        try {
            presenceStore.publish(PresenceKeys.userTopic(userId), envelope);
        } catch (RuntimeException e) {
            log.error("Failed to relay {} for user {}", event, userId, e);
        }
    }

    /**
     * Announce a presence change to every instance.
     */
    public void publishPresence(long userId, boolean online) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", userId);
        data.put("is_online", online);
        if (!online) {
            data.put("last_seen", Instant.now().toString());
        }
        try {
            presenceStore.publish(PresenceKeys.PRESENCE_TOPIC,
                    new Envelope(Events.USER_ONLINE_STATUS, data, instanceIdentity.getInstanceId()));
        } catch (RuntimeException e) {
            log.error("Failed to publish presence of user {}", userId, e);
        }
    }

    /**
     * Push a presence notification to every local connection except the subject's own.
     */
    public void broadcastPresence(Envelope envelope) {
        Map<String, Object> data = envelope.getData();
        Object subject = data == null ? null : data.get("user_id");
        if (!(subject instanceof Number)) {
            log.warn("Ignoring presence notification without user_id");
            return;
        }
        long subjectId = ((Number) subject).longValue();
        String payload = EnvelopeCodec.encode(envelope.getEvent(), data);
        for (Connection connection : registry.snapshot()) {
            if (connection.getUserId() != subjectId) {
                connection.enqueue(payload);
            }
        }
    }
}
