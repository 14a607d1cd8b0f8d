package com.webchat.server.im.connection;

import com.webchat.server.im.entity.Envelope;
import com.webchat.server.im.entity.EnvelopeCodec;
import com.webchat.server.im.exception.InvalidEnvelopeException;
import com.webchat.server.im.model.UserIdentity;
import com.webchat.server.im.presence.PresenceKeys;
import com.webchat.server.im.presence.PresenceStore;
import com.webchat.server.im.service.MessageRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bridge between one WebSocket and the router.
 * <p>
 * Inbound frames are pushed in by the Netty handler through {@link #onInbound}. Outbound
 * traffic goes through a bounded queue drained by a writer task, which also sends a
 * ping whenever a ping period passes without outbound traffic. A relay
 * subscription on the user's topic feeds the same queue with envelopes published by other
 * instances.
 * <p>
 * Two stop signals exist: {@link #closeOutbound()} ends the writer once the queue is
 * drained, {@link #stopSubscription()} tears down the relay. Both are idempotent.
 */
public class Connection {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    private static final OutboundFrame CLOSE_SIGNAL = new OutboundFrame(null);

    private final UserIdentity identity;
    private final Transport transport;
    private final ConnectionSettings settings;
    private final MessageRouter router;
    private final BlockingQueue<OutboundFrame> outbound;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final AtomicBoolean outboundClosed = new AtomicBoolean();
    private final AtomicBoolean subscriptionStopped = new AtomicBoolean();
    private final AtomicBoolean terminated = new AtomicBoolean();

    private volatile PresenceStore.Subscription subscription;
    private volatile String instanceId;

    public Connection(UserIdentity identity, Transport transport, ConnectionSettings settings, MessageRouter router) {
        this.identity = identity;
        this.transport = transport;
        this.settings = settings;
        this.router = router;
        this.outbound = new LinkedBlockingQueue<>(settings.getSendBufferSize());
    }

    public UserIdentity getIdentity() {
        return identity;
    }

    public long getUserId() {
        return identity.getUserId();
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOutboundClosed() {
        return outboundClosed.get();
    }

    public String getTransportId() {
        return transport.id();
    }

    /**
     * True once teardown has started. A terminated connection is never registered.
     */
    public boolean isTerminated() {
        return terminated.get();
    }

    /**
     * Start the writer task and the relay subscription.
     * @param executor Runs the writer task
     * @param presenceStore Source of relayed envelopes
     * @param instanceId Relays published by this instance are skipped
     */
    public void start(ExecutorService executor, PresenceStore presenceStore, String instanceId) {
        this.instanceId = instanceId;
        try {
            executor.execute(this::writeLoop);
        } catch (RejectedExecutionException e) {
            log.error("Cannot start writer for user {}", identity.getUserId(), e);
            terminate();
            return;
        }
        startSubscription(presenceStore);
    }

    private void startSubscription(PresenceStore presenceStore) {
        if (subscriptionStopped.get()) {
            return;
        }
        String topic = PresenceKeys.userTopic(identity.getUserId());
        try {
            subscription = presenceStore.subscribe(topic, this::onRelay);
            log.info("Started relay subscriber for user {} on {}", identity.getUserId(), topic);
        } catch (RuntimeException e) {
            // Local delivery still works without the relay
            log.error("Failed to subscribe user {} to {}", identity.getUserId(), topic, e);
            return;
        }
        // A stop may have raced with the subscribe call
        if (subscriptionStopped.get()) {
            subscription.stop();
        }
    }

    /**
     * Reader side: decode one inbound frame, stamp it with this connection's identity and
     * hand it to the router. Undecodable frames are logged and skipped.
     */
    public void onInbound(String text) {
        Envelope envelope;
        try {
            envelope = EnvelopeCodec.decode(text);
        } catch (InvalidEnvelopeException e) {
            log.warn("Failed to decode frame from user {}: {}", identity.getUserId(), e.getMessage());
            return;
        }

        Map<String, Object> data = envelope.getData();
        if (data == null) {
            data = new LinkedHashMap<>();
            envelope.setData(data);
        }
        // The sender is whoever owns the socket, whatever the payload claims
        data.put("sender_id", identity.getUserId());
        data.put("sender_username", identity.getUsername());
        envelope.setOrigin(null);

        state.compareAndSet(ConnectionState.REGISTERED, ConnectionState.ACTIVE);
        router.dispatch(envelope, this);
    }

    /**
     * Stop reading frames from the socket while the router catches up.
     */
    public void pauseReads() {
        log.debug("Pausing reads for user {}", identity.getUserId());
        transport.pauseReads();
    }

    public void resumeReads() {
        log.debug("Resuming reads for user {}", identity.getUserId());
        transport.resumeReads();
    }

    /**
     * Queue an encoded envelope without blocking. A full queue drops the message.
     * @return true if queued
     */
    public boolean enqueue(String payload) {
        if (outboundClosed.get()) {
            return false;
        }
        if (!outbound.offer(new OutboundFrame(payload))) {
            log.warn("Outbound queue full for user {}, dropping message", identity.getUserId());
            return false;
        }
        return true;
    }

    private void onRelay(Envelope envelope) {
        if (instanceId != null && instanceId.equals(envelope.getOrigin())) {
            return;
        }
        if (envelope.getEvent() == null || envelope.getEvent().isEmpty()) {
            return;
        }
        String payload = EnvelopeCodec.encode(Envelope.of(envelope.getEvent(), envelope.getData()));
        try {
            if (outboundClosed.get()) {
                return;
            }
            if (!outbound.offer(new OutboundFrame(payload), settings.getRelayOfferTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Outbound queue for user {} stayed full, dropping relayed {}", identity.getUserId(), envelope.getEvent());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void writeLoop() {
        long pingPeriodMs = settings.getPingPeriod().toMillis();
        try {
            while (true) {
                OutboundFrame head = outbound.poll(pingPeriodMs, TimeUnit.MILLISECONDS);
                if (head == null) {
                    if (outboundClosed.get()) {
                        break;
                    }
                    transport.ping(settings.getWriteWait());
                    continue;
                }
                if (head == CLOSE_SIGNAL) {
                    break;
                }

                // Coalesce whatever is already queued into the same frame
                StringBuilder batch = new StringBuilder(head.text);
                List<OutboundFrame> pending = new ArrayList<>();
                outbound.drainTo(pending);
                boolean closing = false;
                for (OutboundFrame next : pending) {
                    if (next == CLOSE_SIGNAL) {
                        closing = true;
                        break;
                    }
                    batch.append('\n').append(next.text);
                }

                transport.write(batch.toString(), settings.getWriteWait());
                if (closing) {
                    break;
                }
            }
        } catch (IOException e) {
            log.warn("Write to user {} failed: {}", identity.getUserId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            terminate();
        }
    }

    /**
     * Signal the writer that no more data follows. Pending messages are still written
     * unless the queue is full, in which case they are discarded to make room.
     */
    public void closeOutbound() {
        if (!outboundClosed.compareAndSet(false, true)) {
            return;
        }
        if (!outbound.offer(CLOSE_SIGNAL)) {
            outbound.clear();
            outbound.offer(CLOSE_SIGNAL);
        }
    }

    public void stopSubscription() {
        if (!subscriptionStopped.compareAndSet(false, true)) {
            return;
        }
        PresenceStore.Subscription current = subscription;
        if (current != null) {
            try {
                current.stop();
            } catch (RuntimeException e) {
                log.warn("Failed to stop relay subscriber for user {}", identity.getUserId(), e);
            }
            log.info("Relay subscriber stopped for user {}", identity.getUserId());
        }
    }

    /**
     * Called by the router once this connection is in the registry.
     */
    public void markRegistered() {
        state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.REGISTERED);
    }

    /**
     * Called by the router when a newer connection for the same user replaced this one.
     */
    public void evict() {
        moveToUnregistering();
        closeOutbound();
        stopSubscription();
    }

    /**
     * Teardown after a socket error, a keepalive timeout or a writer failure: leave the
     * registry, close the socket, stop the relay. Runs once.
     */
    public void terminate() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        moveToUnregistering();
        router.unregister(this);
        closeOutbound();
        transport.close();
        stopSubscription();
        state.set(ConnectionState.CLOSED);
    }

    private void moveToUnregistering() {
        state.getAndUpdate(current -> current == ConnectionState.CLOSED ? current : ConnectionState.UNREGISTERING);
    }

    @Override
    public String toString() {
        return "Connection{user=" + identity.getUserId() + ", transport=" + transport.id() + ", state=" + state.get() + "}";
    }

    // Queue item; CLOSE_SIGNAL is the only instance without text
    private static final class OutboundFrame {
        private final String text;

        private OutboundFrame(String text) {
            this.text = text;
        }
    }
}
