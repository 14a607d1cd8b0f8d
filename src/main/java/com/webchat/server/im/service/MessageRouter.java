package com.webchat.server.im.service;

import com.webchat.server.im.connection.Connection;
import com.webchat.server.im.entity.Envelope;
import com.webchat.server.im.exception.InvalidEnvelopeException;
import com.webchat.server.im.handler.EventHandler;
import com.webchat.server.im.model.UserIdentity;
import com.webchat.server.im.presence.PresenceKeys;
import com.webchat.server.im.presence.PresenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * The hub of an instance: owns the connection registry and processes registrations,
 * unregistrations and inbound events strictly one at a time, in arrival order, on a
 * single router thread.
 * <p>
 * Handlers run on that thread too, so a slow persistence call throttles everything behind
 * it. A failing task is logged and the loop moves on to the next one.
 * <p>
 * Callers are Netty event loops, so queueing never blocks and never drops a valid event.
 * Once the backlog reaches the inbound capacity, the connection that queued the event stops
 * reading from its socket; paused connections resume when the backlog falls to half that.
 */
@Service
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final Map<String, EventHandler<?>> handlers = new HashMap<>();
    private final ConnectionRegistry registry;
    private final MessageSender messageSender;
    private final PresenceStore presenceStore;
    private final BlockingQueue<RouterTask> inbound = new LinkedBlockingQueue<>();
    private final int highWatermark;
    private final int lowWatermark;
    private final Set<Connection> paused = ConcurrentHashMap.newKeySet();

    private final ExecutorService routerExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "message-router");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean accepting;
    private volatile boolean running;
    private volatile PresenceStore.Subscription presenceSubscription;

    @Autowired
    public MessageRouter(List<EventHandler<?>> eventHandlers,
                         ConnectionRegistry registry,
                         MessageSender messageSender,
                         PresenceStore presenceStore,
                         @Value("${chat.router.inbound-capacity:256}") int inboundCapacity) {
        if (inboundCapacity < 1) {
            throw new IllegalArgumentException("chat.router.inbound-capacity must be positive");
        }
        for (EventHandler<?> handler : eventHandlers) {
            EventHandler<?> previous = handlers.put(handler.getEvent(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for event " + handler.getEvent());
            }
        }
        this.registry = registry;
        this.messageSender = messageSender;
        this.presenceStore = presenceStore;
        this.highWatermark = inboundCapacity;
        this.lowWatermark = inboundCapacity / 2;
    }

    @PostConstruct
    public void start() {
        running = true;
        accepting = true;
        routerExecutor.submit(this::runLoop);
        try {
            presenceSubscription = presenceStore.subscribe(PresenceKeys.PRESENCE_TOPIC, messageSender::broadcastPresence);
        } catch (RuntimeException e) {
            log.error("Failed to subscribe to presence notifications", e);
        }
        log.info("Message router started with handlers {}", handlers.keySet());
    }

    /**
     * Stop accepting work, let already queued tasks finish, then stop the loop.
     */
    @PreDestroy
    public void stop() {
        if (!accepting) {
            return;
        }
        accepting = false;
        if (presenceSubscription != null) {
            presenceSubscription.stop();
        }
        inbound.offer(new RouterTask("stop", () -> running = false));
        try {
            routerExecutor.shutdown();
            if (!routerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Router did not drain in time, {} tasks left", inbound.size());
                routerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            routerExecutor.shutdownNow();
        }
        resumePaused();
        log.info("Message router stopped");
    }

    private void runLoop() {
        while (running) {
            RouterTask task;
            try {
                task = inbound.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                task.action.run();
                task.done.complete(null);
            } catch (Exception e) {
                log.error("Router task {} failed", task.name, e);
                task.done.completeExceptionally(e);
            }
            if (!paused.isEmpty() && inbound.size() <= lowWatermark) {
                resumePaused();
            }
        }
    }

    /**
     * Queue a registration. A connection already torn down by then is skipped.
     */
    public CompletableFuture<Void> register(Connection connection) {
        return enqueueControl(new RouterTask("register", () -> registerConnection(connection)));
    }

    /**
     * Queue an unregistration. Removing a connection that is no longer the registered one
     * for its user has no presence side effects.
     */
    public CompletableFuture<Void> unregister(Connection connection) {
        return enqueueControl(new RouterTask("unregister", () -> unregisterConnection(connection)));
    }

    /**
     * Queue an inbound event read from the given connection. Never blocks; a full backlog
     * pauses reads on that connection instead.
     */
    public CompletableFuture<Void> dispatch(Envelope envelope, Connection source) {
        UserIdentity sender = source.getIdentity();
        RouterTask task = new RouterTask("dispatch", () -> handleInbound(envelope, sender));
        if (!accepting) {
            log.warn("Router stopped, dropping {} from user {}", envelope.getEvent(), sender.getUserId());
            task.done.complete(null);
            return task.done;
        }
        inbound.offer(task);
        if (inbound.size() >= highWatermark) {
            // Pause before publishing to the set so a concurrent resume cannot be undone
            source.pauseReads();
            paused.add(source);
            log.warn("Router backlog at {}, pausing reads for user {}", inbound.size(), sender.getUserId());
            if (inbound.size() <= lowWatermark) {
                resumePaused();
            }
        }
        return task.done;
    }

    /**
     * Best-effort delivery to a local connection of the user.
     * @return true if queued
     */
    public boolean sendToUser(long userId, String event, Map<String, Object> data) {
        return messageSender.sendToUser(userId, event, data);
    }

    private CompletableFuture<Void> enqueueControl(RouterTask task) {
        if (!accepting) {
            task.done.complete(null);
            return task.done;
        }
        inbound.offer(task);
        return task.done;
    }

    private void resumePaused() {
        for (Connection connection : paused) {
            if (paused.remove(connection)) {
                connection.resumeReads();
            }
        }
    }

    private void registerConnection(Connection connection) {
        long userId = connection.getUserId();
        if (connection.isTerminated()) {
            log.info("Connection {} closed before registration, skipping", connection);
            return;
        }
        Connection previous = registry.put(connection);
        if (previous != null && previous != connection) {
            log.info("User {} connected again, evicting {}", userId, previous);
            previous.evict();
        }
        connection.markRegistered();

        try {
            presenceStore.setPresent(userId);
        } catch (RuntimeException e) {
            log.error("Failed to set user {} online", userId, e);
        }

        log.info("User {} ({}) connected. Total clients: {}", userId, connection.getIdentity().getUsername(), registry.size());
        messageSender.publishPresence(userId, true);
    }

    private void unregisterConnection(Connection connection) {
        long userId = connection.getUserId();
        if (paused.remove(connection)) {
            connection.resumeReads();
        }
        boolean removed = registry.removeIfSame(connection);
        connection.closeOutbound();
        connection.stopSubscription();
        if (!removed) {
            log.debug("Connection {} already unregistered", connection);
            return;
        }

        try {
            presenceStore.clearPresent(userId);
        } catch (RuntimeException e) {
            log.error("Failed to set user {} offline", userId, e);
        }

        log.info("User {} ({}) disconnected. Total clients: {}", userId, connection.getIdentity().getUsername(), registry.size());
        messageSender.publishPresence(userId, false);
    }

    private void handleInbound(Envelope envelope, UserIdentity sender) {
        String event = envelope.getEvent();
        if (event == null || event.isEmpty()) {
            log.warn("Invalid message from user {}: event cannot be empty", sender.getUserId());
            return;
        }
        if (envelope.getData() == null) {
            log.warn("Invalid message from user {}: data cannot be null", sender.getUserId());
            return;
        }

        EventHandler<?> handler = handlers.get(event);
        if (handler == null) {
            log.warn("Unknown event {} from user {}", event, sender.getUserId());
            return;
        }
        invoke(handler, envelope.getData(), sender);
    }

    private <T> void invoke(EventHandler<T> handler, Map<String, Object> data, UserIdentity sender) {
        T payload;
        try {
            payload = handler.parse(data);
        } catch (InvalidEnvelopeException e) {
            log.warn("Invalid {} from user {}: {}", handler.getEvent(), sender.getUserId(), e.getMessage());
            return;
        }

        try {
            handler.handle(sender, payload);
        } catch (RuntimeException e) {
            log.error("Error handling event {} from user {}", handler.getEvent(), sender.getUserId(), e);
        }
    }

    public List<Long> getOnlineUsers() {
        return registry.userIds();
    }

    public Map<String, Object> getConnectionStats() {
        List<Map<String, Object>> clients = new ArrayList<>();
        for (Connection connection : registry.snapshot()) {
            Map<String, Object> client = new LinkedHashMap<>();
            client.put("user_id", connection.getUserId());
            client.put("username", connection.getIdentity().getUsername());
            client.put("state", connection.getState().name());
            clients.add(client);
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_connections", clients.size());
        stats.put("pending_events", inbound.size());
        stats.put("clients", clients);
        return stats;
    }

    @Scheduled(fixedRateString = "${chat.router.stats-interval-ms:60000}")
    public void logStats() {
        log.info("Router stats: {} connections, {} pending events", registry.size(), inbound.size());
    }

    private static final class RouterTask {
        private final String name;
        private final Runnable action;
        private final CompletableFuture<Void> done = new CompletableFuture<>();

        private RouterTask(String name, Runnable action) {
            this.name = name;
            this.action = action;
        }
    }
}
