package com.webchat.server.im.service;

import com.webchat.server.im.connection.Connection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Live connections of this instance, at most one per user.
 * <p>
 * Mutated only from the router thread; read from any thread that sends.
 */
@Component
public class ConnectionRegistry {

    // UserId -> Connection
    private final Map<Long, Connection> connections = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Bind the connection to its user, replacing any previous entry
     * @return The replaced connection, or null
     */
    public Connection put(Connection connection) {
        lock.writeLock().lock();
        try {
            return connections.put(connection.getUserId(), connection);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove the entry only if it is this exact connection (handling reconnections)
     * @return true if removed
     */
    public boolean removeIfSame(Connection connection) {
        lock.writeLock().lock();
        try {
            return connections.remove(connection.getUserId(), connection);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Connection get(long userId) {
        lock.readLock().lock();
        try {
            return connections.get(userId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Connection> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Long> userIds() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
