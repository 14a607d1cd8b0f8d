package com.webchat.server.im.connection;

public enum ConnectionState {
    CONNECTING,
    REGISTERED,
    ACTIVE,
    UNREGISTERING,
    CLOSED
}
