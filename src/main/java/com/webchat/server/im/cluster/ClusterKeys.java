package com.webchat.server.im.cluster;

public final class ClusterKeys {

    // Key prefix for instance heartbeat: server_heartbeat:{instanceId}
    public static final String HEARTBEAT_PREFIX = "server_heartbeat:";
    // Key prefix for instance sessions (reverse index): instance_sessions:{instanceId} -> Set<userId>
    public static final String INSTANCE_SESSIONS_PREFIX = "instance_sessions:";

    private ClusterKeys() {
    }

    public static String heartbeat(String instanceId) {
        return HEARTBEAT_PREFIX + instanceId;
    }

    public static String instanceSessions(String instanceId) {
        return INSTANCE_SESSIONS_PREFIX + instanceId;
    }
}
